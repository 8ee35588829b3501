package org.textcurator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.Value;

import java.util.Optional;

/**
 * Descriptive data attached to every chunk.
 *
 * <p>The hierarchy fields are only populated by the hierarchical strategy.</p>
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_ABSENT)
public class ChunkMetadata {

    int estimatedTokenCount;
    StrategyType strategy;
    String languageCode;

    @Getter(AccessLevel.NONE)
    Integer hierarchyLevel;

    @Getter(AccessLevel.NONE)
    String parentId;

    @Getter(AccessLevel.NONE)
    String sectionTitle;

    /**
     * Heading depth, 1-based, or 0 for content preceding the first heading.
     */
    public Optional<Integer> getHierarchyLevel() {
        return Optional.ofNullable(hierarchyLevel);
    }

    /**
     * Id of the first chunk of the enclosing section.
     */
    public Optional<String> getParentId() {
        return Optional.ofNullable(parentId);
    }

    public Optional<String> getSectionTitle() {
        return Optional.ofNullable(sectionTitle);
    }
}
