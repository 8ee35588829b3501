package org.textcurator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

/**
 * A contiguous segment of source text produced by a chunking strategy.
 *
 * <p>Instances are immutable; re-indexing and balancing produce copies
 * through {@link #toBuilder()}.</p>
 */
@Value
@Builder(toBuilder = true)
public class Chunk {

    String id;
    int index;
    int totalChunks;
    String content;
    ChunkMetadata metadata;
    ChunkLocation location;

    @JsonIgnore
    public int getEstimatedTokenCount() {
        return metadata.getEstimatedTokenCount();
    }

    /**
     * Returns a copy positioned at {@code index} within a sequence of {@code totalChunks}.
     */
    public Chunk withPosition(int index, int totalChunks) {
        if (this.index == index && this.totalChunks == totalChunks) {
            return this;
        }
        return toBuilder().index(index).totalChunks(totalChunks).build();
    }
}
