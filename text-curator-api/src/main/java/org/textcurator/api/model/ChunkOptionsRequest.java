package org.textcurator.api.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.textcurator.model.ChunkOptions;
import org.textcurator.model.StrategyType;

/**
 * Partial chunk options sent by clients. Fields left out keep the configured default.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChunkOptionsRequest {

    private StrategyType strategy;
    private Integer targetChunkSize;
    private Integer minChunkSize;
    private Integer maxChunkSize;
    private Integer overlapSize;

    /** ISO 639-1 code; detected from the text when absent. */
    private String languageCode;

    private Boolean preserveSentences;
    private Boolean preserveParagraphs;
    private Double semanticSimilarityThreshold;
    private Boolean enableChunkBalancing;
    private Boolean normalizeWhitespace;

    /**
     * Overlays the fields present in {@code request} on {@code defaults}.
     */
    public static ChunkOptions resolve(ChunkOptionsRequest request, ChunkOptions defaults) {
        if (request == null) {
            return defaults;
        }
        ChunkOptions.ChunkOptionsBuilder builder = defaults.toBuilder();
        if (request.strategy != null) builder.strategy(request.strategy);
        if (request.targetChunkSize != null) builder.targetChunkSize(request.targetChunkSize);
        if (request.minChunkSize != null) builder.minChunkSize(request.minChunkSize);
        if (request.maxChunkSize != null) builder.maxChunkSize(request.maxChunkSize);
        if (request.overlapSize != null) builder.overlapSize(request.overlapSize);
        if (request.languageCode != null) builder.languageCode(request.languageCode);
        if (request.preserveSentences != null) builder.preserveSentences(request.preserveSentences);
        if (request.preserveParagraphs != null) builder.preserveParagraphs(request.preserveParagraphs);
        if (request.semanticSimilarityThreshold != null) {
            builder.semanticSimilarityThreshold(request.semanticSimilarityThreshold);
        }
        if (request.enableChunkBalancing != null) builder.enableChunkBalancing(request.enableChunkBalancing);
        if (request.normalizeWhitespace != null) builder.normalizeWhitespace(request.normalizeWhitespace);
        return builder.build();
    }
}
