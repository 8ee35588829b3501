package org.textcurator.model;

import lombok.Builder;
import lombok.Value;
import org.textcurator.service.chunking.ChunkingConfigurationException;

/**
 * Immutable chunking configuration. Sizes are estimated token counts.
 *
 * <p>Use {@link #toBuilder()} to derive variants from a preset.</p>
 */
@Value
@Builder(toBuilder = true)
public class ChunkOptions {

    @Builder.Default
    StrategyType strategy = StrategyType.AUTO;

    @Builder.Default
    int targetChunkSize = 512;

    @Builder.Default
    int minChunkSize = 100;

    @Builder.Default
    int maxChunkSize = 1024;

    /** Tokens of the previous chunk repeated at the start of the next one. */
    @Builder.Default
    int overlapSize = 50;

    /** ISO 639-1 code; {@code null} enables detection from the text. */
    String languageCode;

    @Builder.Default
    boolean preserveSentences = true;

    @Builder.Default
    boolean preserveParagraphs = true;

    @Builder.Default
    double semanticSimilarityThreshold = 0.5;

    @Builder.Default
    boolean enableChunkBalancing = true;

    /** Collapses whitespace runs inside each chunk's content. */
    @Builder.Default
    boolean normalizeWhitespace = false;

    public static ChunkOptions defaults() {
        return ChunkOptions.builder().build();
    }

    /**
     * Sentence-based chunks sized for typical embedding models.
     */
    public static ChunkOptions forRag() {
        return ChunkOptions.builder()
                .strategy(StrategyType.SENTENCE)
                .targetChunkSize(512)
                .minChunkSize(100)
                .maxChunkSize(1024)
                .overlapSize(50)
                .build();
    }

    public static ChunkOptions forKorean() {
        return forRag().toBuilder()
                .languageCode("ko")
                .build();
    }

    public static ChunkOptions forLargeDocument() {
        return ChunkOptions.builder()
                .strategy(StrategyType.PARAGRAPH)
                .targetChunkSize(1024)
                .minChunkSize(256)
                .maxChunkSize(2048)
                .overlapSize(100)
                .build();
    }

    /**
     * Fixed-size token windows that ignore sentence boundaries.
     *
     * @param tokenSize target tokens per chunk
     * @param overlap   tokens repeated between consecutive chunks
     */
    public static ChunkOptions fixedSize(int tokenSize, int overlap) {
        return ChunkOptions.builder()
                .strategy(StrategyType.TOKEN)
                .targetChunkSize(tokenSize)
                .minChunkSize(Math.max(1, tokenSize / 4))
                .maxChunkSize(tokenSize * 2)
                .overlapSize(overlap)
                .preserveSentences(false)
                .build();
    }

    /**
     * Rejects contradictory size settings.
     *
     * @throws ChunkingConfigurationException if the options cannot be honoured
     */
    public void validate() {
        if (strategy == null) {
            throw new ChunkingConfigurationException("strategy must not be null");
        }
        if (minChunkSize <= 0 || targetChunkSize <= 0 || maxChunkSize <= 0) {
            throw new ChunkingConfigurationException(String.format(
                    "chunk sizes must be positive (min=%d, target=%d, max=%d)",
                    minChunkSize, targetChunkSize, maxChunkSize));
        }
        if (minChunkSize > targetChunkSize) {
            throw new ChunkingConfigurationException(String.format(
                    "minChunkSize (%d) must not exceed targetChunkSize (%d)", minChunkSize, targetChunkSize));
        }
        if (targetChunkSize > maxChunkSize) {
            throw new ChunkingConfigurationException(String.format(
                    "targetChunkSize (%d) must not exceed maxChunkSize (%d)", targetChunkSize, maxChunkSize));
        }
        if (overlapSize < 0 || overlapSize >= maxChunkSize) {
            throw new ChunkingConfigurationException(String.format(
                    "overlapSize (%d) must be between 0 and maxChunkSize (%d) exclusive", overlapSize, maxChunkSize));
        }
        if (Double.isNaN(semanticSimilarityThreshold)
                || semanticSimilarityThreshold < -1.0 || semanticSimilarityThreshold > 1.0) {
            throw new ChunkingConfigurationException(
                    "semanticSimilarityThreshold must be within [-1, 1] but was " + semanticSimilarityThreshold);
        }
    }
}
