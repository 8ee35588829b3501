package org.textcurator.model;

/**
 * Size distribution summary over a chunk sequence.
 *
 * @param chunkCount           number of chunks
 * @param minTokenCount        smallest token estimate
 * @param maxTokenCount        largest token estimate
 * @param averageTokenCount    mean token estimate
 * @param standardDeviation    population standard deviation of the token estimates
 * @param varianceRatio        {@code max / min}, or 0 when the smallest chunk is empty
 * @param undersizedChunkCount chunks below the configured minimum
 * @param oversizedChunkCount  chunks above the configured maximum
 */
public record ChunkBalanceStats(
        int chunkCount,
        int minTokenCount,
        int maxTokenCount,
        double averageTokenCount,
        double standardDeviation,
        double varianceRatio,
        int undersizedChunkCount,
        int oversizedChunkCount
) {

    /** Largest tolerated {@code max / min} ratio for a balanced sequence. */
    public static final double MAX_BALANCED_VARIANCE_RATIO = 5.0;

    public static ChunkBalanceStats empty() {
        return new ChunkBalanceStats(0, 0, 0, 0, 0, 0, 0, 0);
    }

    public boolean isBalanced() {
        return varianceRatio <= MAX_BALANCED_VARIANCE_RATIO
                && undersizedChunkCount == 0
                && oversizedChunkCount == 0;
    }
}
