package org.textcurator.service.chunking.strategy;

import org.textcurator.model.Chunk;
import org.textcurator.model.ChunkOptions;
import org.textcurator.model.StrategyType;
import org.textcurator.service.chunking.CancellationToken;
import org.textcurator.service.language.LanguageProfile;

import java.util.Iterator;
import java.util.List;

/**
 * Strategy for chunking document text.
 *
 * <p>Implementations are stateless and may be shared between threads. Blank
 * text yields no chunks.</p>
 */
public interface ChunkingStrategy {

    /**
     * The strategy recorded in chunk metadata.
     */
    StrategyType type();

    /**
     * Whether the strategy needs a similarity oracle to run.
     */
    default boolean requiresSimilarityOracle() {
        return false;
    }

    /**
     * Splits text into chunks.
     *
     * @param text    text to chunk
     * @param profile language rules for boundaries and token estimates
     * @param options size limits and flags; assumed valid
     * @param token   checked between chunks
     * @return ordered chunks with contiguous indices
     * @throws java.util.concurrent.CancellationException if {@code token} is cancelled
     */
    List<Chunk> chunk(String text, LanguageProfile profile, ChunkOptions options, CancellationToken token);

    /**
     * Lazily produces the same chunks as {@link #chunk}, computing one per pull.
     *
     * <p>{@code totalChunks} of each chunk is the number produced so far.</p>
     */
    Iterator<Chunk> chunkIterator(String text, LanguageProfile profile, ChunkOptions options, CancellationToken token);

    /**
     * Estimates the number of chunks without producing them.
     */
    int estimateChunkCount(String text, LanguageProfile profile, ChunkOptions options);
}
