package org.textcurator.service.chunking;

import lombok.extern.slf4j.Slf4j;
import org.textcurator.model.Chunk;
import org.textcurator.model.ChunkOptions;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Semaphore;

/**
 * Chunks many texts concurrently.
 *
 * <p>Every text is an independent task on the supplied executor; a semaphore caps
 * how many run at once. Results are returned in input order.</p>
 */
@Slf4j
public class BatchChunkProcessor {

    public static final int MAX_CONCURRENCY = 32;

    private final ChunkingService chunkingService;
    private final Executor executor;

    public BatchChunkProcessor(ChunkingService chunkingService, Executor executor) {
        this.chunkingService = chunkingService;
        this.executor = executor;
    }

    /**
     * Chunks {@code texts} with at most {@code maxConcurrency} (clamped to 1..32) texts in flight.
     *
     * <p>Options are validated up front. The returned future completes exceptionally with the
     * first failure; {@code null} or blank texts yield empty lists.</p>
     *
     * @throws ChunkingConfigurationException if the options are invalid
     */
    public CompletableFuture<List<List<Chunk>>> process(List<String> texts, ChunkOptions options,
                                                        int maxConcurrency, CancellationToken token) {
        chunkingService.validate(options);
        if (texts.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }

        int permits = clampConcurrency(maxConcurrency);
        Semaphore slots = new Semaphore(permits);
        log.debug("Chunking batch of {} texts with concurrency {}", texts.size(), permits);

        List<CompletableFuture<List<Chunk>>> tasks = new ArrayList<>(texts.size());
        CompletableFuture<List<List<Chunk>>> result = new CompletableFuture<>();
        for (String text : texts) {
            CompletableFuture<List<Chunk>> task = CompletableFuture.supplyAsync(
                    () -> chunkWithinSlot(text, options, token, slots), executor);
            task.whenComplete((chunks, ex) -> {
                if (ex != null) {
                    result.completeExceptionally(unwrap(ex));
                }
            });
            tasks.add(task);
        }

        CompletableFuture.allOf(tasks.toArray(new CompletableFuture<?>[0])).thenRun(() -> {
            List<List<Chunk>> ordered = new ArrayList<>(tasks.size());
            for (CompletableFuture<List<Chunk>> task : tasks) {
                ordered.add(task.join());
            }
            result.complete(ordered);
        });
        return result;
    }

    public CompletableFuture<List<List<Chunk>>> process(List<String> texts, ChunkOptions options,
                                                        int maxConcurrency) {
        return process(texts, options, maxConcurrency, CancellationToken.none());
    }

    /**
     * Sum of the per-text chunk estimates.
     */
    public int totalEstimatedChunks(List<String> texts, ChunkOptions options) {
        int total = 0;
        for (String text : texts) {
            total += chunkingService.estimateChunkCount(text, options);
        }
        return total;
    }

    static int clampConcurrency(int maxConcurrency) {
        return Math.max(1, Math.min(MAX_CONCURRENCY, maxConcurrency));
    }

    private List<Chunk> chunkWithinSlot(String text, ChunkOptions options, CancellationToken token,
                                        Semaphore slots) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        try {
            slots.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for a batch slot");
        }
        try {
            token.throwIfCancelled();
            return chunkingService.chunk(text, options, token);
        } finally {
            slots.release();
        }
    }

    private static Throwable unwrap(Throwable ex) {
        return ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
    }
}
