package org.textcurator.service.chunking;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.textcurator.model.Chunk;
import org.textcurator.model.ChunkOptions;
import org.textcurator.service.language.LanguageProfileRegistry;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class BatchChunkProcessorTest {

    private ExecutorService executor;
    private ChunkingService chunkingService;
    private BatchChunkProcessor processor;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        LanguageProfileRegistry registry = new LanguageProfileRegistry();
        chunkingService = new ChunkingService(registry, new ChunkBalancer(registry));
        processor = new BatchChunkProcessor(chunkingService, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("Results follow input order and blank texts give empty lists")
    void orderedResults() throws Exception {
        List<String> texts = Arrays.asList(
                "First text here.",
                "",
                "Second text. It has two sentences.",
                null,
                "안녕하세요. 반갑습니다.");

        List<List<Chunk>> results = processor.process(texts, ChunkOptions.defaults(), 2)
                .get(5, TimeUnit.SECONDS);

        assertThat(results).hasSize(5);
        assertThat(results.get(0)).extracting(Chunk::getContent).containsExactly("First text here.");
        assertThat(results.get(1)).isEmpty();
        assertThat(results.get(2)).extracting(Chunk::getContent)
                .containsExactly("Second text. It has two sentences.");
        assertThat(results.get(3)).isEmpty();
        assertThat(results.get(4).get(0).getMetadata().getLanguageCode()).isEqualTo("ko");
    }

    @Test
    @DisplayName("An empty batch completes immediately")
    void emptyBatch() {
        assertThat(processor.process(List.of(), ChunkOptions.defaults(), 4)).isCompletedWithValue(List.of());
    }

    @Test
    @DisplayName("Invalid options fail before any task is submitted")
    void invalidOptions() {
        ChunkOptions options = ChunkOptions.builder().minChunkSize(600).build();

        assertThatThrownBy(() -> processor.process(List.of("Text."), options, 4))
                .isInstanceOf(ChunkingConfigurationException.class);
    }

    @Test
    @DisplayName("The first failing text fails the whole batch")
    void failurePropagates() {
        ChunkingService failing = mock(ChunkingService.class);
        when(failing.chunk(eq("bad"), any(), any())).thenThrow(new IllegalStateException("boom"));
        when(failing.chunk(eq("good"), any(), any())).thenReturn(List.of());
        BatchChunkProcessor batch = new BatchChunkProcessor(failing, executor);

        CompletableFuture<List<List<Chunk>>> future =
                batch.process(List.of("good", "bad", "good"), ChunkOptions.defaults(), 2);

        assertThatThrownBy(() -> future.get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(IllegalStateException.class)
                .hasRootCauseMessage("boom");
    }

    @Test
    @DisplayName("A cancelled token cancels the batch")
    void cancelled() {
        CancellationToken token = CancellationToken.create();
        token.cancel();

        CompletableFuture<List<List<Chunk>>> future =
                processor.process(List.of("One text.", "Another text."), ChunkOptions.defaults(), 2, token);

        assertThatThrownBy(() -> future.get(5, TimeUnit.SECONDS)).isInstanceOf(CancellationException.class);
    }

    @Test
    @DisplayName("Concurrency is clamped to 1..32")
    void clamp() {
        assertThat(BatchChunkProcessor.clampConcurrency(0)).isEqualTo(1);
        assertThat(BatchChunkProcessor.clampConcurrency(8)).isEqualTo(8);
        assertThat(BatchChunkProcessor.clampConcurrency(100)).isEqualTo(BatchChunkProcessor.MAX_CONCURRENCY);
    }

    @Test
    @DisplayName("Total estimate sums per-text estimates")
    void totalEstimate() {
        assertThat(processor.totalEstimatedChunks(List.of("One.", "Two.", ""), ChunkOptions.defaults()))
                .isEqualTo(2);
    }
}
