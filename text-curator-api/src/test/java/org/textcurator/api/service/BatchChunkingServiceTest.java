package org.textcurator.api.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.textcurator.api.config.CuratorProperties;
import org.textcurator.api.model.BatchChunkRequest;
import org.textcurator.api.model.ChunkOptionsRequest;
import org.textcurator.api.model.ChunkingJob;
import org.textcurator.api.model.ChunkingJob.JobStatus;
import org.textcurator.model.Chunk;
import org.textcurator.service.chunking.BatchChunkProcessor;
import org.textcurator.service.chunking.CancellationToken;
import org.textcurator.service.chunking.ChunkBalancer;
import org.textcurator.service.chunking.ChunkingConfigurationException;
import org.textcurator.service.chunking.ChunkingService;
import org.textcurator.service.language.LanguageProfileRegistry;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("BatchChunkingService Tests")
class BatchChunkingServiceTest {

    private BatchChunkingService service;

    @BeforeEach
    void setUp() {
        LanguageProfileRegistry registry = new LanguageProfileRegistry();
        ChunkingService chunkingService = new ChunkingService(registry, new ChunkBalancer(registry));
        // tasks run on the calling thread
        BatchChunkProcessor processor = new BatchChunkProcessor(chunkingService, Runnable::run);
        service = new BatchChunkingService(processor, new CuratorProperties());
    }

    private static BatchChunkRequest request(List<String> texts, ChunkOptionsRequest options) {
        return BatchChunkRequest.builder().texts(texts).options(options).build();
    }

    @Test
    @DisplayName("Should complete a job and count its chunks")
    void shouldCompleteJob() {
        ChunkingJob job = service.startBatch(request(List.of("First text here.", "Second text here.", " "), null));

        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.getTextCount()).isEqualTo(3);
        assertThat(job.getChunkCountValue()).isEqualTo(2);
        assertThat(job.getResults()).hasSize(3);
        assertThat(job.getResults().get(2)).isEmpty();
        assertThat(job.getCompletedAt()).isNotNull();
        assertThat(service.getJob(job.getJobId())).isSameAs(job);
    }

    @Test
    @DisplayName("Should not register a job when the options are invalid")
    void shouldRejectInvalidOptions() {
        ChunkOptionsRequest invalid = ChunkOptionsRequest.builder().minChunkSize(50).targetChunkSize(10).build();

        assertThatThrownBy(() -> service.startBatch(request(List.of("Text."), invalid)))
                .isInstanceOf(ChunkingConfigurationException.class);
        assertThat(service.getAllJobs()).isEmpty();
    }

    @Test
    @DisplayName("Should throw for an unknown job")
    void shouldThrowForUnknownJob() {
        assertThatThrownBy(() -> service.getJob("nope")).isInstanceOf(JobNotFoundException.class);
        assertThatThrownBy(() -> service.cancelJob("nope")).isInstanceOf(JobNotFoundException.class);
    }

    @Test
    @DisplayName("Should cancel a running job")
    void shouldCancelRunningJob() {
        BatchChunkProcessor processor = mock(BatchChunkProcessor.class);
        CompletableFuture<List<List<Chunk>>> pending = new CompletableFuture<>();
        when(processor.process(anyList(), any(), anyInt(), any(CancellationToken.class))).thenReturn(pending);
        BatchChunkingService pendingService = new BatchChunkingService(processor, new CuratorProperties());

        ChunkingJob job = pendingService.startBatch(request(List.of("Text."), null));
        assertThat(job.isRunning()).isTrue();

        pendingService.cancelJob(job.getJobId());
        assertThat(job.getCancellationToken().isCancelled()).isTrue();

        pending.completeExceptionally(new CancellationException("Chunking was cancelled"));
        assertThat(job.getStatus()).isEqualTo(JobStatus.CANCELLED);
    }

    @Test
    @DisplayName("Should mark a job failed with the error message")
    void shouldFailJob() {
        BatchChunkProcessor processor = mock(BatchChunkProcessor.class);
        CompletableFuture<List<List<Chunk>>> pending = new CompletableFuture<>();
        when(processor.process(anyList(), any(), anyInt(), any(CancellationToken.class))).thenReturn(pending);
        BatchChunkingService pendingService = new BatchChunkingService(processor, new CuratorProperties());

        ChunkingJob job = pendingService.startBatch(request(List.of("Text."), null));
        pending.completeExceptionally(new IllegalStateException("boom"));

        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getError()).isEqualTo("boom");
    }

    @Test
    @DisplayName("Should estimate with the configured defaults")
    void shouldEstimate() {
        assertThat(service.estimate(request(List.of("One.", "Two."), null))).isEqualTo(2);
        assertThat(service.estimate(request(null, null))).isZero();
    }
}
