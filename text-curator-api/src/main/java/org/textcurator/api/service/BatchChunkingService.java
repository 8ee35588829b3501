package org.textcurator.api.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.textcurator.api.config.CuratorProperties;
import org.textcurator.api.model.BatchChunkRequest;
import org.textcurator.api.model.ChunkOptionsRequest;
import org.textcurator.api.model.ChunkingJob;
import org.textcurator.model.Chunk;
import org.textcurator.model.ChunkOptions;
import org.textcurator.service.chunking.BatchChunkProcessor;
import org.textcurator.service.chunking.CancellationToken;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs asynchronous batch chunking jobs and tracks their state.
 */
@Slf4j
@Service
public class BatchChunkingService {

    private final BatchChunkProcessor batchChunkProcessor;
    private final CuratorProperties properties;

    private final Map<String, ChunkingJob> jobsById = new ConcurrentHashMap<>();

    public BatchChunkingService(BatchChunkProcessor batchChunkProcessor, CuratorProperties properties) {
        this.batchChunkProcessor = batchChunkProcessor;
        this.properties = properties;
    }

    /**
     * Starts chunking the request's texts in the background.
     *
     * @return the created job, already registered
     * @throws org.textcurator.service.chunking.ChunkingConfigurationException if the options are invalid
     */
    public ChunkingJob startBatch(BatchChunkRequest request) {
        List<String> texts = request.getTexts() == null ? List.of() : request.getTexts();
        ChunkOptions options = resolveOptions(request.getOptions());
        int concurrency = request.getMaxConcurrency() != null
                ? request.getMaxConcurrency()
                : properties.getBatch().getMaxConcurrency();

        CancellationToken token = CancellationToken.create();
        ChunkingJob job = new ChunkingJob(UUID.randomUUID().toString(), texts.size(), token);

        // invalid options fail here, before the job is registered
        var future = batchChunkProcessor.process(texts, options, concurrency, token);
        jobsById.put(job.getJobId(), job);
        log.info("Starting batch chunking job {} with {} texts (concurrency {})",
                job.getJobId(), texts.size(), concurrency);

        future.whenComplete((results, ex) -> finish(job, results, ex));
        return job;
    }

    public int estimate(BatchChunkRequest request) {
        List<String> texts = request.getTexts() == null ? List.of() : request.getTexts();
        return batchChunkProcessor.totalEstimatedChunks(texts, resolveOptions(request.getOptions()));
    }

    /**
     * @throws JobNotFoundException if no job has this id
     */
    public ChunkingJob getJob(String jobId) {
        ChunkingJob job = jobsById.get(jobId);
        if (job == null) {
            throw new JobNotFoundException(jobId);
        }
        return job;
    }

    public Map<String, ChunkingJob> getAllJobs() {
        return jobsById;
    }

    /**
     * Requests cancellation; the job turns CANCELLED once its running texts stop.
     */
    public ChunkingJob cancelJob(String jobId) {
        ChunkingJob job = getJob(jobId);
        if (job.isRunning()) {
            job.getCancellationToken().cancel();
            log.info("Cancellation requested for batch chunking job {}", jobId);
        }
        return job;
    }

    private ChunkOptions resolveOptions(ChunkOptionsRequest request) {
        return ChunkOptionsRequest.resolve(request, properties.getChunking().toOptions());
    }

    private void finish(ChunkingJob job, List<List<Chunk>> results, Throwable ex) {
        String jobId = job.getJobId();
        if (ex == null) {
            job.complete(results);
            log.info("Batch chunking job {} completed. Texts: {}, Chunks: {}",
                    jobId, job.getTextCount(), job.getChunkCountValue());
        } else if (ex instanceof CancellationException) {
            job.cancelled();
            log.info("Batch chunking job {} cancelled", jobId);
        } else {
            log.error("Batch chunking job {} failed", jobId, ex);
            job.fail(ex.getMessage());
        }
    }
}
