package org.textcurator.api.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.textcurator.api.model.BatchChunkRequest;
import org.textcurator.api.model.BatchEstimateResponse;
import org.textcurator.api.model.ChunkingJob;
import org.textcurator.api.service.BatchChunkingService;

import java.util.Map;

/**
 * REST controller for asynchronous batch chunking jobs.
 */
@RestController
@RequestMapping("/api/batch")
@RequiredArgsConstructor
public class BatchChunkingController {

    private final BatchChunkingService batchChunkingService;

    /**
     * Starts a batch job; poll {@code GET /api/batch/{jobId}} for its results.
     */
    @PostMapping
    @ResponseStatus(HttpStatus.ACCEPTED)
    public ChunkingJob startBatch(@RequestBody BatchChunkRequest request) {
        return batchChunkingService.startBatch(request);
    }

    @GetMapping("/{jobId}")
    public ChunkingJob getJob(@PathVariable String jobId) {
        return batchChunkingService.getJob(jobId);
    }

    @GetMapping
    public Map<String, ChunkingJob> getAllJobs() {
        return batchChunkingService.getAllJobs();
    }

    @DeleteMapping("/{jobId}")
    public ChunkingJob cancelJob(@PathVariable String jobId) {
        return batchChunkingService.cancelJob(jobId);
    }

    @PostMapping("/estimate")
    public BatchEstimateResponse estimate(@RequestBody BatchChunkRequest request) {
        int textCount = request.getTexts() == null ? 0 : request.getTexts().size();
        return new BatchEstimateResponse(textCount, batchChunkingService.estimate(request));
    }
}
