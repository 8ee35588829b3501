package org.textcurator.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.textcurator.model.Chunk;
import org.textcurator.service.chunking.CancellationToken;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * State of one asynchronous batch chunking run.
 *
 * <p>{@code results} holds one chunk list per input text, in input order, once the job completes.</p>
 */
@Getter
@RequiredArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChunkingJob {

    public enum JobStatus { RUNNING, COMPLETED, FAILED, CANCELLED }

    private final String jobId;

    private final int textCount;

    @JsonIgnore
    private final CancellationToken cancellationToken;

    private volatile JobStatus status = JobStatus.RUNNING;

    private final Instant startedAt = Instant.now();
    private volatile Instant completedAt;

    private volatile String error;

    private volatile List<List<Chunk>> results;

    @Getter(AccessLevel.NONE)
    private final AtomicInteger chunkCount = new AtomicInteger(0);

    public void complete(List<List<Chunk>> chunksPerText) {
        int total = 0;
        for (List<Chunk> chunks : chunksPerText) {
            total += chunks.size();
        }
        chunkCount.set(total);
        results = chunksPerText;
        status = JobStatus.COMPLETED;
        completedAt = Instant.now();
    }

    public void fail(String message) {
        error = message;
        status = JobStatus.FAILED;
        completedAt = Instant.now();
    }

    public void cancelled() {
        status = JobStatus.CANCELLED;
        completedAt = Instant.now();
    }

    @JsonIgnore
    public boolean isRunning() {
        return status == JobStatus.RUNNING;
    }

    @JsonProperty("chunkCount")
    public int getChunkCountValue() {
        return chunkCount.get();
    }
}
