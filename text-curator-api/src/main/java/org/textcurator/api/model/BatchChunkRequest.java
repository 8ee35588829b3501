package org.textcurator.api.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request payload for asynchronous batch chunking.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchChunkRequest {

    private List<String> texts;

    private ChunkOptionsRequest options;

    /** Texts chunked at the same time (default: configured in curator.batch.max-concurrency). */
    private Integer maxConcurrency;
}
