package org.textcurator.api.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.textcurator.model.Chunk;
import org.textcurator.model.ChunkBalanceStats;
import org.textcurator.model.StrategyType;

import java.util.List;

/**
 * Response payload for the chunking endpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChunkResponse {

    /** Strategy actually used; never {@code AUTO}. */
    private StrategyType strategy;

    private String languageCode;

    private int chunkCount;

    private List<Chunk> chunks;

    private ChunkBalanceStats stats;
}
