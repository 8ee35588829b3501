package org.textcurator.api.model;

import org.textcurator.model.StrategyType;

public record ChunkEstimateResponse(StrategyType strategy, String languageCode, int estimatedChunkCount) {
}
