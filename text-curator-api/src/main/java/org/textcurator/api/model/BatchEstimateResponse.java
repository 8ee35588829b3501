package org.textcurator.api.model;

public record BatchEstimateResponse(int textCount, int totalEstimatedChunks) {
}
