package org.textcurator.api.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.textcurator.model.ChunkOptions;
import org.textcurator.model.StrategyType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration for chunking defaults, noise reduction, batch jobs and embeddings.
 *
 * <p>Bound from {@code curator.*} in {@code application.yml}.
 */
@Data
@ConfigurationProperties(prefix = "curator")
public class CuratorProperties {

    private Chunking chunking = new Chunking();
    private NoiseReduction noiseReduction = new NoiseReduction();
    private Batch batch = new Batch();
    private Embedding embedding = new Embedding();

    /**
     * Defaults for request fields that are left out.
     */
    @Data
    public static class Chunking {
        private StrategyType strategy = StrategyType.AUTO;
        private int targetChunkSize = 512;
        private int minChunkSize = 100;
        private int maxChunkSize = 1024;
        private int overlapSize = 50;
        private String languageCode;
        private boolean preserveSentences = true;
        private boolean preserveParagraphs = true;
        private double semanticSimilarityThreshold = 0.5;
        private boolean enableChunkBalancing = true;
        private boolean normalizeWhitespace = false;

        public ChunkOptions toOptions() {
            return ChunkOptions.builder()
                    .strategy(strategy)
                    .targetChunkSize(targetChunkSize)
                    .minChunkSize(minChunkSize)
                    .maxChunkSize(maxChunkSize)
                    .overlapSize(overlapSize)
                    .languageCode(languageCode)
                    .preserveSentences(preserveSentences)
                    .preserveParagraphs(preserveParagraphs)
                    .semanticSimilarityThreshold(semanticSimilarityThreshold)
                    .enableChunkBalancing(enableChunkBalancing)
                    .normalizeWhitespace(normalizeWhitespace)
                    .build();
        }
    }

    @Data
    public static class NoiseReduction {
        private boolean enabled = true;
        private boolean aggressive = false;
        private List<String> removePatterns = new ArrayList<>();
        private Map<String, String> replacePatterns = new LinkedHashMap<>();
    }

    @Data
    public static class Batch {
        /** Texts chunked at the same time when a request does not say. */
        private int maxConcurrency = 4;
    }

    @Data
    public static class Embedding {
        /** Enables semantic chunking when an embedding model is available. */
        private boolean enabled = true;
        private String modelName = "default";
    }
}
