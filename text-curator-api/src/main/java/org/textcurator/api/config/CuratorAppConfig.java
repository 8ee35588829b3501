package org.textcurator.api.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.textcurator.service.chunking.BatchChunkProcessor;
import org.textcurator.service.chunking.ChunkBalancer;
import org.textcurator.service.chunking.ChunkingService;
import org.textcurator.service.embedding.EmbeddingModelSimilarityOracle;
import org.textcurator.service.embedding.SimilarityOracle;
import org.textcurator.service.language.LanguageProfileRegistry;
import org.textcurator.service.preprocess.NoiseReductionService;
import org.textcurator.service.preprocess.TextCurationPipeline;
import org.textcurator.service.preprocess.TextPreprocessor;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * Central Spring configuration for the chunking engine.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(CuratorProperties.class)
public class CuratorAppConfig {

    // ----------------------------------------------------------------------
    // Language and chunking
    // ----------------------------------------------------------------------

    @Bean
    public LanguageProfileRegistry languageProfileRegistry() {
        return new LanguageProfileRegistry();
    }

    @Bean
    public ChunkBalancer chunkBalancer(LanguageProfileRegistry registry) {
        return new ChunkBalancer(registry);
    }

    /**
     * Chunking service; semantic chunking is only registered when an embedding model is available.
     */
    @Bean
    public ChunkingService chunkingService(LanguageProfileRegistry registry,
                                           ChunkBalancer balancer,
                                           ObjectProvider<EmbeddingModel> embeddingModel,
                                           CuratorProperties props) {
        return new ChunkingService(registry, balancer, similarityOracle(embeddingModel, props));
    }

    @Bean
    public BatchChunkProcessor batchChunkProcessor(ChunkingService chunkingService,
                                                   @Qualifier("batchChunkingExecutor") Executor executor) {
        return new BatchChunkProcessor(chunkingService, executor);
    }

    // ----------------------------------------------------------------------
    // Preprocessing
    // ----------------------------------------------------------------------

    @Bean
    public NoiseReductionService noiseReductionService(CuratorProperties props) {
        CuratorProperties.NoiseReduction config = props.getNoiseReduction();
        return new NoiseReductionService(
                config.isAggressive(),
                config.getRemovePatterns(),
                config.getReplacePatterns()
        );
    }

    @Bean
    public TextCurationPipeline textCurationPipeline(NoiseReductionService noiseReduction,
                                                     ChunkingService chunkingService,
                                                     CuratorProperties props) {
        List<TextPreprocessor> preprocessors = new ArrayList<>();
        if (props.getNoiseReduction().isEnabled()) {
            preprocessors.add(noiseReduction);
        }
        return new TextCurationPipeline(preprocessors, chunkingService);
    }

    // ----------------------------------------------------------------------
    // Helpers
    // ----------------------------------------------------------------------

    private static SimilarityOracle similarityOracle(ObjectProvider<EmbeddingModel> embeddingModel,
                                                     CuratorProperties props) {
        if (!props.getEmbedding().isEnabled()) {
            log.info("Embeddings disabled; semantic chunking is unavailable");
            return null;
        }
        EmbeddingModel model = embeddingModel.getIfAvailable();
        if (model == null) {
            log.info("No embedding model configured; semantic chunking is unavailable");
            return null;
        }
        log.info("Semantic chunking enabled with embedding model {}", props.getEmbedding().getModelName());
        return new EmbeddingModelSimilarityOracle(model, props.getEmbedding().getModelName());
    }
}
