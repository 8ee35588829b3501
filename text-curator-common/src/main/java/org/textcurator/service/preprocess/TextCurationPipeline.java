package org.textcurator.service.preprocess;

import lombok.extern.slf4j.Slf4j;
import org.textcurator.model.Chunk;
import org.textcurator.model.ChunkOptions;
import org.textcurator.model.PreprocessingResult;
import org.textcurator.service.chunking.CancellationToken;
import org.textcurator.service.chunking.ChunkingService;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the configured preprocessors in order and chunks the result.
 */
@Slf4j
public class TextCurationPipeline {

    private final List<TextPreprocessor> preprocessors;
    private final ChunkingService chunkingService;

    public TextCurationPipeline(List<TextPreprocessor> preprocessors, ChunkingService chunkingService) {
        this.preprocessors = List.copyOf(preprocessors);
        this.chunkingService = chunkingService;
    }

    public PreprocessingResult process(String text, ChunkOptions options) {
        return process(text, options, CancellationToken.none());
    }

    /**
     * @throws org.textcurator.service.chunking.ChunkingConfigurationException if the options are invalid
     */
    public PreprocessingResult process(String text, ChunkOptions options, CancellationToken token) {
        chunkingService.validate(options);
        String original = text == null ? "" : text;

        String processed = original;
        List<String> applied = new ArrayList<>(preprocessors.size());
        for (TextPreprocessor preprocessor : preprocessors) {
            token.throwIfCancelled();
            processed = preprocessor.process(processed);
            applied.add(preprocessor.name());
        }

        if (processed.isBlank() && !original.isBlank()) {
            log.warn("Text became empty after preprocessing ({} chars in)", original.length());
        }

        List<Chunk> chunks = chunkingService.chunk(processed, options, token);
        return new PreprocessingResult(original, processed, chunks, List.copyOf(applied));
    }

    public List<String> preprocessorNames() {
        List<String> names = new ArrayList<>(preprocessors.size());
        for (TextPreprocessor preprocessor : preprocessors) {
            names.add(preprocessor.name());
        }
        return names;
    }
}
