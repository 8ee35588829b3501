package org.textcurator.api.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;
import org.textcurator.api.config.CuratorProperties;
import org.textcurator.api.model.ChunkEstimateResponse;
import org.textcurator.api.model.ChunkOptionsRequest;
import org.textcurator.api.model.ChunkRequest;
import org.textcurator.api.model.ChunkResponse;
import org.textcurator.model.Chunk;
import org.textcurator.model.ChunkBalanceStats;
import org.textcurator.model.ChunkOptions;
import org.textcurator.model.PreprocessingResult;
import org.textcurator.model.StrategyType;
import org.textcurator.service.chunking.ChunkingService;
import org.textcurator.service.language.LanguageProfile;
import org.textcurator.service.preprocess.TextCurationPipeline;

import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;

/**
 * REST controller for chunking single texts.
 *
 * <h3>Usage examples</h3>
 * <pre>
 * curl -X POST http://localhost:9092/api/chunks \
 *   -H "Content-Type: application/json" \
 *   -d '{"text": "First sentence. Second sentence.", "options": {"strategy": "SENTENCE"}}'
 *
 * # One chunk per line as soon as it is produced
 * curl -N -X POST http://localhost:9092/api/chunks/stream \
 *   -H "Content-Type: application/json" \
 *   -d '{"text": "...", "options": {"strategy": "TOKEN", "targetChunkSize": 128}}'
 * </pre>
 */
@Slf4j
@RestController
@RequestMapping("/api/chunks")
@RequiredArgsConstructor
public class ChunkingController {

    public static final MediaType NDJSON = MediaType.parseMediaType("application/x-ndjson");

    private final ChunkingService chunkingService;
    private final TextCurationPipeline curationPipeline;
    private final CuratorProperties properties;
    private final ObjectMapper objectMapper;

    @PostMapping
    public ChunkResponse chunk(@RequestBody ChunkRequest request) {
        ChunkOptions options = optionsOf(request);
        String text = request.getText();

        List<Chunk> chunks = chunkingService.chunk(text, options);
        LanguageProfile profile = chunkingService.resolveProfile(options, text);
        return ChunkResponse.builder()
                .strategy(chunkingService.resolveStrategy(text, options))
                .languageCode(profile.getLanguageCode())
                .chunkCount(chunks.size())
                .chunks(chunks)
                .stats(chunkingService.calculateStats(chunks, options))
                .build();
    }

    /**
     * Streams chunks as newline-delimited JSON while they are produced.
     *
     * <p>Options are validated before the response starts, so configuration errors
     * still map to HTTP 400.</p>
     */
    @PostMapping("/stream")
    public ResponseEntity<StreamingResponseBody> stream(@RequestBody ChunkRequest request) {
        ChunkOptions options = optionsOf(request);
        Stream<Chunk> chunks = chunkingService.chunkStream(request.getText(), options);

        StreamingResponseBody body = out -> {
            int written = 0;
            try (chunks) {
                Iterator<Chunk> it = chunks.iterator();
                while (it.hasNext()) {
                    out.write(objectMapper.writeValueAsBytes(it.next()));
                    out.write('\n');
                    out.flush();
                    written++;
                }
            }
            log.debug("Streamed {} chunks", written);
        };
        return ResponseEntity.ok().contentType(NDJSON).body(body);
    }

    @PostMapping("/estimate")
    public ChunkEstimateResponse estimate(@RequestBody ChunkRequest request) {
        ChunkOptions options = optionsOf(request);
        String text = request.getText();

        int estimate = chunkingService.estimateChunkCount(text, options);
        StrategyType strategy = chunkingService.resolveStrategy(text, options);
        String languageCode = chunkingService.resolveProfile(options, text).getLanguageCode();
        return new ChunkEstimateResponse(strategy, languageCode, estimate);
    }

    @PostMapping("/stats")
    public ChunkBalanceStats stats(@RequestBody ChunkRequest request) {
        ChunkOptions options = optionsOf(request);
        return chunkingService.calculateStats(chunkingService.chunk(request.getText(), options), options);
    }

    /**
     * Runs the preprocessing pipeline (noise reduction) before chunking.
     */
    @PostMapping("/preprocess")
    public PreprocessingResult preprocess(@RequestBody ChunkRequest request) {
        return curationPipeline.process(request.getText(), optionsOf(request));
    }

    private ChunkOptions optionsOf(ChunkRequest request) {
        return ChunkOptionsRequest.resolve(request.getOptions(), properties.getChunking().toOptions());
    }
}
