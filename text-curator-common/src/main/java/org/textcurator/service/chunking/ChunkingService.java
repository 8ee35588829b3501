package org.textcurator.service.chunking;

import lombok.extern.slf4j.Slf4j;
import org.textcurator.model.Chunk;
import org.textcurator.model.ChunkBalanceStats;
import org.textcurator.model.ChunkOptions;
import org.textcurator.model.StrategyType;
import org.textcurator.service.chunking.strategy.ChunkingStrategy;
import org.textcurator.service.chunking.strategy.HierarchicalChunkingStrategy;
import org.textcurator.service.chunking.strategy.ParagraphChunkingStrategy;
import org.textcurator.service.chunking.strategy.SemanticChunkingStrategy;
import org.textcurator.service.chunking.strategy.SentenceChunkingStrategy;
import org.textcurator.service.chunking.strategy.TokenChunkingStrategy;
import org.textcurator.service.embedding.SimilarityOracle;
import org.textcurator.service.language.LanguageProfile;
import org.textcurator.service.language.LanguageProfileRegistry;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Entry point for chunking: resolves the language profile and strategy,
 * runs the strategy and balances the result.
 *
 * <p>Options are validated before any work starts. {@link StrategyType#AUTO}
 * picks a concrete strategy from the text's size and structure:</p>
 * <ol>
 *   <li>Sentence when the text is at most twice the target size</li>
 *   <li>Paragraph when it has more than three paragraph boundaries</li>
 *   <li>Sentence when it has more than five sentence boundaries</li>
 *   <li>Token otherwise</li>
 * </ol>
 */
@Slf4j
public class ChunkingService {

    private final LanguageProfileRegistry registry;
    private final ChunkBalancer balancer;
    private final Map<StrategyType, ChunkingStrategy> strategies;

    public ChunkingService(LanguageProfileRegistry registry, ChunkBalancer balancer) {
        this(registry, balancer, null);
    }

    /**
     * @param similarityOracle enables {@link StrategyType#SEMANTIC}; may be {@code null}
     */
    public ChunkingService(LanguageProfileRegistry registry, ChunkBalancer balancer,
                           SimilarityOracle similarityOracle) {
        this.registry = registry;
        this.balancer = balancer;

        Map<StrategyType, ChunkingStrategy> byType = new EnumMap<>(StrategyType.class);
        register(byType, new SentenceChunkingStrategy());
        register(byType, new ParagraphChunkingStrategy());
        register(byType, new TokenChunkingStrategy());
        register(byType, new HierarchicalChunkingStrategy());
        if (similarityOracle != null) {
            register(byType, new SemanticChunkingStrategy(similarityOracle));
        }
        this.strategies = Collections.unmodifiableMap(byType);
    }

    private static void register(Map<StrategyType, ChunkingStrategy> byType, ChunkingStrategy strategy) {
        byType.put(strategy.type(), strategy);
    }

    /**
     * Hierarchical output is never balanced: merging or splitting across sections would
     * break its level, path and parent links. The strategy already bounds section sizes.
     */
    private static boolean balances(StrategyType type, ChunkOptions options) {
        return options.isEnableChunkBalancing() && type != StrategyType.HIERARCHICAL;
    }

    public List<Chunk> chunk(String text, ChunkOptions options) {
        return chunk(text, options, CancellationToken.none());
    }

    /**
     * Chunks text and returns the complete, reindexed sequence.
     *
     * @throws ChunkingConfigurationException if the options are invalid or name an unavailable strategy
     * @throws java.util.concurrent.CancellationException if {@code token} is cancelled
     */
    public List<Chunk> chunk(String text, ChunkOptions options, CancellationToken token) {
        validate(options);
        if (text == null || text.isBlank()) {
            return List.of();
        }

        LanguageProfile profile = resolveProfile(options, text);
        StrategyType type = resolveStrategy(text, options, profile);
        ChunkingStrategy strategy = strategyFor(type);

        List<Chunk> chunks = strategy.chunk(text, profile, options, token);
        if (balances(type, options)) {
            chunks = balancer.balance(chunks, options, token);
        }
        chunks = ChunkSequence.reindex(chunks);

        log.info("Chunking produced {} chunks (strategy: {}, language: {}, textLength: {})",
                chunks.size(), type, profile.getLanguageCode(), text.length());
        return chunks;
    }

    public Stream<Chunk> chunkStream(String text, ChunkOptions options) {
        return chunkStream(text, options, CancellationToken.none());
    }

    /**
     * Lazily chunks text, computing one chunk per pull.
     *
     * <p>Options and strategy availability are checked when the stream is created.
     * Each chunk carries its running position; {@code totalChunks} is the number of
     * chunks produced so far.</p>
     */
    public Stream<Chunk> chunkStream(String text, ChunkOptions options, CancellationToken token) {
        validate(options);
        if (text == null || text.isBlank()) {
            return Stream.empty();
        }

        LanguageProfile profile = resolveProfile(options, text);
        StrategyType type = resolveStrategy(text, options, profile);
        ChunkingStrategy strategy = strategyFor(type);
        log.debug("Streaming chunks with strategy {} and language {}", type, profile.getLanguageCode());

        Iterator<Chunk> chunks = strategy.chunkIterator(text, profile, options, token);
        if (balances(type, options)) {
            chunks = balancer.balance(chunks, options, token);
        }
        Iterator<Chunk> positioned = new RunningPositionIterator(chunks, token);
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(positioned, Spliterator.ORDERED | Spliterator.NONNULL),
                false);
    }

    /**
     * Estimates the number of chunks the resolved strategy would produce, without producing them.
     */
    public int estimateChunkCount(String text, ChunkOptions options) {
        validate(options);
        if (text == null || text.isBlank()) {
            return 0;
        }
        LanguageProfile profile = resolveProfile(options, text);
        StrategyType type = resolveStrategy(text, options, profile);
        return strategyFor(type).estimateChunkCount(text, profile, options);
    }

    /**
     * The concrete strategy used for {@code text}, applying the automatic selection rules.
     */
    public StrategyType resolveStrategy(String text, ChunkOptions options) {
        if (options.getStrategy() != StrategyType.AUTO) {
            return options.getStrategy();
        }
        return resolveStrategy(text, options, resolveProfile(options, text));
    }

    /**
     * The profile for {@code options.languageCode}, or the one detected from {@code text}.
     */
    public LanguageProfile resolveProfile(ChunkOptions options, String text) {
        if (options.getLanguageCode() != null && !options.getLanguageCode().isBlank()) {
            return registry.getProfile(options.getLanguageCode());
        }
        return registry.detectProfile(text);
    }

    public ChunkBalanceStats calculateStats(List<Chunk> chunks, ChunkOptions options) {
        return balancer.calculateStats(chunks, options);
    }

    public boolean isStrategyAvailable(StrategyType type) {
        return type == StrategyType.AUTO || strategies.containsKey(type);
    }

    private StrategyType resolveStrategy(String text, ChunkOptions options, LanguageProfile profile) {
        StrategyType requested = options.getStrategy();
        if (requested != StrategyType.AUTO) {
            return requested;
        }
        if (text == null || text.isBlank()) {
            return StrategyType.SENTENCE;
        }

        StrategyType resolved;
        if (profile.estimateTokenCount(text) <= 2 * options.getTargetChunkSize()) {
            resolved = StrategyType.SENTENCE;
        } else if (profile.findParagraphBoundaries(text).size() > 3) {
            resolved = StrategyType.PARAGRAPH;
        } else if (profile.findSentenceBoundaries(text).size() > 5) {
            resolved = StrategyType.SENTENCE;
        } else {
            resolved = StrategyType.TOKEN;
        }
        log.debug("Auto strategy resolved to {} for language {}", resolved, profile.getLanguageCode());
        return resolved;
    }

    /**
     * Checks the options and that the requested strategy is available.
     *
     * @throws ChunkingConfigurationException if chunking with {@code options} cannot start
     */
    public void validate(ChunkOptions options) {
        if (options == null) {
            throw new ChunkingConfigurationException("options must not be null");
        }
        options.validate();
        if (!isStrategyAvailable(options.getStrategy())) {
            throw new ChunkingConfigurationException(
                    "Strategy " + options.getStrategy() + " requires a similarity oracle, but none is configured");
        }
    }

    private ChunkingStrategy strategyFor(StrategyType type) {
        ChunkingStrategy strategy = strategies.get(type);
        if (strategy == null) {
            throw new ChunkingConfigurationException("No chunking strategy available for " + type);
        }
        return strategy;
    }

    /**
     * Stamps each chunk with its running index; {@code totalChunks} is the count so far.
     */
    private static final class RunningPositionIterator implements Iterator<Chunk> {

        private final Iterator<Chunk> delegate;
        private final CancellationToken token;
        private int position;

        RunningPositionIterator(Iterator<Chunk> delegate, CancellationToken token) {
            this.delegate = delegate;
            this.token = token;
        }

        @Override
        public boolean hasNext() {
            token.throwIfCancelled();
            return delegate.hasNext();
        }

        @Override
        public Chunk next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            int index = position++;
            return delegate.next().withPosition(index, index + 1);
        }
    }
}
