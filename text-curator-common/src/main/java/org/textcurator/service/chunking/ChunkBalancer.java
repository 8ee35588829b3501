package org.textcurator.service.chunking;

import lombok.extern.slf4j.Slf4j;
import org.textcurator.model.Chunk;
import org.textcurator.model.ChunkBalanceStats;
import org.textcurator.model.ChunkLocation;
import org.textcurator.model.ChunkOptions;
import org.textcurator.model.StrategyType;
import org.textcurator.service.chunking.strategy.SentenceChunkingStrategy;
import org.textcurator.service.chunking.strategy.TextSegmenter;
import org.textcurator.service.chunking.strategy.TextSegmenter.TextSegment;
import org.textcurator.service.language.LanguageProfile;
import org.textcurator.service.language.LanguageProfileRegistry;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.UUID;

/**
 * Evens out the sizes of an already produced chunk sequence.
 *
 * <p>The first pass merges chunks below {@code minChunkSize} into their right
 * neighbour (the last one into its left neighbour). The second pass re-splits
 * chunks above {@code maxChunkSize} by sentence into near-equal pieces. The
 * input is never modified.</p>
 */
@Slf4j
public class ChunkBalancer {

    private static final String MERGE_SEPARATOR = "\n\n";

    private final LanguageProfileRegistry registry;
    private final SentenceChunkingStrategy sentenceStrategy = new SentenceChunkingStrategy();

    public ChunkBalancer(LanguageProfileRegistry registry) {
        this.registry = registry;
    }

    /**
     * Balances a complete sequence and reindexes the result.
     */
    public List<Chunk> balance(List<Chunk> chunks, ChunkOptions options, CancellationToken token) {
        if (chunks.isEmpty()) {
            return chunks;
        }

        List<Chunk> merged = mergeUndersized(chunks, options);
        token.throwIfCancelled();

        List<Chunk> result = new ArrayList<>(merged.size());
        for (Chunk chunk : merged) {
            token.throwIfCancelled();
            result.addAll(splitIfOversized(chunk, options, token));
        }

        log.debug("Balanced {} chunks into {} (merge pass left {})", chunks.size(), result.size(), merged.size());
        return ChunkSequence.reindex(result);
    }

    /**
     * Balances chunks as they are pulled, holding back at most one merged chunk.
     * Positions are left as produced.
     */
    public Iterator<Chunk> balance(Iterator<Chunk> chunks, ChunkOptions options, CancellationToken token) {
        return new StreamingBalancer(chunks, options, token);
    }

    public ChunkBalanceStats calculateStats(List<Chunk> chunks, ChunkOptions options) {
        if (chunks == null || chunks.isEmpty()) {
            return ChunkBalanceStats.empty();
        }

        int min = Integer.MAX_VALUE;
        int max = 0;
        long sum = 0;
        int undersized = 0;
        int oversized = 0;
        for (Chunk chunk : chunks) {
            int tokens = chunk.getEstimatedTokenCount();
            min = Math.min(min, tokens);
            max = Math.max(max, tokens);
            sum += tokens;
            if (tokens < options.getMinChunkSize()) {
                undersized++;
            }
            if (tokens > options.getMaxChunkSize()) {
                oversized++;
            }
        }

        double mean = (double) sum / chunks.size();
        double squares = 0;
        for (Chunk chunk : chunks) {
            double delta = chunk.getEstimatedTokenCount() - mean;
            squares += delta * delta;
        }
        double stdDev = Math.sqrt(squares / chunks.size());
        double varianceRatio = min == 0 ? 0 : (double) max / min;

        return new ChunkBalanceStats(chunks.size(), min, max, mean, stdDev, varianceRatio, undersized, oversized);
    }

    // ------------------------------------------------------------------
    // Merge pass
    // ------------------------------------------------------------------

    private List<Chunk> mergeUndersized(List<Chunk> chunks, ChunkOptions options) {
        List<Chunk> result = new ArrayList<>(chunks.size());
        int i = 0;
        while (i < chunks.size()) {
            Chunk current = chunks.get(i++);
            while (isUndersized(current, options) && i < chunks.size()) {
                current = merge(current, chunks.get(i++));
            }
            result.add(current);
        }

        int last = result.size() - 1;
        if (last > 0 && isUndersized(result.get(last), options)) {
            Chunk tail = result.remove(last);
            result.set(last - 1, merge(result.get(last - 1), tail));
        }
        return result;
    }

    private boolean isUndersized(Chunk chunk, ChunkOptions options) {
        return chunk.getEstimatedTokenCount() < options.getMinChunkSize();
    }

    private Chunk merge(Chunk left, Chunk right) {
        String content = left.getContent() + MERGE_SEPARATOR + right.getContent();
        LanguageProfile profile = registry.getProfile(left.getMetadata().getLanguageCode());

        ChunkLocation location = left.getLocation().toBuilder()
                .endPosition(Math.max(left.getLocation().getEndPosition(), right.getLocation().getEndPosition()))
                .endLine(Math.max(left.getLocation().getEndLine(), right.getLocation().getEndLine()))
                .build();

        return left.toBuilder()
                .content(content)
                .metadata(left.getMetadata().toBuilder()
                        .estimatedTokenCount(profile.estimateTokenCount(content))
                        .build())
                .location(location)
                .build();
    }

    // ------------------------------------------------------------------
    // Split pass
    // ------------------------------------------------------------------

    private List<Chunk> splitIfOversized(Chunk chunk, ChunkOptions options, CancellationToken token) {
        int tokens = chunk.getEstimatedTokenCount();
        int max = options.getMaxChunkSize();
        if (tokens <= max) {
            return List.of(chunk);
        }

        String content = chunk.getContent();
        LanguageProfile profile = registry.getProfile(chunk.getMetadata().getLanguageCode());
        int pieces = (int) Math.ceil((double) tokens / max);
        int limit = Math.max(options.getMinChunkSize(), (int) Math.ceil((double) tokens / pieces));

        ChunkOptions pieceOptions = options.toBuilder()
                .strategy(StrategyType.SENTENCE)
                .targetChunkSize(limit)
                .minChunkSize(Math.min(options.getMinChunkSize(), limit))
                .maxChunkSize(limit)
                .overlapSize(0)
                .normalizeWhitespace(false)
                .enableChunkBalancing(false)
                .build();

        List<TextSegment> ranges = new ArrayList<>();
        long maxWeight = LanguageProfile.toWeight(max);
        for (Chunk piece : sentenceStrategy.chunk(content, profile, pieceOptions, token)) {
            int start = piece.getLocation().getStartPosition();
            int end = piece.getLocation().getEndPosition();
            long weight = profile.tokenWeight(content, start, end);
            if (weight > maxWeight) {
                log.warn("Sentence of {} tokens exceeds maxChunkSize {}; cutting between words",
                        LanguageProfile.toTokenCount(weight), max);
                ranges.addAll(cutBetweenWords(content, start, end, profile, LanguageProfile.toWeight(limit)));
            } else {
                ranges.add(new TextSegment(start, end, weight));
            }
        }
        foldSmallTail(ranges, content, profile, options);

        log.debug("Split chunk {} of {} tokens into {} pieces", chunk.getId(), tokens, ranges.size());
        List<Chunk> result = new ArrayList<>(ranges.size());
        for (int i = 0; i < ranges.size(); i++) {
            result.add(toPiece(chunk, ranges.get(i), i == 0, profile));
        }
        return result;
    }

    private List<TextSegment> cutBetweenWords(String content, int start, int end, LanguageProfile profile,
                                              long limitWeight) {
        List<TextSegment> words = TextSegmenter.splitWords(content, start, end, profile, Long.MAX_VALUE);
        List<TextSegment> pieces = new ArrayList<>();
        int pieceStart = -1;
        int pieceEnd = -1;
        long weight = 0;
        for (TextSegment word : words) {
            if (pieceStart >= 0 && weight + word.weight() > limitWeight) {
                pieces.add(new TextSegment(pieceStart, pieceEnd, weight));
                pieceStart = -1;
                weight = 0;
            }
            if (pieceStart < 0) {
                pieceStart = word.startOffset();
            }
            pieceEnd = word.endOffset();
            weight += word.weight();
        }
        if (pieceStart >= 0) {
            pieces.add(new TextSegment(pieceStart, pieceEnd, weight));
        }
        return pieces;
    }

    private void foldSmallTail(List<TextSegment> ranges, String content, LanguageProfile profile,
                              ChunkOptions options) {
        int size = ranges.size();
        if (size < 2) {
            return;
        }
        TextSegment tail = ranges.get(size - 1);
        if (LanguageProfile.toTokenCount(tail.weight()) >= options.getMinChunkSize()) {
            return;
        }
        TextSegment previous = ranges.get(size - 2);
        long combined = profile.tokenWeight(content, previous.startOffset(), tail.endOffset());
        if (combined <= LanguageProfile.toWeight(options.getMaxChunkSize())) {
            ranges.remove(size - 1);
            ranges.set(size - 2, new TextSegment(previous.startOffset(), tail.endOffset(), combined));
        }
    }

    /**
     * Builds a piece of {@code parent}, mapping its content range back onto the source text.
     */
    private Chunk toPiece(Chunk parent, TextSegment range, boolean first, LanguageProfile profile) {
        String content = parent.getContent();
        String text = range.text(content);
        ChunkLocation source = parent.getLocation();

        int sourceLength = source.getEndPosition() - source.getStartPosition();
        double scale = content.isEmpty() ? 0 : (double) sourceLength / content.length();
        int start = clamp(source.getStartPosition() + (int) Math.round(range.startOffset() * scale),
                source.getStartPosition(), source.getEndPosition());
        int end = clamp(source.getStartPosition() + (int) Math.round(range.endOffset() * scale),
                start, source.getEndPosition());

        int startLine = clamp(source.getStartLine() + countNewlines(content, 0, range.startOffset()),
                source.getStartLine(), source.getEndLine());
        int endLine = clamp(startLine + countNewlines(content, range.startOffset(), range.endOffset()),
                startLine, source.getEndLine());

        return parent.toBuilder()
                .id(first ? parent.getId() : UUID.randomUUID().toString())
                .content(text)
                .metadata(parent.getMetadata().toBuilder()
                        .estimatedTokenCount(profile.estimateTokenCount(text))
                        .build())
                .location(source.toBuilder()
                        .startPosition(start)
                        .endPosition(end)
                        .startLine(startLine)
                        .endLine(endLine)
                        .build())
                .build();
    }

    private static int countNewlines(String text, int from, int to) {
        int count = 0;
        for (int i = from; i < to; i++) {
            if (text.charAt(i) == '\n') {
                count++;
            }
        }
        return count;
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }

    private final class StreamingBalancer implements Iterator<Chunk> {

        private final Iterator<Chunk> source;
        private final ChunkOptions options;
        private final CancellationToken token;
        private final Deque<Chunk> ready = new ArrayDeque<>();

        private Chunk held;

        StreamingBalancer(Iterator<Chunk> source, ChunkOptions options, CancellationToken token) {
            this.source = source;
            this.options = options;
            this.token = token;
        }

        @Override
        public boolean hasNext() {
            while (ready.isEmpty()) {
                if (!advance()) {
                    return false;
                }
            }
            return true;
        }

        @Override
        public Chunk next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return ready.poll();
        }

        /**
         * Moves the next merged chunk into {@code held} and releases the previous one.
         */
        private boolean advance() {
            if (!source.hasNext()) {
                if (held == null) {
                    return false;
                }
                release(held);
                held = null;
                return true;
            }

            Chunk current = source.next();
            while (isUndersized(current, options) && source.hasNext()) {
                current = merge(current, source.next());
            }
            if (held == null) {
                held = current;
                return true;
            }
            if (isUndersized(current, options)) {
                // trailing undersized chunk joins its left neighbour
                held = merge(held, current);
                return true;
            }
            release(held);
            held = current;
            return true;
        }

        private void release(Chunk chunk) {
            token.throwIfCancelled();
            ready.addAll(splitIfOversized(chunk, options, token));
        }
    }
}
