package org.textcurator.service.chunking.strategy;

import org.textcurator.model.Chunk;
import org.textcurator.model.ChunkOptions;
import org.textcurator.model.StrategyType;
import org.textcurator.service.chunking.CancellationToken;
import org.textcurator.service.chunking.strategy.TextSegmenter.TextSegment;
import org.textcurator.service.language.LanguageProfile;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Fills chunks word by word up to the target size.
 *
 * <p>With {@code preserveSentences} the cut is moved back to the last sentence
 * end inside the chunk, unless that leaves less than the minimum size. Overlap
 * repeats the trailing words of a chunk verbatim at the start of the next one;
 * it counts against the target and is capped at half of it, so consecutive
 * chunks do not form a strict partition of the text when overlap is enabled.</p>
 */
public class TokenChunkingStrategy extends AbstractChunkingStrategy {

    @Override
    public StrategyType type() {
        return StrategyType.TOKEN;
    }

    @Override
    protected Iterator<Chunk> openCursor(ChunkAssembler assembler, CancellationToken token) {
        return new TokenCursor(assembler, token);
    }

    @Override
    public int estimateChunkCount(String text, LanguageProfile profile, ChunkOptions options) {
        return estimateBySize(text, profile, options, effectiveOverlap(options));
    }

    static int effectiveOverlap(ChunkOptions options) {
        return Math.min(options.getOverlapSize(), options.getTargetChunkSize() / 2);
    }

    private static final class TokenCursor extends ChunkCursor {

        private final ChunkAssembler assembler;
        private final List<TextSegment> words;
        private final int[] sentenceEnds;
        private final long targetWeight;
        private final long minWeight;
        private final long maxWeight;
        private final long overlapWeight;

        private int nextWord;
        private int overlapFrom = -1;

        TokenCursor(ChunkAssembler assembler, CancellationToken token) {
            super(token);
            ChunkOptions options = assembler.options();
            String text = assembler.text();
            this.assembler = assembler;
            this.targetWeight = LanguageProfile.toWeight(options.getTargetChunkSize());
            this.minWeight = LanguageProfile.toWeight(options.getMinChunkSize());
            this.maxWeight = LanguageProfile.toWeight(options.getMaxChunkSize());
            this.overlapWeight = LanguageProfile.toWeight(effectiveOverlap(options));
            this.words = new ArrayList<>(
                    TextSegmenter.splitWords(text, 0, text.length(), assembler.profile(), targetWeight));
            this.sentenceEnds = options.isPreserveSentences()
                    ? assembler.profile().findSentenceBoundaries(text).stream().mapToInt(Integer::intValue).toArray()
                    : null;
        }

        @Override
        protected Chunk computeNext() {
            if (nextWord >= words.size()) {
                return null;
            }
            String text = assembler.text();
            LanguageProfile profile = assembler.profile();
            int first = nextWord;

            int start = words.get(first).startOffset();
            long weight = 0;
            if (overlapFrom >= 0) {
                long carried = profile.tokenWeight(text, overlapFrom, start);
                if (carried + words.get(first).weight() <= maxWeight) {
                    start = overlapFrom;
                    weight = carried;
                }
            }
            overlapFrom = -1;

            int j = first;
            while (j < words.size() && (j == first || weight + words.get(j).weight() <= targetWeight)) {
                weight += words.get(j).weight();
                j++;
            }
            int end = words.get(j - 1).endOffset();

            if (sentenceEnds != null && j < words.size()) {
                int boundary = lastSentenceEndWithin(words.get(first).startOffset(), end);
                if (boundary > 0 && boundary < end && profile.tokenWeight(text, start, boundary) >= minWeight) {
                    end = boundary;
                    j = resumeAt(first, j, boundary);
                }
            }

            nextWord = j;
            if (overlapWeight > 0 && nextWord < words.size()) {
                overlapFrom = overlapStart(first, nextWord, end);
            }
            return assembler.assemble(start, end);
        }

        /**
         * Largest sentence end in {@code (after, upTo]}, or -1.
         */
        private int lastSentenceEndWithin(int after, int upTo) {
            int lo = 0;
            int hi = sentenceEnds.length - 1;
            int found = -1;
            while (lo <= hi) {
                int mid = (lo + hi) >>> 1;
                if (sentenceEnds[mid] <= upTo) {
                    found = mid;
                    lo = mid + 1;
                } else {
                    hi = mid - 1;
                }
            }
            return found >= 0 && sentenceEnds[found] > after ? sentenceEnds[found] : -1;
        }

        /**
         * Index of the first word after {@code boundary}; a word straddling it is cut in two.
         */
        private int resumeAt(int first, int end, int boundary) {
            int k = end - 1;
            while (k > first && words.get(k - 1).endOffset() > boundary) {
                k--;
            }
            TextSegment word = words.get(k);
            if (word.startOffset() < boundary && word.endOffset() > boundary) {
                TextSegment rest = TextSegmenter.trimmed(assembler.text(), boundary, word.endOffset(), assembler.profile());
                if (rest == null) {
                    return k + 1;
                }
                words.set(k, rest);
                return k;
            }
            return word.startOffset() >= boundary ? k : k + 1;
        }

        private int overlapStart(int first, int end, int chunkEnd) {
            int start = -1;
            long accumulated = 0;
            for (int k = end - 1; k > first; k--) {
                TextSegment word = words.get(k);
                if (word.endOffset() > chunkEnd || accumulated + word.weight() > overlapWeight) {
                    break;
                }
                accumulated += word.weight();
                start = word.startOffset();
            }
            return start;
        }
    }
}
