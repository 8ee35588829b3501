package org.textcurator.service.chunking.strategy;

import lombok.extern.slf4j.Slf4j;
import org.textcurator.model.Chunk;
import org.textcurator.model.ChunkOptions;
import org.textcurator.model.StrategyType;
import org.textcurator.service.chunking.CancellationToken;
import org.textcurator.service.chunking.strategy.TextSegmenter.TextSegment;
import org.textcurator.service.language.LanguageProfile;

import java.util.Iterator;
import java.util.List;

/**
 * Groups whole paragraphs into chunks.
 *
 * <p>Paragraphs larger than the maximum size are split by sentence. When
 * {@code preserveParagraphs} is set those fragments stand alone; otherwise the
 * last fragment may be joined with the paragraphs that follow. Overlap is
 * taken from the trailing sentences of the previous chunk.</p>
 */
@Slf4j
public class ParagraphChunkingStrategy extends AbstractChunkingStrategy {

    @Override
    public StrategyType type() {
        return StrategyType.PARAGRAPH;
    }

    @Override
    protected Iterator<Chunk> openCursor(ChunkAssembler assembler, CancellationToken token) {
        List<TextSegment> paragraphs = TextSegmenter.splitParagraphs(assembler.text(), assembler.profile());
        return new ParagraphCursor(assembler, paragraphs, token);
    }

    @Override
    public int estimateChunkCount(String text, LanguageProfile profile, ChunkOptions options) {
        return estimateBySize(text, profile, options, options.getOverlapSize());
    }

    private static final class ParagraphCursor extends UnitAccumulatingCursor {

        private Iterator<Chunk> fragments;

        ParagraphCursor(ChunkAssembler assembler, List<TextSegment> paragraphs, CancellationToken token) {
            super(assembler, paragraphs, token);
        }

        @Override
        protected Chunk computeNext() {
            if (fragments != null) {
                Chunk fragment = nextFragment();
                if (fragment != null) {
                    return fragment;
                }
            }
            if (!hasUnits()) {
                return flushContentCarry();
            }

            TextSegment paragraph = units.get(nextUnit);
            if (paragraph.weight() > maxWeight && !hasContentCarry()) {
                log.debug("Paragraph at offset {} exceeds {} tokens; splitting by sentence",
                        paragraph.startOffset(), assembler.options().getMaxChunkSize());
                clearCarry();
                nextUnit++;
                cancellationToken().throwIfCancelled();
                fragments = SentenceChunkingStrategy.cursorOver(
                        assembler, paragraph.startOffset(), paragraph.endOffset(), cancellationToken());
                Chunk fragment = nextFragment();
                if (fragment != null) {
                    return fragment;
                }
                return computeNext();
            }
            return accumulate();
        }

        private Chunk nextFragment() {
            if (!fragments.hasNext()) {
                fragments = null;
                return null;
            }
            Chunk fragment = fragments.next();
            if (!fragments.hasNext()) {
                fragments = null;
                if (!assembler.options().isPreserveParagraphs() && hasUnits()) {
                    int start = fragment.getLocation().getStartPosition();
                    int end = fragment.getLocation().getEndPosition();
                    carryContent(start, end, assembler.profile().tokenWeight(assembler.text(), start, end));
                    return computeNext();
                }
            }
            return fragment;
        }

        @Override
        protected int overlapStart(int chunkStart, int chunkEnd, int firstUnit, int endUnit) {
            List<TextSegment> sentences =
                    TextSegmenter.splitSentences(assembler.text(), chunkStart, chunkEnd, assembler.profile());
            long budget = LanguageProfile.toWeight(assembler.options().getOverlapSize());
            int start = chunkEnd;
            long accumulated = 0;
            for (int k = sentences.size() - 1; k > 0; k--) {
                TextSegment sentence = sentences.get(k);
                if (accumulated + sentence.weight() > budget) {
                    break;
                }
                accumulated += sentence.weight();
                start = sentence.startOffset();
            }
            return start;
        }
    }
}
