package org.textcurator.service.chunking.strategy;

import org.textcurator.model.Chunk;
import org.textcurator.model.ChunkOptions;
import org.textcurator.model.StrategyType;
import org.textcurator.service.chunking.CancellationToken;
import org.textcurator.service.chunking.strategy.TextSegmenter.TextSegment;
import org.textcurator.service.language.LanguageProfile;

import java.util.Iterator;
import java.util.List;

/**
 * Groups whole sentences into chunks.
 *
 * <p>A chunk closes when the next sentence would exceed the maximum size and
 * the chunk already holds the minimum. Sentences are never split: one longer
 * than the maximum becomes a chunk of its own. With overlap enabled, the
 * trailing sentences of a chunk that fit in the overlap budget open the next one.</p>
 */
public class SentenceChunkingStrategy extends AbstractChunkingStrategy {

    @Override
    public StrategyType type() {
        return StrategyType.SENTENCE;
    }

    @Override
    protected Iterator<Chunk> openCursor(ChunkAssembler assembler, CancellationToken token) {
        return cursorOver(assembler, 0, assembler.text().length(), token);
    }

    @Override
    public int estimateChunkCount(String text, LanguageProfile profile, ChunkOptions options) {
        return estimateBySize(text, profile, options, options.getOverlapSize());
    }

    /**
     * Cursor chunking only {@code text[from, to)}, used by strategies that fall back
     * to sentence grouping for oversized pieces.
     */
    static UnitAccumulatingCursor cursorOver(ChunkAssembler assembler, int from, int to, CancellationToken token) {
        List<TextSegment> sentences = TextSegmenter.splitSentences(assembler.text(), from, to, assembler.profile());
        return new SentenceCursor(assembler, sentences, token);
    }

    private static final class SentenceCursor extends UnitAccumulatingCursor {

        SentenceCursor(ChunkAssembler assembler, List<TextSegment> sentences, CancellationToken token) {
            super(assembler, sentences, token);
        }

        @Override
        protected Chunk computeNext() {
            return hasUnits() ? accumulate() : null;
        }
    }
}
