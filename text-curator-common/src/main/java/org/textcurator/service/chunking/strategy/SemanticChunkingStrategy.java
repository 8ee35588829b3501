package org.textcurator.service.chunking.strategy;

import org.textcurator.model.Chunk;
import org.textcurator.model.ChunkOptions;
import org.textcurator.model.StrategyType;
import org.textcurator.service.chunking.CancellationToken;
import org.textcurator.service.chunking.strategy.TextSegmenter.TextSegment;
import org.textcurator.service.embedding.SimilarityOracle;
import org.textcurator.service.language.LanguageProfile;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Merges adjacent sentences while they stay on the same topic.
 *
 * <p>Every sentence is embedded once, in a single batch, on the first pull. A
 * chunk grows while the similarity between its running mean embedding and the
 * next sentence stays at or above {@code semanticSimilarityThreshold}; a drop
 * closes it once it holds the minimum size. The size guards and sentence overlap
 * of {@link SentenceChunkingStrategy} apply unchanged.</p>
 */
public class SemanticChunkingStrategy extends AbstractChunkingStrategy {

    private final SimilarityOracle oracle;

    public SemanticChunkingStrategy(SimilarityOracle oracle) {
        this.oracle = Objects.requireNonNull(oracle, "oracle");
    }

    @Override
    public StrategyType type() {
        return StrategyType.SEMANTIC;
    }

    @Override
    public boolean requiresSimilarityOracle() {
        return true;
    }

    @Override
    protected Iterator<Chunk> openCursor(ChunkAssembler assembler, CancellationToken token) {
        List<TextSegment> sentences = TextSegmenter.splitSentences(assembler.text(), assembler.profile());
        return new SemanticCursor(assembler, sentences, token);
    }

    @Override
    public int estimateChunkCount(String text, LanguageProfile profile, ChunkOptions options) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        int total = profile.estimateTokenCount(text);
        return Math.max(1, (int) Math.ceil((double) total / options.getTargetChunkSize()));
    }

    private final class SemanticCursor extends UnitAccumulatingCursor {

        private final double threshold;
        private List<float[]> embeddings;
        private float[] running;
        private int merged;

        SemanticCursor(ChunkAssembler assembler, List<TextSegment> sentences, CancellationToken token) {
            super(assembler, sentences, token);
            this.threshold = assembler.options().getSemanticSimilarityThreshold();
        }

        @Override
        protected Chunk computeNext() {
            if (!hasUnits()) {
                return null;
            }
            if (embeddings == null && units.size() > 1) {
                embeddings = embedUnits();
            }
            return accumulate();
        }

        private List<float[]> embedUnits() {
            List<String> texts = new ArrayList<>(units.size());
            for (TextSegment unit : units) {
                texts.add(unit.text(assembler.text()));
            }
            List<float[]> vectors = oracle.embedBatch(texts);
            if (vectors == null || vectors.size() != texts.size()) {
                throw new IllegalStateException("Similarity oracle returned "
                        + (vectors == null ? 0 : vectors.size()) + " embeddings for " + texts.size() + " sentences");
            }
            return vectors;
        }

        @Override
        protected void onAppend(int unitIndex, boolean firstOfChunk) {
            if (embeddings == null) {
                return;
            }
            float[] vector = embeddings.get(unitIndex);
            if (firstOfChunk || running == null || running.length != vector.length) {
                running = vector.clone();
                merged = 1;
                return;
            }
            merged++;
            for (int i = 0; i < running.length; i++) {
                running[i] += (vector[i] - running[i]) / merged;
            }
        }

        @Override
        protected boolean closesBefore(int unitIndex, long bufferWeight) {
            if (embeddings == null || running == null || bufferWeight < minWeight) {
                return false;
            }
            return oracle.similarity(running, embeddings.get(unitIndex)) < threshold;
        }
    }
}
