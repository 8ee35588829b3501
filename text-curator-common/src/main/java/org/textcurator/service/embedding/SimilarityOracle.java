package org.textcurator.service.embedding;

import java.util.ArrayList;
import java.util.List;

/**
 * Embeds text and compares embeddings. Consumed by semantic chunking.
 */
public interface SimilarityOracle {

    float[] embed(String text);

    /**
     * Embeds several texts; the result has one vector per input, in input order.
     */
    default List<float[]> embedBatch(List<String> texts) {
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(embed(text));
        }
        return vectors;
    }

    /**
     * Cosine similarity clamped to {@code [-1, 1]}; 0 when either vector is all zeros.
     *
     * @throws IllegalArgumentException if the dimensions differ
     */
    default double similarity(float[] a, float[] b) {
        return cosine(a, b);
    }

    static double cosine(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException(
                    "Embedding dimension mismatch: " + a.length + " vs " + b.length);
        }
        double dot = 0;
        double normA = 0;
        double normB = 0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }
        if (normA == 0 || normB == 0) {
            return 0;
        }
        double cosine = dot / (Math.sqrt(normA) * Math.sqrt(normB));
        return Math.max(-1.0, Math.min(1.0, cosine));
    }
}
