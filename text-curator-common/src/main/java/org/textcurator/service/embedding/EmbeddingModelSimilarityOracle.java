package org.textcurator.service.embedding;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.embedding.EmbeddingRequest;
import org.springframework.ai.embedding.EmbeddingResponse;
import org.springframework.ai.retry.TransientAiException;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * {@link SimilarityOracle} backed by a Spring AI {@link EmbeddingModel}, with fallback
 * handling for inputs the model rejects as too large.
 *
 * <p>Sentence units coming from the chunkers are normally well within model limits.
 * When the model still reports an input as too large, the text is split at a
 * natural boundary near the middle, each half is embedded and the vectors are
 * averaged. Batches rejected as too large are retried one text at a time.</p>
 */
@Slf4j
public class EmbeddingModelSimilarityOracle implements SimilarityOracle {

    private static final Pattern TOO_LARGE = Pattern.compile("input \\((\\d+) tokens\\) is too large");

    // Pathological inputs (binary garbage, malformed extraction) are truncated
    private static final int SAFETY_CAP = 3000;

    private static final int MIN_CHARS = 200;

    private final EmbeddingModel embeddingModel;

    @Getter
    private final String modelName;

    public EmbeddingModelSimilarityOracle(EmbeddingModel embeddingModel, String modelName) {
        this.embeddingModel = embeddingModel;
        this.modelName = modelName;
    }

    @Override
    public float[] embed(String text) {
        return embedWithFallback(capped(sanitize(text)));
    }

    @Override
    public List<float[]> embedBatch(List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }
        List<String> inputs = new ArrayList<>(texts.size());
        for (String text : texts) {
            inputs.add(capped(sanitize(text)));
        }

        try {
            EmbeddingResponse response = embeddingModel.call(new EmbeddingRequest(inputs, null));
            List<float[]> vectors = new ArrayList<>(inputs.size());
            for (int i = 0; i < response.getResults().size(); i++) {
                vectors.add(response.getResults().get(i).getOutput());
            }
            log.debug("Embedded batch of {} sentence units with model {}", inputs.size(), modelName);
            return vectors;
        } catch (TransientAiException ex) {
            if (!looksLikeTooLarge(ex)) {
                throw ex;
            }
            log.warn("Embedding batch of {} inputs rejected as too large; embedding one by one", inputs.size());
            List<float[]> vectors = new ArrayList<>(inputs.size());
            for (String input : inputs) {
                vectors.add(embedWithFallback(input));
            }
            return vectors;
        }
    }

    private float[] embedWithFallback(String text) {
        if (text.isEmpty()) {
            return new float[0];
        }

        try {
            return callModel(text);
        } catch (TransientAiException ex) {
            if (!looksLikeTooLarge(ex)) {
                throw ex;
            }

            if (text.length() <= MIN_CHARS) {
                String trimmed = trimWorstParts(text);
                if (trimmed.length() == text.length()) {
                    int newLen = Math.max(1, text.length() / 2);
                    log.warn("Embedding request still too large at {} chars; truncating to {} chars",
                            text.length(), newLen);
                    trimmed = text.substring(0, newLen);
                } else {
                    log.warn("Embedding request too large at {} chars; trimmed to {} chars",
                            text.length(), trimmed.length());
                }
                return callModel(trimmed);
            }

            int mid = findSplitPoint(text);
            String left = text.substring(0, mid);
            String right = text.substring(mid);

            log.warn("Embedding request too large ({} chars); averaging halves of {} and {} chars",
                    text.length(), left.length(), right.length());

            float[] leftVec = embedWithFallback(left);
            float[] rightVec = embedWithFallback(right);
            if (leftVec.length == 0) {
                return rightVec;
            }
            if (rightVec.length == 0) {
                return leftVec;
            }
            if (leftVec.length != rightVec.length) {
                throw new IllegalStateException(
                        "Embedding dimension mismatch after split: left=" + leftVec.length
                                + ", right=" + rightVec.length);
            }

            float[] avg = new float[leftVec.length];
            for (int i = 0; i < avg.length; i++) {
                avg[i] = (leftVec[i] + rightVec[i]) / 2.0f;
            }
            return avg;
        }
    }

    private float[] callModel(String text) {
        EmbeddingResponse response = embeddingModel.call(new EmbeddingRequest(List.of(text), null));
        return response.getResults().get(0).getOutput();
    }

    private boolean looksLikeTooLarge(TransientAiException ex) {
        String msg = ex.getMessage();
        if (msg == null) {
            return false;
        }
        return TOO_LARGE.matcher(msg).find() || msg.contains("physical batch size");
    }

    private int findSplitPoint(String text) {
        int mid = text.length() / 2;

        int best = lastIndexBefore(text, '\n', mid, 120);
        if (best > 0) {
            return best;
        }
        best = lastIndexBefore(text, '.', mid, 120);
        if (best > 0) {
            return best + 1;
        }
        best = lastIndexBefore(text, ' ', mid, 120);
        if (best > 0) {
            return best;
        }
        return mid;
    }

    private int lastIndexBefore(String text, char ch, int from, int window) {
        int start = Math.max(0, from - window);
        for (int i = from; i >= start; i--) {
            if (text.charAt(i) == ch) {
                return i;
            }
        }
        return -1;
    }

    private String capped(String text) {
        if (text.length() > SAFETY_CAP) {
            log.warn("Embedding input exceeds SAFETY_CAP ({} > {}); truncating", text.length(), SAFETY_CAP);
            return text.substring(0, SAFETY_CAP);
        }
        return text;
    }

    private String sanitize(String text) {
        if (text == null) {
            return "";
        }
        String s = text.replace("\u0000", "");
        s = s.replaceAll("[ \\t\\x0B\\f\\r]+", " ");
        s = s.replaceAll("\\n{3,}", "\n\n");
        return s.trim();
    }

    private String trimWorstParts(String text) {
        // very long "words" are usually encoded runs from extraction
        String[] parts = text.split(" ");
        StringBuilder sb = new StringBuilder(text.length());
        for (String p : parts) {
            if (p.length() > 80) {
                continue;
            }
            sb.append(p).append(' ');
        }
        return sb.toString().trim();
    }
}
