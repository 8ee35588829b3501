package org.textcurator.service.language;

import java.util.List;
import java.util.Set;

/**
 * Boundary detection and token estimation rules for one language.
 *
 * <p>Implementations are immutable and safe for concurrent use. None of the
 * methods throw for malformed input: {@code null} or empty text yields an
 * empty result or zero.</p>
 *
 * <p>Token volume is measured as an additive fixed-point <em>weight</em>:
 * each non-whitespace character contributes {@code WEIGHT_PER_TOKEN / charsPerToken}
 * units and whitespace contributes nothing, so the weight of a concatenation is
 * the sum of its parts. {@link #estimateTokenCount(CharSequence)} rounds the
 * weight up to whole tokens.</p>
 */
public interface LanguageProfile {

    /** Weight units that make up one estimated token. */
    int WEIGHT_PER_TOKEN = 180;

    String getLanguageCode();

    String getLanguageName();

    /**
     * Average number of non-whitespace characters per token for this language's script.
     */
    double getCharsPerToken();

    /**
     * Lower-cased words ending in a stop character that do not end a sentence.
     */
    Set<String> getAbbreviations();

    /**
     * Finds sentence ends.
     *
     * @return ascending offsets just past each sentence; the last one is always {@code text.length()}
     */
    List<Integer> findSentenceBoundaries(String text);

    /**
     * Finds paragraph starts after blank lines or language-specific paragraph markers.
     *
     * @return ascending offsets; the last one is always {@code text.length()}
     */
    List<Integer> findParagraphBoundaries(String text);

    /**
     * Finds heading lines in document order.
     */
    List<SectionHeader> findSectionHeaders(String text);

    /**
     * Measures the token weight of {@code text[start, end)}.
     */
    long tokenWeight(CharSequence text, int start, int end);

    default long tokenWeight(CharSequence text) {
        return text == null ? 0 : tokenWeight(text, 0, text.length());
    }

    default int estimateTokenCount(CharSequence text) {
        return toTokenCount(tokenWeight(text));
    }

    static int toTokenCount(long weight) {
        return (int) ((weight + WEIGHT_PER_TOKEN - 1) / WEIGHT_PER_TOKEN);
    }

    static long toWeight(int tokens) {
        return (long) tokens * WEIGHT_PER_TOKEN;
    }
}
