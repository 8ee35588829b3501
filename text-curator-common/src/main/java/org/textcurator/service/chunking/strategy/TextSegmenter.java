package org.textcurator.service.chunking.strategy;

import org.textcurator.service.language.LanguageProfile;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits text into structural units (sentences, paragraphs, words) using a
 * language profile. Used by multiple chunking strategies.
 *
 * <p>Segments are trimmed to their non-whitespace extent; blank segments are dropped.</p>
 */
public final class TextSegmenter {

    private TextSegmenter() {}

    /**
     * Splits {@code text[from, to)} into sentences.
     */
    public static List<TextSegment> splitSentences(String text, int from, int to, LanguageProfile profile) {
        if (from >= to) {
            return List.of();
        }
        boolean whole = from == 0 && to == text.length();
        List<Integer> boundaries = profile.findSentenceBoundaries(whole ? text : text.substring(from, to));
        return fromBoundaries(text, from, boundaries, profile);
    }

    public static List<TextSegment> splitSentences(String text, LanguageProfile profile) {
        return splitSentences(text, 0, text.length(), profile);
    }

    /**
     * Splits text into paragraphs.
     */
    public static List<TextSegment> splitParagraphs(String text, LanguageProfile profile) {
        return fromBoundaries(text, 0, profile.findParagraphBoundaries(text), profile);
    }

    /**
     * Splits {@code text[from, to)} into whitespace-delimited words. Words heavier than
     * {@code maxWeight} are cut at code point boundaries, which covers scripts written
     * without spaces.
     */
    public static List<TextSegment> splitWords(String text, int from, int to, LanguageProfile profile, long maxWeight) {
        List<TextSegment> words = new ArrayList<>();
        int i = from;
        while (i < to) {
            while (i < to && Character.isWhitespace(text.charAt(i))) {
                i++;
            }
            int start = i;
            while (i < to && !Character.isWhitespace(text.charAt(i))) {
                i++;
            }
            if (start < i) {
                addWord(text, start, i, profile, maxWeight, words);
            }
        }
        return words;
    }

    private static void addWord(String text, int start, int end, LanguageProfile profile, long maxWeight,
                                List<TextSegment> sink) {
        long weight = profile.tokenWeight(text, start, end);
        if (weight <= maxWeight) {
            sink.add(new TextSegment(start, end, weight));
            return;
        }

        int pieceStart = start;
        long pieceWeight = 0;
        int i = start;
        while (i < end) {
            int cp = text.codePointAt(i);
            int next = i + Character.charCount(cp);
            long cpWeight = profile.tokenWeight(text, i, next);
            if (pieceWeight > 0 && pieceWeight + cpWeight > maxWeight) {
                sink.add(new TextSegment(pieceStart, i, pieceWeight));
                pieceStart = i;
                pieceWeight = 0;
            }
            pieceWeight += cpWeight;
            i = next;
        }
        if (pieceStart < end) {
            sink.add(new TextSegment(pieceStart, end, pieceWeight));
        }
    }

    private static List<TextSegment> fromBoundaries(String text, int offset, List<Integer> boundaries,
                                                    LanguageProfile profile) {
        List<TextSegment> segments = new ArrayList<>(boundaries.size());
        int previous = offset;
        for (int boundary : boundaries) {
            int end = offset + boundary;
            TextSegment segment = trimmed(text, previous, end, profile);
            if (segment != null) {
                segments.add(segment);
            }
            previous = end;
        }
        return segments;
    }

    /**
     * Returns the non-whitespace extent of {@code text[start, end)}, or {@code null} when blank.
     */
    static TextSegment trimmed(String text, int start, int end, LanguageProfile profile) {
        int s = start;
        int e = end;
        while (s < e && Character.isWhitespace(text.charAt(s))) {
            s++;
        }
        while (e > s && Character.isWhitespace(text.charAt(e - 1))) {
            e--;
        }
        if (s == e) {
            return null;
        }
        return new TextSegment(s, e, profile.tokenWeight(text, s, e));
    }

    /**
     * A unit of text located by offsets into the source, with its token weight.
     */
    public record TextSegment(int startOffset, int endOffset, long weight) {

        public int length() {
            return endOffset - startOffset;
        }

        public String text(String source) {
            return source.substring(startOffset, endOffset);
        }
    }
}
