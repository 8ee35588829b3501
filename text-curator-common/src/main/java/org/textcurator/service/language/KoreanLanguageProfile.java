package org.textcurator.service.language;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Korean rules covering formal, polite and casual sentence endings.
 *
 * <p>Hangul is estimated at 1.5 characters per token and everything else at
 * 4.0. Sentence ends inside quotes or parentheses are ignored.</p>
 */
public final class KoreanLanguageProfile extends AbstractLanguageProfile {

    public static final String CODE = "ko";

    private static final Pattern SENTENCE_END = Pattern.compile(
            "(?<=[가-힣])(?:니다|니까|세요|에요|예요|아요|어요|거든요|잖아요|던데요|었다|았다|였다|한다|이다)"
                    + "[.?!]*(?=\\s|$)"
                    + "|[.!?。！？]+[\"'”’)\\]」』]*(?=\\s|$)");

    private static final Set<String> ABBREVIATIONS = Set.of(
            "dr.", "mr.", "mrs.", "ms.", "prof.", "cf.", "vs.", "etc.", "e.g.", "i.e.");

    private static final int HANGUL_WEIGHT = weightFor(1.5);
    private static final int OTHER_WEIGHT = weightFor(4.0);

    public KoreanLanguageProfile() {
        super(CODE, "Korean", 1.5, SENTENCE_END, ABBREVIATIONS, List.of(
                headerRule("제\\s*\\d+\\s*[장편부]", 1),
                headerRule("제\\s*\\d+\\s*절", 2),
                headerRule("제\\s*\\d+\\s*조", 3)));
    }

    @Override
    protected int weightOf(int codePoint) {
        return isHangul(codePoint) ? HANGUL_WEIGHT : OTHER_WEIGHT;
    }

    @Override
    protected BoundaryFilter boundaryFilter(String text) {
        return new QuoteTracker(text);
    }

    static boolean isHangul(int codePoint) {
        return (codePoint >= 0xAC00 && codePoint <= 0xD7A3)
                || (codePoint >= 0x1100 && codePoint <= 0x11FF)
                || (codePoint >= 0x3130 && codePoint <= 0x318F);
    }

    /**
     * Tracks quote and bracket nesting incrementally; matches arrive in ascending order.
     */
    private static final class QuoteTracker implements BoundaryFilter {

        private final String text;
        private int position;
        private int doubleQuotes;
        private int singleQuotes;
        private int curlyQuotes;
        private int cornerBrackets;
        private int parentheses;

        private QuoteTracker(String text) {
            this.text = text;
        }

        @Override
        public boolean accept(int matchStart, int matchEnd) {
            while (position < matchStart) {
                switch (text.charAt(position)) {
                    case '"' -> doubleQuotes++;
                    case '\'' -> singleQuotes++;
                    case '“' -> curlyQuotes++;
                    case '”' -> curlyQuotes = Math.max(0, curlyQuotes - 1);
                    case '「', '『' -> cornerBrackets++;
                    case '」', '』' -> cornerBrackets = Math.max(0, cornerBrackets - 1);
                    case '(', '（' -> parentheses++;
                    case ')', '）' -> parentheses = Math.max(0, parentheses - 1);
                    default -> {
                    }
                }
                position++;
            }
            boolean insideStraightQuotes = doubleQuotes % 2 == 1 || singleQuotes % 2 == 1;
            return !insideStraightQuotes && curlyQuotes == 0 && cornerBrackets == 0 && parentheses == 0;
        }
    }
}
