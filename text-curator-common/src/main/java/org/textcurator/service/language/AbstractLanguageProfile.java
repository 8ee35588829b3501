package org.textcurator.service.language;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex-driven base for language profiles.
 *
 * <p>Subclasses supply a sentence-end pattern, an abbreviation set, heading
 * idioms and a characters-per-token ratio. Markdown headings and blank-line
 * paragraph breaks are shared by every language.</p>
 */
public abstract class AbstractLanguageProfile implements LanguageProfile {

    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\s*\\n");

    private static final Pattern MARKDOWN_HEADING = Pattern.compile(
            "^[ \\t]{0,3}(#{1,6})[ \\t]+([^\\n]*?)(?:[ \\t]+#+)?[ \\t]*$", Pattern.MULTILINE);

    /** Numbered heading lines longer than this are treated as prose. */
    private static final int MAX_HEADING_LENGTH = 120;

    private static final String CLOSING_PUNCTUATION = "\"'”’»)]」』）";

    private final String languageCode;
    private final String languageName;
    private final double charsPerToken;
    private final Pattern sentenceEnd;
    private final Set<String> abbreviations;
    private final List<HeaderRule> headerRules;
    private final int characterWeight;

    protected AbstractLanguageProfile(String languageCode,
                                      String languageName,
                                      double charsPerToken,
                                      Pattern sentenceEnd,
                                      Set<String> abbreviations,
                                      List<HeaderRule> headerRules) {
        this.languageCode = languageCode;
        this.languageName = languageName;
        this.charsPerToken = charsPerToken;
        this.sentenceEnd = sentenceEnd;
        this.abbreviations = Set.copyOf(abbreviations);
        this.headerRules = List.copyOf(headerRules);
        this.characterWeight = weightFor(charsPerToken);
    }

    @Override
    public String getLanguageCode() {
        return languageCode;
    }

    @Override
    public String getLanguageName() {
        return languageName;
    }

    @Override
    public double getCharsPerToken() {
        return charsPerToken;
    }

    @Override
    public Set<String> getAbbreviations() {
        return abbreviations;
    }

    @Override
    public List<Integer> findSentenceBoundaries(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        List<Integer> boundaries = new ArrayList<>();
        BoundaryFilter filter = boundaryFilter(text);
        Matcher matcher = sentenceEnd.matcher(text);

        while (matcher.find()) {
            int end = matcher.end();
            if (end == 0) {
                continue;
            }
            if (isAbbreviationEnding(text, end)) {
                continue;
            }
            if (!filter.accept(matcher.start(), end)) {
                continue;
            }
            if (boundaries.isEmpty() || boundaries.get(boundaries.size() - 1) < end) {
                boundaries.add(end);
            }
        }

        if (boundaries.isEmpty() || boundaries.get(boundaries.size() - 1) != text.length()) {
            boundaries.add(text.length());
        }
        return boundaries;
    }

    @Override
    public List<Integer> findParagraphBoundaries(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        List<Integer> boundaries = new ArrayList<>();
        collectMatchEnds(PARAGRAPH_BREAK, text, boundaries);
        Pattern marker = paragraphMarker();
        if (marker != null) {
            collectMatchEnds(marker, text, boundaries);
            boundaries.sort(Comparator.naturalOrder());
        }

        List<Integer> result = new ArrayList<>(boundaries.size() + 1);
        for (int boundary : boundaries) {
            if (boundary > 0 && boundary < text.length()
                    && (result.isEmpty() || result.get(result.size() - 1) < boundary)) {
                result.add(boundary);
            }
        }
        result.add(text.length());
        return result;
    }

    @Override
    public List<SectionHeader> findSectionHeaders(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        List<SectionHeader> headers = new ArrayList<>();
        Matcher markdown = MARKDOWN_HEADING.matcher(text);
        while (markdown.find()) {
            String title = markdown.group(2).strip();
            if (!title.isEmpty()) {
                headers.add(new SectionHeader(markdown.start(), markdown.end(), title, markdown.group(1).length()));
            }
        }

        for (HeaderRule rule : headerRules) {
            Matcher matcher = rule.pattern().matcher(text);
            while (matcher.find()) {
                String line = matcher.group().strip();
                if (line.isEmpty() || line.length() > MAX_HEADING_LENGTH || startsAt(headers, matcher.start())) {
                    continue;
                }
                headers.add(new SectionHeader(matcher.start(), matcher.end(), line, rule.level()));
            }
        }

        headers.sort(Comparator.comparingInt(SectionHeader::start));
        return headers;
    }

    @Override
    public long tokenWeight(CharSequence text, int start, int end) {
        if (text == null) {
            return 0;
        }
        long weight = 0;
        int i = Math.max(0, start);
        int limit = Math.min(end, text.length());
        while (i < limit) {
            int codePoint = Character.codePointAt(text, i);
            if (!isWhitespace(codePoint)) {
                weight += weightOf(codePoint);
            }
            i += Character.charCount(codePoint);
        }
        return weight;
    }

    /**
     * Weight of a single non-whitespace code point.
     */
    protected int weightOf(int codePoint) {
        return characterWeight;
    }

    /**
     * Additional marker that starts a paragraph, or {@code null} when blank lines are the only separator.
     */
    protected Pattern paragraphMarker() {
        return null;
    }

    /**
     * Per-call filter applied to every sentence-end match that is not an abbreviation.
     */
    protected BoundaryFilter boundaryFilter(String text) {
        return (matchStart, matchEnd) -> true;
    }

    protected static int weightFor(double charsPerToken) {
        return (int) Math.round(WEIGHT_PER_TOKEN / charsPerToken);
    }

    protected static boolean isWhitespace(int codePoint) {
        return Character.isWhitespace(codePoint) || Character.isSpaceChar(codePoint);
    }

    /**
     * Builds a whole-line heading rule from the pattern matching the start of the line.
     */
    protected static HeaderRule headerRule(String linePrefix, int level) {
        Pattern pattern = Pattern.compile("^[ \\t]*(?:" + linePrefix + ")[^\\n]*$",
                Pattern.MULTILINE | Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        return new HeaderRule(pattern, level);
    }

    private boolean isAbbreviationEnding(String text, int end) {
        if (abbreviations.isEmpty()) {
            return false;
        }
        int wordEnd = end;
        while (wordEnd > 0 && CLOSING_PUNCTUATION.indexOf(text.charAt(wordEnd - 1)) >= 0) {
            wordEnd--;
        }
        if (wordEnd == 0 || text.charAt(wordEnd - 1) != '.') {
            return false;
        }

        int wordStart = wordEnd;
        while (wordStart > 0 && !Character.isWhitespace(text.charAt(wordStart - 1))) {
            wordStart--;
        }
        String word = stripOpening(text.substring(wordStart, wordEnd)).toLowerCase(Locale.ROOT);
        if (abbreviations.contains(word)) {
            return true;
        }

        int previousEnd = wordStart;
        while (previousEnd > 0 && Character.isWhitespace(text.charAt(previousEnd - 1))) {
            previousEnd--;
        }
        int previousStart = previousEnd;
        while (previousStart > 0 && !Character.isWhitespace(text.charAt(previousStart - 1))) {
            previousStart--;
        }
        if (previousStart == previousEnd) {
            return false;
        }
        String twoWords = stripOpening(text.substring(previousStart, previousEnd)).toLowerCase(Locale.ROOT) + " " + word;
        return abbreviations.contains(twoWords);
    }

    private static String stripOpening(String word) {
        int i = 0;
        while (i < word.length() && "\"'“‘«([「『（".indexOf(word.charAt(i)) >= 0) {
            i++;
        }
        return word.substring(i);
    }

    private static void collectMatchEnds(Pattern pattern, String text, List<Integer> sink) {
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            sink.add(matcher.end());
        }
    }

    private static boolean startsAt(List<SectionHeader> headers, int start) {
        for (SectionHeader header : headers) {
            if (header.start() == start) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return languageName + " (" + languageCode + ")";
    }

    /**
     * Whole-line heading idiom and the depth it denotes.
     */
    protected record HeaderRule(Pattern pattern, int level) {
    }

    /**
     * Accepts or rejects a sentence-end match.
     */
    @FunctionalInterface
    protected interface BoundaryFilter {
        boolean accept(int matchStart, int matchEnd);
    }
}
