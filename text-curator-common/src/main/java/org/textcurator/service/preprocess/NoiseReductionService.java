package org.textcurator.service.preprocess;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

/**
 * Text cleaning pipeline that removes noise from extracted document text.
 *
 * <p>Handles page numbers, headers/footers, formatting artifacts and repetitive
 * boilerplate, then applies the configured custom patterns. A custom pattern
 * that does not compile or fails while applying is skipped.</p>
 */
@Slf4j
public class NoiseReductionService implements TextPreprocessor {

    public static final String NAME = "noise-reduction";

    // Standalone page number lines: "Page 3", "- 12 -", "3/15"
    private static final Pattern PAGE_NUMBER = Pattern.compile(
            "(?m)^\\s*(?:" +
                    "(?:page|p\\.?)\\s*\\d+(?:\\s*(?:of|/)\\s*\\d+)?" +
                    "|\\d+\\s*(?:of|/)\\s*\\d+" +
                    "|-\\s*\\d+\\s*-" +
                    "|\\d{1,4}" +
                    ")\\s*$",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern HEADER_FOOTER = Pattern.compile(
            "(?m)^\\s*(?:" +
                    "(?:confidential|draft|internal use only|do not distribute|privileged)" +
                    "|(?:copyright|©)\\s*(?:\\d{4}|\\(c\\)).*" +
                    "|(?:all rights reserved).*" +
                    "|(?:printed on|generated on|last (?:updated|modified))\\s+.*" +
                    ")\\s*$",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern ENCODING_ARTIFACTS = Pattern.compile(
            "(?:" +
                    "\\u0000" +
                    "|\\cL" +
                    "|\\x{FEFF}" +
                    "|\\x{00AD}" +
                    "|[\\x{200B}-\\x{200F}]" +
                    "|[\\x{2028}\\x{2029}]" +
                    ")");

    private static final Pattern REPEATED_CHARS = Pattern.compile("(.)\\1{10,}");

    // Table of contents leaders and horizontal rules
    private static final Pattern DOT_LEADERS = Pattern.compile("[.·…]{5,}|[-_=]{5,}");

    private static final Pattern EXCESSIVE_BLANKS = Pattern.compile("\\n{4,}");

    private static final Pattern HORIZONTAL_WHITESPACE = Pattern.compile("[ \\t\\x0B\\f\\r]+");

    private final boolean aggressive;
    private final List<Pattern> removePatterns;
    private final Map<Pattern, String> replacePatterns;

    public NoiseReductionService(boolean aggressive) {
        this(aggressive, List.of(), Map.of());
    }

    /**
     * @param aggressive      also removes lines repeated across the document
     * @param removePatterns  regular expressions whose matches are deleted
     * @param replacePatterns regular expression to replacement, applied in iteration order
     */
    public NoiseReductionService(boolean aggressive, List<String> removePatterns,
                                 Map<String, String> replacePatterns) {
        this.aggressive = aggressive;
        this.removePatterns = compileAll(removePatterns);

        Map<Pattern, String> replacements = new LinkedHashMap<>();
        replacePatterns.forEach((regex, replacement) -> {
            Pattern pattern = compile(regex);
            if (pattern != null) {
                replacements.put(pattern, replacement == null ? "" : replacement);
            }
        });
        this.replacePatterns = Collections.unmodifiableMap(replacements);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String process(String text) {
        return clean(text);
    }

    /**
     * Cleans extracted text by removing noise patterns.
     *
     * @param text raw extracted text
     * @return cleaned text ready for chunking
     */
    public String clean(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }

        String result = text;

        result = ENCODING_ARTIFACTS.matcher(result).replaceAll("");
        result = REPEATED_CHARS.matcher(result).replaceAll("");

        // paragraph structure is kept, only horizontal runs collapse
        result = HORIZONTAL_WHITESPACE.matcher(result).replaceAll(" ");
        result = DOT_LEADERS.matcher(result).replaceAll(" ");

        result = PAGE_NUMBER.matcher(result).replaceAll("");
        result = HEADER_FOOTER.matcher(result).replaceAll("");

        if (aggressive) {
            result = removeRepetitiveLines(result);
        }

        result = EXCESSIVE_BLANKS.matcher(result).replaceAll("\n\n");
        result = applyCustomPatterns(result);
        result = result.trim();

        if (log.isDebugEnabled()) {
            int removed = text.length() - result.length();
            if (removed > 0) {
                log.debug("Noise reduction removed {} chars ({}% of original)",
                        removed, String.format("%.1f", 100.0 * removed / text.length()));
            }
        }

        return result;
    }

    private String applyCustomPatterns(String text) {
        String result = text;
        for (Pattern pattern : removePatterns) {
            result = applySafely(pattern, "", result);
        }
        for (Map.Entry<Pattern, String> rule : replacePatterns.entrySet()) {
            result = applySafely(rule.getKey(), rule.getValue(), result);
        }
        return result;
    }

    private String applySafely(Pattern pattern, String replacement, String text) {
        try {
            return pattern.matcher(text).replaceAll(replacement);
        } catch (IllegalArgumentException | IndexOutOfBoundsException e) {
            log.warn("Skipping custom pattern '{}' with replacement '{}': {}",
                    pattern.pattern(), replacement, e.getMessage());
            return text;
        }
    }

    private static List<Pattern> compileAll(List<String> regexes) {
        List<Pattern> patterns = new ArrayList<>(regexes.size());
        for (String regex : regexes) {
            Pattern pattern = compile(regex);
            if (pattern != null) {
                patterns.add(pattern);
            }
        }
        return Collections.unmodifiableList(patterns);
    }

    private static Pattern compile(String regex) {
        if (regex == null || regex.isEmpty()) {
            return null;
        }
        try {
            return Pattern.compile(regex, Pattern.MULTILINE);
        } catch (PatternSyntaxException e) {
            log.warn("Skipping custom pattern '{}': {}", regex, e.getDescription());
            return null;
        }
    }

    /**
     * Removes lines that appear more than a threshold number of times,
     * which typically indicates headers, footers, or watermarks.
     */
    private String removeRepetitiveLines(String text) {
        String[] lines = text.split("\\n");
        if (lines.length < 10) {
            return text;
        }

        Map<String, Long> lineCounts = Arrays.stream(lines)
                .map(String::strip)
                .filter(l -> l.length() > 3 && l.length() < 100)
                .collect(Collectors.groupingBy(l -> l, Collectors.counting()));

        // a line in more than about 15% of all lines is boilerplate
        long threshold = Math.max(3, lines.length / 7);

        Set<String> boilerplate = lineCounts.entrySet().stream()
                .filter(e -> e.getValue() >= threshold)
                .map(Map.Entry::getKey)
                .collect(Collectors.toSet());

        if (boilerplate.isEmpty()) {
            return text;
        }

        log.debug("Identified {} repetitive boilerplate patterns", boilerplate.size());

        StringBuilder sb = new StringBuilder(text.length());
        for (String line : lines) {
            if (!boilerplate.contains(line.strip())) {
                sb.append(line).append('\n');
            }
        }
        return sb.toString();
    }
}
