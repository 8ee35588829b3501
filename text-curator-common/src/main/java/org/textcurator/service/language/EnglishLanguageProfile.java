package org.textcurator.service.language;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * English rules. Also the registry's fallback profile.
 *
 * <p>A sentence ends at {@code . ! ?} preceded by a letter or digit and
 * followed by whitespace and an upper-case letter, a digit, a line break or
 * the end of the text.</p>
 */
public final class EnglishLanguageProfile extends AbstractLanguageProfile {

    public static final String CODE = "en";

    private static final Pattern SENTENCE_END = Pattern.compile(
            "(?<=[\\p{L}\\p{N}])[.!?]+[\"'”’)\\]]*" +
                    "(?=\\s+[\"'“‘(\\[]?[\\p{Lu}\\p{N}]|\\s*$|[ \\t]*\\r?\\n)");

    private static final Set<String> ABBREVIATIONS = Set.of(
            "mr.", "mrs.", "ms.", "dr.", "prof.", "sr.", "jr.", "st.", "rev.", "gen.", "col.", "capt.",
            "vs.", "etc.", "e.g.", "i.e.", "cf.", "inc.", "ltd.", "co.", "corp.", "no.", "vol.", "fig.",
            "approx.", "dept.", "est.", "mt.", "ave.", "jan.", "feb.", "mar.", "apr.", "jun.", "jul.",
            "aug.", "sep.", "sept.", "oct.", "nov.", "dec.", "u.s.", "u.k.", "a.m.", "p.m.", "ph.d.",
            "et al.");

    public EnglishLanguageProfile() {
        super(CODE, "English", 4.0, SENTENCE_END, ABBREVIATIONS, List.of(
                headerRule("chapter\\s+(?:\\d+|[ivxlc]+)\\b", 1),
                headerRule("(?:section|part)\\s+(?:\\d+(?:\\.\\d+)*|[ivxlc]+)\\b", 2)));
    }
}
