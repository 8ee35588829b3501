package org.textcurator.service.language;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Shared sentence rule for the European languages that use {@code . ! ? …}
 * followed by whitespace.
 */
abstract class LatinScriptLanguageProfile extends AbstractLanguageProfile {

    private static final Pattern SENTENCE_END = Pattern.compile(
            "[.!?…]+[\"'”’»)\\]]*(?=\\s|$)");

    LatinScriptLanguageProfile(String languageCode,
                               String languageName,
                               double charsPerToken,
                               Set<String> abbreviations,
                               List<HeaderRule> headerRules) {
        super(languageCode, languageName, charsPerToken, SENTENCE_END, abbreviations, headerRules);
    }
}
