package org.textcurator.service.language;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Hindi rules; the danda and double danda end sentences.
 */
public final class HindiLanguageProfile extends AbstractLanguageProfile {

    public static final String CODE = "hi";

    private static final Pattern SENTENCE_END = Pattern.compile("[।॥]+|[.!?]+(?=\\s|$)");

    public HindiLanguageProfile() {
        super(CODE, "Hindi", 3.0, SENTENCE_END, Set.of(), List.of(
                headerRule("अध्याय\\s*[\\d०-९]+", 1),
                headerRule("भाग\\s*[\\d०-९]+", 2)));
    }
}
