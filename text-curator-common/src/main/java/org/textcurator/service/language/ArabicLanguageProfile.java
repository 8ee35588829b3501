package org.textcurator.service.language;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Arabic rules; recognises the Arabic question mark and full stop.
 */
public final class ArabicLanguageProfile extends AbstractLanguageProfile {

    public static final String CODE = "ar";

    private static final Pattern SENTENCE_END = Pattern.compile("[.!?؟۔]+[\"'”»)]*(?=\\s|$)");

    public ArabicLanguageProfile() {
        super(CODE, "Arabic", 3.0, SENTENCE_END, Set.of(), List.of(
                headerRule("الفصل\\s+\\S+", 1),
                headerRule("القسم\\s+\\S+", 2)));
    }
}
