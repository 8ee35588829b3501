package org.textcurator.service.language;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Thai rules. Thai does not separate words with spaces; a run of two or more
 * spaces between text marks a sentence break.
 */
public final class ThaiLanguageProfile extends AbstractLanguageProfile {

    public static final String CODE = "th";

    private static final Pattern SENTENCE_END = Pattern.compile(
            "[.!?]+(?=\\s|$)|(?<=\\S)(?=[ \\t]{2,}\\S)|[。！？]+");

    private static final String NUMERAL = "[\\d๐-๙]+";

    public ThaiLanguageProfile() {
        super(CODE, "Thai", 2.0, SENTENCE_END, Set.of(), List.of(
                headerRule("บทที่\\s*" + NUMERAL, 1),
                headerRule("ส่วนที่\\s*" + NUMERAL, 2),
                headerRule("ข้อ\\s*" + NUMERAL, 3)));
    }
}
