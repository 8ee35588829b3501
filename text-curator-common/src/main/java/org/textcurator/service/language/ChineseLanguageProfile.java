package org.textcurator.service.language;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Chinese rules for simplified and traditional text.
 *
 * <p>Full-width stops and the full-width semicolon end sentences. A line
 * indented with ideographic spaces starts a new paragraph.</p>
 */
public final class ChineseLanguageProfile extends AbstractLanguageProfile {

    public static final String CODE = "zh";

    private static final Pattern SENTENCE_END = Pattern.compile(
            "[。！？；]+[”’」』）]*|[.!?;]+(?=\\s|$)");

    private static final Pattern INDENTED_PARAGRAPH = Pattern.compile("\\n(?=\\u3000{1,2}\\S)");

    private static final String NUMERAL = "[一二三四五六七八九十百千零〇\\d]+";

    public ChineseLanguageProfile() {
        super(CODE, "Chinese", 1.5, SENTENCE_END, Set.of(), List.of(
                headerRule("第" + NUMERAL + "[章编卷]", 1),
                headerRule("第" + NUMERAL + "[节節]", 2),
                headerRule("[一二三四五六七八九十]+、", 2),
                headerRule("[（(][一二三四五六七八九十]+[）)]", 3),
                headerRule("[①-⑳]", 3)));
    }

    @Override
    protected Pattern paragraphMarker() {
        return INDENTED_PARAGRAPH;
    }
}
