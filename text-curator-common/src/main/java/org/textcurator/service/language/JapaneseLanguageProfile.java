package org.textcurator.service.language;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Japanese rules. Polite endings followed by whitespace also close a sentence.
 */
public final class JapaneseLanguageProfile extends AbstractLanguageProfile {

    public static final String CODE = "ja";

    private static final Pattern SENTENCE_END = Pattern.compile(
            "[。！？]+[」』）]*|[.!?]+(?=\\s|$)|(?:でした|ました|です|ます)(?=\\s|$)");

    private static final Pattern INDENTED_PARAGRAPH = Pattern.compile("\\n(?=\\u3000{1,2}\\S)");

    private static final String NUMERAL = "[一二三四五六七八九十百〇\\d]+";

    public JapaneseLanguageProfile() {
        super(CODE, "Japanese", 1.5, SENTENCE_END, Set.of(), List.of(
                headerRule("第" + NUMERAL + "[章部]", 1),
                headerRule("第" + NUMERAL + "節", 2)));
    }

    @Override
    protected Pattern paragraphMarker() {
        return INDENTED_PARAGRAPH;
    }
}
