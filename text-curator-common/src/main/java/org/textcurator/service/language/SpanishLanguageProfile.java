package org.textcurator.service.language;

import java.util.List;
import java.util.Set;

public final class SpanishLanguageProfile extends LatinScriptLanguageProfile {

    public static final String CODE = "es";

    public SpanishLanguageProfile() {
        super(CODE, "Spanish", 4.5,
                Set.of("sr.", "sra.", "srta.", "dr.", "dra.", "ud.", "uds.", "etc.", "pág.", "núm.",
                        "p.ej.", "ej.", "aprox.", "ee.uu."),
                List.of(
                        headerRule("capítulo\\s+(?:\\d+|[ivxlc]+)\\b", 1),
                        headerRule("(?:sección|parte)\\s+(?:\\d+(?:\\.\\d+)*|[ivxlc]+)\\b", 2)));
    }
}
