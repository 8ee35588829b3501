package org.textcurator.service.language;

import java.util.List;
import java.util.Set;

public final class RussianLanguageProfile extends LatinScriptLanguageProfile {

    public static final String CODE = "ru";

    public RussianLanguageProfile() {
        super(CODE, "Russian", 4.0,
                Set.of("т.е.", "т.д.", "т.п.", "г.", "гг.", "др.", "им.", "ул.", "стр.", "см.", "и т.д.", "и т.п."),
                List.of(
                        headerRule("глава\\s+(?:\\d+|[ivxlc]+)", 1),
                        headerRule("(?:раздел|часть)\\s+(?:\\d+(?:\\.\\d+)*|[ivxlc]+)", 2)));
    }
}
