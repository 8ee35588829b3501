package org.textcurator.service.language;

import java.util.List;
import java.util.Set;

public final class PortugueseLanguageProfile extends LatinScriptLanguageProfile {

    public static final String CODE = "pt";

    public PortugueseLanguageProfile() {
        super(CODE, "Portuguese", 4.5,
                Set.of("sr.", "sra.", "dr.", "dra.", "etc.", "p.ex.", "pág.", "av.", "prof.", "nº."),
                List.of(
                        headerRule("capítulo\\s+(?:\\d+|[ivxlc]+)\\b", 1),
                        headerRule("(?:seção|secção|parte)\\s+(?:\\d+(?:\\.\\d+)*|[ivxlc]+)\\b", 2)));
    }
}
