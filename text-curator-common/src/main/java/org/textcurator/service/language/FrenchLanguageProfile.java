package org.textcurator.service.language;

import java.util.List;
import java.util.Set;

public final class FrenchLanguageProfile extends LatinScriptLanguageProfile {

    public static final String CODE = "fr";

    public FrenchLanguageProfile() {
        super(CODE, "French", 4.5,
                Set.of("m.", "mm.", "mme.", "mlle.", "dr.", "etc.", "cf.", "env.", "p.ex.", "n°.", "av.", "apr."),
                List.of(
                        headerRule("chapitre\\s+(?:\\d+|[ivxlc]+)\\b", 1),
                        headerRule("(?:section|partie)\\s+(?:\\d+(?:\\.\\d+)*|[ivxlc]+)\\b", 2)));
    }
}
