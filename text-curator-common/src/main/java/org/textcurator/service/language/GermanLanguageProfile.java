package org.textcurator.service.language;

import java.util.List;
import java.util.Set;

/**
 * German rules. The higher characters-per-token ratio accounts for compound nouns.
 */
public final class GermanLanguageProfile extends LatinScriptLanguageProfile {

    public static final String CODE = "de";

    public GermanLanguageProfile() {
        super(CODE, "German", 5.0,
                Set.of("z.b.", "d.h.", "usw.", "bzw.", "ca.", "dr.", "nr.", "vgl.", "evtl.", "ggf.", "u.a.",
                        "inkl.", "prof.", "s.", "str.", "z.t."),
                List.of(
                        headerRule("kapitel\\s+(?:\\d+|[ivxlc]+)\\b", 1),
                        headerRule("(?:abschnitt|teil)\\s+(?:\\d+(?:\\.\\d+)*|[ivxlc]+)\\b", 2)));
    }
}
