package org.textcurator.service.language;

import java.util.List;
import java.util.Set;

public final class VietnameseLanguageProfile extends LatinScriptLanguageProfile {

    public static final String CODE = "vi";

    public VietnameseLanguageProfile() {
        super(CODE, "Vietnamese", 4.0,
                Set.of("tp.", "ts.", "pgs.", "gs.", "ths.", "v.v."),
                List.of(
                        headerRule("chương\\s+(?:\\d+|[ivxlc]+)", 1),
                        headerRule("(?:phần|mục)\\s+(?:\\d+(?:\\.\\d+)*|[ivxlc]+)", 2),
                        headerRule("điều\\s+\\d+", 3)));
    }
}
