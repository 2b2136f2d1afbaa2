package org.example.coursearchiver.site;

import java.util.List;

public record ChapterOutline(String title, List<UnitDraft> units) {

    public ChapterOutline {
        units = units == null ? List.of() : List.copyOf(units);
    }
}
