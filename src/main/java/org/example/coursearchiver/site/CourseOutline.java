package org.example.coursearchiver.site;

import java.util.List;

/**
 * Course table of contents. {@code accessible} is {@code false} when the account cannot open the
 * course, for instance because it requires a higher subscription tier.
 */
public record CourseOutline(String url, String title, boolean accessible, List<ChapterOutline> chapters) {

    public CourseOutline {
        chapters = chapters == null ? List.of() : List.copyOf(chapters);
    }
}
