package org.example.coursearchiver.site;

import java.util.List;

public record LearningPathListing(String url, String title, List<String> courseUrls) {

    public LearningPathListing {
        courseUrls = courseUrls == null ? List.of() : List.copyOf(courseUrls);
    }
}
