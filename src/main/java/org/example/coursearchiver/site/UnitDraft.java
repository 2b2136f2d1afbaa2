package org.example.coursearchiver.site;

/**
 * Unit as listed in a course outline, before its page has been visited.
 */
public record UnitDraft(String url, String title, UnitType type) {
}
