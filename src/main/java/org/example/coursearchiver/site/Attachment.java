package org.example.coursearchiver.site;

public record Attachment(String name, String url) {
}
