package org.example.coursearchiver.site;

/**
 * WebVTT subtitle published for a video, {@code language} being a short code such as {@code es}.
 */
public record SubtitleTrack(String language, String url) {
}
