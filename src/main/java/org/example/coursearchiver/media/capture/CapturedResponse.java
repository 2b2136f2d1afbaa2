package org.example.coursearchiver.media.capture;

/**
 * Body of a network response observed in the browser.
 */
public record CapturedResponse(String url, byte[] body) {
}
