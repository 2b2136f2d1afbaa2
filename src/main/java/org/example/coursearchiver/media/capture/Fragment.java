package org.example.coursearchiver.media.capture;

import java.nio.file.Path;

/**
 * Transport-stream segment saved during a capture. {@code index} is the arrival order and decides
 * reassembly; {@code sequence} is parsed from the URL and only used to locate resume points.
 */
public record Fragment(int index, long size, String url, int sequence, Path file) {
}
