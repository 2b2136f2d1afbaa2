package org.example.coursearchiver.media;

import java.nio.file.Path;

/**
 * Last-resort strategy that records the video from the browser's own network traffic.
 */
public interface InterceptionCapture {

    void capture(String pageUrl, Path output) throws MediaAcquisitionException, InterruptedException;
}
