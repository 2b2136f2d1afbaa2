package org.example.coursearchiver.media;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Lossless remuxing through an external tool. Both operations copy streams without re-encoding.
 */
public interface MediaMuxer {

    /**
     * Reads a remote HLS or DASH manifest and writes its streams into {@code output}.
     */
    void remux(String manifestUrl, Path output) throws IOException, InterruptedException;

    /**
     * Concatenates the transport-stream files listed in {@code listFile}, in list order.
     */
    void concat(Path listFile, Path output) throws IOException, InterruptedException;
}
