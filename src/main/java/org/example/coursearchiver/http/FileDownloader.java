package org.example.coursearchiver.http;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Plain HTTP access used for subtitles, attachments and manifest probing.
 */
public interface FileDownloader {

    /**
     * Downloads {@code url} into {@code target}, resuming a previous partial transfer when the
     * server allows it.
     */
    void download(String url, Path target) throws IOException, InterruptedException;

    /**
     * Fetches a small text resource such as a manifest.
     *
     * @throws HttpStatusException when the server answers with a non-successful status
     */
    String fetchText(String url) throws IOException;
}
