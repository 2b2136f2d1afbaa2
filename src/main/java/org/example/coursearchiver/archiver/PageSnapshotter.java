package org.example.coursearchiver.archiver;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Saves a rendered page, such as a reading unit or a course presentation, for offline viewing.
 */
public interface PageSnapshotter {

    /**
     * @return the file actually written, which may differ in extension from {@code target}
     */
    Path snapshot(String pageUrl, Path target) throws IOException, InterruptedException;
}
