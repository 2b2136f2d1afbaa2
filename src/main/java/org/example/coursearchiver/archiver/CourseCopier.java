package org.example.coursearchiver.archiver;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Duplicates an already archived course into the directory of another learning path.
 */
public interface CourseCopier {

    void copy(Path source, Path target) throws IOException;
}
