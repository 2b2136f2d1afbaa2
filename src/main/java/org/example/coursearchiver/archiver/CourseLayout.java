package org.example.coursearchiver.archiver;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Directory structure of the archive:
 * <pre>
 * &lt;root&gt;/&lt;path title&gt;/&lt;n&gt;. &lt;course&gt;/&lt;n&gt;. &lt;chapter&gt;/&lt;n&gt;. &lt;unit&gt;.mp4
 * &lt;root&gt;/&lt;course&gt;/&lt;n&gt;. &lt;chapter&gt;/&lt;n&gt;. &lt;unit&gt;.mp4
 * </pre>
 * The second form is used for courses downloaded on their own.
 */
public class CourseLayout {

    static final String PRESENTATION_FILE = "presentation.mhtml";

    private final Path outputRoot;

    public CourseLayout(@NotNull Path outputRoot) {
        this.outputRoot = Objects.requireNonNull(outputRoot, "outputRoot");
    }

    public Path courseDirectory(@Nullable PathContext path, String courseTitle) {
        if (path == null) {
            return outputRoot.resolve(FileNames.clean(courseTitle, FileNames.STANDALONE_COURSE_TITLE_MAX));
        }
        return outputRoot
                .resolve(FileNames.clean(path.title(), FileNames.PATH_TITLE_MAX))
                .resolve(FileNames.numbered(path.courseIndex(), courseTitle, FileNames.PATH_COURSE_TITLE_MAX));
    }

    public Path chapterDirectory(Path courseDirectory, int chapterIndex, String chapterTitle) {
        return courseDirectory.resolve(FileNames.numbered(chapterIndex, chapterTitle, FileNames.CHAPTER_TITLE_MAX));
    }

    public String unitBaseName(int unitIndex, String unitTitle) {
        return FileNames.numbered(unitIndex, unitTitle, FileNames.UNIT_TITLE_MAX);
    }

    public Path presentationFile(Path courseDirectory) {
        return courseDirectory.resolve(PRESENTATION_FILE);
    }

    public Path getOutputRoot() {
        return outputRoot;
    }

    /**
     * Position of a course inside the learning path being archived.
     */
    public record PathContext(String pathId, String title, int courseIndex) {
    }
}
