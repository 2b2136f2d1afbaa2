package org.example.coursearchiver.site;

import java.io.IOException;

/**
 * Site-specific extraction of learning paths, course outlines and unit data. The archiver only
 * consumes the returned records and never looks at page markup itself.
 * <p>
 * Instances are created by a {@link SiteAdapterProvider} discovered with {@link java.util.ServiceLoader}.
 */
public interface SiteAdapter {

    /**
     * Checks that the authenticated session is still usable.
     */
    boolean validateSession() throws IOException;

    LearningPathListing fetchLearningPath(String pathUrl) throws IOException;

    CourseOutline fetchCourseOutline(String courseUrl) throws IOException;

    UnitRecord fetchUnit(UnitDraft draft) throws IOException;
}
