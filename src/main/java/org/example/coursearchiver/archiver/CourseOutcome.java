package org.example.coursearchiver.archiver;

/**
 * What happened to a course during one run.
 */
public enum CourseOutcome {
    /** Already complete in the ledger for the requesting path. */
    SKIPPED,
    /** Complete under another learning path; its directory was duplicated. */
    COPIED,
    COMPLETED,
    FAILED
}
