package org.example.coursearchiver.ledger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory image of the persisted document. Owned by a single {@link CheckpointStore}.
 */
final class Ledger {
    static final String VERSION = "2.0";

    String startedAt;
    String lastUpdated;
    final Map<String, LearningPathEntry> learningPaths = new LinkedHashMap<>();
    final Map<String, CourseEntry> courses = new LinkedHashMap<>();
    final List<ErrorRecord> errors = new ArrayList<>();
    final LedgerStatistics statistics = new LedgerStatistics();
}
