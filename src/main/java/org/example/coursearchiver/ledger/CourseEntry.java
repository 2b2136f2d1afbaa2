package org.example.coursearchiver.ledger;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Ledger record of a course. A course can belong to several learning paths; its units keep the
 * order in which they were first visited.
 */
public class CourseEntry {
    private final String id;
    private String title;
    private DownloadStatus status = DownloadStatus.PENDING;
    private String error;
    private String outputDirectory;
    private String startedAt;
    private String completedAt;
    private final Set<String> learningPathIds = new LinkedHashSet<>();
    private final Map<String, UnitEntry> units = new LinkedHashMap<>();

    CourseEntry(String id, String title) {
        this.id = id;
        this.title = title;
    }

    public String getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    void setTitle(String title) {
        this.title = title;
    }

    public DownloadStatus getStatus() {
        return status;
    }

    void setStatus(DownloadStatus status) {
        this.status = status;
    }

    public String getError() {
        return error;
    }

    void setError(String error) {
        this.error = error;
    }

    public String getOutputDirectory() {
        return outputDirectory;
    }

    void setOutputDirectory(String outputDirectory) {
        this.outputDirectory = outputDirectory;
    }

    public String getStartedAt() {
        return startedAt;
    }

    void setStartedAt(String startedAt) {
        this.startedAt = startedAt;
    }

    public String getCompletedAt() {
        return completedAt;
    }

    void setCompletedAt(String completedAt) {
        this.completedAt = completedAt;
    }

    public Set<String> getLearningPathIds() {
        return Collections.unmodifiableSet(learningPathIds);
    }

    boolean addLearningPathId(String pathId) {
        if (pathId == null || pathId.isBlank()) {
            return false;
        }
        return learningPathIds.add(pathId);
    }

    public Collection<UnitEntry> getUnits() {
        return Collections.unmodifiableCollection(units.values());
    }

    public UnitEntry getUnit(String unitId) {
        return units.get(unitId);
    }

    void putUnit(UnitEntry unit) {
        units.put(unit.getId(), unit);
    }

    public long countUnits(DownloadStatus status) {
        return units.values().stream().filter(unit -> unit.getStatus() == status).count();
    }

    public boolean hasPendingUnits() {
        return units.values().stream().anyMatch(UnitEntry::isPending);
    }
}
