package org.example.coursearchiver.ledger;

public class LearningPathEntry {
    private final String id;
    private String title;
    private DownloadStatus status = DownloadStatus.IN_PROGRESS;
    private int totalCourses;
    private int completedCourses;
    private int failedCourses;
    private String startedAt;
    private String completedAt;

    LearningPathEntry(String id, String title) {
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

    public int getTotalCourses() {
        return totalCourses;
    }

    void setTotalCourses(int totalCourses) {
        this.totalCourses = totalCourses;
    }

    public int getCompletedCourses() {
        return completedCourses;
    }

    void setCompletedCourses(int completedCourses) {
        this.completedCourses = completedCourses;
    }

    public int getFailedCourses() {
        return failedCourses;
    }

    void setFailedCourses(int failedCourses) {
        this.failedCourses = failedCourses;
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
}
