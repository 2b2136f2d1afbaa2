package org.example.coursearchiver.ledger;

/**
 * Ledger record of a single unit (video, lecture, quiz) inside a course.
 */
public class UnitEntry {
    private final String id;
    private String title;
    private DownloadStatus status = DownloadStatus.PENDING;
    private String error;
    private String startedAt;
    private String completedAt;

    UnitEntry(String id, String title) {
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

    /**
     * A unit still needs work when it never finished or finished with an error.
     */
    public boolean isPending() {
        return status == DownloadStatus.PENDING
                || status == DownloadStatus.IN_PROGRESS
                || status == DownloadStatus.FAILED;
    }
}
