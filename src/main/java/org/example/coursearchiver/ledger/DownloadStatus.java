package org.example.coursearchiver.ledger;

import java.util.Locale;

/**
 * Closed set of states tracked by the checkpoint ledger. The wire value is what gets written to
 * disk and must stay stable across releases, independently of the constant names.
 */
public enum DownloadStatus {
    PENDING("pending"),
    IN_PROGRESS("in_progress"),
    COMPLETED("completed"),
    FAILED("failed"),
    SKIPPED("skipped");

    private final String wireValue;

    DownloadStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    public String getWireValue() {
        return wireValue;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Maps a persisted value back to its status. Unknown or missing values fall back to
     * {@link #PENDING} so a hand-edited ledger never blocks a resume.
     */
    public static DownloadStatus fromWire(Object value) {
        if (value == null) {
            return PENDING;
        }
        String normalized = value.toString().trim().toLowerCase(Locale.ROOT);
        for (DownloadStatus status : values()) {
            if (status.wireValue.equals(normalized)) {
                return status;
            }
        }
        return PENDING;
    }
}
