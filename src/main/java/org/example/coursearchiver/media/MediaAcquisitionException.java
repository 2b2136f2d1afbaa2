package org.example.coursearchiver.media;

import java.util.List;

/**
 * No strategy produced a playable file for a unit. {@code terminal} marks failures that a retry
 * on the same setup cannot fix, such as a manifest format the active browser engine rejects.
 */
public class MediaAcquisitionException extends Exception {

    private final boolean terminal;
    private final List<String> attempts;

    public MediaAcquisitionException(String message, boolean terminal) {
        this(message, terminal, List.of(), null);
    }

    public MediaAcquisitionException(String message, boolean terminal, Throwable cause) {
        this(message, terminal, List.of(), cause);
    }

    public MediaAcquisitionException(String message, boolean terminal, List<String> attempts, Throwable cause) {
        super(message, cause);
        this.terminal = terminal;
        this.attempts = List.copyOf(attempts);
    }

    public boolean isTerminal() {
        return terminal;
    }

    /**
     * One line per strategy tried, in order, with its failure cause.
     */
    public List<String> getAttempts() {
        return attempts;
    }
}
