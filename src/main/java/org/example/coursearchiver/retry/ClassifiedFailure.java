package org.example.coursearchiver.retry;

/**
 * Implemented by exceptions that know whether they are worth retrying and whether they stem from
 * an access refusal by the content host.
 */
public interface ClassifiedFailure {

    boolean isForbidden();

    boolean isRetryable();
}
