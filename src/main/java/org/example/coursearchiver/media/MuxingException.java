package org.example.coursearchiver.media;

import org.example.coursearchiver.retry.ClassifiedFailure;

import java.io.IOException;

/**
 * The external muxer exited with an error. When its output shows the content host refused a
 * request the failure is flagged as forbidden so the pipeline can escalate to interception.
 */
public class MuxingException extends IOException implements ClassifiedFailure {

    private final boolean forbidden;

    public MuxingException(String message, boolean forbidden) {
        super(message);
        this.forbidden = forbidden;
    }

    public MuxingException(String message, Throwable cause) {
        super(message, cause);
        this.forbidden = false;
    }

    @Override
    public boolean isForbidden() {
        return forbidden;
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
