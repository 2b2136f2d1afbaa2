package org.example.coursearchiver.site;

import org.example.coursearchiver.retry.ClassifiedFailure;

import java.io.IOException;

/**
 * The session is not valid or the account lacks access to a resource. Never retried.
 */
public class SiteAccessException extends IOException implements ClassifiedFailure {

    public SiteAccessException(String message) {
        super(message);
    }

    @Override
    public boolean isForbidden() {
        return false;
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
