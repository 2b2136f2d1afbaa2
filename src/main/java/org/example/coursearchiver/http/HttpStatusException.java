package org.example.coursearchiver.http;

import org.example.coursearchiver.retry.ClassifiedFailure;

import java.io.IOException;

/**
 * Non-successful HTTP response. Keeps the status so callers can tell forbidden responses, which
 * trigger browser interception, from rate limiting and transient server errors.
 */
public class HttpStatusException extends IOException implements ClassifiedFailure {

    public static final int FORBIDDEN = 403;
    public static final int REQUEST_TIMEOUT = 408;
    public static final int TOO_MANY_REQUESTS = 429;

    private final int statusCode;
    private final String url;

    public HttpStatusException(int statusCode, String url) {
        super("HTTP " + statusCode + " en " + url);
        this.statusCode = statusCode;
        this.url = url;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getUrl() {
        return url;
    }

    @Override
    public boolean isForbidden() {
        return statusCode == FORBIDDEN;
    }

    public boolean isRateLimited() {
        return statusCode == TOO_MANY_REQUESTS;
    }

    @Override
    public boolean isRetryable() {
        return statusCode == TOO_MANY_REQUESTS
                || statusCode == REQUEST_TIMEOUT
                || (statusCode >= 500 && statusCode < 600);
    }
}
