package org.example.coursearchiver.retry;

import java.util.Locale;

/**
 * Sorts failures into the classes the backoff and media fallback logic care about. Exceptions
 * implementing {@link ClassifiedFailure} decide for themselves; anything else is judged by its
 * message, walking the cause chain.
 */
public final class ErrorClassifier {

    private ErrorClassifier() {
    }

    public static boolean isForbidden(Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current instanceof ClassifiedFailure classified) {
                if (classified.isForbidden()) {
                    return true;
                }
                continue;
            }
            String message = lower(current);
            if (message.contains("403") || message.contains("forbidden")) {
                return true;
            }
        }
        return false;
    }

    public static boolean isRateLimited(Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            String message = lower(current);
            if (message.contains("429") || message.contains("rate limit") || message.contains("too many requests")) {
                return true;
            }
        }
        return false;
    }

    /**
     * Access refusals are never retried here: they are handled by the interception fallback.
     */
    public static boolean isRetryable(Throwable error) {
        if (error instanceof InterruptedException) {
            return false;
        }
        if (isForbidden(error)) {
            return false;
        }
        if (error instanceof ClassifiedFailure classified) {
            return classified.isRetryable();
        }
        return true;
    }

    private static String lower(Throwable error) {
        String message = error.getMessage();
        return message == null ? "" : message.toLowerCase(Locale.ROOT);
    }
}
