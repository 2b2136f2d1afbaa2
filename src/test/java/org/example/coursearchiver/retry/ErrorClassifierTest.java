package org.example.coursearchiver.retry;

import org.example.coursearchiver.http.HttpStatusException;
import org.example.coursearchiver.media.MuxingException;
import org.example.coursearchiver.site.SiteAccessException;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ErrorClassifierTest {

    @Test
    void forbiddenIsFoundInCauseChain() {
        IOException wrapped = new IOException("falló la descarga", new HttpStatusException(403, "https://cdn/a.m3u8"));

        assertTrue(ErrorClassifier.isForbidden(wrapped));
        assertFalse(ErrorClassifier.isRetryable(wrapped));
    }

    @Test
    void forbiddenIsRecognisedInPlainMessages() {
        assertTrue(ErrorClassifier.isForbidden(new IOException("Server returned 403 Forbidden")));
        assertFalse(ErrorClassifier.isForbidden(new IOException("Connection reset")));
    }

    @Test
    void rateLimitIsRecognised() {
        assertTrue(ErrorClassifier.isRateLimited(new HttpStatusException(429, "https://x")));
        assertTrue(ErrorClassifier.isRateLimited(new IOException("rate limit exceeded")));
        assertFalse(ErrorClassifier.isRateLimited(new HttpStatusException(500, "https://x")));
    }

    @Test
    void classifiedFailuresDecideRetryability() {
        assertTrue(ErrorClassifier.isRetryable(new HttpStatusException(503, "https://x")));
        assertFalse(ErrorClassifier.isRetryable(new HttpStatusException(404, "https://x")));
        assertFalse(ErrorClassifier.isRetryable(new SiteAccessException("sin acceso")));
        assertTrue(ErrorClassifier.isRetryable(new IOException("timeout")));
        assertFalse(ErrorClassifier.isRetryable(new InterruptedException()));
    }

    @Test
    void muxerRefusalCountsAsForbidden() {
        assertTrue(ErrorClassifier.isForbidden(new MuxingException("ffmpeg terminó con código 1", true)));
        assertFalse(ErrorClassifier.isForbidden(new MuxingException("ffmpeg terminó con código 1", false)));
    }
}
