package org.example.coursearchiver.media.capture;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;

class SeleniumCapturePageTest {

    @Test
    void navigationTimeoutGrowsWithEachAttempt() {
        assertEquals(Duration.ofSeconds(30), SeleniumCapturePage.navigationTimeout(1));
        assertEquals(Duration.ofSeconds(45), SeleniumCapturePage.navigationTimeout(2));
        assertEquals(Duration.ofSeconds(60), SeleniumCapturePage.navigationTimeout(SeleniumCapturePage.NAVIGATION_ATTEMPTS));
    }
}
