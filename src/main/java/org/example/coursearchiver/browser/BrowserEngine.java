package org.example.coursearchiver.browser;

import java.util.Locale;

/**
 * Browser family driving the authenticated session. Chromium-based sessions fetch HLS reliably
 * but have DASH segments rejected by the content host's origin checks.
 */
public enum BrowserEngine {
    CHROMIUM,
    FIREFOX;

    public boolean acceptsDash() {
        return this != CHROMIUM;
    }

    public static BrowserEngine fromName(String name) {
        if (name == null || name.isBlank()) {
            return CHROMIUM;
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        if (normalized.equals("firefox") || normalized.equals("gecko")) {
            return FIREFOX;
        }
        return CHROMIUM;
    }
}
