package org.example.coursearchiver.browser;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Resolves the Chrome binary and ChromeDriver used by Selenium.
 * <p>
 * Candidates are checked in order: JVM property, the value from {@code archiver.json},
 * environment variables and finally common installation locations. When nothing is found
 * {@code null} is returned and Selenium Manager picks a matching browser and driver.
 */
final class ChromeExecutableLocator {

    static final String BROWSER_PROPERTY = "archiver.chrome.binary";
    static final String DRIVER_PROPERTY = "archiver.chrome.driver";
    private static final String[] ENV_BROWSER_KEYS = {
            "ARCHIVER_CHROME_BINARY",
            "CHROME_BINARY",
            "CHROME_PATH"
    };
    private static final String[] ENV_DRIVER_KEYS = {
            "ARCHIVER_CHROMEDRIVER",
            "CHROMEDRIVER",
            "CHROME_DRIVER_PATH"
    };

    private ChromeExecutableLocator() {
    }

    static String resolveChromeBinary(String configured) {
        List<String> candidates = new ArrayList<>();
        addIfPresent(candidates, System.getProperty(BROWSER_PROPERTY));
        addIfPresent(candidates, configured);
        for (String envKey : ENV_BROWSER_KEYS) {
            addIfPresent(candidates, System.getenv(envKey));
        }
        candidates.addAll(defaultBrowserCandidates());
        return firstExistingExecutable(candidates);
    }

    static String resolveChromeDriver(String configured) {
        List<String> candidates = new ArrayList<>();
        addIfPresent(candidates, System.getProperty(DRIVER_PROPERTY));
        addIfPresent(candidates, System.getProperty("webdriver.chrome.driver"));
        addIfPresent(candidates, configured);
        for (String envKey : ENV_DRIVER_KEYS) {
            addIfPresent(candidates, System.getenv(envKey));
        }
        return firstExistingExecutable(candidates);
    }

    private static List<String> defaultBrowserCandidates() {
        String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        List<String> defaults = new ArrayList<>();
        if (os.contains("win")) {
            String programFiles = System.getenv("PROGRAMFILES");
            String programFilesX86 = System.getenv("PROGRAMFILES(X86)");
            String localAppData = System.getenv("LOCALAPPDATA");
            addIfPresent(defaults, join(programFiles, "Google", "Chrome", "Application", "chrome.exe"));
            addIfPresent(defaults, join(programFilesX86, "Google", "Chrome", "Application", "chrome.exe"));
            addIfPresent(defaults, join(localAppData, "Google", "Chrome", "Application", "chrome.exe"));
        } else if (os.contains("mac")) {
            defaults.add("/Applications/Google Chrome.app/Contents/MacOS/Google Chrome");
            defaults.add("/Applications/Chromium.app/Contents/MacOS/Chromium");
        } else {
            defaults.add("/usr/bin/google-chrome");
            defaults.add("/usr/bin/chromium-browser");
            defaults.add("/usr/bin/chromium");
            defaults.add("/snap/bin/chromium");
        }
        return defaults;
    }

    private static String firstExistingExecutable(List<String> candidates) {
        for (String candidate : candidates) {
            Path normalized = Paths.get(candidate).toAbsolutePath().normalize();
            if (Files.isRegularFile(normalized) && Files.isExecutable(normalized)) {
                return normalized.toString();
            }
        }
        return null;
    }

    private static void addIfPresent(List<String> candidates, String value) {
        if (value != null) {
            String trimmed = value.trim();
            if (!trimmed.isEmpty()) {
                candidates.add(trimmed);
            }
        }
    }

    private static String join(String first, String... more) {
        if (first == null || first.isBlank()) {
            return null;
        }
        return Paths.get(first, more).toString();
    }
}
