package org.example.coursearchiver.config;

import org.example.coursearchiver.browser.BrowserEngine;
import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Settings read from {@code archiver.json}. Every key is optional; the JVM properties
 * {@code archiver.checkpoint.path}, {@code archiver.ffmpeg.path} and {@code archiver.browser}
 * take precedence over the file.
 */
public class ArchiverConfig {

    public static final String CONFIG_PATH_PROPERTY = "archiver.config.path";
    public static final String CHECKPOINT_PROPERTY = "archiver.checkpoint.path";
    public static final String FFMPEG_PROPERTY = "archiver.ffmpeg.path";
    public static final String BROWSER_PROPERTY = "archiver.browser";
    public static final String DEFAULT_CONFIG_FILE = "archiver.json";

    private static final Logger LOGGER = Logger.getLogger(ArchiverConfig.class.getName());

    private String checkpointPath = "download_progress.json";
    private String outputRoot = "Courses";
    private String tempRoot = ".tmp";
    private String ffmpegPath = "ffmpeg";
    private BrowserEngine browser = BrowserEngine.CHROMIUM;
    private boolean headless;
    private String profileName = "course-archiver";
    private String chromeBinary;
    private String chromeDriver;
    private long unitDelayMillis = 1500L;
    private int retryAttempts = 5;
    private long retryBaseDelayMillis = 1000L;
    private boolean overwrite;
    private String quality = "best";

    public static ArchiverConfig load() {
        String override = System.getProperty(CONFIG_PATH_PROPERTY);
        Path file = (override != null && !override.isBlank()) ? Paths.get(override.trim()) : Paths.get(DEFAULT_CONFIG_FILE);
        return load(file);
    }

    /**
     * Reads {@code file}; a missing or malformed file yields the defaults.
     */
    public static ArchiverConfig load(Path file) {
        ArchiverConfig config = new ArchiverConfig();
        if (Files.isRegularFile(file)) {
            try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                Object parsed = new JSONParser().parse(reader);
                if (parsed instanceof JSONObject json) {
                    config.apply(json);
                } else {
                    LOGGER.warning(() -> "Configuración ignorada: " + file + " no contiene un objeto JSON");
                }
            } catch (IOException | ParseException e) {
                LOGGER.log(Level.WARNING, "No se pudo leer la configuración " + file + "; se usan valores por defecto", e);
            }
        }
        config.applySystemOverrides();
        return config;
    }

    private void apply(JSONObject json) {
        checkpointPath = stringOr(json.get("checkpointPath"), checkpointPath);
        outputRoot = stringOr(json.get("outputRoot"), outputRoot);
        tempRoot = stringOr(json.get("tempRoot"), tempRoot);
        ffmpegPath = stringOr(json.get("ffmpegPath"), ffmpegPath);
        browser = BrowserEngine.fromName(stringOr(json.get("browser"), browser.name()));
        headless = booleanOr(json.get("headless"), headless);
        profileName = stringOr(json.get("profileName"), profileName);
        chromeBinary = stringOr(json.get("chromeBinary"), chromeBinary);
        chromeDriver = stringOr(json.get("chromeDriver"), chromeDriver);
        unitDelayMillis = Math.max(0L, longOr(json.get("unitDelayMillis"), unitDelayMillis));
        retryAttempts = (int) Math.max(1L, longOr(json.get("retryAttempts"), retryAttempts));
        retryBaseDelayMillis = Math.max(0L, longOr(json.get("retryBaseDelayMillis"), retryBaseDelayMillis));
        overwrite = booleanOr(json.get("overwrite"), overwrite);
        quality = stringOr(json.get("quality"), quality);
    }

    private void applySystemOverrides() {
        checkpointPath = stringOr(System.getProperty(CHECKPOINT_PROPERTY), checkpointPath);
        ffmpegPath = stringOr(System.getProperty(FFMPEG_PROPERTY), ffmpegPath);
        String engine = System.getProperty(BROWSER_PROPERTY);
        if (engine != null && !engine.isBlank()) {
            browser = BrowserEngine.fromName(engine);
        }
    }

    public DownloadOptions toDownloadOptions() {
        return new DownloadOptions(quality, overwrite, checkpointPath);
    }

    public String getCheckpointPath() {
        return checkpointPath;
    }

    public Path getOutputRoot() {
        return Paths.get(outputRoot);
    }

    public Path getTempRoot() {
        return Paths.get(tempRoot);
    }

    public String getFfmpegPath() {
        return ffmpegPath;
    }

    public BrowserEngine getBrowser() {
        return browser;
    }

    public boolean isHeadless() {
        return headless;
    }

    public String getProfileName() {
        return profileName;
    }

    public String getChromeBinary() {
        return chromeBinary;
    }

    public String getChromeDriver() {
        return chromeDriver;
    }

    public long getUnitDelayMillis() {
        return unitDelayMillis;
    }

    public int getRetryAttempts() {
        return retryAttempts;
    }

    public long getRetryBaseDelayMillis() {
        return retryBaseDelayMillis;
    }

    public boolean isOverwrite() {
        return overwrite;
    }

    public void setOverwrite(boolean overwrite) {
        this.overwrite = overwrite;
    }

    public String getQuality() {
        return quality;
    }

    public void setQuality(String quality) {
        this.quality = quality;
    }

    public void setCheckpointPath(String checkpointPath) {
        this.checkpointPath = checkpointPath;
    }

    public void setBrowser(BrowserEngine browser) {
        this.browser = browser;
    }

    public void setHeadless(boolean headless) {
        this.headless = headless;
    }

    private static String stringOr(Object value, String fallback) {
        if (value == null) {
            return fallback;
        }
        String str = value.toString().trim();
        return str.isEmpty() ? fallback : str;
    }

    private static boolean booleanOr(Object value, boolean fallback) {
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value == null) {
            return fallback;
        }
        return Boolean.parseBoolean(value.toString().trim());
    }

    private static long longOr(Object value, long fallback) {
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value == null) {
            return fallback;
        }
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }
}
