package org.example.coursearchiver.browser;

import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.openqa.selenium.firefox.FirefoxDriver;
import org.openqa.selenium.firefox.FirefoxOptions;
import org.openqa.selenium.logging.LogType;
import org.openqa.selenium.logging.LoggingPreferences;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Starts the browser that carries the logged-in session. The profile directory under
 * {@code BrowserProfiles/} persists cookies between runs, so the login performed once by the
 * user is reused.
 */
public class BrowserSessionFactory {

    private static final String PROFILES_DIR = "BrowserProfiles";
    private static final String DEFAULT_USER_AGENT =
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) "
                    + "Chrome/124.0.6367.91 Safari/537.36";

    private final Logger logger;

    public BrowserSessionFactory() {
        this(Logger.getLogger(BrowserSessionFactory.class.getName()));
    }

    public BrowserSessionFactory(Logger logger) {
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    public BrowserSession open(BrowserEngine engine, String profileName, boolean headless,
                               String chromeBinary, String chromeDriver) {
        Path profile = ensureProfileDirectory(engine, profileName);
        if (engine == BrowserEngine.FIREFOX) {
            return openFirefox(profile, headless);
        }
        return openChrome(profile, headless, chromeBinary, chromeDriver);
    }

    private BrowserSession openChrome(Path profile, boolean headless, String chromeBinary, String chromeDriver) {
        String resolvedDriver = ChromeExecutableLocator.resolveChromeDriver(chromeDriver);
        if (resolvedDriver != null) {
            System.setProperty("webdriver.chrome.driver", resolvedDriver);
            logger.fine(() -> "Usando ChromeDriver: " + resolvedDriver);
        } else {
            logger.fine("ChromeDriver no encontrado. Selenium Manager determinará la versión adecuada.");
        }

        ChromeOptions options = new ChromeOptions();
        String binary = ChromeExecutableLocator.resolveChromeBinary(chromeBinary);
        if (binary != null) {
            options.setBinary(binary);
            logger.fine(() -> "Usando binario de Chrome: " + binary);
        }
        applyHumanLikeDefaults(options, profile, headless);

        // Network events are read back from the performance log during interception capture.
        LoggingPreferences logging = new LoggingPreferences();
        logging.enable(LogType.PERFORMANCE, Level.ALL);
        options.setCapability("goog:loggingPrefs", logging);

        WebDriver driver = new ChromeDriver(options);
        maskAutomation(driver);
        logger.info(() -> "Navegador Chromium iniciado (headless=" + headless + ", perfil=" + profile + ")");
        return new SeleniumBrowserSession(driver, BrowserEngine.CHROMIUM, logger);
    }

    private BrowserSession openFirefox(Path profile, boolean headless) {
        FirefoxOptions options = new FirefoxOptions();
        options.addArguments("-profile", profile.toAbsolutePath().toString());
        if (headless) {
            options.addArguments("-headless");
        }
        options.addPreference("media.autoplay.default", 0);
        options.addPreference("media.volume_scale", "0.0");
        WebDriver driver = new FirefoxDriver(options);
        logger.info(() -> "Navegador Firefox iniciado (headless=" + headless + ", perfil=" + profile + ")");
        return new SeleniumBrowserSession(driver, BrowserEngine.FIREFOX, logger);
    }

    static void applyHumanLikeDefaults(ChromeOptions options, Path profile, boolean headless) {
        options.addArguments("--user-data-dir=" + profile.toAbsolutePath());
        options.addArguments("--profile-directory=Default");
        options.addArguments(
                "--no-sandbox",
                "--disable-dev-shm-usage",
                "--window-size=1920,1080",
                "--disable-blink-features=AutomationControlled",
                "--disable-notifications",
                "--disable-background-timer-throttling",
                "--disable-renderer-backgrounding",
                "--disable-backgrounding-occluded-windows",
                "--remote-allow-origins=*",
                "--autoplay-policy=no-user-gesture-required",
                "--mute-audio",
                "--user-agent=" + DEFAULT_USER_AGENT
        );
        if (headless) {
            options.addArguments("--headless=new");
        }

        Map<String, Object> prefs = new HashMap<>();
        prefs.put("credentials_enable_service", false);
        prefs.put("profile.password_manager_enabled", false);
        prefs.put("profile.default_content_setting_values.notifications", 2);
        options.setExperimentalOption("prefs", prefs);
        options.setExperimentalOption("excludeSwitches", Arrays.asList("enable-automation", "enable-logging"));
    }

    private void maskAutomation(WebDriver driver) {
        if (driver instanceof JavascriptExecutor executor) {
            try {
                executor.executeScript("Object.defineProperty(navigator, 'webdriver', {get: () => undefined});");
            } catch (WebDriverException e) {
                logger.fine(() -> "No se pudo ocultar navigator.webdriver: " + e.getMessage());
            }
        }
    }

    private Path ensureProfileDirectory(BrowserEngine engine, String profileName) {
        String sanitized = (profileName == null || profileName.isBlank())
                ? "default"
                : profileName.replaceAll("[^a-zA-Z0-9-_]", "_");
        Path profilePath = Paths.get(PROFILES_DIR, engine.name().toLowerCase(), sanitized);
        try {
            Files.createDirectories(profilePath);
        } catch (IOException e) {
            logger.log(Level.WARNING, "No se pudo crear el perfil del navegador " + profilePath, e);
        }
        return profilePath;
    }
}
