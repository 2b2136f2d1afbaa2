package org.example.coursearchiver.archiver;

import org.example.coursearchiver.browser.BrowserSession;
import org.example.coursearchiver.retry.Sleeper;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WindowType;
import org.openqa.selenium.chromium.HasCdp;
import org.openqa.selenium.support.ui.WebDriverWait;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Page snapshots taken in a separate tab of the authenticated browser. Chromium produces a single
 * MHTML file through DevTools; other engines fall back to the rendered HTML source, written with
 * an {@code .html} extension.
 */
public class SeleniumPageSnapshotter implements PageSnapshotter {

    private static final Duration LOAD_TIMEOUT = Duration.ofSeconds(30);
    private static final long SETTLE_MILLIS = 1000L;

    private final BrowserSession session;
    private final Sleeper sleeper;
    private final Logger logger;

    public SeleniumPageSnapshotter(BrowserSession session, Logger logger) {
        this(session, Sleeper.SYSTEM, logger);
    }

    SeleniumPageSnapshotter(BrowserSession session, Sleeper sleeper, Logger logger) {
        this.session = Objects.requireNonNull(session, "session");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    @Override
    public Path snapshot(String pageUrl, Path target) throws IOException, InterruptedException {
        WebDriver driver = session.driver();
        String originalWindow = driver.getWindowHandle();
        try {
            driver.switchTo().newWindow(WindowType.TAB);
            driver.get(pageUrl);
            waitForDocument(driver);
            sleeper.sleep(SETTLE_MILLIS);
            Files.createDirectories(target.toAbsolutePath().getParent());
            if (driver instanceof HasCdp cdp) {
                Map<String, Object> result = cdp.executeCdpCommand("Page.captureSnapshot", Map.of("format", "mhtml"));
                Object data = result.get("data");
                if (data != null) {
                    Files.writeString(target, data.toString(), StandardCharsets.UTF_8);
                    logger.fine(() -> "Instantánea MHTML guardada: " + target.getFileName());
                    return target;
                }
                logger.warning(() -> "El navegador no devolvió MHTML para " + pageUrl + "; se guarda el HTML");
            }
            Path html = withHtmlExtension(target);
            Files.writeString(html, driver.getPageSource(), StandardCharsets.UTF_8);
            logger.fine(() -> "HTML renderizado guardado: " + html.getFileName());
            return html;
        } catch (WebDriverException e) {
            throw new IOException("No se pudo guardar la página " + pageUrl + ": " + e.getMessage(), e);
        } finally {
            closeTab(driver, originalWindow);
        }
    }

    private void waitForDocument(WebDriver driver) {
        try {
            new WebDriverWait(driver, LOAD_TIMEOUT).until(d ->
                    "complete".equals(((JavascriptExecutor) d).executeScript("return document.readyState")));
        } catch (TimeoutException e) {
            // Slow pages are still saved with whatever has rendered.
            logger.fine(() -> "La página no terminó de cargar en " + LOAD_TIMEOUT.toSeconds() + " s");
        }
    }

    static Path withHtmlExtension(Path target) {
        String name = target.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        return target.resolveSibling(base + ".html");
    }

    private void closeTab(WebDriver driver, String originalWindow) {
        try {
            if (!driver.getWindowHandle().equals(originalWindow)) {
                driver.close();
            }
            driver.switchTo().window(originalWindow);
        } catch (WebDriverException e) {
            logger.log(Level.WARNING, "Error cerrando la pestaña de la instantánea: " + e.getMessage());
        }
    }
}
