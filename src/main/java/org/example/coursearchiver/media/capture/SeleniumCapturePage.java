package org.example.coursearchiver.media.capture;

import org.example.coursearchiver.browser.BrowserSession;
import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;
import org.openqa.selenium.By;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.OutputType;
import org.openqa.selenium.TakesScreenshot;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WindowType;
import org.openqa.selenium.chromium.HasCdp;
import org.openqa.selenium.logging.LogEntry;
import org.openqa.selenium.logging.LogType;
import org.openqa.selenium.support.ui.ExpectedConditions;
import org.openqa.selenium.support.ui.WebDriverWait;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link CapturePage} on a Chromium session. Network events are read from the driver's
 * performance log, which the session enables at start-up, and response bodies are pulled through
 * the DevTools {@code Network.getResponseBody} command once a request has finished loading.
 * Everything runs on the caller's thread.
 */
final class SeleniumCapturePage implements CapturePage {

    static final int NAVIGATION_ATTEMPTS = 3;
    private static final Duration NAVIGATION_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration NAVIGATION_TIMEOUT_STEP = Duration.ofSeconds(15);
    private static final double PLAYBACK_RATE = 4.0;

    private static final String PREPARE_PLAYBACK_SCRIPT =
            "const v = document.querySelector('video');"
                    + "if (!v) { return false; }"
                    + "v.muted = true; v.volume = 0; v.playbackRate = arguments[1];"
                    + "try { v.currentTime = arguments[0]; } catch (e) {}"
                    + "const p = v.play(); if (p && p.catch) { p.catch(() => {}); }"
                    + "return true;";

    private static final String PLAYBACK_STATE_SCRIPT =
            "const v = document.querySelector('video');"
                    + "if (!v) { return null; }"
                    + "let d = v.duration;"
                    + "if (!isFinite(d) || d <= 0) {"
                    + "  const label = document.querySelector('.vjs-duration-display');"
                    + "  if (label) {"
                    + "    const parts = label.textContent.replace(/[^0-9:]/g, '').split(':').map(Number);"
                    + "    d = parts.reduce((acc, n) => acc * 60 + n, 0);"
                    + "  }"
                    + "}"
                    + "let b = 0;"
                    + "for (let i = 0; i < v.buffered.length; i++) {"
                    + "  if (v.buffered.start(i) <= v.currentTime + 1) { b = Math.max(b, v.buffered.end(i)); }"
                    + "}"
                    + "return [v.currentTime, (isFinite(d) && d > 0) ? d : -1, b, v.paused, v.ended];";

    private final WebDriver driver;
    private final HasCdp cdp;
    private final String originalWindow;
    private final Logger logger;
    private final Map<String, String> pendingFragments = new LinkedHashMap<>();

    private SeleniumCapturePage(WebDriver driver, HasCdp cdp, Logger logger) {
        this.driver = driver;
        this.cdp = cdp;
        this.logger = logger;
        this.originalWindow = driver.getWindowHandle();
    }

    /**
     * Returns an opener that creates pages in a new tab of {@code session}.
     */
    static CapturePage.Opener opener(BrowserSession session, Logger logger) {
        return pageUrl -> {
            WebDriver driver = session.driver();
            if (!(driver instanceof HasCdp cdp)) {
                throw new IOException("La intercepción requiere un navegador Chromium; el motor activo es "
                        + session.engine());
            }
            SeleniumCapturePage page = new SeleniumCapturePage(driver, cdp, logger);
            page.open(pageUrl);
            return page;
        };
    }

    private void open(String pageUrl) throws IOException {
        try {
            driver.switchTo().newWindow(WindowType.TAB);
            // Discard events recorded before this tab existed.
            driver.manage().logs().get(LogType.PERFORMANCE);
        } catch (WebDriverException e) {
            throw new IOException("No se pudo abrir una pestaña para la captura: " + e.getMessage(), e);
        }
        WebDriverException lastError = null;
        for (int attempt = 1; attempt <= NAVIGATION_ATTEMPTS; attempt++) {
            Duration timeout = navigationTimeout(attempt);
            try {
                driver.manage().timeouts().pageLoadTimeout(timeout);
                driver.get(pageUrl);
                waitForPlayer(timeout);
                logger.fine(() -> "Página de captura abierta: " + pageUrl);
                return;
            } catch (TimeoutException e) {
                lastError = e;
                int failedAttempt = attempt;
                logger.warning(() -> "La página no cargó en " + timeout.toSeconds() + " s (intento "
                        + failedAttempt + "/" + NAVIGATION_ATTEMPTS + "): " + pageUrl);
            } catch (WebDriverException e) {
                lastError = e;
                break;
            }
        }
        collectDebugArtifacts("apertura-fallida");
        close();
        throw new IOException("No se pudo abrir la página de la unidad: " + lastError.getMessage(), lastError);
    }

    /**
     * Thirty seconds for the first attempt, fifteen more for each retry.
     */
    static Duration navigationTimeout(int attempt) {
        return NAVIGATION_TIMEOUT.plus(NAVIGATION_TIMEOUT_STEP.multipliedBy(Math.max(0, attempt - 1)));
    }

    @Override
    public void startPlayback(double fromSeconds) throws IOException {
        try {
            Object prepared = ((JavascriptExecutor) driver).executeScript(PREPARE_PLAYBACK_SCRIPT, fromSeconds, PLAYBACK_RATE);
            if (!Boolean.TRUE.equals(prepared)) {
                collectDebugArtifacts("video-no-encontrado");
                throw new IOException("No se encontró el elemento de vídeo en la página");
            }
        } catch (WebDriverException e) {
            throw new IOException("No se pudo iniciar la reproducción: " + e.getMessage(), e);
        }
    }

    @Override
    public List<CapturedResponse> drainResponses() throws IOException {
        List<CapturedResponse> responses = new ArrayList<>();
        List<LogEntry> entries;
        try {
            entries = driver.manage().logs().get(LogType.PERFORMANCE).getAll();
        } catch (WebDriverException e) {
            throw new IOException("No se pudo leer el registro de red del navegador: " + e.getMessage(), e);
        }
        JSONParser parser = new JSONParser();
        for (LogEntry entry : entries) {
            JSONObject message;
            try {
                Object parsed = parser.parse(entry.getMessage());
                if (!(parsed instanceof JSONObject root) || !(root.get("message") instanceof JSONObject inner)) {
                    continue;
                }
                message = inner;
            } catch (ParseException e) {
                logger.log(Level.FINEST, "Evento de red ilegible", e);
                continue;
            }
            Object method = message.get("method");
            if (!(message.get("params") instanceof JSONObject params)) {
                continue;
            }
            if ("Network.responseReceived".equals(method)) {
                onResponseReceived(params);
            } else if ("Network.loadingFinished".equals(method)) {
                CapturedResponse response = onLoadingFinished(params);
                if (response != null) {
                    responses.add(response);
                }
            } else if ("Network.loadingFailed".equals(method)) {
                pendingFragments.remove(String.valueOf(params.get("requestId")));
            }
        }
        return responses;
    }

    private void onResponseReceived(JSONObject params) {
        if (!(params.get("response") instanceof JSONObject response)) {
            return;
        }
        String url = String.valueOf(response.get("url"));
        Object status = response.get("status");
        if (!(status instanceof Number number) || number.intValue() != 200 || !FragmentStore.isFragmentUrl(url)) {
            return;
        }
        pendingFragments.put(String.valueOf(params.get("requestId")), url);
    }

    private CapturedResponse onLoadingFinished(JSONObject params) {
        String requestId = String.valueOf(params.get("requestId"));
        String url = pendingFragments.remove(requestId);
        if (url == null) {
            return null;
        }
        try {
            Map<String, Object> body = cdp.executeCdpCommand("Network.getResponseBody", Map.of("requestId", requestId));
            Object data = body.get("body");
            if (data == null) {
                return null;
            }
            byte[] bytes = Boolean.TRUE.equals(body.get("base64Encoded"))
                    ? Base64.getDecoder().decode(data.toString())
                    : data.toString().getBytes(StandardCharsets.ISO_8859_1);
            return new CapturedResponse(url, bytes);
        } catch (WebDriverException | IllegalArgumentException e) {
            logger.log(Level.WARNING, "No se pudo recuperar el cuerpo del fragmento " + url + ": " + e.getMessage());
            return null;
        }
    }

    @Override
    public PlaybackState playbackState() {
        try {
            Object result = ((JavascriptExecutor) driver).executeScript(PLAYBACK_STATE_SCRIPT);
            if (!(result instanceof List<?> values) || values.size() < 5) {
                return PlaybackState.UNKNOWN;
            }
            return new PlaybackState(
                    asDouble(values.get(0)),
                    asDouble(values.get(1)),
                    asDouble(values.get(2)),
                    Boolean.TRUE.equals(values.get(3)),
                    Boolean.TRUE.equals(values.get(4)));
        } catch (WebDriverException e) {
            logger.fine(() -> "No se pudo leer el estado del reproductor: " + e.getMessage());
            return PlaybackState.UNKNOWN;
        }
    }

    @Override
    public void seek(double seconds) throws IOException {
        runScript("const v = document.querySelector('video'); if (v) { v.currentTime = arguments[0]; }", seconds);
    }

    @Override
    public void pause() throws IOException {
        runScript("const v = document.querySelector('video'); if (v) { v.pause(); }");
    }

    @Override
    public void reload(double resumeAt) throws IOException {
        try {
            driver.navigate().refresh();
            waitForPlayer(NAVIGATION_TIMEOUT);
        } catch (WebDriverException e) {
            collectDebugArtifacts("recarga-fallida");
            throw new IOException("No se pudo recargar la página: " + e.getMessage(), e);
        }
        startPlayback(resumeAt);
    }

    @Override
    public void close() {
        try {
            if (!driver.getWindowHandle().equals(originalWindow)) {
                driver.close();
            }
            driver.switchTo().window(originalWindow);
        } catch (WebDriverException e) {
            logger.log(Level.WARNING, "Error cerrando la pestaña de captura: " + e.getMessage());
        }
    }

    private void waitForPlayer(Duration timeout) {
        try {
            new WebDriverWait(driver, timeout).until(ExpectedConditions.presenceOfElementLocated(By.tagName("video")));
        } catch (TimeoutException e) {
            logger.fine(() -> "No apareció el reproductor en " + timeout.toSeconds() + " s");
            throw e;
        }
    }

    private void runScript(String script, Object... args) throws IOException {
        try {
            ((JavascriptExecutor) driver).executeScript(script, args);
        } catch (WebDriverException e) {
            throw new IOException("Error ejecutando script en el reproductor: " + e.getMessage(), e);
        }
    }

    private static double asDouble(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        return -1;
    }

    private void collectDebugArtifacts(String reason) {
        Path debugDir = Paths.get("debug");
        long stamp = System.currentTimeMillis();
        try {
            Files.createDirectories(debugDir);
            Path source = debugDir.resolve("captura-" + reason + "-" + stamp + ".html");
            Files.writeString(source, driver.getPageSource(), StandardCharsets.UTF_8);
            logger.info(() -> "Volcado del DOM guardado en: " + source.toAbsolutePath());
            if (driver instanceof TakesScreenshot screenshots) {
                File screenshot = screenshots.getScreenshotAs(OutputType.FILE);
                Path target = debugDir.resolve("captura-" + reason + "-" + stamp + ".png");
                Files.copy(screenshot.toPath(), target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException | WebDriverException e) {
            logger.log(Level.FINE, "No se pudieron guardar los artefactos de depuración: " + e.getMessage());
        }
    }
}
