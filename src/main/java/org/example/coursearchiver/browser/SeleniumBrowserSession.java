package org.example.coursearchiver.browser;

import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

final class SeleniumBrowserSession implements BrowserSession {

    private final WebDriver driver;
    private final BrowserEngine engine;
    private final Logger logger;
    private boolean closed;

    SeleniumBrowserSession(WebDriver driver, BrowserEngine engine, Logger logger) {
        this.driver = Objects.requireNonNull(driver, "driver");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    @Override
    public WebDriver driver() {
        if (closed) {
            throw new IllegalStateException("La sesión del navegador ya está cerrada");
        }
        return driver;
    }

    @Override
    public BrowserEngine engine() {
        return engine;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            driver.quit();
        } catch (WebDriverException e) {
            logger.log(Level.WARNING, "Error cerrando el navegador: " + e.getMessage(), e);
        }
    }
}
