package org.example.coursearchiver.browser;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChromeExecutableLocatorTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void clearProperties() {
        System.clearProperty(ChromeExecutableLocator.BROWSER_PROPERTY);
        System.clearProperty(ChromeExecutableLocator.DRIVER_PROPERTY);
    }

    private Path executable(String name) throws IOException {
        Path file = Files.writeString(tempDir.resolve(name), "#!/bin/sh\n");
        assertTrue(file.toFile().setExecutable(true));
        return file;
    }

    @Test
    void configuredBinaryIsUsedWhenExecutable() throws Exception {
        Path chrome = executable("chrome");

        assertEquals(chrome.toAbsolutePath().normalize().toString(),
                ChromeExecutableLocator.resolveChromeBinary(chrome.toString()));
    }

    @Test
    void jvmPropertyWinsOverConfiguration() throws Exception {
        Path configured = executable("chrome");
        Path property = executable("chromium");
        System.setProperty(ChromeExecutableLocator.BROWSER_PROPERTY, property.toString());

        assertEquals(property.toAbsolutePath().normalize().toString(),
                ChromeExecutableLocator.resolveChromeBinary(configured.toString()));
    }

    @Test
    void driverPropertyIsResolved() throws Exception {
        Path driver = executable("chromedriver");
        System.setProperty(ChromeExecutableLocator.DRIVER_PROPERTY, "  " + driver + "  ");

        assertEquals(driver.toAbsolutePath().normalize().toString(),
                ChromeExecutableLocator.resolveChromeDriver(tempDir.resolve("no-existe").toString()));
    }
}
