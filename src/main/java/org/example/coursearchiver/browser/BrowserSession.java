package org.example.coursearchiver.browser;

import org.openqa.selenium.WebDriver;

/**
 * Authenticated browser shared by capture and page snapshots. One page context is active at a time.
 */
public interface BrowserSession extends AutoCloseable {

    WebDriver driver();

    BrowserEngine engine();

    @Override
    void close();
}
