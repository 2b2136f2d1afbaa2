package org.example.coursearchiver.site;

import org.example.coursearchiver.browser.BrowserSession;

import java.util.logging.Logger;

/**
 * Service-provider entry for a {@link SiteAdapter}. Implementations are registered in
 * {@code META-INF/services/org.example.coursearchiver.site.SiteAdapterProvider}.
 */
public interface SiteAdapterProvider {

    /**
     * Whether this adapter understands pages under {@code url}.
     */
    boolean supports(String url);

    SiteAdapter create(BrowserSession session, Logger logger);
}
