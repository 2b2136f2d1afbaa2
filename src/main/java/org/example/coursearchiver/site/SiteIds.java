package org.example.coursearchiver.site;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Ledger ids are the path component of the page URL, without trailing slash, so the same page
 * reached with different query strings maps to one entry.
 */
public final class SiteIds {

    private SiteIds() {
    }

    public static String fromUrl(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("URL vacía");
        }
        String path;
        try {
            path = new URI(url.trim()).getPath();
        } catch (URISyntaxException e) {
            path = null;
        }
        if (path == null || path.isBlank()) {
            path = url.trim();
        }
        while (path.length() > 1 && path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        return path;
    }
}
