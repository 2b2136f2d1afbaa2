package org.example.coursearchiver.media;

import java.util.Objects;

public record ManifestRef(String url, ManifestFormat format) {

    public ManifestRef {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(format, "format");
    }

    /**
     * Builds a reference detecting the format from the URL.
     *
     * @throws IllegalArgumentException when the URL is neither HLS nor DASH
     */
    public static ManifestRef of(String url) {
        ManifestFormat format = ManifestFormat.fromUrl(url);
        if (format == null) {
            throw new IllegalArgumentException("Formato de manifiesto desconocido: " + url);
        }
        return new ManifestRef(url, format);
    }
}
