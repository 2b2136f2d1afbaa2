package org.example.coursearchiver.media;

import java.util.Locale;

public enum ManifestFormat {
    HLS,
    DASH;

    /**
     * Guesses the format from the URL extension, ignoring query and fragment.
     *
     * @return the detected format, or {@code null} when the extension is not recognised
     */
    public static ManifestFormat fromUrl(String url) {
        if (url == null) {
            return null;
        }
        String path = url.toLowerCase(Locale.ROOT);
        int cut = path.indexOf('?');
        if (cut >= 0) {
            path = path.substring(0, cut);
        }
        cut = path.indexOf('#');
        if (cut >= 0) {
            path = path.substring(0, cut);
        }
        if (path.endsWith(".m3u8")) {
            return HLS;
        }
        if (path.endsWith(".mpd")) {
            return DASH;
        }
        return null;
    }
}
