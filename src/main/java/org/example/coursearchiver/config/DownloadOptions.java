package org.example.coursearchiver.config;

/**
 * Run options passed through from the command line. {@code quality} is handed to the site adapter
 * untouched.
 */
public record DownloadOptions(String quality, boolean overwrite, String checkpointPath) {

    public static DownloadOptions defaults() {
        return new DownloadOptions("best", false, null);
    }
}
