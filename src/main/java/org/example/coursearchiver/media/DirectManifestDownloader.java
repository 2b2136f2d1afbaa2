package org.example.coursearchiver.media;

import org.example.coursearchiver.http.FileDownloader;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Downloads a manifest's streams straight from the content host. HLS playlists are fetched first
 * over HTTP, which surfaces an access refusal as a status code before the muxer is started.
 */
public class DirectManifestDownloader {

    private static final String HLS_SIGNATURE = "#EXTM3U";

    private final FileDownloader http;
    private final MediaMuxer muxer;

    public DirectManifestDownloader(FileDownloader http, MediaMuxer muxer) {
        this.http = Objects.requireNonNull(http, "http");
        this.muxer = Objects.requireNonNull(muxer, "muxer");
    }

    public void download(ManifestRef manifest, Path output) throws IOException, InterruptedException {
        if (manifest.format() == ManifestFormat.HLS) {
            String playlist = http.fetchText(manifest.url());
            if (playlist == null || !playlist.stripLeading().startsWith(HLS_SIGNATURE)) {
                throw new IOException("La respuesta no es una lista HLS válida: " + manifest.url());
            }
        }
        muxer.remux(manifest.url(), output);
    }
}
