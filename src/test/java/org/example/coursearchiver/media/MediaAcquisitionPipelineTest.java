package org.example.coursearchiver.media;

import org.example.coursearchiver.browser.BrowserEngine;
import org.example.coursearchiver.config.DownloadOptions;
import org.example.coursearchiver.http.FileDownloader;
import org.example.coursearchiver.http.HttpStatusException;
import org.example.coursearchiver.retry.Retrier;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MediaAcquisitionPipelineTest {

    private static final String HLS = "https://cdn.example.com/v/master.m3u8";
    private static final String DASH = "https://cdn.example.com/v/manifest.mpd";
    private static final String PAGE = "https://example.com/clases/1234-intro/";
    private static final Logger LOGGER = Logger.getLogger(MediaAcquisitionPipelineTest.class.getName());

    @TempDir
    Path tempDir;

    private final FakeHttp http = new FakeHttp();
    private final FakeMuxer muxer = new FakeMuxer();
    private final FakeInterception interception = new FakeInterception();
    private final Retrier retrier = new Retrier(3, 10, millis -> { }, LOGGER);

    private MediaAcquisitionPipeline pipeline(BrowserEngine engine, InterceptionCapture capture) {
        return new MediaAcquisitionPipeline(new DirectManifestDownloader(http, muxer), capture, engine, retrier, LOGGER);
    }

    @Test
    void directHlsDownloadIsUsedFirst() throws Exception {
        Path output = tempDir.resolve("1. Intro.mp4");

        Path result = pipeline(BrowserEngine.CHROMIUM, interception)
                .acquire(new ManifestSet(ManifestRef.of(HLS), null), PAGE, output, DownloadOptions.defaults());

        assertEquals(output, result);
        assertTrue(Files.size(output) > 0);
        assertEquals(List.of(HLS), muxer.remuxed);
        assertEquals(0, interception.calls);
    }

    @Test
    void transientServerErrorsAreRetried() throws Exception {
        http.failures.put(HLS, new ArrayDeque<>(List.of(new HttpStatusException(503, HLS), new HttpStatusException(503, HLS))));
        Path output = tempDir.resolve("video.mp4");

        pipeline(BrowserEngine.CHROMIUM, interception)
                .acquire(new ManifestSet(ManifestRef.of(HLS), null), PAGE, output, DownloadOptions.defaults());

        assertEquals(3, http.fetches);
        assertTrue(Files.exists(output));
    }

    @Test
    void fallbackManifestIsTriedBeforeInterception() throws Exception {
        http.alwaysFail.put(HLS, 404);
        Path output = tempDir.resolve("video.mp4");

        pipeline(BrowserEngine.FIREFOX, interception)
                .acquire(new ManifestSet(ManifestRef.of(HLS), ManifestRef.of(DASH)), PAGE, output, DownloadOptions.defaults());

        assertEquals(List.of(DASH), muxer.remuxed);
        assertEquals(0, interception.calls);
    }

    @Test
    void forbiddenManifestEscalatesToInterception() throws Exception {
        http.alwaysFail.put(HLS, 403);
        muxer.forbidden.add(DASH);
        Path output = tempDir.resolve("video.mp4");

        pipeline(BrowserEngine.FIREFOX, interception)
                .acquire(new ManifestSet(ManifestRef.of(HLS), ManifestRef.of(DASH)), PAGE, output, DownloadOptions.defaults());

        assertEquals(1, interception.calls);
        assertEquals(PAGE, interception.lastPage);
        assertTrue(Files.size(output) > 0);
        assertEquals(1, http.fetches);
    }

    @Test
    void chromiumTriesHlsFirstAndKeepsDashAsFallback() throws Exception {
        Path output = tempDir.resolve("video.mp4");
        MediaAcquisitionPipeline chromium = pipeline(BrowserEngine.CHROMIUM, interception);

        assertEquals(List.of(ManifestRef.of(HLS), ManifestRef.of(DASH)),
                chromium.orderCandidates(new ManifestSet(ManifestRef.of(DASH), ManifestRef.of(HLS))));

        chromium.acquire(new ManifestSet(ManifestRef.of(DASH), ManifestRef.of(HLS)), PAGE, output, DownloadOptions.defaults());
        assertEquals(List.of(HLS), muxer.remuxed);
    }

    @Test
    void chromiumUsesDashFallbackBeforeInterception() throws Exception {
        http.alwaysFail.put(HLS, 403);
        Path output = tempDir.resolve("video.mp4");

        pipeline(BrowserEngine.CHROMIUM, interception)
                .acquire(new ManifestSet(ManifestRef.of(HLS), ManifestRef.of(DASH)), PAGE, output, DownloadOptions.defaults());

        assertEquals(List.of(DASH), muxer.remuxed);
        assertEquals(0, interception.calls);
    }

    @Test
    void undersizedRemuxIsDeletedAndCountsAsFailure() {
        muxer.bytes = 12;
        Path output = tempDir.resolve("video.mp4");

        MediaAcquisitionException error = assertThrows(MediaAcquisitionException.class,
                () -> pipeline(BrowserEngine.FIREFOX, interception)
                        .acquire(new ManifestSet(ManifestRef.of(HLS), ManifestRef.of(DASH)), PAGE, output, DownloadOptions.defaults()));

        assertEquals(List.of(HLS, DASH), muxer.remuxed);
        assertEquals(2, error.getAttempts().size());
        assertTrue(error.getAttempts().get(0).contains("demasiado pequeño"));
        assertFalse(Files.exists(output));
        assertEquals(0, interception.calls);
    }

    @Test
    void dashOnlyOnChromiumIsTerminal() {
        Path output = tempDir.resolve("video.mp4");

        MediaAcquisitionException error = assertThrows(MediaAcquisitionException.class,
                () -> pipeline(BrowserEngine.CHROMIUM, interception)
                        .acquire(new ManifestSet(ManifestRef.of(DASH), null), PAGE, output, DownloadOptions.defaults()));

        assertTrue(error.isTerminal());
        assertTrue(error.getMessage().contains("firefox"));
        assertTrue(muxer.remuxed.isEmpty());
        assertEquals(0, interception.calls);
    }

    @Test
    void nonForbiddenFailuresDoNotUseInterception() {
        http.alwaysFail.put(HLS, 404);
        Path output = tempDir.resolve("video.mp4");

        MediaAcquisitionException error = assertThrows(MediaAcquisitionException.class,
                () -> pipeline(BrowserEngine.CHROMIUM, interception)
                        .acquire(new ManifestSet(ManifestRef.of(HLS), null), PAGE, output, DownloadOptions.defaults()));

        assertFalse(error.isTerminal());
        assertEquals(1, error.getAttempts().size());
        assertTrue(error.getAttempts().get(0).contains("404"));
        assertEquals(0, interception.calls);
        assertFalse(Files.exists(output));
    }

    @Test
    void forbiddenWithoutBrowserSessionReportsEveryAttempt() {
        http.alwaysFail.put(HLS, 403);
        Path output = tempDir.resolve("video.mp4");

        MediaAcquisitionException error = assertThrows(MediaAcquisitionException.class,
                () -> pipeline(BrowserEngine.CHROMIUM, null)
                        .acquire(new ManifestSet(ManifestRef.of(HLS), null), PAGE, output, DownloadOptions.defaults()));

        assertEquals(2, error.getAttempts().size());
        assertTrue(error.getAttempts().get(1).contains("no hay sesión"));
    }

    @Test
    void failedInterceptionKeepsItsTerminalFlag() {
        http.alwaysFail.put(HLS, 403);
        interception.failure = new MediaAcquisitionException("No se capturó ningún fragmento de vídeo", true);
        Path output = tempDir.resolve("video.mp4");

        MediaAcquisitionException error = assertThrows(MediaAcquisitionException.class,
                () -> pipeline(BrowserEngine.CHROMIUM, interception)
                        .acquire(new ManifestSet(ManifestRef.of(HLS), null), PAGE, output, DownloadOptions.defaults()));

        assertTrue(error.isTerminal());
        assertEquals(2, error.getAttempts().size());
        assertTrue(error.getMessage().contains("No se capturó"));
    }

    @Test
    void existingOutputIsKeptUnlessOverwriteIsRequested() throws Exception {
        Path output = tempDir.resolve("video.mp4");
        Files.write(output, new byte[(int) MediaAcquisitionPipeline.MIN_VIDEO_BYTES + 10]);
        ManifestSet manifests = new ManifestSet(ManifestRef.of(HLS), null);

        pipeline(BrowserEngine.CHROMIUM, interception).acquire(manifests, PAGE, output, DownloadOptions.defaults());
        assertEquals(MediaAcquisitionPipeline.MIN_VIDEO_BYTES + 10, Files.size(output));
        assertEquals(0, http.fetches);

        pipeline(BrowserEngine.CHROMIUM, interception)
                .acquire(manifests, PAGE, output, new DownloadOptions("best", true, null));
        assertEquals(List.of(HLS), muxer.remuxed);
        assertEquals(FakeMuxer.DEFAULT_BYTES, Files.size(output));
    }

    @Test
    void truncatedLeftoverIsDownloadedAgain() throws Exception {
        Path output = tempDir.resolve("video.mp4");
        Files.writeString(output, "ftyp");

        pipeline(BrowserEngine.CHROMIUM, interception)
                .acquire(new ManifestSet(ManifestRef.of(HLS), null), PAGE, output, DownloadOptions.defaults());

        assertEquals(List.of(HLS), muxer.remuxed);
        assertEquals(FakeMuxer.DEFAULT_BYTES, Files.size(output));
    }

    private static final class FakeHttp implements FileDownloader {
        final Map<String, Integer> alwaysFail = new HashMap<>();
        final Map<String, Deque<IOException>> failures = new HashMap<>();
        int fetches;

        @Override
        public void download(String url, Path target) {
            throw new UnsupportedOperationException();
        }

        @Override
        public String fetchText(String url) throws IOException {
            fetches++;
            if (alwaysFail.containsKey(url)) {
                throw new HttpStatusException(alwaysFail.get(url), url);
            }
            Deque<IOException> queued = failures.get(url);
            if (queued != null && !queued.isEmpty()) {
                throw queued.poll();
            }
            return "#EXTM3U\n#EXT-X-STREAM-INF:BANDWIDTH=800000\nlow.m3u8\n";
        }
    }

    private static final class FakeMuxer implements MediaMuxer {
        static final int DEFAULT_BYTES = 150 * 1024;
        final List<String> remuxed = new ArrayList<>();
        final List<String> forbidden = new ArrayList<>();
        int bytes = DEFAULT_BYTES;

        @Override
        public void remux(String manifestUrl, Path output) throws IOException {
            if (forbidden.contains(manifestUrl)) {
                throw new MuxingException("Server returned 403 Forbidden", true);
            }
            remuxed.add(manifestUrl);
            Files.write(output, new byte[bytes]);
        }

        @Override
        public void concat(Path listFile, Path output) {
            throw new UnsupportedOperationException();
        }
    }

    private static final class FakeInterception implements InterceptionCapture {
        int calls;
        String lastPage;
        MediaAcquisitionException failure;

        @Override
        public void capture(String pageUrl, Path output) throws MediaAcquisitionException {
            calls++;
            lastPage = pageUrl;
            if (failure != null) {
                throw failure;
            }
            try {
                Files.write(output, new byte[200 * 1024]);
            } catch (IOException e) {
                throw new MediaAcquisitionException(e.getMessage(), false, e);
            }
        }
    }
}
