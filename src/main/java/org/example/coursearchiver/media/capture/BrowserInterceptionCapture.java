package org.example.coursearchiver.media.capture;

import org.example.coursearchiver.browser.BrowserSession;
import org.example.coursearchiver.media.InterceptionCapture;
import org.example.coursearchiver.media.MediaAcquisitionPipeline;
import org.example.coursearchiver.media.MediaAcquisitionException;
import org.example.coursearchiver.media.MediaMuxer;
import org.example.coursearchiver.retry.Sleeper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.LongSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * Records a video from the browser's own traffic when the content host refuses direct manifest
 * downloads. The page plays muted at high speed while every transport-stream response is saved;
 * once {@link CaptureMonitor} ends the session the fragments are concatenated, in arrival order,
 * into the destination file. The temporary directory is removed whatever the outcome.
 */
public class BrowserInterceptionCapture implements InterceptionCapture {

    static final long POLL_INTERVAL_MS = 1000L;
    static final long MIN_OUTPUT_BYTES = MediaAcquisitionPipeline.MIN_VIDEO_BYTES;
    private static final String WORK_DIR_PREFIX = "browser_intercept_";

    private final CapturePage.Opener opener;
    private final MediaMuxer muxer;
    private final Path tempRoot;
    private final Sleeper sleeper;
    private final LongSupplier clock;
    private final Logger logger;

    public BrowserInterceptionCapture(BrowserSession session, MediaMuxer muxer, Path tempRoot, Logger logger) {
        this(SeleniumCapturePage.opener(session, logger), muxer, tempRoot, Sleeper.SYSTEM,
                System::currentTimeMillis, logger);
    }

    BrowserInterceptionCapture(CapturePage.Opener opener,
                               MediaMuxer muxer,
                               Path tempRoot,
                               Sleeper sleeper,
                               LongSupplier clock,
                               Logger logger) {
        this.opener = Objects.requireNonNull(opener, "opener");
        this.muxer = Objects.requireNonNull(muxer, "muxer");
        this.tempRoot = Objects.requireNonNull(tempRoot, "tempRoot");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    @Override
    public void capture(String pageUrl, Path output) throws MediaAcquisitionException, InterruptedException {
        Path workDir;
        try {
            Files.createDirectories(tempRoot);
            workDir = Files.createTempDirectory(tempRoot, WORK_DIR_PREFIX + clock.getAsLong() + "_");
        } catch (IOException e) {
            throw new MediaAcquisitionException("No se pudo crear el directorio temporal en " + tempRoot, false, e);
        }

        try {
            FragmentStore store = new FragmentStore(workDir);
            CaptureDecision finish = record(pageUrl, store);
            logger.info(() -> "Captura finalizada: " + finish.reason() + " (" + store.size() + " fragmentos)");
            reassemble(store, finish.keep(), output);
        } finally {
            deleteRecursively(workDir);
        }
    }

    private CaptureDecision record(String pageUrl, FragmentStore store)
            throws MediaAcquisitionException, InterruptedException {
        try (CapturePage page = opener.open(pageUrl)) {
            page.startPlayback(0);
            CaptureMonitor monitor = new CaptureMonitor(clock.getAsLong());
            while (true) {
                sleeper.sleep(POLL_INTERVAL_MS);
                for (CapturedResponse response : page.drainResponses()) {
                    store.add(response);
                }
                PlaybackState state = page.playbackState();
                CaptureDecision decision = monitor.evaluate(clock.getAsLong(), state, store.size(), store.highestSequence());
                switch (decision.action()) {
                    case CONTINUE:
                        break;
                    case SEEK:
                        logger.fine(() -> String.format("Salto a %.1f s: %s", decision.position(), decision.reason()));
                        page.seek(decision.position());
                        break;
                    case PAUSE:
                        logger.fine(decision::reason);
                        page.pause();
                        break;
                    case RELOAD:
                        logger.warning(() -> String.format("Recargando la página y reanudando en %.1f s: %s",
                                decision.position(), decision.reason()));
                        page.reload(decision.position());
                        break;
                    case STOP:
                        return decision;
                    case FAIL:
                        throw new MediaAcquisitionException(decision.reason(), store.size() == 0);
                    default:
                        throw new IllegalStateException("Acción desconocida: " + decision.action());
                }
            }
        } catch (IOException e) {
            throw new MediaAcquisitionException("Error durante la captura en el navegador: " + e.getMessage(), false, e);
        }
    }

    private void reassemble(FragmentStore store, int keep, Path output) throws MediaAcquisitionException, InterruptedException {
        if (keep <= 0) {
            throw new MediaAcquisitionException("No se capturó ningún fragmento de vídeo", true);
        }
        try {
            Path list = store.writeConcatList(keep);
            muxer.concat(list, output);
        } catch (IOException e) {
            throw new MediaAcquisitionException("No se pudieron unir los fragmentos: " + e.getMessage(), true, e);
        }
        long size = sizeOf(output);
        if (size < MIN_OUTPUT_BYTES) {
            deleteQuietly(output);
            throw new MediaAcquisitionException("El vídeo unido es demasiado pequeño (" + size + " bytes)", true);
        }
        List<Fragment> used = store.fragments().subList(0, Math.min(keep, store.size()));
        logger.info(() -> "Vídeo reconstruido con " + used.size() + " fragmentos: " + output.getFileName());
    }

    private long sizeOf(Path file) {
        try {
            return Files.isRegularFile(file) ? Files.size(file) : -1L;
        } catch (IOException e) {
            return -1L;
        }
    }

    private void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            logger.log(Level.FINE, "No se pudo borrar " + file, e);
        }
    }

    private void deleteRecursively(Path directory) {
        if (!Files.exists(directory)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(directory)) {
            paths.sorted(Comparator.reverseOrder()).forEach(this::deleteQuietly);
        } catch (IOException e) {
            logger.log(Level.WARNING, "No se pudo limpiar el directorio temporal " + directory, e);
        }
    }
}
