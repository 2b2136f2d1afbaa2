package org.example.coursearchiver.media;

import org.example.coursearchiver.browser.BrowserEngine;
import org.example.coursearchiver.config.DownloadOptions;
import org.example.coursearchiver.retry.ErrorClassifier;
import org.example.coursearchiver.retry.Retrier;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Produces a local MP4 for a video unit by trying, in order, the advertised manifest, the
 * alternative manifest and, when the host refused a direct fetch, interception of the fragments
 * the browser itself downloads while playing.
 * <p>
 * Each failed strategy is logged with its cause; the caller receives a single
 * {@link MediaAcquisitionException} listing every attempt.
 */
public class MediaAcquisitionPipeline {

    /** Smallest file accepted as a playable video, whichever strategy produced it. */
    public static final long MIN_VIDEO_BYTES = 100L * 1024L;

    private final DirectManifestDownloader direct;
    private final InterceptionCapture interception;
    private final BrowserEngine engine;
    private final Retrier retrier;
    private final Logger logger;

    /**
     * @param interception may be {@code null} when no browser session is available
     */
    public MediaAcquisitionPipeline(DirectManifestDownloader direct,
                                    InterceptionCapture interception,
                                    BrowserEngine engine,
                                    Retrier retrier,
                                    Logger logger) {
        this.direct = Objects.requireNonNull(direct, "direct");
        this.interception = interception;
        this.engine = Objects.requireNonNull(engine, "engine");
        this.retrier = Objects.requireNonNull(retrier, "retrier");
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    public Path acquire(ManifestSet manifests, String pageUrl, Path output, DownloadOptions options)
            throws MediaAcquisitionException, InterruptedException {
        if (manifests == null || manifests.isEmpty()) {
            throw new MediaAcquisitionException("La unidad no publica ningún manifiesto de vídeo", true);
        }
        if (!options.overwrite() && isNonTrivial(output)) {
            logger.info(() -> "El vídeo ya existe, se conserva: " + output.getFileName());
            return output;
        }

        List<ManifestRef> candidates = orderCandidates(manifests);
        if (!engine.acceptsDash() && candidates.stream().allMatch(ref -> ref.format() == ManifestFormat.DASH)) {
            throw new MediaAcquisitionException("Solo hay manifiesto DASH y el motor " + engine
                    + " no puede descargarlo. Pruebe con --browser firefox", true);
        }

        List<String> attempts = new ArrayList<>();
        boolean forbiddenSeen = false;
        IOException lastFailure = null;
        for (int i = 0; i < candidates.size(); i++) {
            ManifestRef manifest = candidates.get(i);
            AcquisitionStrategy strategy = i == 0 ? AcquisitionStrategy.DIRECT_MANIFEST : AcquisitionStrategy.FALLBACK_MANIFEST;
            try {
                retrier.call(strategy.getLabel(), () -> {
                    direct.download(manifest, output);
                    return null;
                });
                verifyOutput(output);
                logger.info(() -> "Vídeo obtenido mediante " + strategy.getLabel() + " (" + manifest.format() + ")");
                return output;
            } catch (IOException e) {
                lastFailure = e;
                boolean forbidden = ErrorClassifier.isForbidden(e);
                forbiddenSeen |= forbidden;
                String attempt = strategy.getLabel() + " " + manifest.format() + ": " + e.getMessage();
                attempts.add(attempt);
                logger.log(Level.WARNING, "Falló " + attempt + (forbidden
                        ? ". El servidor rechazó el acceso directo; se intentará interceptar la reproducción"
                        : ". Revise la conectividad o la validez del manifiesto"));
                deleteQuietly(output);
            }
        }

        ManifestRef hls = manifests.firstOf(ManifestFormat.HLS);
        if (forbiddenSeen && hls != null && interception != null) {
            AcquisitionStrategy strategy = AcquisitionStrategy.BROWSER_INTERCEPTION;
            try {
                interception.capture(pageUrl, output);
                verifyOutput(output);
                logger.info(() -> "Vídeo obtenido mediante " + strategy.getLabel());
                return output;
            } catch (MediaAcquisitionException e) {
                attempts.add(strategy.getLabel() + ": " + e.getMessage());
                logger.log(Level.WARNING, "Falló " + strategy.getLabel() + ": " + e.getMessage()
                        + ". Compruebe que la sesión del navegador sigue iniciada");
                throw new MediaAcquisitionException(summary(attempts), e.isTerminal(), attempts, e);
            } catch (IOException e) {
                attempts.add(strategy.getLabel() + ": " + e.getMessage());
                throw new MediaAcquisitionException(summary(attempts), false, attempts, e);
            }
        } else if (forbiddenSeen && hls == null) {
            attempts.add(AcquisitionStrategy.BROWSER_INTERCEPTION.getLabel() + ": no disponible sin manifiesto HLS");
        } else if (forbiddenSeen) {
            attempts.add(AcquisitionStrategy.BROWSER_INTERCEPTION.getLabel() + ": no hay sesión de navegador");
        }
        throw new MediaAcquisitionException(summary(attempts), false, attempts, lastFailure);
    }

    /**
     * Primary before fallback, except on engines that play DASH poorly, where HLS candidates move
     * to the front and DASH ones stay as the last resort.
     */
    List<ManifestRef> orderCandidates(ManifestSet manifests) {
        List<ManifestRef> ordered = new ArrayList<>(manifests.inOrder());
        if (!engine.acceptsDash() && ordered.stream().anyMatch(ref -> ref.format() == ManifestFormat.DASH)) {
            ordered.sort(Comparator.comparing((ManifestRef ref) -> ref.format() == ManifestFormat.DASH));
            logger.fine(() -> "El manifiesto DASH puede fallar en " + engine + "; se intentará después del HLS");
        }
        return ordered;
    }

    /**
     * Fails, removing the file, when the strategy left nothing or something too small to be a video.
     */
    private void verifyOutput(Path output) throws IOException {
        long size = sizeOf(output);
        if (size < MIN_VIDEO_BYTES) {
            deleteQuietly(output);
            throw new IOException(size < 0
                    ? "El archivo resultante no existe: " + output
                    : "El archivo resultante es demasiado pequeño (" + size + " bytes): " + output);
        }
    }

    static boolean isNonTrivial(Path file) {
        return sizeOf(file) >= MIN_VIDEO_BYTES;
    }

    private static long sizeOf(Path file) {
        try {
            return Files.isRegularFile(file) ? Files.size(file) : -1L;
        } catch (IOException e) {
            return -1L;
        }
    }

    private static String summary(List<String> attempts) {
        return "No se pudo obtener el vídeo tras " + attempts.size() + " estrategias: " + String.join(" | ", attempts);
    }

    private void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            logger.log(Level.FINE, "No se pudo borrar " + file, e);
        }
    }
}
