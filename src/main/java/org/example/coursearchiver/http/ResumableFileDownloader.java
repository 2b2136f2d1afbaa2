package org.example.coursearchiver.http;

import java.io.IOException;
import java.io.InputStream;
import java.io.RandomAccessFile;
import java.net.HttpURLConnection;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * HTTP downloader with resume support based on the Range header. Bytes are written to a
 * {@code .part} sibling that is renamed onto the target only once the transfer is complete, so
 * an interrupted run leaves no truncated file under the final name.
 */
public class ResumableFileDownloader implements FileDownloader {

    private static final int BUFFER_SIZE = 8192;
    private static final int CONNECT_TIMEOUT_MS = (int) Duration.ofSeconds(20).toMillis();
    private static final int READ_TIMEOUT_MS = (int) Duration.ofSeconds(60).toMillis();
    private static final int HTTP_REQUESTED_RANGE_NOT_SATISFIABLE = 416;
    private static final String PART_EXTENSION = ".part";

    private final Consumer<HttpURLConnection> headerConfigurer;
    private final Logger logger;

    public ResumableFileDownloader() {
        this(null, Logger.getLogger(ResumableFileDownloader.class.getName()));
    }

    /**
     * @param headerConfigurer adds cookies, referer or user agent to every request; may be {@code null}
     */
    public ResumableFileDownloader(Consumer<HttpURLConnection> headerConfigurer, Logger logger) {
        this.headerConfigurer = headerConfigurer != null ? headerConfigurer : connection -> { };
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    @Override
    public void download(String url, Path target) throws IOException, InterruptedException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path partFile = target.resolveSibling(target.getFileName() + PART_EXTENSION);
        long localBytes = Files.exists(partFile) ? Files.size(partFile) : 0L;

        HttpURLConnection connection = openConnection(url, "GET");
        if (localBytes > 0) {
            connection.setRequestProperty("Range", "bytes=" + localBytes + "-");
        }
        int responseCode = connection.getResponseCode();
        long startingOffset;
        if (responseCode == HttpURLConnection.HTTP_PARTIAL && localBytes > 0) {
            startingOffset = localBytes;
            long resumeFrom = localBytes;
            logger.fine(() -> "Reanudando " + target.getFileName() + " desde " + resumeFrom + " bytes");
        } else if (responseCode == HTTP_REQUESTED_RANGE_NOT_SATISFIABLE && localBytes > 0) {
            // The part file already holds the whole resource.
            connection.disconnect();
            finalizeDownload(partFile, target);
            return;
        } else if (responseCode == HttpURLConnection.HTTP_OK) {
            startingOffset = 0L;
        } else {
            connection.disconnect();
            throw new HttpStatusException(responseCode, url);
        }

        try (InputStream input = connection.getInputStream();
             RandomAccessFile raf = new RandomAccessFile(partFile.toFile(), "rw")) {
            if (startingOffset > 0) {
                raf.seek(startingOffset);
            } else {
                raf.setLength(0);
            }
            byte[] buffer = new byte[BUFFER_SIZE];
            int read;
            while ((read = input.read(buffer)) != -1) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new InterruptedException("Descarga interrumpida: " + url);
                }
                raf.write(buffer, 0, read);
            }
        } finally {
            connection.disconnect();
        }
        finalizeDownload(partFile, target);
    }

    @Override
    public String fetchText(String url) throws IOException {
        HttpURLConnection connection = openConnection(url, "GET");
        try {
            int responseCode = connection.getResponseCode();
            if (responseCode < 200 || responseCode >= 300) {
                throw new HttpStatusException(responseCode, url);
            }
            try (InputStream input = connection.getInputStream()) {
                return new String(input.readAllBytes(), StandardCharsets.UTF_8);
            }
        } finally {
            connection.disconnect();
        }
    }

    private void finalizeDownload(Path partFile, Path target) throws IOException {
        if (Files.exists(partFile)) {
            Files.move(partFile, target, StandardCopyOption.REPLACE_EXISTING);
        }
        logger.log(Level.FINE, "Descarga completada: {0}", target);
    }

    private HttpURLConnection openConnection(String url, String method) throws IOException {
        HttpURLConnection connection = (HttpURLConnection) new URL(url).openConnection();
        connection.setInstanceFollowRedirects(true);
        connection.setConnectTimeout(CONNECT_TIMEOUT_MS);
        connection.setReadTimeout(READ_TIMEOUT_MS);
        connection.setRequestMethod(method);
        headerConfigurer.accept(connection);
        return connection;
    }
}
