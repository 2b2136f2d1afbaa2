package org.example.coursearchiver.media;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link MediaMuxer} backed by the ffmpeg executable. Output goes to a {@code .part.mp4} sibling
 * that is renamed once ffmpeg exits cleanly; partial output is deleted on failure.
 */
public class FfmpegMuxer implements MediaMuxer {

    private static final String PART_SUFFIX = ".part.mp4";
    private static final int MAX_KEPT_OUTPUT_LINES = 20;

    private final String executable;
    private final Logger logger;

    public FfmpegMuxer(String executable) {
        this(executable, Logger.getLogger(FfmpegMuxer.class.getName()));
    }

    public FfmpegMuxer(String executable, Logger logger) {
        this.executable = (executable == null || executable.isBlank()) ? "ffmpeg" : executable.trim();
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    @Override
    public void remux(String manifestUrl, Path output) throws IOException, InterruptedException {
        Path part = partFileFor(output);
        run(remuxCommand(manifestUrl, part), output, part, null);
    }

    @Override
    public void concat(Path listFile, Path output) throws IOException, InterruptedException {
        Path part = partFileFor(output);
        run(concatCommand(listFile, part), output, part, listFile.toAbsolutePath().getParent());
    }

    List<String> remuxCommand(String manifestUrl, Path output) {
        List<String> command = new ArrayList<>();
        command.add(executable);
        command.add("-hide_banner");
        command.add("-loglevel");
        command.add("error");
        command.add("-protocol_whitelist");
        command.add("file,http,https,tcp,tls,crypto");
        command.add("-allowed_extensions");
        command.add("ALL");
        command.add("-i");
        command.add(manifestUrl);
        command.add("-c");
        command.add("copy");
        command.add("-y");
        command.add(output.toAbsolutePath().toString());
        return command;
    }

    List<String> concatCommand(Path listFile, Path output) {
        List<String> command = new ArrayList<>();
        command.add(executable);
        command.add("-hide_banner");
        command.add("-loglevel");
        command.add("error");
        command.add("-f");
        command.add("concat");
        command.add("-safe");
        command.add("0");
        command.add("-i");
        command.add(listFile.toAbsolutePath().toString());
        command.add("-c");
        command.add("copy");
        command.add("-y");
        command.add(output.toAbsolutePath().toString());
        return command;
    }

    static Path partFileFor(Path output) {
        String name = output.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        return output.resolveSibling(base + PART_SUFFIX);
    }

    /**
     * Detects access refusals in ffmpeg's diagnostics, which the pipeline answers with interception.
     */
    static boolean looksForbidden(String diagnostics) {
        String lower = diagnostics.toLowerCase(Locale.ROOT);
        return lower.contains("403") || lower.contains("forbidden");
    }

    private void run(List<String> command, Path output, Path part, Path workingDirectory)
            throws IOException, InterruptedException {
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        logger.fine(() -> "Ejecutando: " + String.join(" ", command));

        ProcessBuilder builder = new ProcessBuilder(command);
        builder.redirectErrorStream(true);
        if (workingDirectory != null) {
            builder.directory(workingDirectory.toFile());
        }
        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new MuxingException("No se pudo iniciar ffmpeg (" + executable
                    + "). Compruebe que está instalado o configure ffmpegPath", e);
        }

        List<String> lastLines = new ArrayList<>();
        int exitCode;
        try {
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    if (lastLines.size() == MAX_KEPT_OUTPUT_LINES) {
                        lastLines.remove(0);
                    }
                    lastLines.add(line);
                    String logged = line;
                    logger.finer(() -> "[ffmpeg] " + logged);
                }
            }
            exitCode = process.waitFor();
        } catch (InterruptedException e) {
            process.destroyForcibly();
            deleteQuietly(part);
            throw e;
        }

        String diagnostics = String.join("\n", lastLines);
        if (exitCode != 0 || !Files.exists(part)) {
            deleteQuietly(part);
            boolean forbidden = looksForbidden(diagnostics);
            throw new MuxingException("ffmpeg terminó con código " + exitCode
                    + (diagnostics.isBlank() ? "" : ": " + diagnostics), forbidden);
        }
        Files.move(part, output, StandardCopyOption.REPLACE_EXISTING);
    }

    private void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            logger.log(Level.FINE, "No se pudo borrar la salida parcial " + file, e);
        }
    }
}
