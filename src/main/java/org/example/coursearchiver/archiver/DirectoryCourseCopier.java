package org.example.coursearchiver.archiver;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Iterator;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * Recursive copy of a course directory. Files already present at the destination with the same
 * size are left untouched, so an interrupted copy can simply be run again.
 */
public class DirectoryCourseCopier implements CourseCopier {

    private final Logger logger;

    public DirectoryCourseCopier() {
        this(Logger.getLogger(DirectoryCourseCopier.class.getName()));
    }

    public DirectoryCourseCopier(Logger logger) {
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    @Override
    public void copy(Path source, Path target) throws IOException {
        if (!Files.isDirectory(source)) {
            throw new IOException("El directorio de origen no existe: " + source);
        }
        if (target.toAbsolutePath().normalize().startsWith(source.toAbsolutePath().normalize())) {
            throw new IOException("El destino " + target + " está dentro del origen " + source);
        }
        int copied = 0;
        try (Stream<Path> paths = Files.walk(source)) {
            Iterator<Path> iterator = paths.iterator();
            while (iterator.hasNext()) {
                Path current = iterator.next();
                Path destination = target.resolve(source.relativize(current).toString());
                if (Files.isDirectory(current)) {
                    Files.createDirectories(destination);
                } else if (!sameSize(current, destination)) {
                    Files.copy(current, destination, StandardCopyOption.REPLACE_EXISTING,
                            StandardCopyOption.COPY_ATTRIBUTES);
                    copied++;
                }
            }
        }
        int total = copied;
        logger.info(() -> "Curso copiado de " + source + " a " + target + " (" + total + " archivos)");
    }

    private static boolean sameSize(Path source, Path destination) throws IOException {
        return Files.isRegularFile(destination) && Files.size(destination) == Files.size(source);
    }
}
