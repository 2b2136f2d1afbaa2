package org.example.coursearchiver.archiver;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DirectoryCourseCopierTest {

    @TempDir
    Path tempDir;

    private final DirectoryCourseCopier copier = new DirectoryCourseCopier(Logger.getLogger(DirectoryCourseCopierTest.class.getName()));

    private Path sampleCourse() throws IOException {
        Path source = tempDir.resolve("Backend").resolve("1. Curso de Java");
        Path chapter = Files.createDirectories(source.resolve("1. Fundamentos"));
        Files.writeString(chapter.resolve("1. Introducción.mp4"), "video-intro");
        Files.writeString(chapter.resolve("1. Introducción_es.vtt"), "WEBVTT");
        Files.writeString(source.resolve("presentation.mhtml"), "MIME-Version: 1.0");
        return source;
    }

    @Test
    void copiesWholeTree() throws Exception {
        Path source = sampleCourse();
        Path target = tempDir.resolve("Android").resolve("3. Curso de Java");

        copier.copy(source, target);

        assertEquals("video-intro", Files.readString(target.resolve("1. Fundamentos").resolve("1. Introducción.mp4")));
        assertEquals("WEBVTT", Files.readString(target.resolve("1. Fundamentos").resolve("1. Introducción_es.vtt")));
        assertEquals("MIME-Version: 1.0", Files.readString(target.resolve("presentation.mhtml")));
    }

    @Test
    void filesWithSameSizeAreNotCopiedAgain() throws Exception {
        Path source = sampleCourse();
        Path target = tempDir.resolve("Android").resolve("3. Curso de Java");
        copier.copy(source, target);
        Path video = target.resolve("1. Fundamentos").resolve("1. Introducción.mp4");
        Files.writeString(video, "VIDEO-INTRO");
        Files.writeString(target.resolve("presentation.mhtml"), "truncado");

        copier.copy(source, target);

        assertEquals("VIDEO-INTRO", Files.readString(video));
        assertEquals("MIME-Version: 1.0", Files.readString(target.resolve("presentation.mhtml")));
    }

    @Test
    void missingSourceIsRejected() {
        assertThrows(IOException.class, () -> copier.copy(tempDir.resolve("no-existe"), tempDir.resolve("destino")));
    }

    @Test
    void targetInsideSourceIsRejected() throws Exception {
        Path source = sampleCourse();

        assertThrows(IOException.class, () -> copier.copy(source, source.resolve("copia")));
        assertThrows(IOException.class, () -> copier.copy(source, source));
    }
}
