package org.example.coursearchiver;

import org.example.coursearchiver.browser.BrowserEngine;
import org.example.coursearchiver.config.ArchiverConfig;
import org.example.coursearchiver.ledger.CheckpointStore;
import org.example.coursearchiver.ledger.DownloadStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CourseArchiverMainTest {

    private static final String COURSE = "/cursos/java";

    @TempDir
    Path tempDir;

    private Path ledger;
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

    @BeforeEach
    void seedLedger() {
        ledger = tempDir.resolve("progreso.json");
        CheckpointStore store = new CheckpointStore(ledger);
        store.load();
        store.startCourse(COURSE, "Curso de Java", null);
        store.startUnit(COURSE, "/clases/intro", "Introducción");
        store.completeUnit(COURSE, "/clases/intro");
        store.startUnit(COURSE, "/clases/tipos", "Tipos");
        store.failUnit(COURSE, "/clases/tipos", "HTTP 503 en https://cdn.example.com/tipos.m3u8");
        store.completeCourse(COURSE);
    }

    private int run(String... args) {
        return CourseArchiverMain.run(args, out);
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    private CheckpointStore reload() {
        CheckpointStore store = new CheckpointStore(ledger);
        store.load();
        return store;
    }

    @Test
    void statusPrintsReport() {
        assertEquals(CourseArchiverMain.EXIT_OK, run("status", "--checkpoint", ledger.toString()));

        assertTrue(output().contains("REPORTE DE DESCARGA"));
        assertTrue(output().contains("Curso de Java"));
    }

    @Test
    void retryFailedReopensUnitsAfterBackup() {
        assertEquals(CourseArchiverMain.EXIT_OK, run("retry-failed", "--checkpoint", ledger.toString()));

        assertTrue(output().contains("1 unidades devueltas a pendiente"));
        assertTrue(Files.exists(tempDir.resolve("progreso.json.backup")));
        assertEquals(DownloadStatus.PENDING, reload().getCourse(COURSE).getUnit("/clases/tipos").getStatus());
    }

    @Test
    void resetAndRemoveReportUnknownCourses() {
        assertEquals(CourseArchiverMain.EXIT_FAILURES, run("reset", "/cursos/otro", "--checkpoint", ledger.toString()));
        assertEquals(CourseArchiverMain.EXIT_OK, run("reset", COURSE, "--checkpoint", ledger.toString()));
        assertEquals(DownloadStatus.IN_PROGRESS, reload().getCourse(COURSE).getStatus());

        assertEquals(CourseArchiverMain.EXIT_OK, run("remove", COURSE, "--checkpoint", ledger.toString()));
        assertTrue(reload().getCourses().isEmpty());
        assertEquals(CourseArchiverMain.EXIT_FAILURES, run("remove", COURSE, "--checkpoint", ledger.toString()));
    }

    @Test
    void usageErrorsExitWithTwo() {
        assertEquals(CourseArchiverMain.EXIT_USAGE, run());
        assertEquals(CourseArchiverMain.EXIT_USAGE, run("status", "--desconocida"));
        assertEquals(CourseArchiverMain.EXIT_USAGE, run("descargar", "--checkpoint", ledger.toString()));
        assertEquals(CourseArchiverMain.EXIT_USAGE, run("reset", "--checkpoint", ledger.toString()));
        assertEquals(CourseArchiverMain.EXIT_USAGE, run("archive", "--checkpoint", ledger.toString()));
        assertTrue(output().contains("Indique al menos una URL"));
        assertFalse(reload().getCourses().isEmpty());
    }

    @Test
    void optionsOverrideConfiguration() {
        CourseArchiverMain.CommandLine line = CourseArchiverMain.CommandLine.parse(new String[]{
                "archive-path", "https://example.com/rutas/backend/", "--browser", "firefox", "--headless",
                "--overwrite", "--quality", "720p", "--checkpoint", "otro.json", "--verbose"});
        ArchiverConfig config = ArchiverConfig.load(tempDir.resolve("no-existe.json"));

        line.applyTo(config);

        assertEquals("archive-path", line.name);
        assertEquals(List.of("https://example.com/rutas/backend/"), line.arguments);
        assertTrue(line.verbose);
        assertEquals(BrowserEngine.FIREFOX, config.getBrowser());
        assertTrue(config.isHeadless());
        assertTrue(config.isOverwrite());
        assertEquals("720p", config.getQuality());
        assertEquals("otro.json", config.getCheckpointPath());
    }

    @Test
    void optionWithoutValueIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> CourseArchiverMain.CommandLine.parse(new String[]{"status", "--checkpoint"}));
    }
}
