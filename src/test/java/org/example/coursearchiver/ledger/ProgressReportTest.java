package org.example.coursearchiver.ledger;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProgressReportTest {

    @TempDir
    Path tempDir;

    @Test
    void reportListsStatisticsPathsPendingCoursesAndRecentErrors() throws Exception {
        CheckpointStore store = new CheckpointStore(tempDir.resolve("progress.json"),
                java.time.Clock.systemUTC(), Logger.getLogger(ProgressReportTest.class.getName()));
        store.load();
        store.startLearningPath("/ruta/datos", "Ruta de Datos", 2);
        store.startCourse("/cursos/sql", "Curso de SQL", "/ruta/datos");
        store.startUnit("/cursos/sql", "/u/1", "Consultas");
        store.completeUnit("/cursos/sql", "/u/1");
        store.completeCourse("/cursos/sql");
        store.startCourse("/cursos/pandas", "Curso de Pandas", "/ruta/datos");
        for (int i = 1; i <= 12; i++) {
            store.startUnit("/cursos/pandas", "/u/p" + i, "Unidad " + i);
            store.failUnit("/cursos/pandas", "/u/p" + i, "fallo " + i);
        }

        String report = ProgressReport.render(store);

        assertTrue(report.contains("Cursos:   1/2 completados"));
        assertTrue(report.contains("Unidades: 1/13 completadas, 12 fallidas"));
        assertTrue(report.contains("[in_progress] Ruta de Datos: 1/2 cursos"));
        assertTrue(report.contains("Curso de Pandas (12 unidades fallidas)"));
        assertFalse(report.contains("Curso de SQL ("));
        assertTrue(report.contains("fallo 12"));
        assertTrue(report.contains("fallo 3\n"));
        assertFalse(report.contains("fallo 2\n"));

        Path target = tempDir.resolve("informes").resolve("download_report.txt");
        ProgressReport.write(store, target);
        assertTrue(Files.readString(target, StandardCharsets.UTF_8).contains("REPORTE DE DESCARGA"));
    }
}
