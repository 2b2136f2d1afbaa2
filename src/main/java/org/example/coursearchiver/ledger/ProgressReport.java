package org.example.coursearchiver.ledger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Plain-text summary of a ledger, used by the {@code status} command and at the end of a run.
 */
public final class ProgressReport {

    static final int RECENT_ERRORS = 10;
    private static final String RULE = "=".repeat(60);

    private ProgressReport() {
    }

    public static String render(CheckpointStore store) {
        StringBuilder out = new StringBuilder();
        out.append(RULE).append('\n');
        out.append("REPORTE DE DESCARGA\n");
        out.append(RULE).append('\n');
        out.append("Inicio: ").append(orDash(store.getStartedAt())).append('\n');
        out.append("Última actualización: ").append(orDash(store.getLastUpdated())).append("\n\n");

        LedgerStatistics stats = store.getStatistics();
        out.append("ESTADÍSTICAS\n");
        out.append(String.format(Locale.ROOT, "  Cursos:   %d/%d completados, %d fallidos (%s)%n",
                stats.getCompletedCourses(), stats.getTotalCourses(), stats.getFailedCourses(),
                percent(stats.getCompletedCourses(), stats.getTotalCourses())));
        out.append(String.format(Locale.ROOT, "  Unidades: %d/%d completadas, %d fallidas (%s)%n",
                stats.getCompletedUnits(), stats.getTotalUnits(), stats.getFailedUnits(),
                percent(stats.getCompletedUnits(), stats.getTotalUnits())));

        if (!store.getLearningPaths().isEmpty()) {
            out.append("\nRUTAS DE APRENDIZAJE\n");
            for (LearningPathEntry path : store.getLearningPaths()) {
                out.append(String.format(Locale.ROOT, "  [%s] %s: %d/%d cursos, %d fallidos%n",
                        path.getStatus().getWireValue(), path.getTitle(),
                        path.getCompletedCourses(), path.getTotalCourses(), path.getFailedCourses()));
            }
        }

        List<CourseEntry> pending = store.getPendingCourses();
        if (!pending.isEmpty()) {
            out.append("\nCURSOS CON TRABAJO PENDIENTE\n");
            for (CourseEntry course : pending) {
                out.append(String.format(Locale.ROOT, "  [%s] %s (%d unidades fallidas)%n",
                        course.getStatus().getWireValue(), course.getTitle(),
                        course.countUnits(DownloadStatus.FAILED)));
                if (course.getError() != null) {
                    out.append("      error: ").append(course.getError()).append('\n');
                }
            }
        }

        List<ErrorRecord> errors = store.getErrors();
        if (!errors.isEmpty()) {
            out.append("\nÚLTIMOS ERRORES\n");
            for (ErrorRecord error : errors.subList(Math.max(0, errors.size() - RECENT_ERRORS), errors.size())) {
                out.append("  ").append(orDash(error.timestamp()))
                        .append(" [").append(error.kind().getWireValue()).append("] ")
                        .append(orDash(error.title())).append(": ")
                        .append(orDash(error.message())).append('\n');
            }
        }
        out.append(RULE).append('\n');
        return out.toString();
    }

    public static void write(CheckpointStore store, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(target, render(store), StandardCharsets.UTF_8);
    }

    private static String percent(int part, int total) {
        if (total <= 0) {
            return "0.0%";
        }
        return String.format(Locale.ROOT, "%.1f%%", part * 100.0 / total);
    }

    private static String orDash(String value) {
        return value == null ? "-" : value;
    }
}
