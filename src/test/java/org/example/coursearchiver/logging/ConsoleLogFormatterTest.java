package org.example.coursearchiver.logging;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.logging.Level;
import java.util.logging.LogRecord;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConsoleLogFormatterTest {

    private final ConsoleLogFormatter formatter = new ConsoleLogFormatter();

    @Test
    void formatsSingleLineWithComponentAndLevel() {
        LogRecord record = new LogRecord(Level.WARNING, "Reintentando {0} en {1} ms");
        record.setParameters(new Object[]{"índice del curso", "2000"});
        record.setLoggerName("org.example.coursearchiver.retry.Retrier");

        String line = formatter.format(record);

        assertTrue(line.matches("\\[\\d{2}:\\d{2}:\\d{2}\\.\\d{3}]\\[Retrier]\\[WARN] Reintentando índice del curso en 2000 ms\\R"),
                line);
    }

    @Test
    void appendsStackTrace() {
        LogRecord record = new LogRecord(Level.SEVERE, "Error descargando el curso");
        record.setLoggerName("CourseArchiver");
        record.setThrown(new IOException("HTTP 500 en https://example.com/cursos/java"));

        String text = formatter.format(record);

        assertTrue(text.contains("[CourseArchiver][ERROR] Error descargando el curso"));
        assertTrue(text.contains("java.io.IOException: HTTP 500 en https://example.com/cursos/java"));
    }

    @Test
    void levelsMapToShortNames() {
        assertEquals("ERROR", ConsoleLogFormatter.levelName(Level.SEVERE));
        assertEquals("WARN", ConsoleLogFormatter.levelName(Level.WARNING));
        assertEquals("INFO", ConsoleLogFormatter.levelName(Level.INFO));
        assertEquals("DEBUG", ConsoleLogFormatter.levelName(Level.FINE));
        assertEquals("DEBUG", ConsoleLogFormatter.levelName(Level.FINEST));
        assertEquals("INFO", ConsoleLogFormatter.levelName(null));
    }

    @Test
    void componentIsLastSegmentOfLoggerName() {
        assertEquals("CheckpointStore", ConsoleLogFormatter.component("org.example.coursearchiver.ledger.CheckpointStore"));
        assertEquals("archiver", ConsoleLogFormatter.component(null));
        assertEquals("archiver", ConsoleLogFormatter.component(""));
    }
}
