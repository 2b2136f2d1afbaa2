package org.example.coursearchiver.logging;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogRecord;

/**
 * One-line console format: {@code [HH:mm:ss.SSS][component][LEVEL] message}, where the component
 * is the simple name of the logger's class.
 */
public class ConsoleLogFormatter extends Formatter {

    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("HH:mm:ss.SSS");

    @Override
    public String format(LogRecord record) {
        LocalDateTime time = LocalDateTime.ofInstant(Instant.ofEpochMilli(record.getMillis()), ZoneId.systemDefault());
        StringBuilder line = new StringBuilder();
        line.append('[').append(time.format(TIME_FORMATTER)).append(']')
                .append('[').append(component(record.getLoggerName())).append(']')
                .append('[').append(levelName(record.getLevel())).append("] ")
                .append(formatMessage(record))
                .append(System.lineSeparator());
        if (record.getThrown() != null) {
            StringWriter trace = new StringWriter();
            record.getThrown().printStackTrace(new PrintWriter(trace));
            line.append(trace);
        }
        return line.toString();
    }

    static String component(String loggerName) {
        if (loggerName == null || loggerName.isBlank()) {
            return "archiver";
        }
        int dot = loggerName.lastIndexOf('.');
        return dot >= 0 ? loggerName.substring(dot + 1) : loggerName;
    }

    static String levelName(Level level) {
        if (level == null) {
            return "INFO";
        }
        if (level == Level.SEVERE) {
            return "ERROR";
        }
        if (level == Level.WARNING) {
            return "WARN";
        }
        if (level.intValue() < Level.INFO.intValue()) {
            return "DEBUG";
        }
        return level.getName();
    }
}
