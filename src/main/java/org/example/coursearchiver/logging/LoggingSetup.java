package org.example.coursearchiver.logging;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Loads {@code logging.properties} from the classpath unless the JVM was started with an explicit
 * {@code java.util.logging.config.file}.
 */
public final class LoggingSetup {

    private static final String CONFIG_RESOURCE = "/logging.properties";

    private LoggingSetup() {
    }

    public static void configure(boolean verbose) {
        if (System.getProperty("java.util.logging.config.file") == null) {
            try (InputStream input = LoggingSetup.class.getResourceAsStream(CONFIG_RESOURCE)) {
                if (input != null) {
                    LogManager.getLogManager().readConfiguration(input);
                }
            } catch (IOException e) {
                System.err.println("No se pudo cargar la configuración de logging: " + e.getMessage());
            }
        }
        if (verbose) {
            Logger root = Logger.getLogger("org.example.coursearchiver");
            root.setLevel(Level.FINE);
            for (java.util.logging.Handler handler : Logger.getLogger("").getHandlers()) {
                handler.setLevel(Level.FINE);
            }
        }
    }
}
