package org.example.coursearchiver;

import org.example.coursearchiver.archiver.CourseArchiver;
import org.example.coursearchiver.archiver.CourseLayout;
import org.example.coursearchiver.archiver.CourseOutcome;
import org.example.coursearchiver.archiver.DirectoryCourseCopier;
import org.example.coursearchiver.archiver.SeleniumPageSnapshotter;
import org.example.coursearchiver.archiver.UnitContentWriter;
import org.example.coursearchiver.browser.BrowserEngine;
import org.example.coursearchiver.browser.BrowserSession;
import org.example.coursearchiver.browser.BrowserSessionFactory;
import org.example.coursearchiver.config.ArchiverConfig;
import org.example.coursearchiver.http.FileDownloader;
import org.example.coursearchiver.http.ResumableFileDownloader;
import org.example.coursearchiver.ledger.CheckpointStore;
import org.example.coursearchiver.ledger.ProgressReport;
import org.example.coursearchiver.logging.LoggingSetup;
import org.example.coursearchiver.media.DirectManifestDownloader;
import org.example.coursearchiver.media.FfmpegMuxer;
import org.example.coursearchiver.media.InterceptionCapture;
import org.example.coursearchiver.media.MediaAcquisitionPipeline;
import org.example.coursearchiver.media.MediaMuxer;
import org.example.coursearchiver.media.capture.BrowserInterceptionCapture;
import org.example.coursearchiver.retry.Retrier;
import org.example.coursearchiver.retry.Sleeper;
import org.example.coursearchiver.site.SiteAdapter;
import org.example.coursearchiver.site.SiteAdapterProvider;
import org.openqa.selenium.WebDriverException;

import java.io.IOException;
import java.io.PrintStream;
import java.net.HttpURLConnection;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Command-line entry point.
 * <pre>
 * archive &lt;course-url&gt;...        archive standalone courses
 * archive-path &lt;path-url&gt;...     archive learning paths
 * status                         print the progress report
 * retry-failed [course-id]       put failed units back to pending
 * reset &lt;course-id&gt;              force a full re-download of a course
 * remove &lt;course-id&gt;             forget a course
 * </pre>
 * Options: {@code --browser chromium|firefox}, {@code --headless}, {@code --overwrite},
 * {@code --quality <q>}, {@code --checkpoint <file>}, {@code --verbose}.
 */
public final class CourseArchiverMain {

    static final String REPORT_FILE = "download_report.txt";
    static final int EXIT_OK = 0;
    static final int EXIT_FAILURES = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_INTERRUPTED = 130;

    private static final Logger LOGGER = Logger.getLogger(CourseArchiverMain.class.getName());

    private CourseArchiverMain() {
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out));
    }

    static int run(String[] args, PrintStream out) {
        CommandLine command;
        try {
            command = CommandLine.parse(args);
        } catch (IllegalArgumentException e) {
            out.println(e.getMessage());
            out.println(usage());
            return EXIT_USAGE;
        }
        LoggingSetup.configure(command.verbose);

        ArchiverConfig config = ArchiverConfig.load();
        command.applyTo(config);
        CheckpointStore store = new CheckpointStore(CheckpointStore.resolveLocation(config.getCheckpointPath()));
        store.load();

        try {
            return execute(command, config, store, out);
        } catch (IllegalArgumentException e) {
            out.println(e.getMessage());
            out.println(usage());
            return EXIT_USAGE;
        }
    }

    private static int execute(CommandLine command, ArchiverConfig config, CheckpointStore store, PrintStream out) {
        switch (command.name) {
            case "status":
                out.print(ProgressReport.render(store));
                return EXIT_OK;
            case "retry-failed": {
                store.backup();
                String courseId = command.arguments.isEmpty() ? null : command.arguments.get(0);
                int reopened = store.retryFailed(courseId);
                out.println(reopened + " unidades devueltas a pendiente");
                return EXIT_OK;
            }
            case "reset": {
                String courseId = command.requireArgument();
                store.backup();
                boolean reset = store.resetCourse(courseId);
                out.println(reset ? "Curso reiniciado: " + courseId : "Curso desconocido: " + courseId);
                return reset ? EXIT_OK : EXIT_FAILURES;
            }
            case "remove": {
                String courseId = command.requireArgument();
                store.backup();
                boolean removed = store.removeCourse(courseId);
                out.println(removed ? "Curso eliminado del registro: " + courseId : "Curso desconocido: " + courseId);
                return removed ? EXIT_OK : EXIT_FAILURES;
            }
            case "archive":
            case "archive-path":
                if (command.arguments.isEmpty()) {
                    out.println("Indique al menos una URL");
                    return EXIT_USAGE;
                }
                return archive(command, config, store);
            default:
                out.println("Comando desconocido: " + command.name);
                out.println(usage());
                return EXIT_USAGE;
        }
    }

    private static int archive(CommandLine command, ArchiverConfig config, CheckpointStore store) {
        store.startSession();
        boolean paths = "archive-path".equals(command.name);
        int failures = 0;
        BrowserSessionFactory factory = new BrowserSessionFactory(Logger.getLogger(BrowserSessionFactory.class.getName()));
        try (BrowserSession session = factory.open(config.getBrowser(), config.getProfileName(), config.isHeadless(),
                config.getChromeBinary(), config.getChromeDriver())) {
            SiteAdapter site = loadSiteAdapter(command.arguments.get(0), session);
            CourseArchiver archiver = buildArchiver(config, store, session, site);
            for (String url : command.arguments) {
                try {
                    if (paths) {
                        List<CourseOutcome> outcomes = archiver.archiveLearningPath(url);
                        failures += (int) outcomes.stream().filter(o -> o == CourseOutcome.FAILED).count();
                    } else if (archiver.archiveCourse(url) == CourseOutcome.FAILED) {
                        failures++;
                    }
                } catch (IOException e) {
                    failures++;
                    LOGGER.log(Level.SEVERE, "No se pudo procesar " + url + ": " + e.getMessage(), e);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warning("Descarga interrumpida; el progreso queda guardado para la próxima ejecución");
            return EXIT_INTERRUPTED;
        } catch (IOException | WebDriverException e) {
            LOGGER.log(Level.SEVERE, "No se pudo iniciar el archivado: " + e.getMessage(), e);
            return EXIT_FAILURES;
        } finally {
            writeReport(store);
        }
        return failures == 0 ? EXIT_OK : EXIT_FAILURES;
    }

    static CourseArchiver buildArchiver(ArchiverConfig config, CheckpointStore store,
                                        BrowserSession session, SiteAdapter site) {
        Retrier retrier = new Retrier(config.getRetryAttempts(), config.getRetryBaseDelayMillis(),
                Sleeper.SYSTEM, Logger.getLogger(Retrier.class.getName()));
        FileDownloader http = new ResumableFileDownloader(connection -> applySessionCookies(connection, session),
                Logger.getLogger(ResumableFileDownloader.class.getName()));
        MediaMuxer muxer = new FfmpegMuxer(config.getFfmpegPath(), Logger.getLogger(FfmpegMuxer.class.getName()));
        InterceptionCapture interception = session.engine() == BrowserEngine.CHROMIUM
                ? new BrowserInterceptionCapture(session, muxer, config.getTempRoot(),
                Logger.getLogger(BrowserInterceptionCapture.class.getName()))
                : null;
        MediaAcquisitionPipeline pipeline = new MediaAcquisitionPipeline(
                new DirectManifestDownloader(http, muxer), interception, session.engine(), retrier,
                Logger.getLogger(MediaAcquisitionPipeline.class.getName()));
        return new CourseArchiver(
                site,
                store,
                pipeline,
                new UnitContentWriter(http, retrier, Logger.getLogger(UnitContentWriter.class.getName())),
                new SeleniumPageSnapshotter(session, Logger.getLogger(SeleniumPageSnapshotter.class.getName())),
                new DirectoryCourseCopier(),
                new CourseLayout(config.getOutputRoot()),
                retrier,
                Sleeper.SYSTEM,
                config.getUnitDelayMillis(),
                config.toDownloadOptions(),
                Logger.getLogger(CourseArchiver.class.getName()));
    }

    static SiteAdapter loadSiteAdapter(String url, BrowserSession session) throws IOException {
        for (SiteAdapterProvider provider : ServiceLoader.load(SiteAdapterProvider.class)) {
            if (provider.supports(url)) {
                return provider.create(session, Logger.getLogger(provider.getClass().getName()));
            }
        }
        throw new IOException("No hay ningún adaptador de sitio registrado para " + url);
    }

    /**
     * Sends the browser's cookies with plain HTTP requests so subtitles and attachments are
     * fetched with the logged-in session.
     */
    private static void applySessionCookies(HttpURLConnection connection, BrowserSession session) {
        try {
            String host = connection.getURL().getHost();
            String cookies = session.driver().manage().getCookies().stream()
                    .filter(cookie -> cookie.getDomain() == null || host.endsWith(cookie.getDomain().replaceFirst("^\\.", "")))
                    .map(cookie -> cookie.getName() + "=" + cookie.getValue())
                    .collect(Collectors.joining("; "));
            if (!cookies.isEmpty()) {
                connection.setRequestProperty("Cookie", cookies);
            }
        } catch (WebDriverException e) {
            LOGGER.fine(() -> "No se pudieron leer las cookies del navegador: " + e.getMessage());
        }
    }

    private static void writeReport(CheckpointStore store) {
        Path report = Paths.get(REPORT_FILE);
        try {
            ProgressReport.write(store, report);
            LOGGER.info(() -> "Informe de progreso guardado en " + report.toAbsolutePath());
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "No se pudo escribir el informe de progreso", e);
        }
    }

    static String usage() {
        return String.join(System.lineSeparator(),
                "Uso: course-archiver <comando> [opciones] [argumentos]",
                "  archive <url-curso>...       archiva cursos sueltos",
                "  archive-path <url-ruta>...   archiva rutas de aprendizaje completas",
                "  status                       muestra el progreso",
                "  retry-failed [id-curso]      vuelve a poner en cola las unidades fallidas",
                "  reset <id-curso>             fuerza la descarga completa de un curso",
                "  remove <id-curso>            elimina un curso del registro",
                "Opciones: --browser chromium|firefox --headless --overwrite --quality <q> --checkpoint <archivo> --verbose");
    }

    static final class CommandLine {
        final String name;
        final List<String> arguments = new ArrayList<>();
        String browser;
        boolean headless;
        boolean overwrite;
        boolean verbose;
        String quality;
        String checkpoint;

        private CommandLine(String name) {
            this.name = name;
        }

        static CommandLine parse(String[] args) {
            if (args == null || args.length == 0) {
                throw new IllegalArgumentException("Falta el comando");
            }
            CommandLine line = new CommandLine(args[0]);
            for (int i = 1; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "--browser":
                        line.browser = valueAfter(args, ++i, arg);
                        break;
                    case "--quality":
                        line.quality = valueAfter(args, ++i, arg);
                        break;
                    case "--checkpoint":
                        line.checkpoint = valueAfter(args, ++i, arg);
                        break;
                    case "--headless":
                        line.headless = true;
                        break;
                    case "--overwrite":
                        line.overwrite = true;
                        break;
                    case "--verbose":
                        line.verbose = true;
                        break;
                    default:
                        if (arg.startsWith("--")) {
                            throw new IllegalArgumentException("Opción desconocida: " + arg);
                        }
                        line.arguments.add(arg);
                }
            }
            return line;
        }

        private static String valueAfter(String[] args, int index, String option) {
            if (index >= args.length) {
                throw new IllegalArgumentException("La opción " + option + " necesita un valor");
            }
            return args[index];
        }

        String requireArgument() {
            if (arguments.isEmpty()) {
                throw new IllegalArgumentException("El comando " + name + " necesita un identificador de curso");
            }
            return arguments.get(0);
        }

        void applyTo(ArchiverConfig config) {
            if (browser != null) {
                config.setBrowser(BrowserEngine.fromName(browser));
            }
            if (headless) {
                config.setHeadless(true);
            }
            if (overwrite) {
                config.setOverwrite(true);
            }
            if (quality != null) {
                config.setQuality(quality);
            }
            if (checkpoint != null) {
                config.setCheckpointPath(checkpoint);
            }
        }
    }
}
