package org.example.coursearchiver.ledger;

import org.json.simple.parser.ParseException;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Durable progress ledger for learning paths, courses and units.
 * <p>
 * Every mutation is followed by a full snapshot written to disk. Storage problems are logged and
 * never thrown: the in-memory state stays authoritative for the rest of the session. Statistics
 * and per-path aggregates are moved only when the status of an entity actually changes, so
 * repeated calls for the same id never count twice.
 * <p>
 * The store has a single writer and is not thread-safe.
 */
public class CheckpointStore {

    public static final String PATH_PROPERTY = "archiver.checkpoint.path";
    public static final String DEFAULT_FILE_NAME = "download_progress.json";
    private static final String TEMP_EXTENSION = ".tmp";
    private static final String CORRUPT_EXTENSION = ".corrupt";
    private static final String BACKUP_EXTENSION = ".backup";

    private final Path file;
    private final Clock clock;
    private final Logger logger;
    private Ledger ledger = new Ledger();

    public CheckpointStore(Path file) {
        this(file, Clock.systemDefaultZone(), Logger.getLogger(CheckpointStore.class.getName()));
    }

    public CheckpointStore(Path file, Clock clock, Logger logger) {
        this.file = Objects.requireNonNull(file, "file");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    /**
     * Resolves the ledger location: JVM property first, then the supplied path, then the
     * default file in the working directory.
     */
    public static Path resolveLocation(String configured) {
        String override = System.getProperty(PATH_PROPERTY);
        if (override != null && !override.isBlank()) {
            return Paths.get(override.trim());
        }
        if (configured != null && !configured.isBlank()) {
            return Paths.get(configured.trim());
        }
        return Paths.get(DEFAULT_FILE_NAME);
    }

    public Path getFile() {
        return file;
    }

    // ------------------------------------------------------------------ storage

    /**
     * Reads the ledger from disk. A missing file starts an empty ledger; an unreadable one is
     * preserved next to the original with a {@code .corrupt} suffix and replaced by an empty
     * ledger.
     */
    public void load() {
        if (!Files.exists(file)) {
            logger.info(() -> "No existe registro de progreso en " + file + "; se inicia uno nuevo");
            ledger = new Ledger();
            return;
        }
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            ledger = LedgerCodec.decode(reader);
            logger.info(() -> "Registro de progreso cargado: " + ledger.courses.size() + " cursos, "
                    + ledger.learningPaths.size() + " rutas");
        } catch (IOException | ParseException | RuntimeException e) {
            logger.log(Level.SEVERE, "Registro de progreso ilegible en " + file
                    + "; se conserva una copia y se inicia uno vacío", e);
            preserveCorruptFile();
            ledger = new Ledger();
        }
    }

    /**
     * Writes the whole ledger through a temporary sibling and an atomic rename so a crash never
     * leaves a half-written document behind.
     */
    public void persist() {
        ledger.lastUpdated = now();
        Path temp = file.resolveSibling(file.getFileName() + TEMP_EXTENSION);
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (BufferedWriter writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                writer.write(LedgerCodec.encode(ledger));
            }
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            logger.log(Level.SEVERE, "No se pudo guardar el registro de progreso en " + file
                    + "; se continúa con el estado en memoria", e);
        }
    }

    /**
     * Copies the current ledger file to a {@code .backup} sibling before maintenance operations.
     *
     * @return the backup path, or {@code null} when there was nothing to copy or the copy failed
     */
    public Path backup() {
        if (!Files.exists(file)) {
            return null;
        }
        Path backup = file.resolveSibling(file.getFileName() + BACKUP_EXTENSION);
        try {
            Files.copy(file, backup, StandardCopyOption.REPLACE_EXISTING);
            return backup;
        } catch (IOException e) {
            logger.log(Level.WARNING, "No se pudo crear la copia de seguridad " + backup, e);
            return null;
        }
    }

    private void preserveCorruptFile() {
        Path corrupt = file.resolveSibling(file.getFileName() + CORRUPT_EXTENSION);
        try {
            Files.copy(file, corrupt, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            logger.log(Level.WARNING, "No se pudo conservar el registro corrupto en " + corrupt, e);
        }
    }

    // ------------------------------------------------------------------ session & paths

    public void startSession() {
        if (ledger.startedAt == null) {
            ledger.startedAt = now();
            persist();
        }
    }

    public void startLearningPath(String pathId, String title, int totalCourses) {
        LearningPathEntry path = ledger.learningPaths.get(pathId);
        if (path == null) {
            path = new LearningPathEntry(pathId, title);
            path.setStartedAt(now());
            ledger.learningPaths.put(pathId, path);
        } else if (title != null && !title.isBlank()) {
            path.setTitle(title);
        }
        path.setTotalCourses(Math.max(totalCourses, 0));
        path.setStatus(DownloadStatus.IN_PROGRESS);
        path.setCompletedAt(null);
        persist();
    }

    public void completeLearningPath(String pathId) {
        LearningPathEntry path = ledger.learningPaths.get(pathId);
        if (path == null) {
            logger.warning(() -> "Ruta de aprendizaje desconocida al completar: " + pathId);
            return;
        }
        if (path.getStatus() == DownloadStatus.COMPLETED) {
            return;
        }
        path.setStatus(DownloadStatus.COMPLETED);
        path.setCompletedAt(now());
        persist();
    }

    // ------------------------------------------------------------------ courses

    /**
     * Creates the course on first visit; on later visits keeps its units, merges the owning path
     * and moves it back to {@code in_progress}.
     */
    public void startCourse(String courseId, String title, String parentPathId) {
        CourseEntry course = ledger.courses.get(courseId);
        if (course == null) {
            course = new CourseEntry(courseId, title);
            ledger.courses.put(courseId, course);
            ledger.statistics.addTotalCourses(1);
        } else if (title != null && !title.isBlank()) {
            course.setTitle(title);
        }
        moveCourse(course, DownloadStatus.IN_PROGRESS);
        // Attach the new owner after the move so it is never debited for a state it never counted.
        course.addLearningPathId(parentPathId);
        course.setError(null);
        course.setStartedAt(now());
        course.setCompletedAt(null);
        persist();
    }

    public void completeCourse(String courseId) {
        CourseEntry course = requireCourse(courseId, "completar");
        if (course == null) {
            return;
        }
        if (moveCourse(course, DownloadStatus.COMPLETED)) {
            course.setError(null);
            course.setCompletedAt(now());
        }
        persist();
    }

    public void failCourse(String courseId, String error) {
        CourseEntry course = requireCourse(courseId, "marcar como fallido");
        if (course == null) {
            return;
        }
        moveCourse(course, DownloadStatus.FAILED);
        course.setError(error);
        course.setCompletedAt(now());
        ledger.errors.add(new ErrorRecord(ErrorRecord.Kind.COURSE, courseId, null, course.getTitle(), error, now()));
        persist();
    }

    /**
     * Records an additional owning path for a course satisfied by copying an earlier download.
     */
    public void linkCourseToPath(String courseId, String pathId) {
        CourseEntry course = requireCourse(courseId, "vincular");
        if (course == null) {
            return;
        }
        if (course.addLearningPathId(pathId)) {
            adjustPathCounters(pathId, course.getStatus(), 1);
            persist();
        }
    }

    public void recordOutputDirectory(String courseId, Path directory) {
        CourseEntry course = requireCourse(courseId, "registrar directorio");
        if (course == null || directory == null) {
            return;
        }
        course.setOutputDirectory(directory.toString());
        persist();
    }

    // ------------------------------------------------------------------ units

    public void startUnit(String courseId, String unitId, String title) {
        CourseEntry course = requireCourse(courseId, "iniciar unidad");
        if (course == null) {
            return;
        }
        UnitEntry unit = course.getUnit(unitId);
        if (unit == null) {
            unit = new UnitEntry(unitId, title);
            course.putUnit(unit);
            ledger.statistics.addTotalUnits(1);
        } else if (title != null && !title.isBlank()) {
            unit.setTitle(title);
        }
        moveUnit(unit, DownloadStatus.IN_PROGRESS);
        unit.setError(null);
        unit.setStartedAt(now());
        unit.setCompletedAt(null);
        persist();
    }

    public void completeUnit(String courseId, String unitId) {
        UnitEntry unit = requireUnit(courseId, unitId, "completar");
        if (unit == null) {
            return;
        }
        if (moveUnit(unit, DownloadStatus.COMPLETED)) {
            unit.setCompletedAt(now());
        }
        unit.setError(null);
        persist();
    }

    public void failUnit(String courseId, String unitId, String error) {
        UnitEntry unit = requireUnit(courseId, unitId, "marcar como fallida");
        if (unit == null) {
            return;
        }
        moveUnit(unit, DownloadStatus.FAILED);
        unit.setError(error);
        unit.setCompletedAt(now());
        ledger.errors.add(new ErrorRecord(ErrorRecord.Kind.UNIT, courseId, unitId, unit.getTitle(), error, now()));
        persist();
    }

    /**
     * Marks a unit that carries nothing to archive, such as a quiz. Skipped units never count as
     * completed or failed and are not revisited.
     */
    public void skipUnit(String courseId, String unitId, String title, String reason) {
        CourseEntry course = requireCourse(courseId, "omitir unidad");
        if (course == null) {
            return;
        }
        UnitEntry unit = course.getUnit(unitId);
        if (unit == null) {
            unit = new UnitEntry(unitId, title);
            course.putUnit(unit);
            ledger.statistics.addTotalUnits(1);
        }
        moveUnit(unit, DownloadStatus.SKIPPED);
        unit.setError(null);
        unit.setCompletedAt(now());
        logger.fine(() -> "Unidad omitida " + unitId + ": " + reason);
        persist();
    }

    // ------------------------------------------------------------------ decisions

    public boolean shouldSkipCourse(String courseId) {
        CourseEntry course = ledger.courses.get(courseId);
        return course != null
                && course.getStatus() == DownloadStatus.COMPLETED
                && !course.hasPendingUnits();
    }

    public boolean hasPendingUnits(String courseId) {
        CourseEntry course = ledger.courses.get(courseId);
        return course != null && course.hasPendingUnits();
    }

    public boolean shouldSkipUnit(String courseId, String unitId) {
        CourseEntry course = ledger.courses.get(courseId);
        if (course == null) {
            return false;
        }
        UnitEntry unit = course.getUnit(unitId);
        return unit != null
                && (unit.getStatus() == DownloadStatus.COMPLETED || unit.getStatus() == DownloadStatus.SKIPPED);
    }

    // ------------------------------------------------------------------ maintenance

    /**
     * Forces a full re-download of a course: the course goes back to {@code in_progress} and every
     * unit to {@code pending}, withdrawing their previous contribution to the statistics.
     *
     * @return {@code false} when the course is unknown
     */
    public boolean resetCourse(String courseId) {
        CourseEntry course = ledger.courses.get(courseId);
        if (course == null) {
            logger.warning(() -> "No se puede reiniciar un curso desconocido: " + courseId);
            return false;
        }
        moveCourse(course, DownloadStatus.IN_PROGRESS);
        course.setError(null);
        course.setCompletedAt(null);
        for (UnitEntry unit : course.getUnits()) {
            moveUnit(unit, DownloadStatus.PENDING);
            unit.setError(null);
            unit.setStartedAt(null);
            unit.setCompletedAt(null);
        }
        persist();
        return true;
    }

    /**
     * Puts failed units and failed courses back to {@code pending} so the next run retries them.
     * The error log keeps its history.
     *
     * @param courseId restricts the operation to one course, or {@code null} for all of them
     * @return number of units moved back to pending
     */
    public int retryFailed(String courseId) {
        int reopened = 0;
        for (CourseEntry course : ledger.courses.values()) {
            if (courseId != null && !courseId.equals(course.getId())) {
                continue;
            }
            for (UnitEntry unit : course.getUnits()) {
                if (unit.getStatus() == DownloadStatus.FAILED) {
                    moveUnit(unit, DownloadStatus.PENDING);
                    unit.setError(null);
                    unit.setCompletedAt(null);
                    reopened++;
                }
            }
            if (course.getStatus() == DownloadStatus.FAILED) {
                moveCourse(course, DownloadStatus.PENDING);
                course.setError(null);
                course.setCompletedAt(null);
            }
        }
        persist();
        return reopened;
    }

    /**
     * Deletes a course and its units from the ledger.
     *
     * @return {@code false} when the course is unknown
     */
    public boolean removeCourse(String courseId) {
        CourseEntry course = ledger.courses.get(courseId);
        if (course == null) {
            return false;
        }
        moveCourse(course, DownloadStatus.PENDING);
        for (UnitEntry unit : course.getUnits()) {
            moveUnit(unit, DownloadStatus.PENDING);
        }
        ledger.statistics.addTotalUnits(-course.getUnits().size());
        ledger.statistics.addTotalCourses(-1);
        ledger.courses.remove(courseId);
        persist();
        return true;
    }

    // ------------------------------------------------------------------ projections

    public CourseEntry getCourse(String courseId) {
        return ledger.courses.get(courseId);
    }

    public LearningPathEntry getLearningPath(String pathId) {
        return ledger.learningPaths.get(pathId);
    }

    public Collection<CourseEntry> getCourses() {
        return Collections.unmodifiableCollection(ledger.courses.values());
    }

    public Collection<LearningPathEntry> getLearningPaths() {
        return Collections.unmodifiableCollection(ledger.learningPaths.values());
    }

    public List<CourseEntry> getFailedCourses() {
        List<CourseEntry> failed = new ArrayList<>();
        for (CourseEntry course : ledger.courses.values()) {
            if (course.getStatus() == DownloadStatus.FAILED) {
                failed.add(course);
            }
        }
        return failed;
    }

    /**
     * Courses that are not finished or still hold units to download.
     */
    public List<CourseEntry> getPendingCourses() {
        List<CourseEntry> pending = new ArrayList<>();
        for (CourseEntry course : ledger.courses.values()) {
            if (course.getStatus() != DownloadStatus.COMPLETED || course.hasPendingUnits()) {
                pending.add(course);
            }
        }
        return pending;
    }

    public List<FailedUnit> getFailedUnits() {
        List<FailedUnit> failed = new ArrayList<>();
        for (CourseEntry course : ledger.courses.values()) {
            for (UnitEntry unit : course.getUnits()) {
                if (unit.getStatus() == DownloadStatus.FAILED) {
                    failed.add(new FailedUnit(course.getId(), course.getTitle(), unit));
                }
            }
        }
        return failed;
    }

    public List<ErrorRecord> getErrors() {
        return Collections.unmodifiableList(ledger.errors);
    }

    public LedgerStatistics getStatistics() {
        return ledger.statistics.copy();
    }

    public String getStartedAt() {
        return ledger.startedAt;
    }

    public String getLastUpdated() {
        return ledger.lastUpdated;
    }

    public record FailedUnit(String courseId, String courseTitle, UnitEntry unit) {
    }

    // ------------------------------------------------------------------ transitions

    private boolean moveCourse(CourseEntry course, DownloadStatus next) {
        DownloadStatus previous = course.getStatus();
        if (previous == next) {
            return false;
        }
        adjustCourseCounters(course, previous, -1);
        course.setStatus(next);
        adjustCourseCounters(course, next, 1);
        return true;
    }

    private void adjustCourseCounters(CourseEntry course, DownloadStatus status, int delta) {
        if (status == DownloadStatus.COMPLETED) {
            ledger.statistics.addCompletedCourses(delta);
        } else if (status == DownloadStatus.FAILED) {
            ledger.statistics.addFailedCourses(delta);
        } else {
            return;
        }
        for (String pathId : course.getLearningPathIds()) {
            adjustPathCounters(pathId, status, delta);
        }
    }

    private void adjustPathCounters(String pathId, DownloadStatus status, int delta) {
        LearningPathEntry path = ledger.learningPaths.get(pathId);
        if (path == null) {
            return;
        }
        if (status == DownloadStatus.COMPLETED) {
            path.setCompletedCourses(Math.max(0, path.getCompletedCourses() + delta));
        } else if (status == DownloadStatus.FAILED) {
            path.setFailedCourses(Math.max(0, path.getFailedCourses() + delta));
        }
    }

    private boolean moveUnit(UnitEntry unit, DownloadStatus next) {
        DownloadStatus previous = unit.getStatus();
        if (previous == next) {
            return false;
        }
        adjustUnitCounters(previous, -1);
        unit.setStatus(next);
        adjustUnitCounters(next, 1);
        return true;
    }

    private void adjustUnitCounters(DownloadStatus status, int delta) {
        if (status == DownloadStatus.COMPLETED) {
            ledger.statistics.addCompletedUnits(delta);
        } else if (status == DownloadStatus.FAILED) {
            ledger.statistics.addFailedUnits(delta);
        }
    }

    private CourseEntry requireCourse(String courseId, String action) {
        CourseEntry course = ledger.courses.get(courseId);
        if (course == null) {
            logger.warning(() -> "Curso desconocido al " + action + ": " + courseId);
        }
        return course;
    }

    private UnitEntry requireUnit(String courseId, String unitId, String action) {
        CourseEntry course = requireCourse(courseId, action + " unidad");
        if (course == null) {
            return null;
        }
        UnitEntry unit = course.getUnit(unitId);
        if (unit == null) {
            logger.warning(() -> "Unidad desconocida al " + action + ": " + unitId);
        }
        return unit;
    }

    private String now() {
        return LocalDateTime.now(clock).truncatedTo(ChronoUnit.MILLIS).toString();
    }
}
