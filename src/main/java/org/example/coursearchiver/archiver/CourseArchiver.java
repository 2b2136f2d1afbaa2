package org.example.coursearchiver.archiver;

import org.example.coursearchiver.config.DownloadOptions;
import org.example.coursearchiver.ledger.CheckpointStore;
import org.example.coursearchiver.ledger.CourseEntry;
import org.example.coursearchiver.ledger.UnitEntry;
import org.example.coursearchiver.ledger.DownloadStatus;
import org.example.coursearchiver.media.MediaAcquisitionPipeline;
import org.example.coursearchiver.retry.Retrier;
import org.example.coursearchiver.retry.Sleeper;
import org.example.coursearchiver.site.ChapterOutline;
import org.example.coursearchiver.site.CourseOutline;
import org.example.coursearchiver.site.LearningPathListing;
import org.example.coursearchiver.site.SiteAccessException;
import org.example.coursearchiver.site.SiteAdapter;
import org.example.coursearchiver.site.SiteIds;
import org.example.coursearchiver.site.UnitDraft;
import org.example.coursearchiver.site.UnitRecord;
import org.example.coursearchiver.site.UnitType;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Walks learning path → course → unit, asking the {@link CheckpointStore} what is left to do and
 * recording every transition there before moving on.
 * <p>
 * Failures are contained at the smallest level that produced them: a unit failure is recorded and
 * the next unit starts, a course failure does not stop the rest of the path. Only
 * {@link InterruptedException} unwinds the whole run; the unit in flight then stays
 * {@code in_progress} and is retried on the next execution.
 */
public class CourseArchiver {

    static final String NO_ACCESS_ERROR = "Acceso denegado: el curso no está disponible en su suscripción";

    private final SiteAdapter site;
    private final CheckpointStore store;
    private final MediaAcquisitionPipeline pipeline;
    private final UnitContentWriter contentWriter;
    private final PageSnapshotter snapshotter;
    private final CourseCopier copier;
    private final CourseLayout layout;
    private final Retrier retrier;
    private final Sleeper sleeper;
    private final long unitDelayMillis;
    private final DownloadOptions options;
    private final Logger logger;

    private boolean sessionValidated;

    public CourseArchiver(SiteAdapter site,
                          CheckpointStore store,
                          MediaAcquisitionPipeline pipeline,
                          UnitContentWriter contentWriter,
                          PageSnapshotter snapshotter,
                          CourseCopier copier,
                          CourseLayout layout,
                          Retrier retrier,
                          Sleeper sleeper,
                          long unitDelayMillis,
                          DownloadOptions options,
                          Logger logger) {
        this.site = Objects.requireNonNull(site, "site");
        this.store = Objects.requireNonNull(store, "store");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.contentWriter = Objects.requireNonNull(contentWriter, "contentWriter");
        this.snapshotter = Objects.requireNonNull(snapshotter, "snapshotter");
        this.copier = Objects.requireNonNull(copier, "copier");
        this.layout = Objects.requireNonNull(layout, "layout");
        this.retrier = Objects.requireNonNull(retrier, "retrier");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.unitDelayMillis = Math.max(0L, unitDelayMillis);
        this.options = Objects.requireNonNull(options, "options");
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    /**
     * Archives every course of a learning path, in listing order.
     *
     * @return the outcome of each course, in the same order
     * @throws IOException when the session is invalid or the path listing cannot be read
     */
    public List<CourseOutcome> archiveLearningPath(String pathUrl) throws IOException, InterruptedException {
        ensureSession();
        String pathId = SiteIds.fromUrl(pathUrl);
        LearningPathListing listing = retrier.call("ruta de aprendizaje", () -> site.fetchLearningPath(pathUrl));
        List<String> courseUrls = listing.courseUrls();
        logger.info(() -> "Ruta de aprendizaje '" + listing.title() + "' con " + courseUrls.size() + " cursos");
        store.startLearningPath(pathId, listing.title(), courseUrls.size());

        List<CourseOutcome> outcomes = new ArrayList<>();
        for (int i = 0; i < courseUrls.size(); i++) {
            String courseUrl = courseUrls.get(i);
            int index = i + 1;
            logger.info(() -> "Curso " + index + "/" + courseUrls.size() + ": " + courseUrl);
            outcomes.add(processCourse(courseUrl, new CourseLayout.PathContext(pathId, listing.title(), index)));
        }

        store.completeLearningPath(pathId);
        long failed = outcomes.stream().filter(o -> o == CourseOutcome.FAILED).count();
        logger.info(() -> "Ruta '" + listing.title() + "' terminada: " + (outcomes.size() - failed)
                + " cursos correctos, " + failed + " con errores");
        return outcomes;
    }

    /**
     * Archives a single course outside any learning path.
     */
    public CourseOutcome archiveCourse(String courseUrl) throws IOException, InterruptedException {
        ensureSession();
        return processCourse(courseUrl, null);
    }

    private void ensureSession() throws IOException, InterruptedException {
        if (sessionValidated) {
            return;
        }
        boolean valid = retrier.call("validación de sesión", site::validateSession);
        if (!valid) {
            throw new SiteAccessException("La sesión no es válida. Inicie sesión en el perfil del navegador y vuelva a ejecutar");
        }
        sessionValidated = true;
    }

    private CourseOutcome processCourse(String courseUrl, @Nullable CourseLayout.PathContext path)
            throws InterruptedException {
        String courseId = SiteIds.fromUrl(courseUrl);
        String pathId = path == null ? null : path.pathId();

        if (store.shouldSkipCourse(courseId)) {
            CourseEntry existing = store.getCourse(courseId);
            if (pathId == null || existing.getLearningPathIds().contains(pathId)) {
                logger.info(() -> "Curso ya completado, se omite: " + courseUrl);
                return CourseOutcome.SKIPPED;
            }
            logger.info(() -> "Curso ya descargado en otra ruta de aprendizaje; se intentará copiar: " + courseUrl);
            if (copyToPath(existing, path)) {
                return CourseOutcome.COPIED;
            }
            logger.info(() -> "La copia falló; se descargará de nuevo: " + courseUrl);
        } else if (store.hasPendingUnits(courseId)) {
            logger.info(() -> "Reanudando curso con unidades pendientes: " + courseUrl);
        }

        try {
            CourseOutline outline = retrier.call("índice del curso", () -> site.fetchCourseOutline(courseUrl));
            store.startCourse(courseId, outline.title(), pathId);
            if (!outline.accessible()) {
                logger.warning(() -> "Sin acceso al curso '" + outline.title() + "'. Se marca como fallido y se continúa");
                store.failCourse(courseId, NO_ACCESS_ERROR);
                return CourseOutcome.FAILED;
            }

            Path courseDirectory = layout.courseDirectory(path, outline.title());
            Files.createDirectories(courseDirectory);
            store.recordOutputDirectory(courseId, courseDirectory);
            savePresentation(courseUrl, courseDirectory);

            List<ChapterOutline> chapters = outline.chapters();
            int unitsAttempted = 0;
            for (int c = 0; c < chapters.size(); c++) {
                ChapterOutline chapter = chapters.get(c);
                Path chapterDirectory = layout.chapterDirectory(courseDirectory, c + 1, chapter.title());
                Files.createDirectories(chapterDirectory);
                List<UnitDraft> units = chapter.units();
                for (int u = 0; u < units.size(); u++) {
                    if (processUnit(courseId, chapterDirectory, u + 1, units.get(u), unitsAttempted > 0)) {
                        unitsAttempted++;
                    }
                }
            }

            store.completeCourse(courseId);
            reportCourse(courseId, outline.title());
            return CourseOutcome.COMPLETED;
        } catch (IOException | RuntimeException e) {
            String error = "Error descargando el curso: " + e.getMessage();
            logger.log(Level.SEVERE, error + " (" + courseUrl + ")", e);
            if (store.getCourse(courseId) == null) {
                store.startCourse(courseId, courseId, pathId);
            }
            store.failCourse(courseId, error);
            return CourseOutcome.FAILED;
        }
    }

    /**
     * @return {@code true} when the unit was attempted, {@code false} when it was skipped
     */
    private boolean processUnit(String courseId, Path chapterDirectory, int index, UnitDraft draft, boolean pace)
            throws InterruptedException {
        String unitId = SiteIds.fromUrl(draft.url());
        if (store.shouldSkipUnit(courseId, unitId)) {
            logger.fine(() -> "Unidad ya completada, se omite: " + draft.title());
            return false;
        }
        if (draft.type() == UnitType.QUIZ) {
            store.skipUnit(courseId, unitId, draft.title(), "cuestionario sin contenido descargable");
            return false;
        }
        logRetry(courseId, unitId, draft.title());
        if (pace && unitDelayMillis > 0) {
            sleeper.sleep(unitDelayMillis);
        }

        store.startUnit(courseId, unitId, draft.title());
        UnitRecord unit;
        try {
            unit = retrier.call("datos de la unidad", () -> site.fetchUnit(draft));
        } catch (IOException | RuntimeException e) {
            String error = "Error obteniendo los datos de la unidad: " + e.getMessage();
            logger.log(Level.WARNING, error + " ('" + draft.title() + "'). Se continúa con la siguiente", e);
            store.failUnit(courseId, unitId, error);
            return true;
        }

        try {
            if (unit.type() == UnitType.QUIZ) {
                store.skipUnit(courseId, unitId, unit.title(), "cuestionario sin contenido descargable");
                return true;
            }
            String baseName = layout.unitBaseName(index, unit.title());
            if (unit.hasVideo()) {
                Path video = chapterDirectory.resolve(baseName + ".mp4");
                logger.info(() -> "Descargando vídeo: " + video.getFileName());
                pipeline.acquire(unit.manifests(), unit.url(), video, options);
            }
            contentWriter.write(unit, chapterDirectory, index, baseName);
            if (unit.type() == UnitType.LECTURE) {
                Path page = chapterDirectory.resolve(baseName + ".mhtml");
                logger.info(() -> "Guardando lectura: " + page.getFileName());
                snapshotter.snapshot(unit.url(), page);
            }
            store.completeUnit(courseId, unitId);
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            String error = "Error descargando la unidad: " + e.getMessage();
            logger.log(Level.WARNING, error + " ('" + unit.title() + "'). Se continúa con la siguiente", e);
            store.failUnit(courseId, unitId, error);
        }
        return true;
    }

    private void logRetry(String courseId, String unitId, String title) {
        CourseEntry course = store.getCourse(courseId);
        UnitEntry unit = course == null ? null : course.getUnit(unitId);
        if (unit == null) {
            return;
        }
        if (unit.getStatus() == DownloadStatus.FAILED) {
            logger.warning(() -> "Reintentando unidad fallida '" + title + "'. Error anterior: " + unit.getError());
        } else if (unit.getStatus() == DownloadStatus.IN_PROGRESS) {
            logger.info(() -> "Reanudando unidad interrumpida: " + title);
        }
    }

    private void savePresentation(String courseUrl, Path courseDirectory) throws InterruptedException {
        Path target = layout.presentationFile(courseDirectory);
        if (Files.exists(target) && !options.overwrite()) {
            return;
        }
        try {
            snapshotter.snapshot(courseUrl, target);
        } catch (IOException e) {
            logger.log(Level.WARNING, "No se pudo guardar la presentación del curso: " + e.getMessage());
        }
    }

    private boolean copyToPath(CourseEntry course, CourseLayout.PathContext path) {
        String stored = course.getOutputDirectory();
        if (stored == null || stored.isBlank()) {
            logger.warning(() -> "El curso " + course.getId() + " no tiene directorio de salida registrado");
            return false;
        }
        Path source = Paths.get(stored);
        if (!Files.isDirectory(source)) {
            logger.warning(() -> "El directorio del curso ya no existe: " + source);
            return false;
        }
        Path target = layout.courseDirectory(path, course.getTitle());
        try {
            if (!source.toAbsolutePath().normalize().equals(target.toAbsolutePath().normalize())) {
                copier.copy(source, target);
            }
        } catch (IOException e) {
            logger.log(Level.WARNING, "No se pudo copiar el curso a " + target + ": " + e.getMessage(), e);
            return false;
        }
        store.linkCourseToPath(course.getId(), path.pathId());
        return true;
    }

    private void reportCourse(String courseId, String title) {
        CourseEntry course = store.getCourse(courseId);
        if (course == null) {
            return;
        }
        long failed = course.countUnits(DownloadStatus.FAILED);
        if (failed > 0) {
            logger.warning(() -> "Curso '" + title + "' terminado con " + failed
                    + " unidades fallidas. Use retry-failed para reintentarlas");
        } else {
            logger.info(() -> "Curso '" + title + "' completado");
        }
    }
}
