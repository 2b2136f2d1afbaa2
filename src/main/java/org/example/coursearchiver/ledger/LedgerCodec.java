package org.example.coursearchiver.ledger;

import org.json.simple.JSONValue;
import org.json.simple.parser.ContainerFactory;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps the ledger to and from its JSON document. Objects are read into ordered maps so unit
 * order survives a reload.
 */
final class LedgerCodec {

    private static final ContainerFactory ORDERED_CONTAINERS = new ContainerFactory() {
        @Override
        public Map createObjectContainer() {
            return new LinkedHashMap<>();
        }

        @Override
        public List creatArrayContainer() {
            return new ArrayList<>();
        }
    };

    private LedgerCodec() {
    }

    static Ledger decode(Reader reader) throws IOException, ParseException {
        Object parsed = new JSONParser().parse(reader, ORDERED_CONTAINERS);
        if (!(parsed instanceof Map<?, ?> root)) {
            throw new ParseException(ParseException.ERROR_UNEXPECTED_TOKEN, parsed);
        }

        Ledger ledger = new Ledger();
        ledger.startedAt = asString(root.get("started_at"));
        ledger.lastUpdated = asString(root.get("last_updated"));

        for (Map.Entry<?, ?> entry : asMap(root.get("learning_paths")).entrySet()) {
            Map<?, ?> json = asMap(entry.getValue());
            String id = String.valueOf(entry.getKey());
            LearningPathEntry path = new LearningPathEntry(id, asString(json.get("title")));
            path.setStatus(DownloadStatus.fromWire(json.get("status")));
            path.setTotalCourses(asInt(json.get("total_courses")));
            path.setCompletedCourses(asInt(json.get("completed_courses")));
            path.setFailedCourses(asInt(json.get("failed_courses")));
            path.setStartedAt(asString(json.get("started_at")));
            path.setCompletedAt(asString(json.get("completed_at")));
            ledger.learningPaths.put(id, path);
        }

        for (Map.Entry<?, ?> entry : asMap(root.get("courses")).entrySet()) {
            Map<?, ?> json = asMap(entry.getValue());
            String id = String.valueOf(entry.getKey());
            CourseEntry course = new CourseEntry(id, asString(json.get("title")));
            course.setStatus(DownloadStatus.fromWire(json.get("status")));
            course.setError(asString(json.get("error")));
            course.setOutputDirectory(asString(json.get("output_dir")));
            course.setStartedAt(asString(json.get("started_at")));
            course.setCompletedAt(asString(json.get("completed_at")));
            for (Object pathId : asList(json.get("learning_path_ids"))) {
                course.addLearningPathId(String.valueOf(pathId));
            }
            // Ledgers written before courses could be shared carry a single owner.
            course.addLearningPathId(asString(json.get("learning_path_id")));

            for (Map.Entry<?, ?> unitEntry : asMap(json.get("units")).entrySet()) {
                Map<?, ?> unitJson = asMap(unitEntry.getValue());
                UnitEntry unit = new UnitEntry(String.valueOf(unitEntry.getKey()), asString(unitJson.get("title")));
                unit.setStatus(DownloadStatus.fromWire(unitJson.get("status")));
                unit.setError(asString(unitJson.get("error")));
                unit.setStartedAt(asString(unitJson.get("started_at")));
                unit.setCompletedAt(asString(unitJson.get("completed_at")));
                course.putUnit(unit);
            }
            ledger.courses.put(id, course);
        }

        for (Object item : asList(root.get("errors"))) {
            Map<?, ?> json = asMap(item);
            ErrorRecord.Kind kind = ErrorRecord.Kind.fromWire(json.get("type"));
            String courseId = asString(json.get("course_id"));
            if (courseId == null) {
                courseId = asString(json.get("id"));
            }
            ledger.errors.add(new ErrorRecord(kind,
                    courseId,
                    asString(json.get("unit_id")),
                    asString(json.get("title")),
                    asString(json.get("error")),
                    asString(json.get("timestamp"))));
        }

        Map<?, ?> stats = asMap(root.get("statistics"));
        ledger.statistics.restore(
                asInt(stats.get("total_courses")),
                asInt(stats.get("completed_courses")),
                asInt(stats.get("failed_courses")),
                asInt(stats.get("total_units")),
                asInt(stats.get("completed_units")),
                asInt(stats.get("failed_units")));
        return ledger;
    }

    static String encode(Ledger ledger) {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("started_at", ledger.startedAt);
        root.put("last_updated", ledger.lastUpdated);

        Map<String, Object> paths = new LinkedHashMap<>();
        for (LearningPathEntry path : ledger.learningPaths.values()) {
            Map<String, Object> json = new LinkedHashMap<>();
            json.put("title", path.getTitle());
            json.put("status", path.getStatus().getWireValue());
            json.put("total_courses", path.getTotalCourses());
            json.put("completed_courses", path.getCompletedCourses());
            json.put("failed_courses", path.getFailedCourses());
            json.put("started_at", path.getStartedAt());
            json.put("completed_at", path.getCompletedAt());
            paths.put(path.getId(), json);
        }
        root.put("learning_paths", paths);

        Map<String, Object> courses = new LinkedHashMap<>();
        for (CourseEntry course : ledger.courses.values()) {
            Map<String, Object> json = new LinkedHashMap<>();
            json.put("title", course.getTitle());
            json.put("status", course.getStatus().getWireValue());
            json.put("error", course.getError());
            json.put("learning_path_ids", new ArrayList<>(course.getLearningPathIds()));
            json.put("output_dir", course.getOutputDirectory());
            json.put("started_at", course.getStartedAt());
            json.put("completed_at", course.getCompletedAt());
            Map<String, Object> units = new LinkedHashMap<>();
            for (UnitEntry unit : course.getUnits()) {
                Map<String, Object> unitJson = new LinkedHashMap<>();
                unitJson.put("title", unit.getTitle());
                unitJson.put("status", unit.getStatus().getWireValue());
                unitJson.put("error", unit.getError());
                unitJson.put("started_at", unit.getStartedAt());
                unitJson.put("completed_at", unit.getCompletedAt());
                units.put(unit.getId(), unitJson);
            }
            json.put("units", units);
            courses.put(course.getId(), json);
        }
        root.put("courses", courses);

        List<Object> errors = new ArrayList<>();
        for (ErrorRecord error : ledger.errors) {
            Map<String, Object> json = new LinkedHashMap<>();
            json.put("type", error.kind().getWireValue());
            json.put("course_id", error.courseId());
            if (error.unitId() != null) {
                json.put("unit_id", error.unitId());
            }
            json.put("title", error.title());
            json.put("error", error.message());
            json.put("timestamp", error.timestamp());
            errors.add(json);
        }
        root.put("errors", errors);

        LedgerStatistics stats = ledger.statistics;
        Map<String, Object> statistics = new LinkedHashMap<>();
        statistics.put("total_courses", stats.getTotalCourses());
        statistics.put("completed_courses", stats.getCompletedCourses());
        statistics.put("failed_courses", stats.getFailedCourses());
        statistics.put("total_units", stats.getTotalUnits());
        statistics.put("completed_units", stats.getCompletedUnits());
        statistics.put("failed_units", stats.getFailedUnits());
        root.put("statistics", statistics);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("version", Ledger.VERSION);
        root.put("metadata", metadata);

        return JSONValue.toJSONString(root);
    }

    private static Map<?, ?> asMap(Object value) {
        return value instanceof Map<?, ?> map ? map : Collections.emptyMap();
    }

    private static List<?> asList(Object value) {
        return value instanceof List<?> list ? list : Collections.emptyList();
    }

    private static String asString(Object value) {
        if (value == null) {
            return null;
        }
        String str = value.toString();
        return str.isBlank() ? null : str;
    }

    private static int asInt(Object value) {
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value == null) {
            return 0;
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException ex) {
            return 0;
        }
    }
}
