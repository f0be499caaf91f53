package com.lodestar.core.scoring;

import com.lodestar.core.model.FileKind;
import com.lodestar.core.model.TaskType;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Static preference tables behind the path, file-type, task-type and language factors.
 */
final class ScoringTables {

    static final double NEUTRAL = 0.5;

    /** Checked in order; the first directory present in the path wins. */
    private static final Map<String, Double> CORE_DIRECTORIES = new LinkedHashMap<>();

    private static final List<String> VENDOR_DIRECTORIES = List.of("/vendor/", "/node_modules/", "/third_party/");

    private static final Map<TaskType, Map<FileKind, Double>> FILE_TYPE = new EnumMap<>(TaskType.class);

    private static final Map<String, Map<TaskType, Double>> LANGUAGE = new LinkedHashMap<>();

    static {
        CORE_DIRECTORIES.put("/cmd/", 0.9);
        CORE_DIRECTORIES.put("/core/", 0.9);
        CORE_DIRECTORIES.put("/internal/", 0.8);
        CORE_DIRECTORIES.put("/api/", 0.8);
        CORE_DIRECTORIES.put("/src/", 0.8);
        CORE_DIRECTORIES.put("/pkg/", 0.7);
        CORE_DIRECTORIES.put("/lib/", 0.7);

        FILE_TYPE.put(TaskType.FEATURE, kinds(0.9, 0.3, 0.5, 0.2));
        FILE_TYPE.put(TaskType.DEBUG, kinds(1.0, 0.7, 0.4, 0.1));
        FILE_TYPE.put(TaskType.REFACTOR, kinds(1.0, 0.8, 0.3, 0.2));
        FILE_TYPE.put(TaskType.TEST, kinds(0.8, 1.0, 0.3, 0.2));
        FILE_TYPE.put(TaskType.DOCUMENTATION, kinds(0.5, 0.2, 0.4, 1.0));

        for (String code : List.of("go", "java", "kotlin", "python", "javascript", "typescript", "rust", "c++")) {
            LANGUAGE.put(code, tasks(0.9, 0.9, 0.9, 0.9, 0.6));
        }
        LANGUAGE.put("markdown", tasks(0.3, 0.2, 0.2, 0.3, 1.0));
        LANGUAGE.put("yaml", tasks(0.5, 0.4, 0.3, 0.4, 0.6));
        LANGUAGE.put("json", tasks(0.4, 0.4, 0.3, 0.4, 0.5));
    }

    private ScoringTables() {}

    static double pathRelevance(String path, TaskType taskType) {
        String p = "/" + path.toLowerCase(Locale.ROOT).replace('\\', '/');
        if (taskType != TaskType.TEST && p.contains("/test")) {
            return 0.2;
        }
        if (taskType != TaskType.DOCUMENTATION && p.contains("/doc")) {
            return 0.3;
        }
        for (String vendor : VENDOR_DIRECTORIES) {
            if (p.contains(vendor)) {
                return 0.1;
            }
        }
        for (var entry : CORE_DIRECTORIES.entrySet()) {
            if (p.contains(entry.getKey())) {
                return entry.getValue();
            }
        }
        return NEUTRAL;
    }

    static double fileType(TaskType taskType, FileKind kind) {
        Map<FileKind, Double> prefs = FILE_TYPE.get(taskType);
        if (prefs == null) {
            return NEUTRAL;
        }
        return prefs.getOrDefault(kind, NEUTRAL);
    }

    static double taskType(String path, TaskType taskType) {
        String lower = path.toLowerCase(Locale.ROOT);
        return switch (taskType) {
            case DEBUG -> lower.contains("error") || lower.contains("log") ? 0.8 : NEUTRAL;
            case TEST -> path.contains("_test") || path.contains("test_") || path.contains("Test.") ? 1.0 : NEUTRAL;
            case REFACTOR -> lower.contains("interface") || lower.contains("abstract") || lower.contains("api")
                    ? 0.8 : NEUTRAL;
            default -> NEUTRAL;
        };
    }

    static double language(String language, TaskType taskType) {
        Map<TaskType, Double> prefs = LANGUAGE.get(language);
        if (prefs == null) {
            return NEUTRAL;
        }
        return prefs.getOrDefault(taskType, NEUTRAL);
    }

    private static Map<FileKind, Double> kinds(double source, double test, double config, double doc) {
        var map = new EnumMap<FileKind, Double>(FileKind.class);
        map.put(FileKind.SOURCE, source);
        map.put(FileKind.TEST, test);
        map.put(FileKind.CONFIG, config);
        map.put(FileKind.DOC, doc);
        return map;
    }

    private static Map<TaskType, Double> tasks(double feature, double debug, double refactor, double test, double doc) {
        var map = new EnumMap<TaskType, Double>(TaskType.class);
        map.put(TaskType.FEATURE, feature);
        map.put(TaskType.DEBUG, debug);
        map.put(TaskType.REFACTOR, refactor);
        map.put(TaskType.TEST, test);
        map.put(TaskType.DOCUMENTATION, doc);
        return map;
    }
}
