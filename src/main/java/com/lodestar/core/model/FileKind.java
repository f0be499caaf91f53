package com.lodestar.core.model;

import com.lodestar.core.config.ConfigurationException;

import java.util.Locale;
import java.util.Set;

/**
 * Coarse classification of a project file, used by the scorer's preference tables.
 */
public enum FileKind {
    SOURCE,
    TEST,
    CONFIG,
    DOC,
    UNKNOWN;

    private static final Set<String> SOURCE_EXTENSIONS = Set.of(
            "go", "java", "kt", "scala", "groovy", "py", "js", "jsx", "ts", "tsx", "rs",
            "c", "cc", "cpp", "cxx", "h", "hpp", "cs", "rb", "php", "swift", "sh"
    );

    private static final Set<String> DOC_EXTENSIONS = Set.of("md", "mdx", "txt", "rst", "adoc");

    private static final Set<String> CONFIG_EXTENSIONS = Set.of(
            "yml", "yaml", "json", "toml", "xml", "properties", "ini", "conf", "gradle"
    );

    /**
     * Lenient parse used by manifests and the CLI. Accepts the enum names as well as the
     * long forms ("configuration", "documentation") some analyzers emit.
     */
    public static FileKind fromString(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "source", "src" -> SOURCE;
            case "test" -> TEST;
            case "config", "configuration" -> CONFIG;
            case "doc", "docs", "documentation" -> DOC;
            default -> UNKNOWN;
        };
    }

    /**
     * Strict parse for configuration and CLI input: like {@link #fromString} but rejects
     * values that name no kind.
     */
    public static FileKind parse(String value) {
        FileKind kind = fromString(value);
        if (kind == UNKNOWN && (value == null || !"unknown".equals(value.trim().toLowerCase(Locale.ROOT)))) {
            throw new ConfigurationException("Unknown file kind '" + value
                    + "', expected one of source, test, config, doc, unknown");
        }
        return kind;
    }

    /**
     * Classifies a project-relative path by naming convention and extension.
     * Test conventions win over the extension, so {@code auth_test.go} is a test.
     */
    public static FileKind detect(String path) {
        if (path == null || path.isBlank()) {
            return UNKNOWN;
        }
        String normalized = path.replace('\\', '/');
        String lower = normalized.toLowerCase(Locale.ROOT);
        String name = normalized.substring(normalized.lastIndexOf('/') + 1);
        String ext = extensionOf(name);

        if (looksLikeTest(lower, name)) {
            return TEST;
        }
        if (DOC_EXTENSIONS.contains(ext)) {
            return DOC;
        }
        if (CONFIG_EXTENSIONS.contains(ext) || name.equals("Dockerfile") || name.equals("Makefile")) {
            return CONFIG;
        }
        if (SOURCE_EXTENSIONS.contains(ext)) {
            return SOURCE;
        }
        return UNKNOWN;
    }

    static String extensionOf(String name) {
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    private static boolean looksLikeTest(String lowerPath, String name) {
        String lowerName = name.toLowerCase(Locale.ROOT);
        String stem = lowerName.contains(".") ? lowerName.substring(0, lowerName.indexOf('.')) : lowerName;
        if (!SOURCE_EXTENSIONS.contains(extensionOf(name))) {
            return false;
        }
        return stem.endsWith("_test")
                || stem.startsWith("test_")
                || name.matches(".*(Test|Tests|IT)\\.[A-Za-z]+")
                || lowerName.contains(".test.")
                || lowerName.contains(".spec.")
                || lowerPath.startsWith("test/")
                || lowerPath.startsWith("tests/")
                || lowerPath.contains("/test/")
                || lowerPath.contains("/tests/")
                || lowerPath.contains("/__tests__/");
    }
}
