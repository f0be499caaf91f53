package com.lodestar.core.graph;

import com.lodestar.core.model.FileKind;
import com.lodestar.core.model.FileRecord;
import com.lodestar.core.model.PartialAnalysisException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Builds a {@link DependencyGraph} from the files of a snapshot.
 * <p>
 * Import specifiers come from an {@link ImportResolver} and are matched against project
 * files in this order, first rule with a hit wins:
 * <ol>
 *   <li>exact path ({@code internal/auth/auth.go})</li>
 *   <li>relative path against the importing file's directory ({@code ./util}, {@code ../model/user})</li>
 *   <li>path without extension ({@code src/auth/session})</li>
 *   <li>qualified name, dots as separators, matched as a path suffix ({@code com.acme.auth.Session})</li>
 *   <li>directory (package) suffix, linking every non-test file in that directory</li>
 *   <li>module-qualified package ({@code github.com/acme/svc/internal/auth}), matched by the longest
 *       project directory the specifier ends with</li>
 * </ol>
 * Specifiers matching nothing (third-party imports) are ignored. Test files additionally get a
 * {@link EdgeType#TEST_OF} edge to the source file they exercise, found by naming convention.
 * <p>
 * The builder is stateless; the same file set always yields the same graph.
 */
public class DependencyGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(DependencyGraphBuilder.class);

    static final double TEST_EDGE_STRENGTH = 0.5;

    private final ImportResolver importResolver;

    public DependencyGraphBuilder() {
        this(new MetadataImportResolver());
    }

    public DependencyGraphBuilder(ImportResolver importResolver) {
        this.importResolver = importResolver;
    }

    public DependencyGraph build(Collection<FileRecord> files) {
        return analyze(files).graph();
    }

    /**
     * Builds the graph and reports per-file resolution failures alongside it.
     */
    public GraphBuildResult analyze(Collection<FileRecord> files) {
        var index = new PathIndex(files);
        var edges = new LinkedHashSet<DependencyEdge>();
        var failures = new TreeMap<String, String>();

        for (FileRecord file : index.files) {
            List<String> specifiers;
            try {
                specifiers = importResolver.importsOf(file);
            } catch (PartialAnalysisException e) {
                log.warn("Could not resolve imports of {}, treating it as isolated: {}", file.path(), e.getMessage());
                failures.put(file.path(), e.getMessage());
                continue;
            }
            for (String specifier : specifiers) {
                for (String target : index.resolve(file, specifier)) {
                    if (!target.equals(file.path())) {
                        edges.add(DependencyEdge.imports(file.path(), target));
                    }
                }
            }
        }

        for (FileRecord file : index.files) {
            if (failures.containsKey(file.path()) || !isTestFile(file)) {
                continue;
            }
            index.subjectOf(file).ifPresent(subject ->
                    edges.add(new DependencyEdge(file.path(), subject, EdgeType.TEST_OF, TEST_EDGE_STRENGTH)));
        }

        var graph = new DependencyGraph(index.byPath.keySet(), edges);
        log.debug("Built dependency graph: {} nodes, {} edges, {} failures",
                graph.size(), graph.edges().size(), failures.size());
        return new GraphBuildResult(graph, failures);
    }

    private static boolean isTestFile(FileRecord file) {
        return file.kind() == FileKind.TEST || FileKind.detect(file.path()) == FileKind.TEST;
    }

    /**
     * Strips test naming conventions from a file name, returning null when none applies.
     * {@code FooTest.java -> Foo.java}, {@code foo_test.go -> foo.go}, {@code test_foo.py -> foo.py},
     * {@code foo.test.ts -> foo.ts}, {@code foo.spec.js -> foo.js}.
     */
    static String subjectFileName(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0) {
            return null;
        }
        String stem = fileName.substring(0, dot);
        String ext = fileName.substring(dot);
        for (String suffix : List.of(".test", ".spec")) {
            if (stem.endsWith(suffix) && stem.length() > suffix.length()) {
                return stem.substring(0, stem.length() - suffix.length()) + ext;
            }
        }
        if (stem.endsWith("_test") && stem.length() > 5) {
            return stem.substring(0, stem.length() - 5) + ext;
        }
        if (stem.startsWith("test_") && stem.length() > 5) {
            return stem.substring(5) + ext;
        }
        for (String suffix : List.of("Tests", "Test", "IT")) {
            if (stem.endsWith(suffix) && stem.length() > suffix.length()) {
                return stem.substring(0, stem.length() - suffix.length()) + ext;
            }
        }
        return null;
    }

    static String normalize(String path) {
        String p = path.replace('\\', '/');
        while (p.startsWith("./")) {
            p = p.substring(2);
        }
        if (p.startsWith("/")) {
            p = p.substring(1);
        }
        if (p.endsWith("/")) {
            p = p.substring(0, p.length() - 1);
        }
        return p;
    }

    private static String stripExtension(String path) {
        int slash = path.lastIndexOf('/');
        int dot = path.lastIndexOf('.');
        return dot > slash + 1 ? path.substring(0, dot) : path;
    }

    /**
     * Joins a relative specifier onto a directory, collapsing {@code .} and {@code ..} segments.
     * Returns null when the path climbs above the project root.
     */
    static String resolveRelative(String directory, String specifier) {
        var segments = new ArrayList<String>();
        if (!directory.isEmpty()) {
            segments.addAll(List.of(directory.split("/")));
        }
        for (String segment : specifier.split("/")) {
            if (segment.isEmpty() || segment.equals(".")) {
                continue;
            }
            if (segment.equals("..")) {
                if (segments.isEmpty()) {
                    return null;
                }
                segments.remove(segments.size() - 1);
            } else {
                segments.add(segment);
            }
        }
        return String.join("/", segments);
    }

    /** Lookup tables over one file set. */
    private static final class PathIndex {

        private final List<FileRecord> files;
        private final Map<String, FileRecord> byPath = new TreeMap<>();
        private final Map<String, Set<String>> byStem = new HashMap<>();
        private final Map<String, Set<String>> byDirectory = new HashMap<>();
        private final Map<String, Set<String>> byFileName = new HashMap<>();

        PathIndex(Collection<FileRecord> input) {
            for (FileRecord file : input) {
                byPath.putIfAbsent(file.path(), file);
            }
            this.files = List.copyOf(byPath.values());
            for (FileRecord file : files) {
                String path = normalize(file.path());
                byStem.computeIfAbsent(stripExtension(path), k -> new TreeSet<>()).add(file.path());
                byFileName.computeIfAbsent(file.fileName(), k -> new TreeSet<>()).add(file.path());
                if (!isTestFile(file)) {
                    byDirectory.computeIfAbsent(normalize(file.directory()), k -> new TreeSet<>()).add(file.path());
                }
            }
        }

        Set<String> resolve(FileRecord importer, String rawSpecifier) {
            String specifier = rawSpecifier.trim();
            if (specifier.length() > 1 && (specifier.startsWith("\"") || specifier.startsWith("'"))) {
                specifier = specifier.substring(1, specifier.length() - 1);
            }
            specifier = specifier.replace('\\', '/');
            if (specifier.isEmpty()) {
                return Set.of();
            }

            if (byPath.containsKey(specifier)) {
                return Set.of(specifier);
            }
            String candidate;
            if (specifier.startsWith("./") || specifier.startsWith("../")) {
                candidate = resolveRelative(normalize(importer.directory()), specifier);
                if (candidate == null) {
                    return Set.of();
                }
            } else {
                candidate = normalize(specifier);
            }
            if (byPath.containsKey(candidate)) {
                return Set.of(candidate);
            }
            Set<String> stems = byStem.get(candidate);
            if (stems != null) {
                return stems;
            }
            if (!candidate.contains("/") && candidate.indexOf('.') > 0) {
                Set<String> qualified = suffixMatches(byStem, candidate.replace('.', '/'));
                if (!qualified.isEmpty()) {
                    return qualified;
                }
            }
            Set<String> exactDir = byDirectory.get(candidate);
            if (exactDir != null) {
                return exactDir;
            }
            Set<String> dirSuffix = suffixMatches(byDirectory, candidate);
            if (!dirSuffix.isEmpty()) {
                return dirSuffix;
            }
            return modulePrefixed(candidate);
        }

        /**
         * Treats the specifier as {@code <module path>/<project directory>} and returns the files
         * of the longest project directory it ends with.
         */
        private Set<String> modulePrefixed(String specifier) {
            String best = null;
            for (String dir : byDirectory.keySet()) {
                if (!dir.isEmpty() && specifier.endsWith("/" + dir)
                        && (best == null || dir.length() > best.length())) {
                    best = dir;
                }
            }
            return best != null ? byDirectory.get(best) : Set.of();
        }

        Optional<String> subjectOf(FileRecord test) {
            String subjectName = subjectFileName(test.fileName());
            if (subjectName == null) {
                return Optional.empty();
            }
            List<FileRecord> candidates = byFileName.getOrDefault(subjectName, Set.of()).stream()
                    .map(byPath::get)
                    .filter(f -> !isTestFile(f))
                    .toList();
            if (candidates.isEmpty()) {
                return Optional.empty();
            }
            String testDir = normalize(test.directory());
            String mirroredDir = testDir.replace("src/test/", "src/main/");
            for (FileRecord candidate : candidates) {
                String dir = normalize(candidate.directory());
                if (dir.equals(testDir) || dir.equals(mirroredDir)) {
                    return Optional.of(candidate.path());
                }
            }
            return candidates.size() == 1
                    ? Optional.of(candidates.get(0).path())
                    : Optional.empty();
        }

        private static Set<String> suffixMatches(Map<String, Set<String>> table, String suffix) {
            var matches = new TreeSet<String>();
            String slashed = "/" + suffix;
            table.forEach((key, paths) -> {
                if (key.endsWith(slashed)) {
                    matches.addAll(paths);
                }
            });
            return matches;
        }
    }
}
