package com.lodestar.core.model;

import com.lodestar.core.config.ConfigurationException;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Which files may be packed at all. Must-include files are never filtered.
 *
 * @param minRelevanceScore files scoring below this are left out
 * @param includeTests      when false, test files are left out
 * @param includeDocs       when false, documentation is left out
 * @param excludedPatterns  files whose path contains any of these substrings are left out
 * @param preferredKinds    when non-empty, only files of these kinds are packed
 */
public record CandidateFilter(
    double minRelevanceScore,
    boolean includeTests,
    boolean includeDocs,
    List<String> excludedPatterns,
    Set<FileKind> preferredKinds
) {

    /** Admits every file. */
    public static final CandidateFilter NONE = new CandidateFilter(0.0, true, true, List.of(), Set.of());

    public CandidateFilter {
        if (minRelevanceScore < 0 || minRelevanceScore > 1 || Double.isNaN(minRelevanceScore)) {
            throw new ConfigurationException("minRelevanceScore must be in [0,1], got " + minRelevanceScore);
        }
        excludedPatterns = excludedPatterns == null ? List.of()
                : excludedPatterns.stream().filter(Objects::nonNull).filter(p -> !p.isEmpty()).distinct().toList();
        preferredKinds = preferredKinds == null || preferredKinds.isEmpty()
                ? Set.of()
                : Collections.unmodifiableSet(EnumSet.copyOf(preferredKinds));
    }

    public CandidateFilter withMinRelevanceScore(double score) {
        return new CandidateFilter(score, includeTests, includeDocs, excludedPatterns, preferredKinds);
    }

    public CandidateFilter withoutTestsAndDocs() {
        return new CandidateFilter(minRelevanceScore, false, false, excludedPatterns, preferredKinds);
    }

    public boolean admitsAll() {
        return equals(NONE);
    }

    /**
     * Why {@code scored} is left out, or empty when it may be packed.
     */
    public Optional<String> rejection(ScoredFile scored) {
        FileRecord file = scored.file();
        if (!preferredKinds.isEmpty() && !preferredKinds.contains(file.kind())) {
            return Optional.of("kind " + file.kind().name().toLowerCase(Locale.ROOT) + " not preferred");
        }
        for (String pattern : excludedPatterns) {
            if (file.path().contains(pattern)) {
                return Optional.of("matches excluded pattern '" + pattern + "'");
            }
        }
        if (!includeTests && file.kind() == FileKind.TEST) {
            return Optional.of("tests excluded");
        }
        if (!includeDocs && file.kind() == FileKind.DOC) {
            return Optional.of("documentation excluded");
        }
        if (scored.score() < minRelevanceScore) {
            return Optional.of(String.format(Locale.ROOT, "score %.2f below minimum %.2f",
                    scored.score(), minRelevanceScore));
        }
        return Optional.empty();
    }
}
