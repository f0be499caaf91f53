package com.lodestar.core.graph;

import com.lodestar.core.model.FileRecord;
import com.lodestar.core.model.PartialAnalysisException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * Reads import specifiers from the {@code imports} metadata entry written by the analyzer.
 * Accepts either a collection of strings or a single comma-separated string.
 */
public class MetadataImportResolver implements ImportResolver {

    @Override
    public List<String> importsOf(FileRecord file) {
        Object raw = file.metadata().get(FileRecord.METADATA_IMPORTS);
        if (raw == null) {
            return List.of();
        }
        if (raw instanceof String text) {
            return Arrays.stream(text.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .toList();
        }
        if (raw instanceof Collection<?> values) {
            var imports = new ArrayList<String>(values.size());
            for (Object value : values) {
                if (!(value instanceof String specifier)) {
                    throw new PartialAnalysisException(file.path(),
                            "imports metadata of " + file.path() + " contains a non-string entry: " + value);
                }
                if (!specifier.isBlank()) {
                    imports.add(specifier.trim());
                }
            }
            return imports;
        }
        throw new PartialAnalysisException(file.path(),
                "imports metadata of " + file.path() + " has unsupported type " + raw.getClass().getSimpleName());
    }
}
