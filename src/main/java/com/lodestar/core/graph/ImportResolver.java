package com.lodestar.core.graph;

import com.lodestar.core.model.FileRecord;

import java.util.List;

/**
 * Supplies the raw import specifiers of a file.
 * <p>
 * How specifiers are obtained is language specific and lives outside the engine; the
 * builder only turns them into edges between project files.
 */
public interface ImportResolver {

    /**
     * @param file the file to inspect
     * @return import specifiers in source order, never null
     * @throws com.lodestar.core.model.PartialAnalysisException if the file's imports cannot be read
     */
    List<String> importsOf(FileRecord file);
}
