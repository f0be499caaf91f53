package com.lodestar.snapshot;

import com.lodestar.core.model.ProjectSnapshot;

/**
 * Produces the immutable {@link ProjectSnapshot} the engine selects from.
 */
public interface ProjectSnapshotProvider {

    /**
     * @param source provider-specific location of the project description
     * @throws SnapshotException if the source cannot be read or is malformed
     */
    ProjectSnapshot snapshot(String source);
}
