package com.lodestar.core.optimizer;

import com.lodestar.core.model.ContextConstraints;
import com.lodestar.core.model.ProjectSnapshot;
import com.lodestar.core.model.SelectedContext;
import com.lodestar.core.model.Task;

/**
 * Chooses the files of a snapshot that a task needs, within the given constraints.
 */
public interface ContextSelector {

    /**
     * @throws BudgetInfeasibleException only when {@link ContextConstraints#failWhenEmpty()} is set
     *                                   and nothing could be selected
     */
    SelectedContext select(ProjectSnapshot snapshot, Task task, ContextConstraints constraints);
}
