package taskchain.engine.service;

import taskchain.engine.model.WorkflowStatus;

/**
 * Final outcome of a workflow. Only meaningful once {@link #isReady()}.
 */
public record WorkflowResultView(
        String workflowId,
        WorkflowStatus status,
        String finalResult) {

    public boolean isReady() {
        return status.isTerminal();
    }
}
