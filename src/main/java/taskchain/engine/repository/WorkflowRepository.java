package taskchain.engine.repository;

import taskchain.engine.model.Workflow;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Workflow persistence.
 */
public interface WorkflowRepository {

    /**
     * Save a new workflow.
     * 
     * @param workflow the workflow to save
     */
    void save(Workflow workflow);

    /**
     * Overwrite status, final result and finish time of a workflow.
     * 
     * @param workflow the workflow with its new state
     * @return true if a row was updated
     */
    boolean update(Workflow workflow);

    /**
     * Find a workflow by ID.
     * 
     * @param workflowId the workflow ID
     * @return the workflow if found
     */
    Optional<Workflow> findById(String workflowId);

    /**
     * Get recent workflows ordered by creation time.
     * 
     * @param limit maximum results
     * @return list of workflows
     */
    List<Workflow> findRecent(int limit);
}
