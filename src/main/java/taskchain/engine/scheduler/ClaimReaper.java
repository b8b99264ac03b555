package taskchain.engine.scheduler;

import taskchain.engine.config.EngineConfig;
import taskchain.engine.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * Background task that releases stale claims on QUEUED tasks.
 * 
 * A claim goes stale when a worker claims a task and then dies, or hits a
 * store error, before it writes the task's next status. Releasing the
 * claim lets another poll pick the task up again.
 * 
 * IN_PROGRESS tasks are left alone: a running job has no timeout.
 */
public class ClaimReaper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ClaimReaper.class);

    private final TaskRepository taskRepository;
    private final EngineConfig config;

    public ClaimReaper(TaskRepository taskRepository, EngineConfig config) {
        this.taskRepository = taskRepository;
        this.config = config;
    }

    @Override
    public void run() {
        try {
            reapStaleClaims();
        } catch (Exception e) {
            log.error("Claim reaper error", e);
        }
    }

    /**
     * Release claims older than the configured threshold.
     * 
     * @return number of claims released
     */
    public int reapStaleClaims() {
        Instant cutoff = Instant.now().minus(config.claimStaleThreshold());

        int released = taskRepository.releaseStaleClaims(cutoff);
        if (released == 0) {
            log.debug("No stale claims found");
        }
        return released;
    }
}
