package taskchain.engine.job;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps task types to job implementations.
 */
public class JobRegistry {

    private static final Logger log = LoggerFactory.getLogger(JobRegistry.class);

    private final Map<String, Job> jobs = new ConcurrentHashMap<>();

    /**
     * Register a job for a task type, replacing any previous registration.
     */
    public JobRegistry register(String taskType, Job job) {
        if (taskType == null || taskType.isBlank()) {
            throw new IllegalArgumentException("taskType is required");
        }
        Objects.requireNonNull(job, "job is required");

        Job previous = jobs.put(taskType, job);
        if (previous != null) {
            log.warn("Job for task type '{}' replaced: {} -> {}", taskType,
                    previous.getClass().getSimpleName(), job.getClass().getSimpleName());
        } else {
            log.debug("Registered job {} for task type '{}'", job.getClass().getSimpleName(), taskType);
        }
        return this;
    }

    /**
     * Find the job for a task type.
     *
     * @throws UnknownJobTypeException if nothing is registered for the type
     */
    public Job lookup(String taskType) {
        Job job = taskType != null ? jobs.get(taskType) : null;
        if (job == null) {
            throw new UnknownJobTypeException(taskType);
        }
        return job;
    }

    public Set<String> taskTypes() {
        return Set.copyOf(jobs.keySet());
    }
}
