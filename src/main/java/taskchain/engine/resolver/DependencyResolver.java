package taskchain.engine.resolver;

import taskchain.engine.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.function.IntFunction;

/**
 * Classifies a task as runnable, blocked or auto-failed from the state of
 * its dependency. Reads only; the caller writes whatever follows.
 */
public class DependencyResolver {

    private static final Logger log = LoggerFactory.getLogger(DependencyResolver.class);

    /**
     * Resolve the dependency of a task.
     *
     * @param task         the task to classify
     * @param lookupByStep finds a sibling task in the same workflow by step number
     * @return the classification
     */
    public Resolution resolve(Task task, IntFunction<Optional<Task>> lookupByStep) {
        if (!task.hasDependency()) {
            return Resolution.runnable();
        }

        int dependencyStep = task.dependsOn();
        Optional<Task> dependencyOpt = lookupByStep.apply(dependencyStep);
        if (dependencyOpt.isEmpty()) {
            log.info("Task {} [{}] depends on missing step {}", task.id(), task.stepNumber(), dependencyStep);
            return Resolution.autoFailed(AutoFailCause.DEPENDENCY_NOT_FOUND,
                    "Dependency task \"" + dependencyStep + "\" of task " + task.id() + " not found.");
        }

        // Must run before the status check: members of a cycle would otherwise block each other forever
        if (hasCycle(task, lookupByStep)) {
            log.info("Cycle dependency detected for task {} [{}]", task.id(), task.stepNumber());
            return Resolution.autoFailed(AutoFailCause.CYCLE_DETECTED,
                    "Cycle detected in dependency chain of task " + task.id());
        }

        Task dependency = dependencyOpt.get();
        return switch (dependency.status()) {
            case QUEUED, IN_PROGRESS, BLOCKED -> {
                log.info("Task {} [{}] is blocked because its dependency \"{}\" is {}",
                        task.id(), task.stepNumber(), dependencyStep, dependency.status());
                yield Resolution.blocked(dependencyStep);
            }
            case FAILED -> {
                log.info("Task {} [{}] fails because its dependency \"{}\" failed",
                        task.id(), task.stepNumber(), dependencyStep);
                yield Resolution.autoFailed(AutoFailCause.DEPENDENCY_FAILED,
                        "This task can not be executed because its dependency \"" + dependencyStep
                                + "\" task failed.");
            }
            case COMPLETED -> Resolution.runnable();
        };
    }

    /**
     * Follow {@code dependsOn} from {@code start} and report whether a step
     * number comes up twice. Each hop adds a step to the visited set, so the
     * walk ends after at most as many hops as the workflow has tasks.
     */
    boolean hasCycle(Task start, IntFunction<Optional<Task>> lookupByStep) {
        Set<Integer> visited = new HashSet<>();
        Task current = start;

        while (current != null) {
            if (!visited.add(current.stepNumber())) {
                return true;
            }
            if (!current.hasDependency()) {
                return false;
            }
            current = lookupByStep.apply(current.dependsOn()).orElse(null);
        }
        return false;
    }
}
