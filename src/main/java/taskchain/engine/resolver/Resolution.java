package taskchain.engine.resolver;

import java.util.Objects;

/**
 * Outcome of resolving a task's dependency.
 */
public sealed interface Resolution {

    /** The task may run now. */
    record Runnable() implements Resolution {
    }

    /** The dependency has not reached a terminal state yet. */
    record Blocked(int dependencyStep) implements Resolution {
    }

    /** The task can never run; {@code reason} becomes its result output. */
    record AutoFailed(AutoFailCause cause, String reason) implements Resolution {
        public AutoFailed {
            Objects.requireNonNull(cause, "cause is required");
            Objects.requireNonNull(reason, "reason is required");
        }
    }

    static Resolution runnable() {
        return new Runnable();
    }

    static Resolution blocked(int dependencyStep) {
        return new Blocked(dependencyStep);
    }

    static Resolution autoFailed(AutoFailCause cause, String reason) {
        return new AutoFailed(cause, reason);
    }
}
