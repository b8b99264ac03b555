package taskchain.engine.resolver;

/**
 * Why dependency resolution failed a task before any job ran.
 */
public enum AutoFailCause {
    /** The referenced step number does not exist in the workflow */
    DEPENDENCY_NOT_FOUND,
    /** Following the dependency chain revisits a step number */
    CYCLE_DETECTED,
    /** The dependency terminated FAILED */
    DEPENDENCY_FAILED
}
