package taskchain.engine.store;

/**
 * Persistence failure. Never handled inside the engine: it aborts the
 * current task's processing and reaches the caller.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
