package taskchain.engine.job;

/**
 * A job threw or returned an error output. The message is what gets stored
 * as the failed task's result output.
 */
public class JobExecutionException extends Exception {

    public JobExecutionException(String message) {
        super(message);
    }

    public JobExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
