package taskchain.engine.job;

/**
 * Value returned by a {@link Job}.
 *
 * @param output serialized output, stored verbatim in the result
 * @param error  true when the job completed but reports a failure
 */
public record JobOutput(String output, boolean error) {

    public static JobOutput success(String output) {
        return new JobOutput(output, false);
    }

    public static JobOutput error(String output) {
        return new JobOutput(output, true);
    }
}
