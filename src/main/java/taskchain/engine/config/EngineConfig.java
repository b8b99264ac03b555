package taskchain.engine.config;

import java.time.Duration;
import java.util.function.Function;

/**
 * Configuration holder for engine settings.
 * All settings have sensible defaults.
 */
public final class EngineConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/taskchain;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "0.0.0.0";

    // Worker settings
    private String workerId = "worker-" + ProcessHandle.current().pid();
    private int workerCount = 1;
    private Duration pollInterval = Duration.ofSeconds(1);

    // Claim reaper settings
    private Duration claimStaleThreshold = Duration.ofMinutes(2);
    private Duration claimReaperInterval = Duration.ofSeconds(30);

    private EngineConfig() {
    }

    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    public static EngineConfig fromEnv() {
        return fromEnv(System::getenv);
    }

    /**
     * Apply {@code TASKCHAIN_*} overrides read through {@code env}.
     *
     * @throws IllegalArgumentException if a value is not a number or out of range
     */
    static EngineConfig fromEnv(Function<String, String> env) {
        EngineConfig config = new EngineConfig();

        String dbUrl = env.apply("TASKCHAIN_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.withDatabaseUrl(dbUrl);
        }

        String port = env.apply("TASKCHAIN_PORT");
        if (port != null && !port.isBlank()) {
            config.withServerPort(parseNumber("TASKCHAIN_PORT", port));
        }

        String workers = env.apply("TASKCHAIN_WORKERS");
        if (workers != null && !workers.isBlank()) {
            config.withWorkerCount(parseNumber("TASKCHAIN_WORKERS", workers));
        }

        String pollMs = env.apply("TASKCHAIN_POLL_INTERVAL_MS");
        if (pollMs != null && !pollMs.isBlank()) {
            config.withPollInterval(Duration.ofMillis(parseNumber("TASKCHAIN_POLL_INTERVAL_MS", pollMs)));
        }

        String staleSeconds = env.apply("TASKCHAIN_CLAIM_STALE_SECONDS");
        if (staleSeconds != null && !staleSeconds.isBlank()) {
            config.withClaimStaleThreshold(
                    Duration.ofSeconds(parseNumber("TASKCHAIN_CLAIM_STALE_SECONDS", staleSeconds)));
        }

        return config;
    }

    private static int parseNumber(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be a number, got: " + value);
        }
    }

    private static Duration requirePositive(String name, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return value;
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public String workerId() {
        return workerId;
    }

    public int workerCount() {
        return workerCount;
    }

    public Duration pollInterval() {
        return pollInterval;
    }

    public Duration claimStaleThreshold() {
        return claimStaleThreshold;
    }

    public Duration claimReaperInterval() {
        return claimReaperInterval;
    }

    // Fluent setters for testing/customization
    public EngineConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public EngineConfig withServerPort(int port) {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("serverPort must be between 0 and 65535");
        }
        this.serverPort = port;
        return this;
    }

    public EngineConfig withWorkerId(String workerId) {
        this.workerId = workerId;
        return this;
    }

    public EngineConfig withWorkerCount(int workerCount) {
        if (workerCount <= 0) {
            throw new IllegalArgumentException("workerCount must be positive");
        }
        this.workerCount = workerCount;
        return this;
    }

    public EngineConfig withPollInterval(Duration interval) {
        this.pollInterval = requirePositive("pollInterval", interval);
        return this;
    }

    public EngineConfig withClaimStaleThreshold(Duration threshold) {
        this.claimStaleThreshold = requirePositive("claimStaleThreshold", threshold);
        return this;
    }

    public EngineConfig withClaimReaperInterval(Duration interval) {
        this.claimReaperInterval = requirePositive("claimReaperInterval", interval);
        return this;
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", serverPort=" + serverPort +
                ", workerId='" + workerId + '\'' +
                ", workers=" + workerCount +
                ", pollInterval=" + pollInterval +
                '}';
    }
}
