package taskchain.engine.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EngineConfigTest {

    @Test
    void defaults() {
        EngineConfig config = EngineConfig.defaults();

        assertEquals(8080, config.serverPort());
        assertEquals("0.0.0.0", config.serverHost());
        assertEquals(1, config.workerCount());
        assertEquals(Duration.ofSeconds(1), config.pollInterval());
        assertEquals(Duration.ofMinutes(2), config.claimStaleThreshold());
        assertEquals(Duration.ofSeconds(30), config.claimReaperInterval());
        assertTrue(config.databaseUrl().contains("MODE=PostgreSQL"));
        assertTrue(config.workerId().startsWith("worker-"));
    }

    @Test
    void fluentSettersOverrideDefaults() {
        EngineConfig config = EngineConfig.defaults()
                .withServerPort(9090)
                .withWorkerId("w-1")
                .withWorkerCount(4)
                .withClaimReaperInterval(Duration.ofSeconds(5));

        assertEquals(9090, config.serverPort());
        assertEquals("w-1", config.workerId());
        assertEquals(4, config.workerCount());
        assertEquals(Duration.ofSeconds(5), config.claimReaperInterval());
    }

    @Test
    void workerCountMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> EngineConfig.defaults().withWorkerCount(0));
    }

    @Test
    void invalidDurationsAndPortRejected() {
        assertThrows(IllegalArgumentException.class, () -> EngineConfig.defaults().withPollInterval(Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
                () -> EngineConfig.defaults().withClaimStaleThreshold(Duration.ofSeconds(-1)));
        assertThrows(IllegalArgumentException.class, () -> EngineConfig.defaults().withClaimReaperInterval(null));
        assertThrows(IllegalArgumentException.class, () -> EngineConfig.defaults().withServerPort(70000));
        assertEquals(0, EngineConfig.defaults().withServerPort(0).serverPort());
    }

    @Test
    @DisplayName("Environment overrides go through the same validation as the setters")
    void environmentOverrides() {
        Map<String, String> env = Map.of(
                "TASKCHAIN_PORT", "9191",
                "TASKCHAIN_WORKERS", "2",
                "TASKCHAIN_POLL_INTERVAL_MS", "250",
                "TASKCHAIN_CLAIM_STALE_SECONDS", "60");

        EngineConfig config = EngineConfig.fromEnv(env::get);

        assertEquals(9191, config.serverPort());
        assertEquals(2, config.workerCount());
        assertEquals(Duration.ofMillis(250), config.pollInterval());
        assertEquals(Duration.ofSeconds(60), config.claimStaleThreshold());

        assertThrows(IllegalArgumentException.class,
                () -> EngineConfig.fromEnv(Map.of("TASKCHAIN_WORKERS", "0")::get));
        assertThrows(IllegalArgumentException.class,
                () -> EngineConfig.fromEnv(Map.of("TASKCHAIN_POLL_INTERVAL_MS", "0")::get));
        assertThrows(IllegalArgumentException.class,
                () -> EngineConfig.fromEnv(Map.of("TASKCHAIN_CLAIM_STALE_SECONDS", "-5")::get));
        assertThrows(IllegalArgumentException.class,
                () -> EngineConfig.fromEnv(Map.of("TASKCHAIN_WORKERS", "many")::get));
    }
}
