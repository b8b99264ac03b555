package taskchain.engine.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import taskchain.engine.api.Controller;
import taskchain.engine.api.v1.dto.HealthResponse;
import taskchain.engine.job.JobRegistry;
import taskchain.engine.server.RouterHandler;
import taskchain.engine.service.WorkflowService;
import taskchain.engine.store.Database;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.time.Duration;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);

    private final Database database;
    private final WorkflowService workflowService;
    private final JobRegistry jobRegistry;

    public HealthController(Database database, WorkflowService workflowService, JobRegistry jobRegistry) {
        this.database = database;
        this.workflowService = workflowService;
        this.jobRegistry = jobRegistry;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (!database.isHealthy()) {
                return unhealthy("connection failed");
            }

            HealthResponse response = HealthResponse.healthy(
                    formatUptime(),
                    workflowService.countQueued(),
                    workflowService.countInProgress(),
                    jobRegistry.taskTypes().size());

            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));

        } catch (Exception e) {
            log.error("Health check failed", e);
            try {
                return unhealthy(e.getMessage());
            } catch (Exception ex) {
                return ControllerResponse.error("health check failed");
            }
        }
    }

    private ControllerResponse unhealthy(String reason) throws Exception {
        return ControllerResponse.json(
                HttpResponseStatus.SERVICE_UNAVAILABLE,
                RouterHandler.mapper().writeValueAsString(HealthResponse.unhealthy(reason)));
    }

    private String formatUptime() {
        Duration duration = Duration.ofMillis(ManagementFactory.getRuntimeMXBean().getUptime());
        return duration.toHours() + "h " + duration.toMinutesPart() + "m";
    }
}
