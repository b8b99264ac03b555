package taskchain.engine.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import taskchain.engine.api.Controller;
import taskchain.engine.api.v1.dto.CreateWorkflowRequest;
import taskchain.engine.api.v1.dto.CreateWorkflowResponse;
import taskchain.engine.api.v1.dto.TaskResponse;
import taskchain.engine.api.v1.dto.WorkflowResultResponse;
import taskchain.engine.api.v1.dto.WorkflowStatusResponse;
import taskchain.engine.api.v1.dto.WorkflowSummaryResponse;
import taskchain.engine.definition.WorkflowDefinition;
import taskchain.engine.model.Workflow;
import taskchain.engine.server.RouterHandler;
import taskchain.engine.service.TaskSummaryView;
import taskchain.engine.service.WorkflowResultView;
import taskchain.engine.service.WorkflowService;
import taskchain.engine.service.WorkflowStatusView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for workflow submission and queries (public API).
 * 
 * POST /api/v1/workflows - Submit a workflow
 * GET /api/v1/workflows?limit=N - List the most recent workflows
 * GET /api/v1/workflows/{id}/status - Get workflow progress
 * GET /api/v1/workflows/{id}/results - Get the final result of a finished workflow
 * GET /api/v1/workflows/{id}/tasks - List the tasks of a workflow with their outputs
 */
public class WorkflowController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(WorkflowController.class);

    private static final Pattern WORKFLOWS_PATTERN = Pattern.compile("^/api/v1/workflows$");
    private static final Pattern STATUS_PATTERN = Pattern.compile("^/api/v1/workflows/([^/]+)/status$");
    private static final Pattern RESULTS_PATTERN = Pattern.compile("^/api/v1/workflows/([^/]+)/results$");
    private static final Pattern TASKS_PATTERN = Pattern.compile("^/api/v1/workflows/([^/]+)/tasks$");

    private static final int DEFAULT_LIST_LIMIT = 20;
    private static final int MAX_LIST_LIMIT = 500;

    private final WorkflowService workflowService;

    public WorkflowController(WorkflowService workflowService) {
        this.workflowService = workflowService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST) && WORKFLOWS_PATTERN.matcher(path).matches()) {
            return true;
        }
        if (method.equals(HttpMethod.GET)) {
            return WORKFLOWS_PATTERN.matcher(path).matches() ||
                    STATUS_PATTERN.matcher(path).matches() ||
                    RESULTS_PATTERN.matcher(path).matches() ||
                    TASKS_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (req.method().equals(HttpMethod.POST) && WORKFLOWS_PATTERN.matcher(path).matches()) {
                return handleCreate(req);
            }

            if (req.method().equals(HttpMethod.GET) && WORKFLOWS_PATTERN.matcher(path).matches()) {
                return handleList(req);
            }

            Matcher statusMatcher = STATUS_PATTERN.matcher(path);
            if (req.method().equals(HttpMethod.GET) && statusMatcher.matches()) {
                return handleGetStatus(statusMatcher.group(1));
            }

            Matcher resultsMatcher = RESULTS_PATTERN.matcher(path);
            if (req.method().equals(HttpMethod.GET) && resultsMatcher.matches()) {
                return handleGetResults(resultsMatcher.group(1));
            }

            Matcher tasksMatcher = TASKS_PATTERN.matcher(path);
            if (req.method().equals(HttpMethod.GET) && tasksMatcher.matches()) {
                return handleGetTasks(tasksMatcher.group(1));
            }

            return ControllerResponse.notFound("unknown workflow endpoint");

        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("malformed request body: " + e.getOriginalMessage());
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Workflow controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    /**
     * POST /api/v1/workflows
     */
    private ControllerResponse handleCreate(FullHttpRequest req) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        if (body.isBlank()) {
            throw new IllegalArgumentException("request body is required");
        }
        CreateWorkflowRequest request = RouterHandler.mapper().readValue(body, CreateWorkflowRequest.class);
        request.validate();

        WorkflowDefinition definition = request.resolveDefinition();
        Workflow workflow = workflowService.createWorkflow(definition, request.clientId(), request.payload());

        CreateWorkflowResponse response = new CreateWorkflowResponse(workflow.id(), definition.steps().size());
        return ControllerResponse.json(
                HttpResponseStatus.CREATED,
                RouterHandler.mapper().writeValueAsString(response));
    }

    /**
     * GET /api/v1/workflows/{id}/status
     */
    private ControllerResponse handleGetStatus(String workflowId) throws Exception {
        Optional<WorkflowStatusView> status = workflowService.getStatus(workflowId);
        if (status.isEmpty()) {
            return ControllerResponse.notFound("Workflow not found");
        }
        return ControllerResponse.json(
                RouterHandler.mapper().writeValueAsString(WorkflowStatusResponse.from(status.get())));
    }

    /**
     * GET /api/v1/workflows/{id}/results
     */
    private ControllerResponse handleGetResults(String workflowId) throws Exception {
        Optional<WorkflowResultView> result = workflowService.getResult(workflowId);
        if (result.isEmpty()) {
            return ControllerResponse.notFound("Workflow not found");
        }
        if (!result.get().isReady()) {
            return ControllerResponse.badRequest("Workflow is not completed yet");
        }
        return ControllerResponse.json(
                RouterHandler.mapper().writeValueAsString(WorkflowResultResponse.from(result.get())));
    }

    /**
     * GET /api/v1/workflows?limit=N
     */
    private ControllerResponse handleList(FullHttpRequest req) throws Exception {
        int limit = DEFAULT_LIST_LIMIT;
        List<String> limitParam = new QueryStringDecoder(req.uri()).parameters().get("limit");
        if (limitParam != null && !limitParam.isEmpty()) {
            try {
                limit = Integer.parseInt(limitParam.get(0));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("limit must be a number");
            }
            if (limit <= 0) {
                throw new IllegalArgumentException("limit must be positive");
            }
            limit = Math.min(limit, MAX_LIST_LIMIT);
        }

        List<WorkflowSummaryResponse> workflows = workflowService.findRecent(limit).stream()
                .map(WorkflowSummaryResponse::from)
                .toList();

        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(Map.of("workflows", workflows)));
    }

    /**
     * GET /api/v1/workflows/{id}/tasks
     */
    private ControllerResponse handleGetTasks(String workflowId) throws Exception {
        Optional<List<TaskSummaryView>> tasks = workflowService.getTasks(workflowId);
        if (tasks.isEmpty()) {
            return ControllerResponse.notFound("Workflow not found");
        }

        List<TaskResponse> body = tasks.get().stream()
                .map(TaskResponse::from)
                .toList();

        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                Map.of("workflowId", workflowId, "tasks", body)));
    }
}
