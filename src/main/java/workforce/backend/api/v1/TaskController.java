package workforce.backend.api.v1;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import workforce.backend.api.Controller;
import workforce.backend.api.v1.dto.CreateTaskRequest;
import workforce.backend.api.v1.dto.RecommendationResponse;
import workforce.backend.api.v1.dto.TaskResponse;
import workforce.backend.api.v1.dto.UpdateStatusRequest;
import workforce.backend.model.StatusUpdateResult;
import workforce.backend.model.Task;
import workforce.backend.model.TaskStatus;
import workforce.backend.server.RouterHandler;
import workforce.backend.service.SkillService;
import workforce.backend.service.TaskService;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for task management (public API).
 *
 * POST   /api/v1/tasks              - Create a task
 * GET    /api/v1/tasks              - List tasks (?status=&assignee=&limit=)
 * GET    /api/v1/tasks/{id}         - Get a task
 * PATCH  /api/v1/tasks/{id}/status  - Change status
 * DELETE /api/v1/tasks/{id}         - Deactivate a task
 * GET    /api/v1/tasks/{id}/recommendations - Best-fitting employees for the task
 */
public class TaskController implements Controller {

    private static final Pattern TASKS_PATTERN = Pattern.compile("^/api/v1/tasks$");
    private static final Pattern TASK_BY_ID_PATTERN = Pattern.compile("^/api/v1/tasks/([^/]+)$");
    private static final Pattern TASK_STATUS_PATTERN = Pattern.compile("^/api/v1/tasks/([^/]+)/status$");
    private static final Pattern RECOMMENDATIONS_PATTERN =
            Pattern.compile("^/api/v1/tasks/([^/]+)/recommendations$");

    private static final int DEFAULT_LIMIT = 100;

    private final TaskService taskService;
    private final SkillService skillService;

    public TaskController(TaskService taskService, SkillService skillService) {
        this.taskService = taskService;
        this.skillService = skillService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (TASKS_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.POST) || method.equals(HttpMethod.GET);
        }
        if (TASK_BY_ID_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.GET) || method.equals(HttpMethod.DELETE);
        }
        if (RECOMMENDATIONS_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.GET);
        }
        return method.equals(HttpMethod.PATCH) && TASK_STATUS_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        String tenantId = Controller.tenantId(req);
        HttpMethod method = req.method();

        if (TASKS_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.POST)
                    ? handleCreate(tenantId, req)
                    : handleList(tenantId, req);
        }

        Matcher statusMatcher = TASK_STATUS_PATTERN.matcher(path);
        if (statusMatcher.matches()) {
            return handleUpdateStatus(tenantId, statusMatcher.group(1), req);
        }

        Matcher recommendationsMatcher = RECOMMENDATIONS_PATTERN.matcher(path);
        if (recommendationsMatcher.matches()) {
            List<RecommendationResponse> candidates = skillService
                    .recommend(tenantId, recommendationsMatcher.group(1)).stream()
                    .map(RecommendationResponse::from)
                    .toList();
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(candidates));
        }

        Matcher idMatcher = TASK_BY_ID_PATTERN.matcher(path);
        if (idMatcher.matches()) {
            String taskId = idMatcher.group(1);
            if (method.equals(HttpMethod.DELETE)) {
                taskService.deactivate(tenantId, taskId);
                return ControllerResponse.noContent();
            }
            Task task = taskService.get(tenantId, taskId);
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(TaskResponse.from(task)));
        }

        return ControllerResponse.error(HttpResponseStatus.NOT_FOUND, "NOT_FOUND", "unknown task endpoint");
    }

    /**
     * POST /api/v1/tasks
     */
    private ControllerResponse handleCreate(String tenantId, FullHttpRequest req) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        CreateTaskRequest request = RouterHandler.mapper().readValue(body, CreateTaskRequest.class);
        request.validate();

        Task task = taskService.create(tenantId, request.toDraft());

        return ControllerResponse.json(
                HttpResponseStatus.CREATED,
                RouterHandler.mapper().writeValueAsString(TaskResponse.from(task)));
    }

    /**
     * GET /api/v1/tasks
     */
    private ControllerResponse handleList(String tenantId, FullHttpRequest req) throws Exception {
        String statusParam = Controller.queryParam(req, "status");
        TaskStatus status = statusParam != null ? TaskStatus.parse(statusParam) : null;
        String assignee = Controller.queryParam(req, "assignee");
        int limit = Controller.intQueryParam(req, "limit", DEFAULT_LIMIT);

        List<TaskResponse> tasks = taskService.list(tenantId, status, assignee, limit).stream()
                .map(TaskResponse::from)
                .toList();

        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(tasks));
    }

    /**
     * PATCH /api/v1/tasks/{id}/status
     * Responds with the task plus {@code _meta.scoringQueued}.
     */
    private ControllerResponse handleUpdateStatus(String tenantId, String taskId, FullHttpRequest req)
            throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        UpdateStatusRequest request = RouterHandler.mapper().readValue(body, UpdateStatusRequest.class);

        StatusUpdateResult result = taskService.updateStatus(tenantId, taskId, request.parsedStatus());

        ObjectNode response = RouterHandler.mapper().valueToTree(TaskResponse.from(result.task()));
        response.putObject("_meta").put("scoringQueued", result.scoringQueued());

        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }
}
