package workforce.backend.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import workforce.backend.api.Controller;
import workforce.backend.api.v1.dto.EmployeeRequest;
import workforce.backend.api.v1.dto.EmployeeResponse;
import workforce.backend.api.v1.dto.PerformanceLogResponse;
import workforce.backend.api.v1.dto.ScoreResponse;
import workforce.backend.api.v1.dto.SkillGapResponse;
import workforce.backend.server.RouterHandler;
import workforce.backend.service.EmployeeService;
import workforce.backend.service.ScoreService;
import workforce.backend.service.SkillService;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for employee profiles and performance (public API).
 *
 * PUT /api/v1/employees/{id}                  - Create or replace the skill profile
 * GET /api/v1/employees/{id}                  - Get the skill profile
 * GET /api/v1/employees/{id}/score            - Current score, trend and explanation
 * GET /api/v1/employees/{id}/performance-logs - Score history, newest first (?limit=)
 * GET /api/v1/employees/{id}/skill-gaps       - Skills missing for the employee's role
 */
public class EmployeeController implements Controller {

    private static final Pattern PROFILE_PATTERN = Pattern.compile("^/api/v1/employees/([^/]+)$");
    private static final Pattern SCORE_PATTERN = Pattern.compile("^/api/v1/employees/([^/]+)/score$");
    private static final Pattern LOGS_PATTERN = Pattern.compile("^/api/v1/employees/([^/]+)/performance-logs$");
    private static final Pattern GAPS_PATTERN = Pattern.compile("^/api/v1/employees/([^/]+)/skill-gaps$");

    private static final int DEFAULT_LIMIT = 30;

    private final ScoreService scoreService;
    private final EmployeeService employeeService;
    private final SkillService skillService;

    public EmployeeController(ScoreService scoreService, EmployeeService employeeService, SkillService skillService) {
        this.scoreService = scoreService;
        this.employeeService = employeeService;
        this.skillService = skillService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (PROFILE_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.GET) || method.equals(HttpMethod.PUT);
        }
        return method.equals(HttpMethod.GET)
                && (SCORE_PATTERN.matcher(path).matches()
                        || LOGS_PATTERN.matcher(path).matches()
                        || GAPS_PATTERN.matcher(path).matches());
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        String tenantId = Controller.tenantId(req);

        Matcher profileMatcher = PROFILE_PATTERN.matcher(path);
        if (profileMatcher.matches()) {
            return req.method().equals(HttpMethod.PUT)
                    ? handleSave(tenantId, profileMatcher.group(1), req)
                    : json(EmployeeResponse.from(employeeService.get(tenantId, profileMatcher.group(1))));
        }

        Matcher scoreMatcher = SCORE_PATTERN.matcher(path);
        if (scoreMatcher.matches()) {
            return json(ScoreResponse.from(scoreService.score(tenantId, scoreMatcher.group(1))));
        }

        Matcher logsMatcher = LOGS_PATTERN.matcher(path);
        if (logsMatcher.matches()) {
            int limit = Controller.intQueryParam(req, "limit", DEFAULT_LIMIT);
            List<PerformanceLogResponse> logs = scoreService.history(tenantId, logsMatcher.group(1), limit).stream()
                    .map(PerformanceLogResponse::from)
                    .toList();
            return json(logs);
        }

        Matcher gapsMatcher = GAPS_PATTERN.matcher(path);
        if (gapsMatcher.matches()) {
            return json(SkillGapResponse.from(skillService.skillGaps(tenantId, gapsMatcher.group(1))));
        }

        return ControllerResponse.error(HttpResponseStatus.NOT_FOUND, "NOT_FOUND", "unknown employee endpoint");
    }

    /**
     * PUT /api/v1/employees/{id}
     */
    private ControllerResponse handleSave(String tenantId, String employeeId, FullHttpRequest req) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        EmployeeRequest request = RouterHandler.mapper().readValue(body, EmployeeRequest.class);

        return json(EmployeeResponse.from(employeeService.save(tenantId, employeeId, request.toDraft())));
    }

    private static ControllerResponse json(Object body) throws Exception {
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(body));
    }
}
