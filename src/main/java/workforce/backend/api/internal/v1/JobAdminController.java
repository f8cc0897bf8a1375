package workforce.backend.api.internal.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import workforce.backend.api.Controller;
import workforce.backend.api.internal.v1.dto.JobResponse;
import workforce.backend.api.internal.v1.dto.JobStatsResponse;
import workforce.backend.api.internal.v1.dto.OperationResponse;
import workforce.backend.server.RouterHandler;
import workforce.backend.service.JobAdminService;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Internal job queue administration.
 *
 * GET  /internal/v1/jobs/stats       - Counts by queue and status
 * GET  /internal/v1/jobs/failed      - Dead jobs (?queue=&limit=)
 * POST /internal/v1/jobs/{id}/retry  - Revive a FAILED job
 */
public class JobAdminController implements Controller {

    private static final String STATS_PATH = "/internal/v1/jobs/stats";
    private static final String FAILED_PATH = "/internal/v1/jobs/failed";
    private static final Pattern RETRY_PATTERN = Pattern.compile("^/internal/v1/jobs/([^/]+)/retry$");

    private static final int DEFAULT_LIMIT = 50;

    private final JobAdminService jobAdminService;

    public JobAdminController(JobAdminService jobAdminService) {
        this.jobAdminService = jobAdminService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.GET)) {
            return STATS_PATH.equals(path) || FAILED_PATH.equals(path);
        }
        return method.equals(HttpMethod.POST) && RETRY_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        if (STATS_PATH.equals(path)) {
            JobStatsResponse response = new JobStatsResponse(jobAdminService.stats(), jobAdminService.totals());
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
        }

        if (FAILED_PATH.equals(path)) {
            String queue = Controller.queryParam(req, "queue");
            int limit = Controller.intQueryParam(req, "limit", DEFAULT_LIMIT);
            List<JobResponse> jobs = jobAdminService.failed(queue, limit).stream()
                    .map(JobResponse::from)
                    .toList();
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(jobs));
        }

        Matcher retryMatcher = RETRY_PATTERN.matcher(path);
        if (retryMatcher.matches()) {
            if (jobAdminService.retry(retryMatcher.group(1))) {
                return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(OperationResponse.success()));
            }
            return ControllerResponse.json(
                    HttpResponseStatus.CONFLICT,
                    RouterHandler.mapper().writeValueAsString(OperationResponse.notFailed()));
        }

        return ControllerResponse.error(HttpResponseStatus.NOT_FOUND, "NOT_FOUND", "unknown job endpoint");
    }
}
