package workforce.backend.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import workforce.backend.api.Controller;
import workforce.backend.api.v1.dto.HealthResponse;
import workforce.backend.ledger.LedgerClient;
import workforce.backend.model.JobStatus;
import workforce.backend.server.RouterHandler;
import workforce.backend.service.JobAdminService;
import workforce.backend.store.Database;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.time.Duration;
import java.util.Map;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    private static final String VERSION = "1.0.0";

    private final Database database;
    private final JobAdminService jobAdminService;
    private final LedgerClient ledgerClient;

    public HealthController(Database database, JobAdminService jobAdminService, LedgerClient ledgerClient) {
        this.database = database;
        this.jobAdminService = jobAdminService;
        this.ledgerClient = ledgerClient;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        if (!database.isHealthy()) {
            return ControllerResponse.json(
                    HttpResponseStatus.SERVICE_UNAVAILABLE,
                    RouterHandler.mapper().writeValueAsString(HealthResponse.unhealthy("connection failed")));
        }

        try {
            Map<JobStatus, Integer> jobs = jobAdminService.totals();

            HealthResponse response = HealthResponse.healthy(
                    formatUptime(),
                    VERSION,
                    jobs.get(JobStatus.PENDING),
                    jobs.get(JobStatus.PROCESSING),
                    jobs.get(JobStatus.FAILED),
                    ledgerClient.isEnabled());

            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
        } catch (RuntimeException e) {
            log.error("Health check failed", e);
            return ControllerResponse.json(
                    HttpResponseStatus.SERVICE_UNAVAILABLE,
                    RouterHandler.mapper().writeValueAsString(HealthResponse.unhealthy(e.getMessage())));
        }
    }

    private String formatUptime() {
        long uptimeMs = ManagementFactory.getRuntimeMXBean().getUptime();
        Duration duration = Duration.ofMillis(uptimeMs);
        long hours = duration.toHours();
        long minutes = duration.toMinutesPart();
        return hours + "h " + minutes + "m";
    }
}
