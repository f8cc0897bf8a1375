package workforce.backend.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import workforce.backend.api.Controller;
import workforce.backend.api.v1.dto.DashboardResponse;
import workforce.backend.server.RouterHandler;
import workforce.backend.service.DashboardService;

/**
 * GET /api/v1/dashboard - Tenant summary of employees, completion, scores and ledger activity
 */
public class DashboardController implements Controller {

    private static final String DASHBOARD_PATH = "/api/v1/dashboard";

    private final DashboardService dashboardService;

    public DashboardController(DashboardService dashboardService) {
        this.dashboardService = dashboardService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && DASHBOARD_PATH.equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        DashboardResponse response = DashboardResponse.from(dashboardService.stats(Controller.tenantId(req)));
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }
}
