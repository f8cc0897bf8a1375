package workforce.backend.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import workforce.backend.api.Controller;
import workforce.backend.api.v1.dto.LedgerEntryResponse;
import workforce.backend.api.v1.dto.LedgerStatusResponse;
import workforce.backend.server.RouterHandler;
import workforce.backend.service.LedgerService;

import java.util.List;

/**
 * GET /api/v1/ledger/entries - Completion records of the tenant (?limit=)
 * GET /api/v1/ledger/status  - Ledger connection state
 */
public class LedgerController implements Controller {

    private static final String ENTRIES_PATH = "/api/v1/ledger/entries";
    private static final String STATUS_PATH = "/api/v1/ledger/status";

    private static final int DEFAULT_LIMIT = 100;

    private final LedgerService ledgerService;

    public LedgerController(LedgerService ledgerService) {
        this.ledgerService = ledgerService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && (ENTRIES_PATH.equals(path) || STATUS_PATH.equals(path));
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        if (STATUS_PATH.equals(path)) {
            LedgerStatusResponse response = LedgerStatusResponse.from(ledgerService.status());
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
        }

        String tenantId = Controller.tenantId(req);
        int limit = Controller.intQueryParam(req, "limit", DEFAULT_LIMIT);
        List<LedgerEntryResponse> entries = ledgerService.entries(tenantId, limit).stream()
                .map(LedgerEntryResponse::from)
                .toList();
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(entries));
    }
}
