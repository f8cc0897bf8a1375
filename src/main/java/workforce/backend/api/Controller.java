package workforce.backend.api;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;

import java.util.List;

/**
 * Base interface for HTTP controllers.
 * Controllers handle specific URL patterns and HTTP methods.
 * Exceptions thrown by {@link #handle} are mapped to error responses by the router.
 */
public interface Controller {

    /** Header carrying the calling tenant */
    String TENANT_HEADER = "X-Tenant-Id";

    /**
     * Check if this controller can handle the given request.
     *
     * @param method HTTP method
     * @param path   Request path (without query string)
     * @return true if this controller handles this request
     */
    boolean matches(HttpMethod method, String path);

    /**
     * Handle the request.
     *
     * @param ctx  Netty channel context
     * @param req  Full HTTP request
     * @param path Request path (without query string)
     * @return Response to send back
     */
    ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception;

    /**
     * Tenant id of the request.
     *
     * @throws IllegalArgumentException if the header is missing
     */
    static String tenantId(FullHttpRequest req) {
        String tenantId = req.headers().get(TENANT_HEADER);
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException(TENANT_HEADER + " header is required");
        }
        return tenantId.trim();
    }

    /**
     * First value of a query parameter, or null.
     */
    static String queryParam(FullHttpRequest req, String name) {
        List<String> values = new QueryStringDecoder(req.uri()).parameters().get(name);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return null;
        }
        return values.get(0).trim();
    }

    static int intQueryParam(FullHttpRequest req, String name, int fallback) {
        String value = queryParam(req, name);
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer");
        }
    }

    /**
     * Response from a controller.
     */
    record ControllerResponse(
            HttpResponseStatus status,
            String contentType,
            String body) {

        public static ControllerResponse json(String body) {
            return new ControllerResponse(HttpResponseStatus.OK, "application/json", body);
        }

        public static ControllerResponse json(HttpResponseStatus status, String body) {
            return new ControllerResponse(status, "application/json", body);
        }

        public static ControllerResponse noContent() {
            return new ControllerResponse(HttpResponseStatus.NO_CONTENT, "application/json", "");
        }

        public static ControllerResponse error(HttpResponseStatus status, String code, String message) {
            return new ControllerResponse(status, "application/json",
                    "{\"error\":\"" + escapeJson(code) + "\",\"message\":\"" + escapeJson(message) + "\"}");
        }

        private static String escapeJson(String s) {
            if (s == null)
                return "";
            return s.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n").replace("\r", "\\r");
        }
    }
}
