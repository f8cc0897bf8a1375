package workforce.backend.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import workforce.backend.api.Controller;
import workforce.backend.api.Controller.ControllerResponse;
import workforce.backend.config.BackendConfig;
import workforce.backend.service.InvalidTransitionException;
import workforce.backend.service.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_TYPE;
import static io.netty.handler.codec.http.HttpResponseStatus.BAD_REQUEST;
import static io.netty.handler.codec.http.HttpResponseStatus.FORBIDDEN;
import static io.netty.handler.codec.http.HttpResponseStatus.INTERNAL_SERVER_ERROR;
import static io.netty.handler.codec.http.HttpResponseStatus.NOT_FOUND;
import static io.netty.handler.codec.http.HttpResponseStatus.UNPROCESSABLE_ENTITY;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Central router that dispatches HTTP requests to registered controllers.
 *
 * Only handles versioned API endpoints:
 * - /api/v1/* (public API)
 * - /internal/v1/* (operator API, guarded by X-Workforce-Key when a key is configured)
 *
 * All other endpoints return 404.
 *
 * This handler is @Sharable because it has no per-channel state.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .findAndRegisterModules();

    public static final String API_KEY_HEADER = "X-Workforce-Key";

    private final List<Controller> controllers = new ArrayList<>();
    private final BackendConfig config;

    public RouterHandler(BackendConfig config) {
        this.config = config;
    }

    /**
     * Register a controller to handle requests.
     * Controllers are checked in order of registration.
     */
    public RouterHandler registerController(Controller controller) {
        controllers.add(controller);
        log.debug("Registered controller: {}", controller.getClass().getSimpleName());
        return this;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        String uri = req.uri();
        HttpMethod method = req.method();

        // Extract path without query string
        String path = uri.contains("?") ? uri.substring(0, uri.indexOf("?")) : uri;

        try {
            // Check auth for internal endpoints
            if (!checkAuth(req, path)) {
                log.warn("Auth failed for {} {}", method, path);
                writeError(ctx, FORBIDDEN, "FORBIDDEN", "missing or wrong " + API_KEY_HEADER);
                return;
            }

            // Try registered controllers
            for (Controller controller : controllers) {
                if (controller.matches(method, path)) {
                    ControllerResponse response = controller.handle(ctx, req, path);
                    writeSafe(ctx, response.status(), response.contentType(), response.body());
                    return;
                }
            }

            // No controller matched - return 404
            log.debug("No handler for: {} {}", method, path);
            writeError(ctx, NOT_FOUND, "NOT_FOUND", "no route for " + method + " " + path);

        } catch (InvalidTransitionException e) {
            log.info("Rejected transition on {}: {}", path, e.getMessage());
            writeError(ctx, UNPROCESSABLE_ENTITY, InvalidTransitionException.CODE, e.getMessage());
        } catch (NotFoundException e) {
            writeError(ctx, NOT_FOUND, "NOT_FOUND", e.getMessage());
        } catch (IllegalArgumentException e) {
            // Validation errors
            log.warn("Validation error: {}", e.getMessage());
            writeError(ctx, BAD_REQUEST, "BAD_REQUEST", e.getMessage());
        } catch (JsonProcessingException e) {
            log.warn("Malformed request body on {} {}: {}", method, path, e.getOriginalMessage());
            writeError(ctx, BAD_REQUEST, "BAD_REQUEST", "malformed JSON: " + e.getOriginalMessage());
        } catch (Throwable t) {
            log.error("Handler error: {} {}", method, path, t);
            writeError(ctx, INTERNAL_SERVER_ERROR, "INTERNAL", "internal error");
        }
    }

    /**
     * Check if request requires and passes auth.
     */
    private boolean checkAuth(FullHttpRequest req, String path) {
        if (!config.hasApiKey()) {
            return true; // No auth configured
        }

        // Only internal endpoints require auth
        if (!path.startsWith("/internal/")) {
            return true;
        }

        String providedKey = req.headers().get(API_KEY_HEADER);
        return config.apiKey().equals(providedKey);
    }

    private void writeError(ChannelHandlerContext ctx, HttpResponseStatus status, String code, String message) {
        ControllerResponse response = ControllerResponse.error(status, code, message);
        writeSafe(ctx, response.status(), response.contentType(), response.body());
    }

    /**
     * Safe write that catches any exceptions during response writing.
     * Ensures we never silently close the connection.
     */
    private void writeSafe(ChannelHandlerContext ctx, HttpResponseStatus status, String contentType, String body) {
        try {
            if (body == null) {
                body = "";
            }
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            FullHttpResponse response = new DefaultFullHttpResponse(HTTP_1_1, status, Unpooled.wrappedBuffer(bytes));
            response.headers().set(CONTENT_TYPE, contentType + "; charset=utf-8");
            response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
            ctx.writeAndFlush(response);
        } catch (Throwable t) {
            log.error("Failed to write response: {}", t.getMessage(), t);
            ctx.close();
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Unhandled exception in channel: {}", cause.getMessage(), cause);
        ctx.close();
    }

    /**
     * Get the shared ObjectMapper for JSON serialization.
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
