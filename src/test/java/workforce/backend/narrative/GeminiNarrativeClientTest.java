package workforce.backend.narrative;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import workforce.backend.scoring.ScoreBreakdown;
import workforce.backend.scoring.ScoreResult;
import workforce.backend.scoring.TrendAnalysis;
import org.junit.jupiter.api.*;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class GeminiNarrativeClientTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final NarrativeRequest REQUEST = new NarrativeRequest(
            "emp-1",
            new ScoreResult(85.8, "A", new ScoreBreakdown(0.9, 0.85, 4.0, 10, 9, 7)),
            TrendAnalysis.insufficient());

    private HttpServer server;
    private final AtomicInteger status = new AtomicInteger(200);
    private final AtomicReference<String> responseBody = new AtomicReference<>("");
    private final AtomicReference<String> receivedKey = new AtomicReference<>();
    private final AtomicReference<String> receivedBody = new AtomicReference<>();

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/models/", exchange -> {
            receivedKey.set(exchange.getRequestHeaders().getFirst("x-goog-api-key"));
            receivedBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            byte[] bytes = responseBody.get().getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status.get(), bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    @Test
    void readsSummaryFromModelAnswer() throws Exception {
        responseBody.set(answer("```json\n{\"summary\": \"Strong output, mostly on time.\"}\n```"));

        String text = client("secret").explain(REQUEST);

        assertEquals("Strong output, mostly on time.", text);
        assertEquals("secret", receivedKey.get());
        var sent = MAPPER.readTree(receivedBody.get());
        assertEquals("application/json", sent.path("generationConfig").path("responseMimeType").asText());
        assertTrue(sent.path("contents").path(0).path("parts").path(0).path("text").asText().contains("85.8"));
    }

    @Test
    void httpErrorIsUnavailable() {
        status.set(500);
        responseBody.set("{\"error\":{\"message\":\"internal\"}}");

        assertThrows(NarrativeUnavailableException.class, () -> client("secret").explain(REQUEST));
    }

    @Test
    void missingKeyIsUnavailableWithoutCalling() {
        GeminiNarrativeClient client = client(" ");

        assertFalse(client.isEnabled());
        assertThrows(NarrativeUnavailableException.class, () -> client.explain(REQUEST));
        assertNull(receivedBody.get());
    }

    @Test
    void absentScoreIsNotSent() {
        NarrativeRequest empty = new NarrativeRequest("emp-1", ScoreResult.absent(), TrendAnalysis.insufficient());

        assertThrows(NarrativeUnavailableException.class, () -> client("secret").explain(empty));
        assertNull(receivedBody.get());
    }

    @Test
    void parseSummaryRejectsUnexpectedShapes() {
        GeminiNarrativeClient client = client("secret");

        assertThrows(NarrativeUnavailableException.class, () -> client.parseSummary("not json"));
        assertThrows(NarrativeUnavailableException.class, () -> client.parseSummary("{\"candidates\":[]}"));
        assertThrows(NarrativeUnavailableException.class, () -> client.parseSummary(answer("plain prose")));
        assertThrows(NarrativeUnavailableException.class, () -> client.parseSummary(answer("{\"summary\":\"\"}")));
        assertThrows(NarrativeUnavailableException.class, () -> client.parseSummary(answer("{\"text\":\"x\"}")));
    }

    @Test
    void stripFences() {
        assertEquals("{\"a\":1}", GeminiNarrativeClient.stripFences("```json\n{\"a\":1}\n```"));
        assertEquals("{\"a\":1}", GeminiNarrativeClient.stripFences("```\n{\"a\":1}```"));
        assertEquals("{\"a\":1}", GeminiNarrativeClient.stripFences("  {\"a\":1}  "));
    }

    private GeminiNarrativeClient client(String apiKey) {
        String baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
        return new GeminiNarrativeClient(baseUrl, apiKey, "gemini-test", Duration.ofSeconds(5), MAPPER);
    }

    private static String answer(String text) {
        var root = MAPPER.createObjectNode();
        root.putArray("candidates")
                .addObject()
                .putObject("content")
                .putArray("parts")
                .addObject()
                .put("text", text);
        return root.toString();
    }
}
