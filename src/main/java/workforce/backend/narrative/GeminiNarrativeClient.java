package workforce.backend.narrative;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.regex.Pattern;

/**
 * Narrative client for the Gemini generateContent REST endpoint.
 * Asks for a JSON answer and reads its {@code summary} field.
 */
public class GeminiNarrativeClient implements NarrativeClient {

    private static final Logger log = LoggerFactory.getLogger(GeminiNarrativeClient.class);

    public static final String DEFAULT_BASE_URL = "https://generativelanguage.googleapis.com/v1beta";

    private static final Pattern OPENING_FENCE = Pattern.compile("^```(?:json)?\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern CLOSING_FENCE = Pattern.compile("\\s*```$");

    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final String baseUrl;
    private final String apiKey;
    private final String model;
    private final Duration timeout;

    public GeminiNarrativeClient(String apiKey, String model, Duration timeout, ObjectMapper mapper) {
        this(DEFAULT_BASE_URL, apiKey, model, timeout, mapper);
    }

    public GeminiNarrativeClient(String baseUrl, String apiKey, String model, Duration timeout, ObjectMapper mapper) {
        this.baseUrl = baseUrl;
        this.apiKey = apiKey;
        this.model = model;
        this.timeout = timeout;
        this.mapper = mapper;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();

        if (!isEnabled()) {
            log.info("Narrative model disabled (GEMINI_API_KEY not set), template explanations will be used");
        }
    }

    @Override
    public boolean isEnabled() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public String explain(NarrativeRequest request) throws NarrativeUnavailableException {
        if (!isEnabled()) {
            throw new NarrativeUnavailableException("GEMINI_API_KEY is not set");
        }
        if (request.score() == null || request.score().isAbsent()) {
            throw new NarrativeUnavailableException("Nothing to explain without a score");
        }

        HttpRequest httpRequest = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/models/" + model + ":generateContent"))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("x-goog-api-key", apiKey)
                .POST(HttpRequest.BodyPublishers.ofString(requestBody(NarrativePrompt.build(request))))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new NarrativeUnavailableException("Narrative model timed out after " + timeout.toMillis() + "ms", e);
        } catch (IOException e) {
            throw new NarrativeUnavailableException("Narrative model call failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NarrativeUnavailableException("Interrupted while waiting for narrative model", e);
        }

        if (response.statusCode() != 200) {
            throw new NarrativeUnavailableException("Narrative model returned HTTP " + response.statusCode());
        }

        return parseSummary(response.body());
    }

    private String requestBody(String prompt) throws NarrativeUnavailableException {
        ObjectNode body = mapper.createObjectNode();
        body.putArray("contents")
                .addObject()
                .putArray("parts")
                .addObject()
                .put("text", prompt);

        ObjectNode generationConfig = body.putObject("generationConfig");
        generationConfig.put("responseMimeType", "application/json");
        generationConfig.put("temperature", 0.2);
        generationConfig.put("maxOutputTokens", 1024);

        try {
            return mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new NarrativeUnavailableException("Failed to encode narrative request", e);
        }
    }

    String parseSummary(String responseBody) throws NarrativeUnavailableException {
        try {
            JsonNode root = mapper.readTree(responseBody);
            JsonNode text = root.path("candidates").path(0).path("content").path("parts").path(0).path("text");
            if (!text.isTextual()) {
                throw new NarrativeUnavailableException("Narrative model returned no text");
            }

            String json = stripFences(text.asText());
            JsonNode summary = mapper.readTree(json).path("summary");
            if (!summary.isTextual() || summary.asText().isBlank()) {
                throw new NarrativeUnavailableException("Narrative answer has no summary field");
            }
            return summary.asText().trim();
        } catch (JsonProcessingException e) {
            throw new NarrativeUnavailableException("Narrative model returned malformed JSON", e);
        }
    }

    static String stripFences(String text) {
        String trimmed = text.trim();
        trimmed = OPENING_FENCE.matcher(trimmed).replaceFirst("");
        trimmed = CLOSING_FENCE.matcher(trimmed).replaceFirst("");
        return trimmed.trim();
    }
}
