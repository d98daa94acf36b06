package com.raditha.clonegen.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.raditha.clonegen.model.Language;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.Map;

/**
 * Candidate generator backed by the Gemini {@code generateContent} API.
 * <p>
 * Reads {@code api_key}, {@code api_endpoint}, {@code model},
 * {@code timeout_seconds}, {@code temperature} and {@code max_output_tokens}
 * from the {@code ai_service} section. The key falls back to
 * {@code GEMINI_API_KEY} and the endpoint to {@code AI_SERVICE_ENDPOINT}.
 */
public class GeminiCandidateGenerator extends HttpCandidateGenerator {
    private static final Logger logger = LoggerFactory.getLogger(GeminiCandidateGenerator.class);

    static final String DEFAULT_ENDPOINT =
            "https://generativelanguage.googleapis.com/v1beta/models/{model}:generateContent";
    static final String DEFAULT_MODEL = "gemini-2.0-flash-exp";

    public GeminiCandidateGenerator(Map<String, Object> config) throws IOException {
        this(config, null);
    }

    GeminiCandidateGenerator(Map<String, Object> config, HttpClient httpClient) throws IOException {
        super(config, httpClient != null ? httpClient : HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(timeoutOf(config)))
                .build());
        String apiKey = getConfigString("api_key", null);
        if (apiKey == null || apiKey.trim().isEmpty()) {
            throw new IOException(
                    "AI service API key is required. Set GEMINI_API_KEY environment variable or configure ai_service.api_key in clonegen.yml");
        }
    }

    private static int timeoutOf(Map<String, Object> config) {
        Object value = config == null ? null : config.get("timeout_seconds");
        return value instanceof Number n ? n.intValue() : 60;
    }

    @Override
    public String propose(String source, Language language) throws CandidateGenerationException {
        String model = getConfigString("model", DEFAULT_MODEL);
        String url = getConfigString("api_endpoint", DEFAULT_ENDPOINT).replace("{model}", model)
                + "?key=" + getConfigString("api_key", null);

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(buildPayload(prompt(source, language))))
                .timeout(Duration.ofSeconds(getConfigInt("timeout_seconds", 60)))
                .build();

        logger.debug("Requesting a candidate from {}", model);
        return extractText(send(request));
    }

    String buildPayload(String prompt) throws CandidateGenerationException {
        ObjectNode root = MAPPER.createObjectNode();
        ObjectNode content = root.putArray("contents").addObject();
        content.put("role", "user");
        content.putArray("parts").addObject().put("text", prompt);
        ObjectNode generation = root.putObject("generationConfig");
        generation.put("temperature", getConfigDouble("temperature", 0.7));
        generation.put("maxOutputTokens", getConfigInt("max_output_tokens", 2048));
        try {
            return MAPPER.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new CandidateGenerationException("Could not encode request", e);
        }
    }

    /**
     * Text of {@code candidates[0].content.parts[0]}.
     */
    static String extractText(String body) throws CandidateGenerationException {
        JsonNode text;
        try {
            text = MAPPER.readTree(body).path("candidates").path(0).path("content").path("parts").path(0)
                    .path("text");
        } catch (JsonProcessingException e) {
            throw new CandidateGenerationException("Malformed response: " + e.getOriginalMessage(), e);
        }
        if (!text.isTextual()) {
            throw new CandidateGenerationException("Response has no candidate text");
        }
        return text.asText();
    }

    @Override
    protected String environmentFallback(String key, String defaultValue) {
        String value = null;
        if ("api_key".equals(key)) {
            value = env("GEMINI_API_KEY");
        } else if ("api_endpoint".equals(key)) {
            value = env("AI_SERVICE_ENDPOINT");
        }
        return value != null ? value : defaultValue;
    }
}
