package com.raditha.clonegen.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.raditha.clonegen.model.Language;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Map;

/**
 * Candidate generator for a local Ollama server ({@code POST /api/generate}).
 * <p>
 * Failed or empty replies are retried up to {@code max_retries} times with
 * {@code retry_delay_ms} between attempts. After a timeout the token budget
 * shrinks to 80% so the next attempt has a better chance of finishing.
 */
public class OllamaCandidateGenerator extends HttpCandidateGenerator {
    private static final Logger logger = LoggerFactory.getLogger(OllamaCandidateGenerator.class);

    static final String DEFAULT_BASE_URL = "http://localhost:11434";
    static final String DEFAULT_MODEL = "codegemma:2b";

    private final int maxRetries;
    private final long retryDelayMillis;

    public OllamaCandidateGenerator(Map<String, Object> config) {
        this(config, null);
    }

    OllamaCandidateGenerator(Map<String, Object> config, HttpClient httpClient) {
        super(config, httpClient != null ? httpClient : HttpClient.newHttpClient());
        this.maxRetries = Math.max(1, getConfigInt("max_retries", 3));
        this.retryDelayMillis = Math.max(0, getConfigInt("retry_delay_ms", 1000));
    }

    @Override
    public String propose(String source, Language language) throws CandidateGenerationException {
        String prompt = prompt(source, language);
        int maxTokens = getConfigInt("max_output_tokens", 1000);
        CandidateGenerationException last = null;

        for (int attempt = 1; attempt <= maxRetries; attempt++) {
            try {
                String reply = extractResponse(send(buildRequest(prompt, maxTokens)));
                if (!reply.isBlank()) {
                    return reply;
                }
                last = new CandidateGenerationException("Empty response from Ollama");
            } catch (CandidateGenerationException e) {
                last = e;
                if (e.getCause() instanceof HttpTimeoutException) {
                    maxTokens = Math.max(1, (int) (maxTokens * 0.8));
                }
                if (e.getCause() instanceof InterruptedException) {
                    throw e;
                }
            }
            logger.debug("Ollama attempt {}/{} failed: {}", attempt, maxRetries, last.getMessage());
            if (attempt < maxRetries) {
                pause();
            }
        }
        throw last;
    }

    HttpRequest buildRequest(String prompt, int maxTokens) throws CandidateGenerationException {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("model", getConfigString("model", DEFAULT_MODEL));
        root.put("prompt", prompt);
        root.put("stream", false);
        ObjectNode options = root.putObject("options");
        options.put("temperature", getConfigDouble("temperature", 0.1));
        options.put("num_predict", maxTokens);
        String payload;
        try {
            payload = MAPPER.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new CandidateGenerationException("Could not encode request", e);
        }

        String baseUrl = getConfigString("base_url", DEFAULT_BASE_URL);
        if (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        return HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/api/generate"))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(payload))
                .timeout(Duration.ofSeconds(getConfigInt("timeout_seconds", 30)))
                .build();
    }

    static String extractResponse(String body) throws CandidateGenerationException {
        try {
            JsonNode response = MAPPER.readTree(body).path("response");
            return response.isTextual() ? response.asText() : "";
        } catch (JsonProcessingException e) {
            throw new CandidateGenerationException("Malformed response: " + e.getOriginalMessage(), e);
        }
    }

    private void pause() throws CandidateGenerationException {
        if (retryDelayMillis == 0) {
            return;
        }
        try {
            Thread.sleep(retryDelayMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CandidateGenerationException("Interrupted between retries", e);
        }
    }

    @Override
    protected String environmentFallback(String key, String defaultValue) {
        if ("base_url".equals(key)) {
            String value = env("OLLAMA_BASE_URL");
            return value != null ? value : defaultValue;
        }
        return defaultValue;
    }
}
