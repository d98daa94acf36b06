package com.raditha.clonegen.ai;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.raditha.clonegen.model.Language;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Locale;
import java.util.Map;

/**
 * Shared plumbing for generators that talk JSON over HTTP: configuration
 * lookup with environment fallback, request sending and the prompt.
 */
abstract class HttpCandidateGenerator implements CandidateGenerator {

    protected static final ObjectMapper MAPPER = new ObjectMapper();

    protected final HttpClient httpClient;
    private final Map<String, Object> config;

    protected HttpCandidateGenerator(Map<String, Object> config, HttpClient httpClient) {
        this.config = config == null ? Map.of() : config;
        this.httpClient = httpClient;
    }

    /**
     * Send the request and return the body of a 200 response.
     */
    protected String send(HttpRequest request) throws CandidateGenerationException {
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new CandidateGenerationException("Request to " + request.uri().getHost() + " failed: "
                    + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CandidateGenerationException("Interrupted while waiting for " + request.uri().getHost(), e);
        }
        if (response.statusCode() != 200) {
            throw new CandidateGenerationException(
                    "API request failed with status: " + response.statusCode() + ", body: " + response.body());
        }
        return response.body();
    }

    static String prompt(String source, Language language) {
        String name = language.name().toLowerCase(Locale.ROOT);
        return "Rewrite the following " + name + " code so that it becomes a Type-3 clone of itself.\n"
                + "Make a few small statement-level edits: add a harmless statement, remove a non-essential one, "
                + "or wrap a statement in an always-true guard.\n"
                + "Keep every import, signature, declaration, control-flow header and return statement unchanged, "
                + "and keep all brackets balanced.\n"
                + "Return only the code, with no explanation.\n\n"
                + source;
    }

    protected String getConfigString(String key, String defaultValue) {
        Object value = config.get(key);
        if (value instanceof String str && !str.trim().isEmpty()) {
            return str;
        }
        return environmentFallback(key, defaultValue);
    }

    /**
     * Environment variable consulted when {@code key} is not configured.
     */
    protected String environmentFallback(String key, String defaultValue) {
        return defaultValue;
    }

    protected static String env(String variable) {
        String value = System.getenv(variable);
        return value != null && !value.trim().isEmpty() ? value : null;
    }

    protected int getConfigInt(String key, int defaultValue) {
        Object value = config.get(key);
        if (value instanceof Number n) {
            return n.intValue();
        } else if (value instanceof String str) {
            try {
                return Integer.parseInt(str.trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    protected double getConfigDouble(String key, double defaultValue) {
        Object value = config.get(key);
        if (value instanceof Number n) {
            return n.doubleValue();
        } else if (value instanceof String str) {
            try {
                return Double.parseDouble(str.trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }
}
