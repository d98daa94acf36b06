package com.raditha.clonegen.ai;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the configured {@link CandidateGenerator} from the
 * {@code ai_service} section.
 */
public final class CandidateGenerators {
    private static final Logger logger = LoggerFactory.getLogger(CandidateGenerators.class);

    private CandidateGenerators() {
    }

    /**
     * Generator named by {@code provider} ({@code gemini}, {@code ollama} or
     * {@code none}). Empty when none is configured or it cannot be created.
     */
    public static Optional<CandidateGenerator> fromConfig(Map<String, Object> config) {
        Object provider = config == null ? null : config.get("provider");
        String name = provider == null ? "none" : provider.toString().trim().toLowerCase(Locale.ROOT);
        switch (name) {
            case "gemini":
                try {
                    return Optional.of(new GeminiCandidateGenerator(config));
                } catch (IOException e) {
                    logger.warn("Gemini candidate generator unavailable: {}", e.getMessage());
                    return Optional.empty();
                }
            case "ollama":
                return Optional.of(new OllamaCandidateGenerator(config));
            case "none":
            case "":
                return Optional.empty();
            default:
                logger.warn("Unknown ai_service.provider '{}', candidate generation disabled", provider);
                return Optional.empty();
        }
    }

    /**
     * Request timeout from {@code timeout_seconds}, default 60.
     */
    public static int timeoutSeconds(Map<String, Object> config) {
        Object value = config == null ? null : config.get("timeout_seconds");
        if (value instanceof Number n && n.intValue() > 0) {
            return n.intValue();
        }
        return 60;
    }
}
