package com.raditha.clonegen.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * YAML configuration ({@code clonegen.yml}) as a nested map.
 * <p>
 * Top-level sections are {@code clone_generation} and {@code ai_service}.
 */
public class CloneGenSettings {
    private static final Logger logger = LoggerFactory.getLogger(CloneGenSettings.class);

    public static final String DEFAULT_RESOURCE = "clonegen.yml";

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final Map<String, Object> properties;

    private CloneGenSettings(Map<String, Object> properties) {
        this.properties = properties == null ? Map.of() : properties;
    }

    /**
     * Settings from {@code clonegen.yml} on the classpath, or empty settings
     * when the resource is absent.
     */
    public static CloneGenSettings loadDefault() throws IOException {
        try (InputStream in = CloneGenSettings.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                logger.debug("{} not found on the classpath, using built-in defaults", DEFAULT_RESOURCE);
                return empty();
            }
            return parse(in);
        }
    }

    /**
     * Settings from a YAML file.
     *
     * @throws FileNotFoundException if the file does not exist
     * @throws IOException           if it cannot be read or parsed
     */
    public static CloneGenSettings load(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new FileNotFoundException("Configuration file not found: " + file);
        }
        logger.debug("Loading configuration from {}", file);
        try (InputStream in = Files.newInputStream(file)) {
            return parse(in);
        }
    }

    private static CloneGenSettings parse(InputStream in) throws IOException {
        JsonNode root = YAML.readTree(in);
        if (root == null || !root.isObject()) {
            return empty();
        }
        return new CloneGenSettings(YAML.convertValue(root, MAP_TYPE));
    }

    public static CloneGenSettings fromMap(Map<String, Object> properties) {
        return new CloneGenSettings(properties);
    }

    public static CloneGenSettings empty() {
        return new CloneGenSettings(Map.of());
    }

    public Object getProperty(String key) {
        return properties.get(key);
    }

    /**
     * A nested section, or an empty map when it is missing or not a map.
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> section(String key) {
        Object value = properties.get(key);
        if (value instanceof Map) {
            return (Map<String, Object>) value;
        }
        return Map.of();
    }
}
