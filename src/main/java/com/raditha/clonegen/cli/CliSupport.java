package com.raditha.clonegen.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.raditha.clonegen.config.CloneGenSettings;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Input, configuration and JSON helpers shared by the subcommands.
 */
final class CliSupport {

    static final String STDIN = "-";

    private static final ObjectMapper mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private CliSupport() {
    }

    static String readSource(String input, InputStream stdin) throws IOException {
        if (STDIN.equals(input)) {
            return new String(stdin.readAllBytes(), StandardCharsets.UTF_8);
        }
        return Files.readString(Path.of(input), StandardCharsets.UTF_8);
    }

    static CloneGenSettings loadSettings(String configFile) throws IOException {
        if (configFile != null) {
            return CloneGenSettings.load(Path.of(configFile));
        }
        return CloneGenSettings.loadDefault();
    }

    static String toJson(Object value) throws JsonProcessingException {
        return mapper.writeValueAsString(value);
    }
}
