package com.raditha.clonegen.config;

import java.util.List;
import java.util.Map;

/**
 * Builds {@link GenerationOptions} from {@link CloneGenSettings} with CLI
 * overrides.
 * <p>
 * Configuration priority: CLI arguments > clonegen.yml > defaults
 */
public class GenerationSettings {

    public static final String CONFIG_KEY = "clone_generation";

    private GenerationSettings() {
    }

    /**
     * Values given on the command line. Zero and null mean "not given".
     *
     * @param maxAttempts          Attempts before degrading (0 = use YAML/default)
     * @param maxTransformations   Type-3 edit budget (0 = use YAML/default)
     * @param minSimilarityPercent Type-3 lower similarity bound, 0-100 (0 = use YAML/default)
     * @param literalProbability   Type-2 literal change chance (null = use YAML/default)
     * @param spacingStyle         Operator spacing style (null = use YAML/default)
     * @param useCandidateGenerator Ask the candidate generator first (null = use YAML/default)
     */
    public record Overrides(
            int maxAttempts,
            int maxTransformations,
            int minSimilarityPercent,
            Double literalProbability,
            String spacingStyle,
            Boolean useCandidateGenerator) {

        public static Overrides none() {
            return new Overrides(0, 0, 0, null, null, null);
        }
    }

    public static GenerationOptions loadOptions(CloneGenSettings settings) {
        return loadOptions(settings, Overrides.none());
    }

    /**
     * @throws IllegalArgumentException if a value is out of range
     */
    public static GenerationOptions loadOptions(CloneGenSettings settings, Overrides cli) {
        Map<String, Object> config = settings.section(CONFIG_KEY);
        GenerationOptions defaults = GenerationOptions.defaults();

        int maxAttempts = cli.maxAttempts() != 0 ? cli.maxAttempts()
                : getInt(config, "max_attempts", defaults.maxAttempts());
        int minSourceLines = getInt(config, "min_source_lines", defaults.minSourceLines());

        return new GenerationOptions(
                buildFormatting(section(config, "formatting"), cli),
                buildRenaming(section(config, "renaming"), cli),
                buildMutation(section(config, "mutation"), cli),
                buildThresholds(section(config, "validation"), cli),
                maxAttempts,
                minSourceLines);
    }

    private static FormattingOptions buildFormatting(Map<String, Object> config, Overrides cli) {
        String style = cli.spacingStyle() != null ? cli.spacingStyle() : getString(config, "spacing_style", null);
        return new FormattingOptions(
                getBoolean(config, "indentation", true),
                getBoolean(config, "blank_lines", true),
                getBoolean(config, "comments", true),
                getBoolean(config, "operator_spacing", true),
                getBoolean(config, "brace_position", true),
                SpacingStyle.fromString(style));
    }

    private static RenamingOptions buildRenaming(Map<String, Object> config, Overrides cli) {
        RenamingOptions defaults = RenamingOptions.defaults();
        double probability = cli.literalProbability() != null ? cli.literalProbability()
                : getDouble(config, "literal_probability", defaults.literalProbability());
        return new RenamingOptions(
                getBoolean(config, "rename_identifiers", defaults.renameIdentifiers()),
                getBoolean(config, "mutate_literals", defaults.mutateLiterals()),
                probability,
                getBoolean(config, "mutate_booleans", defaults.mutateBooleans()),
                getBoolean(config, "apply_formatting", defaults.applyFormatting()),
                getListString(config, "function_prefixes"));
    }

    private static MutationOptions buildMutation(Map<String, Object> config, Overrides cli) {
        MutationOptions defaults = MutationOptions.defaults();
        int maxTransformations = cli.maxTransformations() != 0 ? cli.maxTransformations()
                : getInt(config, "max_transformations", defaults.maxTransformations());
        int maxRetries = Math.max(maxTransformations, getInt(config, "max_retries", defaults.maxRetries()));
        boolean useCandidates = cli.useCandidateGenerator() != null ? cli.useCandidateGenerator()
                : getBoolean(config, "use_candidate_generator", defaults.useCandidateGenerator());
        return new MutationOptions(
                maxTransformations,
                maxRetries,
                getDouble(config, "min_length_ratio", defaults.minLengthRatio()),
                useCandidates);
    }

    private static ValidationThresholds buildThresholds(Map<String, Object> config, Overrides cli) {
        ValidationThresholds defaults = ValidationThresholds.defaults();
        double min = cli.minSimilarityPercent() != 0 ? cli.minSimilarityPercent() / 100.0
                : getDouble(config, "min_similarity", defaults.minSimilarity());
        return new ValidationThresholds(min, getDouble(config, "max_similarity", defaults.maxSimilarity()));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof Map) {
            return (Map<String, Object>) value;
        }
        return Map.of();
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return defaultValue;
    }

    private static double getDouble(Map<String, Object> map, String key, double defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return defaultValue;
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return defaultValue;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        if (value != null) {
            return value.toString();
        }
        return defaultValue;
    }

    private static List<String> getListString(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        return List.of();
    }
}
