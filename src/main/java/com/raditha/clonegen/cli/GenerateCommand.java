package com.raditha.clonegen.cli;

import com.raditha.clonegen.ai.CandidateGenerator;
import com.raditha.clonegen.ai.CandidateGenerators;
import com.raditha.clonegen.config.CloneGenSettings;
import com.raditha.clonegen.config.GenerationOptions;
import com.raditha.clonegen.config.GenerationSettings;
import com.raditha.clonegen.lexer.LanguageProfile;
import com.raditha.clonegen.model.CloneType;
import com.raditha.clonegen.model.GenerationResult;
import com.raditha.clonegen.model.Language;
import com.raditha.clonegen.util.DiffGenerator;
import com.raditha.clonegen.workflow.CloneGenerator;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * {@code clonegen generate}: print a certified clone of a snippet.
 */
@Command(name = "generate", mixinStandardHelpOptions = true,
        description = "Generate a Type-1, Type-2 or Type-3 clone of a code snippet")
public class GenerateCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", paramLabel = "<file>", description = "Source snippet, or - to read standard input")
    private String input;

    @Option(names = {"-l", "--language"}, required = true, converter = CloneGenCLI.LanguageConverter.class,
            description = "python, java, javascript, cpp or c", paramLabel = "<lang>")
    private Language language;

    @Option(names = {"-t", "--type"}, required = true, converter = CloneGenCLI.CloneTypeConverter.class,
            description = "Clone type: 1, 2 or 3", paramLabel = "<type>")
    private CloneType cloneType;

    @Option(names = "--seed", description = "Seed for reproducible output (default: derived from the source)",
            paramLabel = "<n>")
    private Long seed;

    @Option(names = "--json", description = "Print the full generation result as JSON")
    private boolean jsonOutput = false;

    @Option(names = "--diff", description = "Print a unified diff instead of the variant")
    private boolean diffOutput = false;

    @Option(names = "--count", description = "Number of distinct variants to generate (default: 1)",
            paramLabel = "<n>")
    private int count = 1;

    @Option(names = {"-o", "--output"}, description = "Also write the variant to this file", paramLabel = "<path>")
    private String outputFile;

    @Option(names = "--config-file", description = "Use custom configuration file", paramLabel = "<path>")
    private String configFile;

    @Option(names = "--max-attempts", description = "Attempts before degrading (default: 3)", paramLabel = "<n>")
    private int maxAttempts = 0; // 0 = use YAML/default

    @Option(names = "--max-transformations", description = "Type-3 edit budget (default: 5)", paramLabel = "<n>")
    private int maxTransformations = 0; // 0 = use YAML/default

    @Option(names = "--min-similarity", description = "Type-3 similarity floor 0-100 (default: 50)",
            paramLabel = "<n>")
    private int minSimilarity = 0; // 0 = use YAML/default

    @Option(names = "--literal-probability", description = "Type-2 literal change chance 0.0-1.0 (default: 0.5)",
            paramLabel = "<p>")
    private Double literalProbability;

    @Option(names = "--spacing", description = "Operator spacing: random, compact or spaced", paramLabel = "<style>")
    private String spacing;

    @Option(names = "--llm", negatable = true,
            description = "Ask the configured ai_service for a Type-3 candidate first")
    private Boolean useCandidateGenerator;

    @Override
    public Integer call() throws IOException {
        validateConfiguration();

        CloneGenSettings settings = CliSupport.loadSettings(configFile);
        GenerationOptions options = GenerationSettings.loadOptions(settings, new GenerationSettings.Overrides(
                maxAttempts, maxTransformations, minSimilarity, literalProbability, spacing, useCandidateGenerator));
        String source = CliSupport.readSource(input, System.in);

        CandidateGenerator candidateGenerator = null;
        Duration timeout = null;
        if (cloneType == CloneType.TYPE_3 && options.mutation().useCandidateGenerator()) {
            Map<String, Object> aiConfig = settings.section("ai_service");
            candidateGenerator = CandidateGenerators.fromConfig(aiConfig).orElse(null);
            timeout = Duration.ofSeconds(CandidateGenerators.timeoutSeconds(aiConfig));
        }

        List<GenerationResult> results;
        try (CloneGenerator generator = new CloneGenerator(candidateGenerator, timeout)) {
            results = count == 1
                    ? List.of(generator.generate(source, language, cloneType, seed, options))
                    : generator.generateVariants(source, language, cloneType, count, seed, options);
        }

        if (outputFile != null) {
            Files.writeString(Path.of(outputFile), results.get(0).variant(), StandardCharsets.UTF_8);
        }
        print(source, results);
        return 0;
    }

    private void print(String source, List<GenerationResult> results) throws IOException {
        PrintWriter out = spec.commandLine().getOut();
        if (jsonOutput) {
            out.println(CliSupport.toJson(count == 1 ? results.get(0) : results));
        } else {
            String header = LanguageProfile.of(language).lineCommentPrefix() + " variant %d of %d";
            for (int i = 0; i < results.size(); i++) {
                if (count > 1) {
                    out.println(String.format(header, i + 1, results.size()));
                }
                printVariant(out, source, results.get(i));
            }
        }
        out.flush();
        for (GenerationResult result : results) {
            if (result.degraded()) {
                spec.commandLine().getErr().println("Warning: requested " + result.requestedType().label()
                        + " but produced " + result.achievedType().label());
            }
        }
        if (results.size() < count) {
            spec.commandLine().getErr().println("Warning: only " + results.size() + " of " + count
                    + " variants are distinct");
        }
    }

    private void printVariant(PrintWriter out, String source, GenerationResult result) {
        if (diffOutput) {
            String name = CliSupport.STDIN.equals(input) ? "stdin" : Path.of(input).getFileName().toString();
            out.print(new DiffGenerator().generateUnifiedDiff(name, source, result.variant()));
        } else {
            out.print(result.variant());
            if (!result.variant().endsWith("\n")) {
                out.println();
            }
        }
    }

    /**
     * @throws IllegalArgumentException if an option is out of range
     */
    private void validateConfiguration() {
        if (jsonOutput && diffOutput) {
            throw new IllegalArgumentException("Cannot use both --json and --diff");
        }
        if (count < 1) {
            throw new IllegalArgumentException("Count must be positive, got: " + count);
        }
        if (count > 1 && outputFile != null) {
            throw new IllegalArgumentException("Cannot use --output with --count greater than 1");
        }
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("Max-attempts must be positive, got: " + maxAttempts);
        }
        if (maxTransformations < 0) {
            throw new IllegalArgumentException("Max-transformations must be positive, got: " + maxTransformations);
        }
        if (minSimilarity < 0 || minSimilarity > 100) {
            throw new IllegalArgumentException("Min-similarity must be between 0 and 100, got: " + minSimilarity);
        }
    }
}
