package com.raditha.clonegen.cli;

import com.raditha.clonegen.config.CloneGenSettings;
import com.raditha.clonegen.config.GenerationSettings;
import com.raditha.clonegen.config.ValidationThresholds;
import com.raditha.clonegen.model.CloneType;
import com.raditha.clonegen.model.Language;
import com.raditha.clonegen.model.ValidationReport;
import com.raditha.clonegen.model.Violation;
import com.raditha.clonegen.validation.CloneValidator;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * {@code clonegen validate}: check that a variant is a clone of the claimed
 * type. Exits 0 when valid and 1 when not.
 */
@Command(name = "validate", mixinStandardHelpOptions = true,
        description = "Check a variant against an original for a claimed clone type")
public class ValidateCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Option(names = "--original", required = true, description = "Original snippet", paramLabel = "<file>")
    private String original;

    @Option(names = "--variant", required = true, description = "Variant snippet", paramLabel = "<file>")
    private String variant;

    @Option(names = {"-l", "--language"}, required = true, converter = CloneGenCLI.LanguageConverter.class,
            description = "python, java, javascript, cpp or c", paramLabel = "<lang>")
    private Language language;

    @Option(names = {"-t", "--type"}, required = true, converter = CloneGenCLI.CloneTypeConverter.class,
            description = "Claimed clone type: 1, 2 or 3", paramLabel = "<type>")
    private CloneType cloneType;

    @Option(names = "--json", description = "Print the validation report as JSON")
    private boolean jsonOutput = false;

    @Option(names = "--config-file", description = "Use custom configuration file", paramLabel = "<path>")
    private String configFile;

    @Option(names = "--min-similarity", description = "Type-3 similarity floor 0-100 (default: 50)",
            paramLabel = "<n>")
    private int minSimilarity = 0; // 0 = use YAML/default

    @Override
    public Integer call() throws IOException {
        if (minSimilarity < 0 || minSimilarity > 100) {
            throw new IllegalArgumentException("Min-similarity must be between 0 and 100, got: " + minSimilarity);
        }
        if (CliSupport.STDIN.equals(original) && CliSupport.STDIN.equals(variant)) {
            throw new IllegalArgumentException("Only one of --original and --variant can read standard input");
        }
        CloneGenSettings settings = CliSupport.loadSettings(configFile);
        ValidationThresholds thresholds = GenerationSettings.loadOptions(settings,
                new GenerationSettings.Overrides(0, 0, minSimilarity, null, null, null)).thresholds();

        String originalText = CliSupport.readSource(original, System.in);
        String variantText = CliSupport.readSource(variant, System.in);
        ValidationReport report = new CloneValidator().validate(originalText, variantText, language, cloneType,
                thresholds);

        PrintWriter out = spec.commandLine().getOut();
        if (jsonOutput) {
            out.println(CliSupport.toJson(report));
        } else {
            out.println(report.summary());
            for (Violation violation : report.violations()) {
                out.println("  - " + violation);
            }
        }
        out.flush();
        return report.valid() ? 0 : 1;
    }
}
