package com.raditha.clonegen.cli;

import com.raditha.clonegen.model.CloneType;
import com.raditha.clonegen.model.InputException;
import com.raditha.clonegen.model.Language;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.util.concurrent.Callable;

/**
 * Command-line interface for the clone generator.
 * <p>
 * Usage:
 * java -jar clonegen.jar generate [options] <file-or->
 * java -jar clonegen.jar validate --original <file> --variant <file> [options]
 * <p>
 * Configuration priority: CLI arguments > clonegen.yml > defaults
 * <p>
 * Exit codes: 0 success (or a valid clone), 1 invalid clone or unexpected
 * error, 2 configuration or input error, 3 I/O error, 4 interrupted.
 */
@Command(name = "clonegen", mixinStandardHelpOptions = true, version = "clonegen v1.0.0",
        description = "Synthetic code clone generator and validator",
        subcommands = {GenerateCommand.class, ValidateCommand.class})
@SuppressWarnings("java:S106")
public class CloneGenCLI implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getErr());
        return 2;
    }

    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Command line with the exit-code mapping installed.
     */
    public static CommandLine createCommandLine() {
        CommandLine cmd = new CommandLine(new CloneGenCLI());

        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof InputException) {
                commandLine.getErr().println("Input error: " + ex.getMessage());
                return 2;
            } else if (ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("Configuration error: " + ex.getMessage());
                return 2;
            } else if (ex instanceof IOException) {
                commandLine.getErr().println("I/O error: " + ex.getMessage());
                return 3;
            } else if (ex instanceof InterruptedException) {
                commandLine.getErr().println("Process interrupted: " + ex.getMessage());
                return 4;
            } else {
                commandLine.getErr().println("Error: " + ex.getMessage());
                ex.printStackTrace(commandLine.getErr());
                return 1;
            }
        });

        cmd.setParameterExceptionHandler((ex, args) -> {
            CommandLine failed = ex.getCommandLine();
            CommandLine.Help.ColorScheme colorScheme = CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO);
            failed.getErr().println(colorScheme.errorText(ex.getMessage()));
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, failed.getErr());
            failed.getErr().print(failed.getUsageMessage(colorScheme));
            return 2;
        });
        return cmd;
    }

    /**
     * Accepts {@code python}, {@code py}, {@code java}, {@code js}, {@code cpp}, {@code c} and similar tags.
     */
    public static class LanguageConverter implements ITypeConverter<Language> {
        @Override
        public Language convert(String value) {
            return Language.fromTag(value);
        }
    }

    /**
     * Accepts {@code 1}, {@code type2}, {@code TYPE_3} and similar spellings.
     */
    public static class CloneTypeConverter implements ITypeConverter<CloneType> {
        @Override
        public CloneType convert(String value) {
            return CloneType.fromTag(value);
        }
    }
}
