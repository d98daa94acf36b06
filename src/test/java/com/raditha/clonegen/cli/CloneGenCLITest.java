package com.raditha.clonegen.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class CloneGenCLITest {

    private static final String CALCULATE = "def calculate(a, b):\n    result = a + b * 2\n    return result\n";

    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;
    private Path sourceFile;

    @BeforeEach
    void setUp() throws IOException {
        out = new StringWriter();
        err = new StringWriter();
        sourceFile = tempDir.resolve("calc.py");
        Files.writeString(sourceFile, CALCULATE);
    }

    private int run(String... args) {
        CommandLine cmd = CloneGenCLI.createCommandLine();
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        return cmd.execute(args);
    }

    @Test
    void testGenerateType2() {
        int exitCode = run("generate", sourceFile.toString(), "-l", "python", "-t", "2", "--seed", "7");

        assertEquals(0, exitCode, err.toString());
        assertTrue(out.toString().startsWith("def func_0("), out.toString());
        assertTrue(out.toString().endsWith("\n"));
    }

    @Test
    void testGenerateIsReproducible() {
        run("generate", sourceFile.toString(), "-l", "py", "-t", "type3", "--seed", "11");
        String first = out.toString();
        out.getBuffer().setLength(0);
        run("generate", sourceFile.toString(), "-l", "py", "-t", "type3", "--seed", "11");

        assertEquals(first, out.toString());
    }

    @Test
    void testGenerateJson() throws IOException {
        int exitCode = run("generate", sourceFile.toString(), "-l", "python", "-t", "1", "--json");

        assertEquals(0, exitCode, err.toString());
        JsonNode json = new ObjectMapper().readTree(out.toString());
        assertEquals("TYPE_1", json.path("requestedType").asText());
        assertEquals("TYPE_1", json.path("achievedType").asText());
        assertTrue(json.path("report").path("valid").asBoolean());
        assertTrue(json.path("provenance").isArray());
        assertTrue(json.has("seed"));
    }

    @Test
    void testGenerateDiff() {
        int exitCode = run("generate", sourceFile.toString(), "-l", "python", "-t", "2", "--diff", "--seed", "3");

        assertEquals(0, exitCode, err.toString());
        assertTrue(out.toString().startsWith("--- a/calc.py\n+++ b/calc.py\n"), out.toString());
        assertTrue(out.toString().contains("+def func_0("));
    }

    @Test
    void testGenerateWritesOutputFile() throws IOException {
        Path target = tempDir.resolve("variant.py");

        int exitCode = run("generate", sourceFile.toString(), "-l", "python", "-t", "2", "-o", target.toString());

        assertEquals(0, exitCode, err.toString());
        assertEquals(Files.readString(target).strip(), out.toString().strip());
    }

    @Test
    void testDegradationWarning() throws IOException {
        Path tiny = tempDir.resolve("tiny.py");
        Files.writeString(tiny, "def f():\n    return 1\n");

        int exitCode = run("generate", tiny.toString(), "-l", "python", "-t", "3");

        assertEquals(0, exitCode);
        assertTrue(err.toString().contains("Warning: requested type3 but produced type1"), err.toString());
    }

    @Test
    void testConfigFile() throws IOException {
        Path config = tempDir.resolve("custom.yml");
        Files.writeString(config, """
                clone_generation:
                  renaming:
                    mutate_literals: false
                  formatting:
                    spacing_style: compact
                """);

        int exitCode = run("generate", sourceFile.toString(), "-l", "python", "-t", "2", "--json",
                "--config-file", config.toString());

        assertEquals(0, exitCode, err.toString());
        assertTrue(out.toString().contains("\"rename_identifiers\""));
        assertFalse(out.toString().contains("mutate_literals"));
    }

    @Test
    void testGenerateSeveralVariants() throws IOException {
        int exitCode = run("generate", sourceFile.toString(), "-l", "python", "-t", "2", "--count", "2", "--json",
                "--seed", "4");

        assertEquals(0, exitCode, err.toString());
        JsonNode json = new ObjectMapper().readTree(out.toString());
        assertTrue(json.isArray());
        assertTrue(json.size() >= 1 && json.size() <= 2, out.toString());
        assertTrue(json.get(0).path("renameStats").path("renameMap").has("calculate"), out.toString());
    }

    @Test
    void testVariantHeaders() {
        int exitCode = run("generate", sourceFile.toString(), "-l", "python", "-t", "2", "--count", "2", "--seed", "4");

        assertEquals(0, exitCode, err.toString());
        assertTrue(out.toString().startsWith("# variant 1 of "), out.toString());
    }

    @Test
    void testCountMustBePositive() {
        assertEquals(2, run("generate", sourceFile.toString(), "-l", "python", "-t", "2", "--count", "0"));
        assertTrue(err.toString().contains("Count must be positive"), err.toString());
    }

    @Test
    void testCountWithOutputFileConflict() {
        int exitCode = run("generate", sourceFile.toString(), "-l", "python", "-t", "2", "--count", "2", "-o",
                tempDir.resolve("out.py").toString());

        assertEquals(2, exitCode);
        assertTrue(err.toString().contains("Cannot use --output with --count greater than 1"));
    }

    @Test
    void testJsonAndDiffConflict() {
        int exitCode = run("generate", sourceFile.toString(), "-l", "python", "-t", "1", "--json", "--diff");

        assertEquals(2, exitCode);
        assertTrue(err.toString().contains("Configuration error: Cannot use both --json and --diff"));
    }

    @Test
    void testMinSimilarityOutOfRange() {
        assertEquals(2, run("generate", sourceFile.toString(), "-l", "python", "-t", "3", "--min-similarity", "150"));
    }

    @Test
    void testUnknownLanguage() {
        assertEquals(2, run("generate", sourceFile.toString(), "-l", "cobol", "-t", "1"));
    }

    @Test
    void testMissingRequiredOption() {
        assertEquals(2, run("generate", sourceFile.toString(), "-t", "1"));
    }

    @Test
    void testMissingFile() {
        int exitCode = run("generate", tempDir.resolve("absent.py").toString(), "-l", "python", "-t", "1");

        assertEquals(3, exitCode);
        assertTrue(err.toString().startsWith("I/O error"), err.toString());
    }

    @Test
    void testEmptySource() throws IOException {
        Path empty = tempDir.resolve("empty.py");
        Files.writeString(empty, "\n\n");

        int exitCode = run("generate", empty.toString(), "-l", "python", "-t", "1");

        assertEquals(2, exitCode);
        assertTrue(err.toString().startsWith("Input error"), err.toString());
    }

    @Test
    void testNoSubcommand() {
        assertEquals(2, run());
        assertTrue(err.toString().contains("Usage: clonegen"));
    }

    @Test
    void testValidateValid() throws IOException {
        Path variant = tempDir.resolve("variant.py");
        Files.writeString(variant, "def calculate(a,b):\n  result=a+b*2\n  return result\n");

        int exitCode = run("validate", "--original", sourceFile.toString(), "--variant", variant.toString(),
                "-l", "python", "-t", "1");

        assertEquals(0, exitCode, err.toString());
        assertTrue(out.toString().startsWith("Valid type1 clone"));
    }

    @Test
    void testValidateInvalid() throws IOException {
        Path variant = tempDir.resolve("variant.py");
        Files.writeString(variant, "def calculate(a, b):\n    result = a - b * 2\n    return result\n");

        int exitCode = run("validate", "--original", sourceFile.toString(), "--variant", variant.toString(),
                "-l", "python", "-t", "type2");

        assertEquals(1, exitCode);
        assertTrue(out.toString().contains("  - STRUCTURE_MISMATCH: token"), out.toString());
    }

    @Test
    void testValidateJson() throws IOException {
        int exitCode = run("validate", "--original", sourceFile.toString(), "--variant", sourceFile.toString(),
                "-l", "python", "-t", "3", "--json");

        assertEquals(1, exitCode);
        JsonNode json = new ObjectMapper().readTree(out.toString());
        assertEquals("TYPE_3", json.path("claimedType").asText());
        assertEquals("SIMILARITY_OUT_OF_WINDOW", json.path("violations").path(0).path("kind").asText());
        assertEquals(1.0, json.path("similarity").asDouble(), 0.0001);
    }

    @Test
    void testValidateBothFromStdin() {
        int exitCode = run("validate", "--original", "-", "--variant", "-", "-l", "python", "-t", "1");

        assertEquals(2, exitCode);
    }
}
