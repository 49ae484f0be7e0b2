package com.dialogchain.generator;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class DialogChainCliTest {

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int execute(String... args) {
        CommandLine cli = new CommandLine(new DialogChainCli());
        cli.setOut(new PrintWriter(out));
        cli.setErr(new PrintWriter(err));
        return cli.execute(args);
    }

    @Test
    void createGeneratesProjectAndPrintsNextSteps(@TempDir Path dir) {
        int exitCode = execute("create", "demo", "--output-dir", dir.toString());

        assertEquals(0, exitCode, err.toString());
        assertTrue(Files.isRegularFile(dir.resolve("demo/pipeline.yaml")));
        String output = out.toString();
        assertTrue(output.contains("Generating DialogChain project: demo"));
        assertTrue(output.contains("Project 'demo' generated successfully!"));
        assertTrue(output.contains("Next steps:"));
        assertTrue(output.contains("  2. ./scripts/dev.sh setup"));
        assertTrue(output.contains("curl -X POST http://localhost:8080/webhook"));
    }

    @Test
    void createWithTemplateOption(@TempDir Path dir) {
        int exitCode = execute("create", "guard", "-t", "security", "-o", dir.toString());

        assertEquals(0, exitCode, err.toString());
        assertTrue(Files.isRegularFile(dir.resolve("guard/processors/threat_analysis/go.mod")));
    }

    @Test
    void createWithUnknownTemplateFails(@TempDir Path dir) throws Exception {
        int exitCode = execute("create", "demo", "--template", "nope", "--output-dir", dir.toString());

        assertEquals(1, exitCode);
        assertTrue(err.toString().contains("Error: Template 'nope' not found"), err.toString());
        assertFalse(Files.exists(dir.resolve("demo")));
    }

    @Test
    void createWithInvalidNameFails(@TempDir Path dir) {
        int exitCode = execute("create", "../escape", "--output-dir", dir.toString());

        assertEquals(1, exitCode);
        assertTrue(err.toString().startsWith("Error: "));
    }

    @Test
    void createWithoutNameIsUsageError() {
        int exitCode = execute("create");

        assertEquals(2, exitCode);
        assertTrue(err.toString().contains("Missing required parameter"));
    }

    @Test
    void templatesListsBuiltIns() {
        int exitCode = execute("templates");

        assertEquals(0, exitCode);
        String output = out.toString();
        assertTrue(output.startsWith("Available templates:"));
        assertTrue(output.contains("basic"));
        assertTrue(output.contains("AI-powered security monitoring system"));
        assertTrue(output.contains("processors: rust_wasm, python; services: app, postgres, mqtt"));
    }

    @Test
    void validateGeneratedProject(@TempDir Path dir) {
        assertEquals(0, execute("create", "demo", "--output-dir", dir.toString()));

        int exitCode = execute("validate", dir.resolve("demo").toString());

        String output = out.toString();
        assertEquals(0, exitCode, output);
        assertTrue(output.contains("[ok] Found: pipeline.yaml"));
        assertTrue(output.contains("Errors: 0"));
        assertTrue(output.contains("Project validation passed!"));
    }

    @Test
    void validateEmptyDirectoryFails(@TempDir Path dir) {
        int exitCode = execute("validate", dir.toString());

        assertEquals(1, exitCode);
        String output = out.toString();
        assertTrue(output.contains("[error] Missing required file: pipeline.yaml"));
        assertTrue(output.contains("Errors: 2"));
        assertTrue(output.contains("Project validation failed with 2 errors"));
    }

    @Test
    void validateMissingDirectoryFails(@TempDir Path dir) {
        int exitCode = execute("validate", dir.resolve("absent").toString());

        assertEquals(1, exitCode);
        assertTrue(err.toString().contains("Error: not a directory"));
    }
}
