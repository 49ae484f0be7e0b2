package com.dialogchain.generator.generate;

import com.dialogchain.core.ProjectTemplate;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * State shared by the steps of one generation run: the template being
 * rendered, where the project lives, and what has been written so far.
 */
public class GenerationContext {
    private final String projectName;
    private final ProjectTemplate template;
    private final Path projectPath;
    private final GeneratorOptions options;
    private final List<Path> files = new ArrayList<>();
    private final List<String> skippedProcessors = new ArrayList<>();

    public GenerationContext(String projectName, ProjectTemplate template, Path projectPath, GeneratorOptions options) {
        this.projectName = projectName;
        this.template = template;
        this.projectPath = projectPath;
        this.options = options;
    }

    public String projectName() {
        return projectName;
    }

    public ProjectTemplate template() {
        return template;
    }

    public Path projectPath() {
        return projectPath;
    }

    public GeneratorOptions options() {
        return options;
    }

    /** UTC date of this run, ISO-8601. */
    public String generatedOn() {
        return LocalDate.ofInstant(options.clock().instant(), ZoneOffset.UTC).toString();
    }

    /**
     * Base context for templates: project name, template name and generation date.
     */
    public Map<String, Object> templateContext() {
        Map<String, Object> context = new HashMap<>();
        context.put("projectName", projectName);
        context.put("templateName", template.name());
        context.put("description", template.description());
        context.put("generatedOn", generatedOn());
        return context;
    }

    public Path createDirectories(String relativePath) throws IOException {
        return Files.createDirectories(projectPath.resolve(relativePath));
    }

    /**
     * Writes {@code content} to a file under the project, replacing any
     * existing file and creating missing parent directories.
     */
    public Path write(String relativePath, String content) throws IOException {
        return write(relativePath, content.getBytes(StandardCharsets.UTF_8));
    }

    public Path write(String relativePath, byte[] content) throws IOException {
        Path file = projectPath.resolve(relativePath);
        Files.createDirectories(file.getParent());
        Files.write(file, content);
        files.add(projectPath.relativize(file));
        return file;
    }

    /** Like {@link #write(String, String)}, then sets mode 755. */
    public Path writeExecutable(String relativePath, String content) throws IOException {
        Path file = write(relativePath, content);
        markExecutable(file);
        return file;
    }

    public void skipProcessor(String processorId) {
        skippedProcessors.add(processorId);
    }

    public List<Path> files() {
        return List.copyOf(files);
    }

    public List<String> skippedProcessors() {
        return List.copyOf(skippedProcessors);
    }

    private static void markExecutable(Path file) throws IOException {
        try {
            Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rwxr-xr-x"));
        } catch (UnsupportedOperationException e) {
            if (!file.toFile().setExecutable(true, false)) {
                throw new IOException("Cannot mark " + file + " executable", e);
            }
        }
    }
}
