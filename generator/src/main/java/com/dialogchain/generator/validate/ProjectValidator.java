package com.dialogchain.generator.validate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Checks that a directory looks like a runnable DialogChain project: the
 * descriptor and processor directory exist, YAML files parse, processor
 * dependencies form a DAG over declared ids, and stubs and scripts are in
 * a usable state.
 */
public class ProjectValidator {
    private static final Logger logger = LoggerFactory.getLogger(ProjectValidator.class);

    static final List<String> OPTIONAL_FILES = List.of(
            "requirements.txt", "Dockerfile", "docker-compose.yml", ".gitignore", "README.md");
    static final List<String> OPTIONAL_DIRECTORIES = List.of("configs", "scripts", "tests", "logs");
    private static final int FIRST_LINE_LIMIT = 256;

    private final ObjectMapper yaml = new ObjectMapper(new YAMLFactory());

    public ValidationReport validate(Path projectDir) throws IOException {
        ValidationReport report = new ValidationReport();
        logger.info("Validating DialogChain project at {}", projectDir);

        checkFile(report, projectDir, "pipeline.yaml", true);
        for (String file : OPTIONAL_FILES) {
            checkFile(report, projectDir, file, false);
        }
        checkDirectory(report, projectDir, "processors", true);
        for (String dir : OPTIONAL_DIRECTORIES) {
            checkDirectory(report, projectDir, dir, false);
        }

        JsonNode descriptor = parseYaml(report, projectDir.resolve("pipeline.yaml"));
        Path configs = projectDir.resolve("configs");
        if (Files.isDirectory(configs)) {
            for (Path config : list(configs)) {
                String name = config.getFileName().toString();
                if (name.endsWith(".yaml") || name.endsWith(".yml")) {
                    parseYaml(report, config);
                }
            }
        }
        if (descriptor != null) {
            checkProcessorGraph(report, descriptor);
        }

        checkProcessors(report, projectDir.resolve("processors"));
        checkScripts(report, projectDir.resolve("scripts"));

        logger.info("Validation finished: {} errors, {} warnings",
                report.errors().size(), report.warnings().size());
        return report;
    }

    private static void checkFile(ValidationReport report, Path projectDir, String file, boolean required) {
        if (Files.isRegularFile(projectDir.resolve(file))) {
            report.info("Found: " + file);
        } else if (required) {
            report.error("Missing required file: " + file);
        } else {
            report.warning("Missing optional file: " + file);
        }
    }

    private static void checkDirectory(ValidationReport report, Path projectDir, String dir, boolean required) {
        if (Files.isDirectory(projectDir.resolve(dir))) {
            report.info("Found directory: " + dir);
        } else if (required) {
            report.error("Missing required directory: " + dir);
        } else {
            report.warning("Missing optional directory: " + dir);
        }
    }

    private JsonNode parseYaml(ValidationReport report, Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            return null;
        }
        try {
            JsonNode node = yaml.readTree(file.toFile());
            report.info("Valid YAML: " + file.getFileName());
            return node;
        } catch (JsonProcessingException e) {
            report.error("Invalid YAML syntax in " + file.getFileName() + ": " + e.getOriginalMessage());
            return null;
        }
    }

    static void checkProcessorGraph(ValidationReport report, JsonNode descriptor) {
        Map<String, List<String>> graph = new LinkedHashMap<>();
        for (JsonNode processor : descriptor.path("processors")) {
            String id = processor.path("id").asText(null);
            if (id == null) {
                report.error("Processor without an id in pipeline.yaml");
                continue;
            }
            List<String> dependencies = new ArrayList<>();
            for (JsonNode dependency : processor.path("dependencies")) {
                dependencies.add(dependency.asText());
            }
            if (graph.put(id, dependencies) != null) {
                report.error("Duplicate processor id: " + id);
            }
        }

        boolean resolved = true;
        for (Map.Entry<String, List<String>> entry : graph.entrySet()) {
            for (String dependency : entry.getValue()) {
                if (!graph.containsKey(dependency)) {
                    report.error("Processor '" + entry.getKey() + "' depends on unknown processor '" + dependency + "'");
                    resolved = false;
                }
            }
        }
        if (resolved) {
            List<String> cycle = findCycle(graph);
            if (!cycle.isEmpty()) {
                report.error("Processor dependency cycle: " + String.join(" -> ", cycle));
            }
        }
    }

    /**
     * Depth-first search for a back edge; returns the cycle path, or an empty list.
     */
    static List<String> findCycle(Map<String, List<String>> graph) {
        Map<String, Integer> state = new HashMap<>(); // 1 = on stack, 2 = done
        for (String start : graph.keySet()) {
            List<String> path = new ArrayList<>();
            if (visit(start, graph, state, path)) {
                return path;
            }
        }
        return List.of();
    }

    private static boolean visit(String node, Map<String, List<String>> graph,
                                 Map<String, Integer> state, List<String> path) {
        Integer current = state.get(node);
        if (current != null && current == 2) {
            return false;
        }
        if (current != null && current == 1) {
            List<String> cycle = new ArrayList<>(path.subList(path.indexOf(node), path.size()));
            cycle.add(node);
            path.clear();
            path.addAll(cycle);
            return true;
        }
        state.put(node, 1);
        path.add(node);
        for (String next : graph.getOrDefault(node, List.of())) {
            if (visit(next, graph, state, path)) {
                return true;
            }
        }
        path.remove(path.size() - 1);
        state.put(node, 2);
        return false;
    }

    private static void checkProcessors(ValidationReport report, Path processors) throws IOException {
        if (!Files.isDirectory(processors)) {
            return;
        }
        List<Path> sources;
        try (Stream<Path> walk = Files.walk(processors)) {
            sources = walk.filter(Files::isRegularFile)
                    .filter(p -> {
                        String name = p.getFileName().toString();
                        return name.endsWith(".py") || name.endsWith(".go") || name.endsWith(".js");
                    })
                    .sorted()
                    .toList();
        }
        if (sources.isEmpty()) {
            report.error("No processor files found");
            return;
        }
        report.info("Found " + sources.size() + " processor files");

        for (Path source : sources) {
            String name = source.getFileName().toString();
            if (name.endsWith(".py")) {
                if (firstLine(source).startsWith("#!/usr/bin/env python3")) {
                    report.info("Python processor: " + name);
                } else {
                    report.warning("Python processor missing shebang: " + name);
                }
            } else if (name.equals("main.go")) {
                String module = source.getParent().getFileName().toString();
                if (Files.isRegularFile(source.resolveSibling("go.mod"))) {
                    report.info("Go processor: " + module);
                } else {
                    report.warning("Go processor missing go.mod: " + module);
                }
            }
        }
    }

    private static void checkScripts(ValidationReport report, Path scripts) throws IOException {
        if (!Files.isDirectory(scripts)) {
            return;
        }
        for (Path script : list(scripts)) {
            String name = script.getFileName().toString();
            if (!name.endsWith(".sh")) {
                continue;
            }
            if (Files.isExecutable(script)) {
                report.info("Executable script: " + name);
            } else {
                report.warning("Non-executable script: " + name);
            }
        }
    }

    private static List<Path> list(Path dir) throws IOException {
        try (Stream<Path> entries = Files.list(dir)) {
            return entries.filter(Files::isRegularFile).sorted().toList();
        }
    }

    /**
     * First line of {@code file} decoded as ISO-8859-1, so any byte sequence
     * reads without error. Only the leading bytes are read.
     */
    static String firstLine(Path file) throws IOException {
        byte[] head;
        try (InputStream in = Files.newInputStream(file)) {
            head = in.readNBytes(FIRST_LINE_LIMIT);
        }
        String text = new String(head, StandardCharsets.ISO_8859_1);
        int end = text.indexOf('\n');
        String line = end < 0 ? text : text.substring(0, end);
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }
}
