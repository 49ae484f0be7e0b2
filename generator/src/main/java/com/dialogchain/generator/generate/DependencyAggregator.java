package com.dialogchain.generator.generate;

import com.dialogchain.core.ProjectTemplate;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the dependency manifests of a generated project.
 *
 * <p>Template packages are appended verbatim after the generator's own
 * baseline. Entries are not deduplicated: a package a template lists twice
 * appears twice.
 */
public class DependencyAggregator {
    public static final String REQUIREMENTS_FILE = "requirements.txt";

    /** Needed by the generated Python stubs and the runtime helpers. */
    public static final List<String> PYTHON_BASELINE = List.of("pyyaml>=6.0", "requests>=2.31.0");

    /** Needed to build native wheels inside the container. */
    public static final List<String> SYSTEM_BASELINE = List.of("build-essential");

    public void generate(GenerationContext context) throws IOException {
        context.write(REQUIREMENTS_FILE, aggregate(context.template()));
    }

    /**
     * Contents of {@code requirements.txt}, one package per line.
     */
    public String aggregate(ProjectTemplate template) {
        List<String> requirements = pythonPackages(template);
        return String.join("\n", requirements) + "\n";
    }

    public List<String> pythonPackages(ProjectTemplate template) {
        List<String> packages = new ArrayList<>(PYTHON_BASELINE);
        packages.addAll(template.dependenciesFor("python"));
        return packages;
    }

    /**
     * OS packages installed into the container image.
     */
    public List<String> systemPackages(ProjectTemplate template) {
        List<String> packages = new ArrayList<>(SYSTEM_BASELINE);
        packages.addAll(template.dependenciesFor("system"));
        return packages;
    }
}
