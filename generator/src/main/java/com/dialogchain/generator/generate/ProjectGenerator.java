package com.dialogchain.generator.generate;

import com.dialogchain.core.ProcessorConfig;
import com.dialogchain.core.ProjectTemplate;
import com.dialogchain.core.TemplateRegistry;
import com.dialogchain.generator.generate.processor.ProcessorStubSynthesizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Orchestrates all generators to produce a DialogChain pipeline project
 * from a registered template.
 *
 * <p>The steps run in a fixed order and each writes straight to disk. A
 * failing step aborts the run with {@link GenerationException} and leaves
 * whatever was already written; running again overwrites it. An unknown
 * template or an invalid project name fails before anything is created.
 * Two runs must not target the same project directory at the same time.
 */
public class ProjectGenerator {
    private static final Logger logger = LoggerFactory.getLogger(ProjectGenerator.class);

    public static final String DEFAULT_TEMPLATE = "basic";

    public static final List<String> DIRECTORIES = List.of(
            "processors", "scripts", "configs", "logs", "cache", "models", "data", "tests", "docs");

    private static final Pattern PROJECT_NAME = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*");

    private final TemplateRegistry registry;
    private final GeneratorOptions options;
    private final PipelineConfigGenerator pipelineConfigGenerator;
    private final ProcessorStubSynthesizer stubSynthesizer;
    private final DockerfileGenerator dockerfileGenerator;
    private final DockerComposeGenerator dockerComposeGenerator;
    private final DevScriptGenerator devScriptGenerator;
    private final DependencyAggregator dependencyAggregator;
    private final GitignoreGenerator gitignoreGenerator;
    private final ReadmeGenerator readmeGenerator;

    public ProjectGenerator(TemplateRegistry registry, GeneratorOptions options) {
        this(registry, options, new HandlebarsEngine());
    }

    private ProjectGenerator(TemplateRegistry registry, GeneratorOptions options, HandlebarsEngine engine) {
        this(registry, options, engine, ProcessorStubSynthesizer.withDefaults(engine, options.strict()));
    }

    /**
     * Uses {@code stubSynthesizer} for processor stubs, e.g. one with extra
     * processor types registered.
     */
    public ProjectGenerator(TemplateRegistry registry, GeneratorOptions options,
                            HandlebarsEngine engine, ProcessorStubSynthesizer stubSynthesizer) {
        this.registry = registry;
        this.options = options;
        this.pipelineConfigGenerator = new PipelineConfigGenerator();
        this.stubSynthesizer = stubSynthesizer;
        this.dependencyAggregator = new DependencyAggregator();
        this.dockerfileGenerator = new DockerfileGenerator(engine, dependencyAggregator);
        this.dockerComposeGenerator = new DockerComposeGenerator(engine);
        this.devScriptGenerator = new DevScriptGenerator(engine);
        this.gitignoreGenerator = new GitignoreGenerator(engine);
        this.readmeGenerator = new ReadmeGenerator(engine);
    }

    public GenerationResult generate(String projectName) {
        return generate(projectName, DEFAULT_TEMPLATE);
    }

    public GenerationResult generate(String projectName, String templateName) {
        requireValidProjectName(projectName);
        ProjectTemplate template = registry.lookup(templateName);
        template.processors().forEach(stubSynthesizer::check);

        Path projectPath = options.baseDirectory().resolve(projectName).toAbsolutePath().normalize();
        GenerationContext context = new GenerationContext(projectName, template, projectPath, options);

        logger.info("Generating DialogChain project '{}' from template '{}' to {}",
                projectName, templateName, projectPath);

        step(context, "directories", () -> {
            context.createDirectories("");
            for (String directory : DIRECTORIES) {
                context.createDirectories(directory);
            }
        });

        step(context, "pipeline configuration", () -> pipelineConfigGenerator.generate(context));

        step(context, "processors", () -> {
            for (ProcessorConfig processor : template.processors()) {
                stubSynthesizer.synthesize(processor, context);
            }
        });

        step(context, "docker", () -> {
            dockerfileGenerator.generate(context);
            dockerComposeGenerator.generate(context);
        });

        step(context, "scripts", () -> devScriptGenerator.generate(context));

        step(context, "requirements", () -> dependencyAggregator.generate(context));

        step(context, "documentation", () -> {
            gitignoreGenerator.generate(context);
            readmeGenerator.generate(context);
        });

        List<String> nextSteps = QuickStart.nextSteps(projectPath, template);
        logger.info("Project '{}' generated: {} files, {} processors skipped",
                projectName, context.files().size(), context.skippedProcessors().size());

        return new GenerationResult(projectName, templateName, projectPath,
                context.files(), context.skippedProcessors(), nextSteps);
    }

    private static void step(GenerationContext context, String name, Step step) {
        logger.info("  Generating {}", name);
        try {
            step.run();
        } catch (IOException e) {
            throw new GenerationException(context.projectPath(), name, e);
        }
    }

    /**
     * Project names end up in shell scripts, compose service keys and Go module
     * paths, so only letters, digits, {@code .}, {@code _} and {@code -} are
     * accepted, starting with a letter or digit.
     */
    static void requireValidProjectName(String projectName) {
        if (projectName == null || projectName.isBlank()) {
            throw new IllegalArgumentException("Project name must not be blank");
        }
        if (!PROJECT_NAME.matcher(projectName).matches()) {
            throw new IllegalArgumentException("Invalid project name '" + projectName
                    + "': use letters, digits, '.', '_' or '-', starting with a letter or digit");
        }
    }

    @FunctionalInterface
    private interface Step {
        void run() throws IOException;
    }
}
