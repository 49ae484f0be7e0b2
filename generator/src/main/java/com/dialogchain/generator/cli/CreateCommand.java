package com.dialogchain.generator.cli;

import com.dialogchain.core.TemplateNotFoundException;
import com.dialogchain.core.TemplateRegistry;
import com.dialogchain.generator.generate.GenerationException;
import com.dialogchain.generator.generate.GenerationResult;
import com.dialogchain.generator.generate.GeneratorOptions;
import com.dialogchain.generator.generate.ProjectGenerator;
import com.dialogchain.generator.generate.processor.UnsupportedProcessorTypeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
        name = "create",
        description = "Create a new DialogChain project from a template",
        mixinStandardHelpOptions = true
)
public class CreateCommand implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(CreateCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Project name, used as the directory name")
    private String projectName;

    @Option(names = {"--template", "-t"}, defaultValue = ProjectGenerator.DEFAULT_TEMPLATE,
            description = "Template to generate from (default: ${DEFAULT-VALUE})")
    private String templateName;

    @Option(names = {"--output-dir", "-o"}, defaultValue = "${env:DIALOGCHAIN_OUTPUT_DIR:-.}",
            description = "Directory the project is created in (default: ${DEFAULT-VALUE})")
    private File outputDir;

    @Option(names = {"--strict"}, defaultValue = "${env:DIALOGCHAIN_STRICT:-false}",
            description = "Fail on processor types without a stub instead of skipping them")
    private boolean strict;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            GeneratorOptions options = GeneratorOptions.builder()
                    .baseDirectory(outputDir.toPath().toAbsolutePath())
                    .strict(strict)
                    .build();
            ProjectGenerator generator = new ProjectGenerator(TemplateRegistry.builtIn(), options);

            out.println("Generating DialogChain project: " + projectName);
            GenerationResult result = generator.generate(projectName, templateName);

            for (String skipped : result.skippedProcessors()) {
                out.println("Skipped processor without a stub: " + skipped);
            }
            out.println("Project '" + projectName + "' generated successfully!");
            out.println();
            out.println("Next steps:");
            List<String> nextSteps = result.nextSteps();
            for (int i = 0; i < nextSteps.size(); i++) {
                out.println("  " + (i + 1) + ". " + nextSteps.get(i));
            }
            out.flush();
            return 0;
        } catch (TemplateNotFoundException | UnsupportedProcessorTypeException
                 | GenerationException | IllegalArgumentException e) {
            logger.debug("Generation failed", e);
            err.println("Error: " + e.getMessage());
            err.flush();
            return 1;
        }
    }
}
