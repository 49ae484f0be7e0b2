package com.dialogchain.generator.cli;

import com.dialogchain.core.ProjectTemplate;
import com.dialogchain.core.TemplateRegistry;
import com.dialogchain.generator.generate.processor.ProcessorStubSynthesizer;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

@Command(
        name = "templates",
        description = "List the available project templates",
        mixinStandardHelpOptions = true
)
public class TemplatesCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        out.println("Available templates:");
        for (ProjectTemplate template : TemplateRegistry.builtIn().templates()) {
            out.printf("  %-10s %s%n", template.name(), template.description());
            out.printf("  %-10s processors: %s; services: %s%n", "",
                    processorTypes(template), String.join(", ", template.dockerServices()));
        }
        out.flush();
        return 0;
    }

    /** Distinct processor types in definition order; untyped processors count as python. */
    static String processorTypes(ProjectTemplate template) {
        return template.processors().stream()
                .map(p -> p.type() == null ? ProcessorStubSynthesizer.DEFAULT_TYPE : p.type())
                .distinct()
                .collect(Collectors.joining(", "));
    }
}
