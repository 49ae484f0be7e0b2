package com.dialogchain.generator.cli;

import com.dialogchain.generator.validate.ProjectValidator;
import com.dialogchain.generator.validate.ValidationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(
        name = "validate",
        description = "Validate the structure of a DialogChain project",
        mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(ValidateCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", defaultValue = ".", description = "Project directory (default: ${DEFAULT-VALUE})")
    private File projectDir;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        if (!projectDir.isDirectory()) {
            err.println("Error: not a directory: " + projectDir.getAbsolutePath());
            err.flush();
            return 1;
        }
        try {
            ValidationReport report = new ProjectValidator().validate(projectDir.toPath());
            for (ValidationReport.Finding finding : report.findings()) {
                out.println(marker(finding.severity()) + " " + finding.message());
            }
            out.println();
            out.println("Errors: " + report.errors().size());
            out.println("Warnings: " + report.warnings().size());
            out.println(report.passed()
                    ? "Project validation passed!"
                    : "Project validation failed with " + report.errors().size() + " errors");
            out.flush();
            return report.passed() ? 0 : 1;
        } catch (IOException e) {
            logger.debug("Validation failed", e);
            err.println("Error: " + e.getMessage());
            err.flush();
            return 1;
        }
    }

    private static String marker(ValidationReport.Severity severity) {
        return switch (severity) {
            case INFO -> "[ok]";
            case WARNING -> "[warn]";
            case ERROR -> "[error]";
        };
    }
}
