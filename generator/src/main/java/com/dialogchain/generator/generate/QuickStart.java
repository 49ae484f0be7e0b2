package com.dialogchain.generator.generate;

import com.dialogchain.core.ProjectTemplate;
import com.dialogchain.core.TriggerConfig;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Commands a user runs first in a freshly generated project.
 */
final class QuickStart {
    private QuickStart() {}

    static List<String> nextSteps(Path projectPath, ProjectTemplate template) {
        List<String> steps = new ArrayList<>();
        steps.add("cd " + projectPath);
        steps.add("./scripts/dev.sh setup");
        steps.add("./scripts/dev.sh start");
        steps.add(testRequest(template)
                .map(request -> "Test: " + request)
                .orElse("Test: ./scripts/dev.sh test"));
        return steps;
    }

    /**
     * A curl call against the first enabled HTTP trigger, if the template has one.
     */
    static Optional<String> testRequest(ProjectTemplate template) {
        return template.triggers().stream()
                .filter(TriggerConfig::enabled)
                .filter(t -> "http".equals(t.type()))
                .findFirst()
                .map(t -> "curl -X POST http://localhost:" + t.params().getOrDefault("port", 8080)
                        + t.params().getOrDefault("path", "/")
                        + " -H \"Content-Type: application/json\" -d '{\"message\":\"test\"}'");
    }
}
