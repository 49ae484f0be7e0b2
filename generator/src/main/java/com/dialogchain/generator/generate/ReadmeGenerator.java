package com.dialogchain.generator.generate;

import com.dialogchain.core.ProcessorConfig;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class ReadmeGenerator {
    private final HandlebarsEngine engine;

    public ReadmeGenerator(HandlebarsEngine engine) {
        this.engine = engine;
    }

    public void generate(GenerationContext context) throws IOException {
        Map<String, Object> model = context.templateContext();
        model.put("processors", processorRows(context.template().processors()));
        Optional<String> testRequest = QuickStart.testRequest(context.template());
        model.put("testRequest", testRequest.orElse(null));

        context.write("README.md", engine.render("README.md", model));
    }

    private static List<Map<String, Object>> processorRows(List<ProcessorConfig> processors) {
        return processors.stream()
                .map(p -> Map.<String, Object>of(
                        "id", p.id(),
                        "type", p.type() == null ? "" : p.type(),
                        "dependsOn", p.dependencies().isEmpty() ? "-" : String.join(", ", p.dependencies())))
                .toList();
    }
}
