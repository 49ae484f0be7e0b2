package com.dialogchain.generator.generate;

import java.io.IOException;
import java.util.List;
import java.util.Map;

public class DockerfileGenerator {
    private final HandlebarsEngine engine;
    private final DependencyAggregator dependencies;

    public DockerfileGenerator(HandlebarsEngine engine, DependencyAggregator dependencies) {
        this.engine = engine;
        this.dependencies = dependencies;
    }

    public void generate(GenerationContext context) throws IOException {
        Map<String, Object> model = context.templateContext();
        model.put("systemPackages", String.join(" ", dependencies.systemPackages(context.template())));
        model.put("environment", context.template().environmentVars().entrySet().stream()
                .map(e -> Map.of("name", e.getKey(), "value", e.getValue()))
                .toList());

        context.write("Dockerfile", engine.render("Dockerfile", model));
    }
}
