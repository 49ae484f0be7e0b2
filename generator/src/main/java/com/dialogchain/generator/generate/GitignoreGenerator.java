package com.dialogchain.generator.generate;

import java.io.IOException;
import java.util.Map;

public class GitignoreGenerator {
    private final HandlebarsEngine engine;

    public GitignoreGenerator(HandlebarsEngine engine) {
        this.engine = engine;
    }

    public void generate(GenerationContext context) throws IOException {
        context.write(".gitignore", engine.render("gitignore", Map.of()));
    }
}
