package com.dialogchain.generator.generate;

import java.io.IOException;

/**
 * Writes the executable {@code scripts/dev.sh} with the
 * setup/start/stop/logs/test sub-commands.
 */
public class DevScriptGenerator {
    public static final String SCRIPT_PATH = "scripts/dev.sh";

    private final HandlebarsEngine engine;

    public DevScriptGenerator(HandlebarsEngine engine) {
        this.engine = engine;
    }

    public void generate(GenerationContext context) throws IOException {
        context.writeExecutable(SCRIPT_PATH, engine.render("dev.sh", context.templateContext()));
    }
}
