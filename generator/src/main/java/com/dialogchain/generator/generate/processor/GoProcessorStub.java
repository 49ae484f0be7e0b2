package com.dialogchain.generator.generate.processor;

import com.dialogchain.core.ProcessorConfig;
import com.dialogchain.generator.generate.GenerationContext;
import com.dialogchain.generator.generate.HandlebarsEngine;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Go module in {@code processors/<id>/} with {@code main.go} and {@code go.mod}.
 */
public class GoProcessorStub implements ProcessorStub {
    public static final String GO_VERSION = "1.21";

    private final HandlebarsEngine engine;

    public GoProcessorStub(HandlebarsEngine engine) {
        this.engine = engine;
    }

    @Override
    public String type() {
        return "go";
    }

    @Override
    public List<Path> synthesize(ProcessorConfig processor, GenerationContext context) throws IOException {
        String dir = "processors/" + processor.id();
        Map<String, Object> model = context.templateContext();
        model.put("processorId", processor.id());
        model.put("goVersion", GO_VERSION);

        Path main = context.write(dir + "/main.go", engine.render("processor/go-main.go", model));
        Path goMod = context.write(dir + "/go.mod", engine.render("processor/go.mod", model));
        return List.of(main, goMod);
    }
}
