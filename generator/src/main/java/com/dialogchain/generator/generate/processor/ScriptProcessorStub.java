package com.dialogchain.generator.generate.processor;

import com.dialogchain.core.ProcessorConfig;
import com.dialogchain.generator.generate.GenerationContext;
import com.dialogchain.generator.generate.HandlebarsEngine;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Single executable script at {@code processors/<id>.<extension>}.
 */
public class ScriptProcessorStub implements ProcessorStub {
    private final HandlebarsEngine engine;
    private final String type;
    private final String extension;
    private final String templateName;

    public ScriptProcessorStub(HandlebarsEngine engine, String type, String extension, String templateName) {
        this.engine = engine;
        this.type = type;
        this.extension = extension;
        this.templateName = templateName;
    }

    public static ScriptProcessorStub python(HandlebarsEngine engine) {
        return new ScriptProcessorStub(engine, "python", "py", "processor/python.py");
    }

    public static ScriptProcessorStub node(HandlebarsEngine engine) {
        return new ScriptProcessorStub(engine, "node", "js", "processor/node.js");
    }

    @Override
    public String type() {
        return type;
    }

    @Override
    public List<Path> synthesize(ProcessorConfig processor, GenerationContext context) throws IOException {
        Map<String, Object> model = context.templateContext();
        model.put("processorId", processor.id());

        String content = engine.render(templateName, model);
        return List.of(context.writeExecutable("processors/" + processor.id() + "." + extension, content));
    }
}
