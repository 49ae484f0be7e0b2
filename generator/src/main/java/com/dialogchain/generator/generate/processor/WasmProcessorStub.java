package com.dialogchain.generator.generate.processor;

import com.dialogchain.core.ProcessorConfig;
import com.dialogchain.generator.generate.GenerationContext;
import com.dialogchain.generator.generate.HandlebarsEngine;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Reserves {@code processors/<id>_wasm/} with a README. No Rust source is
 * generated for WASM processors yet.
 */
public class WasmProcessorStub implements ProcessorStub {
    private final HandlebarsEngine engine;

    public WasmProcessorStub(HandlebarsEngine engine) {
        this.engine = engine;
    }

    @Override
    public String type() {
        return "rust_wasm";
    }

    @Override
    public List<Path> synthesize(ProcessorConfig processor, GenerationContext context) throws IOException {
        Map<String, Object> model = context.templateContext();
        model.put("processorId", processor.id());
        model.put("wasmPath", processor.source().getOrDefault("wasm", "processors/" + processor.id() + ".wasm"));

        String readme = engine.render("processor/wasm-readme.md", model);
        return List.of(context.write("processors/" + processor.id() + "_wasm/README.md", readme));
    }
}
