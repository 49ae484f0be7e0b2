package com.dialogchain.generator.generate.processor;

import com.dialogchain.core.ProcessorConfig;
import com.dialogchain.generator.generate.GenerationContext;
import com.dialogchain.generator.generate.HandlebarsEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Dispatches each processor to the {@link ProcessorStub} registered for its
 * type. Supporting a new language is one {@link #register} call.
 *
 * <p>A processor without a type is treated as {@code python}. A processor
 * whose type has no stub is skipped with a warning, or rejected with
 * {@link UnsupportedProcessorTypeException} when the synthesizer is strict.
 */
public class ProcessorStubSynthesizer {
    private static final Logger logger = LoggerFactory.getLogger(ProcessorStubSynthesizer.class);

    public static final String DEFAULT_TYPE = "python";

    private final Map<String, ProcessorStub> stubs = new LinkedHashMap<>();
    private final boolean strict;

    public ProcessorStubSynthesizer(boolean strict) {
        this.strict = strict;
    }

    /**
     * Synthesizer knowing the python, node, go and rust_wasm stubs.
     */
    public static ProcessorStubSynthesizer withDefaults(HandlebarsEngine engine, boolean strict) {
        return new ProcessorStubSynthesizer(strict)
                .register(ScriptProcessorStub.python(engine))
                .register(ScriptProcessorStub.node(engine))
                .register(new GoProcessorStub(engine))
                .register(new WasmProcessorStub(engine));
    }

    public ProcessorStubSynthesizer register(ProcessorStub stub) {
        if (stubs.putIfAbsent(stub.type(), stub) != null) {
            throw new IllegalArgumentException("A stub for processor type '" + stub.type() + "' is already registered");
        }
        return this;
    }

    public Set<String> supportedTypes() {
        return Set.copyOf(stubs.keySet());
    }

    public boolean supports(ProcessorConfig processor) {
        return stubs.containsKey(typeOf(processor));
    }

    public boolean isStrict() {
        return strict;
    }

    /**
     * Throws if strict and {@code processor} has no stub; does nothing otherwise.
     */
    public void check(ProcessorConfig processor) {
        if (strict && !supports(processor)) {
            throw new UnsupportedProcessorTypeException(processor.id(), typeOf(processor), stubs.keySet());
        }
    }

    /**
     * Writes the stub for {@code processor}.
     *
     * @return the files written; empty when the processor was skipped
     */
    public List<Path> synthesize(ProcessorConfig processor, GenerationContext context) throws IOException {
        ProcessorStub stub = stubs.get(typeOf(processor));
        if (stub == null) {
            check(processor);
            logger.warn("Skipping processor '{}': no stub for type '{}'", processor.id(), typeOf(processor));
            context.skipProcessor(processor.id());
            return List.of();
        }
        logger.debug("Synthesizing {} stub for processor '{}'", stub.type(), processor.id());
        return stub.synthesize(processor, context);
    }

    private static String typeOf(ProcessorConfig processor) {
        return processor.type() == null ? DEFAULT_TYPE : processor.type();
    }
}
