package com.dialogchain.generator.generate;

import com.dialogchain.core.OutputConfig;
import com.dialogchain.core.ProcessorConfig;
import com.dialogchain.core.ProjectTemplate;
import com.dialogchain.core.TriggerConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes {@code pipeline.yaml}, the descriptor the DialogChain runtime reads.
 *
 * <p>Keys are emitted in a fixed order: {@code name, version, description,
 * triggers, processors, outputs, settings}. Inside each record the order
 * follows the template definition, so regenerating a project produces the
 * same bytes.
 */
public class PipelineConfigGenerator {
    public static final String FILE_NAME = "pipeline.yaml";
    public static final String PIPELINE_VERSION = "1.0.0";

    private final ObjectMapper yaml;

    public PipelineConfigGenerator() {
        this.yaml = new ObjectMapper(YAMLFactory.builder()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
                .enable(YAMLGenerator.Feature.ALWAYS_QUOTE_NUMBERS_AS_STRINGS)
                .enable(YAMLGenerator.Feature.INDENT_ARRAYS_WITH_INDICATOR)
                .build());
    }

    public void generate(GenerationContext context) throws IOException {
        context.write(FILE_NAME, serialize(context.template(), context.projectName()));
    }

    public byte[] serialize(ProjectTemplate template, String projectName) throws JsonProcessingException {
        return yaml.writeValueAsBytes(descriptor(template, projectName));
    }

    Map<String, Object> descriptor(ProjectTemplate template, String projectName) {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("name", projectName);
        root.put("version", PIPELINE_VERSION);
        root.put("description", template.description());
        root.put("triggers", template.triggers().stream().map(PipelineConfigGenerator::trigger).toList());
        root.put("processors", template.processors().stream().map(PipelineConfigGenerator::processor).toList());
        root.put("outputs", template.outputs().stream().map(PipelineConfigGenerator::output).toList());
        root.put("settings", settings());
        return root;
    }

    private static Map<String, Object> trigger(TriggerConfig trigger) {
        Map<String, Object> node = new LinkedHashMap<>();
        node.put("id", trigger.id());
        node.put("type", trigger.type());
        node.putAll(trigger.params());
        node.put("enabled", trigger.enabled());
        return node;
    }

    private static Map<String, Object> processor(ProcessorConfig processor) {
        Map<String, Object> node = new LinkedHashMap<>();
        node.put("id", processor.id());
        node.put("type", processor.type());
        node.putAll(processor.source());
        node.put("parallel", processor.parallel());
        node.put("timeout", processor.timeout().toMillis());
        node.put("retry", processor.retry());
        node.put("dependencies", processor.dependencies());
        if (!processor.environment().isEmpty()) {
            node.put("environment", processor.environment());
        }
        return node;
    }

    private static Map<String, Object> output(OutputConfig output) {
        Map<String, Object> node = new LinkedHashMap<>();
        node.put("id", output.id());
        node.put("type", output.type());
        node.putAll(output.destination());
        if (output.condition() != null) {
            node.put("condition", output.condition());
        }
        if (output.batchSize() != null) {
            node.put("batch_size", output.batchSize());
        }
        return node;
    }

    // Runtime defaults; not taken from the template.
    private static Map<String, Object> settings() {
        Map<String, Object> performance = new LinkedHashMap<>();
        performance.put("max_concurrent", 10);
        performance.put("buffer_size", 1000);

        Map<String, Object> monitoring = new LinkedHashMap<>();
        monitoring.put("enabled", true);
        monitoring.put("log_level", "INFO");

        Map<String, Object> security = new LinkedHashMap<>();
        security.put("require_auth", false);
        security.put("rate_limit", 1000);

        Map<String, Object> settings = new LinkedHashMap<>();
        settings.put("performance", performance);
        settings.put("monitoring", monitoring);
        settings.put("security", security);
        return settings;
    }
}
