package com.dialogchain.generator.generate;

import com.dialogchain.core.BuiltinTemplates;
import com.dialogchain.core.OutputConfig;
import com.dialogchain.core.ProjectTemplate;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PipelineConfigGeneratorTest {

    private final PipelineConfigGenerator generator = new PipelineConfigGenerator();
    private final ObjectMapper yaml = new ObjectMapper(new YAMLFactory());

    private JsonNode parse(ProjectTemplate template, String projectName) throws Exception {
        return yaml.readTree(generator.serialize(template, projectName));
    }

    private static List<String> keys(JsonNode node) {
        List<String> keys = new ArrayList<>();
        node.fieldNames().forEachRemaining(keys::add);
        return keys;
    }

    @Test
    void topLevelKeysAreInCanonicalOrder() throws Exception {
        JsonNode root = parse(BuiltinTemplates.basic(), "demo");

        assertEquals(List.of("name", "version", "description", "triggers", "processors", "outputs", "settings"),
                keys(root));
        assertEquals("demo", root.get("name").asText());
        assertEquals("1.0.0", root.get("version").asText());
        assertEquals("Simple HTTP to file pipeline", root.get("description").asText());
    }

    @Test
    void triggerKeysFollowTemplateOrder() throws Exception {
        JsonNode trigger = parse(BuiltinTemplates.basic(), "demo").get("triggers").get(0);

        assertEquals(List.of("id", "type", "port", "path", "enabled"), keys(trigger));
        assertEquals(8080, trigger.get("port").asInt());
        assertTrue(trigger.get("enabled").asBoolean());
    }

    @Test
    void processorTimeoutIsWrittenInMilliseconds() throws Exception {
        JsonNode processor = parse(BuiltinTemplates.basic(), "demo").get("processors").get(0);

        assertEquals(List.of("id", "type", "script", "parallel", "timeout", "retry", "dependencies"), keys(processor));
        assertEquals("processors/main.py", processor.get("script").asText());
        assertEquals(5000, processor.get("timeout").asInt());
        assertEquals(2, processor.get("retry").asInt());
        assertTrue(processor.get("dependencies").isArray());
        assertEquals(0, processor.get("dependencies").size());
    }

    @Test
    void processorEnvironmentIsWrittenOnlyWhenPresent() throws Exception {
        JsonNode processors = parse(BuiltinTemplates.security(), "guard").get("processors");

        JsonNode detection = processors.get(0);
        assertEquals("/models/yolov8n.pt", detection.get("environment").get("MODEL_PATH").asText());
        assertTrue(detection.get("environment").get("CONFIDENCE_THRESHOLD").isTextual());
        assertEquals("0.6", detection.get("environment").get("CONFIDENCE_THRESHOLD").asText());

        JsonNode threat = processors.get(1);
        assertFalse(threat.has("environment"));
        assertEquals(List.of("id", "type", "binary", "args", "parallel", "timeout", "retry", "dependencies"),
                keys(threat));
        assertEquals("--confidence=0.7", threat.get("args").get(0).asText());
        assertEquals("object_detection", threat.get("dependencies").get(0).asText());
    }

    @Test
    void outputOptionalFieldsFollowDestination() throws Exception {
        JsonNode outputs = parse(BuiltinTemplates.security(), "guard").get("outputs");

        assertEquals(List.of("id", "type", "smtp", "to", "condition"), keys(outputs.get(0)));
        assertEquals("security@company.com", outputs.get(0).get("to").get(0).asText());
        assertEquals("threat_level > 0.8", outputs.get(0).get("condition").asText());
        assertEquals(List.of("id", "type", "url", "batch_size"), keys(outputs.get(1)));
        assertEquals(10, outputs.get(1).get("batch_size").asInt());
    }

    @Test
    void settingsAreFixed() throws Exception {
        ProjectTemplate bare = ProjectTemplate.builder().name("bare").description("nothing").build();
        JsonNode settings = parse(bare, "bare").get("settings");

        assertEquals(List.of("performance", "monitoring", "security"), keys(settings));
        assertEquals(10, settings.at("/performance/max_concurrent").asInt());
        assertEquals(1000, settings.at("/performance/buffer_size").asInt());
        assertTrue(settings.at("/monitoring/enabled").asBoolean());
        assertEquals("INFO", settings.at("/monitoring/log_level").asText());
        assertFalse(settings.at("/security/require_auth").asBoolean());
        assertEquals(1000, settings.at("/security/rate_limit").asInt());
    }

    @Test
    void emptyCollectionsAreWrittenAsEmptyLists() throws Exception {
        ProjectTemplate bare = ProjectTemplate.builder().name("bare").description("nothing").build();
        JsonNode root = parse(bare, "bare");

        assertEquals(0, root.get("triggers").size());
        assertEquals(0, root.get("processors").size());
        assertEquals(0, root.get("outputs").size());
    }

    @Test
    void serializationIsDeterministic() throws Exception {
        byte[] first = generator.serialize(BuiltinTemplates.iot(), "sensors");
        byte[] second = generator.serialize(BuiltinTemplates.iot(), "sensors");

        assertArrayEquals(first, second);
    }

    @Test
    void documentHasNoStartMarker() throws Exception {
        String text = new String(generator.serialize(BuiltinTemplates.basic(), "demo"), StandardCharsets.UTF_8);

        assertTrue(text.startsWith("name: demo\n"));
        assertFalse(text.contains("---"));
    }

    @Test
    void outputWithoutOptionalFields() throws Exception {
        ProjectTemplate template = ProjectTemplate.builder()
                .name("files")
                .description("file output only")
                .output(OutputConfig.builder().id("out").type("file").destination("path", "logs/out.log"))
                .build();

        JsonNode output = parse(template, "files").get("outputs").get(0);

        assertEquals(List.of("id", "type", "path"), keys(output));
    }
}
