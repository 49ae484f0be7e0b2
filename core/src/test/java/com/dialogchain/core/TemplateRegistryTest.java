package com.dialogchain.core;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TemplateRegistryTest {

    @Test
    void builtInRegistryHoldsAllTemplatesInOrder() {
        TemplateRegistry registry = TemplateRegistry.builtIn();

        assertEquals(List.of("basic", "security", "iot"), registry.names());
        assertTrue(registry.contains("iot"));
        assertFalse(registry.contains("nonexistent"));
    }

    @Test
    void lookupReturnsNamedTemplate() {
        ProjectTemplate basic = TemplateRegistry.builtIn().lookup("basic");

        assertEquals("basic", basic.name());
        assertEquals("Simple HTTP to file pipeline", basic.description());
        assertEquals("main_processor", basic.processors().get(0).id());
        assertEquals(List.of("app"), basic.dockerServices());
    }

    @Test
    void lookupOfUnknownTemplateThrows() {
        TemplateRegistry registry = TemplateRegistry.builtIn();

        TemplateNotFoundException e = assertThrows(TemplateNotFoundException.class,
                () -> registry.lookup("nonexistent"));
        assertEquals("nonexistent", e.getTemplateName());
        assertTrue(e.getMessage().contains("basic, security, iot"));
    }

    @Test
    void everyBuiltInTemplateHasUniqueIdsAndResolvableDependencies() {
        for (ProjectTemplate template : TemplateRegistry.builtIn().templates()) {
            Set<String> processorIds = new HashSet<>();
            for (ProcessorConfig processor : template.processors()) {
                assertTrue(processorIds.add(processor.id()),
                        "duplicate processor id " + processor.id() + " in " + template.name());
            }
            for (ProcessorConfig processor : template.processors()) {
                for (String dependency : processor.dependencies()) {
                    assertTrue(processorIds.contains(dependency),
                            template.name() + ": " + processor.id() + " depends on " + dependency);
                }
            }
        }
    }

    @Test
    void duplicateProcessorIdIsRejected() {
        ProjectTemplate template = ProjectTemplate.builder()
                .name("dup")
                .description("duplicate ids")
                .processor(ProcessorConfig.builder().id("p").type("python"))
                .processor(ProcessorConfig.builder().id("p").type("go"))
                .build();

        InvalidTemplateException e = assertThrows(InvalidTemplateException.class,
                () -> new TemplateRegistry(List.of(template)));
        assertTrue(e.getMessage().contains("duplicate processor id 'p'"));
    }

    @Test
    void duplicateTriggerIdIsRejected() {
        ProjectTemplate template = ProjectTemplate.builder()
                .name("dup-trigger")
                .description("duplicate trigger ids")
                .trigger(TriggerConfig.builder().id("in").type("http"))
                .trigger(TriggerConfig.builder().id("in").type("mqtt"))
                .build();

        assertThrows(InvalidTemplateException.class, () -> new TemplateRegistry(List.of(template)));
    }

    @Test
    void unknownDependencyIsRejected() {
        ProjectTemplate template = ProjectTemplate.builder()
                .name("dangling")
                .description("dangling dependency")
                .processor(ProcessorConfig.builder().id("a").type("python").dependsOn("missing"))
                .build();

        InvalidTemplateException e = assertThrows(InvalidTemplateException.class,
                () -> new TemplateRegistry(List.of(template)));
        assertEquals("dangling", e.getTemplateName());
        assertTrue(e.getMessage().contains("unknown processor 'missing'"));
    }

    @Test
    void dependencyCyclesAreAccepted() {
        ProjectTemplate template = ProjectTemplate.builder()
                .name("cycle")
                .description("a and b depend on each other")
                .processor(ProcessorConfig.builder().id("a").type("python").dependsOn("b"))
                .processor(ProcessorConfig.builder().id("b").type("python").dependsOn("a"))
                .build();

        TemplateRegistry registry = new TemplateRegistry(List.of(template));

        assertEquals(2, registry.lookup("cycle").processors().size());
    }

    @Test
    void sameNameTwiceIsRejected() {
        assertThrows(InvalidTemplateException.class,
                () -> new TemplateRegistry(List.of(BuiltinTemplates.basic(), BuiltinTemplates.basic())));
    }

    @Test
    void customRegistryOnlyKnowsItsOwnTemplates() {
        TemplateRegistry registry = new TemplateRegistry(List.of(BuiltinTemplates.iot()));

        assertEquals(List.of("iot"), registry.names());
        assertThrows(TemplateNotFoundException.class, () -> registry.lookup("basic"));
    }
}
