package com.dialogchain.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Read-only set of named project templates.
 *
 * <p>All templates are supplied and validated at construction; lookups never
 * load or modify anything afterwards. A template is rejected when ids repeat
 * within its triggers, processors or outputs, or when a processor depends on
 * an id that is not one of the template's processors. Dependency cycles are
 * not checked here since nothing in the generator executes the graph.
 */
public class TemplateRegistry {
    private static final Logger logger = LoggerFactory.getLogger(TemplateRegistry.class);

    private final Map<String, ProjectTemplate> templates;

    public TemplateRegistry(Collection<ProjectTemplate> templates) {
        Map<String, ProjectTemplate> byName = new LinkedHashMap<>();
        for (ProjectTemplate template : templates) {
            validate(template);
            if (byName.putIfAbsent(template.name(), template) != null) {
                throw new InvalidTemplateException(template.name(), "registered more than once");
            }
        }
        this.templates = Collections.unmodifiableMap(byName);
        logger.debug("Registered templates: {}", this.templates.keySet());
    }

    /**
     * Registry holding the templates that ship with the generator.
     */
    public static TemplateRegistry builtIn() {
        return new TemplateRegistry(BuiltinTemplates.all());
    }

    public ProjectTemplate lookup(String name) {
        ProjectTemplate template = templates.get(name);
        if (template == null) {
            throw new TemplateNotFoundException(name, templates.keySet());
        }
        return template;
    }

    public boolean contains(String name) {
        return templates.containsKey(name);
    }

    /** Template names in registration order. */
    public List<String> names() {
        return List.copyOf(templates.keySet());
    }

    public List<ProjectTemplate> templates() {
        return List.copyOf(templates.values());
    }

    private static void validate(ProjectTemplate template) {
        if (template.name() == null || template.name().isBlank()) {
            throw new InvalidTemplateException(String.valueOf(template.name()), "name is blank");
        }
        requireUniqueIds(template, "trigger", template.triggers(), TriggerConfig::id);
        Set<String> processorIds = requireUniqueIds(template, "processor", template.processors(), ProcessorConfig::id);
        requireUniqueIds(template, "output", template.outputs(), OutputConfig::id);

        for (ProcessorConfig processor : template.processors()) {
            for (String dependency : processor.dependencies()) {
                if (!processorIds.contains(dependency)) {
                    throw new InvalidTemplateException(template.name(),
                            "processor '" + processor.id() + "' depends on unknown processor '" + dependency + "'");
                }
            }
        }
    }

    private static <T> Set<String> requireUniqueIds(ProjectTemplate template, String kind,
                                                    List<T> records, Function<T, String> idOf) {
        Set<String> ids = new HashSet<>();
        for (T record : records) {
            String id = idOf.apply(record);
            if (id == null || id.isBlank()) {
                throw new InvalidTemplateException(template.name(), kind + " without an id");
            }
            if (!ids.add(id)) {
                throw new InvalidTemplateException(template.name(), "duplicate " + kind + " id '" + id + "'");
            }
        }
        return ids;
    }
}
