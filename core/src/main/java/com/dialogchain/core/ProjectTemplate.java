package com.dialogchain.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A named, immutable description of a pipeline project: what triggers it,
 * which processors run, where results go, and the packages, container
 * services and environment the generated project needs.
 */
public record ProjectTemplate(
        String name,
        String description,
        List<TriggerConfig> triggers,
        List<ProcessorConfig> processors,
        List<OutputConfig> outputs,
        Map<String, List<String>> dependencies,
        List<String> dockerServices,
        Map<String, String> environmentVars
) {
    public ProjectTemplate {
        triggers = List.copyOf(triggers);
        processors = List.copyOf(processors);
        outputs = List.copyOf(outputs);
        Map<String, List<String>> deps = new LinkedHashMap<>();
        dependencies.forEach((ecosystem, packages) -> deps.put(ecosystem, List.copyOf(packages)));
        dependencies = Collections.unmodifiableMap(deps);
        dockerServices = List.copyOf(dockerServices);
        environmentVars = Collections.unmodifiableMap(new LinkedHashMap<>(environmentVars));
    }

    /**
     * Packages declared for one ecosystem, in declaration order; empty when
     * the template declares none.
     */
    public List<String> dependenciesFor(String ecosystem) {
        return dependencies.getOrDefault(ecosystem, List.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String description;
        private final List<TriggerConfig> triggers = new ArrayList<>();
        private final List<ProcessorConfig> processors = new ArrayList<>();
        private final List<OutputConfig> outputs = new ArrayList<>();
        private final Map<String, List<String>> dependencies = new LinkedHashMap<>();
        private final List<String> dockerServices = new ArrayList<>();
        private final Map<String, String> environmentVars = new LinkedHashMap<>();

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder trigger(TriggerConfig trigger) {
            this.triggers.add(trigger);
            return this;
        }

        public Builder trigger(TriggerConfig.Builder triggerBuilder) {
            return trigger(triggerBuilder.build());
        }

        public Builder processor(ProcessorConfig processor) {
            this.processors.add(processor);
            return this;
        }

        public Builder processor(ProcessorConfig.Builder processorBuilder) {
            return processor(processorBuilder.build());
        }

        public Builder output(OutputConfig output) {
            this.outputs.add(output);
            return this;
        }

        public Builder output(OutputConfig.Builder outputBuilder) {
            return output(outputBuilder.build());
        }

        public Builder dependencies(String ecosystem, String... packages) {
            this.dependencies.computeIfAbsent(ecosystem, k -> new ArrayList<>()).addAll(List.of(packages));
            return this;
        }

        public Builder dockerServices(String... services) {
            this.dockerServices.addAll(List.of(services));
            return this;
        }

        public Builder environmentVar(String name, String value) {
            this.environmentVars.put(name, value);
            return this;
        }

        public ProjectTemplate build() {
            return new ProjectTemplate(name, description, triggers, processors, outputs,
                    dependencies, dockerServices, environmentVars);
        }
    }
}
