package com.dialogchain.core;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A unit of data transformation. {@code type} selects the language/runtime
 * of the generated stub, {@code source} holds the reference to the code the
 * runtime executes ({@code script}, {@code binary} and {@code args},
 * {@code wasm}, ...) in declaration order.
 */
public record ProcessorConfig(
        String id,
        String type,
        Map<String, Object> source,
        boolean parallel,
        Duration timeout,
        int retry,
        List<String> dependencies,
        Map<String, String> environment
) {
    public ProcessorConfig {
        source = Collections.unmodifiableMap(new LinkedHashMap<>(source));
        dependencies = List.copyOf(dependencies);
        environment = Collections.unmodifiableMap(new LinkedHashMap<>(environment));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String type;
        private final Map<String, Object> source = new LinkedHashMap<>();
        private boolean parallel;
        private Duration timeout = Duration.ofSeconds(5);
        private int retry;
        private final List<String> dependencies = new ArrayList<>();
        private final Map<String, String> environment = new LinkedHashMap<>();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder source(String key, Object value) {
            this.source.put(key, value);
            return this;
        }

        public Builder parallel(boolean parallel) {
            this.parallel = parallel;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder timeoutMillis(long millis) {
            this.timeout = Duration.ofMillis(millis);
            return this;
        }

        public Builder retry(int retry) {
            this.retry = retry;
            return this;
        }

        public Builder dependsOn(String... processorIds) {
            this.dependencies.addAll(List.of(processorIds));
            return this;
        }

        public Builder environment(String name, String value) {
            this.environment.put(name, value);
            return this;
        }

        public ProcessorConfig build() {
            return new ProcessorConfig(id, type, source, parallel, timeout, retry, dependencies, environment);
        }
    }
}
