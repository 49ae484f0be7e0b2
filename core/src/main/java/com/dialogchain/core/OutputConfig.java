package com.dialogchain.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A destination for processed data (file, email, websocket, database, ...).
 * {@code condition} and {@code batchSize} are optional and may be null.
 */
public record OutputConfig(
        String id,
        String type,
        Map<String, Object> destination,
        String condition,
        Integer batchSize
) {
    public OutputConfig {
        destination = Collections.unmodifiableMap(new LinkedHashMap<>(destination));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String type;
        private final Map<String, Object> destination = new LinkedHashMap<>();
        private String condition;
        private Integer batchSize;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder destination(String key, Object value) {
            this.destination.put(key, value);
            return this;
        }

        public Builder condition(String condition) {
            this.condition = condition;
            return this;
        }

        public Builder batchSize(Integer batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public OutputConfig build() {
            return new OutputConfig(id, type, destination, condition, batchSize);
        }
    }
}
