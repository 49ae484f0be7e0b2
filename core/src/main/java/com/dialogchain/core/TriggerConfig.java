package com.dialogchain.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An external event source declared by a template, e.g. an inbound HTTP
 * endpoint or a broker subscription. {@code params} keeps the connection
 * parameters in declaration order.
 */
public record TriggerConfig(
        String id,
        String type,
        Map<String, Object> params,
        boolean enabled
) {
    public TriggerConfig {
        params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String type;
        private final Map<String, Object> params = new LinkedHashMap<>();
        private boolean enabled = true;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder param(String name, Object value) {
            this.params.put(name, value);
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public TriggerConfig build() {
            return new TriggerConfig(id, type, params, enabled);
        }
    }
}
