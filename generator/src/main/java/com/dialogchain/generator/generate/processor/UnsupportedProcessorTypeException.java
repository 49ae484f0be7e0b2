package com.dialogchain.generator.generate.processor;

import java.util.Collection;

public class UnsupportedProcessorTypeException extends RuntimeException {
    private final String processorId;
    private final String type;

    public UnsupportedProcessorTypeException(String processorId, String type, Collection<String> supported) {
        super("Processor '" + processorId + "' has unsupported type '" + type
                + "' (supported: " + String.join(", ", supported) + ")");
        this.processorId = processorId;
        this.type = type;
    }

    public String getProcessorId() {
        return processorId;
    }

    public String getType() {
        return type;
    }
}
