package com.dialogchain.generator.validate;

import java.util.ArrayList;
import java.util.List;

/**
 * Findings of one {@link ProjectValidator} run, in the order they were made.
 */
public class ValidationReport {

    public enum Severity { INFO, WARNING, ERROR }

    public record Finding(Severity severity, String message) {}

    private final List<Finding> findings = new ArrayList<>();

    void info(String message) {
        findings.add(new Finding(Severity.INFO, message));
    }

    void warning(String message) {
        findings.add(new Finding(Severity.WARNING, message));
    }

    void error(String message) {
        findings.add(new Finding(Severity.ERROR, message));
    }

    public List<Finding> findings() {
        return List.copyOf(findings);
    }

    public List<String> errors() {
        return messages(Severity.ERROR);
    }

    public List<String> warnings() {
        return messages(Severity.WARNING);
    }

    public boolean passed() {
        return errors().isEmpty();
    }

    private List<String> messages(Severity severity) {
        return findings.stream()
                .filter(f -> f.severity() == severity)
                .map(Finding::message)
                .toList();
    }
}
