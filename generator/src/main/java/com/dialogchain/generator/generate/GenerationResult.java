package com.dialogchain.generator.generate;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of a successful generation.
 *
 * @param files             files written, relative to {@code projectPath}, in write order
 * @param skippedProcessors ids of processors whose type has no stub
 * @param nextSteps         instructions for the user, in the order they should be followed
 */
public record GenerationResult(
        String projectName,
        String templateName,
        Path projectPath,
        List<Path> files,
        List<String> skippedProcessors,
        List<String> nextSteps
) {
    public GenerationResult {
        files = List.copyOf(files);
        skippedProcessors = List.copyOf(skippedProcessors);
        nextSteps = List.copyOf(nextSteps);
    }
}
