package com.dialogchain.generator.generate;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A generation step failed on the filesystem. Files written by earlier steps
 * are left in place; running the generation again overwrites them.
 */
public class GenerationException extends RuntimeException {
    private final Path projectPath;
    private final String step;

    public GenerationException(Path projectPath, String step, IOException cause) {
        super("Generating " + projectPath + " failed at step '" + step + "': " + cause.getMessage(), cause);
        this.projectPath = projectPath;
        this.step = step;
    }

    public Path getProjectPath() {
        return projectPath;
    }

    public String getStep() {
        return step;
    }
}
