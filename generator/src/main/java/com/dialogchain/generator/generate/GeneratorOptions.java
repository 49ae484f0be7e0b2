package com.dialogchain.generator.generate;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Settings for one {@link ProjectGenerator}.
 *
 * @param baseDirectory directory the project folder is created in
 * @param strict        fail on processor types without a stub instead of skipping them
 * @param clock         source of the generation date stamped into stubs
 */
public record GeneratorOptions(
        Path baseDirectory,
        boolean strict,
        Clock clock
) {
    public static GeneratorOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Path baseDirectory = Path.of("").toAbsolutePath();
        private boolean strict;
        private Clock clock = Clock.systemUTC();

        public Builder baseDirectory(Path baseDirectory) {
            this.baseDirectory = baseDirectory;
            return this;
        }

        public Builder strict(boolean strict) {
            this.strict = strict;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public GeneratorOptions build() {
            return new GeneratorOptions(baseDirectory, strict, clock);
        }
    }
}
