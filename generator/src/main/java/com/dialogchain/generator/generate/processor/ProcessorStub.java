package com.dialogchain.generator.generate.processor;

import com.dialogchain.core.ProcessorConfig;
import com.dialogchain.generator.generate.GenerationContext;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Generates the placeholder source for processors of one type.
 */
public interface ProcessorStub {

    /** The processor {@code type} this stub handles, e.g. {@code python}. */
    String type();

    /**
     * Writes the stub files for {@code processor} into the project.
     *
     * @return the files written
     */
    List<Path> synthesize(ProcessorConfig processor, GenerationContext context) throws IOException;
}
