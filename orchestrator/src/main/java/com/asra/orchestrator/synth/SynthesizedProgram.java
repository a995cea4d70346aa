package com.asra.orchestrator.synth;

import java.nio.file.Path;

/**
 * A stage program produced from one notebook. Once written to {@code path}
 * the file is read-only to the executor; a later run with the same stage
 * name overwrites it.
 */
public record SynthesizedProgram(String stageName, String text, Path path) {}
