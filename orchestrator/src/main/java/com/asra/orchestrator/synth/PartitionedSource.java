package com.asra.orchestrator.synth;

/**
 * A stage's code split into the two segments the synthesizer assembles.
 *
 * @param definitions class bodies, emitted at module level (may be empty)
 * @param procedure   one-shot top-level statements, wrapped in the entry point (may be empty)
 */
public record PartitionedSource(String definitions, String procedure) {

    public static final PartitionedSource EMPTY = new PartitionedSource("", "");

    public boolean hasDefinitions() { return !definitions.isBlank(); }
    public boolean hasProcedure()   { return !procedure.isBlank(); }
}
