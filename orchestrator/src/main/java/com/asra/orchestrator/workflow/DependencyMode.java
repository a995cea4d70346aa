package com.asra.orchestrator.workflow;

/**
 * How the orchestrator orders stage launches.
 *
 * PARALLEL every converted stage starts immediately; no ordering at all.
 *          The default.
 * GRAPH    opt-in: a stage starts once its upstream stages have finished,
 *          and is skipped if any of them did not succeed.
 */
public enum DependencyMode {
    PARALLEL,
    GRAPH
}
