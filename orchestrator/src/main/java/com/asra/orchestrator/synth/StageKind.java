package com.asra.orchestrator.synth;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * The known stages of the research workflow.
 *
 * Each known stage names the class its notebook is expected to define and
 * the operation the synthesized entry point calls on it. Stage names that
 * match no kind, or more than one, resolve to {@link #UNKNOWN}, which
 * contributes no epilogue.
 */
public enum StageKind {
    ORCHESTRATOR        ("orchestrator",         "ResearchOrchestrator",  "run_workflow"),
    LITERATURE_REVIEW   ("literature_review",    "LiteratureReviewAgent", "analyze_papers"),
    HYPOTHESIS_GENERATOR("hypothesis_generator", "HypothesisGenerator",   "generate_hypotheses"),
    DATA_ANALYZER       ("data_analyzer",        "DataAnalyzer",          "analyze_experiments"),
    VISUALIZER          ("visualizer",           "Visualizer",            "create_visualizations"),
    UNKNOWN             (null,                   null,                    null);

    private final String identifier;
    private final String primaryClass;
    private final String primaryOperation;

    StageKind(String identifier, String primaryClass, String primaryOperation) {
        this.identifier       = identifier;
        this.primaryClass     = primaryClass;
        this.primaryOperation = primaryOperation;
    }

    public String identifier()       { return identifier; }
    public String primaryClass()     { return primaryClass; }
    public String primaryOperation() { return primaryOperation; }

    public boolean isKnown() { return this != UNKNOWN; }

    /** Stage kinds whose output this stage consumes. */
    public List<StageKind> upstream() {
        return switch (this) {
            case HYPOTHESIS_GENERATOR -> List.of(LITERATURE_REVIEW);
            case VISUALIZER           -> List.of(DATA_ANALYZER);
            case ORCHESTRATOR, LITERATURE_REVIEW, DATA_ANALYZER, UNKNOWN -> List.of();
        };
    }

    /**
     * Lines that instantiate the primary class, call its operation once and
     * log the outcome. Empty for {@link #UNKNOWN}. Returned unindented.
     */
    public List<String> epilogue() {
        if (!isKnown()) return List.of();
        return List.of(
                "stage = " + primaryClass + "()",
                "outcome = stage." + primaryOperation + "()",
                "logger.info(\"" + identifier + " finished: %s\", outcome)");
    }

    /**
     * Case-insensitive containment match of the stage name against the known
     * identifiers. Exactly one hit is required.
     */
    public static StageKind resolve(String stageName) {
        if (stageName == null || stageName.isBlank()) return UNKNOWN;
        String name = stageName.toLowerCase(Locale.ROOT);
        List<StageKind> matches = Arrays.stream(values())
                .filter(StageKind::isKnown)
                .filter(k -> name.contains(k.identifier))
                .toList();
        return matches.size() == 1 ? matches.get(0) : UNKNOWN;
    }
}
