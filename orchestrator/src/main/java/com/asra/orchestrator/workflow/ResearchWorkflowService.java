package com.asra.orchestrator.workflow;

import com.asra.orchestrator.artifact.ArtifactStore;
import com.asra.orchestrator.artifact.ResultsLoader;
import com.asra.orchestrator.executor.ExecutionResult;
import com.asra.orchestrator.synth.StageKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * The research workflow: the five agent notebooks, run as one workflow.
 *
 * Checks the preconditions the orchestrator itself does not know about
 * (inputs uploaded, every agent notebook present), logs each stage's
 * outcome, and drops cached results so the next read sees the new output.
 */
@Service
public class ResearchWorkflowService {

    private static final Logger log = LoggerFactory.getLogger(ResearchWorkflowService.class);

    // Notebook order within the agents directory.
    static final List<StageKind> STAGES = List.of(
            StageKind.ORCHESTRATOR,
            StageKind.LITERATURE_REVIEW,
            StageKind.HYPOTHESIS_GENERATOR,
            StageKind.DATA_ANALYZER,
            StageKind.VISUALIZER
    );

    private final WorkflowOrchestrator orchestrator;
    private final ArtifactStore        artifacts;
    private final ResultsLoader        resultsLoader;
    private final Path                 agentsDir;

    public ResearchWorkflowService(WorkflowOrchestrator orchestrator,
                                   ArtifactStore artifacts,
                                   ResultsLoader resultsLoader,
                                   @Value("${asra.paths.agents-dir}") String agentsDir) {
        this.orchestrator  = orchestrator;
        this.artifacts     = artifacts;
        this.resultsLoader = resultsLoader;
        this.agentsDir     = Path.of(agentsDir);
    }

    public List<Path> notebookPaths() {
        return STAGES.stream()
                .map(kind -> agentsDir.resolve(kind.identifier() + ".ipynb"))
                .toList();
    }

    /**
     * @param timeout per-stage ceiling; null uses the configured default
     */
    public WorkflowReport runResearchWorkflow(Duration timeout) {
        log.info("Starting research workflow");
        if (!artifacts.hasInputs()) {
            log.warn("Research workflow requested with no papers or data uploaded");
            return WorkflowReport.failure("No research papers or experimental data uploaded", "");
        }

        List<Path> notebooks = notebookPaths();
        List<Path> missing = notebooks.stream().filter(p -> !Files.isRegularFile(p)).toList();
        if (!missing.isEmpty()) {
            log.error("Missing notebooks: {}", missing);
            return WorkflowReport.failure("Missing notebooks: " + missing, "");
        }

        WorkflowReport report = timeout != null
                ? orchestrator.run(notebooks, timeout)
                : orchestrator.run(notebooks);

        if (report.isFailure()) {
            log.error("Workflow failed:\n{}\n{}", report.error(), report.trace());
        } else {
            for (Map.Entry<String, ExecutionResult> entry : report.stages().entrySet()) {
                ExecutionResult result = entry.getValue();
                if (result.success()) {
                    log.info("{} completed successfully", entry.getKey());
                } else {
                    log.error("{} {}: {}", entry.getKey(), result.outcome(), result.output());
                }
            }
        }
        resultsLoader.invalidate();
        return report;
    }

    /** A run counts as successful when the orchestrator stage succeeded. */
    public static boolean overallSuccess(WorkflowReport report) {
        return report.succeeded(StageKind.ORCHESTRATOR.identifier());
    }
}
