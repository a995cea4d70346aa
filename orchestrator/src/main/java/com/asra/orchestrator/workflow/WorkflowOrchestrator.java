package com.asra.orchestrator.workflow;

import com.asra.orchestrator.executor.ExecutionResult;
import com.asra.orchestrator.executor.StageExecutor;
import com.asra.orchestrator.notebook.ConversionException;
import com.asra.orchestrator.notebook.NotebookDocument;
import com.asra.orchestrator.synth.NotebookConverter;
import com.asra.orchestrator.synth.SupportFileInstaller;
import com.asra.orchestrator.synth.SynthesizedProgram;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives one workflow run: convert every notebook, execute every converted
 * program, merge everything into a {@link WorkflowReport}.
 *
 * <p>Conversion is sequential because it writes into the shared scripts
 * directory. Execution is concurrent: each stage gets its own worker thread
 * and OS process, with no cap (a run has a handful of stages), and no
 * ordering is enforced. Only in the opt-in {@link DependencyMode#GRAPH} does
 * a stage wait for its upstream stages, and it is skipped when one of them
 * did not succeed.
 *
 * <p>Stage-level failures (conversion or execution) become failed entries in
 * the report and never stop the other stages. Only faults that belong to no
 * single stage produce the top-level failure shape.
 */
@Service
public class WorkflowOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(WorkflowOrchestrator.class);

    private static final AtomicInteger WORKER_IDS = new AtomicInteger();

    private final NotebookConverter    converter;
    private final SupportFileInstaller supportFiles;
    private final StageExecutor        executor;
    private final MeterRegistry        meterRegistry;
    private final DependencyMode       dependencyMode;

    private final ExecutorService workers = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "stage-worker-" + WORKER_IDS.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    public WorkflowOrchestrator(NotebookConverter converter,
                                SupportFileInstaller supportFiles,
                                StageExecutor executor,
                                MeterRegistry meterRegistry,
                                @Value("${asra.workflow.dependency-mode:PARALLEL}") DependencyMode dependencyMode) {
        this.converter      = converter;
        this.supportFiles   = supportFiles;
        this.executor       = executor;
        this.meterRegistry  = meterRegistry;
        this.dependencyMode = dependencyMode;
    }

    /** Run with the executor's default per-process timeout. */
    public WorkflowReport run(List<Path> notebookPaths) {
        return run(notebookPaths, executor.environment().defaultTimeout());
    }

    /**
     * Convert and execute {@code notebookPaths}. Blocks until every launched
     * stage has finished.
     *
     * @param timeout per-process ceiling; null for none
     */
    public WorkflowReport run(List<Path> notebookPaths, Duration timeout) {
        String runId = UUID.randomUUID().toString().substring(0, 8);
        MDC.put("workflowRun", runId);
        try {
            WorkflowReport report = runStages(runId, notebookPaths, timeout);
            transition(runId, WorkflowState.REPORTED);
            meterRegistry.counter("asra.workflow.runs", "status", "reported").increment();
            return report;
        } catch (WorkflowException e) {
            transition(runId, WorkflowState.FAILED);
            log.error("Workflow {} failed: {}", runId, e.getMessage(), e);
            meterRegistry.counter("asra.workflow.runs", "status", "failed").increment();
            return WorkflowReport.failure(e);
        } catch (RuntimeException e) {
            transition(runId, WorkflowState.FAILED);
            log.error("Workflow {} failed unexpectedly", runId, e);
            meterRegistry.counter("asra.workflow.runs", "status", "failed").increment();
            return WorkflowReport.failure(e);
        } finally {
            MDC.remove("workflowRun");
        }
    }

    private WorkflowReport runStages(String runId, List<Path> notebookPaths, Duration timeout) {
        transition(runId, WorkflowState.IDLE);

        // ── Converting: one notebook at a time, failures recorded and skipped ──
        transition(runId, WorkflowState.CONVERTING);
        prepareOutput();
        Map<String, SynthesizedProgram> programs = new LinkedHashMap<>();
        Map<String, ExecutionResult> conversionFailures = new LinkedHashMap<>();
        for (Path notebook : notebookPaths) {
            String stageName = NotebookDocument.stageNameOf(notebook);
            if (programs.containsKey(stageName) || conversionFailures.containsKey(stageName)) {
                log.warn("Stage '{}' requested twice; the later notebook {} wins", stageName, notebook);
                programs.remove(stageName);
                conversionFailures.remove(stageName);
            }
            try {
                programs.put(stageName, converter.convert(notebook));
            } catch (ConversionException e) {
                conversionFailures.put(stageName, conversionFailure(stageName, e));
            } catch (RuntimeException e) {
                // Not a malformed notebook but still confined to this stage.
                log.error("Unexpected error converting stage '{}'", stageName, e);
                conversionFailures.put(stageName, conversionFailure(stageName, e));
            }
        }

        // ── Executing: all converted stages at once, gated only by upstream stages ──
        transition(runId, WorkflowState.EXECUTING);
        List<String> stageNames = notebookPaths.stream().map(NotebookDocument::stageNameOf).distinct().toList();
        StageGraph graph = StageGraph.of(stageNames, dependencyMode);

        Map<String, CompletableFuture<ExecutionResult>> futures = new LinkedHashMap<>();
        for (String stageName : graph.topologicalOrder()) {
            ExecutionResult failed = conversionFailures.get(stageName);
            if (failed != null) {
                futures.put(stageName, CompletableFuture.completedFuture(failed));
                continue;
            }
            SynthesizedProgram program = programs.get(stageName);
            List<CompletableFuture<ExecutionResult>> upstream =
                    graph.upstreamOf(stageName).stream().map(futures::get).toList();
            futures.put(stageName, launch(runId, program, upstream, timeout));
        }
        CompletableFuture.allOf(futures.values().toArray(new CompletableFuture[0])).join();

        Map<String, ExecutionResult> results = new LinkedHashMap<>();
        for (String stageName : stageNames) {
            results.put(stageName, futures.get(stageName).join());
        }
        return WorkflowReport.of(results);
    }

    private ExecutionResult conversionFailure(String stageName, RuntimeException e) {
        log.error("Conversion failed for stage '{}': {}", stageName, e.getMessage());
        ExecutionResult result = ExecutionResult.conversionFailed(stageName,
                "Conversion failed: " + e.getMessage() + "\n" + WorkflowReport.stackTrace(e));
        record(stageName, result);
        return result;
    }

    private CompletableFuture<ExecutionResult> launch(String runId,
                                                      SynthesizedProgram program,
                                                      List<CompletableFuture<ExecutionResult>> upstream,
                                                      Duration timeout) {
        return CompletableFuture.allOf(upstream.toArray(new CompletableFuture[0]))
                .thenApplyAsync(ignored -> {
                    List<String> failedUpstream = upstream.stream()
                            .map(CompletableFuture::join)
                            .filter(r -> !r.success())
                            .map(ExecutionResult::stageName)
                            .toList();
                    if (!failedUpstream.isEmpty()) {
                        log.warn("Skipping stage '{}': upstream {} did not succeed",
                                program.stageName(), failedUpstream);
                        return ExecutionResult.skipped(program.stageName(), program.path(),
                                "Skipped: upstream stage(s) " + String.join(", ", failedUpstream) + " failed");
                    }
                    return execute(runId, program, timeout);
                }, workers)
                .exceptionally(e -> ExecutionResult.failed(program.stageName(), program.path(),
                        "Execution failed: " + e.getMessage(), Duration.ZERO))
                .thenApply(result -> {
                    record(program.stageName(), result);
                    return result;
                });
    }

    private ExecutionResult execute(String runId, SynthesizedProgram program, Duration timeout) {
        MDC.put("workflowRun", runId);
        MDC.put("stage", program.stageName());
        try {
            log.info("Launching stage '{}' ({})", program.stageName(), program.path());
            ExecutionResult result = executor.execute(program, timeout);
            meterRegistry.timer("asra.stage.duration", "stage", program.stageName())
                    .record(result.elapsed());
            return result;
        } finally {
            MDC.remove("stage");
            MDC.remove("workflowRun");
        }
    }

    private void prepareOutput() {
        Path scriptsDir = converter.scriptsDir();
        try {
            Files.createDirectories(scriptsDir);
        } catch (IOException e) {
            throw new WorkflowException("Cannot create scripts directory " + scriptsDir, e);
        }
        try {
            supportFiles.install();
        } catch (UncheckedIOException e) {
            throw new WorkflowException("Cannot install shared support files", e);
        }
    }

    private void record(String stageName, ExecutionResult result) {
        meterRegistry.counter("asra.stage.runs",
                "stage", stageName, "outcome", result.outcome().name().toLowerCase(Locale.ROOT)).increment();
    }

    private static void transition(String runId, WorkflowState state) {
        log.info("Workflow {} -> {}", runId, state);
    }

    @PreDestroy
    void shutdown() {
        workers.shutdownNow();
    }
}
