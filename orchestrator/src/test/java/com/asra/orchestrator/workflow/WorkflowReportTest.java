package com.asra.orchestrator.workflow;

import com.asra.orchestrator.executor.ExecutionResult;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkflowReportTest {

    @Test
    void perStageShape_exposesResults() {
        ExecutionResult ok = ExecutionResult.exited("orchestrator", Path.of("o.py"), 0, "done", "", Duration.ZERO);
        ExecutionResult bad = ExecutionResult.conversionFailed("visualizer", "Conversion failed: x");

        WorkflowReport report = WorkflowReport.of(Map.of("orchestrator", ok, "visualizer", bad));

        assertThat(report.isFailure()).isFalse();
        assertThat(report.stages()).hasSize(2);
        assertThat(report.succeeded("orchestrator")).isTrue();
        assertThat(report.succeeded("visualizer")).isFalse();
        assertThat(report.succeeded("absent")).isFalse();
        assertThat(report.result("visualizer")).get().extracting(ExecutionResult::programPath).isNull();
    }

    @Test
    void failureShape_guardsStageAccess() {
        WorkflowReport report = WorkflowReport.failure(new WorkflowException("disk full"));

        assertThat(report.isFailure()).isTrue();
        assertThat(report.error()).isEqualTo("disk full");
        assertThat(report.trace()).contains("WorkflowException");
        assertThat(report.succeeded("orchestrator")).isFalse();
        assertThatThrownBy(report::stages).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> report.result("orchestrator")).isInstanceOf(IllegalStateException.class);
    }
}
