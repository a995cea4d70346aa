package com.asra.orchestrator.api;

import com.asra.orchestrator.api.dto.StageResultResponse;
import com.asra.orchestrator.api.dto.WorkflowFailureResponse;
import com.asra.orchestrator.artifact.ResultsLoader;
import com.asra.orchestrator.workflow.ResearchWorkflowService;
import com.asra.orchestrator.workflow.WorkflowReport;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST API for running the research workflow and reading its results.
 *
 * POST /workflows/run     convert and run all agent notebooks, return the report
 * GET  /results           the JSON results the stages wrote, by section
 */
@RestController
public class WorkflowController {

    private final ResearchWorkflowService workflow;
    private final ResultsLoader           resultsLoader;

    public WorkflowController(ResearchWorkflowService workflow, ResultsLoader resultsLoader) {
        this.workflow      = workflow;
        this.resultsLoader = resultsLoader;
    }

    /**
     * Run the workflow synchronously.
     *
     * HTTP 200   per-stage map (individual stages may still have failed)
     * HTTP 500   the run failed as a whole; body is {error, trace}
     *
     * Example:
     *   curl -X POST 'http://localhost:8080/workflows/run?timeoutSec=600'
     */
    @PostMapping("/workflows/run")
    public ResponseEntity<?> run(@RequestParam(required = false) Integer timeoutSec) {
        if (timeoutSec != null && timeoutSec <= 0) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "timeoutSec must be positive");
        }
        WorkflowReport report = workflow.runResearchWorkflow(
                timeoutSec != null ? Duration.ofSeconds(timeoutSec) : null);

        if (report.isFailure()) {
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(new WorkflowFailureResponse(report.error(), report.trace()));
        }
        Map<String, StageResultResponse> body = new LinkedHashMap<>();
        report.stages().forEach((stage, result) -> body.put(stage, StageResultResponse.from(result)));
        return ResponseEntity.ok(body);
    }

    @GetMapping("/results")
    public Map<String, JsonNode> results() {
        return resultsLoader.load();
    }
}
