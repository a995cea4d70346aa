package com.asra.orchestrator.api.dto;

/** Top-level failure shape of a workflow report. */
public record WorkflowFailureResponse(String error, String trace) {}
