package com.asra.orchestrator.artifact;

import java.time.Instant;

public record ArtifactInfo(String name, long sizeBytes, Instant modified) {}
