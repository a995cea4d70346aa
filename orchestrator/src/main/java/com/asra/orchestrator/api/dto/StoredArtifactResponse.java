package com.asra.orchestrator.api.dto;

import com.asra.orchestrator.artifact.StoredArtifact;
import com.fasterxml.jackson.annotation.JsonProperty;

public record StoredArtifactResponse(
        String path,
        @JsonProperty("isNew") boolean isNew
) {
    public static StoredArtifactResponse from(StoredArtifact a) {
        return new StoredArtifactResponse(a.path().toString(), a.isNew());
    }
}
