package com.asra.orchestrator.artifact;

import java.util.Arrays;

/** Categories of uploaded research input, addressed in URLs by {@code pathSegment}. */
public enum ArtifactKind {
    PAPERS("papers"),
    EXPERIMENTAL_DATA("data");

    private final String pathSegment;

    ArtifactKind(String pathSegment) {
        this.pathSegment = pathSegment;
    }

    public String pathSegment() { return pathSegment; }

    /** @throws IllegalArgumentException for an unknown segment */
    public static ArtifactKind fromPathSegment(String segment) {
        return Arrays.stream(values())
                .filter(k -> k.pathSegment.equalsIgnoreCase(segment))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown artifact kind: " + segment));
    }
}
