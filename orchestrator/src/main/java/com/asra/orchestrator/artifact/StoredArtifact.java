package com.asra.orchestrator.artifact;

import java.nio.file.Path;

/**
 * @param path  where the content lives: the new file, or the existing duplicate
 * @param isNew false when identical content was already stored
 */
public record StoredArtifact(Path path, boolean isNew) {}
