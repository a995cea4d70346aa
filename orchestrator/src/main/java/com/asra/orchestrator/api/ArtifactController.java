package com.asra.orchestrator.api;

import com.asra.orchestrator.api.dto.StoredArtifactResponse;
import com.asra.orchestrator.artifact.ArtifactException;
import com.asra.orchestrator.artifact.ArtifactInfo;
import com.asra.orchestrator.artifact.ArtifactKind;
import com.asra.orchestrator.artifact.ArtifactStore;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.util.List;

/**
 * REST API for research inputs.
 *
 * POST   /artifacts/{kind}           upload a file (multipart field "file")
 * GET    /artifacts/{kind}           list stored files
 * DELETE /artifacts/{kind}/{name}    delete one file
 * DELETE /artifacts                  clear papers, data and outputs
 *
 * {kind} is "papers" or "data".
 */
@RestController
@RequestMapping("/artifacts")
public class ArtifactController {

    private final ArtifactStore store;

    public ArtifactController(ArtifactStore store) {
        this.store = store;
    }

    /**
     * Example:
     *   curl -F file=@paper.txt http://localhost:8080/artifacts/papers
     *
     * Always 201; {@code isNew=false} tells the caller it was a duplicate.
     */
    @PostMapping("/{kind}")
    public ResponseEntity<StoredArtifactResponse> upload(@PathVariable String kind,
                                                         @RequestParam("file") MultipartFile file) {
        ArtifactKind artifactKind = kindOf(kind);
        try {
            var stored = store.store(artifactKind, file.getOriginalFilename(), file.getBytes());
            return ResponseEntity.status(HttpStatus.CREATED).body(StoredArtifactResponse.from(stored));
        } catch (IOException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Cannot read upload", e);
        } catch (ArtifactException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
    }

    @GetMapping("/{kind}")
    public List<ArtifactInfo> list(@PathVariable String kind) {
        return store.list(kindOf(kind));
    }

    @DeleteMapping("/{kind}/{name}")
    public ResponseEntity<Void> delete(@PathVariable String kind, @PathVariable String name) {
        boolean deleted;
        try {
            deleted = store.delete(kindOf(kind), name);
        } catch (ArtifactException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
        if (!deleted) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "No such file: " + name);
        }
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping
    public ResponseEntity<Void> clearAll() {
        store.clearAll();
        return ResponseEntity.noContent().build();
    }

    private static ArtifactKind kindOf(String segment) {
        try {
            return ArtifactKind.fromPathSegment(segment);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        }
    }
}
