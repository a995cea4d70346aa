package com.asra.orchestrator.artifact;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Stores uploaded research papers and experimental data on disk.
 *
 * Idempotent by content: an upload whose SHA-256 matches a stored file is not
 * written again and the existing path is returned with {@code isNew=false}.
 * Same name with different content replaces the old file.
 */
@Component
public class ArtifactStore {

    private static final Logger log = LoggerFactory.getLogger(ArtifactStore.class);

    // Placeholder that keeps empty directories under version control.
    static final String KEEP_FILE = ".gitkeep";

    private final Path papersDir;
    private final Path dataDir;
    private final Path outputsDir;
    private final ResultsLoader resultsLoader;

    public ArtifactStore(@Value("${asra.paths.papers-dir}") String papersDir,
                         @Value("${asra.paths.data-dir}") String dataDir,
                         @Value("${asra.paths.output-dir}") String outputsDir,
                         ResultsLoader resultsLoader) {
        this.papersDir     = Path.of(papersDir);
        this.dataDir       = Path.of(dataDir);
        this.outputsDir    = Path.of(outputsDir);
        this.resultsLoader = resultsLoader;
    }

    public Path directory(ArtifactKind kind) {
        return switch (kind) {
            case PAPERS            -> papersDir;
            case EXPERIMENTAL_DATA -> dataDir;
        };
    }

    /**
     * @throws ArtifactException if the name is unusable or the file cannot be written
     */
    public synchronized StoredArtifact store(ArtifactKind kind, String fileName, byte[] content) {
        String name = sanitize(fileName);
        Path dir = directory(kind);
        String hash = sha256(content);
        try {
            Files.createDirectories(dir);
            Optional<Path> duplicate = findByHash(dir, hash);
            if (duplicate.isPresent()) {
                log.warn("Duplicate upload '{}' matches stored file {}", name, duplicate.get().getFileName());
                return new StoredArtifact(duplicate.get(), false);
            }
            Path target = dir.resolve(name);
            Files.write(target, content);
            log.info("Stored {} upload {} ({} bytes)", kind.pathSegment(), target, content.length);
            return new StoredArtifact(target, true);
        } catch (IOException e) {
            throw new ArtifactException("Cannot store upload '" + name + "'", e);
        }
    }

    /** Stored files of one kind, sorted by name; the keep file is hidden. */
    public List<ArtifactInfo> list(ArtifactKind kind) {
        Path dir = directory(kind);
        if (!Files.isDirectory(dir)) return List.of();
        List<ArtifactInfo> infos = new ArrayList<>();
        try (Stream<Path> files = Files.list(dir)) {
            for (Path file : files.filter(ArtifactStore::isArtifact).toList()) {
                infos.add(new ArtifactInfo(file.getFileName().toString(),
                        Files.size(file), Files.getLastModifiedTime(file).toInstant()));
            }
        } catch (IOException e) {
            throw new ArtifactException("Cannot list " + dir, e);
        }
        infos.sort(Comparator.comparing(ArtifactInfo::name));
        return infos;
    }

    /** @return false if no such file was stored */
    public synchronized boolean delete(ArtifactKind kind, String fileName) {
        Path target = directory(kind).resolve(sanitize(fileName));
        try {
            boolean deleted = Files.deleteIfExists(target);
            if (deleted) log.info("Deleted {}", target);
            return deleted;
        } catch (IOException e) {
            throw new ArtifactException("Cannot delete " + target, e);
        }
    }

    /**
     * Empty the papers, data and outputs directories (keep files survive)
     * and drop cached results.
     */
    public synchronized void clearAll() {
        for (Path dir : List.of(papersDir, dataDir, outputsDir)) {
            if (!Files.isDirectory(dir)) continue;
            try (Stream<Path> entries = Files.list(dir)) {
                for (Path entry : entries.filter(p -> !p.getFileName().toString().equals(KEEP_FILE)).toList()) {
                    deleteRecursively(entry);
                }
            } catch (IOException e) {
                throw new ArtifactException("Cannot clear " + dir, e);
            }
        }
        resultsLoader.invalidate();
        log.info("All data cleared");
    }

    /** True if at least one paper or data file has been stored. */
    public boolean hasInputs() {
        return !list(ArtifactKind.PAPERS).isEmpty() || !list(ArtifactKind.EXPERIMENTAL_DATA).isEmpty();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Optional<Path> findByHash(Path dir, String hash) throws IOException {
        try (Stream<Path> files = Files.list(dir)) {
            for (Path file : files.filter(ArtifactStore::isArtifact).sorted().toList()) {
                if (sha256(Files.readAllBytes(file)).equals(hash)) {
                    return Optional.of(file);
                }
            }
        }
        return Optional.empty();
    }

    private static boolean isArtifact(Path p) {
        return Files.isRegularFile(p) && !p.getFileName().toString().equals(KEEP_FILE);
    }

    static String sanitize(String fileName) {
        if (fileName == null || fileName.isBlank()) {
            throw new ArtifactException("File name must not be blank");
        }
        Path name = Path.of(fileName.replace('\\', '/')).getFileName();
        String base = name == null ? "" : name.toString();
        if (base.isBlank() || base.equals("..") || base.equals(".") || base.equals(KEEP_FILE)) {
            throw new ArtifactException("Invalid file name: " + fileName);
        }
        return base;
    }

    static String sha256(byte[] content) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(content));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static void deleteRecursively(Path path) throws IOException {
        if (Files.isDirectory(path)) {
            try (Stream<Path> walk = Files.walk(path)) {
                for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                    Files.delete(p);
                }
            }
        } else {
            Files.delete(path);
        }
    }
}
