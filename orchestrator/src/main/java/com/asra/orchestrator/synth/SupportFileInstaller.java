package com.asra.orchestrator.synth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.stream.Stream;

/**
 * Copies shared support modules (e.g. the {@code utils} package holding
 * {@code config.py}) into the output root, where every synthesized program
 * finds them through its sys.path entry.
 *
 * Runs once per workflow, before any stage is converted. The copies are
 * read-only for the rest of the run.
 */
@Component
public class SupportFileInstaller {

    private static final Logger log = LoggerFactory.getLogger(SupportFileInstaller.class);

    private final List<Path> sources;
    private final Path       outputRoot;

    public SupportFileInstaller(@Value("${asra.synth.support-paths:}") List<String> sources,
                                @Value("${asra.paths.output-dir}") String outputRoot) {
        this.sources    = sources.stream().filter(s -> !s.isBlank()).map(Path::of).toList();
        this.outputRoot = Path.of(outputRoot);
    }

    /**
     * @return number of support paths copied
     * @throws UncheckedIOException if a present source cannot be copied
     */
    public int install() {
        int installed = 0;
        for (Path source : sources) {
            if (!Files.exists(source)) {
                log.warn("Support path {} does not exist, skipping", source);
                continue;
            }
            Path target = outputRoot.resolve(source.getFileName().toString());
            try {
                if (Files.isDirectory(source)) {
                    copyTree(source, target);
                } else {
                    Files.createDirectories(outputRoot);
                    Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
                }
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot install support path " + source, e);
            }
            log.debug("Installed support path {} -> {}", source, target);
            installed++;
        }
        return installed;
    }

    private static void copyTree(Path source, Path target) throws IOException {
        try (Stream<Path> walk = Files.walk(source)) {
            for (Path path : (Iterable<Path>) walk::iterator) {
                if (path.toString().contains("__pycache__")) continue;
                Path dest = target.resolve(source.relativize(path).toString());
                if (Files.isDirectory(path)) {
                    Files.createDirectories(dest);
                } else {
                    Files.createDirectories(dest.getParent());
                    Files.copy(path, dest, StandardCopyOption.REPLACE_EXISTING);
                }
            }
        }
    }
}
