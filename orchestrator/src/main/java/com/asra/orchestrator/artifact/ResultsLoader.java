package com.asra.orchestrator.artifact;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Reads the JSON files the stages leave in the outputs directory.
 *
 * Each file maps to a section name. A missing file is simply an absent
 * section; a file that cannot be parsed is logged and treated the same way.
 * The result is cached until {@link #invalidate()} (after a workflow run or a
 * data reset).
 */
@Component
public class ResultsLoader {

    private static final Logger log = LoggerFactory.getLogger(ResultsLoader.class);

    static final Map<String, String> RESULT_FILES = resultFiles();

    private final ObjectMapper json;
    private final Path         outputsDir;
    private final AtomicReference<Map<String, JsonNode>> cache = new AtomicReference<>();
    // Bumped by invalidate(); a load that started under an older value is not cached.
    private final AtomicLong generation = new AtomicLong();

    public ResultsLoader(ObjectMapper objectMapper,
                         @Value("${asra.paths.output-dir}") String outputsDir) {
        this.json       = objectMapper;
        this.outputsDir = Path.of(outputsDir);
    }

    public Map<String, JsonNode> load() {
        Map<String, JsonNode> cached = cache.get();
        if (cached != null) return cached;

        long startedAt = generation.get();
        Map<String, JsonNode> results = new LinkedHashMap<>();
        RESULT_FILES.forEach((section, relative) -> {
            Path file = outputsDir.resolve(relative);
            if (!Files.isRegularFile(file)) return;
            try {
                JsonNode node = json.readTree(file.toFile());
                if (node == null || node.isMissingNode()) {
                    log.warn("{} results file {} is empty", section, file);
                    return;
                }
                results.put(section, node);
            } catch (IOException e) {
                log.error("Cannot load {} results from {}: {}", section, file, e.getMessage());
            }
        });
        Map<String, JsonNode> loaded = Collections.unmodifiableMap(results);
        synchronized (this) {
            if (generation.get() == startedAt) {
                cache.compareAndSet(null, loaded);
            }
        }
        return loaded;
    }

    public synchronized void invalidate() {
        generation.incrementAndGet();
        cache.set(null);
    }

    private static Map<String, String> resultFiles() {
        Map<String, String> files = new LinkedHashMap<>();
        files.put("literature",     "literature_analysis.json");
        files.put("hypotheses",     "generated_hypotheses.json");
        files.put("experiments",    "experimental_analysis.json");
        files.put("visualizations", "visualizations/visualization_metadata.json");
        return Collections.unmodifiableMap(files);
    }
}
