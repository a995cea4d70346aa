package com.asra.orchestrator.executor;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * How stage programs are launched.
 *
 * @param interpreterCommand command prefix, e.g. {@code ["python3", "-u"]}; the program path is appended
 * @param searchPathVariable environment variable extended with {@code searchPathEntries} (PYTHONPATH)
 * @param searchPathEntries  extra module roots, prepended to any inherited value
 * @param defaultTimeout     per-process ceiling; null means wait indefinitely
 */
public record ExecutionEnvironment(
        List<String> interpreterCommand,
        String       searchPathVariable,
        List<Path>   searchPathEntries,
        Duration     defaultTimeout
) {
    public ExecutionEnvironment {
        if (interpreterCommand == null || interpreterCommand.isEmpty()) {
            throw new IllegalArgumentException("interpreterCommand must not be empty");
        }
        interpreterCommand = List.copyOf(interpreterCommand);
        searchPathEntries  = List.copyOf(searchPathEntries);
    }
}
