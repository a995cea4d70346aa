package com.asra.orchestrator.executor;

import com.asra.orchestrator.synth.SynthesizedProgram;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a synthesized stage program as a child process.
 *
 * The process runs in the program's own directory with the search-path
 * variable extended so shared modules resolve. Stdout and stderr are drained
 * on separate threads so a chatty stage cannot block on a full pipe.
 *
 * Every failure at this layer is returned as data: non-zero exit, missing
 * interpreter, I/O error, timeout and interrupt all yield a failed
 * {@link ExecutionResult}. Nothing is thrown.
 */
@Component
public class StageExecutor {

    private static final Logger log = LoggerFactory.getLogger(StageExecutor.class);

    // Grace period for a killed process to release its pipes.
    private static final long KILL_WAIT_SEC = 5;

    private static final AtomicInteger READER_IDS = new AtomicInteger();

    private final ExecutionEnvironment environment;
    private final ExecutorService      streamReaders = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "stage-stream-" + READER_IDS.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    public StageExecutor(ExecutionEnvironment environment) {
        this.environment = environment;
    }

    public ExecutionEnvironment environment() {
        return environment;
    }

    /** Run with the environment's default timeout. */
    public ExecutionResult execute(SynthesizedProgram program) {
        return execute(program, environment.defaultTimeout());
    }

    /**
     * Run {@code program} to completion or until {@code timeout} elapses.
     *
     * @param timeout null or non-positive means no ceiling
     */
    public ExecutionResult execute(SynthesizedProgram program, Duration timeout) {
        Path programPath = program.path().toAbsolutePath();
        long start = System.nanoTime();
        try {
            ExecutionResult result = run(program.stageName(), programPath, timeout, start);
            log.info("Stage '{}' exited with status {} in {} ms",
                    program.stageName(), result.exitCode(), result.elapsed().toMillis());
            return result;
        } catch (ExecutorException e) {
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            log.warn("Stage '{}' did not complete: {}", program.stageName(), e.getMessage());
            return e.getKind() == ExecutorException.Kind.TIMEOUT
                    ? ExecutionResult.timedOut(program.stageName(), programPath, e.getMessage(), elapsed)
                    : ExecutionResult.failed(program.stageName(), programPath, e.getMessage(), elapsed);
        }
    }

    private ExecutionResult run(String stageName, Path programPath, Duration timeout, long start) {
        List<String> command = new ArrayList<>(environment.interpreterCommand());
        command.add(programPath.toString());

        if (streamReaders.isShutdown()) {
            throw new ExecutorException(ExecutorException.Kind.SPAWN_FAILURE,
                    "Executor is shut down; not starting stage '" + stageName + "'");
        }

        ProcessBuilder builder = new ProcessBuilder(command);
        builder.directory(programPath.getParent().toFile());
        extendSearchPath(builder.environment(), programPath);

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new ExecutorException(ExecutorException.Kind.SPAWN_FAILURE,
                    "Cannot start " + String.join(" ", command) + ": " + e.getMessage(), e);
        }

        CompletableFuture<String> stdout = drain(process.getInputStream());
        CompletableFuture<String> stderr = drain(process.getErrorStream());
        try {
            boolean bounded = timeout != null && !timeout.isZero() && !timeout.isNegative();
            if (bounded && !process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                kill(process);
                throw new ExecutorException(ExecutorException.Kind.TIMEOUT,
                        "Stage '" + stageName + "' timed out after " + timeout.toMillis() + " ms");
            }
            int exitCode = process.waitFor();
            return ExecutionResult.exited(stageName, programPath, exitCode,
                    stdout.join(), stderr.join(), Duration.ofNanos(System.nanoTime() - start));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            kill(process);
            throw new ExecutorException(ExecutorException.Kind.INTERRUPTED,
                    "Interrupted while waiting for stage '" + stageName + "'", e);
        } catch (CompletionException e) {
            throw new ExecutorException(ExecutorException.Kind.IO_FAILURE,
                    "Cannot read output of stage '" + stageName + "': " + e.getCause().getMessage(), e);
        }
    }

    /**
     * Output root (parent of the scripts directory) first, then configured
     * entries, then whatever the parent process already had.
     */
    private void extendSearchPath(Map<String, String> env, Path programPath) {
        Set<String> entries = new LinkedHashSet<>();
        Path scriptsDir = programPath.getParent();
        if (scriptsDir != null && scriptsDir.getParent() != null) {
            entries.add(scriptsDir.getParent().toString());
        }
        environment.searchPathEntries().forEach(p -> entries.add(p.toAbsolutePath().toString()));

        String inherited = env.get(environment.searchPathVariable());
        if (inherited != null && !inherited.isBlank()) {
            entries.add(inherited);
        }
        env.put(environment.searchPathVariable(), String.join(File.pathSeparator, entries));
    }

    private CompletableFuture<String> drain(InputStream stream) {
        return CompletableFuture.supplyAsync(() -> {
            try (InputStream in = stream) {
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }, streamReaders);
    }

    @PreDestroy
    void shutdown() {
        streamReaders.shutdownNow();
    }

    private static void kill(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        try {
            process.waitFor(KILL_WAIT_SEC, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
