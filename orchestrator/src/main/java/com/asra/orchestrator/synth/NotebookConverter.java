package com.asra.orchestrator.synth;

import com.asra.orchestrator.notebook.ConversionException;
import com.asra.orchestrator.notebook.NotebookDocument;
import com.asra.orchestrator.notebook.NotebookReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Turns one notebook into a program file under the scripts directory:
 * read, partition, synthesize, write {@code <scriptsDir>/<stage>.py}.
 *
 * Not thread-safe with respect to the scripts directory; the orchestrator
 * calls it one notebook at a time.
 */
@Component
public class NotebookConverter {

    private static final Logger log = LoggerFactory.getLogger(NotebookConverter.class);

    private final NotebookReader reader;
    private final Path           scriptsDir;

    public NotebookConverter(NotebookReader reader,
                             @Value("${asra.paths.scripts-dir}") String scriptsDir) {
        this.reader     = reader;
        this.scriptsDir = Path.of(scriptsDir);
    }

    public Path scriptsDir() {
        return scriptsDir;
    }

    /**
     * @throws ConversionException if the notebook is unreadable or malformed,
     *                             or the program cannot be written
     */
    public SynthesizedProgram convert(Path notebookPath) {
        NotebookDocument document = reader.read(notebookPath);
        SynthesizedProgram program = synthesize(document);
        try {
            Files.createDirectories(scriptsDir);
            Files.writeString(program.path(), program.text(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConversionException(program.stageName(),
                    "Cannot write program " + program.path(), e);
        }
        log.info("Converted {} -> {} ({} code cells)",
                notebookPath.getFileName(), program.path(), document.codeSources().size());
        return program;
    }

    /** Build the program for an already-read notebook without touching disk. */
    public SynthesizedProgram synthesize(NotebookDocument document) {
        String stageName = document.stageName();
        PartitionedSource source = SourcePartitioner.partition(document.codeSources());
        String text = ScriptSynthesizer.synthesize(stageName, source);
        return new SynthesizedProgram(stageName, text, scriptsDir.resolve(stageName + ".py"));
    }
}
