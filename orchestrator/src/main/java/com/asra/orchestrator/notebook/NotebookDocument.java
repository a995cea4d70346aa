package com.asra.orchestrator.notebook;

import java.nio.file.Path;
import java.util.List;

/**
 * An agent notebook as read from disk: the ordered cells plus the path it
 * came from. Immutable; read once per workflow run and then discarded.
 */
public record NotebookDocument(Path path, List<Cell> cells) {

    public NotebookDocument {
        cells = List.copyOf(cells);
    }

    /** Stage name = file name without its extension (e.g. "data_analyzer"). */
    public String stageName() {
        return stageNameOf(path);
    }

    /** Source text of every code cell, in notebook order. */
    public List<String> codeSources() {
        return cells.stream()
                .filter(Cell::isCode)
                .map(Cell::source)
                .toList();
    }

    public static String stageNameOf(Path notebookPath) {
        String fileName = notebookPath.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
