package com.asra.orchestrator.notebook;

/**
 * One cell of a notebook. {@code source} is already joined into a single
 * logical text block, whichever form the file stored it in.
 */
public record Cell(CellKind kind, String source) {

    public boolean isCode() {
        return kind == CellKind.CODE;
    }
}
