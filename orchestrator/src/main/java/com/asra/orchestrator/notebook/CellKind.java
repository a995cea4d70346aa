package com.asra.orchestrator.notebook;

/**
 * Type of a notebook cell. Only CODE cells contribute to a stage program;
 * markdown, raw and anything else collapse into OTHER.
 */
public enum CellKind {
    CODE,
    OTHER;

    public static CellKind fromCellType(String cellType) {
        return "code".equals(cellType) ? CODE : OTHER;
    }
}
