package com.asra.orchestrator.notebook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a notebook file (nbformat v4 JSON) into a {@link NotebookDocument}.
 *
 * Only the parts the converter needs are validated: a top-level "cells"
 * array whose entries carry a textual "cell_type" and a "source" that is
 * either one string or a list of strings. Lists are joined without a
 * separator because each entry already ends with its own newline.
 */
@Component
public class NotebookReader {

    private final ObjectMapper json;

    public NotebookReader(ObjectMapper objectMapper) {
        this.json = objectMapper;
    }

    /**
     * @throws ConversionException if the file cannot be read or has the wrong structure
     */
    public NotebookDocument read(Path notebookPath) {
        String stageName = NotebookDocument.stageNameOf(notebookPath);
        try {
            return parse(notebookPath, Files.readString(notebookPath));
        } catch (IOException e) {
            throw new ConversionException(stageName, "Cannot read notebook " + notebookPath, e);
        }
    }

    /**
     * Parse notebook JSON that has already been loaded. {@code notebookPath}
     * only supplies the document identity.
     */
    public NotebookDocument parse(Path notebookPath, String content) {
        String stageName = NotebookDocument.stageNameOf(notebookPath);
        JsonNode root;
        try {
            root = json.readTree(content);
        } catch (JsonProcessingException e) {
            throw new ConversionException(stageName, "Notebook is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new ConversionException(stageName, "Notebook root must be a JSON object");
        }
        JsonNode cellsNode = root.get("cells");
        if (cellsNode == null || !cellsNode.isArray()) {
            throw new ConversionException(stageName, "Notebook has no \"cells\" array");
        }

        List<Cell> cells = new ArrayList<>(cellsNode.size());
        int index = 0;
        for (JsonNode cellNode : cellsNode) {
            cells.add(toCell(stageName, index++, cellNode));
        }
        return new NotebookDocument(notebookPath, cells);
    }

    private static Cell toCell(String stageName, int index, JsonNode cellNode) {
        if (!cellNode.isObject()) {
            throw new ConversionException(stageName, "Cell " + index + " is not an object");
        }
        JsonNode type = cellNode.get("cell_type");
        if (type == null || !type.isTextual()) {
            throw new ConversionException(stageName, "Cell " + index + " has no textual cell_type");
        }
        return new Cell(CellKind.fromCellType(type.asText()),
                sourceText(stageName, index, cellNode.get("source")));
    }

    private static String sourceText(String stageName, int index, JsonNode source) {
        if (source != null && source.isTextual()) {
            return source.asText();
        }
        if (source != null && source.isArray()) {
            StringBuilder sb = new StringBuilder();
            for (JsonNode line : source) {
                if (!line.isTextual()) {
                    throw new ConversionException(stageName,
                            "Cell " + index + " source list contains a non-string entry");
                }
                sb.append(line.asText());
            }
            return sb.toString();
        }
        throw new ConversionException(stageName,
                "Cell " + index + " source must be a string or a list of strings");
    }
}
