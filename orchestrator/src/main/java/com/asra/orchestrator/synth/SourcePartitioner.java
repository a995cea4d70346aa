package com.asra.orchestrator.synth;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a notebook's code cells into a definitions segment and a procedure
 * segment.
 *
 * <p>This is a best-effort textual heuristic, not a parser:
 * <ul>
 *   <li>A cell with a top-level {@code class Name} declaration enters
 *       definition mode and goes to the definitions segment.</li>
 *   <li>While in definition mode, a cell that opens with an indented
 *       {@code def} or a decorator is treated as another member of the
 *       class above it and is re-indented to that class's body indent.</li>
 *   <li>The first cell that matches neither ends definition mode and goes
 *       to the procedure segment, as does every ambiguous cell.</li>
 *   <li>Cells holding nothing but imports are dropped; the program preamble
 *       supplies the imports stages rely on.</li>
 * </ul>
 *
 * Pure function over text, no I/O.
 */
public final class SourcePartitioner {

    // Body indent assumed for a class cell whose body is on its declaration line.
    static final String MEMBER_INDENT = "    ";

    private static final Pattern CLASS_DECLARATION = Pattern.compile(
            "^class\\s+[A-Za-z_]\\w*\\s*[(:]", Pattern.MULTILINE);

    // Checked against the raw cell: a member cell keeps the indent it had inside the class.
    private static final Pattern MEMBER_START = Pattern.compile(
            "^(?:[ \\t]+(?:async[ \\t]+)?def[ \\t]+[A-Za-z_]\\w*|[ \\t]*@[A-Za-z_])");

    private static final Pattern IMPORT_STATEMENT = Pattern.compile(
            "^(?:import[ \\t]+\\S|from[ \\t]+\\S+[ \\t]+import[ \\t]+\\S)");

    private SourcePartitioner() {}

    public static PartitionedSource partition(List<String> codeCells) {
        List<String> definitions = new ArrayList<>();
        List<String> procedure   = new ArrayList<>();
        boolean inDefinition = false;
        String  bodyIndent   = MEMBER_INDENT;

        for (String raw : codeCells) {
            String cell = normalize(raw);
            if (cell.isBlank() || isImportOnly(cell)) {
                continue;
            }

            if (isClassCell(cell)) {
                definitions.add(cell);
                inDefinition = true;
                bodyIndent = classBodyIndent(cell);
            } else if (inDefinition && isMemberCell(raw)) {
                definitions.add(IndentationNormalizer.indent(cell, bodyIndent));
            } else {
                procedure.add(cell);
                inDefinition = false;
            }
        }
        return new PartitionedSource(String.join("\n\n", definitions), String.join("\n\n", procedure));
    }

    /**
     * Dedent and trim trailing whitespace. A lone line has no relative
     * indentation worth keeping, so its leading whitespace goes too.
     */
    static String normalize(String raw) {
        if (raw == null) return "";
        String text = raw.replace("\r\n", "\n").stripTrailing();
        return text.indexOf('\n') < 0
                ? text.stripLeading()
                : IndentationNormalizer.dedent(text);
    }

    static boolean isClassCell(String normalized) {
        return CLASS_DECLARATION.matcher(normalized).find();
    }

    /**
     * Leading whitespace of the first indented line after the last class
     * declaration in {@code normalized}; {@link #MEMBER_INDENT} if there is none.
     */
    static String classBodyIndent(String normalized) {
        Matcher declaration = CLASS_DECLARATION.matcher(normalized);
        int start = -1;
        while (declaration.find()) start = declaration.start();
        if (start < 0) return MEMBER_INDENT;

        String[] lines = normalized.substring(start).split("\n");
        for (int i = 1; i < lines.length; i++) {
            String line = lines[i];
            if (line.isBlank()) continue;
            int width = IndentationNormalizer.leadingWhitespace(line);
            if (width == 0) break;
            return line.substring(0, width);
        }
        return MEMBER_INDENT;
    }

    static boolean isMemberCell(String raw) {
        String first = firstSignificantLine(raw);
        return first != null && MEMBER_START.matcher(first).find();
    }

    static boolean isImportOnly(String normalized) {
        boolean sawImport = false;
        for (String line : normalized.split("\n")) {
            String trimmed = line.strip();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) continue;
            if (!IMPORT_STATEMENT.matcher(trimmed).find()) return false;
            sawImport = true;
        }
        return sawImport;
    }

    private static String firstSignificantLine(String raw) {
        if (raw == null) return null;
        for (String line : raw.replace("\r\n", "\n").split("\n")) {
            String trimmed = line.strip();
            if (!trimmed.isEmpty() && !trimmed.startsWith("#")) {
                return line;
            }
        }
        return null;
    }
}
