package com.asra.orchestrator.synth;

/**
 * Indentation helpers for reassembling cell fragments.
 *
 * Notebook cells are frequently pasted with a stray indent; stripping the
 * common prefix first lets every fragment be re-indented to exactly the
 * level the synthesized program needs.
 */
public final class IndentationNormalizer {

    private IndentationNormalizer() {}

    /**
     * Remove the minimum leading whitespace shared by all non-blank lines.
     *
     * Blank lines are kept verbatim and relative indentation is preserved.
     * Single-line text and text with no common indent come back unchanged.
     */
    public static String dedent(String text) {
        if (text == null) return "";
        String[] lines = text.split("\n", -1);
        if (lines.length == 1) return text;

        int common = Integer.MAX_VALUE;
        for (String line : lines) {
            if (line.isBlank()) continue;
            common = Math.min(common, leadingWhitespace(line));
            if (common == 0) return text;
        }
        if (common == Integer.MAX_VALUE) return text;   // all blank

        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) sb.append('\n');
            String line = lines[i];
            sb.append(line.isBlank() ? line : line.substring(common));
        }
        return sb.toString();
    }

    /**
     * Prefix every non-blank line with {@code prefix}. Blank lines pass
     * through untouched.
     */
    public static String indent(String text, String prefix) {
        if (text == null || text.isEmpty()) return "";
        String[] lines = text.split("\n", -1);
        StringBuilder sb = new StringBuilder(text.length() + lines.length * prefix.length());
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) sb.append('\n');
            String line = lines[i];
            if (!line.isBlank()) sb.append(prefix);
            sb.append(line);
        }
        return sb.toString();
    }

    static int leadingWhitespace(String line) {
        int n = 0;
        while (n < line.length() && (line.charAt(n) == ' ' || line.charAt(n) == '\t')) {
            n++;
        }
        return n;
    }
}
