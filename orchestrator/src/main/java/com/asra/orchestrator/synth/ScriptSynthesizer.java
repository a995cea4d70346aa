package com.asra.orchestrator.synth;

import java.util.ArrayList;
import java.util.List;

/**
 * Assembles a standalone Python program from a partitioned notebook.
 *
 * Layout, top to bottom:
 * <pre>
 *   preamble      fixed imports, logging, sys.path entry for shared modules
 *   definitions   class bodies, verbatim at module level (omitted when empty)
 *   def main():   procedure statements + stage epilogue, one level deep
 *   footer        runs main(); uncaught error -> trace logged, exit 1
 * </pre>
 *
 * Output depends only on the inputs: no timestamps, no host details.
 */
public final class ScriptSynthesizer {

    static final String INDENT = "    ";

    /** Package the preamble imports shared settings from (utils/config.py in the output root). */
    static final String SHARED_CONFIG_MODULE = "utils.config";

    private ScriptSynthesizer() {}

    public static String synthesize(String stageName, PartitionedSource source) {
        StageKind kind = StageKind.resolve(stageName);
        String literal = pythonString(stageName);

        StringBuilder sb = new StringBuilder();
        sb.append(preamble(literal));
        if (source.hasDefinitions()) {
            sb.append("\n\n").append(source.definitions().stripTrailing()).append('\n');
        }
        sb.append("\n\n").append(entryPoint(source, kind));
        sb.append("\n\n").append(footer(literal));
        return sb.toString();
    }

    private static String preamble(String stageLiteral) {
        return """
                import sys
                import os
                import json
                import logging
                import traceback
                from pathlib import Path

                # Shared modules live next to the scripts directory.
                sys.path.append(str(Path(__file__).resolve().parent.parent))

                logging.basicConfig(
                    level=logging.INFO,
                    format="%%(asctime)s - %%(name)s - %%(levelname)s - %%(message)s",
                )
                logger = logging.getLogger(%s)

                try:
                    from %s import *  # noqa: F401,F403
                except ImportError:
                    logger.warning("Shared configuration module %s not found")
                """.formatted(stageLiteral, SHARED_CONFIG_MODULE, SHARED_CONFIG_MODULE);
    }

    private static String entryPoint(PartitionedSource source, StageKind kind) {
        List<String> blocks = new ArrayList<>();
        if (source.hasProcedure()) {
            blocks.add(source.procedure().stripTrailing());
        }
        if (kind.isKnown()) {
            blocks.add(String.join("\n", kind.epilogue()));
        }

        StringBuilder sb = new StringBuilder("def main():\n");
        if (blocks.isEmpty()) {
            sb.append(INDENT).append("pass\n");
        } else {
            sb.append(IndentationNormalizer.indent(String.join("\n\n", blocks), INDENT)).append('\n');
        }
        return sb.toString();
    }

    private static String footer(String stageLiteral) {
        return """
                if __name__ == "__main__":
                    try:
                        main()
                    except Exception:
                        logger.error("Stage %%s failed:\\n%%s", %s, traceback.format_exc())
                        sys.exit(1)
                    sys.exit(0)
                """.formatted(stageLiteral);
    }

    /** Double-quoted Python string literal. */
    static String pythonString(String value) {
        return '"' + value.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }
}
