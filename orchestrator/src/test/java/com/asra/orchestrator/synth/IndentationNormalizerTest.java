package com.asra.orchestrator.synth;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class IndentationNormalizerTest {

    @Test
    void dedent_stripsCommonPrefixAndKeepsRelativeIndent() {
        String text = "    if x:\n        y = 1\n    z = 2";

        assertThat(IndentationNormalizer.dedent(text)).isEqualTo("if x:\n    y = 1\nz = 2");
    }

    @Test
    void dedent_blankLinesPreservedAndIgnoredForPrefix() {
        String text = "    a = 1\n\n  \n    b = 2";

        assertThat(IndentationNormalizer.dedent(text)).isEqualTo("a = 1\n\n  \nb = 2");
    }

    @Test
    void dedent_singleLine_unchanged() {
        assertThat(IndentationNormalizer.dedent("    x = 1")).isEqualTo("    x = 1");
    }

    @Test
    void dedent_noLeadingWhitespace_unchanged() {
        String text = "def f():\n    return 1";
        assertThat(IndentationNormalizer.dedent(text)).isSameAs(text);
    }

    @Test
    void dedent_null_returnsEmpty() {
        assertThat(IndentationNormalizer.dedent(null)).isEmpty();
    }

    @Test
    void indent_prefixesNonBlankLinesOnly() {
        assertThat(IndentationNormalizer.indent("a = 1\n\nb = 2", "    "))
                .isEqualTo("    a = 1\n\n    b = 2");
    }
}
