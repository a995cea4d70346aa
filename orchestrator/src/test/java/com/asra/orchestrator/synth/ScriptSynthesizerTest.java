package com.asra.orchestrator.synth;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for ScriptSynthesizer: layout of the generated program.
 */
class ScriptSynthesizerTest {

    static final String ANALYZER_CLASS = """
            class DataAnalyzer:
                def __init__(self):
                    self.ready = True

                def analyze_experiments(self):
                    return {"rows": 3}""";

    @Test
    void preambleComesFirstRegardlessOfContent() {
        String program = ScriptSynthesizer.synthesize("scratch", PartitionedSource.EMPTY);

        assertThat(program).startsWith("import sys\nimport os\nimport json\nimport logging\nimport traceback\n");
        assertThat(program).contains("sys.path.append(str(Path(__file__).resolve().parent.parent))");
        assertThat(program).contains("logger = logging.getLogger(\"scratch\")");
        assertThat(program).contains("from utils.config import *");
    }

    @Test
    void noClassCells_noClassBlockAndNonEmptyEntryPoint() {
        PartitionedSource source = SourcePartitioner.partition(List.of("x = 1", "print(x)"));

        String program = ScriptSynthesizer.synthesize("scratch", source);

        assertThat(program).doesNotContain("\nclass ");
        assertThat(program).contains("def main():\n    x = 1\n\n    print(x)\n");
        assertThat(program).doesNotContain("    pass\n");
    }

    @Test
    void noCodeAtAll_unknownStage_entryPointIsPass() {
        String program = ScriptSynthesizer.synthesize("scratch", PartitionedSource.EMPTY);

        assertThat(program).contains("def main():\n    pass\n");
        assertThat(program).doesNotContain("stage = ");
    }

    @Test
    void definitionsAppearVerbatimAtTopLevelBetweenPreambleAndMain() {
        PartitionedSource source = new PartitionedSource(ANALYZER_CLASS, "");

        String program = ScriptSynthesizer.synthesize("data_analyzer", source);

        int preambleEnd = program.indexOf("logger = logging.getLogger");
        int classAt     = program.indexOf("\nclass DataAnalyzer:\n");
        int mainAt      = program.indexOf("\ndef main():\n");
        assertThat(preambleEnd).isLessThan(classAt);
        assertThat(classAt).isLessThan(mainAt);
        assertThat(program).contains(ANALYZER_CLASS);
    }

    @Test
    void dataAnalyzer_entryPointInstantiatesAndInvokesExactlyOnce() {
        PartitionedSource source = SourcePartitioner.partition(List.of(
                ANALYZER_CLASS,
                "print('preparing')"));

        String program = ScriptSynthesizer.synthesize("data_analyzer", source);
        String main = program.substring(program.indexOf("def main():"), program.indexOf("if __name__"));

        assertThat(main).contains("    print('preparing')\n\n    stage = DataAnalyzer()\n");
        assertThat(countOf(program, "DataAnalyzer()")).isEqualTo(1);
        assertThat(countOf(program, ".analyze_experiments()")).isEqualTo(1);
        assertThat(main).contains("    logger.info(\"data_analyzer finished: %s\", outcome)");
    }

    @Test
    void procedureBlankLinesStayUnindented() {
        PartitionedSource source = new PartitionedSource("", "a = 1\n\nb = 2");

        String program = ScriptSynthesizer.synthesize("scratch", source);

        assertThat(program).contains("def main():\n    a = 1\n\n    b = 2\n");
    }

    @Test
    void footerExitsNonZeroOnUncaughtError() {
        String program = ScriptSynthesizer.synthesize("visualizer", PartitionedSource.EMPTY);

        assertThat(program).endsWith("""
                if __name__ == "__main__":
                    try:
                        main()
                    except Exception:
                        logger.error("Stage %s failed:\\n%s", "visualizer", traceback.format_exc())
                        sys.exit(1)
                    sys.exit(0)
                """);
    }

    @Test
    void synthesisIsDeterministic() {
        PartitionedSource source = SourcePartitioner.partition(List.of(ANALYZER_CLASS, "x = 1"));

        String first  = ScriptSynthesizer.synthesize("data_analyzer", source);
        String second = ScriptSynthesizer.synthesize("data_analyzer",
                SourcePartitioner.partition(List.of(ANALYZER_CLASS, "x = 1")));

        assertThat(second).isEqualTo(first);
    }

    @Test
    void stageNameIsEscapedInPythonLiterals() {
        assertThat(ScriptSynthesizer.pythonString("a\"b\\c")).isEqualTo("\"a\\\"b\\\\c\"");
    }

    private static int countOf(String haystack, String needle) {
        int count = 0;
        for (int i = haystack.indexOf(needle); i >= 0; i = haystack.indexOf(needle, i + 1)) count++;
        return count;
    }
}
