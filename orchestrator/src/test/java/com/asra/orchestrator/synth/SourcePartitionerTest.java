package com.asra.orchestrator.synth;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for SourcePartitioner. Pure function, no I/O.
 */
class SourcePartitionerTest {

    @Test
    void noClassCells_everythingGoesToProcedure() {
        PartitionedSource source = SourcePartitioner.partition(List.of("x = 1", "print(x)"));

        assertThat(source.hasDefinitions()).isFalse();
        assertThat(source.procedure()).isEqualTo("x = 1\n\nprint(x)");
    }

    @Test
    void classCell_goesToDefinitions_followingStatementToProcedure() {
        PartitionedSource source = SourcePartitioner.partition(List.of(
                "class DataAnalyzer:\n    def __init__(self):\n        self.n = 0",
                "analyzer = DataAnalyzer()"));

        assertThat(source.definitions()).startsWith("class DataAnalyzer:");
        assertThat(source.procedure()).isEqualTo("analyzer = DataAnalyzer()");
    }

    @Test
    void indentedMemberCells_stayInClassAndAreReindented() {
        PartitionedSource source = SourcePartitioner.partition(List.of(
                "class Visualizer:\n    def __init__(self):\n        pass",
                "    def plot(self):\n        return 1",
                "    @staticmethod\n    def helper():\n        return 2",
                "Visualizer().plot()"));

        assertThat(source.definitions()).contains("\n\n    def plot(self):\n        return 1");
        assertThat(source.definitions()).contains("    @staticmethod\n    def helper():\n        return 2");
        assertThat(source.procedure()).isEqualTo("Visualizer().plot()");
    }

    @Test
    void memberCells_followTwoSpaceClassBody() {
        PartitionedSource source = SourcePartitioner.partition(List.of(
                "class DataAnalyzer:\n  def __init__(self):\n    self.n = 0",
                "  def analyze_experiments(self):\n    return self.n"));

        assertThat(source.definitions()).isEqualTo(
                "class DataAnalyzer:\n  def __init__(self):\n    self.n = 0"
                        + "\n\n  def analyze_experiments(self):\n    return self.n");
    }

    @Test
    void memberCells_followTabIndentedClassBody() {
        PartitionedSource source = SourcePartitioner.partition(List.of(
                "class Visualizer:\n\tdef __init__(self):\n\t\tself.figs = []",
                "\tdef create_visualizations(self):\n\t\treturn self.figs"));

        assertThat(source.definitions()).endsWith(
                "\n\n\tdef create_visualizations(self):\n\t\treturn self.figs");
    }

    @Test
    void memberCellIndentedDifferentlyFromClass_isAlignedToClassBody() {
        PartitionedSource source = SourcePartitioner.partition(List.of(
                "class A:\n  x = 1",
                "        def f(self):\n            return 1"));

        assertThat(source.definitions()).endsWith("\n\n  def f(self):\n      return 1");
    }

    @Test
    void classBodyIndent_defaultsWhenBodyIsOnDeclarationLine() {
        assertThat(SourcePartitioner.classBodyIndent("class A: pass")).isEqualTo("    ");
        assertThat(SourcePartitioner.classBodyIndent("X = 1\nclass B(A):\n   y = 2")).isEqualTo("   ");
    }

    @Test
    void memberLookingCellAfterProcedure_isProcedure() {
        PartitionedSource source = SourcePartitioner.partition(List.of(
                "class A:\n    pass",
                "a = A()",
                "    def stray(self):\n        return 1"));

        assertThat(source.definitions()).isEqualTo("class A:\n    pass");
        assertThat(source.procedure()).contains("a = A()").contains("def stray(self):");
    }

    @Test
    void importOnlyCells_areDropped() {
        PartitionedSource source = SourcePartitioner.partition(List.of(
                "import numpy as np\nfrom pathlib import Path\n# comment",
                "x = np.zeros(3)"));

        assertThat(source.procedure()).isEqualTo("x = np.zeros(3)");
        assertThat(source.definitions()).isEmpty();
    }

    @Test
    void importOnlyCell_doesNotEndDefinitionMode() {
        PartitionedSource source = SourcePartitioner.partition(List.of(
                "class A:\n    pass",
                "import os",
                "    def extra(self):\n        return os.getcwd()"));

        assertThat(source.definitions()).contains("    def extra(self):");
        assertThat(source.hasProcedure()).isFalse();
    }

    @Test
    void accidentallyIndentedClassCell_isStillRecognised() {
        PartitionedSource source = SourcePartitioner.partition(List.of(
                "    class HypothesisGenerator:\n        def run(self):\n            return 1"));

        assertThat(source.definitions()).startsWith("class HypothesisGenerator:\n    def run(self):");
    }

    @Test
    void singleIndentedStatement_losesLeadingWhitespace() {
        PartitionedSource source = SourcePartitioner.partition(List.of("   print('hi')"));
        assertThat(source.procedure()).isEqualTo("print('hi')");
    }

    @Test
    void blankCells_areIgnored() {
        PartitionedSource source = SourcePartitioner.partition(List.of("", "   \n  ", "x = 1"));
        assertThat(source.procedure()).isEqualTo("x = 1");
    }

    @Test
    void classWordInsideStatement_isNotADefinition() {
        PartitionedSource source = SourcePartitioner.partition(List.of("label = 'class A:'\nprint(label)"));
        assertThat(source.hasDefinitions()).isFalse();
    }

    @Test
    void noCells_yieldsEmptySegments() {
        assertThat(SourcePartitioner.partition(List.of())).isEqualTo(PartitionedSource.EMPTY);
    }
}
