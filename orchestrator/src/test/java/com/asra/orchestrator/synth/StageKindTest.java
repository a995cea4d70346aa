package com.asra.orchestrator.synth;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StageKindTest {

    @Test
    void resolve_exactAndDecoratedNames() {
        assertThat(StageKind.resolve("data_analyzer")).isEqualTo(StageKind.DATA_ANALYZER);
        assertThat(StageKind.resolve("02_Literature_Review_v2")).isEqualTo(StageKind.LITERATURE_REVIEW);
        assertThat(StageKind.resolve("orchestrator")).isEqualTo(StageKind.ORCHESTRATOR);
    }

    @Test
    void resolve_noMatch_isUnknown() {
        assertThat(StageKind.resolve("scratch")).isEqualTo(StageKind.UNKNOWN);
        assertThat(StageKind.resolve("")).isEqualTo(StageKind.UNKNOWN);
        assertThat(StageKind.resolve(null)).isEqualTo(StageKind.UNKNOWN);
    }

    @Test
    void resolve_ambiguousName_isUnknown() {
        assertThat(StageKind.resolve("visualizer_for_data_analyzer")).isEqualTo(StageKind.UNKNOWN);
    }

    @Test
    void epilogue_instantiatesPrimaryClassAndCallsOperation() {
        assertThat(StageKind.DATA_ANALYZER.epilogue()).containsExactly(
                "stage = DataAnalyzer()",
                "outcome = stage.analyze_experiments()",
                "logger.info(\"data_analyzer finished: %s\", outcome)");
        assertThat(StageKind.UNKNOWN.epilogue()).isEmpty();
    }

    @Test
    void upstream_followsResearchPipeline() {
        assertThat(StageKind.HYPOTHESIS_GENERATOR.upstream()).containsExactly(StageKind.LITERATURE_REVIEW);
        assertThat(StageKind.VISUALIZER.upstream()).containsExactly(StageKind.DATA_ANALYZER);
        assertThat(StageKind.ORCHESTRATOR.upstream()).isEmpty();
        assertThat(StageKind.UNKNOWN.upstream()).isEmpty();
    }
}
