package com.asra.orchestrator.synth;

import com.asra.orchestrator.notebook.ConversionException;
import com.asra.orchestrator.notebook.NotebookReader;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NotebookConverterTest {

    @TempDir Path dir;

    NotebookConverter converter;
    Path scriptsDir;

    @BeforeEach
    void setUp() {
        scriptsDir = dir.resolve("outputs").resolve("scripts");
        converter  = new NotebookConverter(new NotebookReader(new ObjectMapper()), scriptsDir.toString());
    }

    @Test
    void convert_writesProgramNamedAfterStage() throws Exception {
        Path nb = notebook("data_analyzer", """
                {"cells": [
                  {"cell_type": "code", "source": ["import pandas as pd\\n"]},
                  {"cell_type": "code", "source": ["class DataAnalyzer:\\n", "    def analyze_experiments(self):\\n", "        return 1"]},
                  {"cell_type": "markdown", "source": "notes"},
                  {"cell_type": "code", "source": "print('go')"}
                ]}
                """);

        SynthesizedProgram program = converter.convert(nb);

        assertThat(program.stageName()).isEqualTo("data_analyzer");
        assertThat(program.path()).isEqualTo(scriptsDir.resolve("data_analyzer.py"));
        assertThat(Files.readString(program.path())).isEqualTo(program.text());
        assertThat(program.text())
                .contains("class DataAnalyzer:")
                .contains("    print('go')")
                .contains("stage = DataAnalyzer()")
                .doesNotContain("import pandas")
                .doesNotContain("notes");
    }

    @Test
    void convert_sameNotebookTwice_identicalTextAndFileOverwritten() throws Exception {
        Path nb = notebook("visualizer", "{\"cells\": [{\"cell_type\": \"code\", \"source\": \"x = 1\"}]}");

        SynthesizedProgram first  = converter.convert(nb);
        SynthesizedProgram second = converter.convert(nb);

        assertThat(second.text()).isEqualTo(first.text());
        assertThat(Files.readString(second.path())).isEqualTo(first.text());
    }

    @Test
    void convert_malformedNotebook_throwsConversionException() throws Exception {
        Path nb = notebook("hypothesis_generator", "{\"cells\": [{\"cell_type\": \"code\", \"source\": {}}]}");

        assertThatThrownBy(() -> converter.convert(nb))
                .isInstanceOf(ConversionException.class)
                .hasMessageContaining("hypothesis_generator");
        assertThat(scriptsDir.resolve("hypothesis_generator.py")).doesNotExist();
    }

    private Path notebook(String stage, String json) throws Exception {
        Path agents = Files.createDirectories(dir.resolve("agents"));
        return Files.writeString(agents.resolve(stage + ".ipynb"), json);
    }
}
