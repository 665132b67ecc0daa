package org.tabelle.render;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OutputFormatTest {

    @Test
    void parsesFlagsIgnoringCase() {
        assertThat(OutputFormat.fromFlag("latex")).isEqualTo(OutputFormat.LATEX);
        assertThat(OutputFormat.fromFlag(" TEXT ")).isEqualTo(OutputFormat.TEXT);
    }

    @Test
    void rejectsUnknownFlags() {
        assertThatThrownBy(() -> OutputFormat.fromFlag("html"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("html");
        assertThatThrownBy(() -> OutputFormat.fromFlag(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void eachFormatHasItsRendererAndExtension() {
        assertThat(OutputFormat.LATEX.createRenderer()).isInstanceOf(LatexTableRenderer.class);
        assertThat(OutputFormat.TEXT.createRenderer()).isInstanceOf(PlainTextTableRenderer.class);
        assertThat(OutputFormat.LATEX.getExtension()).isEqualTo(".tex");
        assertThat(OutputFormat.TEXT.getExtension()).isEqualTo(".txt");
    }
}
