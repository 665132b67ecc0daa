package org.tabelle.pipeline;

import org.junit.jupiter.api.Test;
import org.tabelle.ast.Head;
import org.tabelle.lexer.FormulaLexException;
import org.tabelle.parser.FormulaParseException;
import org.tabelle.table.TruthTable;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TruthTableGeneratorTest {

    @Test
    void laxLexingIgnoresUnknownCharacters() {
        TruthTable table = new TruthTableGenerator().generate("p -> q;");

        assertThat(table.getHeaders()).containsExactly("p", "q", "p \\rightarrow q");
    }

    @Test
    void strictLexingRejectsUnknownCharacters() {
        TruthTableGenerator generator = new TruthTableGenerator(true);

        assertThatThrownBy(() -> generator.generate("p -> q;"))
                .isInstanceOf(FormulaLexException.class)
                .hasMessageContaining(";");
    }

    @Test
    void tableIsBuiltFromTheFlattenedFormula() {
        TruthTable table = new TruthTableGenerator().generate("a ^ b ^ c");

        assertThat(table.getFormula().is(Head.AND)).isTrue();
        assertThat(table.getFormula().children()).hasSize(3);
        assertThat(table.getSubexpressions()).hasSize(1);
    }

    @Test
    void incompleteFormulaIsAParseError() {
        assertThatThrownBy(() -> new TruthTableGenerator().generate("p ->"))
                .isInstanceOf(FormulaParseException.class);
    }
}
