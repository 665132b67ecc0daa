package org.tabelle.ast;

import org.junit.jupiter.api.Test;
import org.tabelle.eval.Environment;
import org.tabelle.eval.Evaluator;
import org.tabelle.parser.FormulaParser;
import org.tabelle.table.AssignmentEnumerator;
import org.tabelle.table.Variables;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ExprPrinterTest {

    private final FormulaParser parser = new FormulaParser();

    @Test
    void latexUsesMathConnectivesSeparatedBySpaces() {
        assertThat(ExprPrinter.latex(parser.parse("!(p ^ q)"))).isEqualTo("\\neg ( p \\land q )");
        assertThat(ExprPrinter.latex(parser.parse("p -> q <-> r")))
                .isEqualTo("p \\rightarrow q \\leftrightarrow r");
        assertThat(ExprPrinter.latex(parser.parse("a|b"))).isEqualTo("a \\lor b");
    }

    @Test
    void naryNodesPrintEveryOperand() {
        Expr flat = Flattener.flatten(parser.parse("a v b v c"));

        assertThat(ExprPrinter.latex(flat)).isEqualTo("a \\lor b \\lor c");
    }

    @Test
    void asciiNormalizesOperatorSpellings() {
        assertThat(ExprPrinter.ascii(parser.parse("~(p&q)|r"))).isEqualTo("! ( p ^ q ) v r");
        assertThat(parser.parse("p<->q")).hasToString("p <-> q");
    }

    @Test
    void asciiRenderingParsesBackToTheSameTree() {
        List<String> samples = List.of(
                "p -> q -> r",
                "a ^ b v c",
                "a v b ^ c",
                "!(a <-> b) -> ~c & (d | e)",
                "((p))",
                "x <-> y <-> z v !x");

        for (String sample : samples) {
            Expr parsed = parser.parse(sample);
            Expr reparsed = parser.parse(ExprPrinter.ascii(parsed));

            assertThat(reparsed).as(sample).isEqualTo(parsed);
            for (Environment environment : new AssignmentEnumerator(Variables.of(parsed)).environments()) {
                assertThat(Evaluator.evaluate(reparsed, environment)).isEqualTo(Evaluator.evaluate(parsed, environment));
            }
        }
    }
}
