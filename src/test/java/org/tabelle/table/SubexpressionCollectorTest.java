package org.tabelle.table;

import org.junit.jupiter.api.Test;
import org.tabelle.ast.Expr;
import org.tabelle.ast.ExprPrinter;
import org.tabelle.ast.Flattener;
import org.tabelle.ast.Head;
import org.tabelle.parser.FormulaParser;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class SubexpressionCollectorTest {

    private final FormulaParser parser = new FormulaParser();

    private List<Expr> collect(String formula) {
        return SubexpressionCollector.collect(Flattener.flatten(parser.parse(formula)));
    }

    private static List<String> latex(List<Expr> expressions) {
        return expressions.stream().map(ExprPrinter::latex).collect(Collectors.toList());
    }

    @Test
    void implicationIsTheOnlyColumn() {
        assertThat(latex(collect("p -> q"))).containsExactly("p \\rightarrow q");
    }

    @Test
    void aloneSymbolHasNoColumns() {
        assertThat(collect("p")).isEmpty();
        assertThat(collect("((p))")).isEmpty();
    }

    @Test
    void repeatedOperandStaysInTheTreeButGivesOneColumn() {
        Expr flattened = Flattener.flatten(parser.parse("p v p"));

        assertThat(flattened.children()).hasSize(2);
        assertThat(latex(SubexpressionCollector.collect(flattened))).containsExactly("p \\lor p");
    }

    @Test
    void parenthesesAreSkipped() {
        assertThat(latex(collect("!(p ^ q)"))).containsExactly("p \\land q", "\\neg ( p \\land q )");
    }

    @Test
    void firstOccurrenceWinsOnEqualRendering() {
        List<Expr> collected = collect("(p ^ q) -> !q v (p ^ q)");

        assertThat(latex(collected)).containsExactly(
                "p \\land q",
                "\\neg q",
                "\\neg q \\lor ( p \\land q )",
                "( p \\land q ) \\rightarrow \\neg q \\lor ( p \\land q )");
    }

    @Test
    void listsEveryChildBeforeItsParent() {
        List<Expr> collected = collect("!(a v b v !c) <-> (a -> b) ^ !!c");

        Set<String> seen = new HashSet<>();
        for (Expr expr : collected) {
            assertThat(expr.head()).isNotIn(Head.SYMBOL, Head.PAREN);
            assertThat(seen.add(ExprPrinter.latex(expr))).as("duplicato %s", expr).isTrue();
            for (Expr child : expr.children()) {
                Expr unwrapped = child;
                while (unwrapped.is(Head.PAREN)) {
                    unwrapped = unwrapped.child();
                }
                if (!unwrapped.is(Head.SYMBOL)) {
                    assertThat(seen).as("figlio di %s", expr).contains(ExprPrinter.latex(unwrapped));
                }
            }
        }
    }
}
