package org.tabelle.table;

import org.tabelle.ast.Expr;
import org.tabelle.eval.Environment;
import org.tabelle.eval.Evaluator;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Costruzione della tabella di verità di una formula appiattita.
 *
 * Colonne: una per variabile (in ordine crescente) seguita dalle sottoformule
 * in post-ordine. Righe: tutti i 2^N assegnamenti nell'ordine di
 * {@link AssignmentEnumerator}. Ogni cella è la valutazione della colonna
 * sotto l'assegnamento della riga.
 *
 * Il costo è O(2^N * M) valutazioni, con M colonne: nessun limite è imposto
 * oltre a quello di rappresentabilità delle righe.
 */
public final class TruthTableBuilder {

    private static final Logger LOGGER = Logger.getLogger(TruthTableBuilder.class.getName());

    private TruthTableBuilder() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * @param formula formula già appiattita
     * @return tabella completa
     */
    public static TruthTable build(Expr formula) {
        return build(formula, Variables.of(formula), SubexpressionCollector.collect(formula));
    }

    /**
     * Costruisce la tabella da variabili e sottoformule già calcolate.
     *
     * @param formula formula di riferimento
     * @param variables variabili ordinate
     * @param subexpressions sottoformule in post-ordine
     */
    public static TruthTable build(Expr formula, List<String> variables, List<Expr> subexpressions) {
        List<Expr> columns = new ArrayList<>(variables.size() + subexpressions.size());
        for (String variable : variables) {
            columns.add(Expr.symbol(variable));
        }
        columns.addAll(subexpressions);

        AssignmentEnumerator enumerator = new AssignmentEnumerator(variables);
        LOGGER.fine(() -> "Costruzione tabella: " + variables.size() + " variabili, "
                + columns.size() + " colonne, " + enumerator.size() + " righe");

        List<boolean[]> rows = new ArrayList<>(enumerator.size());
        for (Environment environment : enumerator.environments()) {
            boolean[] values = new boolean[columns.size()];
            for (int column = 0; column < columns.size(); column++) {
                values[column] = Evaluator.evaluate(columns.get(column), environment);
            }
            rows.add(values);
        }

        return new TruthTable(formula, variables, columns, rows);
    }
}
