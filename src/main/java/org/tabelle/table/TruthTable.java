package org.tabelle.table;

import org.tabelle.ast.Expr;
import org.tabelle.ast.ExprPrinter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * TABELLA DI VERITÀ - Risultato immutabile dell'elaborazione di una formula
 *
 * COMPOSIZIONE:
 * - Variabili: nomi ordinati, le prime N colonne
 * - Colonne: variabili seguite dalle sottoformule raccolte
 * - Righe: 2^N assegnamenti, un valore per colonna
 *
 * Il contratto verso i renderer è dato da {@link #getHeaders()} (etichette LaTeX)
 * e {@link #getCells()} (celle "1"/"0"), con lo stesso numero di colonne.
 */
public final class TruthTable {

    private final Expr formula;
    private final List<String> variables;
    private final List<Expr> columns;
    private final List<boolean[]> rows;

    TruthTable(Expr formula, List<String> variables, List<Expr> columns, List<boolean[]> rows) {
        for (boolean[] row : rows) {
            if (row.length != columns.size()) {
                throw new IllegalArgumentException("Riga con " + row.length
                        + " valori per " + columns.size() + " colonne");
            }
        }
        this.formula = formula;
        this.variables = List.copyOf(variables);
        this.columns = List.copyOf(columns);
        List<boolean[]> copy = new ArrayList<>(rows.size());
        for (boolean[] row : rows) {
            copy.add(row.clone());
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    /**
     * @return formula appiattita da cui è stata costruita la tabella
     */
    public Expr getFormula() {
        return formula;
    }

    public List<String> getVariables() {
        return variables;
    }

    /**
     * @return sottoformule calcolate, cioè le colonne successive alle variabili
     */
    public List<Expr> getSubexpressions() {
        return columns.subList(variables.size(), columns.size());
    }

    public int getColumnCount() {
        return columns.size();
    }

    public int getRowCount() {
        return rows.size();
    }

    public boolean getValue(int row, int column) {
        return rows.get(row)[column];
    }

    /**
     * @return intestazioni in notazione LaTeX canonica
     */
    public List<String> getHeaders() {
        return getHeaders(ExprPrinter.Notation.LATEX);
    }

    public List<String> getHeaders(ExprPrinter.Notation notation) {
        List<String> headers = new ArrayList<>(columns.size());
        for (Expr column : columns) {
            headers.add(ExprPrinter.print(column, notation));
        }
        return headers;
    }

    /**
     * @return righe come celle "1"/"0" nell'ordine delle colonne
     */
    public List<List<String>> getCells() {
        List<List<String>> cells = new ArrayList<>(rows.size());
        for (boolean[] row : rows) {
            List<String> line = new ArrayList<>(row.length);
            for (boolean value : row) {
                line.add(value ? "1" : "0");
            }
            cells.add(line);
        }
        return cells;
    }

    @Override
    public String toString() {
        return "TruthTable[formula=" + formula + ", colonne=" + columns.size() + ", righe=" + rows.size() + "]";
    }
}
