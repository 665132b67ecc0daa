package org.tabelle.table;

import org.tabelle.ast.Expr;
import org.tabelle.ast.Head;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Estrazione delle variabili libere di una formula.
 */
public final class Variables {

    private Variables() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * @return nomi distinti delle variabili in ordine crescente (maiuscole prima delle minuscole)
     */
    public static List<String> of(Expr expr) {
        SortedSet<String> names = new TreeSet<>();
        collect(expr, names);
        return new ArrayList<>(names);
    }

    private static void collect(Expr expr, SortedSet<String> names) {
        if (expr.is(Head.SYMBOL)) {
            names.add(expr.name());
            return;
        }
        for (Expr child : expr.children()) {
            collect(child, names);
        }
    }
}
