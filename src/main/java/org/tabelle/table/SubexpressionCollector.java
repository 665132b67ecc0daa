package org.tabelle.table;

import org.tabelle.ast.Expr;
import org.tabelle.ast.ExprPrinter;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * RACCOLTA DELLE SOTTOFORMULE - Colonne calcolate della tabella di verità
 *
 * Visita l'albero in post-ordine (figli prima del padre) e raccoglie ogni nodo
 * che non sia una variabile né un raggruppamento PAREN.
 *
 * DEDUPLICAZIONE:
 * - Chiave: rappresentazione LaTeX canonica del nodo
 * - Due nodi con la stessa stampa danno una sola colonna, vince la prima occorrenza
 * - Il post-ordine garantisce che ogni sottoformula raccolta preceda i suoi antenati
 */
public final class SubexpressionCollector {

    private static final Logger LOGGER = Logger.getLogger(SubexpressionCollector.class.getName());

    private SubexpressionCollector() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * @param expr formula, normalmente già appiattita
     * @return sottoformule distinte in post-ordine
     */
    public static List<Expr> collect(Expr expr) {
        List<Expr> collected = new ArrayList<>();
        visit(expr, new HashSet<>(), collected);

        LOGGER.finest(() -> "Sottoformule raccolte: " + collected.size());
        return collected;
    }

    private static void visit(Expr expr, Set<String> seen, List<Expr> collected) {
        for (Expr child : expr.children()) {
            visit(child, seen, collected);
        }

        switch (expr.head()) {
            case SYMBOL, PAREN -> {
                // Variabili e parentesi non diventano colonne calcolate
            }
            case NOT, OR, AND, IMPLIES, EQUIV -> {
                if (seen.add(ExprPrinter.latex(expr))) {
                    collected.add(expr);
                }
            }
        }
    }
}
