package org.tabelle.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Normalizzazione delle catene di operatori associativi.
 *
 * Il parser produce catene binarie annidate a destra ({@code a v (b v c)} senza
 * parentesi esplicite); l'appiattimento le trasforma in un unico nodo n-ario
 * {@code OR(a, b, c)}. Solo OR e AND vengono fusi, e solo con figli diretti
 * della stessa etichetta: un nodo PAREN interrompe la fusione.
 */
public final class Flattener {

    private static final Logger LOGGER = Logger.getLogger(Flattener.class.getName());

    private Flattener() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Appiattisce l'albero dal basso verso l'alto.
     *
     * @param expr albero da normalizzare (non modificato)
     * @return nuovo albero senza nodi OR/AND con figli diretti della stessa etichetta
     */
    public static Expr flatten(Expr expr) {
        Expr result = flattenNode(expr);
        LOGGER.finest(() -> "Formula appiattita: " + result);
        return result;
    }

    private static Expr flattenNode(Expr expr) {
        if (expr.is(Head.SYMBOL)) {
            return expr;
        }

        boolean mergeable = expr.head().isAssociative();
        List<Expr> rebuilt = new ArrayList<>();
        for (Expr child : expr.children()) {
            Expr flatChild = flattenNode(child);
            if (mergeable && flatChild.head() == expr.head()) {
                // Stesso operatore: i nipoti salgono di livello nell'ordine originale
                rebuilt.addAll(flatChild.children());
            } else {
                rebuilt.add(flatChild);
            }
        }
        return Expr.compound(expr.head(), rebuilt);
    }
}
