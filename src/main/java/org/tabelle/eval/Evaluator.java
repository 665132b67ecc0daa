package org.tabelle.eval;

import org.tabelle.ast.Expr;

/**
 * VALUTATORE - Calcolo del valore di verità di una formula sotto un assegnamento
 *
 * SEMANTICA:
 * - SYMBOL: valore assegnato alla variabile
 * - NOT: negazione del figlio
 * - OR: vero se almeno un figlio è vero (cortocircuito da sinistra)
 * - AND: vero se tutti i figli sono veri (cortocircuito da sinistra)
 * - IMPLIES: falso solo con antecedente vero e conseguente falso
 * - EQUIV: vero se i due lati hanno lo stesso valore
 * - PAREN: trasparente, valore del figlio
 *
 * Implicazione e biimplicazione non sono associative: un nodo con un numero
 * di figli diverso da due è rifiutato.
 */
public final class Evaluator {

    private Evaluator() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * @param expr formula da valutare
     * @param environment assegnamento totale sulle variabili della formula
     * @return valore di verità
     * @throws FormulaEvaluationException per variabili non assegnate o arietà errate
     */
    public static boolean evaluate(Expr expr, Environment environment) {
        return switch (expr.head()) {
            case SYMBOL -> environment.valueOf(expr.name());

            case NOT -> !evaluate(expr.child(), environment);

            case OR -> {
                for (Expr child : expr.children()) {
                    if (evaluate(child, environment)) {
                        yield true;
                    }
                }
                yield false;
            }

            case AND -> {
                for (Expr child : expr.children()) {
                    if (!evaluate(child, environment)) {
                        yield false;
                    }
                }
                yield true;
            }

            case IMPLIES -> {
                requireBinary(expr, FormulaEvaluationException.Reason.NON_BINARY_IMPLIES,
                        "L'implicazione non è associativa");
                yield !evaluate(expr.children().get(0), environment)
                        || evaluate(expr.children().get(1), environment);
            }

            case EQUIV -> {
                requireBinary(expr, FormulaEvaluationException.Reason.NON_BINARY_EQUIV,
                        "La biimplicazione non è associativa");
                yield evaluate(expr.children().get(0), environment)
                        == evaluate(expr.children().get(1), environment);
            }

            case PAREN -> evaluate(expr.child(), environment);
        };
    }

    private static void requireBinary(Expr expr, FormulaEvaluationException.Reason reason, String message) {
        if (expr.children().size() != 2) {
            throw new FormulaEvaluationException(reason,
                    message + ": " + expr.children().size() + " operandi in '" + expr + "'");
        }
    }
}
