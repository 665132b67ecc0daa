package org.tabelle.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * STAMPA DELLE FORMULE - Rappresentazione testuale canonica dei nodi
 *
 * La formula viene scomposta in una sequenza di simboli (variabili, connettivi,
 * parentesi) uniti da un singolo spazio. Due notazioni condividono la stessa
 * struttura e differiscono solo per la grafia dei connettivi:
 *
 * - LATEX: \neg \lor \land \rightarrow \leftrightarrow. È la forma canonica:
 *   intestazioni delle colonne e chiave di deduplicazione delle sottoformule.
 * - ASCII: ! v ^ -> <->. Rileggibile dal tokenizer, usata per log e testo semplice.
 *
 * Le parentesi compaiono solo dove l'albero contiene un nodo PAREN.
 */
public final class ExprPrinter {

    /**
     * Grafia dei connettivi.
     */
    public enum Notation {
        LATEX("\\neg", "\\lor", "\\land", "\\rightarrow", "\\leftrightarrow"),
        ASCII("!", "v", "^", "->", "<->");

        private final String not;
        private final String or;
        private final String and;
        private final String implies;
        private final String equiv;

        Notation(String not, String or, String and, String implies, String equiv) {
            this.not = not;
            this.or = or;
            this.and = and;
            this.implies = implies;
            this.equiv = equiv;
        }

        /**
         * @return simbolo del connettivo binario o n-ario
         */
        String infix(Head head) {
            return switch (head) {
                case OR -> or;
                case AND -> and;
                case IMPLIES -> implies;
                case EQUIV -> equiv;
                default -> throw new IllegalArgumentException("Nessun connettivo infisso per " + head);
            };
        }
    }

    private ExprPrinter() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * @return rappresentazione LaTeX canonica, ad esempio {@code \neg ( p \land q )}
     */
    public static String latex(Expr expr) {
        return print(expr, Notation.LATEX);
    }

    /**
     * @return rappresentazione ASCII, ad esempio {@code ! ( p ^ q )}
     */
    public static String ascii(Expr expr) {
        return print(expr, Notation.ASCII);
    }

    public static String print(Expr expr, Notation notation) {
        List<String> parts = new ArrayList<>();
        appendParts(expr, notation, parts);
        return String.join(" ", parts);
    }

    /**
     * Visita in ordine di lettura, accumulando i simboli della formula.
     */
    private static void appendParts(Expr expr, Notation notation, List<String> parts) {
        switch (expr.head()) {
            case SYMBOL -> parts.add(expr.name());
            case NOT -> {
                parts.add(notation.not);
                appendParts(expr.child(), notation, parts);
            }
            case OR, AND, IMPLIES, EQUIV -> {
                List<Expr> children = expr.children();
                appendParts(children.get(0), notation, parts);
                for (Expr child : children.subList(1, children.size())) {
                    parts.add(notation.infix(expr.head()));
                    appendParts(child, notation, parts);
                }
            }
            case PAREN -> {
                parts.add("(");
                appendParts(expr.child(), notation, parts);
                parts.add(")");
            }
        }
    }
}
