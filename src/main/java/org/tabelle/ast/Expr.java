package org.tabelle.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * NODO DELL'ALBERO SINTATTICO - Rappresentazione immutabile di una formula proposizionale
 *
 * Ogni nodo è identificato da un'etichetta {@link Head} e porta:
 * - il nome della variabile (solo SYMBOL)
 * - la lista ordinata e non modificabile dei figli (vuota per SYMBOL)
 *
 * ARIETÀ:
 * - NOT, PAREN: un figlio
 * - OR, AND: due figli dal parser, due o più dopo l'appiattimento
 * - IMPLIES, EQUIV: due figli dal parser; il costruttore generico
 *   {@link #compound(Head, List)} ammette altre arietà, rifiutate in valutazione
 *
 * L'uguaglianza è strutturale: etichetta, nome e figli nell'ordine.
 */
public final class Expr {

    //region ATTRIBUTI

    /** Etichetta del nodo */
    private final Head head;

    /** Nome della variabile (null se il nodo non è SYMBOL) */
    private final String name;

    /** Figli nell'ordine di lettura */
    private final List<Expr> children;

    //endregion

    //region COSTRUZIONE

    private Expr(Head head, String name, List<Expr> children) {
        this.head = head;
        this.name = name;
        this.children = children;
    }

    /**
     * Costruisce una variabile proposizionale.
     *
     * @param name nome non vuoto, senza 'v' minuscola
     * @throws IllegalArgumentException se il nome non è una variabile valida
     */
    public static Expr symbol(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Nome variabile non può essere null o vuoto");
        }
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            boolean latinLetter = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
            if (!latinLetter || c == 'v') {
                throw new IllegalArgumentException("Nome variabile non valido: " + name);
            }
        }
        return new Expr(Head.SYMBOL, name, List.of());
    }

    public static Expr not(Expr child) {
        return compound(Head.NOT, List.of(child));
    }

    public static Expr paren(Expr inner) {
        return compound(Head.PAREN, List.of(inner));
    }

    public static Expr or(Expr left, Expr right) {
        return compound(Head.OR, List.of(left, right));
    }

    public static Expr or(List<Expr> children) {
        return compound(Head.OR, children);
    }

    public static Expr and(Expr left, Expr right) {
        return compound(Head.AND, List.of(left, right));
    }

    public static Expr and(List<Expr> children) {
        return compound(Head.AND, children);
    }

    public static Expr implies(Expr left, Expr right) {
        return compound(Head.IMPLIES, List.of(left, right));
    }

    public static Expr equiv(Expr left, Expr right) {
        return compound(Head.EQUIV, List.of(left, right));
    }

    /**
     * Costruttore generico per nodi con figli.
     *
     * Valida solo i vincoli strutturali non negoziabili: NOT e PAREN hanno un
     * figlio, OR e AND almeno due. IMPLIES ed EQUIV accettano qualsiasi numero
     * di figli non nullo: l'arietà errata è segnalata dal valutatore.
     *
     * @param head etichetta diversa da SYMBOL
     * @param children figli non null (copiati)
     * @throws IllegalArgumentException se i figli non rispettano l'arietà di head
     */
    public static Expr compound(Head head, List<Expr> children) {
        Objects.requireNonNull(head, "Etichetta nodo non può essere null");
        if (children == null || children.contains(null)) {
            throw new IllegalArgumentException("Lista figli null o con elementi null per " + head);
        }

        switch (head) {
            case SYMBOL -> throw new IllegalArgumentException("SYMBOL non ha figli: usare Expr.symbol()");
            case NOT, PAREN -> {
                if (children.size() != 1) {
                    throw new IllegalArgumentException(head + " richiede esattamente un figlio, ricevuti " + children.size());
                }
            }
            case OR, AND -> {
                if (children.size() < 2) {
                    throw new IllegalArgumentException(head + " richiede almeno due figli, ricevuti " + children.size());
                }
            }
            case IMPLIES, EQUIV -> {
                if (children.isEmpty()) {
                    throw new IllegalArgumentException(head + " richiede almeno un figlio");
                }
            }
        }

        return new Expr(head, null, Collections.unmodifiableList(new ArrayList<>(children)));
    }

    //endregion

    //region ACCESSO

    public Head head() {
        return head;
    }

    /**
     * @return nome della variabile
     * @throws IllegalStateException se il nodo non è SYMBOL
     */
    public String name() {
        if (head != Head.SYMBOL) {
            throw new IllegalStateException("Nodo " + head + " non ha nome");
        }
        return name;
    }

    public List<Expr> children() {
        return children;
    }

    /**
     * @return l'unico figlio di NOT o PAREN, il primo figlio negli altri casi
     */
    public Expr child() {
        if (children.isEmpty()) {
            throw new IllegalStateException("Nodo " + head + " senza figli");
        }
        return children.get(0);
    }

    public boolean is(Head other) {
        return head == other;
    }

    //endregion

    //region UGUAGLIANZA E RAPPRESENTAZIONE

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        Expr other = (Expr) obj;
        return head == other.head
                && Objects.equals(name, other.name)
                && children.equals(other.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(head, name, children);
    }

    /**
     * @return la formula in notazione ASCII, rileggibile dal parser
     */
    @Override
    public String toString() {
        return ExprPrinter.ascii(this);
    }

    //endregion
}
