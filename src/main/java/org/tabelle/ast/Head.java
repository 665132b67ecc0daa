package org.tabelle.ast;

/**
 * Etichetta dei nodi dell'albero sintattico.
 *
 * L'insieme è chiuso: stampa, valutazione e raccolta delle sottoformule
 * eseguono uno switch esaustivo su questi sette valori.
 */
public enum Head {
    SYMBOL,     // Variabile proposizionale: p, q, Ab
    NOT,        // Negazione: !A
    OR,         // Disgiunzione n-aria: A v B v C
    AND,        // Congiunzione n-aria: A ^ B ^ C
    IMPLIES,    // Implicazione binaria: A -> B
    EQUIV,      // Biimplicazione binaria: A <-> B
    PAREN;      // Raggruppamento esplicito: ( A )

    /**
     * @return true per gli operatori associativi, appiattiti dalla normalizzazione
     */
    public boolean isAssociative() {
        return this == OR || this == AND;
    }
}
