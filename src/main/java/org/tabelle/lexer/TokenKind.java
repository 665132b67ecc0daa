package org.tabelle.lexer;

/**
 * Categorie lessicali riconosciute nelle formule in notazione ASCII.
 */
public enum TokenKind {
    NOT("!"),           // Negazione: ! oppure ~
    OR("v"),            // Disgiunzione: v oppure |
    AND("^"),           // Congiunzione: ^ oppure &
    IMPLIES("->"),      // Implicazione
    EQUIV("<->"),       // Biimplicazione
    LPAREN("("),
    RPAREN(")"),
    SYMBOL("simbolo"),  // Variabile proposizionale
    END("fine input");

    private final String description;

    TokenKind(String description) {
        this.description = description;
    }

    /**
     * @return forma leggibile della categoria, usata nei messaggi di errore
     */
    public String getDescription() {
        return description;
    }
}
