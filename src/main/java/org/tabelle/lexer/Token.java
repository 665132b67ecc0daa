package org.tabelle.lexer;

import java.util.Objects;

/**
 * Unità lessicale prodotta dal {@link Tokenizer}.
 *
 * Ogni token conserva la categoria, il testo riconosciuto (vuoto per END)
 * e la colonna 0-based del primo carattere nella riga.
 */
public final class Token {

    private final TokenKind kind;
    private final String text;
    private final int column;

    public Token(TokenKind kind, String text, int column) {
        Objects.requireNonNull(kind, "Categoria token non può essere null");
        Objects.requireNonNull(text, "Testo token non può essere null");
        if (column < 0) {
            throw new IllegalArgumentException("Colonna token negativa: " + column);
        }
        this.kind = kind;
        this.text = text;
        this.column = column;
    }

    /**
     * Crea il token di fine input posizionato alla colonna indicata.
     */
    public static Token end(int column) {
        return new Token(TokenKind.END, "", column);
    }

    public TokenKind getKind() {
        return kind;
    }

    public String getText() {
        return text;
    }

    public int getColumn() {
        return column;
    }

    public boolean is(TokenKind other) {
        return kind == other;
    }

    /**
     * Rappresentazione per messaggi diagnostici: 'p' (colonna 3), fine input (colonna 4).
     */
    public String describe() {
        String shown = kind == TokenKind.END ? kind.getDescription() : "'" + text + "'";
        return shown + " (colonna " + column + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        Token other = (Token) obj;
        return kind == other.kind && column == other.column && text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, text, column);
    }

    @Override
    public String toString() {
        return kind + "('" + text + "'@" + column + ")";
    }
}
