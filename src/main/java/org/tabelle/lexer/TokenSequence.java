package org.tabelle.lexer;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Sequenza di token di una singola riga, consumata dal fronte verso il fondo.
 *
 * I token consumati non possono essere riletti: il parser procede per sola
 * lettura in avanti con un token di lookahead. L'ultimo token è sempre END e
 * non viene mai rimosso, così {@link #peek()} resta valido anche a fine input.
 */
public final class TokenSequence {

    private final Deque<Token> remaining;

    /**
     * @param tokens token nell'ordine di lettura, terminati da END
     * @throws IllegalArgumentException se la lista è vuota o non termina con END
     */
    public TokenSequence(List<Token> tokens) {
        if (tokens == null || tokens.isEmpty()) {
            throw new IllegalArgumentException("Sequenza di token vuota");
        }
        Token last = tokens.get(tokens.size() - 1);
        if (!last.is(TokenKind.END)) {
            throw new IllegalArgumentException("La sequenza deve terminare con END, trovato " + last.describe());
        }
        for (int i = 0; i < tokens.size() - 1; i++) {
            if (tokens.get(i).is(TokenKind.END)) {
                throw new IllegalArgumentException("END ammesso solo in ultima posizione");
            }
        }
        this.remaining = new ArrayDeque<>(tokens);
    }

    /**
     * @return token corrente, senza consumarlo
     */
    public Token peek() {
        return remaining.peekFirst();
    }

    public boolean check(TokenKind kind) {
        return peek().is(kind);
    }

    /**
     * Consuma e restituisce il token corrente. END resta in coda.
     */
    public Token next() {
        Token current = remaining.peekFirst();
        if (current.is(TokenKind.END)) {
            return current;
        }
        return remaining.pollFirst();
    }

    /**
     * Consuma il token corrente se della categoria indicata.
     *
     * @return true se il token è stato consumato
     */
    public boolean accept(TokenKind kind) {
        if (check(kind)) {
            next();
            return true;
        }
        return false;
    }

    public boolean isAtEnd() {
        return check(TokenKind.END);
    }

    /**
     * @return copia dei token non ancora consumati
     */
    public List<Token> remaining() {
        return new ArrayList<>(remaining);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder("[");
        for (Token token : remaining) {
            if (builder.length() > 1) {
                builder.append(", ");
            }
            builder.append(token.is(TokenKind.END) ? "END" : token.getText());
        }
        return builder.append(']').toString();
    }
}
