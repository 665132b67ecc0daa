package org.tabelle.lexer;

import org.tabelle.support.FormulaException;

/**
 * Carattere non riconosciuto durante la tokenizzazione in modalità rigorosa.
 */
public class FormulaLexException extends FormulaException {

    private final char character;
    private final int column;

    public FormulaLexException(char character, int column) {
        super("Carattere non riconosciuto '" + character + "' alla colonna " + column);
        this.character = character;
        this.column = column;
    }

    public char getCharacter() {
        return character;
    }

    public int getColumn() {
        return column;
    }
}
