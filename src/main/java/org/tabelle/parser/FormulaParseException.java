package org.tabelle.parser;

import org.tabelle.lexer.Token;
import org.tabelle.support.FormulaException;

/**
 * Errore sintattico: token inatteso, parentesi non chiusa o input residuo.
 */
public class FormulaParseException extends FormulaException {

    private final Token token;

    public FormulaParseException(String message, Token token) {
        super(message + ": " + token.describe());
        this.token = token;
    }

    /**
     * @return token in corrispondenza del quale il parsing è fallito
     */
    public Token getToken() {
        return token;
    }
}
