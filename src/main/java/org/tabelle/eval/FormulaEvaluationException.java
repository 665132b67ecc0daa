package org.tabelle.eval;

import org.tabelle.support.FormulaException;

/**
 * Errore di valutazione. Le formule prodotte dal parser non lo sollevano mai:
 * segnala alberi costruiti a mano con variabili non assegnate o arietà errate.
 */
public class FormulaEvaluationException extends FormulaException {

    /**
     * Causa dell'errore di valutazione.
     */
    public enum Reason {
        UNBOUND_VARIABLE,
        NON_BINARY_IMPLIES,
        NON_BINARY_EQUIV
    }

    private final Reason reason;

    public FormulaEvaluationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
