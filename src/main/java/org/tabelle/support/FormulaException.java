package org.tabelle.support;

/**
 * Eccezione base per tutti gli errori deterministici di elaborazione di una formula.
 *
 * Ogni errore interrompe l'elaborazione della sola riga corrente: è il chiamante
 * (runner) a decidere se proseguire con la riga successiva o terminare l'esecuzione.
 * Non ha senso ritentare: lo stesso input produce sempre lo stesso errore.
 */
public class FormulaException extends RuntimeException {

    public FormulaException(String message) {
        super(message);
    }

    public FormulaException(String message, Throwable cause) {
        super(message, cause);
    }
}
