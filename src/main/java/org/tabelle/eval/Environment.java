package org.tabelle.eval;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Assegnamento immutabile di valori di verità alle variabili di una formula.
 */
public final class Environment {

    private final Map<String, Boolean> values;

    /**
     * @param values assegnamento (copiato, l'ordine di iterazione è preservato)
     */
    public Environment(Map<String, Boolean> values) {
        Objects.requireNonNull(values, "Assegnamento non può essere null");
        if (values.containsKey(null) || values.containsValue(null)) {
            throw new IllegalArgumentException("Assegnamento con chiavi o valori null");
        }
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * Costruisce l'assegnamento che associa a ciascuna variabile il valore
     * nella stessa posizione.
     */
    public static Environment of(List<String> variables, boolean[] assignment) {
        if (variables.size() != assignment.length) {
            throw new IllegalArgumentException("Variabili (" + variables.size()
                    + ") e valori (" + assignment.length + ") in numero diverso");
        }
        Map<String, Boolean> values = new LinkedHashMap<>();
        for (int i = 0; i < assignment.length; i++) {
            values.put(variables.get(i), assignment[i]);
        }
        return new Environment(values);
    }

    /**
     * @return valore della variabile
     * @throws FormulaEvaluationException se la variabile non è assegnata
     */
    public boolean valueOf(String variable) {
        Boolean value = values.get(variable);
        if (value == null) {
            throw new FormulaEvaluationException(FormulaEvaluationException.Reason.UNBOUND_VARIABLE,
                    "Variabile non assegnata: " + variable);
        }
        return value;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        return values.equals(((Environment) obj).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
