package org.tabelle.table;

import org.tabelle.eval.Environment;
import org.tabelle.support.FormulaException;

import java.util.ArrayList;
import java.util.List;

/**
 * ENUMERAZIONE DEGLI ASSEGNAMENTI - Righe della tabella di verità
 *
 * Le N variabili, in ordine crescente, sono trattate come le cifre di un
 * contatore a N bit: la prima variabile è la più significativa (cambia più
 * lentamente), l'ultima la meno significativa. Il bit a 0 corrisponde al
 * valore vero, quindi ogni blocco elenca prima la metà con la variabile a 1
 * e poi quella con la variabile a 0.
 *
 * Per [p, q]: (1,1) (1,0) (0,1) (0,0).
 */
public final class AssignmentEnumerator {

    /** 2^30 è la massima potenza di due rappresentabile come int positivo */
    static final int MAX_VARIABLES = Integer.SIZE - 2;

    private final List<String> variables;

    /**
     * @param variables variabili nell'ordine delle colonne
     * @throws FormulaException se 2^N righe non sono rappresentabili come int
     */
    public AssignmentEnumerator(List<String> variables) {
        if (variables.size() > MAX_VARIABLES) {
            throw new FormulaException("Tabella non rappresentabile: " + variables.size()
                    + " variabili richiedono 2^" + variables.size()
                    + " righe, oltre il massimo indice int di una lista");
        }
        this.variables = List.copyOf(variables);
    }

    /**
     * @return 2^N, numero di righe
     */
    public int size() {
        return 1 << variables.size();
    }

    /**
     * Valori della riga indicata, nell'ordine delle variabili.
     *
     * @param row indice di riga in [0, 2^N)
     */
    public boolean[] assignment(int row) {
        if (row < 0 || row >= size()) {
            throw new IndexOutOfBoundsException("Riga " + row + " fuori da [0, " + size() + ")");
        }
        int count = variables.size();
        boolean[] values = new boolean[count];
        for (int i = 0; i < count; i++) {
            values[i] = ((row >> (count - 1 - i)) & 1) == 0;
        }
        return values;
    }

    public Environment environment(int row) {
        return Environment.of(variables, assignment(row));
    }

    /**
     * @return tutti gli assegnamenti nell'ordine delle righe
     */
    public List<Environment> environments() {
        List<Environment> environments = new ArrayList<>(size());
        for (int row = 0; row < size(); row++) {
            environments.add(environment(row));
        }
        return environments;
    }
}
