package org.tabelle.render;

import org.tabelle.table.TruthTable;

/**
 * Formattazione testuale di una tabella di verità già calcolata.
 *
 * Le implementazioni sono funzioni pure: nessuno stato, nessun effetto collaterale.
 */
public interface TableRenderer {

    /**
     * @param table tabella da formattare
     * @return frammento di documento autonomo, senza terminatore di riga finale
     */
    String render(TruthTable table);
}
