package org.tabelle.render;

import org.tabelle.ast.ExprPrinter;
import org.tabelle.table.TruthTable;

import java.util.List;

/**
 * Tabella in testo semplice per la lettura a terminale.
 *
 * Intestazioni in notazione ASCII, colonne allineate a sinistra e separate da
 * " | ", una riga di trattini sotto le intestazioni:
 * <pre>
 * p | q | p -&gt; q
 * --+---+-------
 * 1 | 1 | 1
 * </pre>
 */
public final class PlainTextTableRenderer implements TableRenderer {

    private static final String SEPARATOR = " | ";

    @Override
    public String render(TruthTable table) {
        List<String> headers = table.getHeaders(ExprPrinter.Notation.ASCII);
        int[] widths = new int[headers.size()];
        for (int i = 0; i < headers.size(); i++) {
            // Le celle contengono un solo carattere
            widths[i] = Math.max(1, headers.get(i).length());
        }

        StringBuilder text = new StringBuilder();
        appendLine(text, headers, widths);
        text.append('\n');

        for (int i = 0; i < widths.length; i++) {
            if (i > 0) {
                text.append("-+-");
            }
            text.append("-".repeat(widths[i]));
        }

        for (List<String> cells : table.getCells()) {
            text.append('\n');
            appendLine(text, cells, widths);
        }
        return text.toString();
    }

    private static void appendLine(StringBuilder text, List<String> values, int[] widths) {
        StringBuilder line = new StringBuilder();
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                line.append(SEPARATOR);
            }
            line.append(values.get(i));
            line.append(" ".repeat(widths[i] - values.get(i).length()));
        }
        // Nessuno spazio in coda all'ultima colonna
        text.append(line.toString().stripTrailing());
    }
}
