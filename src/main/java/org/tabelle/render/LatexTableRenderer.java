package org.tabelle.render;

import org.tabelle.table.TruthTable;

import java.util.ArrayList;
import java.util.List;

/**
 * Ambiente {@code tabular} LaTeX con filetti booktabs.
 *
 * <pre>
 * \begin{tabular}{ccc}\toprule
 * \(p\) &amp; \(q\) &amp; \(p \rightarrow q\)\\\midrule
 * 1 &amp; 1 &amp; 1\\
 * ...
 * 0 &amp; 0 &amp; 1\\\bottomrule
 * \end{tabular}
 * </pre>
 *
 * Ogni intestazione è racchiusa in modo matematico inline {@code \( ... \)}.
 */
public final class LatexTableRenderer implements TableRenderer {

    private static final String CELL_SEPARATOR = " & ";
    private static final String ROW_END = "\\\\";

    @Override
    public String render(TruthTable table) {
        StringBuilder latex = new StringBuilder();

        latex.append("\\begin{tabular}{")
                .append("c".repeat(table.getColumnCount()))
                .append("}\\toprule\n");

        List<String> headers = new ArrayList<>();
        for (String header : table.getHeaders()) {
            headers.add("\\(" + header + "\\)");
        }
        latex.append(String.join(CELL_SEPARATOR, headers))
                .append(ROW_END).append("\\midrule\n");

        List<String> rows = new ArrayList<>();
        for (List<String> cells : table.getCells()) {
            rows.add(String.join(CELL_SEPARATOR, cells));
        }
        latex.append(String.join(ROW_END + "\n", rows))
                .append(ROW_END).append("\\bottomrule\n")
                .append("\\end{tabular}");

        return latex.toString();
    }
}
