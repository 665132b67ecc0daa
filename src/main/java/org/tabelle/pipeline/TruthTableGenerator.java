package org.tabelle.pipeline;

import org.tabelle.ast.Expr;
import org.tabelle.ast.Flattener;
import org.tabelle.lexer.TokenSequence;
import org.tabelle.lexer.Tokenizer;
import org.tabelle.parser.FormulaParser;
import org.tabelle.table.TruthTable;
import org.tabelle.table.TruthTableBuilder;

import java.util.logging.Logger;

/**
 * PIPELINE DI UNA RIGA - Dalla formula testuale alla tabella di verità
 *
 * FASI:
 * 1. Tokenizzazione (lexer ANTLR)
 * 2. Parsing a discesa ricorsiva
 * 3. Appiattimento di OR e AND concatenati
 * 4. Raccolta variabili e sottoformule, valutazione di ogni riga
 *
 * Nessuno stato sopravvive tra una riga e la successiva: la stessa istanza
 * può elaborare righe diverse in parallelo.
 */
public final class TruthTableGenerator {

    private static final Logger LOGGER = Logger.getLogger(TruthTableGenerator.class.getName());

    private final Tokenizer tokenizer;
    private final FormulaParser parser;

    /**
     * Crea un generatore con tokenizer permissivo.
     */
    public TruthTableGenerator() {
        this(false);
    }

    /**
     * @param strictLexing true per rifiutare i caratteri non riconosciuti
     */
    public TruthTableGenerator(boolean strictLexing) {
        this.tokenizer = new Tokenizer(strictLexing);
        this.parser = new FormulaParser(tokenizer);
    }

    /**
     * @param line formula in notazione ASCII
     * @return tabella di verità della formula appiattita
     * @throws org.tabelle.support.FormulaException per errori lessicali, sintattici o di valutazione
     */
    public TruthTable generate(String line) {
        TokenSequence tokens = tokenizer.tokenize(line);
        Expr parsed = parser.parse(tokens);
        Expr flattened = Flattener.flatten(parsed);

        TruthTable table = TruthTableBuilder.build(flattened);
        LOGGER.fine(() -> "Tabella generata per '" + line.trim() + "': " + table);
        return table;
    }
}
