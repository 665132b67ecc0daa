package org.tabelle.lexer;

import org.antlr.v4.runtime.CharStreams;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * TOKENIZER - Conversione di una riga di testo in sequenza di token
 *
 * Il riconoscimento dei lessemi è delegato al lexer ANTLR generato dalla
 * grammatica FormulaLexer.g4; questa classe traduce i token ANTLR nelle
 * categorie di dominio e aggiunge il token END finale.
 *
 * LESSEMI RICONOSCIUTI:
 * - NOT: ! ~
 * - OR: v |
 * - AND: ^ &
 * - IMPLIES: ->    EQUIV: <->
 * - Parentesi: ( )
 * - SYMBOL: una o più lettere latine, esclusa la 'v' minuscola
 *
 * CARATTERI NON RICONOSCIUTI:
 * - Modalità permissiva (default): scartati, come spazi bianchi
 * - Modalità rigorosa: {@link FormulaLexException} con carattere e colonna
 *
 * Le istanze sono immutabili e riutilizzabili da più thread.
 */
public final class Tokenizer {

    private static final Logger LOGGER = Logger.getLogger(Tokenizer.class.getName());

    private final boolean strict;

    /**
     * Crea un tokenizer in modalità permissiva.
     */
    public Tokenizer() {
        this(false);
    }

    /**
     * @param strict true per rifiutare i caratteri non riconosciuti
     */
    public Tokenizer(boolean strict) {
        this.strict = strict;
    }

    /**
     * Tokenizza una riga completa.
     *
     * @param line testo della formula (senza terminatore di riga)
     * @return sequenza di token terminata da END
     * @throws FormulaLexException in modalità rigorosa, al primo carattere non riconosciuto
     */
    public TokenSequence tokenize(String line) {
        Objects.requireNonNull(line, "Riga da tokenizzare non può essere null");

        FormulaLexer lexer = new FormulaLexer(CharStreams.fromString(line));
        // La regola UNKNOWN copre qualsiasi carattere: gli errori del lexer non si verificano
        lexer.removeErrorListeners();

        List<Token> tokens = new ArrayList<>();
        org.antlr.v4.runtime.Token antlrToken = lexer.nextToken();

        while (antlrToken.getType() != org.antlr.v4.runtime.Token.EOF) {
            int column = antlrToken.getStartIndex();

            if (antlrToken.getType() == FormulaLexer.UNKNOWN) {
                handleUnknownCharacter(antlrToken.getText(), column);
            } else {
                tokens.add(new Token(toKind(antlrToken.getType()), antlrToken.getText(), column));
            }
            antlrToken = lexer.nextToken();
        }

        tokens.add(Token.end(line.length()));
        LOGGER.finest(() -> "Token riconosciuti: " + tokens.size() + " per la riga '" + line + "'");
        return new TokenSequence(tokens);
    }

    /**
     * Applica la politica sui caratteri non riconosciuti.
     */
    private void handleUnknownCharacter(String text, int column) {
        if (strict) {
            throw new FormulaLexException(text.charAt(0), column);
        }
        LOGGER.fine(() -> "Carattere ignorato '" + text + "' alla colonna " + column);
    }

    /**
     * Traduce il tipo di token ANTLR nella categoria di dominio.
     */
    private static TokenKind toKind(int antlrType) {
        return switch (antlrType) {
            case FormulaLexer.NOT -> TokenKind.NOT;
            case FormulaLexer.OR -> TokenKind.OR;
            case FormulaLexer.AND -> TokenKind.AND;
            case FormulaLexer.IMPLIES -> TokenKind.IMPLIES;
            case FormulaLexer.EQUIV -> TokenKind.EQUIV;
            case FormulaLexer.LPAREN -> TokenKind.LPAREN;
            case FormulaLexer.RPAREN -> TokenKind.RPAREN;
            case FormulaLexer.SYMBOL -> TokenKind.SYMBOL;
            default -> throw new IllegalStateException("Tipo di token ANTLR inatteso: " + antlrType);
        };
    }
}
