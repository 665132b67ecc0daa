package org.tabelle.parser;

import org.tabelle.ast.Expr;
import org.tabelle.lexer.Token;
import org.tabelle.lexer.TokenKind;
import org.tabelle.lexer.TokenSequence;
import org.tabelle.lexer.Tokenizer;

import java.util.logging.Logger;

/**
 * PARSER FORMULE - Discesa ricorsiva con precedenze fisse
 *
 * GRAMMATICA (precedenza crescente):
 * <pre>
 * formula    := equivChain ('->' equivChain)*
 * equivChain := orExpr ('<->' orExpr)*
 * orExpr     := andExpr (OR orExpr)*
 * andExpr    := unary (AND orExpr)*
 * unary      := NOT unary | SYMBOL | '(' formula ')'
 * </pre>
 *
 * COSTRUZIONE DELL'ALBERO:
 * - Implicazioni e biimplicazioni concatenate si piegano a sinistra:
 *   a -> b -> c diventa IMPLIES(IMPLIES(a, b), c)
 * - OR e AND sono ricorsivi a destra: a v b v c diventa OR(a, OR(b, c)),
 *   appiattito in seguito dal Flattener
 * - L'operando destro di AND è letto al livello di OR: a ^ b v c diventa
 *   AND(a, OR(b, c)). Il comportamento è mantenuto per compatibilità con
 *   le tabelle prodotte finora
 * - Le parentesi esplicite producono un nodo PAREN
 *
 * ERRORI: {@link FormulaParseException} con il token responsabile.
 */
public final class FormulaParser {

    private static final Logger LOGGER = Logger.getLogger(FormulaParser.class.getName());

    private final Tokenizer tokenizer;

    public FormulaParser() {
        this(new Tokenizer());
    }

    /**
     * @param tokenizer tokenizer usato da {@link #parse(String)}
     */
    public FormulaParser(Tokenizer tokenizer) {
        this.tokenizer = tokenizer;
    }

    //region PUNTI DI INGRESSO

    /**
     * Tokenizza e analizza una riga.
     *
     * @param line formula in notazione ASCII
     * @return albero sintattico non appiattito
     */
    public Expr parse(String line) {
        return parse(tokenizer.tokenize(line));
    }

    /**
     * Analizza una sequenza di token consumandola interamente.
     *
     * @param tokens token della riga, terminati da END
     * @return albero sintattico non appiattito
     * @throws FormulaParseException se la sequenza non è una formula completa
     */
    public Expr parse(TokenSequence tokens) {
        LOGGER.finest(() -> "Parsing di " + tokens);

        Expr formula = parseFormula(tokens);
        if (!tokens.isAtEnd()) {
            int unread = tokens.remaining().size() - 1;
            throw new FormulaParseException("Input residuo dopo la formula (" + unread + " token non letti)", tokens.peek());
        }

        LOGGER.fine(() -> "Formula riconosciuta: " + formula);
        return formula;
    }

    //endregion

    //region LIVELLI DI PRECEDENZA

    private Expr parseFormula(TokenSequence tokens) {
        Expr left = parseEquivChain(tokens);
        while (tokens.accept(TokenKind.IMPLIES)) {
            left = Expr.implies(left, parseEquivChain(tokens));
        }
        return left;
    }

    private Expr parseEquivChain(TokenSequence tokens) {
        Expr left = parseOr(tokens);
        while (tokens.accept(TokenKind.EQUIV)) {
            left = Expr.equiv(left, parseOr(tokens));
        }
        return left;
    }

    private Expr parseOr(TokenSequence tokens) {
        Expr left = parseAnd(tokens);
        while (tokens.accept(TokenKind.OR)) {
            left = Expr.or(left, parseOr(tokens));
        }
        return left;
    }

    private Expr parseAnd(TokenSequence tokens) {
        Expr left = parseUnary(tokens);
        while (tokens.accept(TokenKind.AND)) {
            left = Expr.and(left, parseOr(tokens));
        }
        return left;
    }

    private Expr parseUnary(TokenSequence tokens) {
        Token token = tokens.next();

        return switch (token.getKind()) {
            case NOT -> Expr.not(parseUnary(tokens));
            case SYMBOL -> Expr.symbol(token.getText());
            case LPAREN -> {
                Expr inner = parseFormula(tokens);
                expect(tokens, TokenKind.RPAREN);
                yield Expr.paren(inner);
            }
            default -> throw new FormulaParseException("Token inatteso, attesi negazione, variabile o '('", token);
        };
    }

    //endregion

    /**
     * Consuma il token corrente, che deve essere della categoria indicata.
     */
    private static Token expect(TokenSequence tokens, TokenKind kind) {
        if (!tokens.check(kind)) {
            throw new FormulaParseException("Atteso '" + kind.getDescription() + "', trovato", tokens.peek());
        }
        return tokens.next();
    }
}
