package org.taut.parser;

import org.antlr.v4.runtime.CharStreams;
import org.taut.antlr.FormulaLexer;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * TOKENIZZATORE - Adattatore sul lexer ANTLR generato da FormulaLexer.g4
 *
 * Consuma i token del lexer da sinistra a destra e si ferma al primo carattere
 * non riconosciuto (token INVALID), restituendo i token letti fin lì con il flag
 * di validità a false. Nessuna eccezione: il chiamante decide come riportare
 * l'errore ("token non valido dopo X").
 *
 * TOKEN RICONOSCIUTI:
 * • ( ) ~ &amp; v -&gt;
 * • Variabili A1, A2, ... (indice senza zeri iniziali)
 * • Spazi bianchi ignorati
 */
public final class FormulaTokenizer {

    private static final Logger LOGGER = Logger.getLogger(FormulaTokenizer.class.getName());

    private FormulaTokenizer() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Tokenizza una formula.
     *
     * @param formula testo della formula (non null)
     * @return token riconosciuti e flag di validità
     */
    public static TokenizationResult tokenize(String formula) {
        if (formula == null) {
            throw new IllegalArgumentException("Formula non può essere null");
        }

        FormulaLexer lexer = new FormulaLexer(CharStreams.fromString(formula));
        lexer.removeErrorListeners();

        List<Token> tokens = new ArrayList<>();
        for (org.antlr.v4.runtime.Token current = lexer.nextToken();
             current.getType() != org.antlr.v4.runtime.Token.EOF;
             current = lexer.nextToken()) {

            Token token = convert(current);
            if (token == null) {
                LOGGER.fine("Carattere non riconosciuto in posizione " + current.getCharPositionInLine()
                        + " dopo " + tokens.size() + " token");
                return new TokenizationResult(tokens, false);
            }
            tokens.add(token);
        }

        LOGGER.finest("Token riconosciuti: " + tokens);
        return new TokenizationResult(tokens, true);
    }

    /**
     * Converte un token ANTLR nel token del dominio, null se non valido.
     */
    private static Token convert(org.antlr.v4.runtime.Token token) {
        return switch (token.getType()) {
            case FormulaLexer.LPAREN -> Token.of(TokenType.LEFT_PAREN);
            case FormulaLexer.RPAREN -> Token.of(TokenType.RIGHT_PAREN);
            case FormulaLexer.NOT -> Token.of(TokenType.NOT);
            case FormulaLexer.AND -> Token.of(TokenType.AND);
            case FormulaLexer.OR -> Token.of(TokenType.OR);
            case FormulaLexer.IMPLIES -> Token.of(TokenType.IMPLIES);
            case FormulaLexer.VARIABLE -> parseVariable(token.getText());
            default -> null;
        };
    }

    /**
     * Indici che non stanno in un int sono trattati come token non riconosciuti.
     */
    private static Token parseVariable(String text) {
        try {
            return Token.variable(Integer.parseInt(text.substring(1)));
        } catch (NumberFormatException e) {
            LOGGER.fine("Indice variabile fuori intervallo: " + text);
            return null;
        }
    }
}
