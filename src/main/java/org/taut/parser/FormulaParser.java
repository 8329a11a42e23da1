package org.taut.parser;

import org.taut.parser.FormulaParseException.ErrorKind;
import org.taut.support.Conjunction;
import org.taut.support.Disjunction;
import org.taut.support.Formula;
import org.taut.support.Negation;
import org.taut.support.Node;
import org.taut.support.Variable;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * PARSER A DISCESA RICORSIVA - Da testo ad albero sintattico {@link Formula}
 *
 * Grammatica (precedenza crescente, operatori binari associativi a destra):
 * <pre>
 * implication := disjunction ( '-&gt;' implication )?
 * disjunction := conjunction ( 'v' disjunction )?
 * conjunction := negation ( '&amp;' conjunction )?
 * negation    := '~' negation | atom
 * atom        := variable | '(' implication ')'
 * </pre>
 *
 * TRASFORMAZIONI SEMANTICHE:
 * • A -&gt; B diventa (~A v B) già in costruzione, con un proprio identificatore
 * • Ogni congiunzione/disgiunzione riceve l'identificatore successivo dal
 *   contatore della formula, assegnato quando l'operatore viene consumato
 *   (quindi prima di analizzare l'operando destro)
 *
 * ERRORI (mai recuperati):
 * • Tokenizzazione fallita, token residui, parentesi non corrispondenti,
 *   token inatteso, token mancante
 *
 * Un input senza token produce una formula vuota, non un errore.
 *
 * LIMITE DI ANNIDAMENTO:
 * • Ogni regola attiva occupa un livello, al massimo {@link #MAX_DEPTH}
 * • Una coppia di parentesi costa cinque livelli, una negazione o un operatore
 *   binario in catena uno: circa 600 parentesi annidate o 3000 negazioni
 * • Oltre il limite il parsing fallisce con {@code NESTING_TOO_DEEP}; gli alberi
 *   accettati restano quindi abbastanza bassi per stampa, uguaglianza e
 *   valutazione ricorsive
 */
public final class FormulaParser {

    private static final Logger LOGGER = Logger.getLogger(FormulaParser.class.getName());

    /** Numero massimo di regole della grammatica attive contemporaneamente */
    public static final int MAX_DEPTH = 3000;

    //region STATO DEL PARSING

    /** Token da consumare, da sinistra a destra */
    private final List<Token> tokens;

    /** Indice del prossimo token da consumare */
    private int position;

    /** Formula in costruzione, proprietaria del contatore dei connettivi */
    private final Formula formula;

    /** Regole attualmente in esecuzione */
    private int depth;

    //endregion

    private FormulaParser(List<Token> tokens) {
        this.tokens = tokens;
        this.position = 0;
        this.formula = new Formula();
    }

    //region PUNTO DI INGRESSO

    /**
     * Analizza una formula testuale.
     *
     * @param text formula (non null)
     * @return albero sintattico, senza radice se il testo non contiene token
     * @throws FormulaParseException se il testo non è una formula ben formata
     */
    public static Formula parse(String text) throws FormulaParseException {
        TokenizationResult tokenization = FormulaTokenizer.tokenize(text);
        if (!tokenization.isValid()) {
            Token last = tokenization.lastToken();
            if (last != null) {
                throw new FormulaParseException(ErrorKind.INVALID_TOKEN,
                        "Token non valido incontrato dopo: \"" + last.text() + "\".");
            }
            throw new FormulaParseException(ErrorKind.INVALID_TOKEN,
                    "Token non valido all'inizio della formula.");
        }
        return parse(tokenization.getTokens());
    }

    /**
     * Analizza una sequenza di token già prodotta dal tokenizzatore.
     *
     * @param tokens token in ordine
     * @return albero sintattico, senza radice se la lista è vuota
     * @throws FormulaParseException se la sequenza non è una formula ben formata
     */
    public static Formula parse(List<Token> tokens) throws FormulaParseException {
        FormulaParser parser = new FormulaParser(List.copyOf(tokens));
        if (!tokens.isEmpty()) {
            parser.formula.replaceRoot(parser.implication());
            if (parser.position < parser.tokens.size()) {
                throw new FormulaParseException(ErrorKind.UNPARSED_TOKENS,
                        "Token non analizzati nella formula a partire da: \""
                                + parser.tokens.get(parser.position).text() + "\".");
            }
        }

        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Formula analizzata: " + parser.formula + " (" + parser.formula.getConnectiveCount() + " connettivi)");
        }
        return parser.formula;
    }

    //endregion

    //region REGOLE DELLA GRAMMATICA

    private Node implication() throws FormulaParseException {
        enter();
        try {
            Node left = disjunction();
            if (nextIs(TokenType.IMPLIES)) {
                consume();
                int id = formula.nextConnectiveId();
                return new Disjunction(id, new Negation(left), implication());
            }
            return left;
        } finally {
            depth--;
        }
    }

    private Node disjunction() throws FormulaParseException {
        enter();
        try {
            Node left = conjunction();
            if (nextIs(TokenType.OR)) {
                consume();
                int id = formula.nextConnectiveId();
                return new Disjunction(id, left, disjunction());
            }
            return left;
        } finally {
            depth--;
        }
    }

    private Node conjunction() throws FormulaParseException {
        enter();
        try {
            Node left = negation();
            if (nextIs(TokenType.AND)) {
                consume();
                int id = formula.nextConnectiveId();
                return new Conjunction(id, left, conjunction());
            }
            return left;
        } finally {
            depth--;
        }
    }

    private Node negation() throws FormulaParseException {
        enter();
        try {
            if (nextIs(TokenType.NOT)) {
                consume();
                return new Negation(negation());
            }
            return atom();
        } finally {
            depth--;
        }
    }

    private Node atom() throws FormulaParseException {
        enter();
        try {
            Token token = consume();
            if (token == null) {
                throw new FormulaParseException(ErrorKind.NO_TOKEN, "Nessun token da analizzare.");
            }

            return switch (token.getType()) {
                case VARIABLE -> new Variable(token.getVariableIndex());
                case LEFT_PAREN -> {
                    Node expression = implication();
                    if (!nextIs(TokenType.RIGHT_PAREN)) {
                        throw new FormulaParseException(ErrorKind.NON_MATCHING_PARENTHESES, "Parentesi non corrispondenti.");
                    }
                    consume();
                    yield expression;
                }
                default -> throw new FormulaParseException(ErrorKind.UNEXPECTED_TOKEN,
                        "Token inatteso \"" + token.text() + "\".");
            };
        } finally {
            depth--;
        }
    }

    /**
     * Apre un livello di annidamento, fallendo oltre {@link #MAX_DEPTH}.
     */
    private void enter() throws FormulaParseException {
        if (++depth > MAX_DEPTH) {
            throw new FormulaParseException(ErrorKind.NESTING_TOO_DEEP,
                    "Formula annidata oltre il limite di " + MAX_DEPTH + " livelli.");
        }
    }

    //endregion

    //region LOOKAHEAD

    /**
     * Controlla il prossimo token senza consumarlo.
     */
    private boolean nextIs(TokenType type) {
        return position < tokens.size() && tokens.get(position).getType() == type;
    }

    /**
     * Consuma il prossimo token.
     *
     * @return token consumato, null se l'input è terminato
     */
    private Token consume() {
        return position < tokens.size() ? tokens.get(position++) : null;
    }

    //endregion
}
