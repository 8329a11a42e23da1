package org.taut.parser;

/**
 * Errore lessicale o sintattico durante il parsing di una formula.
 * Non viene mai recuperato: interrompe la verifica corrente.
 */
public class FormulaParseException extends Exception {

    /**
     * Tipologie di errore distinte.
     */
    public enum ErrorKind {
        INVALID_TOKEN,              // Carattere non riconosciuto dal lexer
        UNPARSED_TOKENS,            // Token residui dopo una formula completa
        NON_MATCHING_PARENTHESES,   // Parentesi chiusa attesa ma assente o diversa
        UNEXPECTED_TOKEN,           // Token diverso da variabile o '(' in posizione di atomo
        NO_TOKEN,                   // Input terminato dove serviva un atomo
        NESTING_TOO_DEEP            // Annidamento oltre FormulaParser.MAX_DEPTH
    }

    private final ErrorKind kind;

    public FormulaParseException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
