package org.taut.parser;

/**
 * Categorie lessicali della grammatica delle formule.
 */
public enum TokenType {
    LEFT_PAREN("("),
    RIGHT_PAREN(")"),
    NOT("~"),
    AND("&"),
    OR("v"),
    IMPLIES("->"),
    VARIABLE(null);

    private final String symbol;

    TokenType(String symbol) {
        this.symbol = symbol;
    }

    /**
     * @return simbolo fisso del token, null per le variabili
     */
    public String symbol() {
        return symbol;
    }
}
