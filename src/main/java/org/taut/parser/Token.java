package org.taut.parser;

import org.taut.support.Variable;

import java.util.Objects;

/**
 * Unità lessicale. Solo i token variabile portano un indice (> 0), gli altri
 * hanno indice 0.
 */
public final class Token {

    private final TokenType type;
    private final int variableIndex;

    /**
     * @param type categoria del token (non null)
     * @param variableIndex indice della variabile, 0 per gli altri token
     * @throws IllegalArgumentException se tipo e indice non sono coerenti
     */
    public Token(TokenType type, int variableIndex) {
        if (type == null) {
            throw new IllegalArgumentException("Tipo token non può essere null");
        }
        if (type == TokenType.VARIABLE && variableIndex <= 0) {
            throw new IllegalArgumentException("Indice variabile deve essere > 0, ricevuto: " + variableIndex);
        }
        if (type != TokenType.VARIABLE && variableIndex != 0) {
            throw new IllegalArgumentException("Solo i token variabile hanno un indice");
        }
        this.type = type;
        this.variableIndex = variableIndex;
    }

    public static Token of(TokenType type) {
        return new Token(type, 0);
    }

    public static Token variable(int index) {
        return new Token(TokenType.VARIABLE, index);
    }

    public TokenType getType() {
        return type;
    }

    public int getVariableIndex() {
        return variableIndex;
    }

    /**
     * @return testo del token come appare nella formula
     */
    public String text() {
        return type == TokenType.VARIABLE ? Variable.PREFIX + variableIndex : type.symbol();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        Token other = (Token) obj;
        return type == other.type && variableIndex == other.variableIndex;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, variableIndex);
    }

    @Override
    public String toString() {
        return text();
    }
}
