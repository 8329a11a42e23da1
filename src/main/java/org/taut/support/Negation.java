package org.taut.support;

import java.util.Objects;

/**
 * Negazione unaria: possiede esattamente un figlio.
 */
public final class Negation extends Node {

    private Node expression;

    /**
     * @param expression sottoformula negata (non null)
     * @throws IllegalArgumentException se expression null
     */
    public Negation(Node expression) {
        if (expression == null) {
            throw new IllegalArgumentException("Operando per negazione non può essere null");
        }
        this.expression = expression;
    }

    public Node getExpression() {
        return expression;
    }

    /**
     * Sostituisce il figlio. Usato solo dalla normalizzazione delle negazioni.
     */
    public void replaceExpression(Node expression) {
        this.expression = Objects.requireNonNull(expression, "expression");
    }

    @Override
    public Type type() {
        return Type.NEGATION;
    }

    @Override
    Node shallowCopy() {
        return new Negation(expression);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        return ((Negation) obj).expression.equals(expression);
    }

    @Override
    public int hashCode() {
        return 31 * expression.hashCode() + 1;
    }

    @Override
    public String toString() {
        return "~" + expression;
    }
}
