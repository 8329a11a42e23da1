package org.taut.support;

/**
 * Catena di negazioni consecutive che parte da un nodo: numero di negazioni
 * attraversate e primo nodo che non è una negazione.
 */
public final class NegationChain {

    private final int negations;
    private final Node base;

    private NegationChain(int negations, Node base) {
        this.negations = negations;
        this.base = base;
    }

    /**
     * Scende lungo le negazioni a partire da {@code first}, iterativamente.
     *
     * @param first nodo di partenza (non null)
     * @return catena con conteggio e nodo base
     */
    public static NegationChain of(Node first) {
        int negations = 0;
        Node current = first;
        while (current.type() == Node.Type.NEGATION) {
            current = ((Negation) current).getExpression();
            negations++;
        }
        return new NegationChain(negations, current);
    }

    /**
     * @return numero di negazioni incontrate
     */
    public int getNegations() {
        return negations;
    }

    /**
     * @return primo nodo non negazione
     */
    public Node getBase() {
        return base;
    }

    /**
     * @return true se il numero di negazioni è dispari
     */
    public boolean isNegated() {
        return negations % 2 == 1;
    }
}
