package org.taut.support;

import java.util.Map;

/**
 * Valutazione diretta di una formula sotto un assegnamento delle variabili.
 * Usata dalla verifica a tabella di verità e per controllare i controesempi.
 */
public final class FormulaEvaluator {

    private FormulaEvaluator() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Valuta la formula. La formula vuota non è valutabile.
     *
     * @param formula formula non vuota
     * @param bindings valore di ogni variabile usata
     * @return valore di verità della formula
     * @throws IllegalArgumentException se la formula è vuota o manca un valore
     */
    public static boolean evaluate(Formula formula, Map<Integer, Boolean> bindings) {
        if (formula.isEmpty()) {
            throw new IllegalArgumentException("Formula vuota non valutabile");
        }
        return evaluate(formula.getRoot(), bindings);
    }

    /**
     * Valuta ricorsivamente il sottoalbero.
     */
    public static boolean evaluate(Node node, Map<Integer, Boolean> bindings) {
        return switch (node.type()) {
            case VARIABLE -> {
                int id = ((Variable) node).getId();
                Boolean value = bindings.get(id);
                if (value == null) {
                    throw new IllegalArgumentException("Nessun valore per la variabile " + node);
                }
                yield value;
            }
            case NEGATION -> !evaluate(((Negation) node).getExpression(), bindings);
            case CONJUNCTION -> evaluate(((Conjunction) node).getLeft(), bindings)
                    && evaluate(((Conjunction) node).getRight(), bindings);
            case DISJUNCTION -> evaluate(((Disjunction) node).getLeft(), bindings)
                    || evaluate(((Disjunction) node).getRight(), bindings);
        };
    }
}
