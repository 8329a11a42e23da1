package org.taut.support;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * VERIFICA A FORZA BRUTA - Enumerazione completa della tabella di verità
 *
 * Prova tutti i 2^V assegnamenti delle variabili usate e restituisce il primo
 * che falsifica la formula. Serve come controllo incrociato del percorso
 * basato sul solutore SAT, quindi è limitata a un numero ridotto di variabili.
 */
public final class TruthTableChecker {

    private static final Logger LOGGER = Logger.getLogger(TruthTableChecker.class.getName());

    /** Numero massimo di variabili enumerabili */
    public static final int MAX_VARIABLES = 24;

    private TruthTableChecker() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Verifica la validità per enumerazione.
     *
     * @param formula formula non vuota
     * @return esito con il primo assegnamento falsificante trovato
     * @throws IllegalArgumentException se formula vuota o con troppe variabili
     */
    public static ValidityResult check(Formula formula) {
        if (formula.isEmpty()) {
            throw new IllegalArgumentException("Formula vuota non verificabile");
        }

        List<Integer> variables = new ArrayList<>(formula.usedVariables());
        if (variables.size() > MAX_VARIABLES) {
            throw new IllegalArgumentException("Troppe variabili per la tabella di verità: "
                    + variables.size() + " (massimo " + MAX_VARIABLES + ")");
        }

        LOGGER.fine("Enumerazione di 2^" + variables.size() + " assegnamenti");

        Map<Integer, Boolean> bindings = new HashMap<>();
        for (long permutation = 0; permutation < (1L << variables.size()); permutation++) {
            for (int i = 0; i < variables.size(); i++) {
                bindings.put(variables.get(i), (permutation & (1L << i)) != 0);
            }
            if (!FormulaEvaluator.evaluate(formula, bindings)) {
                return ValidityResult.invalid(bindings);
            }
        }
        return ValidityResult.valid();
    }
}
