package org.taut.oracle;

import java.util.List;

/**
 * Esito dell'oracolo: soddisfacibilità e, se soddisfacibile, i letterali del
 * modello riportati dal solutore (positivi = vero, negativi = falso).
 * Le factory method garantiscono che un esito UNSAT non abbia modello.
 */
public final class OracleAnswer {

    private final boolean satisfiable;
    private final List<Integer> model;

    private OracleAnswer(boolean satisfiable, List<Integer> model) {
        this.satisfiable = satisfiable;
        this.model = List.copyOf(model);
    }

    /**
     * @param model letterali del modello (non null)
     */
    public static OracleAnswer satisfiable(List<Integer> model) {
        if (model == null) {
            throw new IllegalArgumentException("Un risultato SAT richiede il modello");
        }
        return new OracleAnswer(true, model);
    }

    public static OracleAnswer unsatisfiable() {
        return new OracleAnswer(false, List.of());
    }

    public boolean isSatisfiable() {
        return satisfiable;
    }

    /**
     * @return letterali del modello, lista vuota se insoddisfacibile
     */
    public List<Integer> getModel() {
        return model;
    }

    @Override
    public String toString() {
        return satisfiable ? "SAT " + model : "UNSAT";
    }
}
