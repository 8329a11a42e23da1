package org.taut.oracle;

import java.util.ArrayList;
import java.util.List;

/**
 * Oracolo di test: decide istanze DIMACS piccole enumerando tutti gli
 * assegnamenti. Restituisce il primo modello trovato, completo e con segno.
 */
class BruteForceOracle implements SatOracle {

    private int calls;

    @Override
    public OracleAnswer solve(String dimacs) throws OracleException {
        calls++;
        int variables = 0;
        List<int[]> clauses = new ArrayList<>();

        for (String line : dimacs.split("\n")) {
            String[] words = line.trim().split("\\s+");
            if (words[0].isEmpty() || words[0].equals("c")) {
                continue;
            }
            if (words[0].equals("p")) {
                variables = Integer.parseInt(words[2]);
                continue;
            }
            int[] clause = new int[words.length - 1];
            for (int i = 0; i < clause.length; i++) {
                clause[i] = Integer.parseInt(words[i]);
            }
            clauses.add(clause);
        }

        if (variables > 20) {
            throw new OracleException("Istanza troppo grande per l'enumerazione: " + variables + " variabili");
        }

        for (long mask = 0; mask < (1L << variables); mask++) {
            if (satisfies(clauses, mask)) {
                List<Integer> model = new ArrayList<>();
                for (int v = 1; v <= variables; v++) {
                    model.add(isTrue(mask, v) ? v : -v);
                }
                return OracleAnswer.satisfiable(model);
            }
        }
        return OracleAnswer.unsatisfiable();
    }

    int getCalls() {
        return calls;
    }

    private static boolean satisfies(List<int[]> clauses, long mask) {
        for (int[] clause : clauses) {
            boolean satisfied = false;
            for (int literal : clause) {
                if (isTrue(mask, Math.abs(literal)) == literal > 0) {
                    satisfied = true;
                    break;
                }
            }
            if (!satisfied) {
                return false;
            }
        }
        return true;
    }

    private static boolean isTrue(long mask, int variable) {
        return (mask & (1L << (variable - 1))) != 0;
    }
}
