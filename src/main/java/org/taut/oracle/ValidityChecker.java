package org.taut.oracle;

import org.taut.cnf.DimacsEncoder;
import org.taut.cnf.TseitinConverter;
import org.taut.parser.FormulaParseException;
import org.taut.parser.FormulaParser;
import org.taut.support.Formula;
import org.taut.support.ValidityResult;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * VERIFICA DI VALIDITÀ - Coordinamento della pipeline completa
 *
 * PIPELINE:
 * 1. Parsing del testo in albero sintattico
 * 2. CNF di Tseitin della negazione
 * 3. Codifica DIMACS e invio all'oracolo
 * 4. UNSAT: formula valida; SAT: formula non valida con controesempio
 *
 * Il controesempio si ottiene dal modello scartando le variabili gate: restano
 * i letterali il cui valore assoluto meno l'offset (numero di connettivi) è una
 * variabile originale usata dalla formula.
 */
public class ValidityChecker {

    private static final Logger LOGGER = Logger.getLogger(ValidityChecker.class.getName());

    private final SatOracle oracle;

    /**
     * @param oracle oracolo di soddisfacibilità (non null)
     */
    public ValidityChecker(SatOracle oracle) {
        if (oracle == null) {
            throw new IllegalArgumentException("Oracolo non può essere null");
        }
        this.oracle = oracle;
    }

    /**
     * Analizza e verifica una formula testuale.
     *
     * @param text formula
     * @return esito della verifica
     * @throws FormulaParseException se la formula non è ben formata
     * @throws OracleException se l'oracolo fallisce
     * @throws IllegalArgumentException se la formula è vuota
     */
    public ValidityResult check(String text) throws FormulaParseException, OracleException {
        return check(FormulaParser.parse(text));
    }

    /**
     * Verifica una formula già analizzata (non modificata).
     *
     * @param formula formula non vuota
     * @return esito della verifica
     * @throws OracleException se l'oracolo fallisce
     * @throws IllegalArgumentException se la formula è vuota
     */
    public ValidityResult check(Formula formula) throws OracleException {
        if (formula.isEmpty()) {
            throw new IllegalArgumentException("Occorre fornire una formula non vuota");
        }

        String dimacs = DimacsEncoder.encode(TseitinConverter.polyNegatedCnf(formula));
        OracleAnswer answer = oracle.solve(dimacs);

        if (!answer.isSatisfiable()) {
            LOGGER.fine("Negazione insoddisfacibile: formula valida");
            return ValidityResult.valid();
        }

        Map<Integer, Boolean> countermodel = countermodel(formula, answer.getModel());
        LOGGER.fine("Negazione soddisfacibile: controesempio " + countermodel);
        return ValidityResult.invalid(countermodel);
    }

    /**
     * Traduce il modello del solutore in un assegnamento delle variabili originali.
     */
    static Map<Integer, Boolean> countermodel(Formula formula, List<Integer> model) {
        int offset = formula.getConnectiveCount();
        Set<Integer> used = formula.usedVariables();

        Map<Integer, Boolean> countermodel = new TreeMap<>();
        for (int literal : model) {
            int variable = Math.abs(literal) - offset;
            if (used.contains(variable)) {
                countermodel.put(variable, literal > 0);
            }
        }
        return countermodel;
    }
}
