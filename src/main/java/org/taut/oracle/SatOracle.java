package org.taut.oracle;

/**
 * Oracolo di soddisfacibilità: riceve un'istanza DIMACS e restituisce l'esito
 * con l'eventuale modello. La pipeline di trasformazione dipende solo da questa
 * interfaccia, non dal modo in cui il solutore viene eseguito.
 */
public interface SatOracle {

    /**
     * Risolve un'istanza DIMACS.
     *
     * @param dimacs testo DIMACS completo di header
     * @return esito del solutore
     * @throws OracleException se il solutore fallisce o restituisce un esito non riconosciuto
     */
    OracleAnswer solve(String dimacs) throws OracleException;
}
