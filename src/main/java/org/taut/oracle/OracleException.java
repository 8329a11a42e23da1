package org.taut.oracle;

import java.io.IOException;

/**
 * Errore dell'oracolo esterno (codice di uscita non riconosciuto, file di
 * risposta illeggibile, processo non avviabile). Distinto dagli errori di parsing.
 */
public class OracleException extends IOException {

    public OracleException(String message) {
        super(message);
    }

    public OracleException(String message, Throwable cause) {
        super(message, cause);
    }
}
