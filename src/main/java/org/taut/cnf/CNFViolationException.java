package org.taut.cnf;

/**
 * Violazione della precondizione strutturale della CNF: una congiunzione (o un
 * connettivo negato) compare all'interno di una clausola. È un errore di
 * programmazione, non un caso recuperabile.
 */
public class CNFViolationException extends RuntimeException {

    public CNFViolationException(String message) {
        super(message);
    }
}
