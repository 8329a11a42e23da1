package org.taut.parser;

import java.util.List;

/**
 * Risultato della tokenizzazione: token riconosciuti nell'ordine e flag di
 * validità. Se la tokenizzazione non è valida la lista contiene i token letti
 * prima del primo carattere non riconosciuto.
 */
public final class TokenizationResult {

    private final List<Token> tokens;
    private final boolean valid;

    /**
     * @param tokens token riconosciuti (copiati in una lista non modificabile)
     * @param valid true se l'intera stringa è stata tokenizzata
     */
    public TokenizationResult(List<Token> tokens, boolean valid) {
        this.tokens = List.copyOf(tokens);
        this.valid = valid;
    }

    public List<Token> getTokens() {
        return tokens;
    }

    public boolean isValid() {
        return valid;
    }

    /**
     * @return ultimo token valido, null se non ne è stato riconosciuto nessuno
     */
    public Token lastToken() {
        return tokens.isEmpty() ? null : tokens.get(tokens.size() - 1);
    }

    @Override
    public String toString() {
        return (valid ? "Token validi " : "Token validi fino all'errore ") + tokens;
    }
}
