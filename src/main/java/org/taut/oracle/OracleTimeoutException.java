package org.taut.oracle;

import java.time.Duration;

/**
 * Il solutore esterno non ha terminato entro il tempo massimo configurato.
 */
public class OracleTimeoutException extends OracleException {

    private final Duration timeout;

    public OracleTimeoutException(Duration timeout) {
        super("Timeout raggiunto dopo " + timeout.toMillis() + " ms");
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
