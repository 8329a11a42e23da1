package org.taut.oracle;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * ORACOLO MINISAT - Solutore esterno invocato tramite file di richiesta e risposta
 *
 * PROTOCOLLO:
 * • Il testo DIMACS viene scritto in un file temporaneo di richiesta
 * • Il solutore viene avviato come {@code <comando> <richiesta> <risposta>}
 * • Codice di uscita 10: SAT, il file di risposta contiene "SAT" e i letterali
 *   del modello terminati da 0
 * • Codice di uscita 20: UNSAT
 * • Qualsiasi altro codice: errore dell'oracolo
 *
 * Ogni invocazione usa file temporanei propri, eliminati al termine, quindi
 * verifiche parallele non condividono percorsi. L'attesa è limitata da un
 * timeout, allo scadere del quale il processo viene terminato.
 */
public class MiniSatOracle implements SatOracle {

    private static final Logger LOGGER = Logger.getLogger(MiniSatOracle.class.getName());

    //region CONFIGURAZIONE

    /** Eseguibile di default, cercato nel PATH */
    public static final String DEFAULT_EXECUTABLE = "minisat";

    /** Tempo massimo di default per una singola risoluzione */
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    /** Codici di uscita del protocollo minisat */
    private static final int EXIT_SATISFIABLE = 10;
    private static final int EXIT_UNSATISFIABLE = 20;

    /** Prima parola del file di risposta per istanze soddisfacibili */
    private static final String SAT_MARKER = "SAT";

    /** Comando del solutore, senza i percorsi dei file */
    private final List<String> command;

    /** Tempo massimo di attesa del processo */
    private final Duration timeout;

    //endregion

    //region COSTRUZIONE

    /**
     * @param executable eseguibile del solutore (nome nel PATH o percorso)
     * @param timeout tempo massimo di attesa
     */
    public MiniSatOracle(String executable, Duration timeout) {
        this(List.of(executable), timeout);
    }

    /**
     * @param command comando del solutore, a cui vengono aggiunti i due percorsi
     * @param timeout tempo massimo di attesa (positivo)
     * @throws IllegalArgumentException se comando vuoto o timeout non positivo
     */
    public MiniSatOracle(List<String> command, Duration timeout) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("Comando del solutore non può essere vuoto");
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("Timeout deve essere positivo, ricevuto: " + timeout);
        }
        this.command = List.copyOf(command);
        this.timeout = timeout;
    }

    //endregion

    //region RISOLUZIONE

    @Override
    public OracleAnswer solve(String dimacs) throws OracleException {
        Path request = null;
        Path response = null;
        try {
            request = Files.createTempFile("minisat_in", ".txt");
            response = Files.createTempFile("minisat_out", ".txt");
            Files.writeString(request, dimacs, StandardCharsets.US_ASCII);

            int exitCode = execute(request, response);
            LOGGER.fine("Solutore terminato con codice " + exitCode);

            return switch (exitCode) {
                case EXIT_UNSATISFIABLE -> OracleAnswer.unsatisfiable();
                case EXIT_SATISFIABLE -> OracleAnswer.satisfiable(readModel(response));
                default -> throw new OracleException("Il solutore ha restituito un codice sconosciuto: " + exitCode);
            };

        } catch (OracleException e) {
            throw e;
        } catch (IOException e) {
            throw new OracleException("Errore di I/O durante la comunicazione con il solutore", e);
        } finally {
            deleteTemporaryFile(request);
            deleteTemporaryFile(response);
        }
    }

    /**
     * Avvia il processo e ne attende la terminazione entro il timeout.
     */
    private int execute(Path request, Path response) throws OracleException {
        List<String> arguments = new ArrayList<>(command);
        arguments.add(request.toString());
        arguments.add(response.toString());

        ProcessBuilder builder = new ProcessBuilder(arguments);
        builder.redirectErrorStream(true);
        builder.redirectOutput(ProcessBuilder.Redirect.DISCARD);

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new OracleException("Impossibile avviare il solutore: " + String.join(" ", command), e);
        }

        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                LOGGER.warning("Solutore terminato forzatamente dopo " + timeout.toMillis() + " ms");
                throw new OracleTimeoutException(timeout);
            }
            return process.exitValue();
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new OracleException("Attesa del solutore interrotta", e);
        }
    }

    /**
     * Legge i letterali del modello dal file di risposta, fino al terminatore 0.
     */
    private List<Integer> readModel(Path response) throws IOException {
        String[] words = Files.readString(response, StandardCharsets.US_ASCII).trim().split("\\s+");
        if (words.length == 0 || !SAT_MARKER.equals(words[0])) {
            throw new OracleException("File di risposta del solutore non riconosciuto: " + response);
        }

        List<Integer> model = new ArrayList<>();
        for (int i = 1; i < words.length; i++) {
            int literal;
            try {
                literal = Integer.parseInt(words[i]);
            } catch (NumberFormatException e) {
                throw new OracleException("Letterale non valido nella risposta del solutore: " + words[i], e);
            }
            if (literal == 0) {
                break;
            }
            model.add(literal);
        }
        return model;
    }

    private void deleteTemporaryFile(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Impossibile eliminare il file temporaneo " + path, e);
        }
    }

    //endregion

    @Override
    public String toString() {
        return String.format("MiniSatOracle[comando=%s, timeout=%dms]", String.join(" ", command), timeout.toMillis());
    }
}
