package org.taut;

import org.taut.cnf.DimacsEncoder;
import org.taut.cnf.TseitinConverter;
import org.taut.oracle.MiniSatOracle;
import org.taut.oracle.OracleException;
import org.taut.oracle.ValidityChecker;
import org.taut.parser.FormulaParseException;
import org.taut.parser.FormulaParser;
import org.taut.support.Formula;
import org.taut.support.TruthTableChecker;
import org.taut.support.ValidityResult;
import org.taut.support.Variable;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.logging.LogManager;

/**
 * VERIFICATORE DI TAUTOLOGIE
 *
 * PIPELINE DI ELABORAZIONE:
 * 1. INPUT: formula da linea di comando, da file (una per riga) o da standard input
 * 2. PARSING: tokenizzazione ANTLR e parser a discesa ricorsiva
 * 3. CONVERSIONE: CNF di Tseitin della negazione della formula
 * 4. CODIFICA: formato DIMACS per il solutore esterno
 * 5. RISOLUZIONE: minisat (UNSAT = formula valida, SAT = controesempio)
 * 6. OUTPUT: esito, controesempio, eventuale confronto con la tabella di verità
 *
 * MODALITÀ OPERATIVE:
 * - Formula singola (-e): formula passata come argomento
 * - File (-f): ogni riga non vuota del file è una formula
 * - Nessun input esplicito: una formula letta da standard input
 * - Solo codifica (-dimacs): stampa l'istanza DIMACS senza risolverla
 * - Verifica incrociata (-verify): confronto con la tabella di verità e tempi
 */
public final class Main {
    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    /**
     * Parametri linea di comando supportati
     */
    private static final String HELP_PARAM = "-h";
    private static final String FORMULA_PARAM = "-e";
    private static final String FILE_PARAM = "-f";
    private static final String SOLVER_PARAM = "-s";
    private static final String TIMEOUT_PARAM = "-t";
    private static final String DIMACS_PARAM = "-dimacs";
    private static final String VERIFY_PARAM = "-verify";

    /**
     * Configurazioni timeout di default e limiti
     */
    private static final int DEFAULT_TIMEOUT_SECONDS = (int) MiniSatOracle.DEFAULT_TIMEOUT.getSeconds();
    private static final int MIN_TIMEOUT_SECONDS = 1;

    /** Risorsa con la configurazione di java.util.logging */
    private static final String LOGGING_CONFIGURATION = "/logging.properties";

    /**
     * Previene istanziazione - classe utility
     */
    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    /**
     * Punto principale dell'applicazione.
     *
     * @param args parametri linea di comando forniti dall'utente
     */
    public static void main(String[] args) {
        configureLogging();
        int status = run(args, System.in, System.out);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Esegue l'applicazione su flussi espliciti.
     *
     * @param args parametri linea di comando
     * @param stdin flusso da cui leggere la formula se non indicata altrimenti
     * @param out flusso di output per l'utente
     * @return codice di uscita: 0 se tutte le formule sono state elaborate, 1 altrimenti
     */
    static int run(String[] args, InputStream stdin, PrintStream out) {
        try {
            VerifierConfiguration config = new ArgumentParser(out).parse(args);
            if (config == null) {
                return 0; // Help mostrato
            }

            List<String> formulas = loadFormulas(config, stdin);
            boolean success = true;
            for (String formula : formulas) {
                success &= processFormula(formula, config, out);
            }
            return success ? 0 : 1;

        } catch (IllegalArgumentException e) {
            out.println("[E] Errore nella validazione dei parametri: " + e.getMessage());
            out.println("Usa -h per visualizzare l'help completo.");
            return 1;
        } catch (IOException e) {
            out.println("[E] Errore nella lettura dell'input: " + e.getMessage());
            return 1;
        }
    }

    /**
     * Carica la configurazione di logging dal classpath.
     */
    private static void configureLogging() {
        try (InputStream configuration = Main.class.getResourceAsStream(LOGGING_CONFIGURATION)) {
            if (configuration != null) {
                LogManager.getLogManager().readConfiguration(configuration);
            }
        } catch (IOException e) {
            System.err.println("[W] Configurazione logging non caricata: " + e.getMessage());
        }
    }

    //endregion

    //region ELABORAZIONE FORMULE

    /**
     * Raccoglie le formule da elaborare in base alla modalità di input.
     */
    private static List<String> loadFormulas(VerifierConfiguration config, InputStream stdin) throws IOException {
        if (config.formula != null) {
            return List.of(config.formula);
        }

        if (config.inputPath != null) {
            List<String> formulas = new ArrayList<>();
            for (String line : Files.readAllLines(Paths.get(config.inputPath), StandardCharsets.UTF_8)) {
                if (!line.isBlank()) {
                    formulas.add(line);
                }
            }
            return formulas;
        }

        BufferedReader reader = new BufferedReader(new InputStreamReader(stdin, StandardCharsets.UTF_8));
        String line = reader.readLine();
        return List.of(line != null ? line : "");
    }

    /**
     * Elabora una singola formula e stampa l'esito.
     *
     * @return true se la formula è stata elaborata senza errori
     */
    private static boolean processFormula(String text, VerifierConfiguration config, PrintStream out) {
        out.println("-->> FORMULA: " + text.strip() + " <<--");

        try {
            Formula formula = FormulaParser.parse(text);
            if (formula.isEmpty()) {
                out.println("[E] Occorre inserire una formula booleana.");
                return false;
            }

            if (config.dimacsOnly) {
                out.print(DimacsEncoder.encode(TseitinConverter.polyNegatedCnf(formula)));
                return true;
            }

            ValidityChecker checker = new ValidityChecker(new MiniSatOracle(
                    Arrays.asList(config.solver.trim().split("\\s+")),
                    Duration.ofSeconds(config.timeoutSeconds)));

            long start = System.nanoTime();
            ValidityResult result = checker.check(formula);
            long oracleNanos = System.nanoTime() - start;

            displayResult(result, out);

            if (config.verify) {
                return crossCheck(formula, result, oracleNanos, out);
            }
            return true;

        } catch (FormulaParseException e) {
            out.println("[E] Formula formattata in modo errato: " + e.getMessage());
            return false;
        } catch (OracleException e) {
            out.println("[E] Errore del solutore: " + e.getMessage());
            return false;
        }
    }

    /**
     * Stampa l'esito e, per formule non valide, l'assegnamento falsificante.
     */
    private static void displayResult(ValidityResult result, PrintStream out) {
        if (result.isValid()) {
            out.println("La formula È valida.");
            return;
        }

        out.println("La formula NON È valida.");
        out.println("Assegnamento che la falsifica:");
        for (Map.Entry<Integer, Boolean> entry : result.getCountermodel().entrySet()) {
            out.println("  " + Variable.PREFIX + entry.getKey() + " = " + entry.getValue());
        }
    }

    /**
     * Confronta l'esito con la tabella di verità e riporta i tempi dei due metodi.
     */
    private static boolean crossCheck(Formula formula, ValidityResult result, long oracleNanos, PrintStream out) {
        if (formula.usedVariables().size() > TruthTableChecker.MAX_VARIABLES) {
            out.println("[W] Verifica con tabella di verità saltata: più di "
                    + TruthTableChecker.MAX_VARIABLES + " variabili");
            return true;
        }

        long start = System.nanoTime();
        ValidityResult bruteForce = TruthTableChecker.check(formula);
        long bruteForceNanos = System.nanoTime() - start;

        out.println("Tempo impiegato per verificare la validità:");
        out.println("\tTabella di verità: " + (bruteForceNanos / 1e9) + " secondi.");
        out.println("\tConversione NCNF: " + (oracleNanos / 1e9) + " secondi.");

        if (bruteForce.isValid() != result.isValid()) {
            out.println("[E] Esiti discordanti: tabella di verità " + bruteForce + ", solutore " + result);
            return false;
        }
        out.println("[I] Esito confermato dalla tabella di verità.");
        return true;
    }

    //endregion

    //region HELP

    /**
     * Stampa la guida dell'applicazione.
     */
    private static void printApplicationHelp(PrintStream out) {
        out.println("\n===============================================");
        out.println("        VERIFICATORE DI TAUTOLOGIE - GUIDA");
        out.println("===============================================\n");

        out.println("UTILIZZO:");
        out.println("     -e <formula>    Verifica una singola formula");
        out.println("     -f <file>       Verifica ogni riga non vuota del file");
        out.println("     (nessuno)       Legge una formula da standard input");
        out.println("     -s <comando>    Comando del solutore SAT, argomenti inclusi (default: " + MiniSatOracle.DEFAULT_EXECUTABLE + ")");
        out.println("     -t <secondi>    Timeout per formula (min: " + MIN_TIMEOUT_SECONDS
                + ", default: " + DEFAULT_TIMEOUT_SECONDS + ")");
        out.println("     -dimacs         Stampa la CNF della negazione in formato DIMACS senza risolverla");
        out.println("     -verify         Confronta l'esito con la tabella di verità e riporta i tempi");
        out.println("     -h              Mostra questa guida\n");

        out.println("SINTASSI DELLE FORMULE:");
        out.println("  Variabili: A1, A2, ... (indice positivo senza zeri iniziali)");
        out.println("  Connettivi: ~ (not), & (and), v (or), -> (implica)");
        out.println("  Precedenza crescente: ->, v, &, ~ ; operatori binari associativi a destra\n");

        out.println("ESEMPI DI UTILIZZO:");
        out.println("  java -jar verificatore-tautologie.jar -e \"(A1 & A2) -> A1\"");
        out.println("  java -jar verificatore-tautologie.jar -f formule.txt -verify -t 30");
        out.println("  java -jar verificatore-tautologie.jar -e \"A1 v A2\" -dimacs\n");

        out.println("===============================================\n");
    }

    //endregion

    //region CLASSI DI SUPPORTO E CONFIGURAZIONE

    /**
     * Configurazione validata dell'applicazione, immutabile.
     */
    private static class VerifierConfiguration {
        final String formula;
        final String inputPath;
        final String solver;
        final int timeoutSeconds;
        final boolean dimacsOnly;
        final boolean verify;

        VerifierConfiguration(String formula, String inputPath, String solver, int timeoutSeconds,
                              boolean dimacsOnly, boolean verify) {
            this.formula = formula;
            this.inputPath = inputPath;
            this.solver = solver;
            this.timeoutSeconds = timeoutSeconds;
            this.dimacsOnly = dimacsOnly;
            this.verify = verify;
        }
    }

    /**
     * Parser per parametri linea di comando.
     */
    private static class ArgumentParser {

        private final PrintStream out;

        ArgumentParser(PrintStream out) {
            this.out = out;
        }

        /**
         * Processa sequenzialmente tutti i parametri della command line.
         *
         * @param args parametri da linea comando forniti dall'utente
         * @return configurazione validata (null se help richiesto)
         * @throws IllegalArgumentException se parametri non validi
         */
        VerifierConfiguration parse(String[] args) {
            String formula = null;
            String inputPath = null;
            String solver = MiniSatOracle.DEFAULT_EXECUTABLE;
            int timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
            boolean dimacsOnly = false;
            boolean verify = false;

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> {
                        printApplicationHelp(out);
                        return null;
                    }

                    // Formula singola (mutualmente esclusiva con file)
                    case FORMULA_PARAM -> {
                        validateExclusiveInput(inputPath != null);
                        formula = getNextArgument(args, ++i, "formula");
                    }

                    case FILE_PARAM -> {
                        validateExclusiveInput(formula != null);
                        inputPath = getNextArgument(args, ++i, "file");
                        validateFileExists(inputPath);
                    }

                    case SOLVER_PARAM -> solver = getNextArgument(args, ++i, "eseguibile solutore");

                    case TIMEOUT_PARAM -> timeoutSeconds = parseAndValidateTimeout(args, ++i);

                    case DIMACS_PARAM -> dimacsOnly = true;

                    case VERIFY_PARAM -> verify = true;

                    default -> throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
                }
            }

            if (dimacsOnly && verify) {
                throw new IllegalArgumentException("-dimacs e -verify non possono essere combinati");
            }

            return new VerifierConfiguration(formula, inputPath, solver, timeoutSeconds, dimacsOnly, verify);
        }

        private void validateExclusiveInput(boolean otherInputPresent) {
            if (otherInputPresent) {
                throw new IllegalArgumentException("Le modalità -e e -f sono mutualmente esclusive");
            }
        }

        /**
         * Verifica che esista un argomento successivo prima di restituirlo.
         */
        private String getNextArgument(String[] args, int currentIndex, String argumentType) {
            if (currentIndex >= args.length) {
                throw new IllegalArgumentException("Parametro " + args[currentIndex - 1] +
                        " richiede " + argumentType);
            }
            return args[currentIndex];
        }

        private int parseAndValidateTimeout(String[] args, int currentIndex) {
            String timeoutStr = getNextArgument(args, currentIndex, "numero secondi");

            try {
                int timeout = Integer.parseInt(timeoutStr);
                if (timeout < MIN_TIMEOUT_SECONDS) {
                    throw new IllegalArgumentException("Timeout minimo: " + MIN_TIMEOUT_SECONDS + " secondi");
                }
                return timeout;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Valore timeout non valido: " + timeoutStr);
            }
        }

        private void validateFileExists(String filePath) {
            File file = new File(filePath);
            if (!file.exists()) {
                throw new IllegalArgumentException("File non esistente: " + filePath);
            }
            if (!file.isFile()) {
                throw new IllegalArgumentException("Non è un file: " + filePath);
            }
            if (!file.canRead()) {
                throw new IllegalArgumentException("File non leggibile: " + filePath);
            }
        }
    }

    //endregion
}
