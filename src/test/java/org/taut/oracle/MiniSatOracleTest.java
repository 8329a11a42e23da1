package org.taut.oracle;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.junit.Assume.assumeTrue;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

/**
 * Il solutore è sostituito da piccoli script di shell che rispettano il
 * protocollo di minisat (file di richiesta e risposta, codici 10 e 20).
 */
public class MiniSatOracleTest {

    private static final String SHELL = "/bin/sh";
    private static final String REQUEST = "p cnf 2 2\n1 -2 0\n2 0\n";

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Before
    public void requireShell() {
        assumeTrue(new File(SHELL).canExecute());
    }

    private MiniSatOracle oracle(String script, Duration timeout) throws IOException {
        File file = folder.newFile();
        Files.writeString(file.toPath(), script, StandardCharsets.UTF_8);
        return new MiniSatOracle(List.of(SHELL, file.getAbsolutePath()), timeout);
    }

    private MiniSatOracle oracle(String script) throws IOException {
        return oracle(script, Duration.ofSeconds(10));
    }

    @Test
    public void satisfiable() throws IOException {
        OracleAnswer answer = oracle("printf 'SAT\\n1 -2 3 0\\n' > \"$2\"\nexit 10\n").solve(REQUEST);

        assertTrue(answer.isSatisfiable());
        assertEquals(List.of(1, -2, 3), answer.getModel());
    }

    @Test
    public void modelStopsAtTerminator() throws IOException {
        OracleAnswer answer = oracle("printf 'SAT\\n-1 2 0 7\\n' > \"$2\"\nexit 10\n").solve(REQUEST);

        assertEquals(List.of(-1, 2), answer.getModel());
    }

    @Test
    public void unsatisfiable() throws IOException {
        OracleAnswer answer = oracle("printf 'UNSAT\\n' > \"$2\"\nexit 20\n").solve(REQUEST);

        assertFalse(answer.isSatisfiable());
        assertTrue(answer.getModel().isEmpty());
    }

    @Test
    public void requestIsWrittenToFreshFilesRemovedAfterwards() throws IOException {
        File copy = new File(folder.getRoot(), "copy.cnf");
        File paths = new File(folder.getRoot(), "paths.txt");
        oracle("cp \"$1\" '" + copy.getAbsolutePath() + "'\n"
                + "printf '%s\\n%s\\n' \"$1\" \"$2\" > '" + paths.getAbsolutePath() + "'\n"
                + "exit 20\n").solve(REQUEST);

        assertEquals(REQUEST, Files.readString(copy.toPath(), StandardCharsets.US_ASCII));
        List<String> used = Files.readAllLines(paths.toPath(), StandardCharsets.UTF_8);
        assertEquals(2, used.size());
        for (String path : used) {
            Path temporary = Paths.get(path);
            assertFalse(path, Files.exists(temporary));
        }
    }

    @Test
    public void unknownExitCode() throws IOException {
        try {
            oracle("exit 3\n").solve(REQUEST);
            fail("Codice di uscita sconosciuto accettato");
        } catch (OracleException e) {
            assertTrue(e.getMessage().contains("3"));
        }
    }

    @Test(expected = OracleException.class)
    public void unrecognizedResponse() throws IOException {
        oracle("printf 'INDET\\n' > \"$2\"\nexit 10\n").solve(REQUEST);
    }

    @Test(expected = OracleException.class)
    public void invalidLiteral() throws IOException {
        oracle("printf 'SAT\\n1 x 0\\n' > \"$2\"\nexit 10\n").solve(REQUEST);
    }

    @Test
    public void timeout() throws IOException {
        Duration timeout = Duration.ofMillis(200);
        try {
            oracle("sleep 5\nexit 20\n", timeout).solve(REQUEST);
            fail("Timeout non rilevato");
        } catch (OracleTimeoutException e) {
            assertEquals(timeout, e.getTimeout());
        }
    }

    @Test(expected = OracleException.class)
    public void missingExecutable() throws IOException {
        File missing = new File(folder.getRoot(), "minisat-mancante");
        new MiniSatOracle(missing.getAbsolutePath(), Duration.ofSeconds(1)).solve(REQUEST);
    }

    @Test(expected = IllegalArgumentException.class)
    public void timeoutMustBePositive() {
        new MiniSatOracle(MiniSatOracle.DEFAULT_EXECUTABLE, Duration.ZERO);
    }
}
