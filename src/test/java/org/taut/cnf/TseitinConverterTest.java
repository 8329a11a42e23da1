package org.taut.cnf;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import org.junit.Test;
import org.taut.parser.FormulaParseException;
import org.taut.parser.FormulaParser;
import org.taut.support.Conjunction;
import org.taut.support.Formula;
import org.taut.support.Negation;
import org.taut.support.NegationChain;
import org.taut.support.Node;
import org.taut.support.Variable;

public class TseitinConverterTest {

    private static String dimacs(String text) throws FormulaParseException {
        return DimacsEncoder.encode(TseitinConverter.polyNegatedCnf(FormulaParser.parse(text)));
    }

    @Test
    public void singleDisjunction() throws FormulaParseException {
        assertEquals("p cnf 3 5\n"
                + "-1 2 3 0\n"
                + "1 2 -3 0\n"
                + "1 -2 3 0\n"
                + "1 -2 -3 0\n"
                + "-1 0\n", dimacs("A1 v A2"));
    }

    @Test
    public void singleConjunction() throws FormulaParseException {
        assertEquals("p cnf 3 5\n"
                + "-1 2 3 0\n"
                + "-1 2 -3 0\n"
                + "-1 -2 3 0\n"
                + "1 -2 -3 0\n"
                + "-1 0\n", dimacs("A1 & A2"));
    }

    @Test
    public void literalRoot() throws FormulaParseException {
        assertEquals("p cnf 1 1\n-1 0\n", dimacs("A1"));
        assertEquals("p cnf 1 1\n1 0\n", dimacs("~A1"));
        assertEquals("p cnf 2 1\n-2 0\n", dimacs("~~A2"));
    }

    @Test
    public void variablesAreOffsetByConnectiveCount() throws FormulaParseException {
        String encoded = dimacs("(A1 & A2) -> A1");

        assertTrue(encoded.startsWith("p cnf 4 9\n"));
        // Gate 2 (implicazione) definita su gate 1 e su A1 = 2 + 1
        assertTrue(encoded.contains("\n-2 1 3 0\n"));
    }

    @Test
    public void clauseCountIsFourPerConnectivePlusOne() throws FormulaParseException {
        for (String text : List.of("A1 v A2", "(A1 & A2) -> A1", "~(A1 v ~(A2 & A3)) -> (A4 -> A1)",
                "((A1 -> A2) & (A2 -> A3)) -> (A1 -> A3)")) {
            Formula source = FormulaParser.parse(text);
            List<List<Integer>> clauses = DimacsEncoder.clauses(TseitinConverter.polyNegatedCnf(source));

            assertEquals(text, 4 * source.countConnectives() + 1, clauses.size());
            for (List<Integer> clause : clauses.subList(0, clauses.size() - 1)) {
                assertEquals(3, clause.size());
            }
            assertEquals(1, clauses.get(clauses.size() - 1).size());
        }
    }

    @Test
    public void sourceIsNotModified() throws FormulaParseException {
        Formula source = FormulaParser.parse("~(A1 v ~A2) -> A3");
        String before = source.toString();

        TseitinConverter.polyNegatedCnf(source);

        assertEquals(before, source.toString());
        assertEquals(2, source.getConnectiveCount());
    }

    @Test
    public void longNegationChain() {
        Node chain = new Variable(1);
        for (int i = 0; i < 100_000; i++) {
            chain = new Negation(chain);
        }
        Formula even = new Formula(chain, 0);
        Formula odd = new Formula(new Negation(chain), 0);

        assertEquals("p cnf 1 1\n-1 0\n", DimacsEncoder.encode(TseitinConverter.polyNegatedCnf(even)));
        assertEquals("p cnf 1 1\n1 0\n", DimacsEncoder.encode(TseitinConverter.polyNegatedCnf(odd)));
        assertEquals(100_000, NegationChain.of(even.getRoot()).getNegations());
    }

    @Test
    public void longConjunctionSpine() {
        int size = 20_000;
        Node spine = new Variable(size + 1);
        for (int i = size; i >= 1; i--) {
            spine = new Conjunction(i, new Negation(new Variable(i)), spine);
        }
        Formula source = new Formula(spine, size);

        List<List<Integer>> clauses = DimacsEncoder.clauses(TseitinConverter.polyNegatedCnf(source));

        assertEquals(4 * size + 1, clauses.size());
        assertEquals(List.of(-1), clauses.get(clauses.size() - 1));
    }

    @Test
    public void conversionLogsBelowInfo() throws FormulaParseException {
        List<LogRecord> published = new ArrayList<>();
        Handler handler = new Handler() {
            @Override
            public void publish(LogRecord record) {
                if (record.getLevel().intValue() >= Level.INFO.intValue()) {
                    published.add(record);
                }
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        };
        Logger logger = Logger.getLogger(TseitinConverter.class.getName());
        logger.addHandler(handler);
        try {
            TseitinConverter.polyNegatedCnf(FormulaParser.parse("(A1 & A2) -> A1"));
        } finally {
            logger.removeHandler(handler);
        }

        assertTrue(published.isEmpty());
    }

    @Test
    public void emptyFormula() {
        Formula cnf = TseitinConverter.polyNegatedCnf(new Formula());

        assertTrue(cnf.isEmpty());
        assertEquals("p cnf 0 0\n", DimacsEncoder.encode(cnf));
    }
}
