package org.taut.support;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Map;

import org.junit.Test;
import org.taut.parser.FormulaParseException;
import org.taut.parser.FormulaParser;

public class TruthTableCheckerTest {

    @Test
    public void evaluate() throws FormulaParseException {
        Formula formula = FormulaParser.parse("A1 -> A2 & ~A3");

        assertTrue(FormulaEvaluator.evaluate(formula, Map.of(1, false, 2, false, 3, true)));
        assertTrue(FormulaEvaluator.evaluate(formula, Map.of(1, true, 2, true, 3, false)));
        assertFalse(FormulaEvaluator.evaluate(formula, Map.of(1, true, 2, true, 3, true)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void evaluateRequiresEveryVariable() throws FormulaParseException {
        FormulaEvaluator.evaluate(FormulaParser.parse("A1 & A2"), Map.of(1, true));
    }

    @Test
    public void tautologies() throws FormulaParseException {
        assertTrue(TruthTableChecker.check(FormulaParser.parse("A1 v ~A1")).isValid());
        assertTrue(TruthTableChecker.check(FormulaParser.parse("A1 -> A1")).isValid());
        assertTrue(TruthTableChecker.check(FormulaParser.parse("(A1 & A2) -> A1")).isValid());
        assertTrue(TruthTableChecker.check(FormulaParser.parse("((A1 -> A2) & (A2 -> A3)) -> (A1 -> A3)")).isValid());
    }

    @Test
    public void falsifyingAssignment() throws FormulaParseException {
        ValidityResult result = TruthTableChecker.check(FormulaParser.parse("(A1 v A2) -> A1"));

        assertFalse(result.isValid());
        assertEquals(Map.of(1, false, 2, true), result.getCountermodel());
    }

    @Test
    public void resultFormatting() {
        assertEquals("VALIDA", ValidityResult.valid().toString());
        assertEquals("NON VALIDA {A1 = false, A2 = true}", ValidityResult.invalid(Map.of(2, true, 1, false)).toString());
    }

    @Test(expected = IllegalArgumentException.class)
    public void emptyFormulaIsRejected() {
        TruthTableChecker.check(new Formula());
    }
}
