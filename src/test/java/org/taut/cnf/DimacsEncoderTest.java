package org.taut.cnf;

import static org.junit.Assert.assertEquals;

import java.util.List;

import org.junit.Test;
import org.taut.support.Conjunction;
import org.taut.support.Disjunction;
import org.taut.support.Formula;
import org.taut.support.Negation;
import org.taut.support.Variable;

public class DimacsEncoderTest {

    @Test
    public void clausesInOrder() {
        Formula cnf = new Formula(new Conjunction(1, new Variable(1),
                new Conjunction(2, new Negation(new Variable(2)),
                        new Disjunction(3, new Variable(1), new Variable(2)))), 3);

        assertEquals("p cnf 2 3\n1 0\n-2 0\n1 2 0\n", DimacsEncoder.encode(cnf));
    }

    @Test
    public void leftNestedClauseKeepsLiteralOrder() {
        Formula cnf = new Formula(new Disjunction(1,
                new Disjunction(2, new Variable(3), new Negation(new Variable(1))), new Variable(7)), 2);

        assertEquals(List.of(List.of(3, -1, 7)), DimacsEncoder.clauses(cnf));
        assertEquals("p cnf 7 1\n3 -1 7 0\n", DimacsEncoder.encode(cnf));
    }

    @Test
    public void doubleNegationIsPositive() {
        Formula cnf = new Formula(new Negation(new Negation(new Variable(4))), 0);

        assertEquals("p cnf 4 1\n4 0\n", DimacsEncoder.encode(cnf));
    }

    @Test(expected = CNFViolationException.class)
    public void conjunctionInsideClause() {
        DimacsEncoder.encode(new Formula(new Disjunction(1, new Variable(1),
                new Conjunction(2, new Variable(2), new Variable(3))), 2));
    }

    @Test(expected = CNFViolationException.class)
    public void negatedConnectiveInsideClause() {
        DimacsEncoder.encode(new Formula(new Disjunction(1, new Variable(1),
                new Negation(new Disjunction(2, new Variable(2), new Variable(3)))), 2));
    }

    @Test
    public void emptyFormula() {
        assertEquals("p cnf 0 0\n", DimacsEncoder.encode(new Formula()));
    }
}
