package org.taut.cnf;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.ArrayDeque;
import java.util.Deque;

import org.junit.Test;
import org.taut.parser.FormulaParseException;
import org.taut.parser.FormulaParser;
import org.taut.support.Conjunction;
import org.taut.support.Connective;
import org.taut.support.Formula;
import org.taut.support.Negation;
import org.taut.support.Node;
import org.taut.support.Variable;

public class NegationNormalizerTest {

    private static Formula literalized(String text) throws FormulaParseException {
        Formula formula = FormulaParser.parse(text);
        NegationNormalizer.literalize(formula);
        return formula;
    }

    /**
     * Visita iterativa: ogni negazione deve avere una variabile come figlio.
     */
    private static boolean negationsOnlyOnVariables(Formula formula) {
        Deque<Node> stack = new ArrayDeque<>();
        stack.push(formula.getRoot());
        while (!stack.isEmpty()) {
            Node node = stack.pop();
            if (node.type() == Node.Type.NEGATION) {
                if (((Negation) node).getExpression().type() != Node.Type.VARIABLE) {
                    return false;
                }
            } else if (node.type() != Node.Type.VARIABLE) {
                Connective connective = (Connective) node;
                stack.push(connective.getLeft());
                stack.push(connective.getRight());
            }
        }
        return true;
    }

    @Test
    public void deMorgan() throws FormulaParseException {
        Formula formula = literalized("~(A1 v A2)");

        assertEquals("(~A1 & ~A2)", formula.toString());
        assertEquals(1, ((Conjunction) formula.getRoot()).getConnectiveId());
        assertEquals("(~A1 v (A2 v ~A3))", literalized("~(A1 & ~(A2 v ~A3))").toString());
        assertEquals("(A1 & ~A2)", literalized("~(A1 -> A2)").toString());
    }

    @Test
    public void negationChains() throws FormulaParseException {
        assertEquals("A1", literalized("~~A1").toString());
        assertEquals("~A1", literalized("~~~A1").toString());
        assertEquals("(A1 v ~A2)", literalized("~~(A1 v ~~~A2)").toString());
    }

    @Test
    public void idempotent() throws FormulaParseException {
        Formula once = literalized("~((A1 -> ~A2) & ~(A3 v ~~A4)) v ~~~A5");
        Formula twice = once.copy();
        NegationNormalizer.literalize(twice);

        assertEquals(once.getRoot(), twice.getRoot());
        assertTrue(negationsOnlyOnVariables(once));
    }

    @Test
    public void emptyFormulaUnchanged() {
        Formula formula = new Formula();
        NegationNormalizer.literalize(formula);

        assertTrue(formula.isEmpty());
    }

    @Test
    public void longNegationChain() {
        Node node = new Variable(1);
        for (int i = 0; i < 100_000; i++) {
            node = new Negation(node);
        }
        Formula even = new Formula(node, 0);
        NegationNormalizer.literalize(even);
        assertEquals(new Variable(1), even.getRoot());

        Formula odd = new Formula(new Negation(node), 0);
        NegationNormalizer.literalize(odd);
        assertEquals(Node.Type.NEGATION, odd.getRoot().type());
        assertEquals(new Variable(1), ((Negation) odd.getRoot()).getExpression());
    }

    @Test
    public void longConjunctionSpine() {
        int size = 50_000;
        Node spine = new Negation(new Negation(new Variable(size + 1)));
        for (int i = size; i >= 1; i--) {
            spine = new Conjunction(i, new Negation(new Negation(new Negation(new Variable(i)))), spine);
        }
        Formula formula = new Formula(new Negation(spine), size);
        NegationNormalizer.literalize(formula);

        assertTrue(negationsOnlyOnVariables(formula));
        assertEquals(size, formula.countConnectives());
        assertEquals(size + 1, formula.usedVariables().size());
    }
}
