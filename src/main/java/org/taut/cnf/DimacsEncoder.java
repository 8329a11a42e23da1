package org.taut.cnf;

import org.taut.support.Conjunction;
import org.taut.support.Disjunction;
import org.taut.support.Formula;
import org.taut.support.NegationChain;
import org.taut.support.Node;
import org.taut.support.Variable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.logging.Logger;

/**
 * CODIFICA DIMACS - Serializzazione di una formula CNF per il solutore esterno
 *
 * Formato prodotto:
 * <pre>
 * p cnf &lt;variabile massima&gt; &lt;numero clausole&gt;
 * &lt;letterali con segno separati da spazio&gt; 0
 * </pre>
 * Una riga per clausola, letterali negativi per le variabili negate. Clausole e
 * letterali sono emessi da sinistra a destra.
 */
public final class DimacsEncoder {

    private static final Logger LOGGER = Logger.getLogger(DimacsEncoder.class.getName());

    /** Terminatore clausola nel formato DIMACS */
    private static final int CLAUSE_TERMINATOR = 0;

    /** Prefisso header problema nel formato DIMACS */
    private static final String PROBLEM_PREFIX = "p cnf";

    private DimacsEncoder() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Codifica la formula in testo DIMACS.
     *
     * @param cnf formula in CNF (spina di congiunzioni di clausole)
     * @return testo DIMACS terminato da newline
     * @throws CNFViolationException se una clausola contiene una congiunzione
     */
    public static String encode(Formula cnf) {
        List<List<Integer>> clauses = clauses(cnf);

        int maxVariable = 0;
        StringBuilder body = new StringBuilder();
        for (List<Integer> clause : clauses) {
            for (int literal : clause) {
                maxVariable = Math.max(maxVariable, Math.abs(literal));
                body.append(literal).append(' ');
            }
            body.append(CLAUSE_TERMINATOR).append('\n');
        }

        LOGGER.fine("DIMACS generato: " + maxVariable + " variabili, " + clauses.size() + " clausole");
        return PROBLEM_PREFIX + " " + maxVariable + " " + clauses.size() + "\n" + body;
    }

    /**
     * Estrae le clausole in forma numerica, con stack espliciti.
     *
     * @param cnf formula in CNF
     * @return clausole come liste di letterali con segno
     * @throws CNFViolationException se la formula non è in CNF
     */
    public static List<List<Integer>> clauses(Formula cnf) {
        List<List<Integer>> clauses = new ArrayList<>();
        if (cnf.isEmpty()) {
            return clauses;
        }

        Deque<Node> spine = new ArrayDeque<>();
        spine.push(cnf.getRoot());
        while (!spine.isEmpty()) {
            Node current = spine.pop();
            if (current.type() == Node.Type.CONJUNCTION) {
                Conjunction conjunction = (Conjunction) current;
                spine.push(conjunction.getRight());
                spine.push(conjunction.getLeft());
            } else {
                clauses.add(literals(current));
            }
        }
        return clauses;
    }

    /**
     * Letterali di una singola clausola.
     */
    private static List<Integer> literals(Node clause) {
        List<Integer> literals = new ArrayList<>();
        Deque<Node> stack = new ArrayDeque<>();
        stack.push(clause);

        while (!stack.isEmpty()) {
            Node current = stack.pop();
            switch (current.type()) {
                case DISJUNCTION -> {
                    stack.push(((Disjunction) current).getRight());
                    stack.push(((Disjunction) current).getLeft());
                }
                case CONJUNCTION -> throw new CNFViolationException("La formula non è in CNF: congiunzione nella clausola " + clause);
                case VARIABLE, NEGATION -> {
                    NegationChain chain = NegationChain.of(current);
                    if (chain.getBase().type() != Node.Type.VARIABLE) {
                        throw new CNFViolationException("La formula non è in CNF: connettivo negato nella clausola " + clause);
                    }
                    Variable variable = (Variable) chain.getBase();
                    literals.add(chain.isNegated() ? -variable.getId() : variable.getId());
                }
            }
        }
        return literals;
    }
}
