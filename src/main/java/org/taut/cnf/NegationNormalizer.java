package org.taut.cnf;

import org.taut.support.Conjunction;
import org.taut.support.Connective;
import org.taut.support.Disjunction;
import org.taut.support.Formula;
import org.taut.support.Negation;
import org.taut.support.NegationChain;
import org.taut.support.Node;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * NORMALIZZAZIONE DELLE NEGAZIONI - Forma normale negativa in loco
 *
 * Spinge tutte le negazioni verso le variabili applicando le leggi di De Morgan
 * ed elimina le catene di negazioni. Lavora su uno stack esplicito di posizioni
 * (nodo, padre, lato), quindi la profondità gestibile dipende solo dalla memoria.
 *
 * TRASFORMAZIONI APPLICATE (n = negazioni consecutive sopra il nodo base):
 * • n pari: la posizione riceve direttamente il nodo base
 * • n dispari, base F v G: diventa ~F &amp; ~G
 * • n dispari, base F &amp; G: diventa ~F v ~G
 * • n dispari, base variabile: resta una sola negazione sopra la variabile
 *
 * I connettivi prodotti da De Morgan mantengono l'identificatore del nodo
 * originale. Al termine ogni negazione ha come figlio una variabile.
 */
public final class NegationNormalizer {

    private static final Logger LOGGER = Logger.getLogger(NegationNormalizer.class.getName());

    /**
     * Posizione da riesaminare: nodo, padre (null per la radice) e lato.
     */
    private static final class Position {
        final Node node;
        final Connective parent;
        final boolean leftChild;

        Position(Node node, Connective parent, boolean leftChild) {
            this.node = node;
            this.parent = parent;
            this.leftChild = leftChild;
        }
    }

    private NegationNormalizer() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Porta la formula in forma normale negativa, modificandola in loco.
     *
     * @param formula formula da normalizzare (la formula vuota resta invariata)
     */
    public static void literalize(Formula formula) {
        if (formula.isEmpty()) {
            return;
        }

        Deque<Position> stack = new ArrayDeque<>();
        stack.push(new Position(formula.getRoot(), null, true));

        while (!stack.isEmpty()) {
            Position current = stack.pop();
            NegationChain chain = NegationChain.of(current.node);
            Node replacement = rewrite(current.node, chain);

            place(formula, current, replacement);

            if (replacement.type() == Node.Type.CONJUNCTION || replacement.type() == Node.Type.DISJUNCTION) {
                Connective connective = (Connective) replacement;
                stack.push(new Position(connective.getLeft(), connective, true));
                stack.push(new Position(connective.getRight(), connective, false));
            }
        }

        if (LOGGER.isLoggable(Level.FINEST)) {
            LOGGER.finest("Formula normalizzata: " + formula);
        }
    }

    /**
     * Calcola il nodo che deve occupare la posizione della catena.
     */
    private static Node rewrite(Node head, NegationChain chain) {
        Node base = chain.getBase();
        if (!chain.isNegated()) {
            return base;
        }

        return switch (base.type()) {
            case DISJUNCTION -> {
                Disjunction disjunction = (Disjunction) base;
                yield new Conjunction(disjunction.getConnectiveId(),
                        new Negation(disjunction.getLeft()), new Negation(disjunction.getRight()));
            }
            case CONJUNCTION -> {
                Conjunction conjunction = (Conjunction) base;
                yield new Disjunction(conjunction.getConnectiveId(),
                        new Negation(conjunction.getLeft()), new Negation(conjunction.getRight()));
            }
            case VARIABLE -> {
                // Con n dispari la testa della catena è una negazione: la si aggancia al nodo base
                Negation literal = (Negation) head;
                literal.replaceExpression(base);
                yield literal;
            }
            case NEGATION -> throw new IllegalStateException("Catena di negazioni non risolta: " + head);
        };
    }

    /**
     * Sostituisce il contenuto della posizione nel padre o nella radice.
     */
    private static void place(Formula formula, Position position, Node replacement) {
        if (position.parent == null) {
            formula.replaceRoot(replacement);
        } else {
            position.parent.replaceChild(position.leftChild, replacement);
        }
    }
}
