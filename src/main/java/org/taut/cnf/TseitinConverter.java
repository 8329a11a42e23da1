package org.taut.cnf;

import org.taut.support.Conjunction;
import org.taut.support.Connective;
import org.taut.support.Disjunction;
import org.taut.support.Formula;
import org.taut.support.Negation;
import org.taut.support.NegationChain;
import org.taut.support.Node;
import org.taut.support.Variable;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.logging.Logger;

/**
 * TRASFORMAZIONE DI TSEITIN - CNF polinomiale della negazione di una formula
 *
 * Produce una nuova formula in CNF soddisfacibile se e solo se è soddisfacibile
 * la negazione della formula di partenza: l'insoddisfacibilità del risultato
 * dimostra che la formula originale è una tautologia.
 *
 * SPAZIO DEI NOMI DELLE VARIABILI (C = connettivi della formula normalizzata):
 * • Gate di un connettivo: il suo stesso identificatore, in 1..C
 * • Variabile originale Ai: C + i
 * La clausola unitaria iniziale usa l'identificatore non traslato se la radice è
 * un connettivo, quello traslato se la radice è un letterale.
 *
 * CLAUSOLE PER CONNETTIVO (x_c ↔ x_l op x_r):
 * • OR:  (~x_c v x_l v x_r), (x_c v x_l v ~x_r), (x_c v ~x_l v x_r), (x_c v ~x_l v ~x_r)
 * • AND: (~x_c v x_l v x_r), (~x_c v x_l v ~x_r), (~x_c v ~x_l v x_r), (x_c v ~x_l v ~x_r)
 *
 * DIMENSIONE: 4 clausole da 3 letterali per connettivo più la clausola unitaria,
 * lineare nel numero di connettivi (la distribuzione di OR su AND è esponenziale).
 */
public final class TseitinConverter {

    private static final Logger LOGGER = Logger.getLogger(TseitinConverter.class.getName());

    /**
     * Letterale di una variabile gate o originale nella formula di arrivo.
     */
    private static final class GateLiteral {
        final int variable;
        final boolean negated;

        GateLiteral(int variable, boolean negated) {
            this.variable = variable;
            this.negated = negated;
        }

        Node toNode() {
            Node node = new Variable(variable);
            return negated ? new Negation(node) : node;
        }

        /**
         * Nodo del letterale, eventualmente negato dal template della clausola.
         * Le doppie negazioni vengono eliminate dalla normalizzazione finale.
         */
        Node toNode(boolean negatedInTemplate) {
            return negatedInTemplate ? new Negation(toNode()) : toNode();
        }
    }

    private TseitinConverter() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //region INTERFACCIA PUBBLICA

    /**
     * METODO PRINCIPALE - CNF equisoddisfacibile della negazione
     *
     * PIPELINE:
     * 1. Copia privata della formula e normalizzazione delle negazioni
     * 2. Clausola unitaria "la formula intera è falsa"
     * 3. Quattro clausole di definizione per ogni connettivo raggiungibile
     * 4. Normalizzazione finale per eliminare le doppie negazioni
     *
     * @param source formula di partenza (non modificata)
     * @return nuova formula in CNF, vuota se la formula di partenza è vuota
     */
    public static Formula polyNegatedCnf(Formula source) {
        Formula target = new Formula();
        if (source.isEmpty()) {
            return target;
        }

        Formula literalized = source.copy();
        NegationNormalizer.literalize(literalized);
        int offset = literalized.getConnectiveCount();

        LOGGER.fine("Inizio trasformazione Tseitin: " + offset + " connettivi, offset variabili " + offset);

        // ~(intera formula) come singolo letterale
        GateLiteral top = gateLiteral(literalized.getRoot(), offset);
        target.replaceRoot(new Negation(top.toNode()));

        Deque<Connective> stack = new ArrayDeque<>();
        if (isConnective(literalized.getRoot())) {
            stack.push((Connective) literalized.getRoot());
        }

        int definedGates = 0;
        while (!stack.isEmpty()) {
            Connective current = stack.pop();
            addDefiningClauses(target, current, offset);
            definedGates++;

            for (Node child : new Node[] {current.getLeft(), current.getRight()}) {
                Node base = NegationChain.of(child).getBase();
                if (isConnective(base)) {
                    stack.push((Connective) base);
                }
            }
        }

        NegationNormalizer.literalize(target);

        LOGGER.fine("CNF di Tseitin generata: " + (4 * definedGates + 1) + " clausole per " + definedGates + " connettivi");
        return target;
    }

    //endregion

    //region GENERAZIONE CLAUSOLE

    /**
     * Antepone alla spina di congiunzioni le quattro clausole del connettivo.
     */
    private static void addDefiningClauses(Formula target, Connective current, int offset) {
        GateLiteral gate = new GateLiteral(current.getConnectiveId(), false);
        GateLiteral left = gateLiteral(current.getLeft(), offset);
        GateLiteral right = gateLiteral(current.getRight(), offset);

        Node[] clauses = switch (current.type()) {
            case DISJUNCTION -> new Node[] {
                    clause(target, gate, true, left, false, right, false),     // F v F -> F
                    clause(target, gate, false, left, false, right, true),     // F v T -> T
                    clause(target, gate, false, left, true, right, false),     // T v F -> T
                    clause(target, gate, false, left, true, right, true)       // T v T -> T
            };
            case CONJUNCTION -> new Node[] {
                    clause(target, gate, true, left, false, right, false),     // F & F -> F
                    clause(target, gate, true, left, false, right, true),      // F & T -> F
                    clause(target, gate, true, left, true, right, false),      // T & F -> F
                    clause(target, gate, false, left, true, right, true)       // T & T -> T
            };
            case VARIABLE, NEGATION -> throw new IllegalStateException("Nodo non connettivo: " + current);
        };

        Node spine = target.getRoot();
        target.replaceRoot(new Conjunction(target.nextConnectiveId(), clauses[0],
                new Conjunction(target.nextConnectiveId(), clauses[1],
                        new Conjunction(target.nextConnectiveId(), clauses[2],
                                new Conjunction(target.nextConnectiveId(), clauses[3], spine)))));
    }

    /**
     * Clausola a tre letterali (a v (b v c)) con i segni del template.
     */
    private static Node clause(Formula target,
                               GateLiteral a, boolean negateA,
                               GateLiteral b, boolean negateB,
                               GateLiteral c, boolean negateC) {
        return new Disjunction(target.nextConnectiveId(), a.toNode(negateA),
                new Disjunction(target.nextConnectiveId(), b.toNode(negateB), c.toNode(negateC)));
    }

    /**
     * Letterale gate di un figlio: identificatore proprio per i connettivi,
     * identificatore traslato per le variabili, negazione singola preservata.
     */
    private static GateLiteral gateLiteral(Node node, int offset) {
        NegationChain chain = NegationChain.of(node);
        int variable = switch (chain.getBase().type()) {
            case CONJUNCTION, DISJUNCTION -> ((Connective) chain.getBase()).getConnectiveId();
            case VARIABLE -> offset + ((Variable) chain.getBase()).getId();
            case NEGATION -> throw new IllegalStateException("Catena di negazioni non risolta: " + node);
        };
        return new GateLiteral(variable, chain.isNegated());
    }

    private static boolean isConnective(Node node) {
        return switch (node.type()) {
            case CONJUNCTION, DISJUNCTION -> true;
            case VARIABLE, NEGATION -> false;
        };
    }

    //endregion
}
