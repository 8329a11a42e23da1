package org.taut.support;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * NODO DELL'ALBERO SINTATTICO - Gerarchia chiusa delle formule proposizionali
 *
 * Le quattro varianti ammesse sono {@link Variable}, {@link Negation},
 * {@link Conjunction} e {@link Disjunction}: i costruttori delle classi base
 * sono visibili solo nel package. Ogni nodo espone il proprio {@link Type} e gli
 * attraversamenti usano switch expression sul tipo, così il compilatore
 * verifica che tutti i casi siano gestiti.
 *
 * PROPRIETÀ DELL'ALBERO:
 * • Ogni nodo appartiene a un solo padre (nessuna condivisione, nessun ciclo)
 * • Dopo la costruzione l'unica modifica ammessa è la sostituzione di sottoalberi
 * • Copia profonda iterativa, profondità limitata solo dalla memoria
 * • Stampa, uguaglianza e valutazione sono ricorsive: la loro profondità è
 *   quella ammessa dal parser ({@code FormulaParser.MAX_DEPTH})
 */
public abstract class Node {

    /**
     * Tipi di nodo supportati.
     */
    public enum Type {
        VARIABLE,       // Variabile: A1, A2, ...
        NEGATION,       // Negazione: ~F
        CONJUNCTION,    // Congiunzione: F & G
        DISJUNCTION     // Disgiunzione: F v G
    }

    /**
     * Posizione del sottoalbero sorgente da copiare e punto di aggancio nella copia.
     */
    private static final class PendingCopy {
        final Node source;
        final Node copyParent;
        final boolean leftChild;

        PendingCopy(Node source, Node copyParent, boolean leftChild) {
            this.source = source;
            this.copyParent = copyParent;
            this.leftChild = leftChild;
        }
    }

    Node() {
    }

    /**
     * @return tipo del nodo corrente
     */
    public abstract Type type();

    /**
     * Copia del solo nodo: i figli restano quelli del nodo sorgente finché
     * {@link #deepCopy()} non li sostituisce con le loro copie.
     */
    abstract Node shallowCopy();

    /**
     * Copia profonda del sottoalbero, identificatori inclusi, con uno stack
     * esplicito di (nodo sorgente, padre nella copia, lato).
     */
    public final Node deepCopy() {
        Node copyRoot = null;
        Deque<PendingCopy> stack = new ArrayDeque<>();
        stack.push(new PendingCopy(this, null, true));

        while (!stack.isEmpty()) {
            PendingCopy pending = stack.pop();
            Node copy = pending.source.shallowCopy();

            if (pending.copyParent == null) {
                copyRoot = copy;
            } else if (pending.copyParent.type() == Type.NEGATION) {
                ((Negation) pending.copyParent).replaceExpression(copy);
            } else {
                ((Connective) pending.copyParent).replaceChild(pending.leftChild, copy);
            }

            switch (copy.type()) {
                case NEGATION -> stack.push(new PendingCopy(((Negation) copy).getExpression(), copy, true));
                case CONJUNCTION, DISJUNCTION -> {
                    Connective connective = (Connective) copy;
                    stack.push(new PendingCopy(connective.getLeft(), copy, true));
                    stack.push(new PendingCopy(connective.getRight(), copy, false));
                }
                case VARIABLE -> {
                    // foglia
                }
            }
        }
        return copyRoot;
    }
}
