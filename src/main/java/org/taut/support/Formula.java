package org.taut.support;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * FORMULA PROPOSIZIONALE - Albero sintattico con contatore dei connettivi
 *
 * Possiede in esclusiva il proprio grafo di nodi e il contatore monotono che
 * assegna gli identificatori ai connettivi. Ogni formula ha un proprio spazio di
 * identificatori: due formule non condividono mai il contatore.
 *
 * CICLO DI VITA:
 * • Creata una volta dal parser (o vuota, per la formula senza token)
 * • Eventualmente normalizzata in loco (sostituzione di sottoalberi)
 * • Usata come input per costruire una nuova formula in CNF
 *
 * INVARIANTI:
 * • La radice è assente solo per la formula vuota
 * • Gli identificatori dei connettivi sono unici e compresi in 1..getConnectiveCount()
 */
public class Formula {

    //region STATO

    /** Radice dell'albero, null per la formula vuota */
    private Node root;

    /** Ultimo identificatore di connettivo assegnato */
    private int connectiveCount;

    //endregion

    //region COSTRUZIONE

    /**
     * Crea una formula vuota con contatore a zero.
     */
    public Formula() {
        this(null, 0);
    }

    /**
     * Crea una formula da una radice già costruita.
     *
     * @param root radice (null per la formula vuota)
     * @param connectiveCount valore corrente del contatore dei connettivi (>= 0)
     */
    public Formula(Node root, int connectiveCount) {
        if (connectiveCount < 0) {
            throw new IllegalArgumentException("Contatore connettivi non può essere negativo: " + connectiveCount);
        }
        this.root = root;
        this.connectiveCount = connectiveCount;
    }

    /**
     * Assegna il prossimo identificatore di connettivo (pre-incremento).
     *
     * @return nuovo identificatore, strettamente maggiore dei precedenti
     */
    public int nextConnectiveId() {
        return ++connectiveCount;
    }

    //endregion

    //region ACCESSORS

    public Node getRoot() {
        return root;
    }

    public boolean isEmpty() {
        return root == null;
    }

    /**
     * @return numero di identificatori di connettivo assegnati finora
     */
    public int getConnectiveCount() {
        return connectiveCount;
    }

    /**
     * Sostituisce la radice. Usato dal parser e dalla normalizzazione.
     */
    public void replaceRoot(Node root) {
        this.root = root;
    }

    //endregion

    //region INTERROGAZIONI SULLA STRUTTURA

    /**
     * Copia profonda: stessa struttura, stessi identificatori, stesso contatore.
     */
    public Formula copy() {
        return new Formula(root != null ? root.deepCopy() : null, connectiveCount);
    }

    /**
     * Identificatori delle variabili originali presenti nella formula,
     * raccolti con uno stack esplicito.
     *
     * @return insieme ordinato e non modificabile degli identificatori
     */
    public SortedSet<Integer> usedVariables() {
        SortedSet<Integer> used = new TreeSet<>();
        if (root != null) {
            Deque<Node> stack = new ArrayDeque<>();
            stack.push(root);
            while (!stack.isEmpty()) {
                Node base = NegationChain.of(stack.pop()).getBase();
                if (base.type() != Node.Type.VARIABLE) {
                    Connective connective = (Connective) base;
                    stack.push(connective.getLeft());
                    stack.push(connective.getRight());
                } else {
                    used.add(((Variable) base).getId());
                }
            }
        }
        return Collections.unmodifiableSortedSet(used);
    }

    /**
     * Conta i nodi connettivo effettivamente presenti nell'albero.
     */
    public int countConnectives() {
        int count = 0;
        if (root != null) {
            Deque<Node> stack = new ArrayDeque<>();
            stack.push(root);
            while (!stack.isEmpty()) {
                Node base = NegationChain.of(stack.pop()).getBase();
                if (base.type() != Node.Type.VARIABLE) {
                    Connective connective = (Connective) base;
                    count++;
                    stack.push(connective.getLeft());
                    stack.push(connective.getRight());
                }
            }
        }
        return count;
    }

    //endregion

    @Override
    public String toString() {
        return root != null ? root.toString() : "";
    }
}
