package org.taut.support;

import java.util.Objects;

/**
 * CONNETTIVO BINARIO - Base comune di congiunzione e disgiunzione
 *
 * Ogni connettivo porta un identificatore positivo assegnato dal contatore della
 * {@link Formula} proprietaria nell'ordine di costruzione. L'identificatore
 * sopravvive alle leggi di De Morgan: la normalizzazione sostituisce il nodo con
 * il connettivo duale mantenendo lo stesso identificatore, che diventa la
 * variabile gate nella trasformazione di Tseitin.
 */
public abstract class Connective extends Node {

    private final int connectiveId;
    private Node left;
    private Node right;

    Connective(int connectiveId, Node left, Node right) {
        if (connectiveId <= 0) {
            throw new IllegalArgumentException("Identificatore connettivo deve essere > 0, ricevuto: " + connectiveId);
        }
        if (left == null || right == null) {
            throw new IllegalArgumentException("Operandi del connettivo non possono essere null");
        }
        this.connectiveId = connectiveId;
        this.left = left;
        this.right = right;
    }

    public int getConnectiveId() {
        return connectiveId;
    }

    public Node getLeft() {
        return left;
    }

    public Node getRight() {
        return right;
    }

    /**
     * Sostituisce l'operando sinistro o destro. Usato solo dalla normalizzazione.
     */
    public void replaceChild(boolean leftChild, Node child) {
        Objects.requireNonNull(child, "child");
        if (leftChild) {
            this.left = child;
        } else {
            this.right = child;
        }
    }

    /**
     * Simbolo del connettivo nella grammatica.
     */
    protected abstract String symbol();

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        Connective other = (Connective) obj;
        return other.connectiveId == connectiveId && other.left.equals(left) && other.right.equals(right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type(), connectiveId, left, right);
    }

    @Override
    public String toString() {
        return "(" + left + " " + symbol() + " " + right + ")";
    }
}
