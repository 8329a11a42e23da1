package org.taut.support;

/**
 * Variabile proposizionale (foglia). L'identificatore è sempre positivo.
 */
public final class Variable extends Node {

    /** Prefisso testuale delle variabili nella grammatica */
    public static final String PREFIX = "A";

    private final int id;

    /**
     * @param id identificatore della variabile (> 0)
     * @throws IllegalArgumentException se id non positivo
     */
    public Variable(int id) {
        if (id <= 0) {
            throw new IllegalArgumentException("Identificatore variabile deve essere > 0, ricevuto: " + id);
        }
        this.id = id;
    }

    public int getId() {
        return id;
    }

    @Override
    public Type type() {
        return Type.VARIABLE;
    }

    @Override
    Node shallowCopy() {
        return new Variable(id);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        return ((Variable) obj).id == id;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(id);
    }

    @Override
    public String toString() {
        return PREFIX + id;
    }
}
