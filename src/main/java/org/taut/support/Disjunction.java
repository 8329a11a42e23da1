package org.taut.support;

/**
 * Disgiunzione binaria {@code (left v right)}. Anche le implicazioni vengono
 * rappresentate così: {@code a -> b} diventa {@code (~a v b)}.
 */
public final class Disjunction extends Connective {

    public Disjunction(int connectiveId, Node left, Node right) {
        super(connectiveId, left, right);
    }

    @Override
    public Type type() {
        return Type.DISJUNCTION;
    }

    @Override
    protected String symbol() {
        return "v";
    }

    @Override
    Node shallowCopy() {
        return new Disjunction(getConnectiveId(), getLeft(), getRight());
    }
}
