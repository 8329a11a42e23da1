package org.taut.support;

/**
 * Congiunzione binaria {@code (left & right)}.
 */
public final class Conjunction extends Connective {

    public Conjunction(int connectiveId, Node left, Node right) {
        super(connectiveId, left, right);
    }

    @Override
    public Type type() {
        return Type.CONJUNCTION;
    }

    @Override
    protected String symbol() {
        return "&";
    }

    @Override
    Node shallowCopy() {
        return new Conjunction(getConnectiveId(), getLeft(), getRight());
    }
}
