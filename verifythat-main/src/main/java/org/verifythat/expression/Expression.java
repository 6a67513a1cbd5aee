package org.verifythat.expression;

/**
 * Base class of the immutable expression tree.
 * <p>
 * Every node knows its kind and the static type of the value it produces. Nodes are built through
 * {@link Expressions} and never change after construction; a rewrite produces new nodes and shares
 * every unchanged subtree.
 */
public abstract class Expression {

    private final Class<?> type;

    protected Expression(Class<?> type) {
        if (type == null) {
            throw new IllegalArgumentException("Expression type must not be null");
        }
        this.type = type;
    }

    public abstract ExpressionType getNodeType();

    public Class<?> getType() {
        return type;
    }

    @Override
    public String toString() {
        return getNodeType() + "<" + type.getSimpleName() + ">";
    }
}
