package org.verifythat.expression;

public final class BinaryExpression extends Expression {

    private final ExpressionType nodeType;
    private final Expression left;
    private final Expression right;

    BinaryExpression(ExpressionType nodeType, Expression left, Expression right, Class<?> type) {
        super(type);
        this.nodeType = nodeType;
        this.left = left;
        this.right = right;
    }

    @Override
    public ExpressionType getNodeType() {
        return nodeType;
    }

    public Expression getLeft() {
        return left;
    }

    public Expression getRight() {
        return right;
    }

    public BinaryExpression update(Expression left, Expression right) {
        if (left == this.left && right == this.right) {
            return this;
        }
        return new BinaryExpression(nodeType, left, right, getType());
    }
}
