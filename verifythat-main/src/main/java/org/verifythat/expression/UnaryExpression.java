package org.verifythat.expression;

public final class UnaryExpression extends Expression {

    private final ExpressionType nodeType;
    private final Expression operand;

    UnaryExpression(ExpressionType nodeType, Expression operand, Class<?> type) {
        super(type);
        this.nodeType = nodeType;
        this.operand = operand;
    }

    @Override
    public ExpressionType getNodeType() {
        return nodeType;
    }

    public Expression getOperand() {
        return operand;
    }

    public UnaryExpression update(Expression operand) {
        if (operand == this.operand) {
            return this;
        }
        return new UnaryExpression(nodeType, operand, getType());
    }
}
