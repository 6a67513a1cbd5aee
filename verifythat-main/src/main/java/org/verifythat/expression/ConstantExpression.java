package org.verifythat.expression;

public final class ConstantExpression extends Expression {

    private final Object value;

    ConstantExpression(Object value, Class<?> type) {
        super(type);
        this.value = value;
    }

    @Override
    public ExpressionType getNodeType() {
        return ExpressionType.CONSTANT;
    }

    public Object getValue() {
        return value;
    }
}
