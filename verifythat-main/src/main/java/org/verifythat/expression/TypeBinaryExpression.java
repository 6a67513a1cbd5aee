package org.verifythat.expression;

/**
 * An {@code instanceof} style test of a value against a type.
 */
public final class TypeBinaryExpression extends Expression {

    private final Expression expression;
    private final Class<?> typeOperand;

    TypeBinaryExpression(Expression expression, Class<?> typeOperand) {
        super(boolean.class);
        this.expression = expression;
        this.typeOperand = typeOperand;
    }

    @Override
    public ExpressionType getNodeType() {
        return ExpressionType.TYPE_IS;
    }

    public Expression getExpression() {
        return expression;
    }

    public Class<?> getTypeOperand() {
        return typeOperand;
    }

    public TypeBinaryExpression update(Expression expression) {
        if (expression == this.expression) {
            return this;
        }
        return new TypeBinaryExpression(expression, typeOperand);
    }
}
