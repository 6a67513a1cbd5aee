package org.verifythat.expression;

public final class ConditionalExpression extends Expression {

    private final Expression test;
    private final Expression ifTrue;
    private final Expression ifFalse;

    ConditionalExpression(Expression test, Expression ifTrue, Expression ifFalse, Class<?> type) {
        super(type);
        this.test = test;
        this.ifTrue = ifTrue;
        this.ifFalse = ifFalse;
    }

    @Override
    public ExpressionType getNodeType() {
        return ExpressionType.CONDITIONAL;
    }

    public Expression getTest() {
        return test;
    }

    public Expression getIfTrue() {
        return ifTrue;
    }

    public Expression getIfFalse() {
        return ifFalse;
    }

    public ConditionalExpression update(Expression test, Expression ifTrue, Expression ifFalse) {
        if (test == this.test && ifTrue == this.ifTrue && ifFalse == this.ifFalse) {
            return this;
        }
        return new ConditionalExpression(test, ifTrue, ifFalse, getType());
    }
}
