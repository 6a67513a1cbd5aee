package org.verifythat.expression;

import java.util.function.Supplier;

/**
 * A parameterless function of its body. Evaluates to a {@link Supplier}.
 */
public final class LambdaExpression extends Expression {

    private final Expression body;

    LambdaExpression(Expression body) {
        super(Supplier.class);
        this.body = body;
    }

    @Override
    public ExpressionType getNodeType() {
        return ExpressionType.LAMBDA;
    }

    public Expression getBody() {
        return body;
    }

    public LambdaExpression update(Expression body) {
        if (body == this.body) {
            return this;
        }
        return new LambdaExpression(body);
    }
}
