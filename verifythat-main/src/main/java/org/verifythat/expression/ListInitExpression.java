package org.verifythat.expression;

import java.lang.reflect.Method;
import java.util.List;

/**
 * Collection construction followed by one {@code add} call per initializer, {@code new Type { a, b }}.
 */
public final class ListInitExpression extends Expression {

    private final NewExpression newExpression;
    private final Method addMethod;
    private final List<Expression> initializers;

    ListInitExpression(NewExpression newExpression, Method addMethod, List<Expression> initializers) {
        super(newExpression.getType());
        this.newExpression = newExpression;
        this.addMethod = addMethod;
        this.initializers = List.copyOf(initializers);
    }

    @Override
    public ExpressionType getNodeType() {
        return ExpressionType.LIST_INIT;
    }

    public NewExpression getNewExpression() {
        return newExpression;
    }

    public Method getAddMethod() {
        return addMethod;
    }

    public List<Expression> getInitializers() {
        return initializers;
    }

    public ListInitExpression update(NewExpression newExpression, List<Expression> initializers) {
        if (newExpression == this.newExpression && initializers == this.initializers) {
            return this;
        }
        return new ListInitExpression(newExpression, addMethod, initializers);
    }
}
