package org.verifythat.expression;

import java.util.List;

/**
 * Applies a function-valued expression ({@code Supplier}, {@code Function} or {@code BiFunction})
 * to its arguments.
 */
public final class InvocationExpression extends Expression {

    private final Expression expression;
    private final List<Expression> arguments;

    InvocationExpression(Expression expression, List<Expression> arguments, Class<?> type) {
        super(type);
        this.expression = expression;
        this.arguments = List.copyOf(arguments);
    }

    @Override
    public ExpressionType getNodeType() {
        return ExpressionType.INVOKE;
    }

    public Expression getExpression() {
        return expression;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    public InvocationExpression update(Expression expression, List<Expression> arguments) {
        if (expression == this.expression && arguments == this.arguments) {
            return this;
        }
        return new InvocationExpression(expression, arguments, getType());
    }
}
