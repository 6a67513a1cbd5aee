package org.verifythat.expression;

import java.lang.reflect.Method;
import java.util.List;

/**
 * An indexed read on an object, such as {@code List.get(int)} or a method annotated with {@link Indexer}.
 */
public final class IndexExpression extends Expression {

    private final Expression target;
    private final Method accessor;
    private final List<Expression> arguments;

    IndexExpression(Expression target, Method accessor, List<Expression> arguments) {
        super(accessor.getReturnType());
        this.target = target;
        this.accessor = accessor;
        this.arguments = List.copyOf(arguments);
    }

    @Override
    public ExpressionType getNodeType() {
        return ExpressionType.INDEX;
    }

    public Expression getTarget() {
        return target;
    }

    public Method getAccessor() {
        return accessor;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    public IndexExpression update(Expression target, List<Expression> arguments) {
        if (target == this.target && arguments == this.arguments) {
            return this;
        }
        return new IndexExpression(target, accessor, arguments);
    }
}
