package org.verifythat.expression;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.List;

/**
 * A method call. A {@code null} target denotes a static method; a static method annotated with
 * {@link Extension} receives its subject as the first argument.
 */
public final class MethodCallExpression extends Expression {

    private final Expression target;
    private final Method method;
    private final List<Expression> arguments;

    MethodCallExpression(Expression target, Method method, List<Expression> arguments) {
        super(method.getReturnType());
        this.target = target;
        this.method = method;
        this.arguments = List.copyOf(arguments);
    }

    @Override
    public ExpressionType getNodeType() {
        return ExpressionType.CALL;
    }

    public Expression getTarget() {
        return target;
    }

    public Method getMethod() {
        return method;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    public boolean isExtension() {
        return Modifier.isStatic(method.getModifiers()) && method.isAnnotationPresent(Extension.class);
    }

    public boolean isIndexer() {
        return method.isAnnotationPresent(Indexer.class);
    }

    public MethodCallExpression update(Expression target, List<Expression> arguments) {
        if (target == this.target && arguments == this.arguments) {
            return this;
        }
        return new MethodCallExpression(target, method, arguments);
    }
}
