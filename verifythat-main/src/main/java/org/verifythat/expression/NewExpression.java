package org.verifythat.expression;

import java.lang.reflect.Constructor;
import java.util.List;

public final class NewExpression extends Expression {

    private final Constructor<?> constructor;
    private final List<Expression> arguments;

    NewExpression(Constructor<?> constructor, List<Expression> arguments) {
        super(constructor.getDeclaringClass());
        this.constructor = constructor;
        this.arguments = List.copyOf(arguments);
    }

    @Override
    public ExpressionType getNodeType() {
        return ExpressionType.NEW;
    }

    public Constructor<?> getConstructor() {
        return constructor;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    public NewExpression update(List<Expression> arguments) {
        if (arguments == this.arguments) {
            return this;
        }
        return new NewExpression(constructor, arguments);
    }
}
