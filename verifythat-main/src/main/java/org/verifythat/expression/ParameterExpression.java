package org.verifythat.expression;

import java.util.function.Supplier;

/**
 * A named variable whose value is read through a binding captured when the tree was built.
 * The binding is read every time the variable is evaluated, never cached.
 */
public final class ParameterExpression extends Expression {

    private final String name;
    private final Supplier<?> binding;

    ParameterExpression(String name, Class<?> type, Supplier<?> binding) {
        super(type);
        this.name = name;
        this.binding = binding;
    }

    @Override
    public ExpressionType getNodeType() {
        return ExpressionType.PARAMETER;
    }

    public String getName() {
        return name;
    }

    /**
     * @return the captured binding, or {@code null} for an unbound variable
     */
    public Supplier<?> getBinding() {
        return binding;
    }
}
