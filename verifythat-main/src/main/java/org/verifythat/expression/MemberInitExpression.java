package org.verifythat.expression;

import java.util.List;

/**
 * Object construction followed by member assignments, {@code new Type { a = 1, b = 2 }}.
 */
public final class MemberInitExpression extends Expression {

    private final NewExpression newExpression;
    private final List<MemberBinding> bindings;

    MemberInitExpression(NewExpression newExpression, List<MemberBinding> bindings) {
        super(newExpression.getType());
        this.newExpression = newExpression;
        this.bindings = List.copyOf(bindings);
    }

    @Override
    public ExpressionType getNodeType() {
        return ExpressionType.MEMBER_INIT;
    }

    public NewExpression getNewExpression() {
        return newExpression;
    }

    public List<MemberBinding> getBindings() {
        return bindings;
    }

    public MemberInitExpression update(NewExpression newExpression, List<MemberBinding> bindings) {
        if (newExpression == this.newExpression && bindings == this.bindings) {
            return this;
        }
        return new MemberInitExpression(newExpression, bindings);
    }
}
