package org.verifythat.expression;

import java.lang.reflect.Member;

/**
 * One {@code name = value} assignment of an object initializer, written through a field or a setter.
 */
public final class MemberBinding {

    private final Member member;
    private final String name;
    private final Expression expression;

    MemberBinding(Member member, String name, Expression expression) {
        this.member = member;
        this.name = name;
        this.expression = expression;
    }

    public Member getMember() {
        return member;
    }

    public String getName() {
        return name;
    }

    public Expression getExpression() {
        return expression;
    }

    public MemberBinding update(Expression expression) {
        if (expression == this.expression) {
            return this;
        }
        return new MemberBinding(member, name, expression);
    }
}
