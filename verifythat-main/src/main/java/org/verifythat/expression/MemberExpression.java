package org.verifythat.expression;

import java.lang.reflect.Member;

/**
 * Reads a field, or a property through its getter. A {@code null} target denotes a static member.
 */
public final class MemberExpression extends Expression {

    private final Expression target;
    private final Member member;
    private final String name;

    MemberExpression(Expression target, Member member, String name, Class<?> type) {
        super(type);
        this.target = target;
        this.member = member;
        this.name = name;
    }

    @Override
    public ExpressionType getNodeType() {
        return ExpressionType.MEMBER_ACCESS;
    }

    public Expression getTarget() {
        return target;
    }

    public Member getMember() {
        return member;
    }

    public String getName() {
        return name;
    }

    public MemberExpression update(Expression target) {
        if (target == this.target) {
            return this;
        }
        return new MemberExpression(target, member, name, getType());
    }
}
