package org.verifythat.visitor;

import org.verifythat.UnsupportedNodeKindException;
import org.verifythat.expression.BinaryExpression;
import org.verifythat.expression.ConditionalExpression;
import org.verifythat.expression.ConstantExpression;
import org.verifythat.expression.Expression;
import org.verifythat.expression.IndexExpression;
import org.verifythat.expression.InvocationExpression;
import org.verifythat.expression.LambdaExpression;
import org.verifythat.expression.ListInitExpression;
import org.verifythat.expression.MemberBinding;
import org.verifythat.expression.MemberExpression;
import org.verifythat.expression.MemberInitExpression;
import org.verifythat.expression.MethodCallExpression;
import org.verifythat.expression.NewArrayExpression;
import org.verifythat.expression.NewExpression;
import org.verifythat.expression.ParameterExpression;
import org.verifythat.expression.TypeBinaryExpression;
import org.verifythat.expression.UnaryExpression;

import java.util.ArrayList;
import java.util.List;

/**
 * Double-dispatch traversal over the expression tree.
 * <p>
 * Every {@code visitXxx} method visits the children of its node and returns the node unchanged when
 * no child changed identity, or a new node of the same kind built from the new children otherwise.
 * Subclasses override the kinds they care about; everything else is copied structurally, sharing
 * every unchanged subtree.
 */
public abstract class ExpressionTreeVisitor {

    protected ExpressionTreeVisitor() {
    }

    public Expression visit(Expression node) {
        if (node == null) {
            return null;
        }
        switch (node.getNodeType()) {
            case NEGATE, NOT, CONVERT, ARRAY_LENGTH, TYPE_AS:
                return visitUnary((UnaryExpression) node);
            case ADD, SUBTRACT, MULTIPLY, DIVIDE, MODULO, POWER,
                 AND, OR, EXCLUSIVE_OR, AND_ALSO, OR_ELSE,
                 LEFT_SHIFT, RIGHT_SHIFT, COALESCE,
                 EQUAL, NOT_EQUAL, LESS_THAN, LESS_THAN_OR_EQUAL, GREATER_THAN, GREATER_THAN_OR_EQUAL,
                 ARRAY_INDEX:
                return visitBinary((BinaryExpression) node);
            case TYPE_IS:
                return visitTypeIs((TypeBinaryExpression) node);
            case CONDITIONAL:
                return visitConditional((ConditionalExpression) node);
            case CONSTANT:
                return visitConstant((ConstantExpression) node);
            case PARAMETER:
                return visitParameter((ParameterExpression) node);
            case MEMBER_ACCESS:
                return visitMemberAccess((MemberExpression) node);
            case CALL:
                return visitMethodCall((MethodCallExpression) node);
            case INDEX:
                return visitIndex((IndexExpression) node);
            case LAMBDA:
                return visitLambda((LambdaExpression) node);
            case NEW:
                return visitNew((NewExpression) node);
            case NEW_ARRAY_INIT, NEW_ARRAY_BOUNDS:
                return visitNewArray((NewArrayExpression) node);
            case INVOKE:
                return visitInvocation((InvocationExpression) node);
            case MEMBER_INIT:
                return visitMemberInit((MemberInitExpression) node);
            case LIST_INIT:
                return visitListInit((ListInitExpression) node);
            default:
                throw new UnsupportedNodeKindException(node.getNodeType());
        }
    }

    protected Expression visitUnary(UnaryExpression u) {
        return u.update(visit(u.getOperand()));
    }

    protected Expression visitBinary(BinaryExpression b) {
        Expression left = visit(b.getLeft());
        Expression right = visit(b.getRight());
        return b.update(left, right);
    }

    protected Expression visitTypeIs(TypeBinaryExpression b) {
        return b.update(visit(b.getExpression()));
    }

    protected Expression visitConstant(ConstantExpression c) {
        return c;
    }

    protected Expression visitConditional(ConditionalExpression c) {
        Expression test = visit(c.getTest());
        Expression ifTrue = visit(c.getIfTrue());
        Expression ifFalse = visit(c.getIfFalse());
        return c.update(test, ifTrue, ifFalse);
    }

    protected Expression visitParameter(ParameterExpression p) {
        return p;
    }

    protected Expression visitMemberAccess(MemberExpression m) {
        return m.update(visit(m.getTarget()));
    }

    protected Expression visitMethodCall(MethodCallExpression m) {
        Expression target = visit(m.getTarget());
        List<Expression> arguments = visitExpressionList(m.getArguments());
        return m.update(target, arguments);
    }

    protected Expression visitIndex(IndexExpression i) {
        Expression target = visit(i.getTarget());
        List<Expression> arguments = visitExpressionList(i.getArguments());
        return i.update(target, arguments);
    }

    /**
     * Visits each expression of {@code original}. The original list is returned when every element
     * came back unchanged, so callers can detect a rewrite by identity.
     */
    protected List<Expression> visitExpressionList(List<Expression> original) {
        List<Expression> list = null;
        for (int i = 0, n = original.size(); i < n; i++) {
            Expression p = visit(original.get(i));
            if (list != null) {
                list.add(p);
            } else if (p != original.get(i)) {
                list = new ArrayList<>(n);
                for (int j = 0; j < i; j++) {
                    list.add(original.get(j));
                }
                list.add(p);
            }
        }
        if (list != null) {
            return List.copyOf(list);
        }
        return original;
    }

    protected MemberBinding visitBinding(MemberBinding binding) {
        return binding.update(visit(binding.getExpression()));
    }

    protected List<MemberBinding> visitBindingList(List<MemberBinding> original) {
        List<MemberBinding> list = null;
        for (int i = 0, n = original.size(); i < n; i++) {
            MemberBinding b = visitBinding(original.get(i));
            if (list != null) {
                list.add(b);
            } else if (b != original.get(i)) {
                list = new ArrayList<>(n);
                for (int j = 0; j < i; j++) {
                    list.add(original.get(j));
                }
                list.add(b);
            }
        }
        if (list != null) {
            return List.copyOf(list);
        }
        return original;
    }

    /**
     * Visits the body. Only the outermost lambda of a verified expression is ever walked.
     */
    protected Expression visitLambda(LambdaExpression lambda) {
        return lambda.update(visit(lambda.getBody()));
    }

    protected NewExpression visitNew(NewExpression nex) {
        return nex.update(visitExpressionList(nex.getArguments()));
    }

    protected Expression visitMemberInit(MemberInitExpression init) {
        NewExpression n = visitNew(init.getNewExpression());
        List<MemberBinding> bindings = visitBindingList(init.getBindings());
        return init.update(n, bindings);
    }

    protected Expression visitListInit(ListInitExpression init) {
        NewExpression n = visitNew(init.getNewExpression());
        List<Expression> initializers = visitExpressionList(init.getInitializers());
        return init.update(n, initializers);
    }

    protected Expression visitNewArray(NewArrayExpression na) {
        return na.update(visitExpressionList(na.getExpressions()));
    }

    protected Expression visitInvocation(InvocationExpression iv) {
        List<Expression> arguments = visitExpressionList(iv.getArguments());
        Expression expression = visit(iv.getExpression());
        return iv.update(expression, arguments);
    }
}
