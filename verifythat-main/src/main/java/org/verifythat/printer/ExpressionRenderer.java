package org.verifythat.printer;

import org.verifythat.expression.BinaryExpression;
import org.verifythat.expression.ConditionalExpression;
import org.verifythat.expression.ConstantExpression;
import org.verifythat.expression.Expression;
import org.verifythat.expression.ExpressionType;
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
import org.verifythat.util.TypeUtils;
import org.verifythat.visitor.ExpressionTreeVisitor;

import java.util.List;

/**
 * Renders an expression tree back into source-like text, in one pass over the tree.
 * <p>
 * The renderer never evaluates anything: constants print their literal value, variables and
 * members print their names. Targets that carry no information for the reader, such as a captured
 * {@code this}, are left out, so {@code this.field == 2} reads {@code field == 2}.
 */
public class ExpressionRenderer extends ExpressionTreeVisitor {

    private final StringBuilder printer = new StringBuilder();

    protected ExpressionRenderer() {
    }

    public static String render(Expression expression) {
        ExpressionRenderer renderer = new ExpressionRenderer();
        renderer.visit(expression);
        return renderer.printer.toString();
    }

    @Override
    protected Expression visitBinary(BinaryExpression b) {
        if (b.getNodeType() == ExpressionType.ARRAY_INDEX) {
            visit(b.getLeft());
            printer.append("[");
            visit(b.getRight());
            printer.append("]");
        } else {
            visit(b.getLeft());
            printer.append(" ").append(OperatorText.operator(b.getNodeType())).append(" ");
            visit(b.getRight());
        }
        return b;
    }

    @Override
    protected Expression visitConditional(ConditionalExpression c) {
        visit(c.getTest());
        printer.append(" ? ");
        visit(c.getIfTrue());
        printer.append(" : ");
        visit(c.getIfFalse());
        return c;
    }

    @Override
    protected Expression visitConstant(ConstantExpression c) {
        printer.append(ValueFormatter.format(c.getValue()));
        return c;
    }

    @Override
    protected Expression visitParameter(ParameterExpression p) {
        printer.append(p.getName());
        return p;
    }

    @Override
    protected List<Expression> visitExpressionList(List<Expression> original) {
        boolean first = true;
        for (Expression expression : original) {
            if (!first) {
                printer.append(", ");
            }
            visit(expression);
            first = false;
        }
        return original;
    }

    @Override
    protected Expression visitMemberAccess(MemberExpression m) {
        if (m.getTarget() == null) {
            printer.append(m.getMember().getDeclaringClass().getSimpleName()).append(".");
        } else if (shouldReport(m.getTarget())) {
            visit(m.getTarget());
            printer.append(".");
        }
        printer.append(m.getName());
        return m;
    }

    @Override
    protected Expression visitMemberInit(MemberInitExpression init) {
        printer.append("new ").append(init.getType().getSimpleName()).append(" { ");
        boolean first = true;
        for (MemberBinding binding : init.getBindings()) {
            if (!first) {
                printer.append(", ");
            }
            printer.append(binding.getName()).append(" = ");
            visit(binding.getExpression());
            first = false;
        }
        printer.append(" }");
        return init;
    }

    @Override
    protected Expression visitMethodCall(MethodCallExpression m) {
        List<Expression> arguments = m.getArguments();
        if (m.isExtension() && !arguments.isEmpty()) {
            visit(arguments.get(0));
            printer.append(".");
            printer.append(m.getMethod().getName()).append("(");
            visitExpressionList(arguments.subList(1, arguments.size()));
            printer.append(")");
            return m;
        }

        boolean mightNeedDot = false;
        if (m.getTarget() == null) {
            printer.append(m.getMethod().getDeclaringClass().getSimpleName()).append(".");
        } else if (shouldReport(m.getTarget())) {
            visit(m.getTarget());
            mightNeedDot = true;
        }

        if (m.isIndexer()) {
            printer.append("[");
            visitExpressionList(arguments);
            printer.append("]");
        } else {
            if (mightNeedDot) {
                printer.append(".");
            }
            printer.append(m.getMethod().getName()).append("(");
            visitExpressionList(arguments);
            printer.append(")");
        }
        return m;
    }

    @Override
    protected Expression visitIndex(IndexExpression i) {
        visit(i.getTarget());
        printer.append("[");
        visitExpressionList(i.getArguments());
        printer.append("]");
        return i;
    }

    @Override
    protected Expression visitUnary(UnaryExpression u) {
        switch (u.getNodeType()) {
            case ARRAY_LENGTH -> {
                visit(u.getOperand());
                printer.append(".Length");
            }
            case CONVERT -> {
                printer.append("(").append(ValueFormatter.typeName(u.getType())).append(")");
                visit(u.getOperand());
            }
            case NEGATE -> {
                printer.append("-");
                visit(u.getOperand());
            }
            case NOT -> {
                printer.append("!");
                visit(u.getOperand());
            }
            case TYPE_AS -> {
                visit(u.getOperand());
                printer.append(" as ").append(ValueFormatter.typeName(u.getType()));
            }
            default -> super.visitUnary(u);
        }
        return u;
    }

    @Override
    protected Expression visitTypeIs(TypeBinaryExpression b) {
        visit(b.getExpression());
        printer.append(" is ").append(ValueFormatter.typeName(b.getTypeOperand()));
        return b;
    }

    @Override
    protected NewExpression visitNew(NewExpression nex) {
        printer.append("new ").append(nex.getType().getSimpleName()).append("(");
        visitExpressionList(nex.getArguments());
        printer.append(")");
        return nex;
    }

    @Override
    protected Expression visitNewArray(NewArrayExpression na) {
        if (na.getNodeType() == ExpressionType.NEW_ARRAY_BOUNDS) {
            Class<?> elementType = na.getType();
            for (int i = 0; i < na.getExpressions().size(); i++) {
                elementType = elementType.getComponentType();
            }
            printer.append("new ").append(ValueFormatter.typeName(elementType));
            for (Expression length : na.getExpressions()) {
                printer.append("[");
                visit(length);
                printer.append("]");
            }
        } else {
            printer.append("new ").append(ValueFormatter.typeName(na.getElementType())).append("[] { ");
            visitExpressionList(na.getExpressions());
            printer.append(na.getExpressions().isEmpty() ? "}" : " }");
        }
        return na;
    }

    @Override
    protected Expression visitListInit(ListInitExpression init) {
        printer.append("new ").append(init.getType().getSimpleName()).append(" { ");
        visitExpressionList(init.getInitializers());
        printer.append(init.getInitializers().isEmpty() ? "}" : " }");
        return init;
    }

    @Override
    protected Expression visitInvocation(InvocationExpression iv) {
        visit(iv.getExpression());
        printer.append("(");
        visitExpressionList(iv.getArguments());
        printer.append(")");
        return iv;
    }

    @Override
    protected Expression visitLambda(LambdaExpression lambda) {
        visit(lambda.getBody());
        return lambda;
    }

    /**
     * Whether a member target is worth printing before the dot: anything but a constant, and
     * constants of primitive, boxed or string type, so {@code "1".trim()} keeps its receiver while
     * a captured {@code this} does not.
     */
    private static boolean shouldReport(Expression expression) {
        return expression != null
                && (expression.getNodeType() != ExpressionType.CONSTANT
                    || TypeUtils.unwrap(expression.getType()).isPrimitive()
                    || expression.getType() == String.class);
    }
}
