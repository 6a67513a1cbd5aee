package org.verifythat.visitor;

import org.junit.jupiter.api.Test;
import org.verifythat.UnsupportedNodeKindException;
import org.verifythat.compiler.ExpressionCompiler;
import org.verifythat.expression.BinaryExpression;
import org.verifythat.expression.ConstantExpression;
import org.verifythat.expression.Expression;
import org.verifythat.expression.ExpressionType;
import org.verifythat.expression.MemberInitExpression;
import org.verifythat.expression.MethodCallExpression;
import org.verifythat.expression.ParameterExpression;
import org.verifythat.printer.ExpressionRenderer;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.verifythat.expression.Expressions.add;
import static org.verifythat.expression.Expressions.andAlso;
import static org.verifythat.expression.Expressions.arrayLength;
import static org.verifythat.expression.Expressions.bind;
import static org.verifythat.expression.Expressions.call;
import static org.verifythat.expression.Expressions.condition;
import static org.verifythat.expression.Expressions.constant;
import static org.verifythat.expression.Expressions.equal;
import static org.verifythat.expression.Expressions.greaterThan;
import static org.verifythat.expression.Expressions.invoke;
import static org.verifythat.expression.Expressions.lambda;
import static org.verifythat.expression.Expressions.listInit;
import static org.verifythat.expression.Expressions.memberInit;
import static org.verifythat.expression.Expressions.newArrayInit;
import static org.verifythat.expression.Expressions.newObject;
import static org.verifythat.expression.Expressions.not;
import static org.verifythat.expression.Expressions.parameter;
import static org.verifythat.expression.Expressions.typeIs;
import static org.verifythat.expression.Expressions.variable;

class ExpressionTreeVisitorTest {

    /**
     * Leaves every node alone.
     */
    private static final class IdentityVisitor extends ExpressionTreeVisitor {
    }

    /**
     * Replaces one named variable with a constant.
     */
    private static final class Substitution extends ExpressionTreeVisitor {

        private final String name;
        private final Object value;

        Substitution(String name, Object value) {
            this.name = name;
            this.value = value;
        }

        @Override
        protected Expression visitParameter(ParameterExpression p) {
            return p.getName().equals(name) ? constant(value, p.getType()) : p;
        }
    }

    /**
     * Records the kinds it meets, in visiting order.
     */
    private static final class KindCollector extends ExpressionTreeVisitor {

        private final List<ExpressionType> kinds = new ArrayList<>();

        @Override
        public Expression visit(Expression node) {
            if (node != null) {
                kinds.add(node.getNodeType());
            }
            return super.visit(node);
        }
    }

    @Test
    void identity_returnsTheSameTree() {
        Expression tree = andAlso(
            greaterThan(add(parameter("a", int.class), constant(1)), constant(2)),
            not(typeIs(parameter("o", Object.class), String.class)));

        assertThat(new IdentityVisitor().visit(tree)).isSameAs(tree);
    }

    @Test
    void identity_coversConstructionKinds() {
        Expression members = memberInit(newObject(Bean.class), bind(Bean.class, "value", parameter("v", int.class)));
        Expression list = listInit(newObject(ArrayList.class), constant(1), parameter("x", int.class));
        Expression array = arrayLength(newArrayInit(int.class, constant(1), parameter("y", int.class)));
        Expression call = invoke(lambda(condition(parameter("b", boolean.class), constant(1), constant(2))));

        IdentityVisitor visitor = new IdentityVisitor();
        assertThat(visitor.visit(members)).isSameAs(members);
        assertThat(visitor.visit(list)).isSameAs(list);
        assertThat(visitor.visit(array)).isSameAs(array);
        assertThat(visitor.visit(call)).isSameAs(call);
    }

    @Test
    void rewrite_sharesUnchangedSubtrees() {
        Expression untouched = equal(call(constant("1"), "trim"), constant("1"));
        BinaryExpression tree = andAlso(untouched, greaterThan(parameter("a", int.class), constant(2)));

        BinaryExpression rewritten = (BinaryExpression) new Substitution("a", 5).visit(tree);

        assertThat(rewritten).isNotSameAs(tree);
        assertThat(rewritten.getNodeType()).isEqualTo(ExpressionType.AND_ALSO);
        assertThat(rewritten.getLeft()).isSameAs(untouched);
        assertThat(((BinaryExpression) rewritten.getRight()).getLeft()).isInstanceOf(ConstantExpression.class);
        assertThat(((BinaryExpression) rewritten.getRight()).getRight()).isSameAs(((BinaryExpression) tree.getRight()).getRight());
        assertThat(ExpressionRenderer.render(rewritten)).isEqualTo("\"1\".trim() == \"1\" && 5 > 2");
        assertThat(ExpressionCompiler.evaluateBoolean(rewritten)).isTrue();
    }

    @Test
    void rewrite_rebuildsArgumentLists() {
        Expression x = parameter("x", int.class);
        MethodCallExpression tree = call(constant("abc"), "substring", constant(0), x);

        MethodCallExpression rewritten = (MethodCallExpression) new Substitution("x", 2).visit(tree);

        assertThat(rewritten.getMethod()).isEqualTo(tree.getMethod());
        assertThat(rewritten.getArguments()).hasSize(2);
        assertThat(rewritten.getArguments().get(0)).isSameAs(tree.getArguments().get(0));
        assertThat(ExpressionCompiler.evaluate(rewritten)).isEqualTo("ab");
    }

    @Test
    void rewrite_reachesMemberBindings() {
        MemberInitExpression tree = memberInit(newObject(Bean.class), bind(Bean.class, "value", parameter("v", int.class)));

        Expression rewritten = new Substitution("v", 7).visit(tree);

        assertThat(rewritten).isNotSameAs(tree);
        assertThat(ExpressionRenderer.render(rewritten)).isEqualTo("new Bean { value = 7 }");
        assertThat(((Bean) ExpressionCompiler.evaluate(rewritten)).getValue()).isEqualTo(7);
    }

    @Test
    void traversal_visitsChildrenLeftToRight() {
        KindCollector collector = new KindCollector();

        collector.visit(equal(add(variable("a", 1), constant(2)), constant(3)));

        assertThat(collector.kinds).containsExactly(
            ExpressionType.EQUAL, ExpressionType.ADD, ExpressionType.PARAMETER,
            ExpressionType.CONSTANT, ExpressionType.CONSTANT);
    }

    @Test
    void visitNull_returnsNull() {
        assertThat(new IdentityVisitor().visit(null)).isNull();
    }

    @Test
    void unknownKinds_areRejected() {
        Expression foreign = new Expression(boolean.class) {
            @Override
            public ExpressionType getNodeType() {
                return ExpressionType.EXTENSION;
            }
        };

        assertThatThrownBy(() -> new IdentityVisitor().visit(not(foreign)))
            .isInstanceOf(UnsupportedNodeKindException.class)
            .hasMessageContaining("EXTENSION");
    }

    public static class Bean {

        private int value;

        public int getValue() {
            return value;
        }

        public void setValue(int value) {
            this.value = value;
        }
    }
}
