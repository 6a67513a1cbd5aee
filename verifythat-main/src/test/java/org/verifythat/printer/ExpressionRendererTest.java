package org.verifythat.printer;

import org.junit.jupiter.api.Test;
import org.verifythat.expression.Expression;
import org.verifythat.expression.ExpressionType;
import org.verifythat.expression.Expressions;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Map;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.verifythat.expression.Expressions.add;
import static org.verifythat.expression.Expressions.andAlso;
import static org.verifythat.expression.Expressions.call;
import static org.verifythat.expression.Expressions.coalesce;
import static org.verifythat.expression.Expressions.constant;
import static org.verifythat.expression.Expressions.equal;
import static org.verifythat.expression.Expressions.field;
import static org.verifythat.expression.Expressions.invoke;
import static org.verifythat.expression.Expressions.lambda;
import static org.verifythat.expression.Expressions.listInit;
import static org.verifythat.expression.Expressions.multiply;
import static org.verifythat.expression.Expressions.newArrayBounds;
import static org.verifythat.expression.Expressions.newArrayInit;
import static org.verifythat.expression.Expressions.newObject;
import static org.verifythat.expression.Expressions.parameter;
import static org.verifythat.expression.Expressions.staticField;
import static org.verifythat.expression.Expressions.typeIs;
import static org.verifythat.expression.Expressions.variable;

class ExpressionRendererTest {

    public int count = 3;

    public static final int LIMIT = 10;

    // ── Operators ──────────────────────────────────────────────────────────

    @Test
    void binaryOperators_useTheSymbolTable() {
        Map<ExpressionType, String> expected = new EnumMap<>(ExpressionType.class);
        expected.put(ExpressionType.ADD, "a + b");
        expected.put(ExpressionType.SUBTRACT, "a - b");
        expected.put(ExpressionType.MULTIPLY, "a * b");
        expected.put(ExpressionType.DIVIDE, "a / b");
        expected.put(ExpressionType.MODULO, "a % b");
        expected.put(ExpressionType.POWER, "a ^ b");
        expected.put(ExpressionType.AND, "a & b");
        expected.put(ExpressionType.OR, "a | b");
        expected.put(ExpressionType.EXCLUSIVE_OR, "a ^ b");
        expected.put(ExpressionType.LEFT_SHIFT, "a << b");
        expected.put(ExpressionType.RIGHT_SHIFT, "a >> b");
        expected.put(ExpressionType.EQUAL, "a == b");
        expected.put(ExpressionType.NOT_EQUAL, "a != b");
        expected.put(ExpressionType.LESS_THAN, "a < b");
        expected.put(ExpressionType.LESS_THAN_OR_EQUAL, "a <= b");
        expected.put(ExpressionType.GREATER_THAN, "a > b");
        expected.put(ExpressionType.GREATER_THAN_OR_EQUAL, "a >= b");

        Expression a = parameter("a", int.class);
        Expression b = parameter("b", int.class);
        expected.forEach((kind, text) ->
            assertThat(ExpressionRenderer.render(Expressions.makeBinary(kind, a, b))).as(kind.name()).isEqualTo(text));

        Expression p = parameter("p", boolean.class);
        Expression q = parameter("q", boolean.class);
        assertThat(ExpressionRenderer.render(andAlso(p, q))).isEqualTo("p && q");
        assertThat(ExpressionRenderer.render(Expressions.orElse(p, q))).isEqualTo("p || q");
        assertThat(ExpressionRenderer.render(coalesce(parameter("s", String.class), constant("x")))).isEqualTo("s ?? \"x\"");
    }

    @Test
    void relationKeywords_coverEveryRelationalKind() {
        Map<ExpressionType, String> expected = new EnumMap<>(ExpressionType.class);
        expected.put(ExpressionType.EQUAL, "be");
        expected.put(ExpressionType.NOT_EQUAL, "not be");
        expected.put(ExpressionType.LESS_THAN, "be less than");
        expected.put(ExpressionType.LESS_THAN_OR_EQUAL, "be less than or equal to");
        expected.put(ExpressionType.GREATER_THAN, "be greater than");
        expected.put(ExpressionType.GREATER_THAN_OR_EQUAL, "be greater than or equal to");

        for (ExpressionType kind : ExpressionType.values()) {
            assertThat(OperatorText.relationKeyword(kind)).as(kind.name()).isEqualTo(expected.get(kind));
            assertThat(kind.isRelational()).as(kind.name()).isEqualTo(expected.containsKey(kind));
        }
    }

    @Test
    void nestedOperators_renderWithoutParentheses() {
        Expression x = parameter("x", int.class);

        assertThat(ExpressionRenderer.render(equal(multiply(add(x, constant(1)), constant(2)), constant(8))))
            .isEqualTo("x + 1 * 2 == 8");
    }

    // ── Members ────────────────────────────────────────────────────────────

    @Test
    void capturedTargets_areSuppressed() {
        assertThat(ExpressionRenderer.render(field(constant(this), "count"))).isEqualTo("count");
    }

    @Test
    void variableTargets_areKept() {
        Expression test = variable("test", ExpressionRendererTest.class, () -> this);

        assertThat(ExpressionRenderer.render(field(test, "count"))).isEqualTo("test.count");
        assertThat(ExpressionRenderer.render(call(test, "toString"))).isEqualTo("test.toString()");
    }

    @Test
    void staticMembers_arePrefixedWithTheirDeclaringType() {
        assertThat(ExpressionRenderer.render(staticField(ExpressionRendererTest.class, "LIMIT")))
            .isEqualTo("ExpressionRendererTest.LIMIT");
        assertThat(ExpressionRenderer.render(call(Math.class, "abs", constant(-1))))
            .isEqualTo("Math.abs(-1)");
    }

    @Test
    void literalReceivers_areKept() {
        assertThat(ExpressionRenderer.render(call(constant("a b"), "split", constant(" "))))
            .isEqualTo("\"a b\".split(\" \")");
        assertThat(ExpressionRenderer.render(call(constant(7L), "toString"))).isEqualTo("7.toString()");
        assertThat(ExpressionRenderer.render(call(constant(7, Integer.class), "toString"))).isEqualTo("7.toString()");
        assertThat(ExpressionRenderer.render(call(constant('c', Character.class), "charValue"))).isEqualTo("c.charValue()");
    }

    // ── Construction ───────────────────────────────────────────────────────

    @Test
    void construction_rendersAsWritten() {
        assertThat(ExpressionRenderer.render(newObject(StringBuilder.class, constant("x"))))
            .isEqualTo("new StringBuilder(\"x\")");
        assertThat(ExpressionRenderer.render(newArrayInit(int.class, constant(1), constant(2))))
            .isEqualTo("new int[] { 1, 2 }");
        assertThat(ExpressionRenderer.render(newArrayInit(String.class)))
            .isEqualTo("new string[] { }");
        assertThat(ExpressionRenderer.render(newArrayBounds(long.class, constant(3))))
            .isEqualTo("new long[3]");
        assertThat(ExpressionRenderer.render(newArrayBounds(int.class, constant(2), constant(3))))
            .isEqualTo("new int[2][3]");
        assertThat(ExpressionRenderer.render(listInit(newObject(ArrayList.class), constant(1), constant("a"))))
            .isEqualTo("new ArrayList { 1, \"a\" }");
    }

    // ── Functions and type tests ───────────────────────────────────────────

    @Test
    void lambdas_renderTheirBody() {
        Expression body = equal(parameter("x", int.class), constant(1));

        assertThat(ExpressionRenderer.render(lambda(body))).isEqualTo("x == 1");
    }

    @Test
    void invocations_renderArguments() {
        Expression f = variable("f", Function.class, () -> (Function<Object, Object>) o -> o);

        assertThat(ExpressionRenderer.render(invoke(f, constant(2)))).isEqualTo("f(2)");
    }

    @Test
    void typeTests_useTypeNames() {
        assertThat(ExpressionRenderer.render(typeIs(parameter("o", Object.class), Integer.class))).isEqualTo("o is int");
    }

    @Test
    void nullConstants_renderAsNull() {
        assertThat(ExpressionRenderer.render(equal(parameter("s", String.class), constant(null))))
            .isEqualTo("s == null");
    }

    // ── Idempotence ────────────────────────────────────────────────────────

    @Test
    void rendering_isIdempotent() {
        Expression expression = equal(call(constant("1"), "trim"), constant("\t2"));

        String first = ExpressionRenderer.render(expression);
        String second = ExpressionRenderer.render(expression);

        assertThat(first).isEqualTo("\"1\".trim() == \"\\t2\"");
        assertThat(second).isEqualTo(first);
    }
}
