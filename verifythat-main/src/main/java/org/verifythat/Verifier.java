package org.verifythat;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.verifythat.compiler.ExpressionCompiler;
import org.verifythat.expression.BinaryExpression;
import org.verifythat.expression.ConstantExpression;
import org.verifythat.expression.Expression;
import org.verifythat.expression.ExpressionType;
import org.verifythat.expression.Expressions;
import org.verifythat.expression.LambdaExpression;
import org.verifythat.expression.MethodCallExpression;
import org.verifythat.expression.TypeBinaryExpression;
import org.verifythat.printer.ExpressionRenderer;
import org.verifythat.printer.OperatorText;
import org.verifythat.printer.ValueFormatter;
import org.verifythat.util.TypeUtils;

import java.util.Objects;

/**
 * Checks boolean expression trees and reports the ones that do not hold.
 * <p>
 * The root is classified by kind. A conjunction {@code a && b} checks both sides, each on its own
 * and both unconditionally. A comparison evaluates its left operand once, compares that value with
 * the right operand and, on failure, reports both sides as written together with the value seen.
 * An {@code is} test reports the runtime type it met. Anything else is evaluated as a plain
 * condition, reporting {@code to be true but was false}, unless it produced a failing
 * {@link CheckOutcome} that describes itself.
 * <p>
 * Instances are immutable and may be shared between threads.
 */
public final class Verifier {

    private static final Logger LOGGER = LoggerFactory.getLogger(Verifier.class);

    private final VerifierParameters parameters;

    public Verifier() {
        this(VerifierParameters.defaults());
    }

    public Verifier(VerifierParameters parameters) {
        this.parameters = Objects.requireNonNull(parameters, "parameters");
    }

    public VerifierParameters getParameters() {
        return parameters;
    }

    /**
     * Checks {@code expression}, reporting through the configured reporter if it does not hold.
     * A {@link LambdaExpression} is checked through its body.
     *
     * @throws NullPointerException     if {@code expression} is null
     * @throws IllegalArgumentException if the expression is not boolean-typed
     */
    public void check(Expression expression) {
        Objects.requireNonNull(expression, "expression");
        Expression body = expression instanceof LambdaExpression lambda ? lambda.getBody() : expression;
        if (!TypeUtils.isBooleanLike(body.getType())) {
            throw new IllegalArgumentException("Expression must be boolean-typed, got " + body.getType().getName());
        }
        evaluateExpression(body);
    }

    private void evaluateExpression(Expression expression) {
        if (expression.getNodeType() == ExpressionType.AND_ALSO) {
            BinaryExpression andAlso = (BinaryExpression) expression;
            evaluateExpression(andAlso.getLeft());
            evaluateExpression(andAlso.getRight());
        } else {
            testExpression(expression);
        }
    }

    private void testExpression(Expression expression) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Checking {}", ExpressionRenderer.render(expression));
        }
        if (expression.getNodeType().isRelational()) {
            testBinaryExpression((BinaryExpression) expression);
        } else if (expression instanceof TypeBinaryExpression typeBinary) {
            testTypeBinaryExpression(typeBinary);
        } else {
            testNonBinaryExpression(expression);
        }
    }

    private void testBinaryExpression(BinaryExpression binary) {
        Expression left = binary.getLeft();
        Object actual = ExpressionCompiler.evaluate(left);

        Expression substituted = Expressions.makeBinary(binary.getNodeType(), literal(actual, left.getType()), binary.getRight());
        if (!ExpressionCompiler.evaluateBoolean(substituted)) {
            report(ExpressionRenderer.render(left),
                    OperatorText.relationKeyword(binary.getNodeType()),
                    ExpressionRenderer.render(binary.getRight()),
                    "was",
                    ValueFormatter.format(actual));
        }
    }

    private void testTypeBinaryExpression(TypeBinaryExpression typeBinary) {
        Expression target = typeBinary.getExpression();
        Object actual = ExpressionCompiler.evaluate(target);

        Expression substituted = Expressions.typeIs(literal(actual, target.getType()), typeBinary.getTypeOperand());
        if (!ExpressionCompiler.evaluateBoolean(substituted)) {
            report(ExpressionRenderer.render(target),
                    "be",
                    ValueFormatter.format(typeBinary.getTypeOperand()),
                    "was",
                    actual == null ? "null" : ValueFormatter.format(actual.getClass()));
        }
    }

    private void testNonBinaryExpression(Expression expression) {
        Object value = ExpressionCompiler.evaluate(expression);

        if (value instanceof CheckOutcome outcome) {
            if (!outcome.isPassed()) {
                Expression subject = expression;
                if (expression.getNodeType() == ExpressionType.CALL) {
                    MethodCallExpression call = (MethodCallExpression) expression;
                    if (call.isExtension() && !call.getArguments().isEmpty()) {
                        subject = call.getArguments().get(0);
                    }
                }
                report(ExpressionRenderer.render(subject),
                        outcome.getBeText(), outcome.getExpectedText(), outcome.getWasText(), outcome.getActualText());
            }
            return;
        }

        if (!ExpressionCompiler.toBoolean(value)) {
            report(ExpressionRenderer.render(expression), "be", "true", "was", "false");
        }
    }

    private void report(String expression, String be, String expected, String was, String actual) {
        String message = parameters.formatter().format(expression, be, expected, was, actual);
        LOGGER.debug("Check failed: {} expected to {} {}, {} {}", expression, be, expected, was, actual);
        parameters.reporter().report(message);
    }

    /**
     * The evaluated value as a constant of the operand's static type, so the rebuilt node types
     * the same as the original. Falls back to the value's own type when it does not fit.
     */
    private static ConstantExpression literal(Object value, Class<?> type) {
        if (value == null ? !type.isPrimitive() : TypeUtils.wrap(type).isInstance(value)) {
            return Expressions.constant(value, type);
        }
        return Expressions.constant(value);
    }
}
