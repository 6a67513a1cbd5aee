package org.verifythat.compiler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.verifythat.CheckOutcome;
import org.verifythat.ExpressionEvaluationException;
import org.verifythat.UnsupportedNodeKindException;
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

import java.lang.reflect.AccessibleObject;
import java.lang.reflect.Array;
import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Member;
import java.lang.reflect.Method;
import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Compiles expression trees into closures.
 * <p>
 * Every node becomes a {@link CompiledExpression} that evaluates its children and applies the node,
 * so the compiled tree runs the expression exactly as written: operands left to right,
 * {@code &&}, {@code ||}, {@code ?:} and {@code ??} lazily, every call and member read against live
 * state. Nothing is cached between evaluations.
 * <p>
 * Faults raised by the code under test (a getter throwing, a division by zero) propagate unchanged,
 * checked exceptions included. Only faults of the evaluator itself are reported as
 * {@link ExpressionEvaluationException}.
 */
public final class ExpressionCompiler {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExpressionCompiler.class);

    private ExpressionCompiler() {}

    public static CompiledExpression compile(Expression expression) {
        if (LOGGER.isTraceEnabled()) {
            LOGGER.trace("Compiling {} expression of type {}", expression.getNodeType(), expression.getType().getName());
        }
        return compileExpression(expression);
    }

    public static Object evaluate(Expression expression) {
        return compile(expression).evaluate();
    }

    public static boolean evaluateBoolean(Expression expression) {
        return toBoolean(evaluate(expression));
    }

    /**
     * Reads a value in a boolean context. A {@link CheckOutcome} counts as true when it passed.
     */
    public static boolean toBoolean(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof CheckOutcome outcome) {
            return outcome.isPassed();
        }
        throw new ExpressionEvaluationException("Expected a boolean value, got "
                + (value == null ? "null" : value.getClass().getName()));
    }

    static CompiledExpression compileExpression(Expression expr) {
        switch (expr.getNodeType()) {
            case CONSTANT:
                return compileConstant((ConstantExpression) expr);
            case PARAMETER:
                return compileParameter((ParameterExpression) expr);
            case MEMBER_ACCESS:
                return compileMemberAccess((MemberExpression) expr);
            case CALL:
                return compileMethodCall((MethodCallExpression) expr);
            case INDEX:
                return compileIndex((IndexExpression) expr);
            case NEGATE, NOT, CONVERT, ARRAY_LENGTH, TYPE_AS:
                return compileUnary((UnaryExpression) expr);
            case ADD, SUBTRACT, MULTIPLY, DIVIDE, MODULO, POWER,
                 AND, OR, EXCLUSIVE_OR, AND_ALSO, OR_ELSE,
                 LEFT_SHIFT, RIGHT_SHIFT, COALESCE,
                 EQUAL, NOT_EQUAL, LESS_THAN, LESS_THAN_OR_EQUAL, GREATER_THAN, GREATER_THAN_OR_EQUAL,
                 ARRAY_INDEX:
                return compileBinary((BinaryExpression) expr);
            case TYPE_IS:
                return compileTypeIs((TypeBinaryExpression) expr);
            case CONDITIONAL:
                return compileConditional((ConditionalExpression) expr);
            case LAMBDA:
                return compileLambda((LambdaExpression) expr);
            case INVOKE:
                return compileInvocation((InvocationExpression) expr);
            case NEW:
                return compileNew((NewExpression) expr);
            case MEMBER_INIT:
                return compileMemberInit((MemberInitExpression) expr);
            case NEW_ARRAY_INIT, NEW_ARRAY_BOUNDS:
                return compileNewArray((NewArrayExpression) expr);
            case LIST_INIT:
                return compileListInit((ListInitExpression) expr);
            default:
                throw new UnsupportedNodeKindException(expr.getNodeType());
        }
    }

    // ── Leaves ───────────────────────────────────────────────────────────

    private static CompiledExpression compileConstant(ConstantExpression c) {
        Object value = c.getValue();
        return () -> value;
    }

    private static CompiledExpression compileParameter(ParameterExpression p) {
        Supplier<?> binding = p.getBinding();
        if (binding == null) {
            String name = p.getName();
            return () -> {
                throw new ExpressionEvaluationException("Variable '" + name + "' is not bound to a value");
            };
        }
        return binding::get;
    }

    // ── Members and calls ────────────────────────────────────────────────

    private static CompiledExpression compileMemberAccess(MemberExpression m) {
        CompiledExpression target = compileOptional(m.getTarget());
        Member member = m.getMember();
        makeAccessible((AccessibleObject) member);
        if (member instanceof Field field) {
            return () -> readField(field, requireTarget(target, m.getName()));
        }
        Method getter = (Method) member;
        return () -> invoke(getter, requireTarget(target, m.getName()), new Object[0]);
    }

    private static CompiledExpression compileMethodCall(MethodCallExpression m) {
        CompiledExpression target = compileOptional(m.getTarget());
        CompiledExpression[] arguments = compileAll(m.getArguments());
        Method method = m.getMethod();
        makeAccessible(method);
        return () -> {
            Object instance = requireTarget(target, method.getName());
            return invoke(method, instance, evaluateAll(arguments));
        };
    }

    private static CompiledExpression compileIndex(IndexExpression i) {
        CompiledExpression target = compileExpression(i.getTarget());
        CompiledExpression[] arguments = compileAll(i.getArguments());
        Method accessor = i.getAccessor();
        makeAccessible(accessor);
        return () -> {
            Object instance = requireTarget(target, accessor.getName());
            return invoke(accessor, instance, evaluateAll(arguments));
        };
    }

    // ── Operators ────────────────────────────────────────────────────────

    private static CompiledExpression compileUnary(UnaryExpression u) {
        CompiledExpression operand = compileExpression(u.getOperand());
        Class<?> type = u.getType();
        switch (u.getNodeType()) {
            case NEGATE:
                return () -> NumericOperations.negate(operand.evaluate());
            case NOT:
                return () -> {
                    Object value = operand.evaluate();
                    if (value instanceof Boolean || value instanceof CheckOutcome) {
                        return !toBoolean(value);
                    }
                    return NumericOperations.complement(value);
                };
            case CONVERT:
                return () -> NumericOperations.convert(operand.evaluate(), type);
            case TYPE_AS:
                return () -> {
                    Object value = operand.evaluate();
                    return type.isInstance(value) ? value : null;
                };
            case ARRAY_LENGTH:
                return () -> {
                    Object array = operand.evaluate();
                    if (array == null) {
                        throw new NullPointerException("Cannot read the array length because the array is null");
                    }
                    return Array.getLength(array);
                };
            default:
                throw new UnsupportedNodeKindException(u.getNodeType());
        }
    }

    private static CompiledExpression compileBinary(BinaryExpression b) {
        CompiledExpression left = compileExpression(b.getLeft());
        CompiledExpression right = compileExpression(b.getRight());
        ExpressionType operator = b.getNodeType();
        switch (operator) {
            case AND_ALSO:
                return () -> toBoolean(left.evaluate()) && toBoolean(right.evaluate());
            case OR_ELSE:
                return () -> toBoolean(left.evaluate()) || toBoolean(right.evaluate());
            case COALESCE:
                return () -> {
                    Object value = left.evaluate();
                    return value != null ? value : right.evaluate();
                };
            case ARRAY_INDEX:
                return () -> {
                    Object array = left.evaluate();
                    Object index = right.evaluate();
                    if (array == null) {
                        throw new NullPointerException("Cannot load from array because the array is null");
                    }
                    return Array.get(array, (Integer) NumericOperations.convert(index, int.class));
                };
            case EQUAL:
                return () -> NumericOperations.areEqual(left.evaluate(), right.evaluate());
            case NOT_EQUAL:
                return () -> !NumericOperations.areEqual(left.evaluate(), right.evaluate());
            case LESS_THAN, LESS_THAN_OR_EQUAL, GREATER_THAN, GREATER_THAN_OR_EQUAL:
                return () -> NumericOperations.compare(operator, left.evaluate(), right.evaluate());
            case POWER:
                return () -> NumericOperations.power(left.evaluate(), right.evaluate());
            case LEFT_SHIFT, RIGHT_SHIFT:
                return () -> NumericOperations.shift(operator, left.evaluate(), right.evaluate());
            case ADD:
                if (b.getType() == String.class) {
                    return () -> {
                        Object l = left.evaluate();
                        return String.valueOf(l) + right.evaluate();
                    };
                }
                return () -> NumericOperations.arithmetic(operator, left.evaluate(), right.evaluate());
            case AND, OR, EXCLUSIVE_OR:
                return () -> {
                    Object l = left.evaluate();
                    Object r = right.evaluate();
                    if (l instanceof Boolean lb && r instanceof Boolean rb) {
                        switch (operator) {
                            case AND: return lb & rb;
                            case OR: return lb | rb;
                            default: return lb ^ rb;
                        }
                    }
                    return NumericOperations.arithmetic(operator, l, r);
                };
            default:
                return () -> NumericOperations.arithmetic(operator, left.evaluate(), right.evaluate());
        }
    }

    private static CompiledExpression compileTypeIs(TypeBinaryExpression b) {
        CompiledExpression expression = compileExpression(b.getExpression());
        Class<?> type = TypeUtils.wrap(b.getTypeOperand());
        return () -> type.isInstance(expression.evaluate());
    }

    private static CompiledExpression compileConditional(ConditionalExpression c) {
        CompiledExpression test = compileExpression(c.getTest());
        CompiledExpression ifTrue = compileExpression(c.getIfTrue());
        CompiledExpression ifFalse = compileExpression(c.getIfFalse());
        Class<?> type = c.getType();
        boolean numeric = type.isPrimitive() && TypeUtils.isNumeric(type);
        return () -> {
            Object value = toBoolean(test.evaluate()) ? ifTrue.evaluate() : ifFalse.evaluate();
            // both branches are promoted to the common numeric type, as the ?: operator does
            return numeric ? NumericOperations.convert(value, type) : value;
        };
    }

    // ── Functions ────────────────────────────────────────────────────────

    private static CompiledExpression compileLambda(LambdaExpression lambda) {
        CompiledExpression body = compileExpression(lambda.getBody());
        return () -> (Supplier<Object>) body::evaluate;
    }

    @SuppressWarnings("unchecked")
    private static CompiledExpression compileInvocation(InvocationExpression iv) {
        CompiledExpression function = compileExpression(iv.getExpression());
        CompiledExpression[] arguments = compileAll(iv.getArguments());
        return () -> {
            Object target = function.evaluate();
            Object[] values = evaluateAll(arguments);
            if (values.length == 0 && target instanceof Supplier) {
                return ((Supplier<Object>) target).get();
            }
            if (values.length == 1 && target instanceof Function) {
                return ((Function<Object, Object>) target).apply(values[0]);
            }
            if (values.length == 2 && target instanceof BiFunction) {
                return ((BiFunction<Object, Object, Object>) target).apply(values[0], values[1]);
            }
            if (target == null) {
                throw new NullPointerException("Cannot invoke a null function");
            }
            throw new ExpressionEvaluationException("Cannot invoke " + target.getClass().getName()
                    + " with " + values.length + " argument(s)");
        };
    }

    // ── Construction ─────────────────────────────────────────────────────

    private static CompiledExpression compileNew(NewExpression nex) {
        CompiledExpression[] arguments = compileAll(nex.getArguments());
        Constructor<?> constructor = nex.getConstructor();
        makeAccessible(constructor);
        return () -> construct(constructor, evaluateAll(arguments));
    }

    private static CompiledExpression compileMemberInit(MemberInitExpression init) {
        CompiledExpression instance = compileNew(init.getNewExpression());
        List<MemberBinding> bindings = init.getBindings();
        CompiledExpression[] values = new CompiledExpression[bindings.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = compileExpression(bindings.get(i).getExpression());
            makeAccessible((AccessibleObject) bindings.get(i).getMember());
        }
        return () -> {
            Object object = instance.evaluate();
            for (int i = 0; i < values.length; i++) {
                Member member = bindings.get(i).getMember();
                Object value = values[i].evaluate();
                if (member instanceof Field field) {
                    writeField(field, object, value);
                } else {
                    invoke((Method) member, object, new Object[]{value});
                }
            }
            return object;
        };
    }

    private static CompiledExpression compileNewArray(NewArrayExpression na) {
        CompiledExpression[] expressions = compileAll(na.getExpressions());
        if (na.getNodeType() == ExpressionType.NEW_ARRAY_BOUNDS) {
            Class<?> elementType = na.getType();
            for (int i = 0; i < expressions.length; i++) {
                elementType = elementType.getComponentType();
            }
            Class<?> innermost = elementType;
            return () -> {
                Object[] lengths = evaluateAll(expressions);
                int[] dimensions = new int[lengths.length];
                for (int i = 0; i < lengths.length; i++) {
                    dimensions[i] = (Integer) NumericOperations.convert(lengths[i], int.class);
                }
                return Array.newInstance(innermost, dimensions);
            };
        }
        Class<?> elementType = na.getElementType();
        return () -> {
            Object[] values = evaluateAll(expressions);
            Object array = Array.newInstance(elementType, values.length);
            for (int i = 0; i < values.length; i++) {
                Array.set(array, i, values[i]);
            }
            return array;
        };
    }

    private static CompiledExpression compileListInit(ListInitExpression init) {
        CompiledExpression instance = compileNew(init.getNewExpression());
        CompiledExpression[] initializers = compileAll(init.getInitializers());
        Method add = init.getAddMethod();
        makeAccessible(add);
        return () -> {
            Object collection = instance.evaluate();
            for (CompiledExpression initializer : initializers) {
                invoke(add, collection, new Object[]{initializer.evaluate()});
            }
            return collection;
        };
    }

    // ── Helpers ──────────────────────────────────────────────────────────

    private static CompiledExpression compileOptional(Expression expression) {
        return expression == null ? null : compileExpression(expression);
    }

    private static CompiledExpression[] compileAll(List<Expression> expressions) {
        CompiledExpression[] compiled = new CompiledExpression[expressions.size()];
        for (int i = 0; i < compiled.length; i++) {
            compiled[i] = compileExpression(expressions.get(i));
        }
        return compiled;
    }

    private static Object[] evaluateAll(CompiledExpression[] expressions) {
        Object[] values = new Object[expressions.length];
        for (int i = 0; i < values.length; i++) {
            values[i] = expressions[i].evaluate();
        }
        return values;
    }

    /**
     * Evaluates the target of an instance member; static members have none and read as {@code null}.
     */
    private static Object requireTarget(CompiledExpression target, String memberName) {
        if (target == null) {
            return null;
        }
        Object instance = target.evaluate();
        if (instance == null) {
            throw new NullPointerException("Cannot access '" + memberName + "' because its target is null");
        }
        return instance;
    }

    private static void makeAccessible(AccessibleObject member) {
        // public members of exported packages are reachable either way
        member.trySetAccessible();
    }

    private static Object readField(Field field, Object instance) {
        try {
            return field.get(instance);
        } catch (IllegalAccessException e) {
            throw new ExpressionEvaluationException("Cannot read field '" + field.getName() + "'", e);
        }
    }

    private static void writeField(Field field, Object instance, Object value) {
        try {
            field.set(instance, value);
        } catch (IllegalAccessException e) {
            throw new ExpressionEvaluationException("Cannot write field '" + field.getName() + "'", e);
        }
    }

    private static Object invoke(Method method, Object instance, Object[] arguments) {
        try {
            return method.invoke(instance, arguments);
        } catch (InvocationTargetException e) {
            throw rethrow(e.getCause());
        } catch (IllegalAccessException | IllegalArgumentException e) {
            throw new ExpressionEvaluationException("Cannot invoke method '" + method.getName() + "'", e);
        }
    }

    private static Object construct(Constructor<?> constructor, Object[] arguments) {
        try {
            return constructor.newInstance(arguments);
        } catch (InvocationTargetException e) {
            throw rethrow(e.getCause());
        } catch (ReflectiveOperationException | IllegalArgumentException e) {
            throw new ExpressionEvaluationException("Cannot construct " + constructor.getDeclaringClass().getName(), e);
        }
    }

    /**
     * Rethrows the fault raised by the code under test as is, without wrapping checked exceptions.
     */
    private static RuntimeException rethrow(Throwable cause) {
        ExpressionCompiler.<RuntimeException>sneakyThrow(cause);
        return new IllegalStateException("unreachable");
    }

    @SuppressWarnings("unchecked")
    private static <T extends Throwable> void sneakyThrow(Throwable t) throws T {
        throw (T) t;
    }
}
