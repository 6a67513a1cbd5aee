package org.verifythat.expression;

import org.verifythat.MethodResolutionException;
import org.verifythat.util.ReflectionUtils;
import org.verifythat.util.TypeUtils;

import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.Member;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Supplier;

/**
 * Factory methods for every node kind.
 * <p>
 * Factories check the structure of what they build (operand kinds, static versus instance members,
 * argument counts) and compute each node's static type, so a tree that builds is a tree the
 * renderer and the compiler accept. Name-based lookups raise {@link MethodResolutionException}
 * when nothing matches.
 */
public final class Expressions {

    private Expressions() {}

    // ── Leaves ───────────────────────────────────────────────────────────

    /**
     * A constant typed by its value. Boxed primitives are typed as the primitive, so
     * {@code constant(1)} is an {@code int} constant; {@code null} is typed {@code Object}.
     */
    public static ConstantExpression constant(Object value) {
        return new ConstantExpression(value, value == null ? Object.class : TypeUtils.unwrap(value.getClass()));
    }

    public static ConstantExpression constant(Object value, Class<?> type) {
        if (value == null ? type.isPrimitive() : !TypeUtils.wrap(type).isInstance(value)) {
            throw new IllegalArgumentException("Value " + value + " is not of type " + type.getName());
        }
        return new ConstantExpression(value, type);
    }

    public static ParameterExpression variable(String name, Class<?> type, Supplier<?> binding) {
        return new ParameterExpression(name, type, binding);
    }

    /**
     * A variable bound to a fixed value, typed like {@link #constant(Object)}.
     */
    public static ParameterExpression variable(String name, Object value) {
        Class<?> type = value == null ? Object.class : TypeUtils.unwrap(value.getClass());
        return new ParameterExpression(name, type, () -> value);
    }

    /**
     * A variable with no binding. Rendering it is fine; evaluating it fails.
     */
    public static ParameterExpression parameter(String name, Class<?> type) {
        return new ParameterExpression(name, type, null);
    }

    // ── Members ──────────────────────────────────────────────────────────

    public static MemberExpression field(Expression target, Field field) {
        checkStatic(field, target);
        return new MemberExpression(target, field, field.getName(), field.getType());
    }

    public static MemberExpression field(Expression target, String name) {
        Field field = ReflectionUtils.findField(target.getType(), name);
        if (field == null || Modifier.isStatic(field.getModifiers())) {
            throw new IllegalArgumentException("No instance field '" + name + "' on " + target.getType().getName());
        }
        return field(target, field);
    }

    public static MemberExpression staticField(Class<?> type, String name) {
        Field field = ReflectionUtils.findField(type, name);
        if (field == null || !Modifier.isStatic(field.getModifiers())) {
            throw new IllegalArgumentException("No static field '" + name + "' on " + type.getName());
        }
        return field(null, field);
    }

    public static MemberExpression property(Expression target, Method getter) {
        checkStatic(getter, target);
        if (getter.getParameterCount() != 0 || getter.getReturnType() == void.class) {
            throw new IllegalArgumentException("Method " + getter.getName() + " is not a getter");
        }
        return new MemberExpression(target, getter, ReflectionUtils.propertyName(getter), getter.getReturnType());
    }

    public static MemberExpression property(Expression target, String name) {
        return property(target, ReflectionUtils.findGetter(TypeUtils.wrap(target.getType()), name, false));
    }

    public static MemberExpression staticProperty(Class<?> type, String name) {
        return property(null, ReflectionUtils.findGetter(type, name, true));
    }

    // ── Calls ────────────────────────────────────────────────────────────

    public static MethodCallExpression call(Expression target, Method method, Expression... arguments) {
        return call(target, method, Arrays.asList(arguments));
    }

    public static MethodCallExpression call(Expression target, Method method, List<Expression> arguments) {
        checkStatic(method, target);
        checkArguments(method.getName(), method.getParameterTypes(), arguments);
        return new MethodCallExpression(target, method, arguments);
    }

    /**
     * A static call, or an extension call when the method is annotated with {@link Extension}.
     */
    public static MethodCallExpression call(Method method, Expression... arguments) {
        return call(null, method, arguments);
    }

    public static MethodCallExpression call(Expression target, String methodName, Expression... arguments) {
        List<Expression> args = Arrays.asList(arguments);
        Method method = ReflectionUtils.findMethod(TypeUtils.wrap(target.getType()), methodName, false, typesOf(args));
        return call(target, method, args);
    }

    public static MethodCallExpression call(Class<?> type, String methodName, Expression... arguments) {
        List<Expression> args = Arrays.asList(arguments);
        Method method = ReflectionUtils.findMethod(type, methodName, true, typesOf(args));
        return call(null, method, args);
    }

    public static IndexExpression index(Expression target, Method accessor, Expression... arguments) {
        List<Expression> args = Arrays.asList(arguments);
        checkStatic(accessor, target);
        if (target == null) {
            throw new IllegalArgumentException("Indexer " + accessor.getName() + " requires a target");
        }
        checkArguments(accessor.getName(), accessor.getParameterTypes(), args);
        return new IndexExpression(target, accessor, args);
    }

    /**
     * An indexed read through the target's {@link Indexer} method, or its {@code get} method when
     * it has none ({@code List.get(int)}, {@code Map.get(Object)}).
     */
    public static IndexExpression index(Expression target, Expression... arguments) {
        List<Expression> args = Arrays.asList(arguments);
        Class<?> type = target.getType();
        Method accessor = ReflectionUtils.findAnnotatedMethod(type, Indexer.class, typesOf(args));
        if (accessor == null) {
            accessor = ReflectionUtils.findMethod(type, "get", false, typesOf(args));
        }
        return index(target, accessor, arguments);
    }

    public static BinaryExpression arrayIndex(Expression array, Expression index) {
        if (!array.getType().isArray()) {
            throw new IllegalArgumentException("Array index requires an array, got " + array.getType().getName());
        }
        if (TypeUtils.promote(index.getType()) != int.class) {
            throw new IllegalArgumentException("Array index must be an int, got " + index.getType().getName());
        }
        return new BinaryExpression(ExpressionType.ARRAY_INDEX, array, index, array.getType().getComponentType());
    }

    // ── Unary ────────────────────────────────────────────────────────────

    public static UnaryExpression arrayLength(Expression array) {
        if (!array.getType().isArray()) {
            throw new IllegalArgumentException("Array length requires an array, got " + array.getType().getName());
        }
        return new UnaryExpression(ExpressionType.ARRAY_LENGTH, array, int.class);
    }

    public static UnaryExpression negate(Expression operand) {
        Class<?> type = TypeUtils.promote(operand.getType());
        if (type == null) {
            throw new IllegalArgumentException("Negate requires a numeric operand, got " + operand.getType().getName());
        }
        return new UnaryExpression(ExpressionType.NEGATE, operand, type);
    }

    /**
     * Logical negation of a boolean (or of a {@link org.verifythat.CheckOutcome}), bitwise
     * complement of an integral value.
     */
    public static UnaryExpression not(Expression operand) {
        Class<?> type;
        if (TypeUtils.isBooleanLike(operand.getType())) {
            type = boolean.class;
        } else if (TypeUtils.isIntegral(operand.getType())) {
            type = TypeUtils.promote(operand.getType());
        } else {
            throw new IllegalArgumentException("Not requires a boolean or integral operand, got " + operand.getType().getName());
        }
        return new UnaryExpression(ExpressionType.NOT, operand, type);
    }

    public static UnaryExpression convert(Expression operand, Class<?> type) {
        return new UnaryExpression(ExpressionType.CONVERT, operand, type);
    }

    public static UnaryExpression typeAs(Expression operand, Class<?> type) {
        if (type.isPrimitive()) {
            throw new IllegalArgumentException("TypeAs requires a reference type, got " + type.getName());
        }
        return new UnaryExpression(ExpressionType.TYPE_AS, operand, type);
    }

    public static TypeBinaryExpression typeIs(Expression expression, Class<?> type) {
        return new TypeBinaryExpression(expression, type);
    }

    public static ConditionalExpression condition(Expression test, Expression ifTrue, Expression ifFalse) {
        checkBoolean("Conditional test", test);
        Class<?> type;
        if (ifTrue.getType() == ifFalse.getType()) {
            type = ifTrue.getType();
        } else if (TypeUtils.promote(ifTrue.getType(), ifFalse.getType()) != null) {
            type = TypeUtils.promote(ifTrue.getType(), ifFalse.getType());
        } else {
            type = Object.class;
        }
        return new ConditionalExpression(test, ifTrue, ifFalse, type);
    }

    // ── Binary ───────────────────────────────────────────────────────────

    public static BinaryExpression add(Expression left, Expression right) {
        return makeBinary(ExpressionType.ADD, left, right);
    }

    public static BinaryExpression subtract(Expression left, Expression right) {
        return makeBinary(ExpressionType.SUBTRACT, left, right);
    }

    public static BinaryExpression multiply(Expression left, Expression right) {
        return makeBinary(ExpressionType.MULTIPLY, left, right);
    }

    public static BinaryExpression divide(Expression left, Expression right) {
        return makeBinary(ExpressionType.DIVIDE, left, right);
    }

    public static BinaryExpression modulo(Expression left, Expression right) {
        return makeBinary(ExpressionType.MODULO, left, right);
    }

    public static BinaryExpression power(Expression left, Expression right) {
        return makeBinary(ExpressionType.POWER, left, right);
    }

    public static BinaryExpression and(Expression left, Expression right) {
        return makeBinary(ExpressionType.AND, left, right);
    }

    public static BinaryExpression or(Expression left, Expression right) {
        return makeBinary(ExpressionType.OR, left, right);
    }

    public static BinaryExpression exclusiveOr(Expression left, Expression right) {
        return makeBinary(ExpressionType.EXCLUSIVE_OR, left, right);
    }

    public static BinaryExpression andAlso(Expression left, Expression right) {
        return makeBinary(ExpressionType.AND_ALSO, left, right);
    }

    public static BinaryExpression orElse(Expression left, Expression right) {
        return makeBinary(ExpressionType.OR_ELSE, left, right);
    }

    public static BinaryExpression leftShift(Expression left, Expression right) {
        return makeBinary(ExpressionType.LEFT_SHIFT, left, right);
    }

    public static BinaryExpression rightShift(Expression left, Expression right) {
        return makeBinary(ExpressionType.RIGHT_SHIFT, left, right);
    }

    public static BinaryExpression coalesce(Expression left, Expression right) {
        return makeBinary(ExpressionType.COALESCE, left, right);
    }

    public static BinaryExpression equal(Expression left, Expression right) {
        return makeBinary(ExpressionType.EQUAL, left, right);
    }

    public static BinaryExpression notEqual(Expression left, Expression right) {
        return makeBinary(ExpressionType.NOT_EQUAL, left, right);
    }

    public static BinaryExpression lessThan(Expression left, Expression right) {
        return makeBinary(ExpressionType.LESS_THAN, left, right);
    }

    public static BinaryExpression lessThanOrEqual(Expression left, Expression right) {
        return makeBinary(ExpressionType.LESS_THAN_OR_EQUAL, left, right);
    }

    public static BinaryExpression greaterThan(Expression left, Expression right) {
        return makeBinary(ExpressionType.GREATER_THAN, left, right);
    }

    public static BinaryExpression greaterThanOrEqual(Expression left, Expression right) {
        return makeBinary(ExpressionType.GREATER_THAN_OR_EQUAL, left, right);
    }

    public static BinaryExpression makeBinary(ExpressionType nodeType, Expression left, Expression right) {
        if (!nodeType.isBinary()) {
            throw new IllegalArgumentException(nodeType + " is not a binary node type");
        }
        if (nodeType == ExpressionType.ARRAY_INDEX) {
            return arrayIndex(left, right);
        }
        return new BinaryExpression(nodeType, left, right, binaryType(nodeType, left.getType(), right.getType()));
    }

    private static Class<?> binaryType(ExpressionType nodeType, Class<?> left, Class<?> right) {
        Class<?> promoted = TypeUtils.promote(left, right);
        switch (nodeType) {
            case EQUAL:
            case NOT_EQUAL:
                return boolean.class;
            case LESS_THAN:
            case LESS_THAN_OR_EQUAL:
            case GREATER_THAN:
            case GREATER_THAN_OR_EQUAL:
                if (promoted == null && !Comparable.class.isAssignableFrom(TypeUtils.wrap(left))) {
                    throw new IllegalArgumentException(nodeType + " requires numeric or comparable operands, got "
                            + left.getName() + " and " + right.getName());
                }
                return boolean.class;
            case AND_ALSO:
            case OR_ELSE:
                if (!TypeUtils.isBooleanLike(left) || !TypeUtils.isBooleanLike(right)) {
                    throw new IllegalArgumentException(nodeType + " requires boolean operands, got "
                            + left.getName() + " and " + right.getName());
                }
                return boolean.class;
            case ADD:
                if (left == String.class || right == String.class) {
                    return String.class;
                }
                return requireNumeric(nodeType, promoted, left, right);
            case SUBTRACT:
            case MULTIPLY:
            case DIVIDE:
            case MODULO:
                return requireNumeric(nodeType, promoted, left, right);
            case POWER:
                requireNumeric(nodeType, promoted, left, right);
                return double.class;
            case AND:
            case OR:
            case EXCLUSIVE_OR:
                if (TypeUtils.isBoolean(left) && TypeUtils.isBoolean(right)) {
                    return boolean.class;
                }
                if (TypeUtils.isIntegral(left) && TypeUtils.isIntegral(right)) {
                    return promoted;
                }
                throw new IllegalArgumentException(nodeType + " requires boolean or integral operands, got "
                        + left.getName() + " and " + right.getName());
            case LEFT_SHIFT:
            case RIGHT_SHIFT:
                if (!TypeUtils.isIntegral(left) || !TypeUtils.isIntegral(right)) {
                    throw new IllegalArgumentException(nodeType + " requires integral operands, got "
                            + left.getName() + " and " + right.getName());
                }
                return TypeUtils.promote(left);
            case COALESCE:
                if (left.isPrimitive()) {
                    throw new IllegalArgumentException("Coalesce requires a reference left operand, got " + left.getName());
                }
                return left;
            default:
                throw new IllegalArgumentException(nodeType + " is not a binary node type");
        }
    }

    private static Class<?> requireNumeric(ExpressionType nodeType, Class<?> promoted, Class<?> left, Class<?> right) {
        if (promoted == null) {
            throw new IllegalArgumentException(nodeType + " requires numeric operands, got "
                    + left.getName() + " and " + right.getName());
        }
        return promoted;
    }

    // ── Construction ─────────────────────────────────────────────────────

    public static NewExpression newObject(Constructor<?> constructor, Expression... arguments) {
        List<Expression> args = Arrays.asList(arguments);
        checkArguments("<init>", constructor.getParameterTypes(), args);
        return new NewExpression(constructor, args);
    }

    public static NewExpression newObject(Class<?> type, Expression... arguments) {
        return newObject(ReflectionUtils.findConstructor(type, typesOf(Arrays.asList(arguments))), arguments);
    }

    /**
     * Binds a value to a field, or to a setter when the member is a method.
     */
    public static MemberBinding bind(Member member, Expression expression) {
        if (member instanceof Field field) {
            if (!TypeUtils.isAssignable(field.getType(), expression.getType())) {
                throw new IllegalArgumentException("Cannot assign " + expression.getType().getName() + " to field " + field.getName());
            }
            return new MemberBinding(field, field.getName(), expression);
        }
        if (member instanceof Method setter && setter.getParameterCount() == 1) {
            if (!TypeUtils.isAssignable(setter.getParameterTypes()[0], expression.getType())) {
                throw new IllegalArgumentException("Cannot pass " + expression.getType().getName() + " to setter " + setter.getName());
            }
            return new MemberBinding(setter, ReflectionUtils.propertyName(setter), expression);
        }
        throw new IllegalArgumentException("Member " + member.getName() + " is neither a field nor a setter");
    }

    /**
     * Binds a value to the named property of {@code type}, through its setter or else its field.
     */
    public static MemberBinding bind(Class<?> type, String name, Expression expression) {
        Method setter = ReflectionUtils.findSetter(type, name);
        if (setter != null) {
            return bind(setter, expression);
        }
        Field field = ReflectionUtils.findField(type, name);
        if (field == null) {
            throw new MethodResolutionException(type.getName(), name, 1);
        }
        return bind(field, expression);
    }

    public static MemberInitExpression memberInit(NewExpression newExpression, MemberBinding... bindings) {
        for (MemberBinding binding : bindings) {
            if (!binding.getMember().getDeclaringClass().isAssignableFrom(newExpression.getType())) {
                throw new IllegalArgumentException("Member " + binding.getName() + " is not a member of "
                        + newExpression.getType().getName());
            }
        }
        return new MemberInitExpression(newExpression, Arrays.asList(bindings));
    }

    public static NewArrayExpression newArrayInit(Class<?> elementType, Expression... elements) {
        for (Expression element : elements) {
            if (!TypeUtils.isAssignable(elementType, element.getType())) {
                throw new IllegalArgumentException("Cannot store " + element.getType().getName() + " in "
                        + elementType.getName() + "[]");
            }
        }
        return new NewArrayExpression(ExpressionType.NEW_ARRAY_INIT, elementType.arrayType(), Arrays.asList(elements));
    }

    public static NewArrayExpression newArrayBounds(Class<?> elementType, Expression... lengths) {
        if (lengths.length == 0) {
            throw new IllegalArgumentException("Array creation requires at least one dimension");
        }
        Class<?> arrayType = elementType;
        for (Expression length : lengths) {
            if (TypeUtils.promote(length.getType()) != int.class) {
                throw new IllegalArgumentException("Array length must be an int, got " + length.getType().getName());
            }
            arrayType = arrayType.arrayType();
        }
        return new NewArrayExpression(ExpressionType.NEW_ARRAY_BOUNDS, arrayType, Arrays.asList(lengths));
    }

    /**
     * Collection creation followed by one {@code add} call per initializer.
     */
    public static ListInitExpression listInit(NewExpression newExpression, Expression... initializers) {
        Method add = ReflectionUtils.findMethod(newExpression.getType(), "add", false, List.of(Object.class));
        return new ListInitExpression(newExpression, add, Arrays.asList(initializers));
    }

    // ── Functions ────────────────────────────────────────────────────────

    public static InvocationExpression invoke(Expression expression, Expression... arguments) {
        if (arguments.length > 2) {
            throw new IllegalArgumentException("Invocation supports at most two arguments, got " + arguments.length);
        }
        Class<?> type = expression instanceof LambdaExpression lambda ? lambda.getBody().getType() : Object.class;
        return new InvocationExpression(expression, Arrays.asList(arguments), type);
    }

    public static LambdaExpression lambda(Expression body) {
        return new LambdaExpression(body);
    }

    // ── Checks ───────────────────────────────────────────────────────────

    private static void checkStatic(Member member, Expression target) {
        boolean isStatic = Modifier.isStatic(member.getModifiers());
        if (isStatic && target != null) {
            throw new IllegalArgumentException("Static member " + member.getName() + " must not have a target");
        }
        if (!isStatic && target == null) {
            throw new IllegalArgumentException("Instance member " + member.getName() + " requires a target");
        }
    }

    private static void checkArguments(String name, Class<?>[] parameterTypes, List<Expression> arguments) {
        if (parameterTypes.length != arguments.size()) {
            throw new IllegalArgumentException("Incorrect number of arguments for " + name + ": expected "
                    + parameterTypes.length + ", got " + arguments.size());
        }
        for (int i = 0; i < parameterTypes.length; i++) {
            if (!TypeUtils.isAssignable(parameterTypes[i], arguments.get(i).getType())) {
                throw new IllegalArgumentException("Argument " + i + " of " + name + " must be "
                        + parameterTypes[i].getName() + ", got " + arguments.get(i).getType().getName());
            }
        }
    }

    private static void checkBoolean(String what, Expression expression) {
        if (!TypeUtils.isBooleanLike(expression.getType())) {
            throw new IllegalArgumentException(what + " must be boolean, got " + expression.getType().getName());
        }
    }

    private static List<Class<?>> typesOf(List<Expression> expressions) {
        List<Class<?>> types = new ArrayList<>(expressions.size());
        for (Expression expression : expressions) {
            types.add(expression.getType());
        }
        return types;
    }
}
