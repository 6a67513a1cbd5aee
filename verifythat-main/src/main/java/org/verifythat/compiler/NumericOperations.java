package org.verifythat.compiler;

import org.verifythat.ExpressionEvaluationException;
import org.verifythat.expression.ExpressionType;
import org.verifythat.util.TypeUtils;

import java.util.Objects;

/**
 * Runtime arithmetic over boxed operands, following Java's binary numeric promotion.
 */
public final class NumericOperations {

    private NumericOperations() {}

    public static boolean isNumeric(Object value) {
        return value != null && TypeUtils.isNumeric(value.getClass());
    }

    /**
     * Applies an arithmetic or bitwise operator after promoting both operands to their common type.
     */
    public static Object arithmetic(ExpressionType operator, Object left, Object right) {
        Class<?> type = promotedType(operator, left, right);
        if (type == int.class) {
            int a = toNumber(left).intValue();
            int b = toNumber(right).intValue();
            switch (operator) {
                case ADD: return a + b;
                case SUBTRACT: return a - b;
                case MULTIPLY: return a * b;
                case DIVIDE: return a / b;
                case MODULO: return a % b;
                case AND: return a & b;
                case OR: return a | b;
                case EXCLUSIVE_OR: return a ^ b;
                default: break;
            }
        } else if (type == long.class) {
            long a = toNumber(left).longValue();
            long b = toNumber(right).longValue();
            switch (operator) {
                case ADD: return a + b;
                case SUBTRACT: return a - b;
                case MULTIPLY: return a * b;
                case DIVIDE: return a / b;
                case MODULO: return a % b;
                case AND: return a & b;
                case OR: return a | b;
                case EXCLUSIVE_OR: return a ^ b;
                default: break;
            }
        } else if (type == float.class) {
            float a = toNumber(left).floatValue();
            float b = toNumber(right).floatValue();
            switch (operator) {
                case ADD: return a + b;
                case SUBTRACT: return a - b;
                case MULTIPLY: return a * b;
                case DIVIDE: return a / b;
                case MODULO: return a % b;
                default: break;
            }
        } else {
            double a = toNumber(left).doubleValue();
            double b = toNumber(right).doubleValue();
            switch (operator) {
                case ADD: return a + b;
                case SUBTRACT: return a - b;
                case MULTIPLY: return a * b;
                case DIVIDE: return a / b;
                case MODULO: return a % b;
                default: break;
            }
        }
        throw new ExpressionEvaluationException("Operator " + operator + " cannot be applied to "
                + describe(left) + " and " + describe(right));
    }

    public static Object shift(ExpressionType operator, Object left, Object right) {
        Class<?> type = TypeUtils.promote(typeOf(operator, left));
        int distance = toNumber(right).intValue();
        boolean leftShift = operator == ExpressionType.LEFT_SHIFT;
        if (type == int.class) {
            int value = toNumber(left).intValue();
            return leftShift ? value << distance : value >> distance;
        }
        if (type == long.class) {
            long value = toNumber(left).longValue();
            return leftShift ? value << distance : value >> distance;
        }
        throw new ExpressionEvaluationException("Operator " + operator + " cannot be applied to " + describe(left));
    }

    public static double power(Object left, Object right) {
        return Math.pow(toNumber(requireOperand(ExpressionType.POWER, left)).doubleValue(),
                toNumber(requireOperand(ExpressionType.POWER, right)).doubleValue());
    }

    public static Object negate(Object operand) {
        Class<?> type = TypeUtils.promote(typeOf(ExpressionType.NEGATE, operand));
        Number value = toNumber(operand);
        if (type == int.class) {
            return -value.intValue();
        }
        if (type == long.class) {
            return -value.longValue();
        }
        if (type == float.class) {
            return -value.floatValue();
        }
        if (type == double.class) {
            return -value.doubleValue();
        }
        throw new ExpressionEvaluationException("Operator NEGATE cannot be applied to " + describe(operand));
    }

    public static Object complement(Object operand) {
        Class<?> type = TypeUtils.promote(typeOf(ExpressionType.NOT, operand));
        if (type == int.class) {
            return ~toNumber(operand).intValue();
        }
        if (type == long.class) {
            return ~toNumber(operand).longValue();
        }
        throw new ExpressionEvaluationException("Operator NOT cannot be applied to " + describe(operand));
    }

    /**
     * Numbers compare by promoted value, so {@code 1 == 1L}; everything else by {@code equals}.
     */
    public static boolean areEqual(Object left, Object right) {
        if (isNumeric(left) && isNumeric(right)) {
            Class<?> type = TypeUtils.promote(left.getClass(), right.getClass());
            if (type == float.class || type == double.class) {
                // NaN is unequal to itself, 0.0 equals -0.0
                return toNumber(left).doubleValue() == toNumber(right).doubleValue();
            }
            return toNumber(left).longValue() == toNumber(right).longValue();
        }
        return Objects.equals(left, right);
    }

    /**
     * Applies {@code <}, {@code <=}, {@code >} or {@code >=}. Floating-point operands keep Java's
     * operator semantics: any comparison with NaN is false and {@code -0.0} equals {@code 0.0}.
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public static boolean compare(ExpressionType operator, Object left, Object right) {
        if (isNumeric(left) && isNumeric(right)) {
            Class<?> type = TypeUtils.promote(left.getClass(), right.getClass());
            if (type == float.class || type == double.class) {
                // widening float to double keeps both order and NaN
                return holds(operator, toNumber(left).doubleValue(), toNumber(right).doubleValue());
            }
            return holds(operator, Long.compare(toNumber(left).longValue(), toNumber(right).longValue()));
        }
        requireOperand(operator, left);
        requireOperand(operator, right);
        if (left instanceof Comparable comparable && left.getClass().isInstance(right)) {
            return holds(operator, comparable.compareTo(right));
        }
        if (right instanceof Comparable comparable && right.getClass().isInstance(left)) {
            return holds(operator, -comparable.compareTo(left));
        }
        throw new ExpressionEvaluationException("Operator " + operator + " cannot be applied to "
                + describe(left) + " and " + describe(right));
    }

    /**
     * Casts a value to {@code type}: numeric conversion between primitives and their boxes,
     * a checked reference cast otherwise.
     */
    public static Object convert(Object value, Class<?> type) {
        if (value == null) {
            if (type.isPrimitive()) {
                throw new NullPointerException("Cannot convert null to " + type.getName());
            }
            return null;
        }
        Class<?> target = TypeUtils.unwrap(type);
        if (target.isPrimitive() && target != boolean.class && isNumeric(value)) {
            Number number = toNumber(value);
            if (target == int.class) {
                return number.intValue();
            }
            if (target == long.class) {
                return number.longValue();
            }
            if (target == double.class) {
                return number.doubleValue();
            }
            if (target == float.class) {
                return number.floatValue();
            }
            if (target == short.class) {
                return number.shortValue();
            }
            if (target == byte.class) {
                return number.byteValue();
            }
            if (target == char.class) {
                return (char) number.intValue();
            }
        }
        return TypeUtils.wrap(type).cast(value);
    }

    private static boolean holds(ExpressionType operator, double a, double b) {
        switch (operator) {
            case LESS_THAN: return a < b;
            case LESS_THAN_OR_EQUAL: return a <= b;
            case GREATER_THAN: return a > b;
            case GREATER_THAN_OR_EQUAL: return a >= b;
            default: throw new ExpressionEvaluationException("Operator " + operator + " is not an ordering");
        }
    }

    private static boolean holds(ExpressionType operator, int sign) {
        switch (operator) {
            case LESS_THAN: return sign < 0;
            case LESS_THAN_OR_EQUAL: return sign <= 0;
            case GREATER_THAN: return sign > 0;
            case GREATER_THAN_OR_EQUAL: return sign >= 0;
            default: throw new ExpressionEvaluationException("Operator " + operator + " is not an ordering");
        }
    }

    private static Class<?> promotedType(ExpressionType operator, Object left, Object right) {
        Class<?> type = TypeUtils.promote(typeOf(operator, left), typeOf(operator, right));
        if (type == null) {
            throw new ExpressionEvaluationException("Operator " + operator + " cannot be applied to "
                    + describe(left) + " and " + describe(right));
        }
        return type;
    }

    private static Class<?> typeOf(ExpressionType operator, Object operand) {
        return requireOperand(operator, operand).getClass();
    }

    private static Object requireOperand(ExpressionType operator, Object operand) {
        if (operand == null) {
            throw new NullPointerException("Operand of " + operator + " is null");
        }
        return operand;
    }

    private static Number toNumber(Object value) {
        if (value instanceof Character c) {
            return (int) c;
        }
        if (value instanceof Number n) {
            return n;
        }
        throw new ExpressionEvaluationException("Expected a number, got " + describe(value));
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName() + " " + value;
    }
}
