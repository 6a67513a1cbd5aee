package org.verifythat.util;

import org.verifythat.CheckOutcome;

import java.util.Map;

/**
 * Boxing, unboxing and numeric promotion rules over {@link Class} objects.
 */
public final class TypeUtils {

    private TypeUtils() {}

    // Primitive → boxed
    private static final Map<Class<?>, Class<?>> BOXING_TYPES = Map.of(
        int.class, Integer.class,
        long.class, Long.class,
        double.class, Double.class,
        float.class, Float.class,
        boolean.class, Boolean.class,
        byte.class, Byte.class,
        char.class, Character.class,
        short.class, Short.class,
        void.class, Void.class
    );

    // Boxed → primitive
    private static final Map<Class<?>, Class<?>> UNBOXING_TYPES = Map.of(
        Integer.class, int.class,
        Long.class, long.class,
        Double.class, double.class,
        Float.class, float.class,
        Boolean.class, boolean.class,
        Byte.class, byte.class,
        Character.class, char.class,
        Short.class, short.class,
        Void.class, void.class
    );

    // Numeric primitives ordered by widening rank
    private static final Map<Class<?>, Integer> NUMERIC_RANK = Map.of(
        byte.class, 1,
        short.class, 2,
        char.class, 2,
        int.class, 3,
        long.class, 4,
        float.class, 5,
        double.class, 6
    );

    public static Class<?> wrap(Class<?> type) {
        Class<?> boxed = BOXING_TYPES.get(type);
        return boxed != null ? boxed : type;
    }

    public static Class<?> unwrap(Class<?> type) {
        Class<?> primitive = UNBOXING_TYPES.get(type);
        return primitive != null ? primitive : type;
    }

    public static boolean isNumeric(Class<?> type) {
        return NUMERIC_RANK.containsKey(unwrap(type));
    }

    public static boolean isIntegral(Class<?> type) {
        Class<?> primitive = unwrap(type);
        return primitive == int.class || primitive == long.class || primitive == short.class
                || primitive == byte.class || primitive == char.class;
    }

    public static boolean isBoolean(Class<?> type) {
        return unwrap(type) == boolean.class;
    }

    /**
     * True for types that can stand where a boolean is expected: {@code boolean}, {@code Boolean}
     * and {@link CheckOutcome}.
     */
    public static boolean isBooleanLike(Class<?> type) {
        return isBoolean(type) || type == CheckOutcome.class;
    }

    /**
     * Unary numeric promotion: {@code byte}, {@code short} and {@code char} become {@code int}.
     *
     * @return the promoted primitive type, or {@code null} when {@code type} is not numeric
     */
    public static Class<?> promote(Class<?> type) {
        Integer rank = NUMERIC_RANK.get(unwrap(type));
        if (rank == null) {
            return null;
        }
        return rank <= 3 ? int.class : unwrap(type);
    }

    /**
     * Binary numeric promotion.
     *
     * @return the common primitive type, or {@code null} when either type is not numeric
     */
    public static Class<?> promote(Class<?> left, Class<?> right) {
        Class<?> l = promote(left);
        Class<?> r = promote(right);
        if (l == null || r == null) {
            return null;
        }
        return NUMERIC_RANK.get(l) >= NUMERIC_RANK.get(r) ? l : r;
    }

    /**
     * Method invocation conversion: identity, boxing, unboxing, primitive widening and reference widening.
     */
    public static boolean isAssignable(Class<?> parameterType, Class<?> argumentType) {
        if (argumentType == null) {
            // a null literal fits any reference parameter
            return !parameterType.isPrimitive();
        }
        if (wrap(parameterType).isAssignableFrom(wrap(argumentType))) {
            return true;
        }
        if (parameterType.isPrimitive() || argumentType.isPrimitive()) {
            Class<?> from = unwrap(argumentType);
            Class<?> to = unwrap(parameterType);
            if (from == char.class) {
                return to == int.class || to == long.class || to == float.class || to == double.class;
            }
            if (to == char.class) {
                return false;
            }
            Integer fromRank = NUMERIC_RANK.get(from);
            Integer toRank = NUMERIC_RANK.get(to);
            return fromRank != null && toRank != null && fromRank < toRank;
        }
        return false;
    }
}
