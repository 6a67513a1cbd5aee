package org.verifythat.expression;

import java.util.EnumSet;
import java.util.Set;

/**
 * The closed set of node kinds a verified expression may contain.
 */
public enum ExpressionType {
    // unary
    NEGATE,
    NOT,
    CONVERT,
    ARRAY_LENGTH,
    TYPE_AS,

    // binary
    ADD,
    SUBTRACT,
    MULTIPLY,
    DIVIDE,
    MODULO,
    POWER,
    AND,
    OR,
    EXCLUSIVE_OR,
    AND_ALSO,
    OR_ELSE,
    LEFT_SHIFT,
    RIGHT_SHIFT,
    COALESCE,
    EQUAL,
    NOT_EQUAL,
    LESS_THAN,
    LESS_THAN_OR_EQUAL,
    GREATER_THAN,
    GREATER_THAN_OR_EQUAL,
    ARRAY_INDEX,

    TYPE_IS,
    CONDITIONAL,
    CONSTANT,
    PARAMETER,
    MEMBER_ACCESS,
    CALL,
    INDEX,
    LAMBDA,
    NEW,
    NEW_ARRAY_INIT,
    NEW_ARRAY_BOUNDS,
    INVOKE,
    MEMBER_INIT,
    LIST_INIT,

    /** Reported by node classes outside this package; no traversal accepts it. */
    EXTENSION;

    private static final Set<ExpressionType> UNARY = EnumSet.of(NEGATE, NOT, CONVERT, ARRAY_LENGTH, TYPE_AS);

    private static final Set<ExpressionType> BINARY = EnumSet.range(ADD, ARRAY_INDEX);

    private static final Set<ExpressionType> RELATIONAL = EnumSet.range(EQUAL, GREATER_THAN_OR_EQUAL);

    public boolean isUnary() {
        return UNARY.contains(this);
    }

    public boolean isBinary() {
        return BINARY.contains(this);
    }

    public boolean isRelational() {
        return RELATIONAL.contains(this);
    }
}
