package org.verifythat.printer;

import org.verifythat.expression.ExpressionType;

import java.util.Map;

import static java.util.Map.entry;

public final class OperatorText {

    private OperatorText() {}

    private static final Map<ExpressionType, String> OPERATOR_MAP = Map.ofEntries(
            entry(ExpressionType.ADD, "+"),
            entry(ExpressionType.AND, "&"),
            entry(ExpressionType.AND_ALSO, "&&"),
            entry(ExpressionType.COALESCE, "??"),
            entry(ExpressionType.DIVIDE, "/"),
            entry(ExpressionType.EQUAL, "=="),
            entry(ExpressionType.EXCLUSIVE_OR, "^"),
            entry(ExpressionType.GREATER_THAN, ">"),
            entry(ExpressionType.GREATER_THAN_OR_EQUAL, ">="),
            entry(ExpressionType.LEFT_SHIFT, "<<"),
            entry(ExpressionType.LESS_THAN, "<"),
            entry(ExpressionType.LESS_THAN_OR_EQUAL, "<="),
            entry(ExpressionType.MODULO, "%"),
            entry(ExpressionType.MULTIPLY, "*"),
            entry(ExpressionType.NOT_EQUAL, "!="),
            entry(ExpressionType.OR, "|"),
            entry(ExpressionType.OR_ELSE, "||"),
            entry(ExpressionType.POWER, "^"),
            entry(ExpressionType.RIGHT_SHIFT, ">>"),
            entry(ExpressionType.SUBTRACT, "-")
    );

    private static final Map<ExpressionType, String> RELATION_MAP = Map.of(
            ExpressionType.EQUAL, "be",
            ExpressionType.GREATER_THAN, "be greater than",
            ExpressionType.GREATER_THAN_OR_EQUAL, "be greater than or equal to",
            ExpressionType.LESS_THAN, "be less than",
            ExpressionType.LESS_THAN_OR_EQUAL, "be less than or equal to",
            ExpressionType.NOT_EQUAL, "not be"
    );

    /**
     * @return the source symbol of a binary operator, or {@code null} for kinds without one
     */
    public static String operator(ExpressionType nodeType) {
        return OPERATOR_MAP.get(nodeType);
    }

    /**
     * The phrase a failed comparison reads with: {@code foo} is expected "to be greater than" 2.
     *
     * @return the relation keyword, or {@code null} for non-relational kinds
     */
    public static String relationKeyword(ExpressionType nodeType) {
        return RELATION_MAP.get(nodeType);
    }
}
