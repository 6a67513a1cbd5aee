package org.verifythat.expression;

import java.util.List;

/**
 * Array creation, either from its elements ({@link ExpressionType#NEW_ARRAY_INIT}) or from its
 * dimension lengths ({@link ExpressionType#NEW_ARRAY_BOUNDS}).
 */
public final class NewArrayExpression extends Expression {

    private final ExpressionType nodeType;
    private final List<Expression> expressions;

    NewArrayExpression(ExpressionType nodeType, Class<?> arrayType, List<Expression> expressions) {
        super(arrayType);
        this.nodeType = nodeType;
        this.expressions = List.copyOf(expressions);
    }

    @Override
    public ExpressionType getNodeType() {
        return nodeType;
    }

    public Class<?> getElementType() {
        return getType().getComponentType();
    }

    public List<Expression> getExpressions() {
        return expressions;
    }

    public NewArrayExpression update(List<Expression> expressions) {
        if (expressions == this.expressions) {
            return this;
        }
        return new NewArrayExpression(nodeType, getType(), expressions);
    }
}
