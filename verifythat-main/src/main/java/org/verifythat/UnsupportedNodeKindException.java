package org.verifythat;

import org.verifythat.expression.ExpressionType;

public class UnsupportedNodeKindException extends VerifyThatException {

    private final ExpressionType nodeType;

    public UnsupportedNodeKindException(ExpressionType nodeType) {
        super("Unhandled expression type: '" + nodeType + "'");
        this.nodeType = nodeType;
    }

    public ExpressionType getNodeType() {
        return nodeType;
    }
}
