package org.verifythat;

/**
 * Raised when the evaluator itself cannot apply a node to its operands. Faults raised by the
 * code under test are never wrapped in this exception.
 */
public class ExpressionEvaluationException extends VerifyThatException {

    public ExpressionEvaluationException(String message) {
        super(message);
    }

    public ExpressionEvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
