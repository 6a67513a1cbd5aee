package org.verifythat;

/**
 * Thrown by the default reporter when a verified expression evaluates to false.
 */
public class VerificationException extends AssertionError {

    private static final long serialVersionUID = 6409186123504381727L;

    public VerificationException(String message) {
        super(message);
    }
}
