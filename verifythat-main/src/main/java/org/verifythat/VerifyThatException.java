package org.verifythat;

public class VerifyThatException extends RuntimeException {

    public VerifyThatException(String message) {
        super(message);
    }

    public VerifyThatException(String message, Throwable cause) {
        super(message, cause);
    }

    public VerifyThatException(Throwable cause) {
        super(cause);
    }
}
