package org.verifythat;

public class MethodResolutionException extends VerifyThatException {

    private final String className;
    private final String methodName;
    private final int argCount;

    public MethodResolutionException(String className, String methodName, int argCount) {
        super("No method '" + methodName + "' with " + argCount + " parameter(s) found on type '" + className + "'");
        this.className = className;
        this.methodName = methodName;
        this.argCount = argCount;
    }

    public String getClassName() {
        return className;
    }

    public String getMethodName() {
        return methodName;
    }

    public int getArgCount() {
        return argCount;
    }
}
