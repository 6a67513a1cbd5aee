package org.verifythat;

import org.verifythat.expression.Expression;

/**
 * Static entry point.
 * <pre>{@code
 * Verify.that(equal(variable("foo", foo), constant(2)));
 * }</pre>
 * fails with
 * <pre>
 *   Expected: foo
 *      to be: 2
 *    but was: 1
 * </pre>
 */
public final class Verify {

    private static final String EXPECTED_LABEL = "Expected:";
    private static final String BUT_WAS_LABEL = "but was:";

    private static final MessageReporter DEFAULT_REPORTER = message -> {
        throw new VerificationException(System.lineSeparator() + message);
    };

    private static final MessageFormatter DEFAULT_FORMATTER = Verify::formatColumns;

    private Verify() {}

    public static void that(Expression expression) {
        that(expression, DEFAULT_REPORTER);
    }

    public static void that(Expression expression, MessageReporter reporter) {
        that(expression, reporter, DEFAULT_FORMATTER);
    }

    public static void that(Expression expression, MessageReporter reporter, MessageFormatter formatter) {
        new Verifier(new VerifierParameters(reporter, formatter)).check(expression);
    }

    /**
     * Throws a {@link VerificationException} whose message starts on a fresh line.
     */
    public static MessageReporter defaultReporter() {
        return DEFAULT_REPORTER;
    }

    /**
     * Three lines, labels right-aligned to a common column.
     */
    public static MessageFormatter defaultFormatter() {
        return DEFAULT_FORMATTER;
    }

    private static String formatColumns(String expression, String be, String expected, String was, String actual) {
        String relationLabel = "to " + be + ":";
        int width = Math.max(EXPECTED_LABEL.length(), Math.max(relationLabel.length(), BUT_WAS_LABEL.length())) + 2;

        String newLine = System.lineSeparator();
        return padLeft(EXPECTED_LABEL, width) + " " + expression + newLine
                + padLeft(relationLabel, width) + " " + expected + newLine
                + padLeft(BUT_WAS_LABEL, width) + " " + actual;
    }

    private static String padLeft(String text, int width) {
        return " ".repeat(Math.max(0, width - text.length())) + text;
    }
}
