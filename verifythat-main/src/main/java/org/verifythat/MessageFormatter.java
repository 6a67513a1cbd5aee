package org.verifythat;

/**
 * Lays out a failure report from its parts.
 */
@FunctionalInterface
public interface MessageFormatter {

    /**
     * @param expression the rendered subject, e.g. {@code foo.Length}
     * @param be         the relation, e.g. {@code be greater than}
     * @param expected   the rendered expected side, e.g. {@code 2}
     * @param was        the word introducing the actual value, {@code was} unless a custom check says otherwise
     * @param actual     the formatted actual value
     */
    String format(String expression, String be, String expected, String was, String actual);
}
