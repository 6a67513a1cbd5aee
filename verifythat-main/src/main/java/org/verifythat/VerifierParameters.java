package org.verifythat;

import java.util.Objects;

/**
 * Configuration of a {@link Verifier}.
 *
 * @param reporter  receives the report of every failed check
 * @param formatter lays the report out
 */
public record VerifierParameters(MessageReporter reporter, MessageFormatter formatter) {

    public VerifierParameters {
        Objects.requireNonNull(reporter, "reporter");
        Objects.requireNonNull(formatter, "formatter");
    }

    /**
     * The throwing reporter and the column-aligned layout.
     */
    public static VerifierParameters defaults() {
        return new VerifierParameters(Verify.defaultReporter(), Verify.defaultFormatter());
    }

    public VerifierParameters withReporter(MessageReporter reporter) {
        return new VerifierParameters(reporter, formatter);
    }

    public VerifierParameters withFormatter(MessageFormatter formatter) {
        return new VerifierParameters(reporter, formatter);
    }
}
