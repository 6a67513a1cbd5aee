package org.verifythat;

/**
 * What happens to a composed failure report: throwing, logging, collecting.
 * Called only when a check fails.
 */
@FunctionalInterface
public interface MessageReporter {

    void report(String message);
}
