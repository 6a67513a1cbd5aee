package org.verifythat;

import java.util.Objects;

/**
 * Result of a predicate that describes its own failure.
 * <p>
 * A predicate returning {@code CheckOutcome} instead of {@code boolean} lets the report read
 * {@code Expected foo to be empty but contained 3 items} rather than the generic
 * {@code to be true but was false}. A failing outcome carries the four text fields the report is
 * built from; a passing one carries none.
 */
public final class CheckOutcome {

    private static final CheckOutcome PASS = new CheckOutcome(true, null, null, null, null);

    private final boolean passed;
    private final String beText;
    private final String expectedText;
    private final String wasText;
    private final String actualText;

    private CheckOutcome(boolean passed, String beText, String expectedText, String wasText, String actualText) {
        this.passed = passed;
        this.beText = beText;
        this.expectedText = expectedText;
        this.wasText = wasText;
        this.actualText = actualText;
    }

    public static CheckOutcome pass() {
        return PASS;
    }

    public static CheckOutcome fail(String beText, String expectedText, String wasText, String actualText) {
        return new CheckOutcome(false,
                Objects.requireNonNull(beText, "beText"),
                Objects.requireNonNull(expectedText, "expectedText"),
                Objects.requireNonNull(wasText, "wasText"),
                Objects.requireNonNull(actualText, "actualText"));
    }

    public boolean isPassed() {
        return passed;
    }

    public String getBeText() {
        return beText;
    }

    public String getExpectedText() {
        return expectedText;
    }

    public String getWasText() {
        return wasText;
    }

    public String getActualText() {
        return actualText;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CheckOutcome)) {
            return false;
        }
        CheckOutcome that = (CheckOutcome) o;
        return passed == that.passed
                && Objects.equals(beText, that.beText)
                && Objects.equals(expectedText, that.expectedText)
                && Objects.equals(wasText, that.wasText)
                && Objects.equals(actualText, that.actualText);
    }

    @Override
    public int hashCode() {
        return Objects.hash(passed, beText, expectedText, wasText, actualText);
    }

    @Override
    public String toString() {
        if (passed) {
            return "CheckOutcome[pass]";
        }
        return "CheckOutcome[fail: " + beText + " " + expectedText + ", " + wasText + " " + actualText + "]";
    }
}
