package org.verifythat.extensions;

import org.verifythat.CheckOutcome;
import org.verifythat.expression.Extension;
import org.verifythat.printer.ValueFormatter;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;

/**
 * Predicates over sequences, rendered with extension-call syntax: a call of
 * {@code Enumerables.isEmpty(foo)} reads {@code foo.isEmpty()} in a report.
 * <p>
 * {@link #isEmpty} and {@link #isSubsetOf} describe their own failure, so a failed check reads
 * {@code Expected foo to be empty but contained 3 items}.
 */
public final class Enumerables {

    private Enumerables() {}

    @Extension
    public static CheckOutcome isEmpty(Iterable<?> source) {
        Objects.requireNonNull(source, "source");
        int count = 0;
        for (Object ignored : source) {
            count++;
        }
        if (count == 0) {
            return CheckOutcome.pass();
        }
        return CheckOutcome.fail("be", "empty", "contained", count + " items");
    }

    /**
     * Passes when every element of {@code source} occurs in {@code other}. A failure lists the
     * elements that do not, in order of first appearance and without repeats.
     */
    @Extension
    public static CheckOutcome isSubsetOf(Iterable<?> source, Iterable<?> other) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(other, "other");
        Set<Object> superset = new HashSet<>();
        List<Object> otherElements = new ArrayList<>();
        for (Object element : other) {
            superset.add(element);
            otherElements.add(element);
        }
        Set<Object> difference = new LinkedHashSet<>();
        for (Object element : source) {
            if (!superset.contains(element)) {
                difference.add(element);
            }
        }
        if (difference.isEmpty()) {
            return CheckOutcome.pass();
        }
        return CheckOutcome.fail("be subset of",
                ValueFormatter.formatSequence(otherElements),
                "difference was",
                ValueFormatter.formatSequence(difference));
    }

    @Extension
    public static boolean contains(Iterable<?> source, Object element) {
        Objects.requireNonNull(source, "source");
        for (Object candidate : source) {
            if (Objects.equals(candidate, element)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @throws NoSuchElementException if {@code source} is empty
     */
    @Extension
    public static Object first(Iterable<?> source) {
        Objects.requireNonNull(source, "source");
        Iterator<?> iterator = source.iterator();
        if (!iterator.hasNext()) {
            throw new NoSuchElementException("Sequence contains no elements");
        }
        return iterator.next();
    }
}
