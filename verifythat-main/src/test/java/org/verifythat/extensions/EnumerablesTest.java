package org.verifythat.extensions;

import org.junit.jupiter.api.Test;
import org.verifythat.CheckOutcome;
import org.verifythat.Verify;
import org.verifythat.expression.Expression;

import java.util.List;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.verifythat.expression.Expressions.call;
import static org.verifythat.expression.Expressions.variable;

class EnumerablesTest {

    private String message;

    @Test
    void isEmpty_reportsItemCount() {
        List<Integer> foo = List.of(1, 2, 3);

        act(call(Enumerables.class, "isEmpty", list("foo", foo)));

        assertThat(message).isEqualTo("Expected foo to be empty but contained 3 items");
    }

    @Test
    void isSubsetOf_noElementsIntersect() {
        List<Integer> foo = List.of(1, 2, 3);
        List<Integer> other = List.of(4, 5, 6);

        act(call(Enumerables.class, "isSubsetOf", list("foo", foo), list("other", other)));

        assertThat(message).isEqualTo("Expected foo to be subset of {4, 5, 6} but difference was {1, 2, 3}");
    }

    @Test
    void isSubsetOf_oneElementIntersects() {
        List<Integer> foo = List.of(1, 2, 4);
        List<Integer> other = List.of(4, 5, 6);

        act(call(Enumerables.class, "isSubsetOf", list("foo", foo), list("other", other)));

        assertThat(message).isEqualTo("Expected foo to be subset of {4, 5, 6} but difference was {1, 2}");
    }

    @Test
    void isSubsetOf_twoElementsIntersect() {
        List<Integer> foo = List.of(1, 4, 5);
        List<Integer> other = List.of(4, 5, 6);

        act(call(Enumerables.class, "isSubsetOf", list("foo", foo), list("other", other)));

        assertThat(message).isEqualTo("Expected foo to be subset of {4, 5, 6} but difference was {1}");
    }

    @Test
    void isSubsetOf_collapsesRepeatedDifferences() {
        CheckOutcome outcome = Enumerables.isSubsetOf(List.of("a", "b", "a"), List.of("c"));

        assertThat(outcome.isPassed()).isFalse();
        assertThat(outcome.getExpectedText()).isEqualTo("{\"c\"}");
        assertThat(outcome.getActualText()).isEqualTo("{\"a\", \"b\"}");
    }

    @Test
    void passingOutcomes_reportNothing() {
        act(call(Enumerables.class, "isEmpty", list("foo", List.of())));
        assertThat(message).isNull();

        act(call(Enumerables.class, "isSubsetOf", list("foo", List.of(4)), list("other", List.of(4, 5))));
        assertThat(message).isNull();
    }

    @Test
    void directCalls_behaveAsPlainPredicates() {
        assertThat(Enumerables.isEmpty(List.of()).isPassed()).isTrue();
        assertThat(Enumerables.isEmpty(List.of(1)).getActualText()).isEqualTo("1 items");
        assertThat(Enumerables.contains(List.of(1, 2), 2)).isTrue();
        assertThat(Enumerables.contains(List.of(1, 2), null)).isFalse();
        assertThat(Enumerables.first(List.of("x", "y"))).isEqualTo("x");
    }

    @Test
    void first_failsOnEmptySequence() {
        assertThatThrownBy(() -> Enumerables.first(List.of()))
            .isInstanceOf(NoSuchElementException.class);
    }

    private static Expression list(String name, List<?> value) {
        return variable(name, List.class, () -> value);
    }

    private void act(Expression expression) {
        message = null;
        Verify.that(expression, m -> message = m,
            (x, be, expected, was, actual) -> String.format("Expected %s to %s %s but %s %s", x, be, expected, was, actual));
    }
}
