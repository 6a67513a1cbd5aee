package org.verifythat.printer;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ValueFormatterTest {

    @Test
    void scalars() {
        assertThat(ValueFormatter.format(null)).isEqualTo("null");
        assertThat(ValueFormatter.format(true)).isEqualTo("true");
        assertThat(ValueFormatter.format(false)).isEqualTo("false");
        assertThat(ValueFormatter.format(42)).isEqualTo("42");
        assertThat(ValueFormatter.format(2.5)).isEqualTo("2.5");
        assertThat(ValueFormatter.format('c')).isEqualTo("c");
    }

    @Test
    void strings_areQuotedAndEscaped() {
        assertThat(ValueFormatter.format("a")).isEqualTo("\"a\"");
        assertThat(ValueFormatter.format("say \"hi\"")).isEqualTo("\"say \\\"hi\\\"\"");
        assertThat(ValueFormatter.format("")).isEqualTo("\"\"");
    }

    @Test
    void escape_mapsEveryControlCharacter() {
        assertThat(ValueFormatter.escape("\0")).isEqualTo("\\0");
        assertThat(ValueFormatter.escape("\u0007")).isEqualTo("\\a");
        assertThat(ValueFormatter.escape("\b")).isEqualTo("\\b");
        assertThat(ValueFormatter.escape("\f")).isEqualTo("\\f");
        assertThat(ValueFormatter.escape("\n")).isEqualTo("\\n");
        assertThat(ValueFormatter.escape("\r")).isEqualTo("\\r");
        assertThat(ValueFormatter.escape("\t")).isEqualTo("\\t");
        assertThat(ValueFormatter.escape("\u000B")).isEqualTo("\\v");
        assertThat(ValueFormatter.escape("\\")).isEqualTo("\\\\");
        assertThat(ValueFormatter.escape("plain")).isEqualTo("plain");
    }

    @Test
    void escape_roundTrips() {
        String original = "x\"\\\0\u0007\b\f\n\r\t\u000By";

        assertThat(unescape(ValueFormatter.escape(original))).isEqualTo(original);
    }

    @Test
    void dateTimes_useSortableFormat() {
        assertThat(ValueFormatter.format(LocalDateTime.of(2010, 3, 4, 5, 6, 7, 999)))
            .isEqualTo("2010-03-04T05:06:07");
        assertThat(ValueFormatter.format(LocalDate.of(2010, 3, 4))).isEqualTo("2010-03-04T00:00:00");
        assertThat(ValueFormatter.format(Instant.parse("2010-03-04T05:06:07Z"))).isEqualTo("2010-03-04T05:06:07");
        assertThat(ValueFormatter.format(OffsetDateTime.of(2010, 3, 4, 5, 6, 7, 0, ZoneOffset.ofHours(2))))
            .isEqualTo("2010-03-04T05:06:07");
    }

    @Test
    void types_useTypeofAndShortNames() {
        assertThat(ValueFormatter.format(String.class)).isEqualTo("typeof(string)");
        assertThat(ValueFormatter.format(int.class)).isEqualTo("typeof(int)");
        assertThat(ValueFormatter.format(Integer.class)).isEqualTo("typeof(int)");
        assertThat(ValueFormatter.format(Map.class)).isEqualTo("typeof(Map)");
        assertThat(ValueFormatter.typeName(long.class)).isEqualTo("long");
    }

    @Test
    void sequences_areBraced() {
        assertThat(ValueFormatter.format(new int[]{1, 2, 3})).isEqualTo("{1, 2, 3}");
        assertThat(ValueFormatter.format(new String[]{"a", null})).isEqualTo("{\"a\", null}");
        assertThat(ValueFormatter.formatSequence(List.of())).isEqualTo("{}");
        assertThat(ValueFormatter.formatSequence(List.of(4, 5, 6))).isEqualTo("{4, 5, 6}");
        assertThat(ValueFormatter.format(List.of(1, 2, 3))).isEqualTo("{1, 2, 3}");
        assertThat(ValueFormatter.format(new LinkedHashSet<>(List.of("a", "b")))).isEqualTo("{\"a\", \"b\"}");
        assertThat(ValueFormatter.format(List.of(List.of(1), List.of()))).isEqualTo("{{1}, {}}");
    }

    private static String unescape(String escaped) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < escaped.length(); i++) {
            char c = escaped.charAt(i);
            if (c != '\\') {
                sb.append(c);
                continue;
            }
            char next = escaped.charAt(++i);
            switch (next) {
                case '0' -> sb.append('\0');
                case 'a' -> sb.append('\u0007');
                case 'b' -> sb.append('\b');
                case 'f' -> sb.append('\f');
                case 'n' -> sb.append('\n');
                case 'r' -> sb.append('\r');
                case 't' -> sb.append('\t');
                case 'v' -> sb.append('\u000B');
                default -> sb.append(next);
            }
        }
        return sb.toString();
    }
}
