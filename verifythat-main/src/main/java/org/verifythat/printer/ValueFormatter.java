package org.verifythat.printer;

import java.lang.reflect.Array;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.Date;

/**
 * Source-like text for runtime values: quoted strings, {@code typeof(T)} for types, sortable
 * date-times, {@code {a, b}} for arrays and collections.
 */
public final class ValueFormatter {

    private ValueFormatter() {}

    private static final DateTimeFormatter SORTABLE_DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    public static String format(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Boolean b) {
            return b ? "true" : "false";
        }
        LocalDateTime dateTime = toLocalDateTime(value);
        if (dateTime != null) {
            return dateTime.format(SORTABLE_DATE_TIME);
        }
        if (value instanceof String s) {
            return "\"" + escape(s) + "\"";
        }
        if (value instanceof Class<?> type) {
            return "typeof(" + typeName(type) + ")";
        }
        if (value.getClass().isArray()) {
            return formatArray(value);
        }
        if (value instanceof Collection<?> collection) {
            return formatSequence(collection);
        }
        return String.valueOf(value);
    }

    /**
     * Escapes quotes, backslashes and the control characters NUL, BEL, BS, FF, LF, CR, TAB and VT
     * into their two-character forms.
     */
    public static String escape(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\0' -> sb.append("\\0");
                case '\u0007' -> sb.append("\\a");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                case '\u000B' -> sb.append("\\v");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    public static String typeName(Class<?> type) {
        if (type == String.class) {
            return "string";
        }
        if (type == int.class || type == Integer.class) {
            return "int";
        }
        return type.getSimpleName();
    }

    /**
     * Formats a sequence as {@code {a, b, c}}, each element formatted by {@link #format(Object)}.
     */
    public static String formatSequence(Iterable<?> values) {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Object value : values) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(format(value));
            first = false;
        }
        return sb.append('}').toString();
    }

    private static String formatArray(Object array) {
        StringBuilder sb = new StringBuilder("{");
        for (int i = 0, n = Array.getLength(array); i < n; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(format(Array.get(array, i)));
        }
        return sb.append('}').toString();
    }

    private static LocalDateTime toLocalDateTime(Object value) {
        if (value instanceof LocalDateTime ldt) {
            return ldt;
        }
        if (value instanceof LocalDate ld) {
            return ld.atStartOfDay();
        }
        if (value instanceof ZonedDateTime zdt) {
            return zdt.toLocalDateTime();
        }
        if (value instanceof OffsetDateTime odt) {
            return odt.toLocalDateTime();
        }
        if (value instanceof Instant instant) {
            return LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
        }
        if (value instanceof Date date) {
            return LocalDateTime.ofInstant(Instant.ofEpochMilli(date.getTime()), ZoneId.systemDefault());
        }
        return null;
    }
}
