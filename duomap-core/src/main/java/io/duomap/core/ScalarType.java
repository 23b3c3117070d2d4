package io.duomap.core;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;

/**
 * Scalar value types a field can be declared with.
 * <p>
 * Each type knows its Java carrier class, whether it can serve as a primary key
 * and how a loosely typed input (a boxed {@code Integer} for a {@code LONG}
 * column, or the text {@code "123"}) is normalised before storage.
 */
public enum ScalarType {
    INT(Integer.class, true),
    LONG(Long.class, true),
    BOOLEAN(Boolean.class, false),
    DOUBLE(Double.class, false),
    DECIMAL(BigDecimal.class, false),
    STRING(String.class, true),
    UUID(java.util.UUID.class, true),
    INSTANT(Instant.class, false),
    LOCAL_DATE(LocalDate.class, false),
    LOCAL_DATE_TIME(LocalDateTime.class, false);

    private final Class<?> javaType;
    private final boolean identifierCompatible;

    ScalarType(Class<?> javaType, boolean identifierCompatible) {
        this.javaType = javaType;
        this.identifierCompatible = identifierCompatible;
    }

    public Class<?> javaType() {
        return javaType;
    }

    /**
     * Whether a field of this type may be used as a primary key and, by
     * extension, as the type of a synthesized foreign key.
     */
    public boolean identifierCompatible() {
        return identifierCompatible;
    }

    /**
     * Whether the value can be stored in a column of this type, after
     * {@link #coerce(Object)}. {@code null} is handled by the caller.
     * <p>
     * Text is accepted when it parses as this type: {@code "123"} for the
     * numeric types, {@code "true"}/{@code "false"} for {@code BOOLEAN} and
     * ISO-8601 text for UUIDs and temporal types.
     */
    public boolean accepts(Object value) {
        if (value == null) {
            return false;
        }
        if (javaType.isInstance(value)) {
            return true;
        }
        if (value instanceof String text) {
            return parse(text) != null;
        }
        return switch (this) {
            case INT -> value instanceof Short || value instanceof Byte
                    || (value instanceof Long l && l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE);
            case LONG -> value instanceof Integer || value instanceof Short || value instanceof Byte;
            case DOUBLE -> value instanceof Float || value instanceof Long || value instanceof Integer;
            case DECIMAL -> value instanceof Long || value instanceof Integer;
            default -> false;
        };
    }

    /**
     * Normalise an accepted value to this type's carrier class.
     *
     * @throws IllegalArgumentException if the value is not accepted
     */
    public Object coerce(Object value) {
        if (value == null || javaType.isInstance(value)) {
            return value;
        }
        if (!accepts(value)) {
            throw new IllegalArgumentException("Value of type " + value.getClass().getName()
                    + " cannot be stored as " + name());
        }
        if (value instanceof String text) {
            return parse(text);
        }
        return switch (this) {
            case INT -> ((Number) value).intValue();
            case LONG -> ((Number) value).longValue();
            case DOUBLE -> ((Number) value).doubleValue();
            case DECIMAL -> BigDecimal.valueOf(((Number) value).longValue());
            default -> throw new IllegalStateException("No coercion for " + name());
        };
    }

    /**
     * @return the parsed value, or {@code null} if the text is not a valid literal of this type
     */
    private Object parse(String text) {
        var trimmed = text.trim();
        try {
            return switch (this) {
                case INT -> Integer.valueOf(trimmed);
                case LONG -> Long.valueOf(trimmed);
                case DOUBLE -> Double.valueOf(trimmed);
                case DECIMAL -> new BigDecimal(trimmed);
                case BOOLEAN -> parseBoolean(trimmed);
                case UUID -> java.util.UUID.fromString(trimmed);
                case INSTANT -> Instant.parse(trimmed);
                case LOCAL_DATE -> LocalDate.parse(trimmed);
                case LOCAL_DATE_TIME -> LocalDateTime.parse(trimmed);
                case STRING -> text;
            };
        } catch (IllegalArgumentException | DateTimeParseException e) {
            return null;
        }
    }

    private static Boolean parseBoolean(String text) {
        if ("true".equalsIgnoreCase(text)) {
            return Boolean.TRUE;
        }
        if ("false".equalsIgnoreCase(text)) {
            return Boolean.FALSE;
        }
        return null;
    }
}
