package com.opentoclose.client.service.validation;

import com.opentoclose.client.exception.apiclient.ValidationException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.OptionalLong;

/**
 * Coercion and description helpers shared by the validators.
 */
public final class Values {

    private Values() {
    }

    /**
     * Describes a value with its type, for error messages.
     *
     * @param value any value.
     *
     * @return e.g. {@code "String: abc"} or {@code "null"}.
     */
    public static String describe(Object value) {
        if (value == null) {
            return "null";
        }
        return typeName(value) + ": " + value;
    }

    public static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }

    /**
     * Coerces integral numbers and numeric strings to a {@code long}. Fractional numbers are
     * truncated; booleans are rejected.
     *
     * @param value the value to coerce.
     * @param field the field name used in the error message.
     *
     * @return the coerced value.
     *
     * @throws ValidationException if the value is not an integer.
     */
    public static long toLong(Object value, String field) {
        return parseLong(value).orElseThrow(
                () -> new ValidationException(field + " must be an integer, got " + describe(value)));
    }

    /**
     * Same coercion as {@link #toLong(Object, String)} without raising.
     *
     * @param value the value to coerce.
     *
     * @return the coerced value, or empty if the value is not an integer.
     */
    public static OptionalLong parseLong(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return OptionalLong.of(((Number) value).longValue());
        }
        if (value instanceof BigInteger bigInteger && bigInteger.bitLength() < Long.SIZE) {
            return OptionalLong.of(bigInteger.longValue());
        }
        if (value instanceof Double || value instanceof Float || value instanceof BigDecimal) {
            double number = ((Number) value).doubleValue();
            if (Double.isFinite(number) && Math.abs(number) < Long.MAX_VALUE) {
                return OptionalLong.of((long) number);
            }
        }
        if (value instanceof String text) {
            try {
                return OptionalLong.of(Long.parseLong(text.trim()));
            } catch (NumberFormatException e) {
                return OptionalLong.empty();
            }
        }
        return OptionalLong.empty();
    }

    /**
     * Like {@link #toLong(Object, String)} but also rejects values outside the {@code int} range.
     */
    public static int toInt(Object value, String field) {
        long coerced = toLong(value, field);
        if (coerced < Integer.MIN_VALUE || coerced > Integer.MAX_VALUE) {
            throw new ValidationException(field + " must be an integer, got " + describe(value));
        }
        return (int) coerced;
    }

    /**
     * Coerces numbers and numeric strings to a {@link BigDecimal}; booleans are rejected.
     *
     * @param value the value to coerce.
     * @param field the field name used in the error message.
     *
     * @return the coerced value.
     *
     * @throws ValidationException if the value is not a number.
     */
    public static BigDecimal toDecimal(Object value, String field) {
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof BigInteger bigInteger) {
            return new BigDecimal(bigInteger);
        }
        if (value instanceof Number number) {
            try {
                return new BigDecimal(number.toString());
            } catch (NumberFormatException e) {
                throw new ValidationException(field + " must be a number, got " + describe(value));
            }
        }
        if (value instanceof String text) {
            try {
                return new BigDecimal(text.trim());
            } catch (NumberFormatException e) {
                throw new ValidationException(field + " must be a number, got " + describe(value));
            }
        }
        throw new ValidationException(field + " must be a number, got " + describe(value));
    }

    public static boolean isNonBlankString(Object value) {
        return value instanceof String text && !text.isBlank();
    }
}
