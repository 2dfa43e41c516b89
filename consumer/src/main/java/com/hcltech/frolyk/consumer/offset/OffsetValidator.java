package com.hcltech.frolyk.consumer.offset;

import com.hcltech.frolyk.common.errorsor.ErrorsOr;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * Reads commit offsets. Broker offsets can exceed {@code long}, so they are carried as {@link BigInteger}.
 *
 * <p>Accepted: decimal digit strings, integral numbers ({@code Byte} to {@code Long}, {@code BigInteger},
 * the atomic wrappers), integral {@code BigDecimal}s and finite integral floating point values. The
 * value must not be negative.
 */
public final class OffsetValidator {
    static final String REQUIRED = "Valid offset is required";

    private static final Pattern DIGITS = Pattern.compile("[0-9]+");

    private OffsetValidator() {
    }

    public static ErrorsOr<BigInteger> validate(Object input) {
        return parse(input).flatMap(OffsetValidator::nonNegative);
    }

    /**
     * Validates {@code input} and pairs it with {@code metadata}, which is passed through as is.
     *
     * @param metadata null when absent
     * @throws InvalidOffsetException if the input is not a valid offset
     */
    public static ValidOffset validOffset(Object input, String metadata) {
        BigInteger offset = validate(input).valueOrThrow(errors -> new InvalidOffsetException(errors.get(0)));
        return new ValidOffset(offset, Optional.ofNullable(metadata));
    }

    private static ErrorsOr<BigInteger> parse(Object input) {
        if (input == null) return invalid("null");
        if (input instanceof BigInteger b) return ErrorsOr.lift(b);
        if (input instanceof Long || input instanceof Integer || input instanceof Short || input instanceof Byte
                || input instanceof AtomicLong || input instanceof AtomicInteger) {
            return ErrorsOr.lift(BigInteger.valueOf(((Number) input).longValue()));
        }
        if (input instanceof BigDecimal d) return integral(d, input);
        if (input instanceof Double || input instanceof Float) {
            double d = ((Number) input).doubleValue();
            if (!Double.isFinite(d)) return invalid(input);
            return integral(BigDecimal.valueOf(d), input);
        }
        if (input instanceof CharSequence cs) {
            String s = cs.toString().trim();
            if (!DIGITS.matcher(s).matches()) return invalid("'" + cs + "'");
            return ErrorsOr.lift(new BigInteger(s));
        }
        return invalid(input.getClass().getSimpleName() + " " + input);
    }

    private static ErrorsOr<BigInteger> integral(BigDecimal d, Object input) {
        return ErrorsOr.trying(d::toBigIntegerExact, e -> REQUIRED + ", got fractional " + input);
    }

    private static ErrorsOr<BigInteger> nonNegative(BigInteger offset) {
        return offset.signum() < 0 ? invalid("negative " + offset) : ErrorsOr.lift(offset);
    }

    private static <T> ErrorsOr<T> invalid(Object got) {
        return ErrorsOr.error(REQUIRED + ", got " + got);
    }
}
