package org.nowstart.lotledger.service.ledger.core;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.OptionalDouble;

/**
 * Fixed-point currency amount held as a signed count of minor units (1/100 of the major unit).
 *
 * <p>Every operation that cannot divide evenly rounds {@link RoundingMode#HALF_UP}, ties away from
 * zero. This is the only rounding rule used by the ledger, both when a major-unit value is converted
 * and when an amount is divided.
 */
public final class Money implements Comparable<Money> {

    public static final int SCALE = 2;
    public static final RoundingMode ROUNDING = RoundingMode.HALF_UP;

    private static final Money ZERO = new Money(0L);

    private final long minorUnits;

    private Money(long minorUnits) {
        this.minorUnits = minorUnits;
    }

    public static Money zero() {
        return ZERO;
    }

    public static Money ofMinor(long minorUnits) {
        return minorUnits == 0L ? ZERO : new Money(minorUnits);
    }

    public static Money fromMajorUnits(BigDecimal majorUnits) {
        if (majorUnits == null) {
            throw new IllegalArgumentException("majorUnits must not be null");
        }
        BigDecimal scaled = majorUnits.setScale(SCALE, ROUNDING);
        return ofMinor(scaled.movePointRight(SCALE).longValueExact());
    }

    /**
     * Parses a broker-formatted amount such as {@code "1,250.50"} or {@code "Rs. 300"}.
     */
    public static Money fromMajorUnits(String value) {
        if (value == null) {
            throw new NumberFormatException("empty money value");
        }
        String cleaned = value.trim().toUpperCase(Locale.ROOT)
                .replace(",", "")
                .replace("NPR", "")
                .replace("RS.", "")
                .replace("RS", "")
                .trim();
        if (cleaned.isEmpty()) {
            throw new NumberFormatException("empty money value");
        }
        return fromMajorUnits(new BigDecimal(cleaned));
    }

    public long minorUnits() {
        return minorUnits;
    }

    public BigDecimal toMajorUnits() {
        return BigDecimal.valueOf(minorUnits, SCALE);
    }

    public Money add(Money other) {
        return ofMinor(Math.addExact(minorUnits, other.minorUnits));
    }

    public Money subtract(Money other) {
        return ofMinor(Math.subtractExact(minorUnits, other.minorUnits));
    }

    /**
     * Subtraction for amounts that may never go below zero, such as a remaining cost basis.
     *
     * @throws MoneyUnderflowException when {@code other} is larger than this amount
     */
    public Money subtractNonNegative(Money other) {
        Money result = subtract(other);
        if (result.isNegative()) {
            throw new MoneyUnderflowException(this, other);
        }
        return result;
    }

    public Money multiply(long quantity) {
        return ofMinor(Math.multiplyExact(minorUnits, quantity));
    }

    public Money divide(long divisor) {
        if (divisor == 0L) {
            throw new ArithmeticException("division by zero");
        }
        if (minorUnits % divisor == 0L) {
            return ofMinor(minorUnits / divisor);
        }
        BigDecimal quotient = BigDecimal.valueOf(minorUnits)
                .divide(BigDecimal.valueOf(divisor), 0, ROUNDING);
        return ofMinor(quotient.longValueExact());
    }

    /**
     * Share of this amount proportional to {@code part / whole}, rounded once.
     */
    public Money prorate(long part, long whole) {
        if (whole <= 0L) {
            throw new ArithmeticException("whole must be positive");
        }
        BigDecimal share = BigDecimal.valueOf(minorUnits)
                .multiply(BigDecimal.valueOf(part))
                .divide(BigDecimal.valueOf(whole), 0, ROUNDING);
        return ofMinor(share.longValueExact());
    }

    /**
     * This amount as a percentage of {@code base}. Display only; empty when the base is zero.
     */
    public OptionalDouble percentOf(Money base) {
        if (base == null || base.isZero()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(minorUnits * 100.0 / base.minorUnits);
    }

    public boolean isZero() {
        return minorUnits == 0L;
    }

    public boolean isNegative() {
        return minorUnits < 0L;
    }

    @Override
    public int compareTo(Money other) {
        return Long.compare(minorUnits, other.minorUnits);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Money other)) {
            return false;
        }
        return minorUnits == other.minorUnits;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(minorUnits);
    }

    @Override
    public String toString() {
        return toMajorUnits().toPlainString();
    }
}
