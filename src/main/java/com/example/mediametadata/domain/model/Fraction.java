package com.example.mediametadata.domain.model;

import com.example.mediametadata.domain.exception.DivideByZeroException;

/**
 * Exact rational value as stored by the tag container.
 * Both components are kept as {@code long} so unsigned 32-bit and signed 32-bit rationals fit unchanged.
 * A zero denominator is representable (absent tags default to {@link #ZERO}) but cannot be converted.
 */
public record Fraction(long numerator, long denominator) {

    public static final Fraction ZERO = new Fraction(0, 0);

    /**
     * Converts the fraction to a decimal value.
     *
     * @return {@code numerator / denominator} as a double
     * @throws DivideByZeroException when the denominator is zero
     */
    public double toDecimal() {
        if (denominator == 0) {
            throw new DivideByZeroException();
        }
        return (double) numerator / denominator;
    }

    @Override
    public String toString() {
        return numerator + "/" + denominator;
    }
}
