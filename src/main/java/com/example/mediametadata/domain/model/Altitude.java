package com.example.mediametadata.domain.model;

import com.example.mediametadata.domain.exception.DecimalConversionException;

/**
 * GPS altitude in meters with its sea-level reference: {@code 0} above, {@code 1} below.
 */
public record Altitude(Fraction value, int ref) {

    public static final int ABOVE_SEA_LEVEL = 0;
    public static final int BELOW_SEA_LEVEL = 1;

    public static final Altitude EMPTY = new Altitude(Fraction.ZERO, ABOVE_SEA_LEVEL);

    /**
     * Converts the altitude to signed meters.
     *
     * @return meters, negative when the reference marks the value as below sea level
     * @throws DecimalConversionException when the inner fraction cannot be converted
     */
    public double toDecimal() {
        double meters;
        try {
            meters = value.toDecimal();
        } catch (DecimalConversionException ex) {
            throw new DecimalConversionException("altitude can't be converted to decimal", ex);
        }
        return ref == BELOW_SEA_LEVEL ? -meters : meters;
    }

    public Altitude withValue(Fraction newValue) {
        return new Altitude(newValue, ref);
    }

    public Altitude withRef(int newRef) {
        return new Altitude(value, newRef);
    }
}
