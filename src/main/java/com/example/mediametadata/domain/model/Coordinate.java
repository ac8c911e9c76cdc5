package com.example.mediametadata.domain.model;

import com.example.mediametadata.domain.exception.DecimalConversionException;

/**
 * Degrees/minutes/seconds position along one axis plus its hemisphere reference.
 * Only {@code "S"} and {@code "W"} flip the sign; any other reference, including unknown letters, is positive.
 */
public record Coordinate(Fraction degrees, Fraction minutes, Fraction seconds, String ref) {

    public static final Coordinate EMPTY = new Coordinate(Fraction.ZERO, Fraction.ZERO, Fraction.ZERO, "");

    /**
     * Converts the coordinate to signed decimal degrees.
     * No range check is applied to the result.
     *
     * @return {@code (degrees + minutes / 60 + seconds / 3600) * sign}
     * @throws DecimalConversionException naming the first component whose fraction cannot be converted
     */
    public double toDecimal() {
        double d = convert(degrees, "degrees");
        double m = convert(minutes, "minutes");
        double s = convert(seconds, "seconds");

        double value = d + m / 60 + s / 3600;
        return isNegativeHemisphere() ? -value : value;
    }

    public boolean isNegativeHemisphere() {
        return "S".equals(ref) || "W".equals(ref);
    }

    public Coordinate withRef(String newRef) {
        return new Coordinate(degrees, minutes, seconds, newRef);
    }

    public Coordinate withDms(Fraction newDegrees, Fraction newMinutes, Fraction newSeconds) {
        return new Coordinate(newDegrees, newMinutes, newSeconds, ref);
    }

    private static double convert(Fraction fraction, String component) {
        try {
            return fraction.toDecimal();
        } catch (DecimalConversionException ex) {
            throw new DecimalConversionException(component + " can't be converted to decimal", ex);
        }
    }
}
