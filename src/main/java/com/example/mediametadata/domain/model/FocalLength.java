package com.example.mediametadata.domain.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Lens focal length as recorded by the camera, with the 35mm film equivalent when the camera writes one.
 * A zero equivalent means the camera did not record it.
 */
public record FocalLength(Fraction actual, int equivalent35mm) {

    public static final FocalLength EMPTY = new FocalLength(Fraction.ZERO, 0);

    /**
     * Renders the focal length for display, e.g. {@code 4.25mm (26mm in 35mm format)}, {@code 23mm}
     * or {@code 28mm in 35mm format}.
     *
     * @return display text, or an empty string when neither value is known
     */
    public String describe() {
        String millimetres = actualMillimetres();
        boolean hasEquivalent = equivalent35mm > 0;
        if (!millimetres.isEmpty()) {
            return hasEquivalent
                    ? millimetres + "mm (" + equivalent35mm + "mm in 35mm format)"
                    : millimetres + "mm";
        }
        return hasEquivalent ? equivalent35mm + "mm in 35mm format" : "";
    }

    // at most two decimals, trailing zeros dropped; zero or undefined lengths count as unknown
    private String actualMillimetres() {
        if (actual.numerator() == 0 || actual.denominator() == 0) {
            return "";
        }
        return BigDecimal.valueOf(actual.numerator())
                .divide(BigDecimal.valueOf(actual.denominator()), 2, RoundingMode.HALF_EVEN)
                .stripTrailingZeros()
                .toPlainString();
    }

    public FocalLength withActual(Fraction newActual) {
        return new FocalLength(newActual, equivalent35mm);
    }

    public FocalLength withEquivalent35mm(int newEquivalent35mm) {
        return new FocalLength(actual, newEquivalent35mm);
    }
}
