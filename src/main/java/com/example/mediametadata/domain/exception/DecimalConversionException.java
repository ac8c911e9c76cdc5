package com.example.mediametadata.domain.exception;

/**
 * Raised when a rational-backed value (fraction, coordinate, altitude) cannot be turned into a decimal.
 */
public class DecimalConversionException extends DomainException {

	/**
	 * @param message which value failed to convert
	 */
    public DecimalConversionException(String message) {
        super(message);
    }

	/**
	 * @param message which part of the value failed to convert
	 * @param cause   conversion failure of the inner fraction
	 */
    public DecimalConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
