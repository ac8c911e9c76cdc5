package com.example.mediametadata.domain.exception;

/**
 * Raised when a fraction with a zero denominator is asked for its decimal value.
 * Zero denominators are legal to hold (absent tags use them) but never legal to divide by.
 */
public class DivideByZeroException extends DecimalConversionException {

    public static final String MESSAGE = "fraction with 0 denominator cannot be converted to decimal";

	/**
	 * Creates the exception with its fixed message.
	 */
    public DivideByZeroException() {
        super(MESSAGE);
    }
}
