package com.example.mediametadata.domain.exception;

/**
 * Raised when a capture-time tag does not follow the {@code YYYY:MM:DD HH:MM:SS} layout.
 */
public class DateParseException extends DomainException {

    private final String value;

	/**
	 * @param tag   tag holding the date string
	 * @param value raw string that failed to parse
	 * @param cause parser failure from {@code java.time}
	 */
    public DateParseException(String tag, String value, Throwable cause) {
        super("failed to parse " + tag + " value '" + value + "'", cause);
        this.value = value;
    }

    public String value() {
        return value;
    }
}
