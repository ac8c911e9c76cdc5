package com.example.mediametadata.domain.exception;

/**
 * Raised when a recognized tag carries a payload whose type or element count does not match the
 * shape declared for that tag.
 */
public class FieldFormatException extends DomainException {

    private final String tag;
    private final String rawValueDescription;

	/**
	 * Creates the exception naming the tag and the payload that was found instead.
	 *
	 * @param tag                 canonical tag name, e.g. {@code FNumber}
	 * @param rawValueDescription diagnostic rendering of the unexpected payload
	 */
    public FieldFormatException(String tag, String rawValueDescription) {
        super(tag + " was not in expected format: " + rawValueDescription);
        this.tag = tag;
        this.rawValueDescription = rawValueDescription;
    }

    public String tag() {
        return tag;
    }

    public String rawValueDescription() {
        return rawValueDescription;
    }
}
