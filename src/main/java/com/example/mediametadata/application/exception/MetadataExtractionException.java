package com.example.mediametadata.application.exception;

/**
 * Signals that a tag tree walk was aborted because one recognized tag carried unusable data.
 * The cause is the field-level domain exception naming the tag.
 */
public class MetadataExtractionException extends ApplicationException {

	/**
	 * @param message stage of the extraction that failed
	 * @param cause   field error that aborted the walk
	 */
    public MetadataExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
