package com.example.mediametadata.infrastructure.exception;

/**
 * Infrastructure-layer exception that signals the tag container exists but could not be parsed.
 */
public class TagCollectionException extends InfrastructureException {

	/**
	 * @param message description of the container that could not be parsed
	 */
    public TagCollectionException(String message) {
        super(message);
    }

	/**
	 * Creates the exception with a contextual message and the root cause from metadata-extractor.
	 *
	 * @param message description shared with the application layer
	 * @param cause   low-level library exception
	 */
    public TagCollectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
