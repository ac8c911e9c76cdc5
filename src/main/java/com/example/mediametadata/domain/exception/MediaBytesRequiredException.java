package com.example.mediametadata.domain.exception;

/**
 * Raised when an extraction is requested without any file content.
 * Guards the tag-walking adapter from null buffers.
 */
public class MediaBytesRequiredException extends DomainException {

	/**
	 * Creates the exception with a predefined error message.
	 */
    public MediaBytesRequiredException() {
        super("Media bytes are required to extract capture metadata.");
    }
}
