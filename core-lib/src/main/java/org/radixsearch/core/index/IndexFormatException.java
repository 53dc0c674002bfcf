package org.radixsearch.core.index;

import java.io.IOException;

/**
 * Thrown when a persisted index file does not match the expected section layout.
 */
public class IndexFormatException extends IOException {
	public IndexFormatException(String message) {
		super(message);
	}

	public IndexFormatException(String message, Throwable cause) {
		super(message, cause);
	}
}
