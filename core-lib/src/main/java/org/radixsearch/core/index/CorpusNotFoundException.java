package org.radixsearch.core.index;

import java.io.IOException;

/**
 * Indicates the corpus root directory does not exist.
 */
public class CorpusNotFoundException extends IOException {
	public CorpusNotFoundException(String message) {
		super(message);
	}
}
