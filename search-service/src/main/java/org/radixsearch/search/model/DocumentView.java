package org.radixsearch.search.model;

import org.radixsearch.core.model.DocumentMetadata;

public record DocumentView(
		String documentId,
		String title,
		String text,
		DocumentMetadata metadata
) {}
