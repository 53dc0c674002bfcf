package org.radixsearch.indexing.model;

public record IndexResponse(
		String status,
		int documentsIndexed,
		String message
) {
	public static IndexResponse completed(int documentsIndexed) {
		return new IndexResponse("completed", documentsIndexed, null);
	}

	public static IndexResponse failed(String message) {
		return new IndexResponse("failed", 0, message);
	}
}
