package org.radixsearch.search.controller;

import com.google.gson.Gson;
import io.javalin.Javalin;
import io.javalin.http.Context;
import org.radixsearch.search.model.DocumentView;
import org.radixsearch.search.model.SearchResponse;
import org.radixsearch.search.service.SearchService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class SearchController {
	private static final Logger logger = LoggerFactory.getLogger(SearchController.class);
	private static final Gson gson = new Gson();
	private final SearchService searchService;
	private final int defaultLimit;

	public SearchController(SearchService searchService, int defaultLimit) {
		this.searchService = searchService;
		this.defaultLimit = defaultLimit;
	}

	/**
	 * Register all routes with the Javalin app
	 */
	public void registerRoutes(Javalin app) {
		app.get("/", this::handleHome);

		app.get("/health", this::handleHealth);

		app.get("/search", this::handleSearch);

		app.get("/document", this::handleDocument);

		app.get("/suggest", this::handleSuggest);

		app.get("/stats", this::handleStats);

		app.post("/admin/reload", this::handleReload);

		logger.info("Search routes registered");
	}

	/**
	 * GET /
	 * Home page: what the engine has indexed and where to go next
	 */
	private void handleHome(Context ctx) {
		SearchService.SearchStats stats = searchService.getStats();

		Map<String, Object> home = new HashMap<>();
		home.put("service", "search-service");
		home.put("documents", stats.totalDocuments());
		home.put("distinct_terms", stats.distinctTerms());
		home.put("search", "/search?q={query}&page={page}&limit={limit}");
		home.put("document", "/document?id={documentId}");

		ctx.status(200).result(gson.toJson(home));
	}

	/**
	 * GET /health
	 * Health check endpoint
	 */
	private void handleHealth(Context ctx) {
		Map<String, Object> health = new HashMap<>();
		health.put("service", "search-service");
		health.put("status", "running");
		health.put("timestamp", System.currentTimeMillis());

		try {
			SearchService.SearchStats stats = searchService.getStats();
			health.put("total_documents", stats.totalDocuments());
			health.put("index_loaded", stats.indexLoaded());
			health.put("distinct_terms", stats.distinctTerms());
		} catch (Exception e) {
			health.put("total_documents", "error");
			logger.error("Error getting stats for health check", e);
		}

		ctx.result(gson.toJson(health));
	}

	/**
	 * GET /search?q={query}&page={page}&limit={limit}
	 * Ranked results with highlighted snippets
	 */
	private void handleSearch(Context ctx) {
		try {
			String query = ctx.queryParam("q");

			Integer page = parseIntParam(ctx, "page", 1);
			if (page == null) {
				return;
			}
			Integer limit = parseIntParam(ctx, "limit", defaultLimit);
			if (limit == null) {
				return;
			}

			if (query == null || query.trim().isEmpty()) {
				error(ctx, 400, "Query parameter 'q' is required.");
				return;
			}

			logger.info("Search request: q='{}', page={}, limit={}", query, page, limit);

			SearchResponse response = searchService.search(query, page, limit);

			ctx.status(200).result(gson.toJson(response));
			logger.info("Returned {} of {} search results", response.returnedResults(), response.totalResults());

		} catch (Exception e) {
			error(ctx, 500, "Search failed: " + e.getMessage());
			logger.error("Search failed", e);
		}
	}

	/**
	 * GET /document?id={documentId}
	 * Document viewer: title, raw text and metadata
	 */
	private void handleDocument(Context ctx) {
		String documentId = ctx.queryParam("id");
		if (documentId == null || documentId.isBlank()) {
			error(ctx, 400, "Query parameter 'id' is required.");
			return;
		}

		Optional<DocumentView> document = searchService.getDocument(documentId);
		if (document.isEmpty()) {
			error(ctx, 404, "Document not found: " + documentId);
			return;
		}

		ctx.status(200).result(gson.toJson(document.get()));
	}

	/**
	 * GET /suggest?prefix={prefix}&limit={limit}
	 * Indexed terms starting with a prefix
	 */
	private void handleSuggest(Context ctx) {
		Integer limit = parseIntParam(ctx, "limit", defaultLimit);
		if (limit == null) {
			return;
		}

		String prefix = ctx.queryParam("prefix");
		List<String> terms = searchService.suggest(prefix, limit);

		Map<String, Object> response = new HashMap<>();
		response.put("prefix", prefix);
		response.put("terms", terms);
		ctx.status(200).result(gson.toJson(response));
	}

	/**
	 * GET /stats
	 * Get search statistics
	 */
	private void handleStats(Context ctx) {
		try {
			SearchService.SearchStats stats = searchService.getStats();

			Map<String, Object> response = new HashMap<>();
			response.put("total_documents", stats.totalDocuments());
			response.put("total_tokens", stats.totalTokens());
			response.put("distinct_terms", stats.distinctTerms());
			response.put("index_size_mb", String.format("%.2f", stats.indexSizeMB()));
			response.put("index_loaded", stats.indexLoaded());

			ctx.status(200).result(gson.toJson(response));
			logger.debug("Retrieved search statistics");

		} catch (Exception e) {
			error(ctx, 500, "Failed to retrieve statistics: " + e.getMessage());
			logger.error("Failed to get statistics", e);
		}
	}

	/**
	 * POST /admin/reload
	 * Swap in the index currently persisted on disk
	 */
	private void handleReload(Context ctx) {
		try {
			logger.info("Received index reload request");
			int documents = searchService.reload();

			Map<String, Object> response = new HashMap<>();
			response.put("status", "reloaded");
			response.put("total_documents", documents);
			ctx.status(200).result(gson.toJson(response));

		} catch (Exception e) {
			error(ctx, 500, "Reload failed: " + e.getMessage());
			logger.error("Failed to reload index", e);
		}
	}

	/**
	 * Parse an optional integer query parameter. Writes a 400 response and returns null when it is malformed.
	 */
	private Integer parseIntParam(Context ctx, String name, int defaultValue) {
		String value = ctx.queryParam(name);
		if (value == null || value.isEmpty()) {
			return defaultValue;
		}
		try {
			return Integer.parseInt(value);
		} catch (NumberFormatException e) {
			error(ctx, 400, "Invalid " + name + " format. Must be an integer.");
			return null;
		}
	}

	private static void error(Context ctx, int status, String message) {
		Map<String, String> error = new HashMap<>();
		error.put("error", message);
		ctx.status(status).result(gson.toJson(error));
	}
}
