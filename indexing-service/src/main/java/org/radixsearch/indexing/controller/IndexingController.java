package org.radixsearch.indexing.controller;

import com.google.gson.Gson;
import io.javalin.Javalin;
import io.javalin.http.Context;
import org.radixsearch.core.index.CorpusNotFoundException;
import org.radixsearch.indexing.model.IndexResponse;
import org.radixsearch.indexing.model.IndexStatusResponse;
import org.radixsearch.indexing.service.IndexingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

public class IndexingController {
	private static final Logger logger = LoggerFactory.getLogger(IndexingController.class);
	private static final Gson gson = new Gson();
	private final IndexingService indexingService;

	public IndexingController(IndexingService indexingService) {
		this.indexingService = indexingService;
	}

	/**
	 * Register all routes with the Javalin app
	 */
	public void registerRoutes(Javalin app) {
		app.get("/health", this::handleHealth);

		app.post("/index/rebuild", this::handleIndexRebuild);

		app.get("/index/status", this::handleIndexStatus);

		logger.info("Indexing routes registered");
	}

	/**
	 * GET /health
	 * Health check endpoint
	 */
	private void handleHealth(Context ctx) {
		Map<String, Object> health = new HashMap<>();
		health.put("service", "indexing-service");
		health.put("status", "running");
		health.put("timestamp", System.currentTimeMillis());

		try {
			IndexingService.IndexStats stats = indexingService.getStats();
			health.put("documents_indexed", stats.documentsIndexed());
			health.put("distinct_terms", stats.distinctTerms());
			health.put("index_size_mb", String.format("%.2f", stats.indexSizeMB()));
		} catch (Exception e) {
			health.put("documents_indexed", "error");
			logger.error("Error getting stats for health check", e);
		}

		ctx.result(gson.toJson(health));
	}

	/**
	 * POST /index/rebuild
	 * Rebuild the entire index from the corpus
	 */
	private void handleIndexRebuild(Context ctx) {
		try {
			logger.info("Received index rebuild request");

			int documentsIndexed = indexingService.rebuildIndex();

			ctx.status(200).result(gson.toJson(IndexResponse.completed(documentsIndexed)));
			logger.info("Successfully rebuilt index with {} documents", documentsIndexed);

		} catch (CorpusNotFoundException e) {
			ctx.status(404).result(gson.toJson(IndexResponse.failed(e.getMessage())));
			logger.error("Failed to rebuild index: {}", e.getMessage());

		} catch (Exception e) {
			ctx.status(500).result(gson.toJson(IndexResponse.failed(e.getMessage())));
			logger.error("Failed to rebuild index: {}", e.getMessage(), e);
		}
	}

	/**
	 * GET /index/status
	 * Get indexing statistics
	 */
	private void handleIndexStatus(Context ctx) {
		try {
			IndexingService.IndexStats stats = indexingService.getStats();

			IndexStatusResponse response = new IndexStatusResponse(
					stats.documentsIndexed(),
					stats.totalTokens(),
					stats.distinctTerms(),
					stats.lastUpdate() != null ? stats.lastUpdate().toString() : null,
					stats.indexSizeMB()
			);

			ctx.status(200).result(gson.toJson(response));
			logger.debug("Retrieved index status: {} documents, {} MB",
					stats.documentsIndexed(), stats.indexSizeMB());

		} catch (Exception e) {
			Map<String, String> error = new HashMap<>();
			error.put("error", "Failed to retrieve index status: " + e.getMessage());
			ctx.status(500).result(gson.toJson(error));
			logger.error("Failed to get index status: {}", e.getMessage());
		}
	}
}
