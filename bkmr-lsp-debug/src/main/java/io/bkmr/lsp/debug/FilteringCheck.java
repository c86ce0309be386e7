/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.bkmr.lsp.debug;

import java.util.ArrayList;
import java.util.List;
import java.util.function.LongSupplier;

import com.fasterxml.jackson.databind.JsonNode;
import io.bkmr.lsp.client.LspSyncClient;
import io.bkmr.lsp.debug.FilteringReport.TypingStep;
import io.bkmr.lsp.spec.LspResponseException;
import io.bkmr.lsp.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scripted typing session that tells whether completions are filtered by the server or
 * left to the client. The document is opened with the first text, then replaced by each
 * following text through {@code didChange}; after every state completions are requested
 * at the end of the document. The number of items, the {@code isIncomplete} flag and the
 * searches the server reported are recorded per step.
 *
 * <p>
 * Server searches are read from a counter fed by the server's error stream. Lines arrive
 * asynchronously, so a search logged after its completion answer is counted in the next
 * step.
 */
public class FilteringCheck {

	private static final Logger logger = LoggerFactory.getLogger(FilteringCheck.class);

	public static final String DEFAULT_URI = "file:///tmp/test-filtering.rs";

	public static final String DEFAULT_LANGUAGE_ID = "rust";

	/**
	 * An empty document, a comment being started, a word typed into it and the body of a
	 * function.
	 */
	public static final List<String> DEFAULT_TEXTS = List.of("", "// ", "// test", "fn main() {\n    ");

	private final LspSyncClient client;

	private final LongSupplier serverQueries;

	/**
	 * @param client an unstarted session; the check starts and closes it
	 * @param serverQueries the number of searches the server has reported so far
	 */
	public FilteringCheck(LspSyncClient client, LongSupplier serverQueries) {
		Assert.notNull(client, "The client can not be null");
		Assert.notNull(serverQueries, "The serverQueries can not be null");
		this.client = client;
		this.serverQueries = serverQueries;
	}

	/**
	 * The document states seen while typing {@code word} character by character,
	 * starting from the empty document.
	 * @param word the word to type
	 * @return the empty text followed by every prefix of {@code word}
	 */
	public static List<String> typing(String word) {
		Assert.hasText(word, "The word can not be empty");
		List<String> texts = new ArrayList<>();
		for (int i = 0; i <= word.length(); i++) {
			texts.add(word.substring(0, i));
		}
		return texts;
	}

	public FilteringReport run() {
		return run(DEFAULT_URI, DEFAULT_LANGUAGE_ID, DEFAULT_TEXTS);
	}

	public FilteringReport run(String uri, String languageId, List<String> texts) {
		Assert.hasText(uri, "The uri can not be empty");
		Assert.hasText(languageId, "The languageId can not be empty");
		Assert.notEmpty(texts, "The texts can not be empty");
		try (this.client) {
			this.client.start();
			this.client.initialize();
			this.client.initialized();

			long sessionStart = this.serverQueries.getAsLong();
			long seen = sessionStart;
			List<TypingStep> steps = new ArrayList<>();
			for (int i = 0; i < texts.size(); i++) {
				String text = texts.get(i);
				if (i == 0) {
					this.client.didOpen(uri, languageId, 1, text);
				}
				else {
					this.client.didChange(uri, i + 1, text);
				}
				TypingStep step = complete(uri, text, seen);
				seen += step.serverQueries();
				steps.add(step);
			}

			boolean acknowledged = this.client.shutdown();
			this.client.exit();
			FilteringReport report = new FilteringReport(steps, this.serverQueries.getAsLong() - sessionStart,
					FilteringReport.Verdict.of(steps), acknowledged);
			logger.info("Filtering looks {} after {} steps and {} server queries", report.verdict(), steps.size(),
					report.serverQueries());
			return report;
		}
	}

	private TypingStep complete(String uri, String text, long queriesBefore) {
		int line = (int) text.chars().filter(c -> c == '\n').count();
		int character = text.length() - (text.lastIndexOf('\n') + 1);
		try {
			JsonNode result = this.client.completion(uri, line, character);
			int count = CompletionProbe.countItems(result);
			JsonNode incomplete = result.path("isIncomplete");
			long queries = this.serverQueries.getAsLong() - queriesBefore;
			logger.info("'{}': {} completion items, {} server queries", text, count, queries);
			return new TypingStep(text, line, character, count, incomplete.isBoolean() ? incomplete.booleanValue() : null,
					queries, null);
		}
		catch (LspResponseException e) {
			logger.warn("Completion for '{}' failed: {}", text, e.getMessage());
			return new TypingStep(text, line, character, 0, null, this.serverQueries.getAsLong() - queriesBefore,
					e.getJsonRpcError().message());
		}
	}

}
