/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.bkmr.lsp.debug;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import io.bkmr.lsp.client.LspSyncClient;
import io.bkmr.lsp.debug.ProbeReport.CompletionSample;
import io.bkmr.lsp.spec.LspResponseException;
import io.bkmr.lsp.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scripted completion session: start the server, complete the handshake, open one
 * document, request completions at a list of positions, then shut the server down.
 *
 * <p>
 * A completion answered with an error is recorded in the report and probing continues.
 * Any other failure aborts the remaining steps and propagates. The session is closed in
 * every case.
 */
public class CompletionProbe {

	private static final Logger logger = LoggerFactory.getLogger(CompletionProbe.class);

	/**
	 * A zero-based position in the probed document.
	 */
	public record Position(int line, int character) {

		public Position {
			Assert.isTrue(line >= 0, "The line can not be negative");
			Assert.isTrue(character >= 0, "The character can not be negative");
		}

	}

	/**
	 * The document opened before completions are requested.
	 */
	public record Document(String uri, String languageId, String text) {

		private static final Map<String, String> EXTENSIONS = Map.of("rust", "rs", "python", "py", "javascript", "js",
				"typescript", "ts", "shellscript", "sh", "markdown", "md");

		public Document {
			Assert.hasText(uri, "The uri can not be empty");
			Assert.hasText(languageId, "The languageId can not be empty");
			Assert.notNull(text, "The text can not be null");
		}

		/**
		 * A single-line comment document in {@code /tmp}, named after the language.
		 * @param languageId the LSP language id
		 * @return the document
		 */
		public static Document forLanguage(String languageId) {
			String extension = EXTENSIONS.getOrDefault(languageId, languageId);
			String comment = switch (languageId) {
				case "python", "sh", "shellscript", "yaml", "toml" -> "# Test file\n";
				case "markdown", "html" -> "<!-- Test file -->\n";
				default -> "// Test file\n";
			};
			return new Document("file:///tmp/test." + extension, languageId, comment);
		}

	}

	public static final Document DEFAULT_DOCUMENT = Document.forLanguage("rust");

	/**
	 * Start of the document, end of the comment line and the empty line after it.
	 */
	public static final List<Position> DEFAULT_POSITIONS = List.of(new Position(0, 0), new Position(0, 12),
			new Position(1, 0));

	private final LspSyncClient client;

	/**
	 * @param client an unstarted session; the probe starts and closes it
	 */
	public CompletionProbe(LspSyncClient client) {
		Assert.notNull(client, "The client can not be null");
		this.client = client;
	}

	public ProbeReport run() {
		return run(DEFAULT_DOCUMENT, DEFAULT_POSITIONS);
	}

	public ProbeReport run(Document document, List<Position> positions) {
		Assert.notNull(document, "The document can not be null");
		Assert.notEmpty(positions, "The positions can not be empty");
		try (this.client) {
			this.client.start();
			this.client.initialize();
			this.client.initialized();
			List<String> commands = this.client.getAdvertisedCommands();

			this.client.didOpen(document.uri(), document.languageId(), 1, document.text());
			List<CompletionSample> samples = new ArrayList<>();
			for (Position position : positions) {
				samples.add(complete(document, position));
			}

			boolean acknowledged = this.client.shutdown();
			this.client.exit();
			return new ProbeReport(commands, samples, acknowledged);
		}
	}

	private CompletionSample complete(Document document, Position position) {
		try {
			JsonNode result = this.client.completion(document.uri(), position.line(), position.character());
			int count = countItems(result);
			logger.info("{} completion items at {}:{}", count, position.line(), position.character());
			return new CompletionSample(position.line(), position.character(), count, null);
		}
		catch (LspResponseException e) {
			logger.warn("Completion at {}:{} failed: {}", position.line(), position.character(), e.getMessage());
			return new CompletionSample(position.line(), position.character(), 0, e.getJsonRpcError().message());
		}
	}

	/**
	 * A completion result is either a bare item array or a {@code CompletionList}.
	 */
	static int countItems(JsonNode result) {
		if (result.isArray()) {
			return result.size();
		}
		JsonNode items = result.path("items");
		return items.isArray() ? items.size() : 0;
	}

}
