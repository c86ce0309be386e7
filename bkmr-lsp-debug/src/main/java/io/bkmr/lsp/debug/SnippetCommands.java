/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.bkmr.lsp.debug;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import io.bkmr.lsp.client.LspSyncClient;
import io.bkmr.lsp.spec.LspResponseException;
import io.bkmr.lsp.spec.LspSchema;
import io.bkmr.lsp.util.Assert;
import io.bkmr.lsp.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.util.annotation.Nullable;

/**
 * The snippet commands the bkmr server offers through {@code workspace/executeCommand}.
 *
 * <p>
 * Every command takes a single JSON object as its only argument and returns the server's
 * raw result. bkmr reports command failures inside the result rather than as a JSON-RPC
 * error:
 *
 * <pre>{@code
 * {"success": false, "error": {"code": -32001, "message": "Snippet with ID 42 not found"}}
 * }</pre>
 *
 * Such a result is raised as an {@link LspResponseException}, the same as a JSON-RPC
 * error.
 */
public class SnippetCommands {

	private static final Logger logger = LoggerFactory.getLogger(SnippetCommands.class);

	public static final String CREATE_SNIPPET = "bkmr.createSnippet";

	public static final String UPDATE_SNIPPET = "bkmr.updateSnippet";

	public static final String DELETE_SNIPPET = "bkmr.deleteSnippet";

	public static final String GET_SNIPPET = "bkmr.getSnippet";

	public static final String LIST_SNIPPETS = "bkmr.listSnippets";

	public static final String SEARCH_SNIPPETS = "bkmr.searchSnippets";

	public static final String INSERT_FILEPATH_COMMENT = "bkmr.insertFilepathComment";

	public static final List<String> ALL = List.of(CREATE_SNIPPET, UPDATE_SNIPPET, DELETE_SNIPPET, GET_SNIPPET,
			LIST_SNIPPETS, SEARCH_SNIPPETS, INSERT_FILEPATH_COMMENT);

	/**
	 * A working argument for each command, used to try a command out.
	 */
	static final Map<String, Map<String, Object>> SAMPLE_ARGUMENTS = Map.of( // @formatter:off
			CREATE_SNIPPET, Map.of("url", "console.log('Hello, World!');", "title", "JavaScript Hello World",
					"description", "Simple console log example", "tags", List.of("javascript", "example")),
			UPDATE_SNIPPET, Map.of("id", 1, "url", "console.log('Updated!');", "title", "Updated JavaScript",
					"tags", List.of("javascript", "updated")),
			DELETE_SNIPPET, Map.of("id", 1),
			GET_SNIPPET, Map.of("id", 1),
			LIST_SNIPPETS, Map.of("language", "rust"),
			SEARCH_SNIPPETS, Map.of("query", "async"),
			INSERT_FILEPATH_COMMENT, Map.of("uri", "file:///path/to/file.rs")); // @formatter:on

	private final LspSyncClient client;

	/**
	 * @param client an initialized session with a bkmr server
	 */
	public SnippetCommands(LspSyncClient client) {
		Assert.notNull(client, "The client can not be null");
		this.client = client;
	}

	/**
	 * Creates a snippet.
	 * @param url the snippet content
	 * @param title the snippet title
	 * @param description optional description
	 * @param tags the tags to attach
	 * @return the created snippet, including its id
	 */
	public JsonNode createSnippet(String url, String title, @Nullable String description, List<String> tags) {
		Assert.notNull(url, "The url can not be null");
		Assert.hasText(title, "The title can not be empty");
		Assert.notNull(tags, "The tags can not be null");
		Map<String, Object> argument = new LinkedHashMap<>();
		argument.put("url", url);
		argument.put("title", title);
		if (description != null) {
			argument.put("description", description);
		}
		argument.put("tags", tags);
		return execute(CREATE_SNIPPET, argument);
	}

	/**
	 * Updates the given fields of a snippet; {@code null} fields are left unchanged.
	 * @param id the snippet id
	 * @return the updated snippet
	 */
	public JsonNode updateSnippet(long id, @Nullable String url, @Nullable String title, @Nullable String description,
			@Nullable List<String> tags) {
		Map<String, Object> argument = new LinkedHashMap<>();
		argument.put("id", id);
		putIfPresent(argument, "url", url);
		putIfPresent(argument, "title", title);
		putIfPresent(argument, "description", description);
		putIfPresent(argument, "tags", tags);
		return execute(UPDATE_SNIPPET, argument);
	}

	public JsonNode deleteSnippet(long id) {
		return execute(DELETE_SNIPPET, Map.of("id", id));
	}

	public JsonNode getSnippet(long id) {
		return execute(GET_SNIPPET, Map.of("id", id));
	}

	/**
	 * Lists snippets, optionally only those for one language.
	 * @param language a language id such as {@code rust} or {@code sh}, or {@code null}
	 * for all snippets
	 * @return the server's listing
	 */
	public JsonNode listSnippets(@Nullable String language) {
		return execute(LIST_SNIPPETS, Utils.hasText(language) ? Map.of("language", language) : Map.of());
	}

	public JsonNode searchSnippets(String query) {
		Assert.notNull(query, "The query can not be null");
		return execute(SEARCH_SNIPPETS, Map.of("query", query));
	}

	/**
	 * Asks for the edit that inserts a comment naming the file at its top.
	 * @param uri the document URI
	 * @return the workspace edit proposed by the server
	 */
	public JsonNode insertFilepathComment(String uri) {
		Assert.hasText(uri, "The uri can not be empty");
		return execute(INSERT_FILEPATH_COMMENT, Map.of("uri", uri));
	}

	/**
	 * Runs a command with a sample argument. Commands other than the snippet commands
	 * are sent without arguments.
	 * @param command the command name, such as {@code bkmr.listSnippets}
	 * @return the server's result
	 */
	public JsonNode executeWithSampleArgument(String command) {
		Assert.hasText(command, "The command can not be empty");
		Map<String, Object> sample = SAMPLE_ARGUMENTS.get(command);
		if (sample == null) {
			logger.warn("No sample argument for '{}', sending it without arguments", command);
			return this.client.executeCommand(command, List.of());
		}
		return execute(command, sample);
	}

	private JsonNode execute(String command, Map<String, Object> argument) {
		logger.debug("Executing {} with {}", command, argument);
		JsonNode result = this.client.executeCommand(command, List.of(argument));
		JsonNode success = result.path("success");
		if (success.isBoolean() && !success.booleanValue()) {
			JsonNode error = result.path("error");
			throw new LspResponseException(command,
					new LspSchema.JsonRpcError(error.path("code").asInt(LspSchema.ErrorCodes.INTERNAL_ERROR),
							error.path("message").asText("Unknown error"), null));
		}
		return result;
	}

	private static void putIfPresent(Map<String, Object> argument, String key, @Nullable Object value) {
		if (value != null) {
			argument.put(key, value);
		}
	}

}
