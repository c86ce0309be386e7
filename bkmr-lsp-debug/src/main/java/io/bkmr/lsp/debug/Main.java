/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.bkmr.lsp.debug;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.Function;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.bkmr.lsp.client.LspClient;
import io.bkmr.lsp.client.LspSyncClient;
import io.bkmr.lsp.client.transport.DiagnosticLine;
import io.bkmr.lsp.client.transport.ServerParameters;
import io.bkmr.lsp.spec.LspClientException;
import io.bkmr.lsp.spec.LspJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.util.annotation.Nullable;

/**
 * Debug entry point that runs one scripted session against {@code bkmr lsp} and prints
 * the raw JSON result on stdout. Logging, including the server's stderr, goes to stderr.
 *
 * <p>
 * Usage: {@code Main [--db <path>] [--debug] [--no-interpolation] <command> [args]}
 * <ul>
 * <li>{@code probe [languageId]}: open a document and request completions</li>
 * <li>{@code filter [languageId] [word]}: type a document and tell where completions
 * are filtered</li>
 * <li>{@code list [language]}: list snippets, optionally for one language</li>
 * <li>{@code get <id>}: fetch one snippet</li>
 * <li>{@code commands}: the commands the server advertises</li>
 * <li>{@code test-command <command>}: run one command with a sample argument</li>
 * </ul>
 * {@code --debug} raises the server's log level and the {@value #CLIENT_LOGGER_NAME}
 * loggers to debug.
 */
public final class Main {

	private static final Logger logger = LoggerFactory.getLogger(Main.class);

	static final int EXIT_OK = 0;

	static final int EXIT_FAILURE = 1;

	static final int EXIT_USAGE = 2;

	static final String CLIENT_LOGGER_NAME = "io.bkmr.lsp";

	private static final String USAGE = """
			Usage: Main [--db <path>] [--debug] [--no-interpolation] <command> [args]
			Commands:
			  probe [languageId]            open a document and request completions
			  filter [languageId] [word]    type a document and tell where completions are filtered
			  list [language]               list snippets, optionally for one language
			  get <id>                      fetch one snippet
			  commands                      show the commands the server advertises
			  test-command <command>        run one command with a sample argument""";

	private Main() {
	}

	public static void main(String[] args) {
		System.exit(run(args, System.out, System.err,
				(params, diagnostics) -> LspClient.sync(params).diagnosticsConsumer(diagnostics).build()));
	}

	/**
	 * Runs one command.
	 * @param args the command line
	 * @param out receives the JSON result
	 * @param err receives usage errors
	 * @param clients opens a session for the configured server, passing the server's
	 * error-stream lines to the given consumer
	 * @return the process exit code
	 */
	static int run(String[] args, PrintStream out, PrintStream err,
			BiFunction<ServerParameters, Consumer<DiagnosticLine>, LspSyncClient> clients) {
		Invocation invocation;
		try {
			invocation = Invocation.parse(args);
		}
		catch (IllegalArgumentException e) {
			err.println("Error: " + e.getMessage());
			err.println(USAGE);
			return EXIT_USAGE;
		}

		if (invocation.debug()) {
			raiseClientLogLevel();
		}
		ObjectMapper mapper = LspJson.newObjectMapper();
		ServerParameters params = invocation.server().build();
		logger.debug("Launching {}", params);
		ServerQueryCounter queries = new ServerQueryCounter();
		LspSyncClient client = clients.apply(params, queries);
		try {
			JsonNode result = switch (invocation.command()) {
				case "probe" -> mapper.valueToTree(new CompletionProbe(client)
					.run(CompletionProbe.Document.forLanguage(invocation.operand("rust")),
							CompletionProbe.DEFAULT_POSITIONS));
				case "filter" -> mapper.valueToTree(filter(new FilteringCheck(client, queries::getCount), invocation));
				case "list" -> session(client, c -> new SnippetCommands(c).listSnippets(invocation.operand(null)));
				case "get" -> session(client, c -> new SnippetCommands(c).getSnippet(invocation.snippetId()));
				case "commands" -> session(client, c -> mapper.valueToTree(c.getAdvertisedCommands()));
				case "test-command" -> session(client, c -> testCommand(c, invocation.operand(null)));
				default -> throw new IllegalStateException("Unknown command: " + invocation.command());
			};
			out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(result));
			return EXIT_OK;
		}
		catch (LspClientException e) {
			logger.error("{} failed: {}", invocation.command(), e.getMessage());
			return EXIT_FAILURE;
		}
		catch (JsonProcessingException e) {
			logger.error("Could not render the result of {}", invocation.command(), e);
			return EXIT_FAILURE;
		}
		finally {
			client.close();
		}
	}

	private static FilteringReport filter(FilteringCheck check, Invocation invocation) {
		String languageId = invocation.operand(FilteringCheck.DEFAULT_LANGUAGE_ID);
		List<String> texts = (invocation.operands().size() < 2) ? FilteringCheck.DEFAULT_TEXTS
				: FilteringCheck.typing(invocation.operands().get(1));
		return check.run(CompletionProbe.Document.forLanguage(languageId).uri(), languageId, texts);
	}

	/**
	 * Runs a command with its sample argument. A command the server does not advertise is
	 * still sent; a server that advertises nothing is assumed to know the snippet
	 * commands.
	 */
	private static JsonNode testCommand(LspSyncClient client, String command) {
		List<String> advertised = client.getAdvertisedCommands();
		List<String> known = advertised.isEmpty() ? SnippetCommands.ALL : advertised;
		if (!known.contains(command)) {
			logger.warn("'{}' is not among the known commands {}", command, known);
		}
		return new SnippetCommands(client).executeWithSampleArgument(command);
	}

	private static void raiseClientLogLevel() {
		if (LoggerFactory.getILoggerFactory() instanceof LoggerContext context) {
			context.getLogger(CLIENT_LOGGER_NAME).setLevel(Level.DEBUG);
		}
		else {
			logger.warn("Logging is not backed by logback, leaving the log level of {} unchanged",
					CLIENT_LOGGER_NAME);
		}
	}

	/**
	 * Runs an operation inside a complete session: handshake first, graceful shutdown
	 * after.
	 */
	private static JsonNode session(LspSyncClient client, Function<LspSyncClient, JsonNode> operation) {
		client.start();
		client.initialize();
		client.initialized();
		JsonNode result = operation.apply(client);
		client.closeGracefully();
		return result;
	}

	/**
	 * A parsed command line.
	 */
	record Invocation(String command, List<String> operands, BkmrServer.Builder server, boolean debug) {

		static final List<String> COMMANDS = List.of("probe", "filter", "list", "get", "commands", "test-command");

		static Invocation parse(String[] args) {
			BkmrServer.Builder server = BkmrServer.builder();
			List<String> positional = new ArrayList<>();
			boolean debug = false;
			for (int i = 0; i < args.length; i++) {
				switch (args[i]) {
					case "--db" -> {
						if (i + 1 >= args.length) {
							throw new IllegalArgumentException("--db requires a path");
						}
						server.database(args[++i]);
					}
					case "--debug" -> {
						server.logLevel("debug");
						debug = true;
					}
					case "--no-interpolation" -> server.noInterpolation(true);
					default -> {
						if (args[i].startsWith("--")) {
							throw new IllegalArgumentException("Unknown option: " + args[i]);
						}
						positional.add(args[i]);
					}
				}
			}
			if (positional.isEmpty()) {
				throw new IllegalArgumentException("No command given");
			}
			String command = positional.get(0);
			if (!COMMANDS.contains(command)) {
				throw new IllegalArgumentException("Unknown command: " + command);
			}
			Invocation invocation = new Invocation(command, List.copyOf(positional.subList(1, positional.size())),
					server, debug);
			if (command.equals("get")) {
				invocation.snippetId();
			}
			if (command.equals("filter")) {
				// searches are only logged at debug level
				server.logLevel("debug");
			}
			if (command.equals("test-command") && invocation.operands().isEmpty()) {
				throw new IllegalArgumentException("test-command requires a command name");
			}
			return invocation;
		}

		@Nullable
		String operand(@Nullable String defaultValue) {
			return this.operands.isEmpty() ? defaultValue : this.operands.get(0);
		}

		long snippetId() {
			if (this.operands.isEmpty()) {
				throw new IllegalArgumentException("get requires a snippet id");
			}
			try {
				return Long.parseLong(this.operands.get(0));
			}
			catch (NumberFormatException e) {
				throw new IllegalArgumentException("Not a snippet id: " + this.operands.get(0), e);
			}
		}

	}

}
