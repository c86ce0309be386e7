/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.bkmr.lsp.client;

import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import io.bkmr.lsp.spec.LspSchema;
import reactor.util.annotation.Nullable;

/**
 * A blocking session with one language server.
 *
 * <p>
 * A session moves through {@link State#UNSTARTED}, {@link State#STARTED},
 * {@link State#INITIALIZED}, {@link State#SHUTTING_DOWN} and {@link State#CLOSED}, in that
 * order. Requests and notifications are only accepted once the session is initialized;
 * calling them earlier fails with {@link io.bkmr.lsp.spec.LspInvalidStateException}. A
 * transport failure or the death of the server closes the session before the error
 * reaches the caller.
 *
 * <pre>{@code
 * try (LspSyncClient client = LspClient.sync(ServerParameters.fromCommandLine("bkmr lsp").build()).build()) {
 *     client.start();
 *     client.initialize();
 *     client.initialized();
 *     JsonNode snippets = client.executeCommand("bkmr.listSnippets", List.of(Map.of()));
 *     client.closeGracefully();
 * }
 * }</pre>
 *
 * <p>
 * A session serves one caller at a time.
 */
public interface LspSyncClient extends AutoCloseable {

	enum State {

		UNSTARTED, STARTED, INITIALIZED, SHUTTING_DOWN, CLOSED

	}

	State getState();

	/**
	 * Launches the server.
	 * @throws io.bkmr.lsp.spec.LspStartupException if the server fails to launch or exits
	 * during the startup grace period; the session is closed
	 */
	void start();

	/**
	 * Performs the {@code initialize} request with the configured client info and
	 * capabilities.
	 * @return the server's answer
	 * @throws io.bkmr.lsp.spec.LspHandshakeException if the server answers with an error
	 * or not at all; the session is closed
	 */
	LspSchema.InitializeResult initialize();

	/**
	 * Performs the {@code initialize} request.
	 * @param clientInfo how the client introduces itself
	 * @param capabilities the client capabilities to announce
	 * @return the server's answer
	 */
	LspSchema.InitializeResult initialize(LspSchema.Implementation clientInfo, Object capabilities);

	/**
	 * Sends the {@code initialized} notification that completes the handshake.
	 */
	void initialized();

	@Nullable
	LspSchema.InitializeResult getInitializeResult();

	/**
	 * The capabilities announced by the server.
	 * @return the raw capabilities, or {@code null} before initialization
	 */
	@Nullable
	JsonNode getServerCapabilities();

	/**
	 * The commands listed by the server's {@code executeCommandProvider}.
	 * @return the command names, empty before initialization or if none are listed
	 */
	List<String> getAdvertisedCommands();

	void notify(String method, @Nullable Object params);

	/**
	 * Sends a request and waits for its result.
	 * @param method the method to invoke
	 * @param params the parameters, may be {@code null}
	 * @return the raw result, {@link com.fasterxml.jackson.databind.node.NullNode} for an
	 * explicit {@code null}
	 * @throws io.bkmr.lsp.spec.LspResponseException if the server answers with an error
	 * @throws io.bkmr.lsp.spec.LspTimeoutException if no answer arrives in time
	 */
	JsonNode request(String method, @Nullable Object params);

	/**
	 * Invokes {@code workspace/executeCommand}.
	 * @param command the command identifier
	 * @param arguments the command arguments
	 * @return the raw result; interpreting it is up to the caller
	 */
	JsonNode executeCommand(String command, List<Object> arguments);

	void didOpen(String uri, String languageId, int version, String text);

	/**
	 * Replaces the whole content of an open document.
	 */
	void didChange(String uri, int version, String text);

	void didClose(String uri);

	/**
	 * Requests completions at a position, as if invoked manually.
	 * @param uri the document
	 * @param line zero-based line
	 * @param character zero-based character offset
	 * @return the raw completion result, a list or a {@code CompletionList}
	 */
	JsonNode completion(String uri, int line, int character);

	/**
	 * Sends the {@code shutdown} request. Failures are logged, not raised.
	 * @return {@code true} if the server acknowledged the request
	 */
	boolean shutdown();

	/**
	 * Sends the {@code exit} notification, best effort. Only valid after
	 * {@link #shutdown()}.
	 */
	void exit();

	/**
	 * Runs {@code shutdown} and {@code exit} as far as the current state allows, then
	 * closes the session.
	 * @return {@code true} if the server acknowledged the shutdown
	 */
	boolean closeGracefully();

	/**
	 * Terminates the server and releases its streams. Safe to call in any state and more
	 * than once.
	 */
	@Override
	void close();

}
