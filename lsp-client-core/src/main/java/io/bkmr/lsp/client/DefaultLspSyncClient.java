/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.bkmr.lsp.client;

import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Supplier;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import io.bkmr.lsp.spec.LspClientException;
import io.bkmr.lsp.spec.LspClientTransport;
import io.bkmr.lsp.spec.LspHandshakeException;
import io.bkmr.lsp.spec.LspInvalidStateException;
import io.bkmr.lsp.spec.LspProtocolException;
import io.bkmr.lsp.spec.LspRequestCorrelator;
import io.bkmr.lsp.spec.LspResponseException;
import io.bkmr.lsp.spec.LspSchema;
import io.bkmr.lsp.spec.LspSchema.JsonRpcNotification;
import io.bkmr.lsp.spec.LspSchema.JsonRpcResponse;
import io.bkmr.lsp.spec.LspServerDiedException;
import io.bkmr.lsp.spec.LspStartupException;
import io.bkmr.lsp.spec.LspTimeoutException;
import io.bkmr.lsp.spec.LspTransportException;
import io.bkmr.lsp.spec.RequestIdGenerator;
import io.bkmr.lsp.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.util.annotation.Nullable;

/**
 * Default {@link LspSyncClient}: drives a {@link LspRequestCorrelator} over a
 * {@link LspClientTransport} and enforces the session state machine.
 */
public class DefaultLspSyncClient implements LspSyncClient {

	private static final Logger logger = LoggerFactory.getLogger(DefaultLspSyncClient.class);

	private static final Set<State> SHUTDOWN_STATES = EnumSet.of(State.STARTED, State.INITIALIZED);

	private final LspClientTransport transport;

	private final LspRequestCorrelator correlator;

	private final ObjectMapper objectMapper;

	private final Duration requestTimeout;

	private final Duration initializationTimeout;

	private final Duration terminationGracePeriod;

	private final LspSchema.Implementation clientInfo;

	private final Object capabilities;

	@Nullable
	private final Consumer<JsonRpcNotification> notificationConsumer;

	private final AtomicReference<State> state = new AtomicReference<>(State.UNSTARTED);

	private volatile LspSchema.InitializeResult initializeResult;

	DefaultLspSyncClient(LspClientTransport transport, ObjectMapper objectMapper, Duration requestTimeout,
			Duration initializationTimeout, Duration terminationGracePeriod, LspSchema.Implementation clientInfo,
			Object capabilities, @Nullable Consumer<JsonRpcNotification> notificationConsumer,
			LspRequestCorrelator.RequestHandler serverRequestHandler) {
		Assert.notNull(transport, "The transport can not be null");
		Assert.notNull(objectMapper, "The objectMapper can not be null");
		Assert.isPositive(requestTimeout, "The requestTimeout must be positive");
		Assert.isPositive(initializationTimeout, "The initializationTimeout must be positive");
		Assert.notNull(terminationGracePeriod, "The terminationGracePeriod can not be null");
		Assert.notNull(clientInfo, "The clientInfo can not be null");
		Assert.notNull(capabilities, "The capabilities can not be null");
		this.transport = transport;
		this.objectMapper = objectMapper;
		this.requestTimeout = requestTimeout;
		this.initializationTimeout = initializationTimeout;
		this.terminationGracePeriod = terminationGracePeriod;
		this.clientInfo = clientInfo;
		this.capabilities = capabilities;
		this.notificationConsumer = notificationConsumer;
		this.correlator = new LspRequestCorrelator(transport, RequestIdGenerator.ofIncremental(),
				this::onNotification, serverRequestHandler);
	}

	@Override
	public State getState() {
		return this.state.get();
	}

	@Override
	public void start() {
		transition("start", State.UNSTARTED, State.STARTED);
		try {
			this.transport.start();
		}
		catch (LspStartupException e) {
			close();
			throw e;
		}
		catch (RuntimeException e) {
			close();
			throw new LspStartupException("Failed to start server: " + e.getMessage(), e);
		}
	}

	@Override
	public LspSchema.InitializeResult initialize() {
		return initialize(this.clientInfo, this.capabilities);
	}

	@Override
	public LspSchema.InitializeResult initialize(LspSchema.Implementation clientInfo, Object capabilities) {
		Assert.notNull(clientInfo, "The clientInfo can not be null");
		Assert.notNull(capabilities, "The capabilities can not be null");
		requireState("initialize", State.STARTED);

		LspSchema.InitializeParams params = new LspSchema.InitializeParams(ProcessHandle.current().pid(), clientInfo,
				capabilities, null);
		JsonRpcResponse response;
		try {
			response = guarded(() -> this.correlator.sendRequest(LspSchema.METHOD_INITIALIZE, params,
					this.initializationTimeout));
		}
		catch (LspTimeoutException e) {
			close();
			throw new LspHandshakeException("No response to initialize within "
					+ this.initializationTimeout.toMillis() + " ms", e);
		}
		if (response.error() != null) {
			close();
			throw new LspHandshakeException(response.error());
		}

		LspSchema.InitializeResult result;
		try {
			result = this.objectMapper.convertValue(response.result(), LspSchema.InitializeResult.class);
		}
		catch (IllegalArgumentException e) {
			close();
			throw new LspHandshakeException("Malformed initialize result", e);
		}
		if (result == null) {
			close();
			throw new LspHandshakeException("Server answered initialize without a result",
					new LspProtocolException("Null initialize result"));
		}
		this.initializeResult = result;
		transition("initialize", State.STARTED, State.INITIALIZED);
		logger.info("Server initialized: {} (commands: {})",
				(result.serverInfo() != null) ? result.serverInfo().name() : "unknown server",
				result.advertisedCommands());
		return result;
	}

	@Override
	public void initialized() {
		notify(LspSchema.METHOD_INITIALIZED, Map.of());
	}

	@Override
	@Nullable
	public LspSchema.InitializeResult getInitializeResult() {
		return this.initializeResult;
	}

	@Override
	@Nullable
	public JsonNode getServerCapabilities() {
		LspSchema.InitializeResult result = this.initializeResult;
		return (result != null) ? result.capabilities() : null;
	}

	@Override
	public List<String> getAdvertisedCommands() {
		LspSchema.InitializeResult result = this.initializeResult;
		return (result != null) ? result.advertisedCommands() : List.of();
	}

	@Override
	public void notify(String method, @Nullable Object params) {
		requireState("send " + method, State.INITIALIZED);
		guarded(() -> {
			this.correlator.sendNotification(method, params);
			return null;
		});
	}

	@Override
	public JsonNode request(String method, @Nullable Object params) {
		requireState("request " + method, State.INITIALIZED);
		JsonRpcResponse response = guarded(() -> this.correlator.sendRequest(method, params, this.requestTimeout));
		if (response.error() != null) {
			throw new LspResponseException(method, response.error());
		}
		return toJsonNode(response.result());
	}

	@Override
	public JsonNode executeCommand(String command, List<Object> arguments) {
		Assert.hasText(command, "The command can not be empty");
		Assert.notNull(arguments, "The arguments can not be null");
		return request(LspSchema.METHOD_WORKSPACE_EXECUTE_COMMAND,
				new LspSchema.ExecuteCommandParams(command, arguments));
	}

	@Override
	public void didOpen(String uri, String languageId, int version, String text) {
		notify(LspSchema.METHOD_TEXT_DOCUMENT_DID_OPEN, new LspSchema.DidOpenTextDocumentParams(
				new LspSchema.TextDocumentItem(uri, languageId, version, text)));
	}

	@Override
	public void didChange(String uri, int version, String text) {
		notify(LspSchema.METHOD_TEXT_DOCUMENT_DID_CHANGE,
				new LspSchema.DidChangeTextDocumentParams(new LspSchema.VersionedTextDocumentIdentifier(uri, version),
						List.of(new LspSchema.TextDocumentContentChangeEvent(text))));
	}

	@Override
	public void didClose(String uri) {
		notify(LspSchema.METHOD_TEXT_DOCUMENT_DID_CLOSE,
				new LspSchema.DidCloseTextDocumentParams(new LspSchema.TextDocumentIdentifier(uri)));
	}

	@Override
	public JsonNode completion(String uri, int line, int character) {
		return request(LspSchema.METHOD_TEXT_DOCUMENT_COMPLETION,
				new LspSchema.CompletionParams(new LspSchema.TextDocumentIdentifier(uri),
						new LspSchema.Position(line, character),
						new LspSchema.CompletionContext(LspSchema.CompletionTriggerKind.INVOKED, null)));
	}

	@Override
	public boolean shutdown() {
		State current = this.state.get();
		if (!SHUTDOWN_STATES.contains(current)
				|| !this.state.compareAndSet(current, State.SHUTTING_DOWN)) {
			throw new LspInvalidStateException("shutdown", this.state.get(), SHUTDOWN_STATES);
		}
		try {
			JsonRpcResponse response = this.correlator.sendRequest(LspSchema.METHOD_SHUTDOWN, null,
					this.requestTimeout);
			if (response.error() != null) {
				logger.warn("Server rejected shutdown: {} (code {})", response.error().message(),
						response.error().code());
				return false;
			}
			return true;
		}
		catch (LspClientException e) {
			logger.warn("Shutdown request failed: {}", e.getMessage());
			return false;
		}
	}

	@Override
	public void exit() {
		requireState("exit", State.SHUTTING_DOWN);
		try {
			this.correlator.sendNotification(LspSchema.METHOD_EXIT, null);
		}
		catch (LspClientException e) {
			logger.warn("Exit notification failed: {}", e.getMessage());
		}
	}

	@Override
	public boolean closeGracefully() {
		boolean acknowledged = false;
		try {
			if (SHUTDOWN_STATES.contains(this.state.get())) {
				acknowledged = shutdown();
			}
			if (this.state.get() == State.SHUTTING_DOWN) {
				exit();
			}
		}
		catch (LspInvalidStateException e) {
			logger.debug("Session changed state during graceful close: {}", e.getMessage());
		}
		finally {
			close();
		}
		return acknowledged;
	}

	@Override
	public void close() {
		State previous = this.state.getAndSet(State.CLOSED);
		if (previous == State.CLOSED) {
			return;
		}
		logger.debug("Closing session in state {}", previous);
		if (previous != State.UNSTARTED) {
			this.transport.terminate(this.terminationGracePeriod);
		}
	}

	/**
	 * Runs an operation, closing the session if it fails in a way the session can not
	 * recover from.
	 */
	private <T> T guarded(Supplier<T> operation) {
		try {
			return operation.get();
		}
		catch (LspTransportException | LspServerDiedException e) {
			logger.warn("Closing session after fatal error: {}", e.getMessage());
			close();
			throw e;
		}
	}

	private void onNotification(JsonRpcNotification notification) {
		if (LspSchema.METHOD_WINDOW_LOG_MESSAGE.equals(notification.method())
				|| LspSchema.METHOD_WINDOW_SHOW_MESSAGE.equals(notification.method())) {
			logServerMessage(toJsonNode(notification.params()));
		}
		else {
			logger.debug("Notification from server: {}", notification.method());
		}
		if (this.notificationConsumer != null) {
			this.notificationConsumer.accept(notification);
		}
	}

	private static void logServerMessage(JsonNode params) {
		String message = params.path("message").asText("");
		switch (params.path("type").asInt(LspSchema.MessageType.LOG)) {
			case LspSchema.MessageType.ERROR -> logger.error("[server] {}", message);
			case LspSchema.MessageType.WARNING -> logger.warn("[server] {}", message);
			case LspSchema.MessageType.INFO -> logger.info("[server] {}", message);
			default -> logger.debug("[server] {}", message);
		}
	}

	private JsonNode toJsonNode(@Nullable Object value) {
		if (value == null) {
			return NullNode.getInstance();
		}
		if (value instanceof JsonNode node) {
			return node;
		}
		return this.objectMapper.valueToTree(value);
	}

	private void requireState(String operation, State required) {
		State current = this.state.get();
		if (current != required) {
			throw new LspInvalidStateException(operation, current, required);
		}
	}

	private void transition(String operation, State from, State to) {
		if (!this.state.compareAndSet(from, to)) {
			throw new LspInvalidStateException(operation, this.state.get(), from);
		}
	}

}
