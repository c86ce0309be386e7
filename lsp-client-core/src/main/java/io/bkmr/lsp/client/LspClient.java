/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.bkmr.lsp.client;

import java.time.Duration;
import java.util.function.Consumer;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.bkmr.lsp.client.transport.DiagnosticClassifier;
import io.bkmr.lsp.client.transport.DiagnosticLine;
import io.bkmr.lsp.client.transport.ServerParameters;
import io.bkmr.lsp.client.transport.StdioClientTransport;
import io.bkmr.lsp.spec.LspClientTransport;
import io.bkmr.lsp.spec.LspJson;
import io.bkmr.lsp.spec.LspRequestCorrelator;
import io.bkmr.lsp.spec.LspSchema;
import io.bkmr.lsp.spec.LspSchema.JsonRpcNotification;
import io.bkmr.lsp.util.Assert;

/**
 * Factory for LSP client sessions.
 *
 * <pre>{@code
 * LspSyncClient client = LspClient.sync(ServerParameters.fromCommandLine("bkmr lsp").build())
 *     .requestTimeout(Duration.ofSeconds(10))
 *     .clientInfo(new LspSchema.Implementation("snippet-probe", "1.0"))
 *     .notificationConsumer(notification -> System.err.println(notification.method()))
 *     .build();
 * }</pre>
 */
public interface LspClient {

	Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(5);

	Duration DEFAULT_INITIALIZATION_TIMEOUT = Duration.ofSeconds(5);

	Duration DEFAULT_TERMINATION_GRACE_PERIOD = Duration.ofSeconds(2);

	LspSchema.Implementation DEFAULT_CLIENT_INFO = new LspSchema.Implementation("bkmr-lsp-client", "0.1.0");

	/**
	 * Starts building a session that launches the server described by {@code params}.
	 * @param params how to launch the server
	 * @return a new builder
	 */
	static SyncSpec sync(ServerParameters params) {
		Assert.notNull(params, "The params can not be null");
		return new SyncSpec(params, null);
	}

	/**
	 * Starts building a session over an existing transport. Settings that only concern
	 * process launch (startup grace period, diagnostics) are ignored.
	 * @param transport the transport to use
	 * @return a new builder
	 */
	static SyncSpec sync(LspClientTransport transport) {
		Assert.notNull(transport, "The transport can not be null");
		return new SyncSpec(null, transport);
	}

	/**
	 * Builder of {@link LspSyncClient} instances.
	 */
	class SyncSpec {

		private final ServerParameters params;

		private final LspClientTransport transport;

		private ObjectMapper objectMapper = LspJson.newObjectMapper();

		private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;

		private Duration initializationTimeout = DEFAULT_INITIALIZATION_TIMEOUT;

		private Duration startupGracePeriod = StdioClientTransport.DEFAULT_STARTUP_GRACE_PERIOD;

		private Duration terminationGracePeriod = DEFAULT_TERMINATION_GRACE_PERIOD;

		private LspSchema.Implementation clientInfo = DEFAULT_CLIENT_INFO;

		private Object capabilities = LspSchema.ClientCapabilities.defaults();

		private Consumer<JsonRpcNotification> notificationConsumer;

		private Consumer<DiagnosticLine> diagnosticsConsumer;

		private LspRequestCorrelator.RequestHandler serverRequestHandler = LspRequestCorrelator.RequestHandler
			.methodNotFound();

		private DiagnosticClassifier diagnosticClassifier = new DiagnosticClassifier();

		private SyncSpec(ServerParameters params, LspClientTransport transport) {
			this.params = params;
			this.transport = transport;
		}

		public SyncSpec objectMapper(ObjectMapper objectMapper) {
			Assert.notNull(objectMapper, "The objectMapper can not be null");
			this.objectMapper = objectMapper;
			return this;
		}

		/**
		 * How long any request other than {@code initialize} may wait for its response.
		 * @param requestTimeout defaults to five seconds
		 * @return this builder
		 */
		public SyncSpec requestTimeout(Duration requestTimeout) {
			Assert.isPositive(requestTimeout, "The requestTimeout must be positive");
			this.requestTimeout = requestTimeout;
			return this;
		}

		public SyncSpec initializationTimeout(Duration initializationTimeout) {
			Assert.isPositive(initializationTimeout, "The initializationTimeout must be positive");
			this.initializationTimeout = initializationTimeout;
			return this;
		}

		public SyncSpec startupGracePeriod(Duration startupGracePeriod) {
			Assert.notNull(startupGracePeriod, "The startupGracePeriod can not be null");
			this.startupGracePeriod = startupGracePeriod;
			return this;
		}

		/**
		 * How long the server may take to exit on its own when the session closes before
		 * it is killed.
		 * @param terminationGracePeriod defaults to two seconds
		 * @return this builder
		 */
		public SyncSpec terminationGracePeriod(Duration terminationGracePeriod) {
			Assert.notNull(terminationGracePeriod, "The terminationGracePeriod can not be null");
			this.terminationGracePeriod = terminationGracePeriod;
			return this;
		}

		public SyncSpec clientInfo(LspSchema.Implementation clientInfo) {
			Assert.notNull(clientInfo, "The clientInfo can not be null");
			this.clientInfo = clientInfo;
			return this;
		}

		public SyncSpec capabilities(Object capabilities) {
			Assert.notNull(capabilities, "The capabilities can not be null");
			this.capabilities = capabilities;
			return this;
		}

		/**
		 * Receives every notification the server sends, in arrival order, on the thread
		 * that issued the request during which it arrived. Log messages are logged
		 * regardless.
		 * @param notificationConsumer the consumer
		 * @return this builder
		 */
		public SyncSpec notificationConsumer(Consumer<JsonRpcNotification> notificationConsumer) {
			Assert.notNull(notificationConsumer, "The notificationConsumer can not be null");
			this.notificationConsumer = notificationConsumer;
			return this;
		}

		public SyncSpec diagnosticsConsumer(Consumer<DiagnosticLine> diagnosticsConsumer) {
			Assert.notNull(diagnosticsConsumer, "The diagnosticsConsumer can not be null");
			this.diagnosticsConsumer = diagnosticsConsumer;
			return this;
		}

		public SyncSpec serverRequestHandler(LspRequestCorrelator.RequestHandler serverRequestHandler) {
			Assert.notNull(serverRequestHandler, "The serverRequestHandler can not be null");
			this.serverRequestHandler = serverRequestHandler;
			return this;
		}

		public SyncSpec diagnosticClassifier(DiagnosticClassifier diagnosticClassifier) {
			Assert.notNull(diagnosticClassifier, "The diagnosticClassifier can not be null");
			this.diagnosticClassifier = diagnosticClassifier;
			return this;
		}

		public LspSyncClient build() {
			LspClientTransport clientTransport = this.transport;
			if (clientTransport == null) {
				StdioClientTransport.Builder builder = StdioClientTransport.builder(this.params)
					.objectMapper(this.objectMapper)
					.startupGracePeriod(this.startupGracePeriod)
					.diagnosticClassifier(this.diagnosticClassifier);
				if (this.diagnosticsConsumer != null) {
					builder.diagnosticsConsumer(this.diagnosticsConsumer);
				}
				clientTransport = builder.build();
			}
			return new DefaultLspSyncClient(clientTransport, this.objectMapper, this.requestTimeout,
					this.initializationTimeout, this.terminationGracePeriod, this.clientInfo, this.capabilities,
					this.notificationConsumer, this.serverRequestHandler);
		}

	}

}
