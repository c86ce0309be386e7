/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.bkmr.lsp.client.transport;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.time.Duration;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.bkmr.lsp.spec.ContentLengthCodec;
import io.bkmr.lsp.spec.InboundFrame;
import io.bkmr.lsp.spec.LspClientTransport;
import io.bkmr.lsp.spec.LspJson;
import io.bkmr.lsp.spec.LspProtocolException;
import io.bkmr.lsp.spec.LspSchema.JsonRpcMessage;
import io.bkmr.lsp.spec.LspStartupException;
import io.bkmr.lsp.spec.LspTransportException;
import io.bkmr.lsp.util.Assert;
import io.bkmr.lsp.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.util.annotation.Nullable;

/**
 * Runs a language server as a child process and talks to it over the process's standard
 * streams.
 *
 * <p>
 * Standard output is framed by a dedicated reader thread into a queue, which lets
 * {@link #receive(Duration)} honour deadlines. Standard error is drained by a
 * {@link StderrMonitor}. Neither thread ever waits on the other or on the caller.
 *
 * <pre>{@code
 * StdioClientTransport transport = StdioClientTransport
 *     .builder(ServerParameters.fromCommandLine("bkmr lsp").addEnvVar("RUST_LOG", "debug").build())
 *     .startupGracePeriod(Duration.ofMillis(500))
 *     .build();
 * }</pre>
 */
public class StdioClientTransport implements LspClientTransport {

	private static final Logger logger = LoggerFactory.getLogger(StdioClientTransport.class);

	public static final Duration DEFAULT_STARTUP_GRACE_PERIOD = Duration.ofMillis(500);

	/** How long the reader waits for the exit status once the server's output has ended. */
	private static final Duration EXIT_SETTLE_TIMEOUT = Duration.ofSeconds(1);

	private static final Duration STDERR_FLUSH_TIMEOUT = Duration.ofMillis(500);

	private static final int LOG_PAYLOAD_LIMIT = 500;

	private final ServerParameters params;

	private final ContentLengthCodec codec;

	private final Duration startupGracePeriod;

	private final DiagnosticClassifier diagnosticClassifier;

	@Nullable
	private final Consumer<DiagnosticLine> diagnosticsConsumer;

	private final BlockingQueue<InboundFrame> inboundFrames = new LinkedBlockingQueue<>();

	private final Scheduler inboundScheduler;

	private final Object writeLock = new Object();

	private final AtomicBoolean started = new AtomicBoolean(false);

	private final AtomicBoolean terminated = new AtomicBoolean(false);

	private volatile Process process;

	private volatile OutputStream processInput;

	private volatile StderrMonitor stderrMonitor;

	private volatile boolean endOfStreamSeen;

	public StdioClientTransport(ServerParameters params) {
		this(params, LspJson.newObjectMapper(), DEFAULT_STARTUP_GRACE_PERIOD, new DiagnosticClassifier(), null);
	}

	StdioClientTransport(ServerParameters params, ObjectMapper objectMapper, Duration startupGracePeriod,
			DiagnosticClassifier diagnosticClassifier, @Nullable Consumer<DiagnosticLine> diagnosticsConsumer) {
		Assert.notNull(params, "The params can not be null");
		Assert.notNull(objectMapper, "The objectMapper can not be null");
		Assert.notNull(startupGracePeriod, "The startupGracePeriod can not be null");
		Assert.isTrue(!startupGracePeriod.isNegative(), "The startupGracePeriod can not be negative");
		Assert.notNull(diagnosticClassifier, "The diagnosticClassifier can not be null");
		this.params = params;
		this.codec = new ContentLengthCodec(objectMapper);
		this.startupGracePeriod = startupGracePeriod;
		this.diagnosticClassifier = diagnosticClassifier;
		this.diagnosticsConsumer = diagnosticsConsumer;
		this.inboundScheduler = Schedulers.newSingle("lsp-inbound", true);
	}

	public static Builder builder(ServerParameters params) {
		return new Builder(params);
	}

	public ServerParameters getServerParameters() {
		return this.params;
	}

	@Override
	public void start() {
		if (!this.started.compareAndSet(false, true)) {
			throw new IllegalStateException("Transport already started");
		}
		String command = String.join(" ", this.params.getCommandLine());

		ProcessBuilder processBuilder = new ProcessBuilder(this.params.getCommandLine());
		if (!this.params.isInheritEnvironment()) {
			processBuilder.environment().clear();
		}
		processBuilder.environment().putAll(this.params.getEnv());

		Process startedProcess;
		try {
			startedProcess = processBuilder.start();
		}
		catch (IOException e) {
			this.inboundScheduler.dispose();
			throw new LspStartupException("Failed to start server process '" + command + "'", e);
		}
		this.process = startedProcess;
		this.processInput = new BufferedOutputStream(startedProcess.getOutputStream());
		logger.info("Started server process '{}' (pid {})", command, startedProcess.pid());

		this.stderrMonitor = new StderrMonitor(startedProcess.getErrorStream(), this.diagnosticClassifier,
				this.diagnosticsConsumer);
		this.stderrMonitor.start();
		this.inboundScheduler.schedule(() -> readInbound(startedProcess.getInputStream()));

		try {
			if (startedProcess.waitFor(this.startupGracePeriod.toMillis(), TimeUnit.MILLISECONDS)) {
				int exitCode = startedProcess.exitValue();
				terminate(Duration.ZERO);
				throw new LspStartupException(command, exitCode);
			}
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			terminate(Duration.ZERO);
			throw new LspStartupException("Interrupted while starting server process '" + command + "'", e);
		}
	}

	@Override
	public void send(JsonRpcMessage message) {
		Process current = this.process;
		if (current == null) {
			throw new LspTransportException("Transport not started");
		}
		if (!current.isAlive()) {
			throw new LspTransportException(
					"Broken pipe: server process has exited with code " + current.exitValue());
		}
		if (logger.isDebugEnabled()) {
			logger.debug("--> {}", Utils.truncate(String.valueOf(message), LOG_PAYLOAD_LIMIT));
		}
		synchronized (this.writeLock) {
			this.codec.write(this.processInput, message);
		}
	}

	@Override
	@Nullable
	public InboundFrame receive(Duration timeout) {
		assertStarted();
		if (this.endOfStreamSeen && this.inboundFrames.isEmpty()) {
			return InboundFrame.END_OF_STREAM;
		}
		try {
			return track(this.inboundFrames.poll(timeout.toNanos(), TimeUnit.NANOSECONDS));
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new LspTransportException("Interrupted while waiting for server output", e);
		}
	}

	@Override
	public InboundFrame receive() {
		assertStarted();
		if (this.endOfStreamSeen && this.inboundFrames.isEmpty()) {
			return InboundFrame.END_OF_STREAM;
		}
		try {
			return track(this.inboundFrames.take());
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new LspTransportException("Interrupted while waiting for server output", e);
		}
	}

	@Override
	public boolean isAlive() {
		Process current = this.process;
		return current != null && current.isAlive();
	}

	@Override
	public OptionalInt exitCode() {
		Process current = this.process;
		if (current == null || current.isAlive()) {
			return OptionalInt.empty();
		}
		return OptionalInt.of(current.exitValue());
	}

	/**
	 * The classified lines the server writes to its error stream.
	 * @return the diagnostics, empty before the transport is started
	 */
	public Flux<DiagnosticLine> diagnostics() {
		StderrMonitor monitor = this.stderrMonitor;
		return (monitor != null) ? monitor.lines() : Flux.empty();
	}

	@Override
	public void terminate(Duration graceTimeout) {
		Assert.notNull(graceTimeout, "The graceTimeout can not be null");
		if (!this.terminated.compareAndSet(false, true)) {
			return;
		}
		Process current = this.process;
		if (current != null) {
			closeProcessInput();
			if (current.isAlive()) {
				current.destroy();
				if (!awaitExit(current, graceTimeout)) {
					logger.warn("Server process did not exit within {} ms, killing it", graceTimeout.toMillis());
					current.destroyForcibly();
					while (!awaitExit(current, Duration.ofSeconds(5))) {
						logger.warn("Still waiting for server process {} to exit", current.pid());
					}
				}
			}
			logger.info("Server process exited with code {}", current.exitValue());
			StderrMonitor monitor = this.stderrMonitor;
			if (monitor != null) {
				monitor.awaitCompletion(STDERR_FLUSH_TIMEOUT);
				monitor.stop();
			}
		}
		this.inboundScheduler.dispose();
	}

	private void readInbound(InputStream stdout) {
		InputStream in = new BufferedInputStream(stdout);
		try {
			while (readFrame(in)) {
				// keep reading until the stream ends
			}
		}
		catch (LspTransportException e) {
			logger.debug("Server output closed: {}", e.getMessage());
		}
		finally {
			Process current = this.process;
			if (current != null) {
				awaitExit(current, EXIT_SETTLE_TIMEOUT);
			}
			this.inboundFrames.add(InboundFrame.END_OF_STREAM);
		}
	}

	/**
	 * Reads and queues one frame.
	 * @return {@code false} at the end of the stream
	 */
	private boolean readFrame(InputStream in) {
		try {
			Optional<JsonRpcMessage> message = this.codec.read(in);
			if (message.isEmpty()) {
				return false;
			}
			if (logger.isDebugEnabled()) {
				logger.debug("<-- {}", Utils.truncate(String.valueOf(message.get()), LOG_PAYLOAD_LIMIT));
			}
			this.inboundFrames.add(InboundFrame.of(message.get()));
		}
		catch (LspProtocolException e) {
			logger.warn("Malformed frame from server: {}", e.getMessage());
			this.inboundFrames.add(InboundFrame.malformed(e));
		}
		return true;
	}

	@Nullable
	private InboundFrame track(@Nullable InboundFrame frame) {
		if (frame instanceof InboundFrame.EndOfStream) {
			this.endOfStreamSeen = true;
		}
		return frame;
	}

	private void assertStarted() {
		if (!this.started.get()) {
			throw new IllegalStateException("Transport not started");
		}
	}

	private void closeProcessInput() {
		OutputStream input = this.processInput;
		if (input == null) {
			return;
		}
		synchronized (this.writeLock) {
			try {
				input.close();
			}
			catch (IOException e) {
				logger.debug("Failed to close server input: {}", e.getMessage());
			}
		}
	}

	/**
	 * Waits for the process to exit, keeping the interrupt status for the caller.
	 * @return {@code true} if the process has exited
	 */
	private static boolean awaitExit(Process process, Duration timeout) {
		boolean interrupted = false;
		long deadline = System.nanoTime() + timeout.toNanos();
		try {
			while (true) {
				try {
					return process.waitFor(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
				}
				catch (InterruptedException e) {
					interrupted = true;
				}
			}
		}
		finally {
			if (interrupted) {
				Thread.currentThread().interrupt();
			}
		}
	}

	/**
	 * Builder for {@link StdioClientTransport}.
	 */
	public static class Builder {

		private final ServerParameters params;

		private ObjectMapper objectMapper = LspJson.newObjectMapper();

		private Duration startupGracePeriod = DEFAULT_STARTUP_GRACE_PERIOD;

		private DiagnosticClassifier diagnosticClassifier = new DiagnosticClassifier();

		private Consumer<DiagnosticLine> diagnosticsConsumer;

		Builder(ServerParameters params) {
			Assert.notNull(params, "The params can not be null");
			this.params = params;
		}

		public Builder objectMapper(ObjectMapper objectMapper) {
			Assert.notNull(objectMapper, "The objectMapper can not be null");
			this.objectMapper = objectMapper;
			return this;
		}

		/**
		 * How long {@link StdioClientTransport#start()} watches the new process before
		 * considering it started. A process that exits within this period fails the
		 * start.
		 * @param startupGracePeriod the grace period, zero to skip the check
		 * @return this builder
		 */
		public Builder startupGracePeriod(Duration startupGracePeriod) {
			Assert.notNull(startupGracePeriod, "The startupGracePeriod can not be null");
			this.startupGracePeriod = startupGracePeriod;
			return this;
		}

		public Builder diagnosticClassifier(DiagnosticClassifier diagnosticClassifier) {
			Assert.notNull(diagnosticClassifier, "The diagnosticClassifier can not be null");
			this.diagnosticClassifier = diagnosticClassifier;
			return this;
		}

		public Builder diagnosticsConsumer(Consumer<DiagnosticLine> diagnosticsConsumer) {
			this.diagnosticsConsumer = diagnosticsConsumer;
			return this;
		}

		public StdioClientTransport build() {
			return new StdioClientTransport(this.params, this.objectMapper, this.startupGracePeriod,
					this.diagnosticClassifier, this.diagnosticsConsumer);
		}

	}

}
