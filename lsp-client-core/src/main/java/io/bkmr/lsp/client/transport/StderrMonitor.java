/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.bkmr.lsp.client.transport;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import io.bkmr.lsp.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.util.annotation.Nullable;

/**
 * Drains a server's error stream on a thread of its own so the server never blocks on a
 * full pipe. Every line is classified, logged at its severity under the
 * {@value #SERVER_LOGGER_NAME} logger, published on {@link #lines()} and handed to the
 * optional consumer.
 *
 * <p>
 * The monitor never raises: read failures end it quietly, and a line that fails to be
 * classified, logged or delivered is skipped. It stops when the stream closes.
 */
public class StderrMonitor {

	private static final Logger logger = LoggerFactory.getLogger(StderrMonitor.class);

	public static final String SERVER_LOGGER_NAME = "io.bkmr.lsp.server.stderr";

	private static final Logger serverLogger = LoggerFactory.getLogger(SERVER_LOGGER_NAME);

	/** Lines kept for subscribers that arrive late. */
	private static final int REPLAY_LIMIT = 256;

	private final InputStream stderr;

	private final DiagnosticClassifier classifier;

	@Nullable
	private final Consumer<DiagnosticLine> consumer;

	private final Sinks.Many<DiagnosticLine> sink = Sinks.many().replay().limit(REPLAY_LIMIT);

	private final Scheduler scheduler;

	private final AtomicBoolean started = new AtomicBoolean(false);

	private final CountDownLatch finished = new CountDownLatch(1);

	public StderrMonitor(InputStream stderr, DiagnosticClassifier classifier,
			@Nullable Consumer<DiagnosticLine> consumer) {
		Assert.notNull(stderr, "The stderr stream can not be null");
		Assert.notNull(classifier, "The classifier can not be null");
		this.stderr = stderr;
		this.classifier = classifier;
		this.consumer = consumer;
		this.scheduler = Schedulers.newSingle("lsp-stderr", true);
	}

	public void start() {
		if (!this.started.compareAndSet(false, true)) {
			return;
		}
		this.scheduler.schedule(this::drain);
	}

	/**
	 * The classified lines. Late subscribers first receive the most recent lines, then
	 * the live ones; the flux completes when the stream closes.
	 * @return the line stream
	 */
	public Flux<DiagnosticLine> lines() {
		return this.sink.asFlux();
	}

	public boolean isRunning() {
		return this.started.get() && this.finished.getCount() > 0;
	}

	/**
	 * Waits for the monitor to reach the end of the stream.
	 * @param timeout how long to wait
	 * @return {@code true} if the monitor has finished
	 */
	public boolean awaitCompletion(Duration timeout) {
		try {
			return this.finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			return false;
		}
	}

	/**
	 * Releases the monitor's thread. A read in progress ends once the stream closes.
	 */
	public void stop() {
		this.scheduler.dispose();
	}

	private void drain() {
		try (BufferedReader reader = new BufferedReader(new InputStreamReader(this.stderr, StandardCharsets.UTF_8))) {
			String line;
			while ((line = reader.readLine()) != null) {
				try {
					publish(this.classifier.classify(line));
				}
				catch (RuntimeException e) {
					logger.warn("Failed to handle server error line, skipping it", e);
				}
			}
		}
		catch (IOException e) {
			logger.debug("Server error stream closed: {}", e.getMessage());
		}
		finally {
			this.sink.tryEmitComplete();
			this.finished.countDown();
		}
	}

	private void publish(DiagnosticLine line) {
		log(line);
		this.sink.tryEmitNext(line);
		if (this.consumer != null) {
			try {
				this.consumer.accept(line);
			}
			catch (RuntimeException e) {
				logger.debug("Diagnostics consumer failed, ignoring", e);
			}
		}
	}

	private static void log(DiagnosticLine line) {
		String text = DiagnosticClassifier.stripAnsi(line.text());
		switch (line.severity()) {
			case ERROR -> serverLogger.error("{}", text);
			case WARN -> serverLogger.warn("{}", text);
			case INFO -> serverLogger.info("{}", text);
			case TRACE -> serverLogger.trace("{}", text);
			default -> serverLogger.debug("{}", text);
		}
	}

}
