/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.bkmr.lsp.debug;

import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

import io.bkmr.lsp.client.transport.DiagnosticLine;
import io.bkmr.lsp.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Counts the snippet searches a bkmr server reports on its error stream. The server logs
 * one {@code Executing bookmark search ...} line per search when it runs with
 * {@code RUST_LOG=debug}; without it nothing is counted.
 */
public class ServerQueryCounter implements Consumer<DiagnosticLine> {

	private static final Logger logger = LoggerFactory.getLogger(ServerQueryCounter.class);

	public static final String DEFAULT_QUERY_MARKER = "Executing";

	private final String queryMarker;

	private final AtomicLong queries = new AtomicLong();

	public ServerQueryCounter() {
		this(DEFAULT_QUERY_MARKER);
	}

	public ServerQueryCounter(String queryMarker) {
		Assert.hasText(queryMarker, "The queryMarker can not be empty");
		this.queryMarker = queryMarker;
	}

	@Override
	public void accept(DiagnosticLine line) {
		if (line.highlighted() && line.text().contains(this.queryMarker)) {
			long count = this.queries.incrementAndGet();
			logger.debug("Server query #{}: {}", count, line.text());
		}
	}

	public long getCount() {
		return this.queries.get();
	}

}
