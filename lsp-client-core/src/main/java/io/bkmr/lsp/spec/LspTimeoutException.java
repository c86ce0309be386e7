/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.bkmr.lsp.spec;

import java.time.Duration;

/**
 * No response matching a request arrived within its timeout. The session stays usable; a
 * late response to the abandoned request is dropped.
 */
public class LspTimeoutException extends LspClientException {

	private static final long serialVersionUID = 1L;

	private final String method;

	private final long requestId;

	private final Duration timeout;

	public LspTimeoutException(String method, long requestId, Duration timeout) {
		super("No response to '" + method + "' (id " + requestId + ") within " + timeout.toMillis() + " ms");
		this.method = method;
		this.requestId = requestId;
		this.timeout = timeout;
	}

	public String getMethod() {
		return this.method;
	}

	public long getRequestId() {
		return this.requestId;
	}

	public Duration getTimeout() {
		return this.timeout;
	}

}
