/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.bkmr.lsp.spec;

/**
 * A pipe to or from the server process failed: the process is gone, a stream was closed
 * or a write could not complete. Fatal to the session.
 */
public class LspTransportException extends LspClientException {

	private static final long serialVersionUID = 1L;

	public LspTransportException(String message) {
		super(message);
	}

	public LspTransportException(String message, Throwable cause) {
		super(message, cause);
	}

}
