/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.bkmr.lsp.client.transport;

import java.time.Instant;

/**
 * A line the server wrote to its error stream, tagged with the severity it appears to
 * carry. Purely informational.
 *
 * @param severity the classified severity
 * @param text the line as written, without its terminator
 * @param highlighted whether the line contains one of the highlight keywords
 * @param timestamp when the line was read
 */
public record DiagnosticLine(Severity severity, String text, boolean highlighted, Instant timestamp) {

	public enum Severity {

		ERROR, WARN, INFO, DEBUG, TRACE, UNCLASSIFIED

	}

}
