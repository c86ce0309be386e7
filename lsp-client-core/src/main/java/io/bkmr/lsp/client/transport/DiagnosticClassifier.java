/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.bkmr.lsp.client.transport;

import java.time.Instant;
import java.util.List;
import java.util.regex.Pattern;

import io.bkmr.lsp.client.transport.DiagnosticLine.Severity;
import io.bkmr.lsp.util.Assert;

/**
 * Tags error-stream lines by the level markers that logging frameworks print, such as
 * {@code ERROR} or {@code WARN}. The first marker found wins, in order of decreasing
 * severity. ANSI colour sequences are ignored when matching.
 */
public class DiagnosticClassifier {

	public static final List<String> DEFAULT_HIGHLIGHT_KEYWORDS = List.of("Successfully", "Executing",
			"snippets found");

	private static final Pattern ANSI_ESCAPE = Pattern.compile("\u001B\\[[0-9;?]*[ -/]*[@-~]");

	private static final Severity[] RULES = { Severity.ERROR, Severity.WARN, Severity.INFO, Severity.DEBUG,
			Severity.TRACE };

	private final List<String> highlightKeywords;

	public DiagnosticClassifier() {
		this(DEFAULT_HIGHLIGHT_KEYWORDS);
	}

	public DiagnosticClassifier(List<String> highlightKeywords) {
		Assert.notNull(highlightKeywords, "The highlightKeywords can not be null");
		this.highlightKeywords = List.copyOf(highlightKeywords);
	}

	public DiagnosticLine classify(String line) {
		String plain = stripAnsi(line);
		return new DiagnosticLine(severityOf(plain), line, isHighlighted(plain), Instant.now());
	}

	static String stripAnsi(String line) {
		return ANSI_ESCAPE.matcher(line).replaceAll("");
	}

	private static Severity severityOf(String plain) {
		for (Severity severity : RULES) {
			if (plain.contains(severity.name())) {
				return severity;
			}
		}
		return Severity.UNCLASSIFIED;
	}

	private boolean isHighlighted(String plain) {
		for (String keyword : this.highlightKeywords) {
			if (plain.contains(keyword)) {
				return true;
			}
		}
		return false;
	}

}
