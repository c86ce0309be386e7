/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.bkmr.lsp.debug;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import reactor.util.annotation.Nullable;

/**
 * What a {@link CompletionProbe} observed.
 *
 * @param advertisedCommands commands listed by the server's
 * {@code executeCommandProvider}
 * @param completions one sample per probed position, in probing order
 * @param shutdownAcknowledged whether the server answered {@code shutdown}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProbeReport( // @formatter:off
	@JsonProperty("advertisedCommands") List<String> advertisedCommands,
	@JsonProperty("completions") List<CompletionSample> completions,
	@JsonProperty("shutdownAcknowledged") boolean shutdownAcknowledged) { // @formatter:on

	public ProbeReport {
		advertisedCommands = List.copyOf(advertisedCommands);
		completions = List.copyOf(completions);
	}

	/**
	 * The completion answer at one position.
	 *
	 * @param line zero-based line
	 * @param character zero-based character offset
	 * @param itemCount number of items returned, {@code 0} when the request failed
	 * @param error the server's error message if the request was answered with an error
	 */
	@JsonInclude(JsonInclude.Include.NON_NULL)
	public record CompletionSample( // @formatter:off
		@JsonProperty("line") int line,
		@JsonProperty("character") int character,
		@JsonProperty("itemCount") int itemCount,
		@JsonProperty("error") @Nullable String error) { // @formatter:on

		public boolean failed() {
			return this.error != null;
		}

	}

}
