/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.bkmr.lsp.debug;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import reactor.util.annotation.Nullable;

/**
 * What a {@link FilteringCheck} observed while a document was typed.
 *
 * @param steps one entry per document state, in typing order
 * @param serverQueries searches the server reported over the whole session
 * @param verdict where the completions were filtered
 * @param shutdownAcknowledged whether the server answered {@code shutdown}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FilteringReport( // @formatter:off
	@JsonProperty("steps") List<TypingStep> steps,
	@JsonProperty("serverQueries") long serverQueries,
	@JsonProperty("verdict") Verdict verdict,
	@JsonProperty("shutdownAcknowledged") boolean shutdownAcknowledged) { // @formatter:on

	public FilteringReport {
		steps = List.copyOf(steps);
	}

	public enum Verdict {

		/** The server answers every keystroke with freshly filtered results. */
		SERVER_SIDE,

		/** The same results come back for every keystroke; the client must filter. */
		CLIENT_SIDE,

		/** No step produced completions to compare. */
		INCONCLUSIVE;

		/**
		 * Judges a typing session. Filtering is server-side when the item counts differ
		 * between steps or every keystroke after the first triggered a server query.
		 * Constant non-zero counts without per-keystroke queries mean client-side
		 * filtering. Failed steps are ignored.
		 * @param steps the observed steps
		 * @return the verdict
		 */
		public static Verdict of(List<TypingStep> steps) {
			List<TypingStep> answered = steps.stream().filter(step -> !step.failed()).toList();
			if (answered.isEmpty()) {
				return INCONCLUSIVE;
			}
			long distinctCounts = answered.stream().mapToInt(TypingStep::itemCount).distinct().count();
			boolean queriedPerKeystroke = answered.size() > 1
					&& answered.stream().skip(1).allMatch(step -> step.serverQueries() > 0);
			if (distinctCounts > 1 || queriedPerKeystroke) {
				return SERVER_SIDE;
			}
			if (answered.stream().allMatch(step -> step.itemCount() > 0)) {
				return CLIENT_SIDE;
			}
			return INCONCLUSIVE;
		}

	}

	/**
	 * The completion answer for one document state, requested at the end of the text.
	 *
	 * @param text the whole document text at this step
	 * @param line zero-based line of the request
	 * @param character zero-based character offset of the request
	 * @param itemCount number of items returned, {@code 0} when the request failed
	 * @param incomplete the {@code isIncomplete} flag of a completion list, {@code null}
	 * for a bare item array
	 * @param serverQueries searches the server reported since the previous step
	 * @param error the server's error message if the request was answered with an error
	 */
	@JsonInclude(JsonInclude.Include.NON_NULL)
	public record TypingStep( // @formatter:off
		@JsonProperty("text") String text,
		@JsonProperty("line") int line,
		@JsonProperty("character") int character,
		@JsonProperty("itemCount") int itemCount,
		@JsonProperty("isIncomplete") @Nullable Boolean incomplete,
		@JsonProperty("serverQueries") long serverQueries,
		@JsonProperty("error") @Nullable String error) { // @formatter:on

		public boolean failed() {
			return this.error != null;
		}

	}

}
