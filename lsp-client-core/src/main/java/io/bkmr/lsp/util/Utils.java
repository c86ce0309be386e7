/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.bkmr.lsp.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import reactor.util.annotation.Nullable;

/**
 * Miscellaneous utility methods.
 */
public final class Utils {

	private Utils() {
	}

	/**
	 * Check whether the given {@code String} contains actual <em>text</em>.
	 * <p>
	 * More specifically, this method returns {@code true} if the {@code String} is not
	 * {@code null}, its length is greater than 0, and it contains at least one
	 * non-whitespace character.
	 * @param str the {@code String} to check (may be {@code null})
	 * @return {@code true} if the {@code String} is not {@code null}, its length is
	 * greater than 0, and it does not contain whitespace only
	 * @see Character#isWhitespace
	 */
	public static boolean hasText(@Nullable String str) {
		return (str != null && !str.isBlank());
	}

	/**
	 * Return {@code true} if the supplied Collection is {@code null} or empty. Otherwise,
	 * return {@code false}.
	 * @param collection the Collection to check
	 * @return whether the given Collection is empty
	 */
	public static boolean isEmpty(@Nullable Collection<?> collection) {
		return (collection == null || collection.isEmpty());
	}

	/**
	 * Split a command line into words. Words are separated by whitespace; single or
	 * double quotes group characters, including whitespace, into one word. No other
	 * shell syntax is interpreted.
	 * @param commandLine the command line to split
	 * @return the words, never {@code null}
	 * @throws IllegalArgumentException if a quote is left unterminated
	 */
	public static List<String> splitCommandLine(String commandLine) {
		List<String> words = new ArrayList<>();
		StringBuilder current = new StringBuilder();
		boolean inWord = false;
		char quote = 0;
		for (int i = 0; i < commandLine.length(); i++) {
			char c = commandLine.charAt(i);
			if (quote != 0) {
				if (c == quote) {
					quote = 0;
				}
				else {
					current.append(c);
				}
			}
			else if (c == '"' || c == '\'') {
				quote = c;
				inWord = true;
			}
			else if (Character.isWhitespace(c)) {
				if (inWord) {
					words.add(current.toString());
					current.setLength(0);
					inWord = false;
				}
			}
			else {
				current.append(c);
				inWord = true;
			}
		}
		if (quote != 0) {
			throw new IllegalArgumentException("Unterminated quote in command line: " + commandLine);
		}
		if (inWord) {
			words.add(current.toString());
		}
		return words;
	}

	/**
	 * Shorten a value for log output.
	 * @param value the value, may be {@code null}
	 * @param max the maximum number of characters to keep
	 * @return the value, truncated with a trailing ellipsis when longer than {@code max}
	 */
	public static String truncate(@Nullable String value, int max) {
		if (value == null || value.length() <= max) {
			return value;
		}
		return value.substring(0, max) + "...";
	}

}
