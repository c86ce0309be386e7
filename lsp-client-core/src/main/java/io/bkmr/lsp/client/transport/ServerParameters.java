/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.bkmr.lsp.client.transport;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import io.bkmr.lsp.util.Assert;
import io.bkmr.lsp.util.Utils;

/**
 * How to launch a language server: the executable, its arguments and the environment
 * variables laid over the parent environment. The overlay is handed to the process as-is;
 * the client never interprets it.
 */
public final class ServerParameters {

	private final String command;

	private final List<String> args;

	private final Map<String, String> env;

	private final boolean inheritEnvironment;

	private ServerParameters(String command, List<String> args, Map<String, String> env, boolean inheritEnvironment) {
		Assert.hasText(command, "The command can not be empty");
		this.command = command;
		this.args = Collections.unmodifiableList(new ArrayList<>(args));
		this.env = Collections.unmodifiableMap(new HashMap<>(env));
		this.inheritEnvironment = inheritEnvironment;
	}

	public static Builder builder(String command) {
		return new Builder(command);
	}

	/**
	 * Parses a single command line such as {@code bkmr lsp --no-interpolation}. Words are
	 * separated by whitespace; single or double quotes group words.
	 * @param commandLine the command line
	 * @return a builder preset with the command and its arguments
	 */
	public static Builder fromCommandLine(String commandLine) {
		List<String> words = Utils.splitCommandLine(commandLine);
		Assert.notEmpty(words, "The command line can not be empty");
		return new Builder(words.get(0)).args(words.subList(1, words.size()));
	}

	public String getCommand() {
		return this.command;
	}

	public List<String> getArgs() {
		return this.args;
	}

	public Map<String, String> getEnv() {
		return this.env;
	}

	public boolean isInheritEnvironment() {
		return this.inheritEnvironment;
	}

	/**
	 * The full command: the executable followed by its arguments.
	 * @return the command words
	 */
	public List<String> getCommandLine() {
		List<String> commandLine = new ArrayList<>(this.args.size() + 1);
		commandLine.add(this.command);
		commandLine.addAll(this.args);
		return commandLine;
	}

	@Override
	public String toString() {
		return "ServerParameters[command=" + String.join(" ", getCommandLine()) + ", env=" + this.env.keySet() + "]";
	}

	public static class Builder {

		private final String command;

		private final List<String> args = new ArrayList<>();

		private final Map<String, String> env = new HashMap<>();

		private boolean inheritEnvironment = true;

		public Builder(String command) {
			Assert.hasText(command, "The command can not be empty");
			this.command = command;
		}

		public Builder args(String... args) {
			Assert.notNull(args, "The args can not be null");
			return args(Arrays.asList(args));
		}

		public Builder args(List<String> args) {
			Assert.notNull(args, "The args can not be null");
			this.args.addAll(args);
			return this;
		}

		public Builder arg(String arg) {
			Assert.notNull(arg, "The arg can not be null");
			this.args.add(arg);
			return this;
		}

		public Builder env(Map<String, String> env) {
			Assert.notNull(env, "The env can not be null");
			this.env.putAll(env);
			return this;
		}

		public Builder addEnvVar(String key, String value) {
			Assert.hasText(key, "The key can not be empty");
			Assert.notNull(value, "The value can not be null");
			this.env.put(key, value);
			return this;
		}

		/**
		 * Whether the server starts from a copy of this process's environment. When
		 * {@code false} it sees only the overlay.
		 * @param inheritEnvironment defaults to {@code true}
		 * @return this builder
		 */
		public Builder inheritEnvironment(boolean inheritEnvironment) {
			this.inheritEnvironment = inheritEnvironment;
			return this;
		}

		public ServerParameters build() {
			return new ServerParameters(this.command, this.args, this.env, this.inheritEnvironment);
		}

	}

}
