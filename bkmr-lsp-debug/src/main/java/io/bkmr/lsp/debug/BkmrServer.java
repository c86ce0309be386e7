/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.bkmr.lsp.debug;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

import io.bkmr.lsp.client.transport.ServerParameters;
import io.bkmr.lsp.util.Assert;
import io.bkmr.lsp.util.Utils;
import reactor.util.annotation.Nullable;

/**
 * Launch configuration for {@code bkmr lsp}.
 *
 * <p>
 * The database and the log verbosity are handed to the server through its environment:
 * {@value #DB_URL_ENV} and {@value #LOG_LEVEL_ENV}. Unless one of them sets it,
 * {@value #LOG_LEVEL_ENV} falls back to {@value #DEFAULT_LOG_LEVEL} so that the server
 * reports its activity on stderr.
 *
 * <pre>{@code
 * ServerParameters params = BkmrServer.builder()
 *     .database("/tmp/bkmr-test.db")
 *     .logLevel("debug")
 *     .build();
 * }</pre>
 */
public final class BkmrServer {

	public static final String DEFAULT_BINARY = "bkmr";

	public static final String DB_URL_ENV = "BKMR_DB_URL";

	public static final String LOG_LEVEL_ENV = "RUST_LOG";

	public static final String DEFAULT_LOG_LEVEL = "info";

	public static final String NO_INTERPOLATION_FLAG = "--no-interpolation";

	private BkmrServer() {
	}

	public static Builder builder() {
		return new Builder(System::getenv);
	}

	/**
	 * Builder whose view of the parent environment is replaced, for tests.
	 */
	static Builder builder(UnaryOperator<String> parentEnvironment) {
		return new Builder(parentEnvironment);
	}

	public static final class Builder {

		private final UnaryOperator<String> parentEnvironment;

		private String binary = DEFAULT_BINARY;

		@Nullable
		private String database;

		@Nullable
		private String logLevel;

		private boolean noInterpolation;

		private final List<String> extraArgs = new ArrayList<>();

		private final Map<String, String> env = new LinkedHashMap<>();

		private Builder(UnaryOperator<String> parentEnvironment) {
			this.parentEnvironment = parentEnvironment;
		}

		public Builder binary(String binary) {
			Assert.hasText(binary, "The binary can not be empty");
			this.binary = binary;
			return this;
		}

		/**
		 * Database the server opens, passed as {@value #DB_URL_ENV}.
		 */
		public Builder database(@Nullable String database) {
			this.database = database;
			return this;
		}

		/**
		 * Server log filter, passed as {@value #LOG_LEVEL_ENV}.
		 */
		public Builder logLevel(@Nullable String logLevel) {
			this.logLevel = logLevel;
			return this;
		}

		public Builder noInterpolation(boolean noInterpolation) {
			this.noInterpolation = noInterpolation;
			return this;
		}

		public Builder extraArgs(String... args) {
			Assert.notNull(args, "The args can not be null");
			this.extraArgs.addAll(List.of(args));
			return this;
		}

		public Builder env(String key, String value) {
			Assert.hasText(key, "The key can not be empty");
			Assert.notNull(value, "The value can not be null");
			this.env.put(key, value);
			return this;
		}

		public ServerParameters build() {
			ServerParameters.Builder params = ServerParameters.builder(this.binary).arg("lsp");
			if (this.noInterpolation) {
				params.arg(NO_INTERPOLATION_FLAG);
			}
			params.args(this.extraArgs).env(this.env);

			if (Utils.hasText(this.database)) {
				params.addEnvVar(DB_URL_ENV, this.database);
			}
			if (Utils.hasText(this.logLevel)) {
				params.addEnvVar(LOG_LEVEL_ENV, this.logLevel);
			}
			else if (!this.env.containsKey(LOG_LEVEL_ENV) && this.parentEnvironment.apply(LOG_LEVEL_ENV) == null) {
				params.addEnvVar(LOG_LEVEL_ENV, DEFAULT_LOG_LEVEL);
			}
			return params.build();
		}

	}

}
