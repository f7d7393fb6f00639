/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.a2aadapter.adapter;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import io.a2aadapter.backend.BackendRequest;
import io.a2aadapter.backend.BackendResponse;
import io.a2aadapter.backend.SubprocessBackend;
import io.a2aadapter.spec.A2aSchema.Message;
import io.a2aadapter.spec.A2aSchema.MessageSendParams;
import io.a2aadapter.translate.MessageTranslator;
import io.a2aadapter.util.Assert;
import io.a2aadapter.util.Utils;

/**
 * Adapter for command-line agents. Every call runs the configured command once per
 * attempt.
 *
 * <p>
 * Command arguments can reference {@code {message}}, {@code {session_id}},
 * {@code {request_id}} and any configured variable, for example
 * {@code List.of("openclaw", "agent", "--session", "{session_id}", "--thinking", "{thinking}", "-m", "{message}")}.
 * The session id of the inbound call is used when present, otherwise the adapter's own
 * session id, which is generated when none is configured.
 *
 * <p>
 * CLI agents are often slow; with {@link Builder#asyncMode(boolean) async mode} enabled
 * the adapter reports {@link #supportsAsyncTasks()} so that requests are routed through
 * a task manager.
 */
public class CliAgentAdapter extends AbstractAgentAdapter {

	public static final String SESSION_ID_FIELD = "session_id";

	private final MessageTranslator translator;

	private final Map<String, String> variables;

	private final String sessionId;

	private final boolean asyncMode;

	protected CliAgentAdapter(Builder builder) {
		super(builder.backend(), builder);
		this.translator = MessageTranslator.builder().objectMapper(builder.objectMapperOrDefault()).build();
		this.variables = Map.copyOf(builder.variables);
		this.sessionId = builder.sessionId != null ? builder.sessionId : "a2a-" + UUID.randomUUID();
		this.asyncMode = builder.asyncMode;
	}

	@Override
	public BackendRequest toBackend(MessageSendParams params, String correlationId) {
		String text = MessageTranslator.latestUserText(params);
		Map<String, Object> payload = new LinkedHashMap<>(this.variables);
		payload.put(MessageTranslator.DEFAULT_MESSAGE_FIELD, text);
		payload.put(SESSION_ID_FIELD, Utils.hasText(params.sessionId()) ? params.sessionId() : this.sessionId);
		return new BackendRequest(correlationId, text, payload);
	}

	@Override
	public Message fromBackend(BackendResponse response, MessageSendParams params) {
		return this.translator.toMessage(response.body());
	}

	@Override
	public boolean supportsAsyncTasks() {
		return this.asyncMode;
	}

	public String getSessionId() {
		return this.sessionId;
	}

	public static Builder builder(List<String> command) {
		return new Builder(command);
	}

	/**
	 * Builder for {@link CliAgentAdapter}.
	 */
	public static class Builder extends AbstractBuilder<Builder> {

		private final List<String> command;

		private Path workingDirectory;

		private final Map<String, String> environment = new LinkedHashMap<>();

		private final Map<String, String> variables = new LinkedHashMap<>();

		private Set<Integer> clientErrorExitCodes;

		private String sessionId;

		private boolean asyncMode;

		protected Builder(List<String> command) {
			Assert.notEmpty(command, "command must not be empty");
			this.command = List.copyOf(command);
		}

		@Override
		protected Builder self() {
			return this;
		}

		public Builder workingDirectory(Path workingDirectory) {
			this.workingDirectory = workingDirectory;
			return this;
		}

		public Builder environment(Map<String, String> environment) {
			Assert.notNull(environment, "environment must not be null");
			this.environment.putAll(environment);
			return this;
		}

		/**
		 * Adds a value available to command arguments as {@code {name}}.
		 * @param name the variable name
		 * @param value the value
		 * @return this builder
		 */
		public Builder variable(String name, String value) {
			Assert.hasText(name, "variable name must not be empty");
			Assert.notNull(value, "variable value must not be null");
			this.variables.put(name, value);
			return this;
		}

		public Builder clientErrorExitCodes(Set<Integer> clientErrorExitCodes) {
			this.clientErrorExitCodes = clientErrorExitCodes;
			return this;
		}

		public Builder sessionId(String sessionId) {
			this.sessionId = sessionId;
			return this;
		}

		public Builder asyncMode(boolean asyncMode) {
			this.asyncMode = asyncMode;
			return this;
		}

		private SubprocessBackend backend() {
			SubprocessBackend.Builder backend = SubprocessBackend.builder(this.command)
				.workingDirectory(this.workingDirectory)
				.environment(this.environment)
				.objectMapper(objectMapperOrDefault());
			if (this.clientErrorExitCodes != null) {
				backend.clientErrorExitCodes(this.clientErrorExitCodes);
			}
			return backend.build();
		}

		public CliAgentAdapter build() {
			return new CliAgentAdapter(this);
		}

	}

}
