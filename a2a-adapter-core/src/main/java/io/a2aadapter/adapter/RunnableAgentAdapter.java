/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.a2aadapter.adapter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.a2aadapter.backend.AgentRunnable;
import io.a2aadapter.backend.BackendRequest;
import io.a2aadapter.backend.BackendResponse;
import io.a2aadapter.backend.RunnableBackend;
import io.a2aadapter.spec.A2aSchema.Message;
import io.a2aadapter.spec.A2aSchema.MessageSendParams;
import io.a2aadapter.translate.MessageTranslator;
import io.a2aadapter.util.Assert;

/**
 * Adapter for agents running in the same JVM.
 *
 * <p>
 * The runnable receives {@code {<inputKey>: "<latest user text>", "context_id": <session id>}}.
 * A string result is the reply as is; for map-like results the reply is read from the
 * {@code output}, {@code result}, {@code message} or {@code content} field.
 */
public class RunnableAgentAdapter extends AbstractAgentAdapter {

	public static final String DEFAULT_INPUT_KEY = "input";

	public static final String CONTEXT_ID_FIELD = "context_id";

	static final List<String> RESPONSE_KEYS = List.of("output", "result", "message", "content");

	private final String inputKey;

	private final MessageTranslator translator;

	protected RunnableAgentAdapter(Builder builder) {
		super(new RunnableBackend(builder.runnable, builder.name, builder.objectMapperOrDefault()), builder);
		this.inputKey = builder.inputKey;
		this.translator = MessageTranslator.builder()
			.responseKeys(RESPONSE_KEYS)
			.objectMapper(builder.objectMapperOrDefault())
			.build();
	}

	@Override
	public BackendRequest toBackend(MessageSendParams params, String correlationId) {
		String text = MessageTranslator.latestUserText(params);
		Map<String, Object> input = new LinkedHashMap<>();
		input.put(this.inputKey, text);
		input.put(CONTEXT_ID_FIELD, params.sessionId());
		return new BackendRequest(correlationId, text, input);
	}

	@Override
	public Message fromBackend(BackendResponse response, MessageSendParams params) {
		return this.translator.toMessage(response.body());
	}

	public static Builder builder(AgentRunnable runnable) {
		return new Builder(runnable);
	}

	/**
	 * Builder for {@link RunnableAgentAdapter}. In-process calls do not retry by default.
	 */
	public static class Builder extends AbstractBuilder<Builder> {

		private final AgentRunnable runnable;

		private String name;

		private String inputKey = DEFAULT_INPUT_KEY;

		protected Builder(AgentRunnable runnable) {
			Assert.notNull(runnable, "runnable must not be null");
			this.runnable = runnable;
			this.name = runnable.getClass().getSimpleName();
			this.maxRetries = 0;
		}

		@Override
		protected Builder self() {
			return this;
		}

		public Builder name(String name) {
			Assert.hasText(name, "name must not be empty");
			this.name = name;
			return this;
		}

		public Builder inputKey(String inputKey) {
			Assert.hasText(inputKey, "inputKey must not be empty");
			this.inputKey = inputKey;
			return this;
		}

		public RunnableAgentAdapter build() {
			return new RunnableAgentAdapter(this);
		}

	}

}
