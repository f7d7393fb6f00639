/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.a2aadapter.adapter;

import java.net.http.HttpClient;
import java.util.LinkedHashMap;
import java.util.Map;

import io.a2aadapter.backend.BackendRequest;
import io.a2aadapter.backend.BackendResponse;
import io.a2aadapter.backend.WebhookBackend;
import io.a2aadapter.spec.A2aSchema.Message;
import io.a2aadapter.spec.A2aSchema.MessageSendParams;
import io.a2aadapter.translate.MessageTranslator;
import io.a2aadapter.util.Assert;

/**
 * Adapter for workflow engines that expose an agent as an HTTP webhook, such as n8n.
 *
 * <p>
 * The request body is
 * {@code {"message": "<latest user text>", "metadata": {"session_id": ..., "context": ...}}}
 * plus any configured template fields. The reply is read from the {@code output},
 * {@code result} or {@code message} field of the response, in that order.
 *
 * <pre>{@code
 * WebhookAgentAdapter adapter = WebhookAgentAdapter.builder("http://localhost:5678/webhook/agent")
 * 	.timeout(Duration.ofSeconds(10))
 * 	.header("Authorization", "Bearer " + token)
 * 	.build();
 * }</pre>
 */
public class WebhookAgentAdapter extends AbstractAgentAdapter {

	private final MessageTranslator translator;

	protected WebhookAgentAdapter(Builder builder) {
		super(WebhookBackend.builder(builder.webhookUrl)
			.headers(builder.headers)
			.clientBuilder(builder.clientBuilder)
			.objectMapper(builder.objectMapperOrDefault())
			.build(), builder);
		this.translator = MessageTranslator.builder()
			.messageField(builder.messageField)
			.payloadTemplate(builder.payloadTemplate)
			.objectMapper(builder.objectMapperOrDefault())
			.build();
	}

	@Override
	public BackendRequest toBackend(MessageSendParams params, String correlationId) {
		String text = MessageTranslator.latestUserText(params);
		return new BackendRequest(correlationId, text, this.translator.toPayload(text, params));
	}

	@Override
	public Message fromBackend(BackendResponse response, MessageSendParams params) {
		return this.translator.toMessage(response.body());
	}

	public static Builder builder(String webhookUrl) {
		return new Builder(webhookUrl);
	}

	/**
	 * Builder for {@link WebhookAgentAdapter}.
	 */
	public static class Builder extends AbstractBuilder<Builder> {

		private final String webhookUrl;

		private final Map<String, String> headers = new LinkedHashMap<>();

		private Map<String, Object> payloadTemplate = Map.of();

		private String messageField = MessageTranslator.DEFAULT_MESSAGE_FIELD;

		private HttpClient.Builder clientBuilder = HttpClient.newBuilder();

		protected Builder(String webhookUrl) {
			Assert.hasText(webhookUrl, "webhookUrl must not be empty");
			this.webhookUrl = webhookUrl;
		}

		@Override
		protected Builder self() {
			return this;
		}

		public Builder headers(Map<String, String> headers) {
			Assert.notNull(headers, "headers must not be null");
			headers.forEach(this::header);
			return this;
		}

		public Builder header(String name, String value) {
			Assert.hasText(name, "header name must not be empty");
			Assert.notNull(value, "header value must not be null");
			this.headers.put(name, value);
			return this;
		}

		public Builder payloadTemplate(Map<String, Object> payloadTemplate) {
			Assert.notNull(payloadTemplate, "payloadTemplate must not be null");
			this.payloadTemplate = payloadTemplate;
			return this;
		}

		/**
		 * Sets the name of the payload field carrying the message text.
		 * @param messageField the field name, {@code message} by default
		 * @return this builder
		 */
		public Builder messageField(String messageField) {
			Assert.hasText(messageField, "messageField must not be empty");
			this.messageField = messageField;
			return this;
		}

		public Builder clientBuilder(HttpClient.Builder clientBuilder) {
			Assert.notNull(clientBuilder, "clientBuilder must not be null");
			this.clientBuilder = clientBuilder;
			return this;
		}

		public WebhookAgentAdapter build() {
			return new WebhookAgentAdapter(this);
		}

	}

}
