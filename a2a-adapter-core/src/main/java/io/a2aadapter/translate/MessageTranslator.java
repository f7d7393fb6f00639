/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.a2aadapter.translate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.a2aadapter.spec.A2aSchema.Message;
import io.a2aadapter.spec.A2aSchema.MessageSendParams;
import io.a2aadapter.spec.A2aSchema.Part;
import io.a2aadapter.spec.A2aSchema.Role;
import io.a2aadapter.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts protocol messages to backend payloads and backend responses back to
 * assistant messages.
 *
 * <p>
 * Outbound, the text of the most recent user message is placed under the configured
 * message field next to a {@code metadata} object holding the session id and context.
 * Inbound, the first of the configured response keys present in a JSON object body
 * provides the reply text; bodies without any of those keys are rendered as
 * pretty-printed JSON.
 */
public class MessageTranslator {

	private static final Logger logger = LoggerFactory.getLogger(MessageTranslator.class);

	public static final String DEFAULT_MESSAGE_FIELD = "message";

	public static final List<String> DEFAULT_RESPONSE_KEYS = List.of("output", "result", "message");

	public static final String METADATA_FIELD = "metadata";

	private final String messageField;

	private final Map<String, Object> payloadTemplate;

	private final List<String> responseKeys;

	private final ObjectMapper objectMapper;

	protected MessageTranslator(Builder builder) {
		this.messageField = builder.messageField;
		this.payloadTemplate = Collections.unmodifiableMap(new LinkedHashMap<>(builder.payloadTemplate));
		this.responseKeys = List.copyOf(builder.responseKeys);
		this.objectMapper = builder.objectMapper;
	}

	/**
	 * Extracts the text of the most recent user message. Text parts are trimmed and the
	 * non-empty ones joined by single spaces; parts without text are skipped.
	 * @param params the inbound parameters
	 * @return the text, or an empty string if there is no user message
	 */
	public static String latestUserText(MessageSendParams params) {
		List<Message> messages = params.messages();
		for (int i = messages.size() - 1; i >= 0; i--) {
			Message message = messages.get(i);
			if (message.role() != Role.USER) {
				continue;
			}
			List<String> texts = new ArrayList<>();
			for (Part part : message.parts()) {
				String text = part.text();
				if (text != null && !text.isBlank()) {
					texts.add(text.strip());
				}
			}
			return String.join(" ", texts);
		}
		return "";
	}

	/**
	 * Builds the backend payload. Template fields are copied first so they can never
	 * replace the message field or the metadata.
	 * @param text the extracted message text
	 * @param params the inbound parameters
	 * @return a new mutable payload map
	 */
	public Map<String, Object> toPayload(String text, MessageSendParams params) {
		Map<String, Object> metadata = new LinkedHashMap<>();
		metadata.put("session_id", params.sessionId());
		metadata.put("context", params.context());

		Map<String, Object> payload = new LinkedHashMap<>(this.payloadTemplate);
		payload.put(this.messageField, text);
		payload.put(METADATA_FIELD, metadata);
		return payload;
	}

	/**
	 * Extracts the reply text from a response body. Never throws.
	 * @param body the response body
	 * @return the reply text
	 */
	public String responseText(JsonNode body) {
		if (body == null || body.isMissingNode()) {
			return "";
		}
		if (body.isObject()) {
			for (String key : this.responseKeys) {
				JsonNode value = body.get(key);
				if (value != null) {
					return value.isTextual() ? value.asText() : write(value, false);
				}
			}
			return write(body, true);
		}
		if (body.isTextual()) {
			return body.asText();
		}
		return write(body, true);
	}

	/**
	 * Wraps the reply text of a response body in an assistant message with a single text
	 * part.
	 * @param body the response body
	 * @return the assistant message
	 */
	public Message toMessage(JsonNode body) {
		return Message.text(Role.ASSISTANT, responseText(body));
	}

	private String write(JsonNode node, boolean pretty) {
		try {
			return pretty ? this.objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(node)
					: this.objectMapper.writeValueAsString(node);
		}
		catch (JsonProcessingException e) {
			logger.debug("Failed to render response body as JSON, falling back to toString", e);
			return node.toString();
		}
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Builder for {@link MessageTranslator}.
	 */
	public static class Builder {

		private String messageField = DEFAULT_MESSAGE_FIELD;

		private Map<String, Object> payloadTemplate = Map.of();

		private List<String> responseKeys = DEFAULT_RESPONSE_KEYS;

		private ObjectMapper objectMapper;

		private Builder() {
		}

		public Builder messageField(String messageField) {
			Assert.hasText(messageField, "messageField must not be empty");
			Assert.isTrue(!METADATA_FIELD.equals(messageField), "messageField must not be '" + METADATA_FIELD + "'");
			this.messageField = messageField;
			return this;
		}

		/**
		 * Sets static fields included in every payload.
		 * @param payloadTemplate the template fields
		 * @return this builder
		 */
		public Builder payloadTemplate(Map<String, Object> payloadTemplate) {
			Assert.notNull(payloadTemplate, "payloadTemplate must not be null");
			this.payloadTemplate = payloadTemplate;
			return this;
		}

		/**
		 * Sets the keys probed, in order, for the reply text of a JSON object body.
		 * @param responseKeys the keys
		 * @return this builder
		 */
		public Builder responseKeys(List<String> responseKeys) {
			Assert.notEmpty(responseKeys, "responseKeys must not be empty");
			this.responseKeys = responseKeys;
			return this;
		}

		public Builder objectMapper(ObjectMapper objectMapper) {
			Assert.notNull(objectMapper, "objectMapper must not be null");
			this.objectMapper = objectMapper;
			return this;
		}

		public MessageTranslator build() {
			if (this.objectMapper == null) {
				this.objectMapper = new ObjectMapper();
			}
			return new MessageTranslator(this);
		}

	}

}
