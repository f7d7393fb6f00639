/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.a2aadapter.backend;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.a2aadapter.util.Assert;
import io.a2aadapter.util.Utils;

/**
 * A successful backend response.
 *
 * @param body the response body; never {@code null}
 */
public record BackendResponse(JsonNode body) {

	public BackendResponse {
		Assert.notNull(body, "body must not be null");
	}

	/**
	 * Creates a response from a raw body. JSON bodies are parsed, other text is kept
	 * verbatim as a text node and a blank body becomes an empty object.
	 * @param rawBody the raw body, may be {@code null}
	 * @param objectMapper the mapper used to parse JSON
	 * @return the response
	 */
	public static BackendResponse parse(String rawBody, ObjectMapper objectMapper) {
		if (!Utils.hasText(rawBody)) {
			return new BackendResponse(JsonNodeFactory.instance.objectNode());
		}
		try {
			// "42 apples" is text, not the number 42
			return new BackendResponse(
					objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS).readTree(rawBody));
		}
		catch (JsonProcessingException e) {
			return new BackendResponse(TextNode.valueOf(rawBody));
		}
	}

	/**
	 * Creates a response from an in-process value.
	 * @param value a String, a {@link JsonNode} or any value Jackson can convert
	 * @param objectMapper the mapper used to convert the value
	 * @return the response
	 */
	public static BackendResponse fromValue(Object value, ObjectMapper objectMapper) {
		if (value == null) {
			return new BackendResponse(NullNode.getInstance());
		}
		if (value instanceof JsonNode node) {
			return new BackendResponse(node);
		}
		if (value instanceof CharSequence text) {
			return new BackendResponse(TextNode.valueOf(text.toString()));
		}
		return new BackendResponse(objectMapper.valueToTree(value));
	}

}
