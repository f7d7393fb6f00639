/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.a2aadapter.backend;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import io.a2aadapter.util.Assert;

/**
 * A backend-native request produced from one protocol message.
 *
 * <p>
 * The correlation id is generated once per logical call and reused by every retry
 * attempt of that call, so backends that support idempotency keys can deduplicate.
 *
 * @param correlationId the correlation id of the logical call
 * @param text the plain-text rendering of the triggering message
 * @param payload backend-specific fields, in insertion order
 */
public record BackendRequest(String correlationId, String text, Map<String, Object> payload) {

	public BackendRequest {
		Assert.hasText(correlationId, "correlationId must not be empty");
		Assert.notNull(text, "text must not be null");
		// values may legitimately be null (e.g. an absent session id)
		payload = payload != null ? Collections.unmodifiableMap(new LinkedHashMap<>(payload)) : Map.of();
	}

}
