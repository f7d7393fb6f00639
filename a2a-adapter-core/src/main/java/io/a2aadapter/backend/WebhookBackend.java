/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.a2aadapter.backend;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandlers;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicReference;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.a2aadapter.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Posts the request payload as JSON to a webhook URL, as exposed by workflow engines
 * such as n8n.
 *
 * <p>
 * One {@link HttpClient} is built per open scope and shared by all concurrent calls.
 * Every request carries {@code Content-Type: application/json} and an
 * {@code X-Request-Id} header holding the correlation id. Configured headers are merged
 * last and may replace any header except {@code X-Request-Id}.
 */
public final class WebhookBackend implements Backend {

	private static final Logger logger = LoggerFactory.getLogger(WebhookBackend.class);

	public static final String REQUEST_ID_HEADER = "X-Request-Id";

	private static final String CONTENT_TYPE = "Content-Type";

	private static final String APPLICATION_JSON = "application/json";

	private final URI webhookUri;

	private final Map<String, String> headers;

	private final HttpClient.Builder clientBuilder;

	private final ObjectMapper objectMapper;

	private final AtomicReference<HttpClient> httpClient = new AtomicReference<>();

	private WebhookBackend(Builder builder) {
		this.webhookUri = URI.create(builder.webhookUrl);
		this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
		this.clientBuilder = builder.clientBuilder;
		this.objectMapper = builder.objectMapper;
	}

	@Override
	public void open() {
		if (this.httpClient.compareAndSet(null, this.clientBuilder.build())) {
			logger.debug("Opened HTTP client for {}", this.webhookUri);
		}
	}

	@Override
	public Mono<BackendResponse> call(BackendRequest request, Duration timeout) {
		return Mono.defer(() -> {
			HttpClient client = this.httpClient.get();
			if (client == null) {
				return Mono.error(new IllegalStateException("Webhook client for " + this.webhookUri + " is not open"));
			}
			String body;
			try {
				body = this.objectMapper.writeValueAsString(request.payload());
			}
			catch (JsonProcessingException e) {
				return Mono.error(new IllegalArgumentException("Failed to serialize webhook payload", e));
			}
			HttpRequest.Builder requestBuilder = HttpRequest.newBuilder(this.webhookUri)
				.timeout(timeout)
				.POST(BodyPublishers.ofString(body, StandardCharsets.UTF_8));
			requestHeaders(request.correlationId()).forEach(requestBuilder::setHeader);
			HttpRequest httpRequest = requestBuilder.build();

			return Mono.fromFuture(() -> client.sendAsync(httpRequest, BodyHandlers.ofString(StandardCharsets.UTF_8)))
				.map(response -> toBackendResponse(request, response));
		});
	}

	Map<String, String> requestHeaders(String correlationId) {
		Map<String, String> merged = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
		merged.put(CONTENT_TYPE, APPLICATION_JSON);
		merged.put(REQUEST_ID_HEADER, correlationId);
		this.headers.forEach((name, value) -> {
			if (REQUEST_ID_HEADER.equalsIgnoreCase(name)) {
				logger.debug("Ignoring configured {} header, the correlation id is used instead", name);
				return;
			}
			merged.put(name, value);
		});
		return merged;
	}

	private BackendResponse toBackendResponse(BackendRequest request, HttpResponse<String> response) {
		int status = response.statusCode();
		if (status / 100 == 2) {
			logger.trace("Webhook {} answered {} for request {}", this.webhookUri, status, request.correlationId());
			return BackendResponse.parse(response.body(), this.objectMapper);
		}
		throw new BackendStatusException(status, response.body(),
				"Webhook " + this.webhookUri + " returned status " + status);
	}

	@Override
	public void close() {
		if (this.httpClient.getAndSet(null) != null) {
			logger.debug("Released HTTP client for {}", this.webhookUri);
		}
	}

	@Override
	public String describe() {
		return "webhook " + this.webhookUri;
	}

	public static Builder builder(String webhookUrl) {
		return new Builder(webhookUrl);
	}

	/**
	 * Builder for {@link WebhookBackend}.
	 */
	public static class Builder {

		private final String webhookUrl;

		private final Map<String, String> headers = new LinkedHashMap<>();

		private HttpClient.Builder clientBuilder = HttpClient.newBuilder();

		private ObjectMapper objectMapper;

		private Builder(String webhookUrl) {
			Assert.hasText(webhookUrl, "webhookUrl must not be empty");
			this.webhookUrl = webhookUrl;
		}

		/**
		 * Adds headers sent with every request.
		 * @param headers the headers to add
		 * @return this builder
		 */
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

		/**
		 * Configures the builder used to create the HTTP client when the backend is
		 * opened.
		 * @param clientBuilder the client builder
		 * @return this builder
		 */
		public Builder clientBuilder(HttpClient.Builder clientBuilder) {
			Assert.notNull(clientBuilder, "clientBuilder must not be null");
			this.clientBuilder = clientBuilder;
			return this;
		}

		public Builder objectMapper(ObjectMapper objectMapper) {
			Assert.notNull(objectMapper, "objectMapper must not be null");
			this.objectMapper = objectMapper;
			return this;
		}

		public WebhookBackend build() {
			if (this.objectMapper == null) {
				this.objectMapper = new ObjectMapper();
			}
			return new WebhookBackend(this);
		}

	}

}
