/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.a2aadapter.backend;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

class WebhookBackendTests {

	private HttpServer server;

	private String url;

	private final AtomicReference<Integer> responseStatus = new AtomicReference<>(200);

	private final AtomicReference<String> responseBody = new AtomicReference<>("{\"output\":\"hi\"}");

	private final AtomicReference<Headers> lastHeaders = new AtomicReference<>();

	private final AtomicReference<String> lastBody = new AtomicReference<>();

	@BeforeEach
	void startServer() throws IOException {
		this.server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
		this.server.createContext("/webhook", exchange -> {
			this.lastHeaders.set(exchange.getRequestHeaders());
			this.lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
			byte[] body = this.responseBody.get().getBytes(StandardCharsets.UTF_8);
			exchange.sendResponseHeaders(this.responseStatus.get(), body.length == 0 ? -1 : body.length);
			if (body.length > 0) {
				try (OutputStream out = exchange.getResponseBody()) {
					out.write(body);
				}
			}
			exchange.close();
		});
		this.server.start();
		this.url = "http://localhost:" + this.server.getAddress().getPort() + "/webhook";
	}

	@AfterEach
	void stopServer() {
		this.server.stop(0);
	}

	@Test
	void requestIdHeaderCannotBeOverridden() {
		WebhookBackend backend = WebhookBackend.builder(this.url)
			.header("x-request-id", "spoofed")
			.header("Authorization", "Bearer token")
			.header("content-type", "application/vnd.custom+json")
			.build();

		Map<String, String> headers = backend.requestHeaders("req-1");

		assertThat(headers.get("X-Request-Id")).isEqualTo("req-1");
		assertThat(headers.get("Authorization")).isEqualTo("Bearer token");
		assertThat(headers.get("Content-Type")).isEqualTo("application/vnd.custom+json");
		assertThat(headers).hasSize(3);
	}

	@Test
	void postsPayloadAsJson() throws Exception {
		WebhookBackend backend = WebhookBackend.builder(this.url).header("X-Tenant", "acme").build();
		backend.open();

		StepVerifier
			.create(backend.call(new BackendRequest("req-2", "hi", Map.of("message", "hi")), Duration.ofSeconds(5)))
			.assertNext(response -> assertThat(response.body().get("output").asText()).isEqualTo("hi"))
			.verifyComplete();

		assertThat(this.lastHeaders.get().getFirst("X-Request-Id")).isEqualTo("req-2");
		assertThat(this.lastHeaders.get().getFirst("Content-Type")).isEqualTo("application/json");
		assertThat(this.lastHeaders.get().getFirst("X-Tenant")).isEqualTo("acme");
		assertThat(new ObjectMapper().readTree(this.lastBody.get()).get("message").asText()).isEqualTo("hi");
		backend.close();
	}

	@Test
	void nonSuccessStatusRaisesStatusException() {
		this.responseStatus.set(503);
		this.responseBody.set("maintenance");
		WebhookBackend backend = WebhookBackend.builder(this.url).build();
		backend.open();

		StepVerifier.create(backend.call(new BackendRequest("req-3", "", Map.of()), Duration.ofSeconds(5)))
			.expectErrorSatisfies(error -> {
				assertThat(error).isInstanceOf(BackendStatusException.class);
				assertThat(((BackendStatusException) error).getStatusCode()).isEqualTo(503);
				assertThat(((BackendStatusException) error).getBody()).isEqualTo("maintenance");
			})
			.verify();
		backend.close();
	}

	@Test
	void plainTextAndEmptyBodies() {
		WebhookBackend backend = WebhookBackend.builder(this.url).build();
		backend.open();

		this.responseBody.set("just text");
		StepVerifier.create(backend.call(new BackendRequest("req-4", "", Map.of()), Duration.ofSeconds(5)))
			.assertNext(response -> assertThat(response.body().asText()).isEqualTo("just text"))
			.verifyComplete();

		this.responseBody.set("");
		StepVerifier.create(backend.call(new BackendRequest("req-5", "", Map.of()), Duration.ofSeconds(5)))
			.assertNext(response -> assertThat(response.body().isObject()).isTrue())
			.verifyComplete();
		backend.close();
	}

	@Test
	void callsFailWhenNotOpen() {
		WebhookBackend backend = WebhookBackend.builder(this.url).build();

		StepVerifier.create(backend.call(new BackendRequest("req-6", "", Map.of()), Duration.ofSeconds(5)))
			.expectError(IllegalStateException.class)
			.verify();

		backend.open();
		backend.close();
		StepVerifier.create(backend.call(new BackendRequest("req-7", "", Map.of()), Duration.ofSeconds(5)))
			.expectError(IllegalStateException.class)
			.verify();
	}

	@Test
	void nullHeaderValuesAreRejectedWhenConfigured() {
		Map<String, String> headers = new HashMap<>();
		headers.put("Authorization", null);

		assertThatThrownBy(() -> WebhookBackend.builder("http://localhost/hook").header("Authorization", null))
			.isInstanceOf(IllegalArgumentException.class)
			.hasMessage("header value must not be null");
		assertThatThrownBy(() -> WebhookBackend.builder("http://localhost/hook").headers(headers))
			.isInstanceOf(IllegalArgumentException.class);
	}

}
