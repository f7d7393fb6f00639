/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.a2aadapter.test;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A local webhook endpoint for tests. Responses come from a queue of scripted
 * {@link StubResponse}s first, then from a fallback handler. Every request is recorded.
 */
public final class StubWebhookServer implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(StubWebhookServer.class);

	public static final String PATH = "/webhook";

	private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

	private final HttpServer server;

	private final ExecutorService executor = Executors.newCachedThreadPool();

	private final Deque<StubResponse> scripted = new ConcurrentLinkedDeque<>();

	private final List<RecordedRequest> requests = new CopyOnWriteArrayList<>();

	private volatile Function<RecordedRequest, StubResponse> fallback;

	private StubWebhookServer(Function<RecordedRequest, StubResponse> fallback) throws IOException {
		this.fallback = fallback;
		this.server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
		this.server.createContext(PATH, this::handle);
		this.server.setExecutor(this.executor);
		this.server.start();
		logger.debug("Stub webhook listening on {}", url());
	}

	/**
	 * Starts a server answering every request that no scripted response covers with the
	 * given handler.
	 * @param fallback computes the response for a request
	 * @return the running server
	 * @throws IOException if the server cannot bind
	 */
	public static StubWebhookServer start(Function<RecordedRequest, StubResponse> fallback) throws IOException {
		return new StubWebhookServer(fallback);
	}

	public static StubWebhookServer start() throws IOException {
		return start(request -> StubResponse.json(200, "{\"output\":\"ok\"}"));
	}

	/**
	 * Queues responses served, in order, before the fallback handler.
	 * @param responses the responses
	 * @return this server
	 */
	public StubWebhookServer enqueue(StubResponse... responses) {
		this.scripted.addAll(List.of(responses));
		return this;
	}

	public StubWebhookServer fallback(Function<RecordedRequest, StubResponse> fallback) {
		this.fallback = fallback;
		return this;
	}

	public String url() {
		InetSocketAddress address = this.server.getAddress();
		return "http://" + address.getHostString() + ":" + address.getPort() + PATH;
	}

	public List<RecordedRequest> requests() {
		return new ArrayList<>(this.requests);
	}

	private void handle(HttpExchange exchange) throws IOException {
		try {
			String body;
			try (InputStream in = exchange.getRequestBody()) {
				body = new String(in.readAllBytes(), StandardCharsets.UTF_8);
			}
			Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
			exchange.getRequestHeaders().forEach((name, values) -> headers.put(name, String.join(",", values)));
			RecordedRequest request = new RecordedRequest(exchange.getRequestMethod(), headers, body);
			this.requests.add(request);

			StubResponse response = this.scripted.poll();
			if (response == null) {
				response = this.fallback.apply(request);
			}
			if (response.delayMillis() > 0) {
				try {
					Thread.sleep(response.delayMillis());
				}
				catch (InterruptedException e) {
					Thread.currentThread().interrupt();
					return;
				}
			}
			byte[] bytes = response.body().getBytes(StandardCharsets.UTF_8);
			exchange.getResponseHeaders().set("Content-Type", response.contentType());
			exchange.sendResponseHeaders(response.status(), bytes.length == 0 ? -1 : bytes.length);
			if (bytes.length > 0) {
				try (OutputStream out = exchange.getResponseBody()) {
					out.write(bytes);
				}
			}
		}
		finally {
			exchange.close();
		}
	}

	@Override
	public void close() {
		this.server.stop(0);
		this.executor.shutdownNow();
	}

	/**
	 * A request received by the stub.
	 *
	 * @param method the HTTP method
	 * @param headers the request headers, case-insensitive
	 * @param body the raw request body
	 */
	public record RecordedRequest(String method, Map<String, String> headers, String body) {

		public String header(String name) {
			return this.headers.get(name);
		}

		/**
		 * Parses the body as a JSON object.
		 * @return the parsed payload
		 */
		public Map<String, Object> json() {
			try {
				return OBJECT_MAPPER.readValue(this.body, new TypeReference<Map<String, Object>>() {
				});
			}
			catch (IOException e) {
				throw new IllegalStateException("Request body is not a JSON object: " + this.body, e);
			}
		}

	}

	/**
	 * A scripted response.
	 *
	 * @param status the HTTP status
	 * @param contentType the content type
	 * @param body the response body
	 * @param delayMillis how long to wait before answering
	 */
	public record StubResponse(int status, String contentType, String body, long delayMillis) {

		public static StubResponse json(int status, String body) {
			return new StubResponse(status, "application/json", body, 0);
		}

		public static StubResponse text(int status, String body) {
			return new StubResponse(status, "text/plain", body, 0);
		}

		public StubResponse delayed(long millis) {
			return new StubResponse(this.status, this.contentType, this.body, millis);
		}

	}

}
