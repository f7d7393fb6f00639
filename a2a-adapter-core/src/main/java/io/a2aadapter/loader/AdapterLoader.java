/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.a2aadapter.loader;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.a2aadapter.adapter.AbstractAgentAdapter;
import io.a2aadapter.adapter.AgentAdapter;
import io.a2aadapter.adapter.CliAgentAdapter;
import io.a2aadapter.adapter.RunnableAgentAdapter;
import io.a2aadapter.adapter.WebhookAgentAdapter;
import io.a2aadapter.backend.AgentRunnable;
import io.a2aadapter.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds adapters from plain configuration maps, such as a parsed JSON document.
 *
 * <p>
 * The {@code adapter} key selects the adapter:
 * <ul>
 * <li>{@code webhook} or {@code n8n}: requires {@code webhook_url}; optional
 * {@code headers}, {@code payload_template} and {@code message_field}</li>
 * <li>{@code cli}: requires {@code command} (a list of arguments or a single
 * whitespace-separated string); optional {@code working_directory}, {@code env_vars},
 * {@code session_id}, {@code async_mode}, {@code client_error_exit_codes} and
 * {@code variables}</li>
 * <li>{@code openclaw}: a CLI adapter whose command is derived from
 * {@code openclaw_path}, {@code thinking} and {@code agent_id} unless {@code command}
 * is given</li>
 * <li>{@code runnable} or {@code callable}: requires {@code runnable}, an
 * {@link AgentRunnable} instance; optional {@code input_key}</li>
 * </ul>
 * All adapters accept {@code timeout} and {@code backoff} in seconds and
 * {@code max_retries}.
 */
public final class AdapterLoader {

	private static final Logger logger = LoggerFactory.getLogger(AdapterLoader.class);

	public static final String ADAPTER_KEY = "adapter";

	private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

	private AdapterLoader() {
	}

	/**
	 * Reads a JSON configuration object and builds the adapter it describes.
	 * @param json the configuration document
	 * @return the adapter
	 * @throws IOException if the document cannot be read or is not a JSON object
	 */
	public static AgentAdapter load(InputStream json) throws IOException {
		Assert.notNull(json, "json must not be null");
		Map<String, Object> config = OBJECT_MAPPER.readValue(json, new TypeReference<Map<String, Object>>() {
		});
		if (config == null) {
			throw new IllegalArgumentException("Adapter configuration must be a JSON object");
		}
		return load(config);
	}

	/**
	 * Builds the adapter described by a configuration map.
	 * @param config the configuration
	 * @return the adapter
	 * @throws IllegalArgumentException if the adapter type is unknown or a value is
	 * missing or malformed
	 */
	public static AgentAdapter load(Map<String, Object> config) {
		Assert.notNull(config, "config must not be null");
		String type = requireString(config, ADAPTER_KEY).toLowerCase(Locale.ROOT);
		logger.debug("Loading {} adapter", type);
		switch (type) {
			case "webhook":
			case "n8n":
				return webhook(config);
			case "cli":
				return cli(config, requireCommand(config));
			case "openclaw":
				return cli(config, config.containsKey("command") ? requireCommand(config) : openclawCommand(config));
			case "runnable":
			case "callable":
				return runnable(config);
			default:
				throw new IllegalArgumentException("Unknown adapter type: " + type);
		}
	}

	private static WebhookAgentAdapter webhook(Map<String, Object> config) {
		WebhookAgentAdapter.Builder builder = WebhookAgentAdapter.builder(requireString(config, "webhook_url"));
		dispatchSettings(config, builder);
		Map<String, Object> headers = optionalMap(config, "headers");
		if (headers != null) {
			headers.forEach((name, value) -> builder.header(name, String.valueOf(value)));
		}
		Map<String, Object> template = optionalMap(config, "payload_template");
		if (template != null) {
			builder.payloadTemplate(template);
		}
		String messageField = optionalString(config, "message_field");
		if (messageField != null) {
			builder.messageField(messageField);
		}
		return builder.build();
	}

	private static CliAgentAdapter cli(Map<String, Object> config, List<String> command) {
		CliAgentAdapter.Builder builder = CliAgentAdapter.builder(command);
		dispatchSettings(config, builder);
		String workingDirectory = optionalString(config, "working_directory");
		if (workingDirectory != null) {
			builder.workingDirectory(Path.of(workingDirectory));
		}
		Map<String, Object> env = optionalMap(config, "env_vars");
		if (env != null) {
			env.forEach((name, value) -> builder.environment(Map.of(name, String.valueOf(value))));
		}
		Map<String, Object> variables = optionalMap(config, "variables");
		if (variables != null) {
			variables.forEach((name, value) -> builder.variable(name, String.valueOf(value)));
		}
		builder.sessionId(optionalString(config, "session_id"));
		Object asyncMode = config.get("async_mode");
		if (asyncMode != null) {
			if (!(asyncMode instanceof Boolean)) {
				throw new IllegalArgumentException("async_mode must be a boolean");
			}
			builder.asyncMode((Boolean) asyncMode);
		}
		Object exitCodes = config.get("client_error_exit_codes");
		if (exitCodes != null) {
			Set<Integer> codes = new LinkedHashSet<>();
			for (Object code : requireList(exitCodes, "client_error_exit_codes")) {
				codes.add(toNumber(code, "client_error_exit_codes").intValue());
			}
			builder.clientErrorExitCodes(codes);
		}
		return builder.build();
	}

	private static RunnableAgentAdapter runnable(Map<String, Object> config) {
		Object runnable = config.get("runnable");
		if (!(runnable instanceof AgentRunnable)) {
			throw new IllegalArgumentException("runnable must be an AgentRunnable instance");
		}
		RunnableAgentAdapter.Builder builder = RunnableAgentAdapter.builder((AgentRunnable) runnable);
		dispatchSettings(config, builder);
		String inputKey = optionalString(config, "input_key");
		if (inputKey != null) {
			builder.inputKey(inputKey);
		}
		return builder.build();
	}

	private static void dispatchSettings(Map<String, Object> config, AbstractAgentAdapter.AbstractBuilder<?> builder) {
		if (config.get("timeout") != null) {
			builder.timeout(seconds(config.get("timeout"), "timeout"));
		}
		if (config.get("max_retries") != null) {
			builder.maxRetries(toNumber(config.get("max_retries"), "max_retries").intValue());
		}
		if (config.get("backoff") != null) {
			builder.backoff(seconds(config.get("backoff"), "backoff"));
		}
	}

	private static List<String> requireCommand(Map<String, Object> config) {
		Object command = config.get("command");
		if (command instanceof String) {
			List<String> parts = List.of(((String) command).trim().split("\\s+"));
			if (parts.get(0).isEmpty()) {
				throw new IllegalArgumentException("command must not be empty");
			}
			return parts;
		}
		if (command == null) {
			throw new IllegalArgumentException("Missing required configuration key: command");
		}
		List<String> parts = new ArrayList<>();
		for (Object part : requireList(command, "command")) {
			parts.add(String.valueOf(part));
		}
		if (parts.isEmpty()) {
			throw new IllegalArgumentException("command must not be empty");
		}
		return parts;
	}

	static List<String> openclawCommand(Map<String, Object> config) {
		String executable = optionalString(config, "openclaw_path");
		List<String> command = new ArrayList<>(List.of(executable != null ? executable : "openclaw", "agent",
				"--session-id", "{session_id}", "--message", "{message}"));
		String thinking = optionalString(config, "thinking");
		if (thinking != null) {
			command.add("--thinking");
			command.add(thinking);
		}
		String agentId = optionalString(config, "agent_id");
		if (agentId != null) {
			command.add("--agent");
			command.add(agentId);
		}
		return command;
	}

	private static Duration seconds(Object value, String key) {
		double seconds = toNumber(value, key).doubleValue();
		if (seconds < 0 || Double.isNaN(seconds) || Double.isInfinite(seconds)) {
			throw new IllegalArgumentException(key + " must be a non-negative number of seconds");
		}
		return Duration.ofNanos(Math.round(seconds * 1_000_000_000L));
	}

	private static Number toNumber(Object value, String key) {
		if (value instanceof Number) {
			return (Number) value;
		}
		if (value instanceof String) {
			try {
				return Double.valueOf((String) value);
			}
			catch (NumberFormatException e) {
				throw new IllegalArgumentException(key + " must be a number, got '" + value + "'", e);
			}
		}
		throw new IllegalArgumentException(key + " must be a number");
	}

	private static String requireString(Map<String, Object> config, String key) {
		String value = optionalString(config, key);
		if (value == null || value.isBlank()) {
			throw new IllegalArgumentException("Missing required configuration key: " + key);
		}
		return value;
	}

	private static String optionalString(Map<String, Object> config, String key) {
		Object value = config.get(key);
		if (value == null) {
			return null;
		}
		if (!(value instanceof String)) {
			throw new IllegalArgumentException(key + " must be a string");
		}
		return (String) value;
	}

	@SuppressWarnings("unchecked")
	private static Map<String, Object> optionalMap(Map<String, Object> config, String key) {
		Object value = config.get(key);
		if (value == null) {
			return null;
		}
		if (!(value instanceof Map)) {
			throw new IllegalArgumentException(key + " must be an object");
		}
		Map<String, Object> copy = new LinkedHashMap<>();
		((Map<Object, Object>) value).forEach((k, v) -> copy.put(String.valueOf(k), v));
		return copy;
	}

	private static List<?> requireList(Object value, String key) {
		if (!(value instanceof List)) {
			throw new IllegalArgumentException(key + " must be a list");
		}
		return (List<?>) value;
	}

}
