/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.a2aadapter.backend;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.a2aadapter.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Runs a command-line agent as a subprocess, one process per attempt.
 *
 * <p>
 * Arguments may reference request payload fields with {@code {field}} placeholders
 * (for example {@code {message}} or {@code {session_id}}); {@code {request_id}} expands
 * to the correlation id. When no argument references {@code {message}}, the message
 * text is written to the process's standard input instead.
 *
 * <p>
 * Exit code {@code 0} is a success and standard output becomes the response body (parsed
 * as JSON when possible). Any other exit code raises a {@link BackendStatusException}:
 * status {@code 400} for the configured client-error exit codes, {@code 500} otherwise.
 * Processes that outlive the attempt timeout, or whose attempt is cancelled, are
 * destroyed.
 */
public final class SubprocessBackend implements Backend {

	private static final Logger logger = LoggerFactory.getLogger(SubprocessBackend.class);

	private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z0-9_.-]+)}");

	private static final String MESSAGE_PLACEHOLDER = "{message}";

	private static final String REQUEST_ID = "request_id";

	static final int CLIENT_ERROR_STATUS = 400;

	static final int SERVER_ERROR_STATUS = 500;

	private final List<String> command;

	private final Path workingDirectory;

	private final Map<String, String> environment;

	private final Set<Integer> clientErrorExitCodes;

	private final ObjectMapper objectMapper;

	private final boolean messageOnStdin;

	private final Set<Process> liveProcesses = ConcurrentHashMap.newKeySet();

	private volatile boolean open;

	private SubprocessBackend(Builder builder) {
		this.command = List.copyOf(builder.command);
		this.workingDirectory = builder.workingDirectory;
		this.environment = Map.copyOf(builder.environment);
		this.clientErrorExitCodes = Set.copyOf(builder.clientErrorExitCodes);
		this.objectMapper = builder.objectMapper;
		this.messageOnStdin = this.command.stream().noneMatch(arg -> arg.contains(MESSAGE_PLACEHOLDER));
	}

	@Override
	public void open() {
		this.open = true;
	}

	@Override
	public Mono<BackendResponse> call(BackendRequest request, Duration timeout) {
		return Mono.defer(() -> {
			if (!this.open) {
				return Mono.error(new IllegalStateException("Subprocess backend " + describe() + " is not open"));
			}
			return Mono.using(() -> start(request), process -> Mono.fromCallable(() -> await(process, request, timeout)),
					this::destroy);
		}).subscribeOn(Schedulers.boundedElastic());
	}

	List<String> resolveCommand(BackendRequest request) {
		List<String> resolved = new ArrayList<>(this.command.size());
		for (String arg : this.command) {
			// single pass, so substituted values are never expanded again
			resolved.add(PLACEHOLDER.matcher(arg).replaceAll(match -> {
				String value = placeholderValue(match.group(1), request);
				return Matcher.quoteReplacement(value != null ? value : match.group());
			}));
		}
		return resolved;
	}

	private static String placeholderValue(String name, BackendRequest request) {
		if (REQUEST_ID.equals(name)) {
			return request.correlationId();
		}
		Object value = request.payload().get(name);
		if (value == null || value instanceof Map || value instanceof Iterable) {
			return null;
		}
		return String.valueOf(value);
	}

	private Process start(BackendRequest request) {
		ProcessBuilder processBuilder = new ProcessBuilder(resolveCommand(request));
		if (this.workingDirectory != null) {
			processBuilder.directory(this.workingDirectory.toFile());
		}
		processBuilder.environment().putAll(this.environment);
		Process process;
		try {
			process = processBuilder.start();
		}
		catch (IOException e) {
			// a missing executable or working directory will not appear on retry
			throw new BackendStatusException(CLIENT_ERROR_STATUS, String.valueOf(e.getMessage()),
					"Failed to start command " + this.command.get(0), e);
		}
		this.liveProcesses.add(process);
		logger.debug("Started {} (pid {}) for request {}", this.command.get(0), process.pid(),
				request.correlationId());
		return process;
	}

	private BackendResponse await(Process process, BackendRequest request, Duration timeout)
			throws IOException, InterruptedException, TimeoutException {
		CompletableFuture<String> stdout = drain(process.getInputStream());
		CompletableFuture<String> stderr = drain(process.getErrorStream());

		try (OutputStream stdin = process.getOutputStream()) {
			if (this.messageOnStdin) {
				stdin.write(request.text().getBytes(StandardCharsets.UTF_8));
			}
		}
		catch (IOException e) {
			if (process.isAlive()) {
				throw e;
			}
			// the command exited without reading its input; its exit code decides
			logger.debug("Command {} closed stdin before reading the message", this.command.get(0));
		}

		if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
			throw new TimeoutException("Command " + this.command.get(0) + " did not finish within " + timeout.toMillis()
					+ " ms (request " + request.correlationId() + ")");
		}

		int exitCode = process.exitValue();
		String out = join(stdout);
		if (exitCode == 0) {
			return BackendResponse.parse(out, this.objectMapper);
		}
		String err = join(stderr);
		int status = this.clientErrorExitCodes.contains(exitCode) ? CLIENT_ERROR_STATUS : SERVER_ERROR_STATUS;
		throw new BackendStatusException(status, err.isBlank() ? out : err,
				"Command " + this.command.get(0) + " exited with code " + exitCode);
	}

	private void destroy(Process process) {
		this.liveProcesses.remove(process);
		if (process.isAlive()) {
			logger.debug("Destroying process {}", process.pid());
			process.destroyForcibly();
		}
	}

	private static String join(CompletableFuture<String> output) throws IOException, InterruptedException {
		try {
			return output.get();
		}
		catch (ExecutionException e) {
			throw new IOException("Failed to read process output", e.getCause());
		}
	}

	private static CompletableFuture<String> drain(InputStream stream) {
		return Mono.fromCallable(() -> {
			try (stream) {
				return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
			}
		}).subscribeOn(Schedulers.boundedElastic()).toFuture();
	}

	@Override
	public void close() {
		this.open = false;
		for (Process process : this.liveProcesses) {
			destroy(process);
		}
	}

	@Override
	public String describe() {
		return "subprocess " + this.command.get(0);
	}

	public static Builder builder(List<String> command) {
		return new Builder(command);
	}

	/**
	 * Builder for {@link SubprocessBackend}.
	 */
	public static class Builder {

		private final List<String> command;

		private Path workingDirectory;

		private final Map<String, String> environment = new LinkedHashMap<>();

		private Set<Integer> clientErrorExitCodes = Set.of(2);

		private ObjectMapper objectMapper;

		private Builder(List<String> command) {
			Assert.notEmpty(command, "command must not be empty");
			Assert.hasText(command.get(0), "executable must not be empty");
			this.command = List.copyOf(command);
		}

		public Builder workingDirectory(Path workingDirectory) {
			this.workingDirectory = workingDirectory;
			return this;
		}

		/**
		 * Adds environment variables on top of the inherited environment.
		 * @param environment the variables to add
		 * @return this builder
		 */
		public Builder environment(Map<String, String> environment) {
			Assert.notNull(environment, "environment must not be null");
			this.environment.putAll(environment);
			return this;
		}

		/**
		 * Sets the exit codes that signal a rejected request. Failures with these codes
		 * are never retried.
		 * @param exitCodes the exit codes
		 * @return this builder
		 */
		public Builder clientErrorExitCodes(Set<Integer> exitCodes) {
			Assert.notNull(exitCodes, "exitCodes must not be null");
			Assert.isTrue(!exitCodes.contains(0), "exit code 0 signals success");
			this.clientErrorExitCodes = exitCodes;
			return this;
		}

		public Builder objectMapper(ObjectMapper objectMapper) {
			Assert.notNull(objectMapper, "objectMapper must not be null");
			this.objectMapper = objectMapper;
			return this;
		}

		public SubprocessBackend build() {
			if (this.objectMapper == null) {
				this.objectMapper = new ObjectMapper();
			}
			return new SubprocessBackend(this);
		}

	}

}
