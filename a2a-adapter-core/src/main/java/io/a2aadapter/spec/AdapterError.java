/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.a2aadapter.spec;

import java.time.Duration;

import reactor.util.annotation.Nullable;

/**
 * Terminal error raised by adapters and the task lifecycle manager.
 *
 * <p>
 * Backend failures always carry enough context to be diagnosed without re-running the
 * call: the correlation id of the logical call, the number of attempts made, the total
 * elapsed time, the last status code (if a response was received) and a bounded preview
 * of the response body.
 */
public class AdapterError extends RuntimeException {

	private static final long serialVersionUID = 1L;

	/**
	 * Error taxonomy.
	 */
	public enum Kind {

		/**
		 * The backend rejected the request (4xx-equivalent). Never retried.
		 */
		CLIENT_ERROR,

		/**
		 * The backend failed (5xx-equivalent) on every attempt of the retry budget.
		 */
		SERVER_ERROR,

		/**
		 * No response was received (connection refused, timeout, reset) on every attempt
		 * of the retry budget.
		 */
		TRANSPORT_ERROR,

		/**
		 * The task identifier is unknown or has been deleted.
		 */
		NOT_FOUND,

		/**
		 * The requested task operation is not legal in the task's current state.
		 */
		INVALID_STATE

	}

	private final Kind kind;

	private final String correlationId;

	private final int attempts;

	private final Duration elapsed;

	private final Integer statusCode;

	private final String bodyPreview;

	protected AdapterError(Builder builder) {
		super(builder.message, builder.cause);
		this.kind = builder.kind;
		this.correlationId = builder.correlationId;
		this.attempts = builder.attempts;
		this.elapsed = builder.elapsed;
		this.statusCode = builder.statusCode;
		this.bodyPreview = builder.bodyPreview;
	}

	public Kind getKind() {
		return this.kind;
	}

	@Nullable
	public String getCorrelationId() {
		return this.correlationId;
	}

	/**
	 * Returns the number of attempts made for the logical call.
	 * @return the attempt count, {@code 0} for task lifecycle errors
	 */
	public int getAttempts() {
		return this.attempts;
	}

	@Nullable
	public Duration getElapsed() {
		return this.elapsed;
	}

	@Nullable
	public Integer getStatusCode() {
		return this.statusCode;
	}

	@Nullable
	public String getBodyPreview() {
		return this.bodyPreview;
	}

	/**
	 * Whether this error terminates a backend call after its retry budget was spent.
	 * @return true for SERVER_ERROR and TRANSPORT_ERROR
	 */
	public boolean isRetryExhausted() {
		return this.kind == Kind.SERVER_ERROR || this.kind == Kind.TRANSPORT_ERROR;
	}

	public static AdapterError notFound(String taskId) {
		return builder(Kind.NOT_FOUND).message("Task not found: " + taskId).build();
	}

	public static AdapterError invalidState(String message) {
		return builder(Kind.INVALID_STATE).message(message).build();
	}

	public static Builder builder(Kind kind) {
		return new Builder(kind);
	}

	public static class Builder {

		private final Kind kind;

		private String message;

		private Throwable cause;

		private String correlationId;

		private int attempts;

		private Duration elapsed;

		private Integer statusCode;

		private String bodyPreview;

		public Builder(Kind kind) {
			this.kind = kind;
		}

		public Builder message(String message) {
			this.message = message;
			return this;
		}

		public Builder cause(Throwable cause) {
			this.cause = cause;
			return this;
		}

		public Builder correlationId(String correlationId) {
			this.correlationId = correlationId;
			return this;
		}

		public Builder attempts(int attempts) {
			this.attempts = attempts;
			return this;
		}

		public Builder elapsed(Duration elapsed) {
			this.elapsed = elapsed;
			return this;
		}

		public Builder statusCode(Integer statusCode) {
			this.statusCode = statusCode;
			return this;
		}

		public Builder bodyPreview(String bodyPreview) {
			this.bodyPreview = bodyPreview;
			return this;
		}

		public AdapterError build() {
			return new AdapterError(this);
		}

	}

}
