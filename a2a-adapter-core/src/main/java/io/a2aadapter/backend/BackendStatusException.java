/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.a2aadapter.backend;

/**
 * Raised by a backend when the call produced a response with a failure status: a
 * non-2xx HTTP status, or a non-zero process exit code mapped onto the HTTP status
 * ranges.
 */
public class BackendStatusException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final int statusCode;

	private final String body;

	public BackendStatusException(int statusCode, String body) {
		this(statusCode, body, "Backend returned status " + statusCode);
	}

	public BackendStatusException(int statusCode, String body, String message) {
		this(statusCode, body, message, null);
	}

	public BackendStatusException(int statusCode, String body, String message, Throwable cause) {
		super(message, cause);
		this.statusCode = statusCode;
		this.body = body != null ? body : "";
	}

	public int getStatusCode() {
		return this.statusCode;
	}

	public String getBody() {
		return this.body;
	}

}
