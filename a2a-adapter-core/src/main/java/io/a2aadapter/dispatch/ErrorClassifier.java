/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.a2aadapter.dispatch;

import java.io.IOException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import io.a2aadapter.backend.BackendStatusException;
import reactor.util.annotation.Nullable;

/**
 * Maps backend outcomes to an {@link ErrorCategory}.
 *
 * <ul>
 * <li>5xx status: {@link ErrorCategory#TRANSIENT}</li>
 * <li>any other non-2xx status, 4xx included: {@link ErrorCategory#CLIENT_ERROR}</li>
 * <li>no response ({@link IOException} such as a refused connection, reset socket or
 * HTTP timeout, or a {@link TimeoutException}): {@link ErrorCategory#TRANSIENT}</li>
 * </ul>
 *
 * Everything else is a programming or configuration error and is not classified.
 */
public final class ErrorClassifier {

	private ErrorClassifier() {
	}

	/**
	 * Classifies a non-2xx response status.
	 * @param status the HTTP status, or the status a subprocess exit code was mapped to
	 * @return the category
	 */
	public static ErrorCategory classify(int status) {
		if (status >= 500 && status < 600) {
			return ErrorCategory.TRANSIENT;
		}
		// 1xx and 3xx are not followed, so they cannot succeed on retry either
		return ErrorCategory.CLIENT_ERROR;
	}

	/**
	 * Classifies an exception raised by a backend attempt.
	 * @param error the exception
	 * @return the category, or {@code null} if the exception must propagate unchanged
	 */
	@Nullable
	public static ErrorCategory classify(Throwable error) {
		Throwable cause = unwrap(error);
		if (cause instanceof BackendStatusException statusException) {
			return classify(statusException.getStatusCode());
		}
		if (cause instanceof IOException || cause instanceof TimeoutException) {
			return ErrorCategory.TRANSIENT;
		}
		return null;
	}

	/**
	 * Strips the wrappers added by futures.
	 * @param error the exception
	 * @return the innermost meaningful exception
	 */
	public static Throwable unwrap(Throwable error) {
		Throwable current = error;
		while ((current instanceof CompletionException || current instanceof ExecutionException)
				&& current.getCause() != null) {
			current = current.getCause();
		}
		return current;
	}

}
