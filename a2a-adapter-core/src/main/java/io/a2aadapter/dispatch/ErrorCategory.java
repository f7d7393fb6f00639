/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.a2aadapter.dispatch;

/**
 * Category of a failed backend attempt.
 */
public enum ErrorCategory {

	/**
	 * The failure may not recur: a 5xx status, or no response at all. Retried while the
	 * retry budget lasts.
	 */
	TRANSIENT,

	/**
	 * The backend rejected the request. Retrying cannot succeed.
	 */
	CLIENT_ERROR,

	/**
	 * A backend fault that must not be retried again. The classifier never returns it
	 * and {@link RetryPolicy#shouldRetry} rejects it; the dispatch engine reports an
	 * exhausted budget with a response status as
	 * {@link io.a2aadapter.spec.AdapterError.Kind#SERVER_ERROR}.
	 */
	SERVER_ERROR

}
