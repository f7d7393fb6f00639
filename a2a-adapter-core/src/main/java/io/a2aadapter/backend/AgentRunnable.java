/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.a2aadapter.backend;

import java.util.Map;

/**
 * An in-process agent invoked with a plain input map.
 *
 * <p>
 * The returned value becomes the response body: strings are kept as text, maps, lists
 * and other objects are converted to JSON. Implementations signal a rejected request by
 * throwing a {@link BackendStatusException} with a 4xx status and a failed dependency
 * by throwing an {@link java.io.IOException}; both are classified like their remote
 * counterparts. Any other exception is propagated to the caller unchanged.
 *
 * <p>
 * Implementations that also implement {@link AutoCloseable} are closed when the owning
 * backend is closed.
 */
@FunctionalInterface
public interface AgentRunnable {

	Object invoke(Map<String, Object> input) throws Exception;

}
