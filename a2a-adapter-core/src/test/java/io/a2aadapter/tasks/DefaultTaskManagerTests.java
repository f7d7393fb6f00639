/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.a2aadapter.tasks;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import io.a2aadapter.adapter.AgentAdapter;
import io.a2aadapter.adapter.RunnableAgentAdapter;
import io.a2aadapter.backend.BackendStatusException;
import io.a2aadapter.spec.A2aSchema.Message;
import io.a2aadapter.spec.A2aSchema.MessageSendParams;
import io.a2aadapter.spec.A2aSchema.Role;
import io.a2aadapter.spec.A2aSchema.Task;
import io.a2aadapter.spec.A2aSchema.TaskState;
import io.a2aadapter.spec.AdapterError;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

/**
 * Tests for {@link DefaultTaskManager} with a mocked {@link AgentAdapter}.
 */
class DefaultTaskManagerTests {

	private static final Duration TIMEOUT = Duration.ofSeconds(5);

	private static final MessageSendParams PARAMS = MessageSendParams.of(Message.text(Role.USER, "long job"));

	private AgentAdapter adapter;

	private DefaultTaskManager taskManager;

	@BeforeEach
	void setUp() {
		this.adapter = mock(AgentAdapter.class);
		this.taskManager = DefaultTaskManager.builder(this.adapter).pollInterval(Duration.ofMillis(10)).build();
	}

	@AfterEach
	void tearDown() {
		this.taskManager.shutdown().block(TIMEOUT);
	}

	private static AdapterError.Kind kindOf(Throwable error) {
		assertThat(error).isInstanceOf(AdapterError.class);
		return ((AdapterError) error).getKind();
	}

	@Test
	void createReturnsBeforeTheBackendAnswers() {
		Sinks.One<Message> reply = Sinks.one();
		when(this.adapter.handle(any(), anyString())).thenReturn(reply.asMono());

		Task task = this.taskManager.create(PARAMS).block(TIMEOUT);

		assertThat(task.state()).isEqualTo(TaskState.SUBMITTED);
		await().atMost(TIMEOUT)
			.untilAsserted(() -> assertThat(this.taskManager.get(task.id()).block().state())
				.isEqualTo(TaskState.WORKING));

		reply.tryEmitValue(Message.text(Role.ASSISTANT, "finished"));

		StepVerifier.create(this.taskManager.awaitTerminal(task.id(), TIMEOUT)).assertNext(done -> {
			assertThat(done.state()).isEqualTo(TaskState.COMPLETED);
			assertThat(done.result().parts().get(0).text()).isEqualTo("finished");
			assertThat(done.error()).isNull();
		}).verifyComplete();
	}

	@Test
	void backendCallUsesTheTaskCorrelationId() {
		AtomicReference<String> seen = new AtomicReference<>();
		when(this.adapter.handle(any(), anyString())).thenAnswer(invocation -> {
			seen.set(invocation.getArgument(1));
			return Mono.just(Message.text(Role.ASSISTANT, "ok"));
		});

		Task task = this.taskManager.create(PARAMS).block(TIMEOUT);
		this.taskManager.awaitTerminal(task.id(), TIMEOUT).block();

		assertThat(seen.get()).isEqualTo(task.correlationId());
	}

	@Test
	void failedCallFailsTheTask() {
		AdapterError error = AdapterError.builder(AdapterError.Kind.SERVER_ERROR)
			.message("Backend webhook failed after 3 attempt(s)")
			.attempts(3)
			.build();
		when(this.adapter.handle(any(), anyString())).thenReturn(Mono.error(error));

		Task task = this.taskManager.create(PARAMS).block(TIMEOUT);

		StepVerifier.create(this.taskManager.awaitTerminal(task.id(), TIMEOUT)).assertNext(failed -> {
			assertThat(failed.state()).isEqualTo(TaskState.FAILED);
			assertThat(failed.error()).isEqualTo("Backend webhook failed after 3 attempt(s)");
			assertThat(failed.result()).isNull();
		}).verifyComplete();
	}

	@Test
	void rejectedCallKeepsItsDiagnosticsInTheTaskError() {
		RunnableAgentAdapter rejecting = RunnableAgentAdapter.builder(input -> {
			throw new BackendStatusException(422, "field 'foo' is required");
		}).name("validator").build();
		DefaultTaskManager manager = DefaultTaskManager.builder(rejecting).pollInterval(Duration.ofMillis(10)).build();

		try {
			Task task = manager.create(PARAMS).block(TIMEOUT);

			StepVerifier.create(manager.awaitTerminal(task.id(), TIMEOUT)).assertNext(failed -> {
				assertThat(failed.state()).isEqualTo(TaskState.FAILED);
				assertThat(failed.error()).contains("runnable validator", task.correlationId(), "status 422",
						"after 1 attempt(s) in ", " ms", "field 'foo' is required");
			}).verifyComplete();
		}
		finally {
			manager.shutdown().block(TIMEOUT);
			rejecting.close();
		}
	}

	@Test
	void cancelWhileWorkingDisposesTheCall() {
		AtomicBoolean disposed = new AtomicBoolean();
		when(this.adapter.handle(any(), anyString()))
			.thenReturn(Mono.<Message>never().doOnCancel(() -> disposed.set(true)));

		Task task = this.taskManager.create(PARAMS).block(TIMEOUT);
		await().atMost(TIMEOUT)
			.untilAsserted(() -> assertThat(this.taskManager.get(task.id()).block().state())
				.isEqualTo(TaskState.WORKING));

		StepVerifier.create(this.taskManager.cancel(task.id()))
			.assertNext(canceled -> assertThat(canceled.state()).isEqualTo(TaskState.CANCELED))
			.verifyComplete();

		await().atMost(TIMEOUT).untilTrue(disposed);
		assertThat(this.taskManager.get(task.id()).block().state()).isEqualTo(TaskState.CANCELED);
	}

	@Test
	void cancelCompletedTaskIsInvalidState() {
		when(this.adapter.handle(any(), anyString())).thenReturn(Mono.just(Message.text(Role.ASSISTANT, "ok")));

		Task task = this.taskManager.create(PARAMS).block(TIMEOUT);
		this.taskManager.awaitTerminal(task.id(), TIMEOUT).block();

		StepVerifier.create(this.taskManager.cancel(task.id()))
			.expectErrorSatisfies(error -> assertThat(kindOf(error)).isEqualTo(AdapterError.Kind.INVALID_STATE))
			.verify();
		assertThat(this.taskManager.get(task.id()).block().state()).isEqualTo(TaskState.COMPLETED);
	}

	@Test
	void unknownTaskIsNotFound() {
		StepVerifier.create(this.taskManager.get("missing"))
			.expectErrorSatisfies(error -> assertThat(kindOf(error)).isEqualTo(AdapterError.Kind.NOT_FOUND))
			.verify();
		StepVerifier.create(this.taskManager.cancel("missing"))
			.expectErrorSatisfies(error -> assertThat(kindOf(error)).isEqualTo(AdapterError.Kind.NOT_FOUND))
			.verify();
		StepVerifier.create(this.taskManager.delete("missing"))
			.expectErrorSatisfies(error -> assertThat(kindOf(error)).isEqualTo(AdapterError.Kind.NOT_FOUND))
			.verify();
	}

	@Test
	void deleteRequiresATerminalTask() {
		when(this.adapter.handle(any(), anyString())).thenReturn(Mono.never());

		Task task = this.taskManager.create(PARAMS).block(TIMEOUT);

		StepVerifier.create(this.taskManager.delete(task.id()))
			.expectErrorSatisfies(error -> assertThat(kindOf(error)).isEqualTo(AdapterError.Kind.INVALID_STATE))
			.verify();

		this.taskManager.cancel(task.id()).block(TIMEOUT);
		StepVerifier.create(this.taskManager.delete(task.id())).verifyComplete();
		StepVerifier.create(this.taskManager.get(task.id()))
			.expectErrorSatisfies(error -> assertThat(kindOf(error)).isEqualTo(AdapterError.Kind.NOT_FOUND))
			.verify();
	}

	@Test
	void listIncludesCreatedTasks() {
		when(this.adapter.handle(any(), anyString())).thenReturn(Mono.never());

		Task first = this.taskManager.create(PARAMS).block(TIMEOUT);
		Task second = this.taskManager.create(PARAMS).block(TIMEOUT);

		StepVerifier.create(this.taskManager.list(null))
			.assertNext(page -> assertThat(page.tasks()).extracting(Task::id)
				.containsExactlyInAnyOrder(first.id(), second.id()))
			.verifyComplete();
	}

	@Test
	void awaitTerminalTimesOut() {
		when(this.adapter.handle(any(), anyString())).thenReturn(Mono.never());

		Task task = this.taskManager.create(PARAMS).block(TIMEOUT);

		StepVerifier.create(this.taskManager.awaitTerminal(task.id(), Duration.ofMillis(100)))
			.expectError(TimeoutException.class)
			.verify(TIMEOUT);
	}

	@Test
	void shutdownCancelsRunningTasks() {
		when(this.adapter.handle(any(), anyString())).thenReturn(Mono.never());
		TaskStore store = new InMemoryTaskStore();
		DefaultTaskManager manager = DefaultTaskManager.builder(this.adapter).taskStore(store).build();

		Task task = manager.create(PARAMS).block(TIMEOUT);
		await().atMost(TIMEOUT)
			.untilAsserted(() -> assertThat(store.getTask(task.id()).block().state()).isEqualTo(TaskState.WORKING));

		manager.shutdown().block(TIMEOUT);

		assertThat(store.getTask(task.id()).block().state()).isEqualTo(TaskState.CANCELED);
	}

}
