/*
 * Copyright 2024-2025 the original author or authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.github.supervisorgraph.graph;

import io.github.supervisorgraph.graph.action.AsyncNodeAction;
import io.github.supervisorgraph.graph.exception.NodeInvocationException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static io.github.supervisorgraph.graph.StateGraph.END;

import static io.github.supervisorgraph.graph.SupervisorGraphs.ROUTER;
import static io.github.supervisorgraph.graph.SupervisorGraphs.WORKER;
import static io.github.supervisorgraph.graph.SupervisorGraphs.finishOnceAnswered;
import static io.github.supervisorgraph.graph.SupervisorGraphs.messagesSchema;
import static io.github.supervisorgraph.graph.SupervisorGraphs.supervisor;
import static io.github.supervisorgraph.graph.action.AsyncNodeAction.node_async;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class GraphRunTest {

	@Test
	void startDoesNotRunAnyNode() throws Exception {
		AsyncNodeAction worker = mock(AsyncNodeAction.class);
		CompiledGraph graph = supervisor(finishOnceAnswered(), worker).compile();

		try (GraphRun run = graph.start(Map.of())) {
			assertTrue(run.hasNext());
			assertTrue(run.hasNext());
			assertEquals(0, run.stepCount());
			assertEquals(RunStatus.RUNNING, run.status());
		}
		verify(worker, never()).apply(any());
	}

	@Test
	void cancelAfterFirstStepStopsTheRun() throws Exception {
		AsyncNodeAction worker = mock(AsyncNodeAction.class);
		when(worker.apply(any())).thenReturn(CompletableFuture.completedFuture(Map.of("messages", List.of("done"))));
		CompiledGraph graph = supervisor(finishOnceAnswered(), worker).compile();

		GraphRun run = graph.start(Map.of());
		assertEquals(ROUTER, run.next().node());

		run.cancel();

		assertFalse(run.hasNext());
		assertEquals(RunStatus.CANCELLED, run.status());
		assertEquals(1, run.steps().size());
		assertThrows(NoSuchElementException.class, run::next);
		assertTrue(run.toCompletion().isEmpty());
		verify(worker, never()).apply(any());
	}

	@Test
	void closeBeforeFirstStepCancels() throws Exception {
		GraphRun run = supervisor().compile().start(Map.of());

		run.close();

		assertEquals(RunStatus.CANCELLED, run.status());
		assertFalse(run.hasNext());
		assertTrue(run.steps().isEmpty());
	}

	@Test
	void closeAfterCompletionKeepsStatus() throws Exception {
		GraphRun run = supervisor().compile().start(Map.of());
		run.toCompletion();

		run.close();

		assertEquals(RunStatus.COMPLETED, run.status());
		assertEquals(3, run.steps().size());
	}

	@Test
	void stepInFlightCompletesWhenCancelledFromAnotherThread() throws Exception {
		CountDownLatch entered = new CountDownLatch(1);
		CountDownLatch release = new CountDownLatch(1);
		CompiledGraph graph = supervisor(finishOnceAnswered(), node_async(state -> {
			entered.countDown();
			assertTrue(release.await(5, TimeUnit.SECONDS));
			return Map.of("messages", List.of("late"));
		})).compile();

		GraphRun run = graph.start(Map.of());
		run.next();

		Thread canceller = new Thread(() -> {
			try {
				assertTrue(entered.await(5, TimeUnit.SECONDS));
			}
			catch (InterruptedException ex) {
				Thread.currentThread().interrupt();
			}
			run.cancel();
			release.countDown();
		});
		canceller.start();

		NodeOutput inFlight = run.next();
		canceller.join(5000);

		assertEquals(WORKER, inFlight.node());
		assertFalse(run.hasNext());
		assertEquals(RunStatus.CANCELLED, run.status());
		assertEquals(List.of(ROUTER, WORKER), run.steps().stream().map(NodeOutput::node).toList());
		assertEquals(List.of("late"), run.state().value("messages").orElseThrow());
	}

	@Test
	void closeDuringFinalStepLetsTheRunComplete() throws Exception {
		AtomicReference<GraphRun> current = new AtomicReference<>();
		CompiledGraph graph = new StateGraph(messagesSchema()).addNode(WORKER, node_async(state -> {
			current.get().close();
			return Map.of("messages", List.of("done"));
		})).addEdge(WORKER, END).setEntryPoint(WORKER).compile();

		GraphRun run = graph.start(Map.of());
		current.set(run);
		Optional<OverAllState> result = run.toCompletion();

		assertEquals(RunStatus.COMPLETED, run.status());
		assertEquals(List.of("done"), result.orElseThrow().value("messages").orElseThrow());
		assertEquals(1, run.steps().size());
	}

	@Test
	void closeDuringStepTakesEffectAtNextBoundary() throws Exception {
		AtomicReference<GraphRun> current = new AtomicReference<>();
		AsyncNodeAction worker = mock(AsyncNodeAction.class);
		when(worker.apply(any())).thenAnswer(invocation -> {
			assertEquals(RunStatus.RUNNING, current.get().status());
			current.get().close();
			assertEquals(RunStatus.RUNNING, current.get().status());
			return CompletableFuture.completedFuture(Map.of("messages", List.of("done")));
		});
		GraphRun run = supervisor(SupervisorGraphs.alwaysWorker(), worker).compile().start(Map.of());
		current.set(run);

		assertTrue(run.toCompletion().isEmpty());

		assertEquals(RunStatus.CANCELLED, run.status());
		assertEquals(List.of(ROUTER, WORKER), run.steps().stream().map(NodeOutput::node).toList());
		verify(worker).apply(any());
	}

	@Test
	void failureOfStepClosedMidwayIsReported() throws Exception {
		AtomicReference<GraphRun> current = new AtomicReference<>();
		CompiledGraph graph = supervisor(finishOnceAnswered(), node_async(state -> {
			current.get().close();
			throw new IllegalStateException("worker down");
		})).compile();

		GraphRun run = graph.start(Map.of());
		current.set(run);

		assertThrows(NodeInvocationException.class, run::toCompletion);
		assertEquals(RunStatus.FAILED, run.status());
		assertEquals(WORKER, run.failure().orElseThrow().nodeId().orElseThrow());
	}

	@Test
	void cancelLandingAfterHasNextEndsDrainQuietly() throws Exception {
		AtomicReference<GraphRun> current = new AtomicReference<>();
		GraphLifecycleListener cancelOnStart = new GraphLifecycleListener() {
			@Override
			public void onStart(String nodeId, Map<String, Object> state, RunnableConfig config) {
				current.get().cancel();
			}
		};
		AsyncNodeAction worker = mock(AsyncNodeAction.class);
		CompiledGraph graph = supervisor(finishOnceAnswered(), worker)
			.compile(CompileConfig.builder().withLifecycleListener(cancelOnStart).build());

		GraphRun run = graph.start(Map.of());
		current.set(run);

		assertTrue(run.toCompletion().isEmpty());
		assertEquals(RunStatus.CANCELLED, run.status());
		assertTrue(run.steps().isEmpty());
		verify(worker, never()).apply(any());
	}

	@Test
	void eachStartIsAFreshRun() throws Exception {
		CompiledGraph graph = supervisor().compile();

		GraphRun first = graph.start(Map.of());
		first.toCompletion();
		GraphRun second = graph.start(Map.of());

		assertNotEquals(first.runId(), second.runId());
		assertEquals(0, second.stepCount());
		assertTrue(second.state().data().isEmpty());
	}

	@Test
	void runIdComesFromConfig() throws Exception {
		GraphRun run = supervisor().compile().start(Map.of(), RunnableConfig.builder().runId("run-42").build());

		assertEquals("run-42", run.runId());
	}

}
