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

import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.util.List;
import java.util.Map;

import static io.github.supervisorgraph.graph.SupervisorGraphs.ROUTER;
import static io.github.supervisorgraph.graph.SupervisorGraphs.WORKER;
import static io.github.supervisorgraph.graph.SupervisorGraphs.alwaysWorker;
import static io.github.supervisorgraph.graph.SupervisorGraphs.supervisor;
import static io.github.supervisorgraph.graph.action.AsyncNodeAction.node_async;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isA;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class GraphLifecycleListenerTest {

	@Test
	void listenerSeesEveryStepOfCompletedRun() throws Exception {
		GraphLifecycleListener listener = mock(GraphLifecycleListener.class);
		CompiledGraph graph = supervisor().compile(CompileConfig.builder().withLifecycleListener(listener).build());

		graph.invoke(Map.of());

		InOrder order = inOrder(listener);
		order.verify(listener).onStart(eq(ROUTER), anyMap(), any(RunnableConfig.class));
		order.verify(listener).before(eq(ROUTER), anyMap(), any(RunnableConfig.class), eq(1));
		order.verify(listener).after(eq(ROUTER), anyMap(), any(RunnableConfig.class), eq(1));
		order.verify(listener).before(eq(WORKER), anyMap(), any(RunnableConfig.class), eq(2));
		order.verify(listener).after(eq(WORKER), eq(Map.of("messages", List.of("done"))), any(RunnableConfig.class),
				eq(2));
		order.verify(listener).before(eq(ROUTER), anyMap(), any(RunnableConfig.class), eq(3));
		order.verify(listener).after(eq(ROUTER), anyMap(), any(RunnableConfig.class), eq(3));
		order.verify(listener).onComplete(eq(ROUTER), anyMap(), any(RunnableConfig.class));
		verify(listener, never()).onError(anyString(), anyMap(), any(), any());
	}

	@Test
	void listenerIsToldAboutFailure() throws Exception {
		GraphLifecycleListener listener = mock(GraphLifecycleListener.class);
		CompiledGraph graph = supervisor(alwaysWorker(), node_async(state -> {
			throw new IllegalStateException("boom");
		})).compile(CompileConfig.builder().withLifecycleListener(listener).build());

		assertThrows(RuntimeException.class, () -> graph.invoke(Map.of()));

		verify(listener).onError(eq(WORKER), anyMap(), isA(RuntimeException.class), any(RunnableConfig.class));
		verify(listener, never()).onComplete(anyString(), anyMap(), any());
	}

	@Test
	void failingListenerDoesNotAbortRun() throws Exception {
		GraphLifecycleListener listener = mock(GraphLifecycleListener.class);
		doThrow(new IllegalStateException("listener bug")).when(listener)
			.before(anyString(), anyMap(), any(), anyInt());
		CompiledGraph graph = supervisor().compile(CompileConfig.builder().withLifecycleListener(listener).build());

		OverAllState state = graph.invoke(Map.of()).orElseThrow();

		assertEquals(List.of("done"), state.value("messages").orElseThrow());
		verify(listener, times(3)).after(anyString(), anyMap(), any(), anyInt());
	}

}
