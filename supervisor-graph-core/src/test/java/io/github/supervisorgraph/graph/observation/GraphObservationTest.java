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
package io.github.supervisorgraph.graph.observation;

import io.github.supervisorgraph.graph.CompileConfig;
import io.github.supervisorgraph.graph.CompiledGraph;
import io.github.supervisorgraph.graph.KeyStrategy;
import io.github.supervisorgraph.graph.KeyStrategyFactoryBuilder;
import io.github.supervisorgraph.graph.RunnableConfig;
import io.github.supervisorgraph.graph.StateGraph;
import io.micrometer.observation.tck.TestObservationRegistry;
import io.micrometer.observation.tck.TestObservationRegistryAssert;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static io.github.supervisorgraph.graph.StateGraph.END;
import static io.github.supervisorgraph.graph.action.AsyncNodeAction.node_async;
import static io.github.supervisorgraph.graph.action.AsyncRouterAction.router_async;
import static org.junit.jupiter.api.Assertions.*;

class GraphObservationTest {

	private final TestObservationRegistry registry = TestObservationRegistry.create();

	private CompiledGraph graph(String workerReply) throws Exception {
		return new StateGraph("supervisor",
				new KeyStrategyFactoryBuilder().addStrategy("messages", KeyStrategy.APPEND).build())
			.addRouter("router", Set.of("worker", "FINISH"),
					router_async(state -> state.value("messages").isPresent() ? "FINISH" : "worker"))
			.addNode("worker", node_async(state -> {
				if (workerReply == null) {
					throw new IllegalStateException("worker down");
				}
				return Map.of("messages", List.of(workerReply));
			}))
			.addConditionalEdges("router", Map.of("worker", "worker", "FINISH", END))
			.addEdge("worker", "router")
			.setEntryPoint("router")
			.compile(CompileConfig.builder().observationRegistry(registry).build());
	}

	@Test
	void completedRunIsObservedOncePerRunAndPerStep() throws Exception {
		graph("done").invoke(Map.of(), RunnableConfig.builder().runId("run-1").build());

		TestObservationRegistryAssert.assertThat(registry)
			.hasNumberOfObservationsWithNameEqualTo("supervisor.graph.node", 3)
			.hasObservationWithNameEqualTo("supervisor.graph")
			.that()
			.hasBeenStarted()
			.hasBeenStopped()
			.hasLowCardinalityKeyValue("supervisor.graph.kind", "graph")
			.hasLowCardinalityKeyValue("supervisor.graph.name", "supervisor")
			.hasHighCardinalityKeyValue("supervisor.graph.run.id", "run-1")
			.hasHighCardinalityKeyValue("supervisor.graph.run.steps", "3")
			.hasHighCardinalityKeyValue("supervisor.graph.run.outcome", "COMPLETED");
	}

	@Test
	void stepObservationCarriesNodeAndRoute() throws Exception {
		graph("done").invoke(Map.of());

		TestObservationRegistryAssert.assertThat(registry)
			.hasAnObservation(observation -> observation.hasNameEqualTo("supervisor.graph.node")
				.hasLowCardinalityKeyValue("supervisor.graph.node.id", "worker")
				.hasHighCardinalityKeyValue("supervisor.graph.node.step", "2")
				.hasHighCardinalityKeyValue("supervisor.graph.node.outcome", "router"))
			.hasAnObservation(observation -> observation.hasNameEqualTo("supervisor.graph.node")
				.hasHighCardinalityKeyValue("supervisor.graph.node.step", "3")
				.hasHighCardinalityKeyValue("supervisor.graph.node.outcome", END));
	}

	@Test
	void failedRunRecordsError() throws Exception {
		CompiledGraph graph = graph(null);

		assertThrows(RuntimeException.class, () -> graph.invoke(Map.of()));

		TestObservationRegistryAssert.assertThat(registry)
			.hasObservationWithNameEqualTo("supervisor.graph")
			.that()
			.hasError()
			.hasHighCardinalityKeyValue("supervisor.graph.run.outcome", "FAILED");
		TestObservationRegistryAssert.assertThat(registry)
			.hasAnObservation(observation -> observation.hasNameEqualTo("supervisor.graph.node")
				.hasLowCardinalityKeyValue("supervisor.graph.node.id", "worker")
				.hasError());
	}

}
