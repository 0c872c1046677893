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
package io.github.supervisorgraph.graph.diagram;

import io.github.supervisorgraph.graph.GraphRepresentation;
import io.github.supervisorgraph.graph.KeyStrategyFactoryBuilder;
import io.github.supervisorgraph.graph.StateGraph;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static io.github.supervisorgraph.graph.StateGraph.END;
import static io.github.supervisorgraph.graph.action.AsyncEdgeAction.edge_async;
import static io.github.supervisorgraph.graph.action.AsyncNodeAction.node_async;
import static io.github.supervisorgraph.graph.action.AsyncRouterAction.router_async;
import static org.junit.jupiter.api.Assertions.*;

class PlantUMLGeneratorTest {

	@Test
	void rendersRoutersWorkersAndConditions() throws Exception {
		StateGraph graph = new StateGraph(new KeyStrategyFactoryBuilder().addStrategy("messages").build())
			.addRouter("supervisor", Set.of("coder", "FINISH"), router_async(state -> "FINISH"))
			.addNode("coder", node_async(state -> Map.of()))
			.addConditionalEdges("supervisor", Map.of("coder", "coder", "FINISH", END))
			.addConditionalEdges("coder", edge_async(state -> "review"), Set.of("review"),
					Map.of("review", "supervisor"))
			.setEntryPoint("supervisor");

		String content = graph.compile().getGraph(GraphRepresentation.Type.PLANTUML, "Supervisor Team").content();

		assertTrue(content.startsWith("@startuml Supervisor_Team\n"), content);
		assertTrue(content.contains("title \"Supervisor Team\"\n"), content);
		assertTrue(content.contains("hexagon \"supervisor\"<<Router>>\n"), content);
		assertTrue(content.contains("usecase \"coder\"<<Node>>\n"), content);
		assertTrue(content.contains("hexagon \"check state\" as condition0<<Condition>>\n"), content);
		assertTrue(content.contains("hexagon \"check state\" as condition1<<Condition>>\n"), content);
		assertTrue(content.contains("\"__START__\" -down-> \"supervisor\"\n"), content);
		assertTrue(content.contains("\"condition0\" .down.> \"__END__\": \"FINISH\"\n"), content);
		assertTrue(content.contains("\"condition1\" .down.> \"supervisor\": \"review\"\n"), content);
		assertTrue(content.endsWith("@enduml\n"), content);
	}

	@Test
	void uncompiledGraphCanBeRendered() throws Exception {
		StateGraph graph = new StateGraph(new KeyStrategyFactoryBuilder().addStrategy("messages").build())
			.addNode("coder", node_async(state -> Map.of()))
			.addEdge("coder", END)
			.setEntryPoint("coder");

		String content = graph.getGraph(GraphRepresentation.Type.PLANTUML, null).content();

		assertTrue(content.startsWith("@startuml unnamed\n"), content);
		assertTrue(content.contains("\"coder\" -down-> \"__END__\"\n"), content);
	}

}
