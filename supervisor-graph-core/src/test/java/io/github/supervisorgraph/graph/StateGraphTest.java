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

import io.github.supervisorgraph.graph.exception.GraphStateException;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import static io.github.supervisorgraph.graph.StateGraph.END;
import static io.github.supervisorgraph.graph.StateGraph.START;
import static io.github.supervisorgraph.graph.SupervisorGraphs.FINISH;
import static io.github.supervisorgraph.graph.SupervisorGraphs.ROUTER;
import static io.github.supervisorgraph.graph.SupervisorGraphs.WORKER;
import static io.github.supervisorgraph.graph.SupervisorGraphs.alwaysWorker;
import static io.github.supervisorgraph.graph.SupervisorGraphs.messagesSchema;
import static io.github.supervisorgraph.graph.SupervisorGraphs.replyDone;
import static io.github.supervisorgraph.graph.action.AsyncEdgeAction.edge_async;
import static org.junit.jupiter.api.Assertions.*;

class StateGraphTest {

	private StateGraph graph() {
		return new StateGraph("test", messagesSchema());
	}

	@Test
	void supervisorGraphCompiles() throws Exception {
		CompiledGraph compiled = SupervisorGraphs.supervisor().compile();

		assertEquals(ROUTER, compiled.getEntryPoint());
		assertEquals("supervisor", compiled.getGraphName());
		assertTrue(compiled.getNode(ROUTER).orElseThrow().isRouter());
		assertEquals(Set.of(WORKER, FINISH), compiled.getEdge(ROUTER).orElseThrow().target().value().options());
	}

	@Test
	void duplicateNodeIdIsRejected() throws Exception {
		StateGraph graph = graph().addNode(WORKER, replyDone());

		GraphStateException ex = assertThrows(GraphStateException.class, () -> graph.addNode(WORKER, replyDone()));
		assertEquals("node with id: Worker already exist!", ex.getMessage());
		assertThrows(GraphStateException.class, () -> graph.addRouter(WORKER, Set.of("a"), alwaysWorker()));
	}

	@Test
	void reservedAndBlankIdsAreRejected() {
		StateGraph graph = graph();

		assertThrows(GraphStateException.class, () -> graph.addNode(END, replyDone()));
		assertThrows(GraphStateException.class, () -> graph.addNode(START, replyDone()));
		assertThrows(GraphStateException.class, () -> graph.addNode("__private", replyDone()));
		assertThrows(GraphStateException.class, () -> graph.addNode(" ", replyDone()));
	}

	@Test
	void routerNeedsOptions() {
		GraphStateException ex = assertThrows(GraphStateException.class,
				() -> graph().addRouter(ROUTER, Set.of(), alwaysWorker()));

		assertTrue(ex.getMessage().contains("empty option set"));
	}

	@Test
	void nodeCannotHaveTwoOutgoingEdges() throws Exception {
		StateGraph graph = graph().addNode(WORKER, replyDone()).addEdge(WORKER, END);

		assertThrows(GraphStateException.class, () -> graph.addEdge(WORKER, WORKER));
		assertThrows(GraphStateException.class,
				() -> graph.addConditionalEdges(WORKER, edge_async(state -> "x"), Set.of("x"), Map.of("x", END)));
	}

	@Test
	void entryPointCanBeSetOnce() throws Exception {
		StateGraph graph = graph().setEntryPoint(WORKER);

		GraphStateException ex = assertThrows(GraphStateException.class, () -> graph.setEntryPoint(ROUTER));
		assertEquals("entryPoint already set to 'Worker'!", ex.getMessage());
	}

	@Test
	void endHasNoOutgoingEdges() {
		assertThrows(GraphStateException.class, () -> graph().addEdge(END, WORKER));
	}

	@Test
	void entryPointMustBeStatic() {
		assertThrows(GraphStateException.class, () -> graph().addConditionalEdges(START, Map.of("a", WORKER)));
	}

	@Test
	void missingEntryPointFailsCompile() throws Exception {
		StateGraph graph = graph().addNode(WORKER, replyDone()).addEdge(WORKER, END);

		GraphStateException ex = assertThrows(GraphStateException.class, graph::compile);
		assertEquals("missing Entry Point", ex.getMessage());
	}

	@Test
	void entryPointMustBeRegistered() throws Exception {
		StateGraph graph = graph().setEntryPoint("Ghost");

		GraphStateException ex = assertThrows(GraphStateException.class, graph::compile);
		assertEquals("entryPoint: Ghost does not exist!", ex.getMessage());
	}

	@Test
	void entryPointCannotBeEnd() throws Exception {
		assertThrows(GraphStateException.class, graph().setEntryPoint(END)::compile);
	}

	@Test
	void dispatchMapMissingDeclaredLabelFailsCompile() throws Exception {
		StateGraph graph = graph().addRouter(ROUTER, Set.of(WORKER, FINISH), alwaysWorker())
			.addNode(WORKER, replyDone())
			.addEdge(WORKER, ROUTER)
			.addConditionalEdges(ROUTER, Map.of(WORKER, WORKER))
			.setEntryPoint(ROUTER);

		GraphStateException ex = assertThrows(GraphStateException.class, graph::compile);
		assertTrue(ex.getMessage().contains("missing labels: [FINISH]"), ex.getMessage());
		assertTrue(ex.getMessage().contains("unexpected labels: []"), ex.getMessage());
	}

	@Test
	void dispatchMapWithExtraLabelFailsCompile() throws Exception {
		StateGraph graph = graph().addRouter(ROUTER, Set.of(WORKER, FINISH), alwaysWorker())
			.addNode(WORKER, replyDone())
			.addEdge(WORKER, ROUTER)
			.addConditionalEdges(ROUTER, Map.of(WORKER, WORKER, FINISH, END, "RETRY", WORKER))
			.setEntryPoint(ROUTER);

		GraphStateException ex = assertThrows(GraphStateException.class, graph::compile);
		assertTrue(ex.getMessage().contains("unexpected labels: [RETRY]"), ex.getMessage());
	}

	@Test
	void explicitOptionsMustMatchRouterOptions() throws Exception {
		StateGraph graph = graph().addRouter(ROUTER, Set.of(WORKER, FINISH), alwaysWorker())
			.addNode(WORKER, replyDone())
			.addEdge(WORKER, ROUTER)
			.addConditionalEdges(ROUTER, Set.of(WORKER), Map.of(WORKER, WORKER))
			.setEntryPoint(ROUTER);

		GraphStateException ex = assertThrows(GraphStateException.class, graph::compile);
		assertTrue(ex.getMessage().contains("differ from the router options"), ex.getMessage());
	}

	@Test
	void explicitOptionsMustMatchDispatchMap() throws Exception {
		StateGraph graph = graph().addNode(WORKER, replyDone())
			.addConditionalEdges(WORKER, edge_async(state -> "again"), Set.of("again", "stop"),
					Map.of("again", WORKER))
			.setEntryPoint(WORKER);

		GraphStateException ex = assertThrows(GraphStateException.class, graph::compile);
		assertTrue(ex.getMessage().contains("missing labels: [stop]"), ex.getMessage());
	}

	@Test
	void edgeToUnregisteredNodeFailsCompile() throws Exception {
		StateGraph graph = graph().addNode(WORKER, replyDone()).addEdge(WORKER, "Ghost").setEntryPoint(WORKER);

		GraphStateException ex = assertThrows(GraphStateException.class, graph::compile);
		assertEquals("edge sourceId 'Ghost' refers to undefined node!", ex.getMessage());
	}

	@Test
	void edgeFromUnregisteredNodeFailsCompile() throws Exception {
		StateGraph graph = graph().addNode(WORKER, replyDone())
			.addEdge(WORKER, END)
			.addEdge("Ghost", WORKER)
			.setEntryPoint(WORKER);

		assertThrows(GraphStateException.class, graph::compile);
	}

	@Test
	void dispatchToUnregisteredNodeFailsCompile() throws Exception {
		StateGraph graph = graph().addRouter(ROUTER, Set.of(WORKER, FINISH), alwaysWorker())
			.addConditionalEdges(ROUTER, Map.of(WORKER, "Ghost", FINISH, END))
			.setEntryPoint(ROUTER);

		GraphStateException ex = assertThrows(GraphStateException.class, graph::compile);
		assertEquals("edge mapping for sourceId: Router contains a not existent nodeId Ghost!", ex.getMessage());
	}

	@Test
	void everyNodeNeedsAnOutgoingEdge() throws Exception {
		StateGraph graph = graph().addNode(WORKER, replyDone()).addNode("Idle", replyDone()).addEdge(WORKER, END)
			.setEntryPoint(WORKER);

		GraphStateException ex = assertThrows(GraphStateException.class, graph::compile);
		assertEquals("node 'Idle' has no outgoing edge!", ex.getMessage());
	}

	@Test
	void routerCannotHaveStaticEdge() throws Exception {
		StateGraph graph = graph().addRouter(ROUTER, Set.of(WORKER), alwaysWorker())
			.addNode(WORKER, replyDone())
			.addEdge(ROUTER, WORKER)
			.addEdge(WORKER, END)
			.setEntryPoint(ROUTER);

		assertThrows(GraphStateException.class, graph::compile);
	}

	@Test
	void conditionalEdgeFromWorkerNeedsDecision() throws Exception {
		StateGraph graph = graph().addNode(WORKER, replyDone())
			.addConditionalEdges(WORKER, Map.of("again", WORKER, "stop", END))
			.setEntryPoint(WORKER);

		GraphStateException ex = assertThrows(GraphStateException.class, graph::compile);
		assertTrue(ex.getMessage().contains("has no decision function"), ex.getMessage());
	}

	@Test
	void routerEdgeCannotCarryItsOwnDecision() throws Exception {
		StateGraph graph = graph().addRouter(ROUTER, Set.of(FINISH), alwaysWorker())
			.addConditionalEdges(ROUTER, edge_async(state -> FINISH), Set.of(FINISH), Map.of(FINISH, END))
			.setEntryPoint(ROUTER);

		assertThrows(GraphStateException.class, graph::compile);
	}

	@Test
	void compiledGraphIsIsolatedFromLaterChanges() throws Exception {
		StateGraph graph = SupervisorGraphs.supervisor();
		CompiledGraph compiled = graph.compile();

		graph.addNode("Late", replyDone());

		assertTrue(compiled.getNode("Late").isEmpty());
		assertThrows(GraphStateException.class, graph::compile);
	}

	enum Route {

		WORK, STOP

	}

	@Test
	void enumRouterDerivesOptionsFromConstants() throws Exception {
		CompiledGraph compiled = graph()
			.addRouter(ROUTER, Route.class, state -> state.value("messages").isPresent() ? Route.STOP : Route.WORK)
			.addNode(WORKER, replyDone())
			.addEdge(WORKER, ROUTER)
			.addConditionalEdges(ROUTER, Route.class, Map.of(Route.WORK, WORKER, Route.STOP, END))
			.setEntryPoint(ROUTER)
			.compile();

		assertEquals(Set.of("WORK", "STOP"), compiled.getEdge(ROUTER).orElseThrow().target().value().options());
		OverAllState state = compiled.invoke(Map.of()).orElseThrow();
		assertEquals(java.util.List.of("done"), state.value("messages").orElseThrow());
	}

	@Test
	void nullLabelsAreRejectedAsConfigurationErrors() throws Exception {
		Set<String> options = new HashSet<>(Set.of(WORKER));
		options.add(null);
		assertThrows(GraphStateException.class, () -> graph().addRouter(ROUTER, options, alwaysWorker()));

		StateGraph graph = graph().addRouter(ROUTER, Set.of(WORKER, FINISH), alwaysWorker());
		Map<String, String> mappings = new HashMap<>(Map.of(WORKER, WORKER, FINISH, END));
		mappings.put(null, END);
		GraphStateException ex = assertThrows(GraphStateException.class,
				() -> graph.addConditionalEdges(ROUTER, mappings));
		assertEquals("node 'Router' declares a null label!", ex.getMessage());

		assertThrows(GraphStateException.class, () -> graph().addNode(WORKER, replyDone())
			.addConditionalEdges(WORKER, edge_async(state -> "stop"), options, Map.of("stop", END)));

		Map<Route, String> byRoute = new HashMap<>(Map.of(Route.WORK, WORKER));
		byRoute.put(null, END);
		StateGraph enumGraph = graph().addRouter(ROUTER, Route.class, state -> Route.STOP);
		assertThrows(GraphStateException.class, () -> enumGraph.addConditionalEdges(ROUTER, Route.class, byRoute));
	}

	@Test
	void enumDispatchMustCoverEveryConstant() throws Exception {
		StateGraph graph = graph().addRouter(ROUTER, Route.class, state -> Route.STOP)
			.addConditionalEdges(ROUTER, Route.class, Map.of(Route.STOP, END))
			.setEntryPoint(ROUTER);

		GraphStateException ex = assertThrows(GraphStateException.class, graph::compile);
		assertTrue(ex.getMessage().contains("missing labels: [WORK]"), ex.getMessage());
	}

}
