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

import io.github.supervisorgraph.graph.executor.MainGraphExecutor;
import io.github.supervisorgraph.graph.internal.edge.Edge;
import io.github.supervisorgraph.graph.internal.node.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static io.github.supervisorgraph.graph.StateGraph.START;

/**
 * A validated, frozen {@link StateGraph}.
 * <p>
 * A compiled graph holds no per-run state: every call to {@link #start}, {@link #invoke}
 * or {@link #stream} begins a fresh run with its own snapshot lineage and step counter,
 * so one instance can serve any number of concurrent runs.
 */
public class CompiledGraph {

	private static final Logger log = LoggerFactory.getLogger(CompiledGraph.class);

	public final StateGraph stateGraph;

	public final CompileConfig compileConfig;

	private final Map<String, Node> nodes;

	private final Map<String, Edge> edges;

	private final List<Node> nodeList;

	private final List<Edge> edgeList;

	private final Map<String, KeyStrategy> keyStrategyMap;

	private final String entryPoint;

	private final String graphName;

	private final MainGraphExecutor mainGraphExecutor = new MainGraphExecutor();

	/**
	 * Freezes a graph that already passed {@link StateGraph#validateGraph()}.
	 */
	protected CompiledGraph(StateGraph stateGraph, CompileConfig compileConfig) {
		this.stateGraph = stateGraph;
		this.compileConfig = compileConfig;

		Map<String, Node> nodeMap = new LinkedHashMap<>();
		for (Node node : stateGraph.nodes.elements) {
			nodeMap.put(node.id(), node);
		}
		this.nodes = Collections.unmodifiableMap(nodeMap);
		this.nodeList = List.copyOf(nodeMap.values());

		Map<String, Edge> edgeMap = new LinkedHashMap<>();
		List<Edge> resolvedEdges = new ArrayList<>();
		for (Edge edge : stateGraph.edges.elements) {
			Edge resolved = edge.resolve(stateGraph.nodes);
			resolvedEdges.add(resolved);
			if (!START.equals(resolved.sourceId())) {
				edgeMap.put(resolved.sourceId(), resolved);
			}
		}
		this.edges = Collections.unmodifiableMap(edgeMap);
		this.edgeList = List.copyOf(resolvedEdges);
		this.entryPoint = stateGraph.edges.edgeBySourceId(START)
			.map(edge -> edge.target().id())
			.orElseThrow(() -> new IllegalStateException("graph has no entry point"));

		this.keyStrategyMap = Collections
			.unmodifiableMap(new LinkedHashMap<>(stateGraph.getKeyStrategyFactory().apply()));
		this.graphName = compileConfig.graphName().orElse(stateGraph.getName());

		log.debug("compiled graph '{}' with {} node(s), entry point '{}'", graphName, nodes.size(), entryPoint);
	}

	public Optional<Node> getNode(String nodeId) {
		return Optional.ofNullable(nodes.get(nodeId));
	}

	public Optional<Edge> getEdge(String sourceId) {
		return Optional.ofNullable(edges.get(sourceId));
	}

	public String getEntryPoint() {
		return entryPoint;
	}

	public Map<String, KeyStrategy> getKeyStrategyMap() {
		return keyStrategyMap;
	}

	public String getGraphName() {
		return graphName;
	}

	/**
	 * Starts a run. No node runs until the first call to {@link GraphRun#next()}.
	 * @param inputs the initial state, validated against the schema
	 * @param config the run settings
	 * @return the run, to be iterated and closed by the caller
	 * @throws io.github.supervisorgraph.graph.exception.InvalidUpdateException if the
	 * initial state does not fit the schema
	 */
	public GraphRun start(Map<String, Object> inputs, RunnableConfig config) {
		Objects.requireNonNull(config, "config cannot be null");
		OverAllState initialState = OverAllState.initialize(inputs, keyStrategyMap);
		return new GraphRun(new GraphRunnerContext(initialState, config, this), mainGraphExecutor);
	}

	public GraphRun start(Map<String, Object> inputs) {
		return start(inputs, RunnableConfig.builder().build());
	}

	/**
	 * Runs the graph to completion on the calling thread.
	 * @return the final snapshot
	 * @throws io.github.supervisorgraph.graph.exception.GraphRunnerException if the run
	 * failed
	 */
	public Optional<OverAllState> invoke(Map<String, Object> inputs, RunnableConfig config) {
		try (GraphRun run = start(inputs, config)) {
			return run.toCompletion();
		}
	}

	public Optional<OverAllState> invoke(Map<String, Object> inputs) {
		return invoke(inputs, RunnableConfig.builder().build());
	}

	/**
	 * Publishes the steps of a new run per subscription. The run executes on the
	 * subscribing thread as elements are requested; cancelling the subscription
	 * cancels the run.
	 */
	public Flux<NodeOutput> stream(Map<String, Object> inputs, RunnableConfig config) {
		return Flux.using(() -> start(inputs, config), CompiledGraph::steps, GraphRun::close);
	}

	private static Flux<NodeOutput> steps(GraphRun run) {
		Iterable<NodeOutput> steps = () -> run;
		return Flux.fromIterable(steps);
	}

	public Flux<NodeOutput> stream(Map<String, Object> inputs) {
		return Flux.defer(() -> stream(inputs, RunnableConfig.builder().build()));
	}

	/**
	 * Renders the compiled graph.
	 * @param type the diagram language
	 * @param title the diagram title
	 * @param printConditionalEdges whether to draw conditional edges through a decision
	 * vertex
	 */
	public GraphRepresentation getGraph(GraphRepresentation.Type type, String title, boolean printConditionalEdges) {
		String content = type.generator.generate(nodeList, edgeList, title, printConditionalEdges);
		return new GraphRepresentation(type, content);
	}

	public GraphRepresentation getGraph(GraphRepresentation.Type type, String title) {
		return getGraph(type, title, true);
	}

}
