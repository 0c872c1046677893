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

import io.github.supervisorgraph.graph.action.AsyncEdgeAction;
import io.github.supervisorgraph.graph.action.AsyncNodeAction;
import io.github.supervisorgraph.graph.action.AsyncRouterAction;
import io.github.supervisorgraph.graph.exception.Errors;
import io.github.supervisorgraph.graph.exception.GraphStateException;
import io.github.supervisorgraph.graph.internal.edge.Edge;
import io.github.supervisorgraph.graph.internal.edge.EdgeCondition;
import io.github.supervisorgraph.graph.internal.edge.EdgeValue;
import io.github.supervisorgraph.graph.internal.node.Node;
import io.github.supervisorgraph.graph.internal.node.RouterNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

import static io.github.supervisorgraph.graph.action.AsyncRouterAction.router_async;

/**
 * Builder of a supervisor graph: worker nodes, router nodes and the edges between them.
 * <p>
 * Registration errors (duplicates, reserved ids) are reported as soon as they happen;
 * structural errors (dangling references, dispatch tables that do not cover a router's
 * options, nodes without an outgoing edge) are reported by {@link #compile()}. A
 * successful compilation freezes a copy of the graph, so the builder can be discarded or
 * extended without affecting the returned {@link CompiledGraph}.
 */
public class StateGraph {

	/**
	 * Terminal sentinel. Routing to it completes the run.
	 */
	public static final String END = "__END__";

	/**
	 * Virtual source of the entry edge.
	 */
	public static final String START = "__START__";

	public static final String ERROR = "__ERROR__";

	public static final String NODE_BEFORE = "__NODE_BEFORE__";

	public static final String NODE_AFTER = "__NODE_AFTER__";

	final Nodes nodes = new Nodes();

	final Edges edges = new Edges();

	private final String name;

	private final KeyStrategyFactory keyStrategyFactory;

	public static class Nodes {

		public final Set<Node> elements = new LinkedHashSet<>();

		public boolean anyMatchById(String id) {
			return elements.stream().anyMatch(n -> Objects.equals(n.id(), id));
		}

		public Optional<Node> findById(String id) {
			return elements.stream().filter(n -> Objects.equals(n.id(), id)).findFirst();
		}

	}

	public static class Edges {

		public final List<Edge> elements = new ArrayList<>();

		public Optional<Edge> edgeBySourceId(String sourceId) {
			return elements.stream().filter(e -> Objects.equals(e.sourceId(), sourceId)).findFirst();
		}

	}

	public StateGraph(String name, KeyStrategyFactory keyStrategyFactory) {
		this.name = name;
		this.keyStrategyFactory = Objects.requireNonNull(keyStrategyFactory, "keyStrategyFactory cannot be null");
	}

	public StateGraph(KeyStrategyFactory keyStrategyFactory) {
		this(null, keyStrategyFactory);
	}

	public String getName() {
		return name;
	}

	public KeyStrategyFactory getKeyStrategyFactory() {
		return keyStrategyFactory;
	}

	/**
	 * Registers a worker.
	 * @param id the unique node id
	 * @param action the worker logic
	 * @return this
	 * @throws GraphStateException if the id is invalid or already registered
	 */
	public StateGraph addNode(String id, AsyncNodeAction action) throws GraphStateException {
		Objects.requireNonNull(action, "action cannot be null");
		return register(new Node(id, action));
	}

	/**
	 * Registers a router whose labels are drawn from {@code options}.
	 * @param id the unique node id
	 * @param options the closed set of labels the router may return
	 * @param router the decision policy
	 * @return this
	 * @throws GraphStateException if the id is invalid or already registered, or the
	 * option set is empty
	 */
	public StateGraph addRouter(String id, Set<String> options, AsyncRouterAction router)
			throws GraphStateException {
		Objects.requireNonNull(router, "router cannot be null");
		return register(new RouterNode(id, options, router));
	}

	/**
	 * Registers a router whose option set is the constants of {@code labels}.
	 */
	public <E extends Enum<E>> StateGraph addRouter(String id, Class<E> labels, Function<OverAllState, E> decision)
			throws GraphStateException {
		Objects.requireNonNull(decision, "decision cannot be null");
		return addRouter(id, enumLabels(labels), router_async(state -> {
			E label = decision.apply(state);
			return label == null ? null : label.name();
		}));
	}

	private StateGraph register(Node node) throws GraphStateException {
		node.validate();
		if (nodes.anyMatchById(node.id())) {
			throw Errors.duplicateNodeError.exception(node.id());
		}
		nodes.elements.add(node);
		return this;
	}

	/**
	 * Adds a static edge.
	 * @param sourceId the source node, or {@link #START} for the entry edge
	 * @param targetId the target node, or {@link #END}
	 * @return this
	 * @throws GraphStateException if the source is {@link #END} or already has an
	 * outgoing edge
	 */
	public StateGraph addEdge(String sourceId, String targetId) throws GraphStateException {
		checkSource(sourceId);
		if (targetId == null || targetId.isBlank()) {
			throw Errors.invalidEdgeTarget.exception(sourceId);
		}
		edges.elements.add(new Edge(sourceId, new EdgeValue(targetId)));
		return this;
	}

	/**
	 * Same as {@code addEdge(START, nodeId)}.
	 */
	public StateGraph setEntryPoint(String nodeId) throws GraphStateException {
		return addEdge(START, nodeId);
	}

	/**
	 * Adds the conditional edge leaving a router. The router's label is looked up in
	 * {@code mappings}, whose key set must equal the router's option set.
	 */
	public StateGraph addConditionalEdges(String routerId, Map<String, String> mappings) throws GraphStateException {
		return addCondition(routerId, new EdgeCondition(null, null, copyMappings(routerId, mappings)));
	}

	/**
	 * Adds the conditional edge leaving a router, restating its option set.
	 */
	public StateGraph addConditionalEdges(String routerId, Set<String> options, Map<String, String> mappings)
			throws GraphStateException {
		return addCondition(routerId,
				new EdgeCondition(null, copyOptions(routerId, options), copyMappings(routerId, mappings)));
	}

	/**
	 * Adds the conditional edge leaving a router registered with an enum option set.
	 */
	public <E extends Enum<E>> StateGraph addConditionalEdges(String routerId, Class<E> labels,
			Map<E, String> mappings) throws GraphStateException {
		Objects.requireNonNull(mappings, "mappings cannot be null");
		if (mappings.keySet().stream().anyMatch(Objects::isNull)) {
			throw Errors.nullLabel.exception(routerId);
		}
		Map<String, String> byName = new LinkedHashMap<>();
		mappings.forEach((label, target) -> byName.put(label.name(), target));
		return addConditionalEdges(routerId, enumLabels(labels), byName);
	}

	/**
	 * Adds a conditional edge leaving a worker. {@code decision} runs on the snapshot
	 * produced by the worker's step and must return one of {@code options}.
	 */
	public StateGraph addConditionalEdges(String sourceId, AsyncEdgeAction decision, Set<String> options,
			Map<String, String> mappings) throws GraphStateException {
		Objects.requireNonNull(decision, "decision cannot be null");
		return addCondition(sourceId,
				new EdgeCondition(decision, copyOptions(sourceId, options), copyMappings(sourceId, mappings)));
	}

	private StateGraph addCondition(String sourceId, EdgeCondition condition) throws GraphStateException {
		if (Objects.equals(sourceId, START)) {
			throw Errors.conditionalEntryPoint.exception();
		}
		checkSource(sourceId);
		edges.elements.add(new Edge(sourceId, new EdgeValue(condition)));
		return this;
	}

	private void checkSource(String sourceId) throws GraphStateException {
		if (Objects.equals(sourceId, END)) {
			throw Errors.invalidEdgeIdentifier.exception();
		}
		if (sourceId == null || sourceId.isBlank()) {
			throw Errors.invalidNodeIdentifier.exception("blank node id");
		}
		if (edges.edgeBySourceId(sourceId).isPresent()) {
			if (Objects.equals(sourceId, START)) {
				throw Errors.duplicateEntryPoint.exception(edges.edgeBySourceId(START).get().target().id());
			}
			throw Errors.duplicateEdgeError.exception(sourceId);
		}
	}

	private static Set<String> copyOptions(String sourceId, Set<String> options) throws GraphStateException {
		if (options == null || options.isEmpty()) {
			throw Errors.emptyOptionSet.exception(sourceId);
		}
		if (options.stream().anyMatch(Objects::isNull)) {
			throw Errors.nullLabel.exception(sourceId);
		}
		return Collections.unmodifiableSet(new LinkedHashSet<>(options));
	}

	private static Map<String, String> copyMappings(String sourceId, Map<String, String> mappings)
			throws GraphStateException {
		if (mappings == null || mappings.isEmpty()) {
			throw Errors.emptyEdgeMapping.exception(sourceId);
		}
		if (mappings.keySet().stream().anyMatch(Objects::isNull)) {
			throw Errors.nullLabel.exception(sourceId);
		}
		return Collections.unmodifiableMap(new LinkedHashMap<>(mappings));
	}

	private static <E extends Enum<E>> Set<String> enumLabels(Class<E> labels) {
		Objects.requireNonNull(labels, "labels cannot be null");
		Set<String> names = new LinkedHashSet<>();
		EnumSet.allOf(labels).forEach(label -> names.add(label.name()));
		return names;
	}

	/**
	 * Runs every structural check on the graph.
	 * @throws GraphStateException on the first violation found
	 */
	void validateGraph() throws GraphStateException {
		var entryEdge = edges.edgeBySourceId(START).orElseThrow(Errors.missingEntryPoint::exception);
		String entryPoint = entryEdge.target().id();
		if (!nodes.anyMatchById(entryPoint)) {
			throw Errors.entryPointNotExist.exception(entryPoint);
		}

		for (Edge edge : edges.elements) {
			edge.validate(nodes);
		}

		for (Node node : nodes.elements) {
			if (edges.edgeBySourceId(node.id()).isEmpty()) {
				throw Errors.missingOutgoingEdge.exception(node.id());
			}
		}
	}

	public CompiledGraph compile() throws GraphStateException {
		return compile(CompileConfig.builder().build());
	}

	/**
	 * Validates the graph and freezes it.
	 * @param config the compile configuration
	 * @return a graph that can be run any number of times, concurrently
	 * @throws GraphStateException if the graph is inconsistent
	 */
	public CompiledGraph compile(CompileConfig config) throws GraphStateException {
		Objects.requireNonNull(config, "config cannot be null");
		validateGraph();
		return new CompiledGraph(this, config);
	}

	/**
	 * Renders the graph as it is currently declared, without validating it.
	 */
	public GraphRepresentation getGraph(GraphRepresentation.Type type, String title, boolean printConditionalEdges) {
		String content = type.generator.generate(List.copyOf(nodes.elements), List.copyOf(edges.elements), title,
				printConditionalEdges);
		return new GraphRepresentation(type, content);
	}

	public GraphRepresentation getGraph(GraphRepresentation.Type type, String title) {
		return getGraph(type, title, true);
	}

}
