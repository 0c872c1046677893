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
package io.github.supervisorgraph.graph.internal.edge;

import io.github.supervisorgraph.graph.StateGraph;
import io.github.supervisorgraph.graph.exception.Errors;
import io.github.supervisorgraph.graph.exception.GraphStateException;
import io.github.supervisorgraph.graph.internal.node.Node;
import io.github.supervisorgraph.graph.internal.node.RouterNode;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

import static io.github.supervisorgraph.graph.StateGraph.END;
import static io.github.supervisorgraph.graph.StateGraph.START;

/**
 * Represents the single outgoing edge of a node.
 *
 * @param sourceId The ID of the source node.
 * @param target The target value associated with the edge.
 */
public record Edge(String sourceId, EdgeValue target) {

	/**
	 * Checks that every node the edge mentions exists and that a conditional dispatch
	 * covers exactly its declared label set.
	 * @param nodes the registered nodes
	 * @throws GraphStateException on the first inconsistency found
	 */
	public void validate(StateGraph.Nodes nodes) throws GraphStateException {
		if (!Objects.equals(sourceId, START) && !nodes.anyMatchById(sourceId)) {
			throw Errors.missingNodeReferencedByEdge.exception(sourceId);
		}
		Optional<RouterNode> router = nodes.findById(sourceId)
			.filter(Node::isRouter)
			.map(RouterNode.class::cast);

		if (target.id() != null) {
			if (!Objects.equals(target.id(), END) && !nodes.anyMatchById(target.id())) {
				throw Errors.missingNodeReferencedByEdge.exception(target.id());
			}
			if (router.isPresent()) {
				throw Errors.routerRequiresConditionalEdge.exception(sourceId, target.id());
			}
			return;
		}
		if (target.value() == null) {
			throw Errors.invalidEdgeTarget.exception(sourceId);
		}

		EdgeCondition condition = target.value();
		if (condition.mappings().isEmpty()) {
			throw Errors.emptyEdgeMapping.exception(sourceId);
		}
		for (String nodeId : condition.mappings().values()) {
			if (!Objects.equals(nodeId, END) && !nodes.anyMatchById(nodeId)) {
				throw Errors.missingNodeInEdgeMapping.exception(sourceId, nodeId);
			}
		}

		if (router.isPresent()) {
			if (condition.action() != null) {
				throw Errors.routerDecisionConflict.exception(sourceId);
			}
			Set<String> routerOptions = router.get().options();
			if (condition.options() != null && !condition.options().equals(routerOptions)) {
				throw Errors.routerOptionsMismatch.exception(new TreeSet<>(condition.options()), sourceId,
						new TreeSet<>(routerOptions));
			}
			checkDispatch(routerOptions);
		}
		else {
			if (condition.action() == null || condition.options() == null) {
				throw Errors.missingEdgeDecision.exception(sourceId, sourceId);
			}
			if (condition.options().isEmpty()) {
				throw Errors.emptyOptionSet.exception(sourceId);
			}
			checkDispatch(condition.options());
		}
	}

	private void checkDispatch(Set<String> options) throws GraphStateException {
		Set<String> missing = new TreeSet<>(options);
		missing.removeAll(target.value().mappings().keySet());
		Set<String> unexpected = new TreeSet<>(target.value().mappings().keySet());
		unexpected.removeAll(options);
		if (!missing.isEmpty() || !unexpected.isEmpty()) {
			throw Errors.dispatchMappingMismatch.exception(sourceId, new TreeSet<>(options), missing, unexpected);
		}
	}

	/**
	 * Returns a copy of this edge whose conditional options are spelled out, taking
	 * them from the source router when the edge did not declare them. Call it only on
	 * an edge that passed {@link #validate(StateGraph.Nodes)}.
	 * @param nodes the registered nodes
	 * @return the resolved edge
	 */
	public Edge resolve(StateGraph.Nodes nodes) {
		if (target.value() == null || target.value().options() != null) {
			return this;
		}
		Set<String> options = nodes.findById(sourceId)
			.filter(Node::isRouter)
			.map(node -> ((RouterNode) node).options())
			.orElseThrow(() -> new IllegalStateException("edge from " + sourceId + " has no option set"));
		return new Edge(sourceId, new EdgeValue(target.value().withOptions(options)));
	}

	public boolean isConditional() {
		return target.isConditional();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (o == null || getClass() != o.getClass())
			return false;
		Edge edge = (Edge) o;
		return Objects.equals(sourceId, edge.sourceId);
	}

	@Override
	public int hashCode() {
		return Objects.hash(sourceId);
	}

}
