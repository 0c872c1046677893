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

import io.github.supervisorgraph.graph.internal.edge.Edge;
import io.github.supervisorgraph.graph.internal.edge.EdgeCondition;
import io.github.supervisorgraph.graph.internal.node.Node;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Template for rendering a graph in a textual diagram language. Subclasses supply the
 * syntax; this class decides what is drawn and in which order, so that the output of a
 * given graph is stable.
 */
public abstract class DiagramGenerator {

	public enum CallStyle {

		DEFAULT, CONDITIONAL

	}

	public record Context(StringBuilder sb, String title, boolean printConditionalEdges) {

		static Context of(String title, boolean printConditionalEdges) {
			return new Context(new StringBuilder(), title, printConditionalEdges);
		}

		/**
		 * Converts the title to snake_case format.
		 * @return an {@code Optional} containing the title in snake_case format, or an
		 * empty {@code Optional} if the title is not set
		 */
		public Optional<String> titleToSnakeCase() {
			return Optional.ofNullable(title).map(v -> v.replaceAll("[^a-zA-Z0-9]", "_"));
		}

		@Override
		public String toString() {
			return sb.toString();
		}

	}

	protected abstract void appendHeader(Context ctx);

	protected abstract void appendFooter(Context ctx);

	protected abstract void call(Context ctx, String from, String to, CallStyle style);

	protected abstract void call(Context ctx, String from, String to, String description, CallStyle style);

	protected abstract void declareRouter(Context ctx, String name);

	protected abstract void declareNode(Context ctx, String name);

	protected abstract void declareConditionalEdge(Context ctx, int ordinal);

	/**
	 * Generates a textual representation of a graph.
	 * @param nodes the nodes, in registration order
	 * @param edges the edges, in declaration order
	 * @param title the diagram title
	 * @param printConditionalEdges {@code true} to route every conditional edge through
	 * a decision vertex, {@code false} to draw labelled edges straight to the targets
	 * @return the diagram source
	 */
	public final String generate(List<Node> nodes, List<Edge> edges, String title, boolean printConditionalEdges) {
		Context ctx = Context.of(title, printConditionalEdges);

		appendHeader(ctx);

		for (Node node : nodes) {
			if (node.isRouter()) {
				declareRouter(ctx, node.id());
			}
			else {
				declareNode(ctx, node.id());
			}
		}

		int conditionalEdgeCount = 0;
		for (Edge edge : edges) {
			if (edge.isConditional() && printConditionalEdges) {
				declareConditionalEdge(ctx, conditionalEdgeCount++);
			}
		}

		conditionalEdgeCount = 0;
		for (Edge edge : edges) {
			if (!edge.isConditional()) {
				call(ctx, edge.sourceId(), edge.target().id(), CallStyle.DEFAULT);
				continue;
			}
			EdgeCondition condition = edge.target().value();
			Map<String, String> mappings = new TreeMap<>(condition.mappings());
			if (printConditionalEdges) {
				String conditionName = "condition" + conditionalEdgeCount++;
				call(ctx, edge.sourceId(), conditionName, CallStyle.DEFAULT);
				mappings.forEach((label, target) -> call(ctx, conditionName, target, label, CallStyle.CONDITIONAL));
			}
			else {
				mappings.forEach((label, target) -> call(ctx, edge.sourceId(), target, label, CallStyle.CONDITIONAL));
			}
		}

		appendFooter(ctx);

		return ctx.toString();
	}

}
