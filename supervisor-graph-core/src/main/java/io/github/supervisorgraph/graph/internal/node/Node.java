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
package io.github.supervisorgraph.graph.internal.node;

import io.github.supervisorgraph.graph.StateGraph;
import io.github.supervisorgraph.graph.action.AsyncNodeAction;
import io.github.supervisorgraph.graph.exception.Errors;
import io.github.supervisorgraph.graph.exception.GraphStateException;

import java.util.Objects;

import static java.lang.String.format;

/**
 * A worker node: a unique identifier bound to the action that computes its state update.
 */
public class Node {

	public static final String PRIVATE_PREFIX = "__";

	private final String id;

	private final AsyncNodeAction action;

	public Node(String id, AsyncNodeAction action) {
		this.id = id;
		this.action = action;
	}

	/**
	 * Rejects blank ids and ids in the reserved {@value #PRIVATE_PREFIX} namespace.
	 * @throws GraphStateException if the id cannot be registered
	 */
	public void validate() throws GraphStateException {
		if (id == null || id.isBlank()) {
			throw Errors.invalidNodeIdentifier.exception("blank node id");
		}
		if (Objects.equals(id, StateGraph.END) || Objects.equals(id, StateGraph.START)) {
			throw Errors.invalidNodeIdentifier.exception(id);
		}
		if (id.startsWith(PRIVATE_PREFIX)) {
			throw Errors.invalidNodeIdentifier.exception(format("id that start with %s", PRIVATE_PREFIX));
		}
	}

	public String id() {
		return id;
	}

	/**
	 * @return the worker action, {@code null} for a router
	 */
	public AsyncNodeAction action() {
		return action;
	}

	public boolean isRouter() {
		return false;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (o == null)
			return false;
		if (o instanceof Node node) {
			return Objects.equals(id, node.id);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return Objects.hash(id);
	}

	@Override
	public String toString() {
		return format("Node(%s,%s)", id, action != null ? "action" : "null");
	}

}
