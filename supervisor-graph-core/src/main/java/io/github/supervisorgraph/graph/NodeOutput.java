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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;

/**
 * One completed step of a run: the node that ran, the partial update it returned, the
 * snapshot after merging that update and, for a router, the label it chose.
 */
public final class NodeOutput {

	private final int step;

	private final String node;

	private final Map<String, Object> update;

	private final OverAllState state;

	private final String route;

	private NodeOutput(int step, String node, Map<String, Object> update, OverAllState state, String route) {
		this.step = step;
		this.node = Objects.requireNonNull(node, "node cannot be null");
		this.update = update == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(update));
		this.state = Objects.requireNonNull(state, "state cannot be null");
		this.route = route;
	}

	public static NodeOutput of(int step, String node, Map<String, Object> update, OverAllState state) {
		return new NodeOutput(step, node, update, state, null);
	}

	public static NodeOutput of(int step, String node, Map<String, Object> update, OverAllState state,
			String route) {
		return new NodeOutput(step, node, update, state, route);
	}

	/**
	 * @return the 1-based position of this step in its run
	 */
	public int step() {
		return step;
	}

	public String node() {
		return node;
	}

	public Map<String, Object> update() {
		return update;
	}

	public OverAllState state() {
		return state;
	}

	/**
	 * @return the label chosen by a router step, empty for a worker step
	 */
	public Optional<String> route() {
		return Optional.ofNullable(route);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (!(o instanceof NodeOutput that))
			return false;
		return step == that.step && node.equals(that.node) && update.equals(that.update)
				&& state.equals(that.state) && Objects.equals(route, that.route);
	}

	@Override
	public int hashCode() {
		return Objects.hash(step, node, update, state, route);
	}

	@Override
	public String toString() {
		return format("NodeOutput{step=%d, node=%s, route=%s, update=%s, state=%s}", step, node, route, update,
				state);
	}

}
