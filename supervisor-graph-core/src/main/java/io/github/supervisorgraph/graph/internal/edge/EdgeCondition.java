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

import io.github.supervisorgraph.graph.action.AsyncEdgeAction;

import java.util.Map;
import java.util.Set;

/**
 * Dispatch table of a conditional edge.
 *
 * @param action the decision function, {@code null} when the edge leaves a router and
 * dispatches on the router's own label
 * @param options the declared label set, {@code null} to inherit the router's options
 * @param mappings label to target node id (or {@code END})
 */
public record EdgeCondition(AsyncEdgeAction action, Set<String> options, Map<String, String> mappings) {

	public EdgeCondition withOptions(Set<String> options) {
		return new EdgeCondition(action, options, mappings);
	}

}
