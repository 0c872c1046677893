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

/**
 * Target of an edge: either a fixed node id or a conditional dispatch.
 *
 * @param id The target node id of a static edge.
 * @param value The condition of a conditional edge.
 */
public record EdgeValue(String id, EdgeCondition value) {

	public EdgeValue(String id) {
		this(id, null);
	}

	public EdgeValue(EdgeCondition value) {
		this(null, value);
	}

	public boolean isConditional() {
		return value != null;
	}

}
