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
package io.github.supervisorgraph.graph.exception;

import io.github.supervisorgraph.graph.NodeOutput;

import java.util.List;
import java.util.Set;

/**
 * An update (or an initial state) referenced fields outside the declared schema, or
 * carried a value the field's reducer cannot merge.
 */
public class InvalidUpdateException extends GraphRunnerException {

	private final Set<String> keys;

	public InvalidUpdateException(String message, Set<String> keys) {
		this(message, keys, null, List.of());
	}

	public InvalidUpdateException(String message, Set<String> keys, String nodeId, List<NodeOutput> history) {
		super(message, nodeId, history, null);
		this.keys = Set.copyOf(keys);
	}

	/**
	 * @return the offending state keys
	 */
	public Set<String> keys() {
		return keys;
	}

	/**
	 * Binds this failure to the node that produced the update.
	 * @param nodeId the node whose update was rejected
	 * @param history the steps completed so far
	 * @return a new exception with the same message and keys
	 */
	public InvalidUpdateException withContext(String nodeId, List<NodeOutput> history) {
		return new InvalidUpdateException(getMessage(), keys, nodeId, history);
	}

}
