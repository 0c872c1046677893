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

/**
 * The run used up its step budget without reaching {@code END}.
 */
public class RecursionLimitExceededException extends GraphRunnerException {

	private final int maxSteps;

	public RecursionLimitExceededException(String message, int maxSteps, String nodeId, List<NodeOutput> history) {
		super(message, nodeId, history, null);
		this.maxSteps = maxSteps;
	}

	public int maxSteps() {
		return maxSteps;
	}

}
