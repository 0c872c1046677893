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
import java.util.Optional;

/**
 * Base class of every failure that aborts a run. Besides the message, it carries the
 * node that was about to run or was running, and the steps completed before the
 * failure, so callers can diagnose what happened.
 */
public class GraphRunnerException extends RuntimeException {

	private final String nodeId;

	private final List<NodeOutput> history;

	public GraphRunnerException(String message, String nodeId, List<NodeOutput> history, Throwable cause) {
		super(message, cause);
		this.nodeId = nodeId;
		this.history = history == null ? List.of() : List.copyOf(history);
	}

	/**
	 * @return the id of the node the run failed on, if the failure is bound to a node
	 */
	public Optional<String> nodeId() {
		return Optional.ofNullable(nodeId);
	}

	/**
	 * @return the steps the run completed before it failed, in execution order
	 */
	public List<NodeOutput> history() {
		return history;
	}

	/**
	 * @return the number of steps completed before the failure
	 */
	public int completedSteps() {
		return history.size();
	}

	/**
	 * Walks the cause chain looking for a {@code GraphRunnerException}.
	 * @param throwable the throwable to inspect
	 * @return the first runner exception in the chain, if any
	 */
	public static Optional<GraphRunnerException> from(Throwable throwable) {
		Throwable current = throwable;
		while (current != null) {
			if (current instanceof GraphRunnerException ex) {
				return Optional.of(ex);
			}
			current = current.getCause();
		}
		return Optional.empty();
	}

}
