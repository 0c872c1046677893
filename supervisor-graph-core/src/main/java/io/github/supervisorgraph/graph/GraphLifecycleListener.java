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

import java.util.Map;

/**
 * Callbacks fired synchronously on the thread driving a run. A listener that throws is
 * logged and ignored; it never aborts the run.
 */
public interface GraphLifecycleListener {

	/**
	 * The run is about to execute its entry node.
	 */
	default void onStart(String nodeId, Map<String, Object> state, RunnableConfig config) {
	}

	default void before(String nodeId, Map<String, Object> state, RunnableConfig config, int step) {
	}

	/**
	 * @param state the snapshot after the node's update was merged
	 */
	default void after(String nodeId, Map<String, Object> state, RunnableConfig config, int step) {
	}

	default void onError(String nodeId, Map<String, Object> state, Throwable ex, RunnableConfig config) {
	}

	/**
	 * The run reached the terminal sentinel.
	 * @param nodeId the last node that ran
	 */
	default void onComplete(String nodeId, Map<String, Object> state, RunnableConfig config) {
	}

}
