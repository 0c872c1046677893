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
package io.github.supervisorgraph.graph.action;

import io.github.supervisorgraph.graph.OverAllState;

@FunctionalInterface
public interface EdgeAction {

	/**
	 * Decides the label of a conditional edge leaving a worker.
	 * @param state the snapshot after the worker's update was merged
	 * @return one of the options declared for the edge
	 * @throws Exception if the decision cannot be taken
	 */
	String apply(OverAllState state) throws Exception;

}
