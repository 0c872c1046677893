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

import static java.lang.String.format;

/**
 * Catalogue of run time error messages.
 */
public enum RunnableErrors {

	missingNode("node: '%s' not found!"),

	missingEdge("missing Edge for node: '%s'!"),

	missingNodeInEdgeMapping("cannot find edge mapping for label: '%s' in conditional edge from: '%s'!"),

	undeclaredFields("%s references undeclared state keys %s!"),

	invalidFieldValue("value for state key '%s' cannot be merged: %s"),

	undeclaredRoute("'%s' returned label '%s' which is not one of its declared options %s!"),

	nodeFailure("node '%s' failed at step %d: %s"),

	decisionFailure("decision for conditional edge from '%s' failed at step %d: %s"),

	nodeTimeout("node '%s' did not complete within %s at step %d"),

	nodeInterrupted("interrupted while waiting for node '%s' at step %d"),

	recursionLimitExceeded("maximum number of steps (%d) reached before '%s' could run; END was not reached"),

	executionError("%s");

	private final String errorMessage;

	RunnableErrors(String errorMessage) {
		this.errorMessage = errorMessage;
	}

	public String message(Object... args) {
		return format(errorMessage, args);
	}

}
