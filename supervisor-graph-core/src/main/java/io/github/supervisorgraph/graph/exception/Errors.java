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
 * Catalogue of graph construction errors.
 */
public enum Errors {

	missingEntryPoint("missing Entry Point"),

	entryPointNotExist("entryPoint: %s does not exist!"),

	duplicateEntryPoint("entryPoint already set to '%s'!"),

	invalidNodeIdentifier("%s is not a valid node id!"),

	conditionalEntryPoint("entry point must be a static edge from START!"),

	invalidEdgeIdentifier("END is not a valid edge sourceId!"),

	invalidEdgeTarget("edge target for sourceId: %s has neither id nor condition!"),

	duplicateNodeError("node with id: %s already exist!"),

	duplicateEdgeError("edge from '%s' already exist!"),

	missingNodeReferencedByEdge("edge sourceId '%s' refers to undefined node!"),

	missingNodeInEdgeMapping("edge mapping for sourceId: %s contains a not existent nodeId %s!"),

	missingOutgoingEdge("node '%s' has no outgoing edge!"),

	emptyOptionSet("node '%s' declares an empty option set!"),

	nullLabel("node '%s' declares a null label!"),

	emptyEdgeMapping("edge mapping for sourceId: %s is empty!"),

	dispatchMappingMismatch(
			"edge mapping for sourceId: %s does not match its declared options %s (missing labels: %s, unexpected labels: %s)"),

	routerOptionsMismatch("options %s declared on edge from router '%s' differ from the router options %s!"),

	routerRequiresConditionalEdge("router '%s' must be followed by a conditional edge, found static edge to '%s'!"),

	routerDecisionConflict("router '%s' dispatches on its own label; a separate decision function is not allowed!"),

	missingEdgeDecision("conditional edge from '%s' has no decision function and '%s' is not a router!");

	private final String errorMessage;

	Errors(String errorMessage) {
		this.errorMessage = errorMessage;
	}

	public GraphStateException exception(Object... args) {
		return new GraphStateException(format(errorMessage, args));
	}

}
