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
package io.github.supervisorgraph.graph.observation.node;

import io.github.supervisorgraph.graph.observation.SupervisorGraphKind;
import io.github.supervisorgraph.graph.observation.node.GraphNodeObservationDocumentation.HighCardinalityKeyNames;
import io.github.supervisorgraph.graph.observation.node.GraphNodeObservationDocumentation.LowCardinalityKeyNames;
import io.micrometer.common.KeyValue;
import io.micrometer.common.KeyValues;
import org.springframework.lang.Nullable;

public class DefaultGraphNodeObservationConvention implements GraphNodeObservationConvention {

	public static final String DEFAULT_OPERATION_NAME = "supervisor.graph.node";

	private final String name;

	public DefaultGraphNodeObservationConvention() {
		this(DEFAULT_OPERATION_NAME);
	}

	public DefaultGraphNodeObservationConvention(String name) {
		this.name = name;
	}

	@Override
	public String getName() {
		return this.name;
	}

	@Override
	@Nullable
	public String getContextualName(GraphNodeObservationContext context) {
		return "%s.%s".formatted(this.name, context.getNodeId());
	}

	@Override
	public KeyValues getLowCardinalityKeyValues(GraphNodeObservationContext context) {
		return KeyValues.of(
				KeyValue.of(LowCardinalityKeyNames.SUPERVISOR_GRAPH_KIND, SupervisorGraphKind.NODE.getValue()),
				KeyValue.of(LowCardinalityKeyNames.GRAPH_NAME, String.valueOf(context.getGraphName())),
				KeyValue.of(LowCardinalityKeyNames.NODE_ID, context.getNodeId()));
	}

	@Override
	public KeyValues getHighCardinalityKeyValues(GraphNodeObservationContext context) {
		KeyValues keyValues = KeyValues.of(KeyValue.of(HighCardinalityKeyNames.RUN_ID, context.getRunId()),
				KeyValue.of(HighCardinalityKeyNames.STEP, String.valueOf(context.getStep())));
		if (context.getOutcome() != null) {
			keyValues = keyValues.and(KeyValue.of(HighCardinalityKeyNames.OUTCOME, context.getOutcome()));
		}
		return keyValues;
	}

}
