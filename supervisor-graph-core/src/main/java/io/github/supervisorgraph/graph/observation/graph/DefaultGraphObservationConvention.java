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
package io.github.supervisorgraph.graph.observation.graph;

import io.github.supervisorgraph.graph.observation.SupervisorGraphKind;
import io.github.supervisorgraph.graph.observation.graph.GraphObservationDocumentation.HighCardinalityKeyNames;
import io.github.supervisorgraph.graph.observation.graph.GraphObservationDocumentation.LowCardinalityKeyNames;
import io.micrometer.common.KeyValue;
import io.micrometer.common.KeyValues;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

/**
 * Default implementation of GraphObservationConvention, with a configurable observation
 * name.
 */
public class DefaultGraphObservationConvention implements GraphObservationConvention {

	/** Default observation name of a run */
	public static final String DEFAULT_OPERATION_NAME = "supervisor.graph";

	private final String name;

	public DefaultGraphObservationConvention() {
		this(DEFAULT_OPERATION_NAME);
	}

	public DefaultGraphObservationConvention(String name) {
		this.name = name;
	}

	@Override
	public String getName() {
		return this.name;
	}

	@Override
	@Nullable
	public String getContextualName(GraphObservationContext context) {
		if (StringUtils.hasText(context.getGraphName())) {
			return "%s.%s".formatted(this.name, context.getGraphName());
		}
		return this.name;
	}

	@Override
	public KeyValues getLowCardinalityKeyValues(GraphObservationContext context) {
		return KeyValues.of(
				KeyValue.of(LowCardinalityKeyNames.SUPERVISOR_GRAPH_KIND, SupervisorGraphKind.GRAPH.getValue()),
				KeyValue.of(LowCardinalityKeyNames.GRAPH_NAME, String.valueOf(context.getGraphName())));
	}

	@Override
	public KeyValues getHighCardinalityKeyValues(GraphObservationContext context) {
		KeyValues keyValues = KeyValues.of(KeyValue.of(HighCardinalityKeyNames.RUN_ID, context.getRunId()),
				KeyValue.of(HighCardinalityKeyNames.STEPS, String.valueOf(context.getSteps())));
		if (context.getOutcome() != null) {
			keyValues = keyValues.and(KeyValue.of(HighCardinalityKeyNames.OUTCOME, context.getOutcome()));
		}
		return keyValues;
	}

}
