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

import io.micrometer.observation.Observation;

/**
 * Observation context of a single step.
 */
public class GraphNodeObservationContext extends Observation.Context {

	private final String graphName;

	private final String nodeId;

	private final String runId;

	private final int step;

	private String outcome;

	public GraphNodeObservationContext(String graphName, String nodeId, String runId, int step) {
		this.graphName = graphName;
		this.nodeId = nodeId;
		this.runId = runId;
		this.step = step;
	}

	public String getGraphName() {
		return graphName;
	}

	public String getNodeId() {
		return nodeId;
	}

	public String getRunId() {
		return runId;
	}

	public int getStep() {
		return step;
	}

	/**
	 * @return the node the step routed to, {@code null} until the step completes
	 */
	public String getOutcome() {
		return outcome;
	}

	public void setOutcome(String outcome) {
		this.outcome = outcome;
	}

}
