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

import io.micrometer.observation.Observation;

/**
 * Observation context of a whole run.
 */
public class GraphObservationContext extends Observation.Context {

	private final String graphName;

	private final String runId;

	private final int maxSteps;

	private String outcome;

	private int steps;

	public GraphObservationContext(String graphName, String runId, int maxSteps) {
		this.graphName = graphName;
		this.runId = runId;
		this.maxSteps = maxSteps;
	}

	public String getGraphName() {
		return graphName;
	}

	public String getRunId() {
		return runId;
	}

	public int getMaxSteps() {
		return maxSteps;
	}

	public String getOutcome() {
		return outcome;
	}

	public void setOutcome(String outcome) {
		this.outcome = outcome;
	}

	public int getSteps() {
		return steps;
	}

	public void setSteps(int steps) {
		this.steps = steps;
	}

}
