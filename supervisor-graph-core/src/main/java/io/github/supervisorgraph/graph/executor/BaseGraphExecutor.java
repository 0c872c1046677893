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
package io.github.supervisorgraph.graph.executor;

import io.github.supervisorgraph.graph.GraphResponse;
import io.github.supervisorgraph.graph.GraphRunnerContext;
import io.github.supervisorgraph.graph.NodeOutput;
import io.github.supervisorgraph.graph.RunStatus;
import io.github.supervisorgraph.graph.exception.GraphRunnerException;
import io.github.supervisorgraph.graph.observation.graph.GraphObservationContext;
import io.micrometer.observation.Observation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.github.supervisorgraph.graph.StateGraph.ERROR;

/**
 * Base class of the graph executors. It owns the transitions of a run into a terminal
 * status, so that every executor reports completion, failure and cancellation the same
 * way.
 */
public abstract class BaseGraphExecutor {

	private static final Logger log = LoggerFactory.getLogger(BaseGraphExecutor.class);

	/**
	 * Advances the run by at most one step.
	 * @param context the run
	 * @return the emitted step, the end of the run, or the failure that ended it
	 */
	public abstract GraphResponse<NodeOutput> execute(GraphRunnerContext context);

	protected GraphResponse<NodeOutput> handleCompletion(GraphRunnerContext context) {
		return GraphResponse.done();
	}

	protected GraphResponse<NodeOutput> handleFailure(GraphRunnerContext context, GraphRunnerException ex) {
		if (context.fail(ex)) {
			log.error("run {} failed after {} step(s) at node '{}'", context.getConfig().runId(),
					context.getStepCount(), ex.nodeId().orElse(null), ex);
			context.doListeners(ERROR, ex);
			stopGraphObservation(context, RunStatus.FAILED, ex);
		}
		return GraphResponse.error(ex);
	}

	/**
	 * Cancels the run if it is still running. Callers other than the executor must only
	 * use it between two steps, see {@link GraphRunnerContext#isStepInProgress()}.
	 * @param context the run
	 */
	public void handleCancellation(GraphRunnerContext context) {
		if (context.terminate(RunStatus.CANCELLED)) {
			log.debug("run {} cancelled after {} step(s)", context.getConfig().runId(), context.getStepCount());
			stopGraphObservation(context, RunStatus.CANCELLED, null);
		}
	}

	protected void stopGraphObservation(GraphRunnerContext context, RunStatus status, Throwable error) {
		Observation observation = context.takeGraphObservation();
		if (observation == null) {
			return;
		}
		if (observation.getContext() instanceof GraphObservationContext graphContext) {
			graphContext.setOutcome(status.name());
			graphContext.setSteps(context.getStepCount());
		}
		if (error != null) {
			observation.error(error);
		}
		observation.stop();
	}

}
