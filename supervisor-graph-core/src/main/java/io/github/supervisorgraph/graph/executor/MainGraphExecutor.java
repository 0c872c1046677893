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
import io.github.supervisorgraph.graph.exception.RecursionLimitExceededException;
import io.github.supervisorgraph.graph.exception.RunnableErrors;
import io.github.supervisorgraph.graph.observation.graph.DefaultGraphObservationConvention;
import io.github.supervisorgraph.graph.observation.graph.GraphObservationContext;
import io.github.supervisorgraph.graph.observation.graph.GraphObservationDocumentation;
import io.micrometer.observation.Observation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

import static io.github.supervisorgraph.graph.StateGraph.END;
import static io.github.supervisorgraph.graph.StateGraph.START;

/**
 * Main graph executor: drives a run one step at a time, enforcing the step budget and
 * honouring cancellation at step boundaries. The node itself is run by
 * {@link NodeExecutor}.
 * <p>
 * The executor is stateless; one instance serves every run of a compiled graph.
 */
public class MainGraphExecutor extends BaseGraphExecutor {

	private static final Logger log = LoggerFactory.getLogger(MainGraphExecutor.class);

	private static final DefaultGraphObservationConvention DEFAULT_CONVENTION = new DefaultGraphObservationConvention();

	private final NodeExecutor nodeExecutor;

	public MainGraphExecutor() {
		this.nodeExecutor = new NodeExecutor();
	}

	@Override
	public GraphResponse<NodeOutput> execute(GraphRunnerContext context) {
		context.enterStep();
		try {
			if (!context.isRunning()) {
				return handleCompletion(context);
			}

			if (context.markStarted()) {
				handleStartNode(context);
				if (!context.isRunning()) {
					// terminated by a concurrent close() while the observation was opening
					stopGraphObservation(context, context.status(), null);
					return handleCompletion(context);
				}
			}

			if (context.isCancelRequested()) {
				handleCancellation(context);
				return handleCompletion(context);
			}

			if (context.getStepCount() >= context.getMaxSteps()) {
				throw new RecursionLimitExceededException(
						RunnableErrors.recursionLimitExceeded.message(context.getMaxSteps(), context.getNextNodeId()),
						context.getMaxSteps(), context.getNextNodeId(), context.history());
			}

			GraphResponse<NodeOutput> response = nodeExecutor.execute(context);

			if (Objects.equals(context.getNextNodeId(), END)) {
				handleEndNode(context);
			}
			return response;
		}
		catch (GraphRunnerException e) {
			return handleFailure(context, e);
		}
		catch (RuntimeException e) {
			return handleFailure(context, new GraphRunnerException(RunnableErrors.executionError.message(e.getMessage()),
					context.getCurrentNodeId(), context.history(), e));
		}
		finally {
			context.exitStep();
			// a cancellation requested during the step takes effect at this boundary
			if (context.isCancelRequested()) {
				handleCancellation(context);
			}
		}
	}

	/**
	 * Positions the run on the entry point and opens its observation.
	 */
	private void handleStartNode(GraphRunnerContext context) {
		var compiledGraph = context.getCompiledGraph();
		context.setNextNodeId(compiledGraph.getEntryPoint());

		GraphObservationContext observationContext = new GraphObservationContext(compiledGraph.getGraphName(),
				context.getConfig().runId(), context.getMaxSteps());
		Observation observation = GraphObservationDocumentation.GRAPH
			.observation(null, DEFAULT_CONVENTION, () -> observationContext,
					compiledGraph.compileConfig.observationRegistry())
			.start();
		context.setGraphObservation(observation);

		log.debug("run {} starting at '{}' with maxSteps={}", context.getConfig().runId(), context.getNextNodeId(),
				context.getMaxSteps());
		context.doListeners(START, null);
	}

	private void handleEndNode(GraphRunnerContext context) {
		if (context.terminate(RunStatus.COMPLETED)) {
			log.debug("run {} completed after {} step(s)", context.getConfig().runId(), context.getStepCount());
			context.doListeners(END, null);
			stopGraphObservation(context, RunStatus.COMPLETED, null);
		}
	}

}
