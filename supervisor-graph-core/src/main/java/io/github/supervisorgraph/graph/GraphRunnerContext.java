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

import io.github.supervisorgraph.graph.exception.GraphRunnerException;
import io.github.supervisorgraph.graph.internal.edge.Edge;
import io.github.supervisorgraph.graph.internal.node.Node;
import io.micrometer.observation.Observation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static io.github.supervisorgraph.graph.StateGraph.END;
import static io.github.supervisorgraph.graph.StateGraph.ERROR;
import static io.github.supervisorgraph.graph.StateGraph.NODE_AFTER;
import static io.github.supervisorgraph.graph.StateGraph.NODE_BEFORE;
import static io.github.supervisorgraph.graph.StateGraph.START;

/**
 * Mutable bookkeeping of one run: the current snapshot, the node cursor, the step
 * counter and the transcript. It is owned by a single {@link GraphRun}; only the
 * cancellation flag and the status are touched from other threads.
 */
public class GraphRunnerContext {

	private static final Logger log = LoggerFactory.getLogger(GraphRunnerContext.class);

	private final CompiledGraph compiledGraph;

	private final RunnableConfig config;

	private final int maxSteps;

	private final Duration nodeTimeout;

	private final List<NodeOutput> history = new CopyOnWriteArrayList<>();

	private final AtomicBoolean started = new AtomicBoolean(false);

	private final AtomicReference<RunStatus> status = new AtomicReference<>(RunStatus.RUNNING);

	private volatile boolean cancelRequested;

	private volatile OverAllState overallState;

	private volatile GraphRunnerException failure;

	private volatile boolean stepInProgress;

	private String currentNodeId;

	private String nextNodeId;

	private int stepCount;

	private final AtomicReference<Observation> graphObservation = new AtomicReference<>();

	public GraphRunnerContext(OverAllState initialState, RunnableConfig config, CompiledGraph compiledGraph) {
		this.compiledGraph = compiledGraph;
		this.config = config;
		this.overallState = initialState;
		this.maxSteps = config.maxSteps().orElse(compiledGraph.compileConfig.recursionLimit());
		this.nodeTimeout = config.nodeTimeout().or(compiledGraph.compileConfig::nodeTimeout).orElse(null);
	}

	public CompiledGraph getCompiledGraph() {
		return compiledGraph;
	}

	public RunnableConfig getConfig() {
		return config;
	}

	public int getMaxSteps() {
		return maxSteps;
	}

	public Optional<Duration> getNodeTimeout() {
		return Optional.ofNullable(nodeTimeout);
	}

	public OverAllState getOverallState() {
		return overallState;
	}

	public String getCurrentNodeId() {
		return currentNodeId;
	}

	public void setCurrentNodeId(String currentNodeId) {
		this.currentNodeId = currentNodeId;
	}

	public String getNextNodeId() {
		return nextNodeId;
	}

	public void setNextNodeId(String nextNodeId) {
		this.nextNodeId = nextNodeId;
	}

	public int getStepCount() {
		return stepCount;
	}

	public Node getNode(String nodeId) {
		return compiledGraph.getNode(nodeId).orElse(null);
	}

	public Edge getEdge(String nodeId) {
		return compiledGraph.getEdge(nodeId).orElse(null);
	}

	/**
	 * @return the steps completed so far, in order
	 */
	public List<NodeOutput> history() {
		return List.copyOf(history);
	}

	/**
	 * Records a completed step and moves the cursor to the resolved next node.
	 */
	public void commitStep(NodeOutput output, String nextNodeId) {
		history.add(output);
		this.stepCount = output.step();
		this.overallState = output.state();
		this.nextNodeId = nextNodeId;
	}

	/**
	 * @return {@code true} exactly once, for the first caller
	 */
	public boolean markStarted() {
		return started.compareAndSet(false, true);
	}

	public RunStatus status() {
		return status.get();
	}

	public boolean isRunning() {
		return !status.get().isTerminal();
	}

	public void requestCancel() {
		this.cancelRequested = true;
	}

	public boolean isCancelRequested() {
		return cancelRequested;
	}

	public void enterStep() {
		this.stepInProgress = true;
	}

	public void exitStep() {
		this.stepInProgress = false;
	}

	/**
	 * @return {@code true} while the executor is inside a call, between two step
	 * boundaries
	 */
	public boolean isStepInProgress() {
		return stepInProgress;
	}

	/**
	 * Moves a running run to a terminal status.
	 * @return {@code false} if the run had already terminated
	 */
	public boolean terminate(RunStatus terminalStatus) {
		return status.compareAndSet(RunStatus.RUNNING, terminalStatus);
	}

	public boolean fail(GraphRunnerException failure) {
		if (terminate(RunStatus.FAILED)) {
			this.failure = failure;
			return true;
		}
		return false;
	}

	public Optional<GraphRunnerException> failure() {
		return Optional.ofNullable(failure);
	}

	public Observation getGraphObservation() {
		return graphObservation.get();
	}

	public void setGraphObservation(Observation graphObservation) {
		this.graphObservation.set(graphObservation);
	}

	/**
	 * Detaches the run observation so that exactly one caller stops it.
	 * @return the observation, or {@code null} if it was never opened or already taken
	 */
	public Observation takeGraphObservation() {
		return graphObservation.getAndSet(null);
	}

	/**
	 * Notifies the lifecycle listeners of the compiled graph.
	 * @param scene one of {@code START}, {@code NODE_BEFORE}, {@code NODE_AFTER},
	 * {@code ERROR} or {@code END}
	 * @param e the failure, for {@code ERROR}
	 */
	public void doListeners(String scene, Throwable e) {
		Map<String, Object> state = overallState.data();
		for (GraphLifecycleListener listener : compiledGraph.compileConfig.lifecycleListeners()) {
			try {
				switch (scene) {
					case START -> listener.onStart(nextNodeId, state, config);
					case NODE_BEFORE -> listener.before(currentNodeId, state, config, stepCount + 1);
					case NODE_AFTER -> listener.after(currentNodeId, state, config, stepCount);
					case ERROR -> listener.onError(currentNodeId, state, e, config);
					case END -> listener.onComplete(currentNodeId, state, config);
					default -> throw new IllegalArgumentException("unknown listener scene: " + scene);
				}
			}
			catch (RuntimeException ex) {
				log.warn("lifecycle listener {} failed on {} for run {}", listener.getClass().getName(), scene,
						config.runId(), ex);
			}
		}
	}

}
