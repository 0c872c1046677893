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
import io.github.supervisorgraph.graph.executor.MainGraphExecutor;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * One execution of a {@link CompiledGraph}, consumed as a lazy sequence of steps.
 * <p>
 * Each call to {@link #next()} runs exactly one node on the calling thread and returns
 * the completed step; {@link #hasNext()} never runs a node. The sequence is finite and
 * cannot be restarted: it ends when the run reaches {@code END}, fails (the failure is
 * thrown from {@code next()}) or is cancelled. {@link #cancel()} may be called from any
 * thread and takes effect at the next step boundary.
 *
 * <pre>{@code
 * try (GraphRun run = graph.start(Map.of("messages", List.of("hi")))) {
 *     while (run.hasNext()) {
 *         NodeOutput step = run.next();
 *         ...
 *     }
 * }
 * }</pre>
 */
public class GraphRun implements Iterator<NodeOutput>, AutoCloseable {

	private final GraphRunnerContext context;

	private final MainGraphExecutor executor;

	GraphRun(GraphRunnerContext context, MainGraphExecutor executor) {
		this.context = context;
		this.executor = executor;
	}

	@Override
	public boolean hasNext() {
		if (context.isRunning() && context.isCancelRequested() && !context.isStepInProgress()) {
			executor.handleCancellation(context);
		}
		return context.isRunning();
	}

	/**
	 * Runs the next node.
	 * @return the completed step
	 * @throws GraphRunnerException if the step failed or the step budget is exhausted
	 * @throws NoSuchElementException if the run has already terminated, including a
	 * cancellation that landed after the last {@link #hasNext()}
	 */
	@Override
	public NodeOutput next() {
		if (!hasNext()) {
			throw new NoSuchElementException("run " + runId() + " is " + status());
		}
		return advance().output()
			.orElseThrow(() -> new NoSuchElementException("run " + runId() + " is " + status()));
	}

	private GraphResponse<NodeOutput> advance() {
		GraphResponse<NodeOutput> response = executor.execute(context);
		if (response.isError()) {
			Throwable error = response.error().get();
			throw GraphRunnerException.from(error)
				.orElseGet(() -> new GraphRunnerException(error.getMessage(), context.getCurrentNodeId(),
						context.history(), error));
		}
		return response;
	}

	/**
	 * Requests cancellation. The node currently running, if any, is not interrupted; no
	 * further node is started.
	 */
	public void cancel() {
		context.requestCancel();
	}

	/**
	 * Cancels the run if it is still running. Called while a step is executing, the step
	 * is allowed to finish and the run ends at the following boundary.
	 */
	@Override
	public void close() {
		cancel();
		if (!context.isStepInProgress()) {
			executor.handleCancellation(context);
		}
	}

	/**
	 * Drains the remaining steps.
	 * @return the final snapshot if the run reached {@code END}, empty if it was cancelled
	 * @throws GraphRunnerException if a step failed
	 */
	public Optional<OverAllState> toCompletion() {
		while (hasNext()) {
			if (advance().isDone()) {
				break;
			}
		}
		context.failure().ifPresent(failure -> {
			throw failure;
		});
		return status() == RunStatus.COMPLETED ? Optional.of(context.getOverallState()) : Optional.empty();
	}

	public String runId() {
		return context.getConfig().runId();
	}

	public RunStatus status() {
		return context.status();
	}

	/**
	 * @return the steps completed so far
	 */
	public List<NodeOutput> steps() {
		return context.history();
	}

	public int stepCount() {
		return context.getStepCount();
	}

	/**
	 * @return the latest snapshot
	 */
	public OverAllState state() {
		return context.getOverallState();
	}

	public Optional<GraphRunnerException> failure() {
		return context.failure();
	}

}
