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
import io.github.supervisorgraph.graph.OverAllState;
import io.github.supervisorgraph.graph.exception.GraphRunnerException;
import io.github.supervisorgraph.graph.exception.InvalidUpdateException;
import io.github.supervisorgraph.graph.exception.NodeInvocationException;
import io.github.supervisorgraph.graph.exception.RunnableErrors;
import io.github.supervisorgraph.graph.internal.edge.Edge;
import io.github.supervisorgraph.graph.internal.edge.EdgeCondition;
import io.github.supervisorgraph.graph.internal.node.Node;
import io.github.supervisorgraph.graph.internal.node.RouterNode;
import io.github.supervisorgraph.graph.observation.node.DefaultGraphNodeObservationConvention;
import io.github.supervisorgraph.graph.observation.node.GraphNodeObservationContext;
import io.github.supervisorgraph.graph.observation.node.GraphNodeObservationDocumentation;
import io.github.supervisorgraph.graph.state.strategy.ReplaceStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

import static io.github.supervisorgraph.graph.StateGraph.NODE_AFTER;
import static io.github.supervisorgraph.graph.StateGraph.NODE_BEFORE;

/**
 * Runs a single step: invokes the current node on the latest snapshot, merges its
 * update, resolves the outgoing edge and records the step on the run.
 */
public class NodeExecutor extends BaseGraphExecutor {

	private static final Logger log = LoggerFactory.getLogger(NodeExecutor.class);

	private static final DefaultGraphNodeObservationConvention DEFAULT_CONVENTION = new DefaultGraphNodeObservationConvention();

	private static final String NO_FUTURE = "no result future returned";

	@Override
	public GraphResponse<NodeOutput> execute(GraphRunnerContext context) {
		context.setCurrentNodeId(context.getNextNodeId());
		String nodeId = context.getCurrentNodeId();
		Node node = context.getNode(nodeId);
		if (node == null) {
			throw new GraphRunnerException(RunnableErrors.missingNode.message(nodeId), nodeId, context.history(),
					null);
		}
		int step = context.getStepCount() + 1;

		context.doListeners(NODE_BEFORE, null);

		var compiledGraph = context.getCompiledGraph();
		GraphNodeObservationContext observationContext = new GraphNodeObservationContext(
				compiledGraph.getGraphName(), nodeId, context.getConfig().runId(), step);
		return GraphNodeObservationDocumentation.GRAPH_NODE
			.observation(null, DEFAULT_CONVENTION, () -> observationContext,
					compiledGraph.compileConfig.observationRegistry())
			.parentObservation(context.getGraphObservation())
			.observe(() -> executeNode(context, node, step, observationContext));
	}

	private GraphResponse<NodeOutput> executeNode(GraphRunnerContext context, Node node, int step,
			GraphNodeObservationContext observationContext) {
		String nodeId = node.id();
		OverAllState state = context.getOverallState();

		Map<String, Object> update;
		String route = null;
		if (node instanceof RouterNode router) {
			route = await(context, nodeId, step, () -> router.router().apply(state), RunnableErrors.nodeFailure);
			checkLabel(context, nodeId, route, router.options());
			update = Map.of();
		}
		else {
			Map<String, Object> result = await(context, nodeId, step, () -> node.action().apply(state),
					RunnableErrors.nodeFailure);
			update = copyOf(result);
		}

		OverAllState merged;
		try {
			merged = state.apply(update);
		}
		catch (InvalidUpdateException ex) {
			throw ex.withContext(nodeId, context.history());
		}

		String nextNodeId = nextNodeId(context, nodeId, step, route, merged);
		NodeOutput output = NodeOutput.of(step, nodeId, update, merged, route);
		context.commitStep(output, nextNodeId);
		observationContext.setOutcome(nextNodeId);

		context.doListeners(NODE_AFTER, null);
		logStep(context, output, nextNodeId);
		return GraphResponse.of(output);
	}

	/**
	 * Resolves the node to run after {@code nodeId}.
	 * @param route the label chosen by a router step, {@code null} for a worker
	 * @param merged the snapshot produced by the step
	 */
	private String nextNodeId(GraphRunnerContext context, String nodeId, int step, String route,
			OverAllState merged) {
		Edge edge = context.getEdge(nodeId);
		if (edge == null) {
			throw new GraphRunnerException(RunnableErrors.missingEdge.message(nodeId), nodeId, context.history(),
					null);
		}
		if (edge.target().id() != null) {
			return edge.target().id();
		}

		EdgeCondition condition = edge.target().value();
		String label = route;
		if (condition.action() != null) {
			label = await(context, nodeId, step, () -> condition.action().apply(merged),
					RunnableErrors.decisionFailure);
			checkLabel(context, nodeId, label, condition.options());
		}

		String target = condition.mappings().get(label);
		if (target == null) {
			throw new NodeInvocationException(RunnableErrors.missingNodeInEdgeMapping.message(label, nodeId), nodeId,
					context.history(), null);
		}
		return target;
	}

	private void checkLabel(GraphRunnerContext context, String nodeId, String label, Set<String> options) {
		if (label == null || !options.contains(label)) {
			throw new NodeInvocationException(
					RunnableErrors.undeclaredRoute.message(nodeId, label, new TreeSet<>(options)), nodeId,
					context.history(), null);
		}
	}

	/**
	 * Blocks until the future returned by a capability completes. Without a node timeout
	 * the capability is invoked on the run thread. With one, it is invoked on a
	 * bounded-elastic worker so that blocking capabilities, such as those adapted with
	 * {@code node_async}, are bounded too.
	 */
	private <T> T await(GraphRunnerContext context, String nodeId, int step, Supplier<CompletableFuture<T>> invocation,
			RunnableErrors failure) {
		Optional<Duration> timeout = context.getNodeTimeout();
		if (timeout.isPresent()) {
			return awaitWithin(context, nodeId, step, invocation, failure, timeout.get());
		}

		CompletableFuture<T> future;
		try {
			future = invocation.get();
		}
		catch (RuntimeException ex) {
			throw new NodeInvocationException(failure.message(nodeId, step, ex.getMessage()), nodeId,
					context.history(), ex);
		}
		if (future == null) {
			throw new NodeInvocationException(failure.message(nodeId, step, NO_FUTURE), nodeId, context.history(),
					null);
		}

		try {
			return future.get();
		}
		catch (ExecutionException | CompletionException ex) {
			throw invocationFailure(context, nodeId, step, failure, unwrap(ex));
		}
		catch (CancellationException ex) {
			throw new NodeInvocationException(failure.message(nodeId, step, "invocation was cancelled"), nodeId,
					context.history(), ex);
		}
		catch (InterruptedException ex) {
			Thread.currentThread().interrupt();
			throw new NodeInvocationException(RunnableErrors.nodeInterrupted.message(nodeId, step), nodeId,
					context.history(), ex);
		}
	}

	private <T> T awaitWithin(GraphRunnerContext context, String nodeId, int step,
			Supplier<CompletableFuture<T>> invocation, RunnableErrors failure, Duration timeout) {
		AtomicReference<CompletableFuture<T>> started = new AtomicReference<>();
		try {
			Mono<T> result = Mono.<CompletableFuture<T>>fromCallable(() -> {
				CompletableFuture<T> future = invocation.get();
				if (future == null) {
					throw new IllegalStateException(NO_FUTURE);
				}
				started.set(future);
				return future;
			}).flatMap(future -> Mono.fromFuture(future));
			return result.subscribeOn(Schedulers.boundedElastic()).timeout(timeout).block();
		}
		catch (RuntimeException ex) {
			Throwable cause = unwrap(Exceptions.unwrap(ex));
			if (cause instanceof TimeoutException) {
				Optional.ofNullable(started.get()).ifPresent(future -> future.cancel(true));
				throw new NodeInvocationException(RunnableErrors.nodeTimeout.message(nodeId, timeout, step), nodeId,
						context.history(), cause);
			}
			if (cause instanceof InterruptedException) {
				Thread.currentThread().interrupt();
				throw new NodeInvocationException(RunnableErrors.nodeInterrupted.message(nodeId, step), nodeId,
						context.history(), cause);
			}
			if (cause instanceof CancellationException) {
				throw new NodeInvocationException(failure.message(nodeId, step, "invocation was cancelled"), nodeId,
						context.history(), cause);
			}
			throw invocationFailure(context, nodeId, step, failure, cause);
		}
	}

	private static NodeInvocationException invocationFailure(GraphRunnerContext context, String nodeId, int step,
			RunnableErrors failure, Throwable cause) {
		return new NodeInvocationException(failure.message(nodeId, step, cause.getMessage()), nodeId,
				context.history(), cause);
	}

	/**
	 * Detaches the update from the map the worker returned, so that later changes to it
	 * reach neither the merged snapshot nor the recorded step.
	 */
	private static Map<String, Object> copyOf(Map<String, Object> result) {
		if (result == null || result.isEmpty()) {
			return Map.of();
		}
		Map<String, Object> copy = new LinkedHashMap<>();
		result.forEach((key, value) -> copy.put(key, ReplaceStrategy.copyOf(value)));
		return Collections.unmodifiableMap(copy);
	}

	private static Throwable unwrap(Throwable ex) {
		Throwable cause = ex;
		while ((cause instanceof ExecutionException || cause instanceof CompletionException)
				&& cause.getCause() != null) {
			cause = cause.getCause();
		}
		return cause;
	}

	private void logStep(GraphRunnerContext context, NodeOutput output, String nextNodeId) {
		if (!log.isDebugEnabled()) {
			return;
		}
		try {
			log.debug("run {} step {} node '{}' -> '{}' state: {}", context.getConfig().runId(), output.step(),
					output.node(), nextNodeId,
					context.getCompiledGraph().compileConfig.stateSerializer().writeState(output.state()));
		}
		catch (IOException ex) {
			log.debug("run {} step {} node '{}' -> '{}' (state not serializable: {})", context.getConfig().runId(),
					output.step(), output.node(), nextNodeId, ex.getMessage());
		}
	}

}
