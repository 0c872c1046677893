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

import io.github.supervisorgraph.graph.serializer.StateSerializer;
import io.github.supervisorgraph.graph.serializer.jackson.JacksonStateSerializer;
import io.micrometer.observation.ObservationRegistry;
import org.springframework.util.Assert;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Settings applied to every run of a compiled graph.
 */
public class CompileConfig {

	public static final int DEFAULT_RECURSION_LIMIT = 25;

	private int recursionLimit = DEFAULT_RECURSION_LIMIT;

	private Duration nodeTimeout;

	private List<GraphLifecycleListener> lifecycleListeners = List.of();

	private ObservationRegistry observationRegistry = ObservationRegistry.NOOP;

	private StateSerializer stateSerializer;

	private String graphName;

	/**
	 * @return the default step budget of a run
	 */
	public int recursionLimit() {
		return recursionLimit;
	}

	/**
	 * @return how long a single node invocation may take, empty for no limit
	 */
	public Optional<Duration> nodeTimeout() {
		return Optional.ofNullable(nodeTimeout);
	}

	public List<GraphLifecycleListener> lifecycleListeners() {
		return lifecycleListeners;
	}

	public ObservationRegistry observationRegistry() {
		return observationRegistry;
	}

	public StateSerializer stateSerializer() {
		return stateSerializer;
	}

	public Optional<String> graphName() {
		return Optional.ofNullable(graphName);
	}

	public static Builder builder() {
		return new Builder();
	}

	public static class Builder {

		private final CompileConfig config;

		private final List<GraphLifecycleListener> listeners = new ArrayList<>();

		protected Builder() {
			this.config = new CompileConfig();
		}

		/**
		 * Sets the default step budget of a run.
		 * @param recursionLimit a positive number of steps
		 * @return this builder
		 */
		public Builder recursionLimit(int recursionLimit) {
			Assert.isTrue(recursionLimit > 0, "recursionLimit must be > 0");
			this.config.recursionLimit = recursionLimit;
			return this;
		}

		public Builder nodeTimeout(Duration nodeTimeout) {
			Assert.isTrue(nodeTimeout == null || (!nodeTimeout.isNegative() && !nodeTimeout.isZero()),
					"nodeTimeout must be positive");
			this.config.nodeTimeout = nodeTimeout;
			return this;
		}

		public Builder withLifecycleListener(GraphLifecycleListener listener) {
			Assert.notNull(listener, "listener cannot be null");
			this.listeners.add(listener);
			return this;
		}

		public Builder observationRegistry(ObservationRegistry observationRegistry) {
			Assert.notNull(observationRegistry, "observationRegistry cannot be null");
			this.config.observationRegistry = observationRegistry;
			return this;
		}

		public Builder stateSerializer(StateSerializer stateSerializer) {
			Assert.notNull(stateSerializer, "stateSerializer cannot be null");
			this.config.stateSerializer = stateSerializer;
			return this;
		}

		public Builder graphName(String graphName) {
			this.config.graphName = graphName;
			return this;
		}

		public CompileConfig build() {
			config.lifecycleListeners = Collections.unmodifiableList(new ArrayList<>(listeners));
			if (config.stateSerializer == null) {
				config.stateSerializer = new JacksonStateSerializer();
			}
			return new CompileConfig(config);
		}

	}

	private CompileConfig() {
	}

	private CompileConfig(CompileConfig config) {
		this.recursionLimit = config.recursionLimit;
		this.nodeTimeout = config.nodeTimeout;
		this.lifecycleListeners = config.lifecycleListeners;
		this.observationRegistry = config.observationRegistry;
		this.stateSerializer = config.stateSerializer;
		this.graphName = config.graphName;
	}

}
