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

import org.springframework.util.Assert;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Per run settings. Values left unset fall back to the {@link CompileConfig} of the
 * graph being run.
 */
public final class RunnableConfig {

	private final String runId;

	private final Integer maxSteps;

	private final Duration nodeTimeout;

	private final Map<String, Object> metadata;

	private RunnableConfig(Builder builder) {
		this.runId = builder.runId != null ? builder.runId : UUID.randomUUID().toString();
		this.maxSteps = builder.maxSteps;
		this.nodeTimeout = builder.nodeTimeout;
		this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
	}

	public String runId() {
		return runId;
	}

	/**
	 * @return the step budget override for this run
	 */
	public Optional<Integer> maxSteps() {
		return Optional.ofNullable(maxSteps);
	}

	public Optional<Duration> nodeTimeout() {
		return Optional.ofNullable(nodeTimeout);
	}

	public Map<String, Object> metadata() {
		return metadata;
	}

	public Optional<Object> metadata(String key) {
		return Optional.ofNullable(metadata.get(key));
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public String toString() {
		return "RunnableConfig{runId=" + runId + ", maxSteps=" + maxSteps + ", nodeTimeout=" + nodeTimeout
				+ ", metadata=" + metadata + '}';
	}

	public static class Builder {

		private String runId;

		private Integer maxSteps;

		private Duration nodeTimeout;

		private final Map<String, Object> metadata = new LinkedHashMap<>();

		public Builder runId(String runId) {
			Assert.hasText(runId, "runId cannot be null or empty");
			this.runId = runId;
			return this;
		}

		/**
		 * Overrides the compiled recursion limit for this run.
		 * @param maxSteps a positive number of steps
		 * @return this builder
		 * @throws IllegalArgumentException if {@code maxSteps <= 0}
		 */
		public Builder maxSteps(int maxSteps) {
			Assert.isTrue(maxSteps > 0, "maxSteps must be > 0");
			this.maxSteps = maxSteps;
			return this;
		}

		public Builder nodeTimeout(Duration nodeTimeout) {
			Assert.isTrue(nodeTimeout == null || (!nodeTimeout.isNegative() && !nodeTimeout.isZero()),
					"nodeTimeout must be positive");
			this.nodeTimeout = nodeTimeout;
			return this;
		}

		public Builder addMetadata(String key, Object value) {
			Assert.hasText(key, "key cannot be null or empty");
			this.metadata.put(key, value);
			return this;
		}

		public RunnableConfig build() {
			return new RunnableConfig(this);
		}

	}

}
