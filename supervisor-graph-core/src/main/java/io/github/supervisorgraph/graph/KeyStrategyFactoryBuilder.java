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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for a {@link KeyStrategyFactory}.
 *
 * <pre>{@code
 * KeyStrategyFactory schema = new KeyStrategyFactoryBuilder()
 *     .addStrategy("messages", KeyStrategy.APPEND)
 *     .addStrategy("next", KeyStrategy.REPLACE)
 *     .build();
 * }</pre>
 */
public class KeyStrategyFactoryBuilder {

	private final Map<String, KeyStrategy> strategies = new LinkedHashMap<>();

	public KeyStrategyFactoryBuilder addStrategy(String key, KeyStrategy strategy) {
		Assert.hasText(key, "key cannot be null or empty");
		Assert.notNull(strategy, "strategy cannot be null");
		Assert.isTrue(!strategies.containsKey(key), () -> "strategy for key '" + key + "' already declared");
		strategies.put(key, strategy);
		return this;
	}

	/**
	 * Declares a key with the {@link KeyStrategy#REPLACE} policy.
	 */
	public KeyStrategyFactoryBuilder addStrategy(String key) {
		return addStrategy(key, KeyStrategy.REPLACE);
	}

	public KeyStrategyFactory build() {
		Map<String, KeyStrategy> copy = Collections.unmodifiableMap(new LinkedHashMap<>(strategies));
		return () -> copy;
	}

}
