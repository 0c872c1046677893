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

import io.github.supervisorgraph.graph.state.strategy.AppendStrategy;
import io.github.supervisorgraph.graph.state.strategy.ReplaceStrategy;

import java.util.function.BiFunction;

/**
 * Reducer policy of a single state key. Given the stored value and the value carried by
 * an update, it returns the value to store next. A {@code null} result removes the key.
 */
public interface KeyStrategy extends BiFunction<Object, Object, Object> {

	/**
	 * The new value replaces the old one outright.
	 */
	KeyStrategy REPLACE = new ReplaceStrategy();

	/**
	 * The new items are concatenated after the existing sequence.
	 */
	KeyStrategy APPEND = new AppendStrategy();

	/**
	 * Normalizes a value supplied by the initial state.
	 * @param value the caller supplied value, never {@code null}
	 * @return the value to store
	 * @throws IllegalArgumentException if the value cannot be held by this strategy
	 */
	default Object initialValue(Object value) {
		return value;
	}

}
