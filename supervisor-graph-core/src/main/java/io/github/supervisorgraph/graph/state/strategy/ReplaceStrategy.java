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
package io.github.supervisorgraph.graph.state.strategy;

import io.github.supervisorgraph.graph.KeyStrategy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class ReplaceStrategy implements KeyStrategy {

	@Override
	public Object apply(Object oldValue, Object newValue) {
		return copyOf(newValue);
	}

	@Override
	public Object initialValue(Object value) {
		return copyOf(value);
	}

	/**
	 * Returns an unmodifiable shallow copy of a list, set or map value; any other value
	 * is returned as is.
	 * @param value the value handed over by a caller
	 * @return a value the caller can no longer change through its own reference
	 */
	public static Object copyOf(Object value) {
		if (value instanceof List<?> list) {
			return Collections.unmodifiableList(new ArrayList<>(list));
		}
		if (value instanceof Set<?> set) {
			return Collections.unmodifiableSet(new LinkedHashSet<>(set));
		}
		if (value instanceof Map<?, ?> map) {
			return Collections.unmodifiableMap(new LinkedHashMap<>(map));
		}
		return value;
	}

	@Override
	public String toString() {
		return "REPLACE";
	}

}
