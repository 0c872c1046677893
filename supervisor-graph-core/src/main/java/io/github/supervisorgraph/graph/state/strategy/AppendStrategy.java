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

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import static java.lang.String.format;

/**
 * Concatenates the items of an update after the stored sequence, keeping arrival order
 * and duplicates. The stored value is always an unmodifiable {@link List}.
 * <p>
 * A {@link Collection} or an array contributes its items, any other value is appended
 * as a single item and {@code null} leaves the stored sequence untouched.
 */
public class AppendStrategy implements KeyStrategy {

	@Override
	public Object apply(Object oldValue, Object newValue) {
		if (newValue == null) {
			return oldValue;
		}
		List<Object> result = new ArrayList<>();
		if (oldValue != null) {
			if (!isSequence(oldValue)) {
				throw new IllegalArgumentException(
						format("stored value of type %s is not a sequence", oldValue.getClass().getName()));
			}
			addItems(result, oldValue);
		}
		if (isSequence(newValue)) {
			addItems(result, newValue);
		}
		else {
			result.add(newValue);
		}
		return Collections.unmodifiableList(result);
	}

	@Override
	public Object initialValue(Object value) {
		if (!isSequence(value)) {
			throw new IllegalArgumentException(
					format("initial value of type %s is not a sequence", value.getClass().getName()));
		}
		List<Object> result = new ArrayList<>();
		addItems(result, value);
		return Collections.unmodifiableList(result);
	}

	private static boolean isSequence(Object value) {
		return value instanceof Collection<?> || value.getClass().isArray();
	}

	private static void addItems(List<Object> target, Object sequence) {
		if (sequence instanceof Collection<?> collection) {
			target.addAll(collection);
			return;
		}
		int length = Array.getLength(sequence);
		for (int i = 0; i < length; i++) {
			target.add(Array.get(sequence, i));
		}
	}

	@Override
	public String toString() {
		return "APPEND";
	}

}
