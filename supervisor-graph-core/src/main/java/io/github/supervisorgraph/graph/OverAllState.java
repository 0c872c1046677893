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

import io.github.supervisorgraph.graph.exception.InvalidUpdateException;
import io.github.supervisorgraph.graph.exception.RunnableErrors;
import org.springframework.util.Assert;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

import static java.lang.String.format;

/**
 * Immutable snapshot of the shared state of a run.
 * <p>
 * Every key is bound to a {@link KeyStrategy} by the schema the snapshot was created
 * with. {@link #apply(Map)} never touches the receiver: it merges the update through the
 * key strategies and returns a new snapshot, so a snapshot can be handed to a node, kept
 * in a step transcript or shared between threads without copying.
 */
public final class OverAllState {

	private final Map<String, Object> data;

	private final Map<String, KeyStrategy> keyStrategies;

	private OverAllState(Map<String, Object> data, Map<String, KeyStrategy> keyStrategies) {
		this.data = data;
		this.keyStrategies = keyStrategies;
	}

	/**
	 * Creates the first snapshot of a run.
	 * @param initialState the caller supplied values, may be empty
	 * @param keyStrategies the state schema
	 * @return the initial snapshot
	 * @throws InvalidUpdateException if a key is not declared, or a value cannot be held
	 * by its strategy
	 */
	public static OverAllState initialize(Map<String, Object> initialState, Map<String, KeyStrategy> keyStrategies) {
		Assert.notNull(keyStrategies, "keyStrategies cannot be null");
		Map<String, KeyStrategy> schema = Collections.unmodifiableMap(new LinkedHashMap<>(keyStrategies));
		if (initialState == null || initialState.isEmpty()) {
			return new OverAllState(Map.of(), schema);
		}
		checkDeclared("initial state", initialState.keySet(), schema);

		Map<String, Object> data = new LinkedHashMap<>();
		for (Map.Entry<String, Object> entry : initialState.entrySet()) {
			if (entry.getValue() == null) {
				continue;
			}
			String key = entry.getKey();
			try {
				data.put(key, schema.get(key).initialValue(entry.getValue()));
			}
			catch (IllegalArgumentException | ClassCastException ex) {
				throw new InvalidUpdateException(RunnableErrors.invalidFieldValue.message(key, ex.getMessage()),
						Set.of(key));
			}
		}
		return new OverAllState(Collections.unmodifiableMap(data), schema);
	}

	/**
	 * Merges a partial update into this snapshot.
	 * @param update the values produced by a node, {@code null} or empty for no change
	 * @return the merged snapshot, or this snapshot when the update is empty
	 * @throws InvalidUpdateException if the update references an undeclared key, or its
	 * strategy rejects the value
	 */
	public OverAllState apply(Map<String, Object> update) {
		if (update == null || update.isEmpty()) {
			return this;
		}
		checkDeclared("update", update.keySet(), keyStrategies);

		Map<String, Object> merged = new LinkedHashMap<>(data);
		for (Map.Entry<String, Object> entry : update.entrySet()) {
			String key = entry.getKey();
			Object value;
			try {
				value = keyStrategies.get(key).apply(data.get(key), entry.getValue());
			}
			catch (IllegalArgumentException | ClassCastException ex) {
				throw new InvalidUpdateException(RunnableErrors.invalidFieldValue.message(key, ex.getMessage()),
						Set.of(key));
			}
			if (value == null) {
				merged.remove(key);
			}
			else {
				merged.put(key, value);
			}
		}
		return new OverAllState(Collections.unmodifiableMap(merged), keyStrategies);
	}

	private static void checkDeclared(String source, Set<String> keys, Map<String, KeyStrategy> schema) {
		Set<String> undeclared = new TreeSet<>();
		for (String key : keys) {
			if (!schema.containsKey(key)) {
				undeclared.add(key);
			}
		}
		if (!undeclared.isEmpty()) {
			throw new InvalidUpdateException(RunnableErrors.undeclaredFields.message(source, undeclared), undeclared);
		}
	}

	/**
	 * @return an unmodifiable view of the stored values
	 */
	public Map<String, Object> data() {
		return data;
	}

	public Map<String, KeyStrategy> keyStrategies() {
		return keyStrategies;
	}

	@SuppressWarnings("unchecked")
	public <T> Optional<T> value(String key) {
		return Optional.ofNullable((T) data.get(key));
	}

	public <T> Optional<T> value(String key, Class<T> type) {
		Object value = data.get(key);
		if (value == null) {
			return Optional.empty();
		}
		if (!type.isInstance(value)) {
			throw new ClassCastException(format("value of key '%s' is a %s, not a %s", key,
					value.getClass().getName(), type.getName()));
		}
		return Optional.of(type.cast(value));
	}

	@SuppressWarnings("unchecked")
	public <T> T value(String key, T defaultValue) {
		Object value = data.get(key);
		return value == null ? defaultValue : (T) value;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (!(o instanceof OverAllState that))
			return false;
		return Objects.equals(data, that.data);
	}

	@Override
	public int hashCode() {
		return Objects.hash(data);
	}

	@Override
	public String toString() {
		return "OverAllState{data=" + data + '}';
	}

}
