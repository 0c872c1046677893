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
package io.github.supervisorgraph.graph.serializer;

import io.github.supervisorgraph.graph.KeyStrategy;
import io.github.supervisorgraph.graph.NodeOutput;
import io.github.supervisorgraph.graph.OverAllState;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Converts snapshots and step transcripts to and from a textual form.
 */
public abstract class StateSerializer {

	private final String contentType;

	protected StateSerializer(String contentType) {
		this.contentType = contentType;
	}

	public String contentType() {
		return contentType;
	}

	public abstract String writeState(OverAllState state) throws IOException;

	/**
	 * Writes the transcript of a run: for each step its number, node, route, update and
	 * resulting snapshot.
	 */
	public abstract String writeSteps(List<NodeOutput> steps) throws IOException;

	/**
	 * Reads a snapshot written by {@link #writeState(OverAllState)}.
	 * @param content the serialized snapshot
	 * @param keyStrategies the schema the snapshot must fit
	 * @return the snapshot
	 * @throws IOException if the content cannot be parsed
	 */
	public abstract OverAllState readState(String content, Map<String, KeyStrategy> keyStrategies)
			throws IOException;

}
