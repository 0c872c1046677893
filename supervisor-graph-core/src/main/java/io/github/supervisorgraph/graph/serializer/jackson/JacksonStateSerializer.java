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
package io.github.supervisorgraph.graph.serializer.jackson;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.github.supervisorgraph.graph.KeyStrategy;
import io.github.supervisorgraph.graph.NodeOutput;
import io.github.supervisorgraph.graph.OverAllState;
import io.github.supervisorgraph.graph.serializer.StateSerializer;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON serializer backed by a Jackson {@link ObjectMapper}. Map entries are written in
 * key order, so equal snapshots always produce identical text.
 */
public class JacksonStateSerializer extends StateSerializer {

	private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
	};

	protected final ObjectMapper objectMapper;

	public JacksonStateSerializer() {
		this(new ObjectMapper());
	}

	public JacksonStateSerializer(ObjectMapper objectMapper) {
		super("application/json");
		this.objectMapper = objectMapper.copy()
			.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false)
			.configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
	}

	@Override
	public String writeState(OverAllState state) throws IOException {
		return objectMapper.writeValueAsString(state.data());
	}

	@Override
	public String writeSteps(List<NodeOutput> steps) throws IOException {
		List<Map<String, Object>> transcript = new ArrayList<>(steps.size());
		for (NodeOutput step : steps) {
			Map<String, Object> entry = new LinkedHashMap<>();
			entry.put("step", step.step());
			entry.put("node", step.node());
			step.route().ifPresent(route -> entry.put("route", route));
			entry.put("update", step.update());
			entry.put("state", step.state().data());
			transcript.add(entry);
		}
		return objectMapper.writeValueAsString(transcript);
	}

	@Override
	public OverAllState readState(String content, Map<String, KeyStrategy> keyStrategies) throws IOException {
		Map<String, Object> data = objectMapper.readValue(content, MAP_TYPE);
		return OverAllState.initialize(data, keyStrategies);
	}

}
