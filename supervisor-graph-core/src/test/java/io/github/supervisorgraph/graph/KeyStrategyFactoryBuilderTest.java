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

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class KeyStrategyFactoryBuilderTest {

	@Test
	void buildsSchemaInDeclarationOrder() {
		Map<String, KeyStrategy> schema = new KeyStrategyFactoryBuilder().addStrategy("messages", KeyStrategy.APPEND)
			.addStrategy("next")
			.build()
			.apply();

		assertEquals(List.of("messages", "next"), List.copyOf(schema.keySet()));
		assertSame(KeyStrategy.APPEND, schema.get("messages"));
		assertSame(KeyStrategy.REPLACE, schema.get("next"));
	}

	@Test
	void keyCannotBeDeclaredTwice() {
		KeyStrategyFactoryBuilder builder = new KeyStrategyFactoryBuilder().addStrategy("next");

		assertThrows(IllegalArgumentException.class, () -> builder.addStrategy("next", KeyStrategy.APPEND));
	}

	@Test
	void builtSchemaIsFrozen() {
		KeyStrategyFactory factory = new KeyStrategyFactoryBuilder().addStrategy("next").build();

		assertThrows(UnsupportedOperationException.class, () -> factory.apply().put("other", KeyStrategy.REPLACE));
	}

}
