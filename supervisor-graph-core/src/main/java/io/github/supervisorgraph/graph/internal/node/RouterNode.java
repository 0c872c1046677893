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
package io.github.supervisorgraph.graph.internal.node;

import io.github.supervisorgraph.graph.action.AsyncRouterAction;
import io.github.supervisorgraph.graph.exception.Errors;
import io.github.supervisorgraph.graph.exception.GraphStateException;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

import static java.lang.String.format;

/**
 * A router node. It contributes no state update; its step yields one label drawn from
 * a closed option set, and the conditional edge leaving it dispatches on that label.
 */
public class RouterNode extends Node {

	private final Set<String> options;

	private final AsyncRouterAction router;

	public RouterNode(String id, Set<String> options, AsyncRouterAction router) {
		super(id, null);
		this.options = options == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(options));
		this.router = router;
	}

	@Override
	public void validate() throws GraphStateException {
		super.validate();
		if (options.isEmpty()) {
			throw Errors.emptyOptionSet.exception(id());
		}
		if (options.stream().anyMatch(Objects::isNull)) {
			throw Errors.nullLabel.exception(id());
		}
	}

	public Set<String> options() {
		return options;
	}

	public AsyncRouterAction router() {
		return router;
	}

	@Override
	public boolean isRouter() {
		return true;
	}

	@Override
	public String toString() {
		return format("RouterNode(%s,%s)", id(), options);
	}

}
