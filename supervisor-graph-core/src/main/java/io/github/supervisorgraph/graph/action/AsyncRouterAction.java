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
package io.github.supervisorgraph.graph.action;

import io.github.supervisorgraph.graph.OverAllState;

import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Asynchronous decision policy of a router. The returned label must be one of the
 * options the router was registered with.
 */
@FunctionalInterface
public interface AsyncRouterAction extends Function<OverAllState, CompletableFuture<String>> {

	CompletableFuture<String> apply(OverAllState state);

	static AsyncRouterAction router_async(RouterAction syncAction) {
		return state -> {
			CompletableFuture<String> result = new CompletableFuture<>();
			try {
				result.complete(syncAction.apply(state));
			}
			catch (Exception e) {
				result.completeExceptionally(e);
			}
			return result;
		};
	}

}
