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

import java.util.Optional;

/**
 * Outcome of a single call into a graph executor: an emitted element, the end of the run,
 * or a failure.
 *
 * @param <E> the element type
 */
public final class GraphResponse<E> {

	private static final GraphResponse<?> DONE = new GraphResponse<>(null, null);

	private final E output;

	private final Throwable error;

	private GraphResponse(E output, Throwable error) {
		this.output = output;
		this.error = error;
	}

	public static <E> GraphResponse<E> of(E output) {
		return new GraphResponse<>(output, null);
	}

	@SuppressWarnings("unchecked")
	public static <E> GraphResponse<E> done() {
		return (GraphResponse<E>) DONE;
	}

	public static <E> GraphResponse<E> error(Throwable error) {
		return new GraphResponse<>(null, error);
	}

	public Optional<E> output() {
		return Optional.ofNullable(output);
	}

	public Optional<Throwable> error() {
		return Optional.ofNullable(error);
	}

	/**
	 * @return {@code true} if the run has ended and no element was emitted
	 */
	public boolean isDone() {
		return output == null && error == null;
	}

	public boolean isError() {
		return error != null;
	}

}
