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
package io.github.supervisorgraph.graph.observation.graph;

import io.micrometer.common.docs.KeyName;
import io.micrometer.observation.Observation;
import io.micrometer.observation.ObservationConvention;
import io.micrometer.observation.docs.ObservationDocumentation;

/**
 * Documentation enum for run observations. Defines the observation convention and the
 * key names attached to every run.
 */
public enum GraphObservationDocumentation implements ObservationDocumentation {

	/**
	 * One run of a compiled graph, from its first step to its terminal status.
	 */
	GRAPH {

		@Override
		public Class<? extends ObservationConvention<? extends Observation.Context>> getDefaultConvention() {
			return GraphObservationConvention.class;
		}

		@Override
		public KeyName[] getLowCardinalityKeyNames() {
			return LowCardinalityKeyNames.values();
		}

		@Override
		public KeyName[] getHighCardinalityKeyNames() {
			return HighCardinalityKeyNames.values();
		}
	};

	public enum LowCardinalityKeyNames implements KeyName {

		/**
		 * Kind of the observed operation.
		 */
		SUPERVISOR_GRAPH_KIND {
			@Override
			public String asString() {
				return "supervisor.graph.kind";
			}
		},

		/**
		 * Name of the graph being run.
		 */
		GRAPH_NAME {
			@Override
			public String asString() {
				return "supervisor.graph.name";
			}
		}

	}

	public enum HighCardinalityKeyNames implements KeyName {

		/**
		 * Identifier of the run.
		 */
		RUN_ID {
			@Override
			public String asString() {
				return "supervisor.graph.run.id";
			}
		},

		/**
		 * Number of steps completed by the run.
		 */
		STEPS {
			@Override
			public String asString() {
				return "supervisor.graph.run.steps";
			}
		},

		/**
		 * Terminal status of the run.
		 */
		OUTCOME {
			@Override
			public String asString() {
				return "supervisor.graph.run.outcome";
			}
		}

	}

}
