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
package io.github.supervisorgraph.graph.observation.node;

import io.micrometer.common.docs.KeyName;
import io.micrometer.observation.Observation;
import io.micrometer.observation.ObservationConvention;
import io.micrometer.observation.docs.ObservationDocumentation;

public enum GraphNodeObservationDocumentation implements ObservationDocumentation {

	/**
	 * One step: the invocation of a node and the resolution of its outgoing edge.
	 */
	GRAPH_NODE {

		@Override
		public Class<? extends ObservationConvention<? extends Observation.Context>> getDefaultConvention() {
			return GraphNodeObservationConvention.class;
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

		SUPERVISOR_GRAPH_KIND {
			@Override
			public String asString() {
				return "supervisor.graph.kind";
			}
		},

		GRAPH_NAME {
			@Override
			public String asString() {
				return "supervisor.graph.name";
			}
		},

		NODE_ID {
			@Override
			public String asString() {
				return "supervisor.graph.node.id";
			}
		}

	}

	public enum HighCardinalityKeyNames implements KeyName {

		RUN_ID {
			@Override
			public String asString() {
				return "supervisor.graph.run.id";
			}
		},

		STEP {
			@Override
			public String asString() {
				return "supervisor.graph.node.step";
			}
		},

		/**
		 * The node the step routed to.
		 */
		OUTCOME {
			@Override
			public String asString() {
				return "supervisor.graph.node.outcome";
			}
		}

	}

}
