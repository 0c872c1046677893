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
package io.github.supervisorgraph.graph.diagram;

import io.github.supervisorgraph.graph.DiagramGenerator;

import static io.github.supervisorgraph.graph.StateGraph.END;
import static io.github.supervisorgraph.graph.StateGraph.START;
import static java.lang.String.format;
import static java.util.Optional.ofNullable;

/**
 * Renders a graph as a Mermaid flowchart. Routers are drawn as decision shapes.
 */
public class MermaidGenerator extends DiagramGenerator {

	@Override
	protected void appendHeader(Context ctx) {
		ofNullable(ctx.title()).map(title -> ctx.sb().append(format("---\ntitle: %s\n---\n", title)))
			.orElseGet(ctx::sb)
			.append("flowchart TD\n")
			.append(format("\t%s((start))\n", START))
			.append(format("\t%s((stop))\n", END));
	}

	@Override
	protected void appendFooter(Context ctx) {
		ctx.sb()
			.append('\n')
			.append(format("\tclassDef %s fill:black,stroke-width:1px,font-size:xx-small;\n", START))
			.append(format("\tclassDef %s fill:black,stroke-width:1px,font-size:xx-small;\n", END));
	}

	@Override
	protected void declareRouter(Context ctx, String name) {
		ctx.sb().append(format("\t%s{\"%s\"}\n", name, name));
	}

	@Override
	protected void declareNode(Context ctx, String name) {
		ctx.sb().append(format("\t%s(\"%s\")\n", name, name));
	}

	@Override
	protected void declareConditionalEdge(Context ctx, int ordinal) {
		ctx.sb().append(format("\tcondition%d{\"check state\"}\n", ordinal));
	}

	@Override
	protected void call(Context ctx, String from, String to, CallStyle style) {
		ctx.sb().append(switch (style) {
			case CONDITIONAL -> format("\t%1$s:::%1$s -.-> %2$s:::%2$s\n", from, to);
			default -> format("\t%1$s:::%1$s --> %2$s:::%2$s\n", from, to);
		});
	}

	@Override
	protected void call(Context ctx, String from, String to, String description, CallStyle style) {
		ctx.sb().append(switch (style) {
			case CONDITIONAL -> format("\t%1$s:::%1$s -.->|%2$s| %3$s:::%3$s\n", from, description, to);
			default -> format("\t%1$s:::%1$s -->|%2$s| %3$s:::%3$s\n", from, description, to);
		});
	}

}
