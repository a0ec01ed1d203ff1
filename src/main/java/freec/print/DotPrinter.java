package freec.print;

import freec.analysis.DependencyGraph;
import freec.ast.ir.IrDecl;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Prints a dependency graph in the DOT language of Graphviz. Nodes are numbered in the order of the declarations.
 */
public final class DotPrinter {
	public String print(DependencyGraph<? extends IrDecl> graph) {
		StringBuilder out = new StringBuilder();
		String nl = System.lineSeparator();
		out.append("digraph {").append(nl);
		for (int v = 0; v < graph.size(); v++) {
			out.append("  ").append(v).append(" [label=").append(IrPrinter.quote(graph.entry(v).key())).append("];")
					.append(nl);
		}
		for (int v = 0; v < graph.size(); v++) {
			List<Integer> successors = graph.successors(v);
			if (!successors.isEmpty()) {
				out.append("  ").append(v).append(" -> {")
						.append(successors.stream().map(String::valueOf).collect(Collectors.joining(",")))
						.append("};").append(nl);
			}
		}
		return out.append("}").append(nl).toString();
	}
}
