package freec.analysis;

import freec.ast.ir.IrDecl;
import freec.ast.ir.IrFuncDecl;
import freec.ast.ir.IrTypeDecl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;

/**
 * Strongly connected components of a dependency graph in dependency order.
 *
 * The components are computed with Tarjan's algorithm, which emits a component only after all components it
 * depends on. Roots and successors are visited in descending key order, so components that do not depend on each
 * other appear in reverse name order. The declarations of a recursive component keep the order of the input.
 */
public final class DependencyAnalysis {
	private static final Logger LOG = LoggerFactory.getLogger(DependencyAnalysis.class);

	private DependencyAnalysis() {
	}

	public static List<DependencyComponent<IrTypeDecl>> groupTypeDecls(List<IrTypeDecl> decls) {
		return groupDependencies(DependencyGraph.typeDependencyGraph(decls));
	}

	public static List<DependencyComponent<IrFuncDecl>> groupFuncDecls(List<IrFuncDecl> decls) {
		return groupDependencies(DependencyGraph.funcDependencyGraph(decls));
	}

	public static <D extends IrDecl> List<DependencyComponent<D>> groupDependencies(DependencyGraph<D> graph) {
		List<DependencyComponent<D>> components = new ArrayList<>();
		for (List<Integer> scc : new Tarjan<>(graph).run()) {
			if (scc.size() == 1 && !graph.successors(scc.get(0)).contains(scc.get(0))) {
				components.add(new DependencyComponent.NonRecursive<>(graph.entry(scc.get(0)).decl()));
			} else {
				List<D> decls = new ArrayList<>();
				scc.stream().sorted().forEach(v -> decls.add(graph.entry(v).decl()));
				components.add(new DependencyComponent.Recursive<>(decls));
			}
		}
		if (LOG.isDebugEnabled()) {
			LOG.debug("{} declarations form {} components: {}", graph.size(), components.size(),
					components.stream().map(DependencyAnalysis::describe).toList());
		}
		return components;
	}

	private static String describe(DependencyComponent<? extends IrDecl> component) {
		String names = String.join(", ", component.decls().stream().map(IrDecl::name).toList());
		return component instanceof DependencyComponent.Recursive<?> ? "rec {" + names + "}" : names;
	}

	private static final class Tarjan<D extends IrDecl> {
		private final DependencyGraph<D> graph;
		private final int[] index;
		private final int[] lowLink;
		private final boolean[] onStack;
		private final Deque<Integer> stack = new ArrayDeque<>();
		private final List<List<Integer>> result = new ArrayList<>();
		private int counter;

		Tarjan(DependencyGraph<D> graph) {
			this.graph = graph;
			this.index = new int[graph.size()];
			this.lowLink = new int[graph.size()];
			this.onStack = new boolean[graph.size()];
			Arrays.fill(index, -1);
		}

		List<List<Integer>> run() {
			for (int v : descendingByKey(allVertices())) {
				if (index[v] < 0) {
					visit(v);
				}
			}
			return result;
		}

		private void visit(int v) {
			index[v] = counter;
			lowLink[v] = counter;
			counter++;
			stack.push(v);
			onStack[v] = true;

			for (int w : descendingByKey(graph.successors(v))) {
				if (index[w] < 0) {
					visit(w);
					lowLink[v] = Math.min(lowLink[v], lowLink[w]);
				} else if (onStack[w]) {
					lowLink[v] = Math.min(lowLink[v], index[w]);
				}
			}

			if (lowLink[v] == index[v]) {
				List<Integer> scc = new ArrayList<>();
				int w;
				do {
					w = stack.pop();
					onStack[w] = false;
					scc.add(w);
				} while (w != v);
				result.add(scc);
			}
		}

		private List<Integer> allVertices() {
			List<Integer> vertices = new ArrayList<>();
			for (int v = 0; v < graph.size(); v++) {
				vertices.add(v);
			}
			return vertices;
		}

		private List<Integer> descendingByKey(List<Integer> vertices) {
			List<Integer> sorted = new ArrayList<>(vertices);
			sorted.sort(Comparator.comparing((Integer v) -> graph.entry(v).key()).reversed());
			return sorted;
		}
	}
}
