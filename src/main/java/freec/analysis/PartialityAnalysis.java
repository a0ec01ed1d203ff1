package freec.analysis;

import freec.ast.ir.IrFuncDecl;
import freec.env.Environment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Identifies the functions of a batch that are partial.
 *
 * A function is partial if it uses {@code error} or {@code undefined}, if it refers to a function that the
 * environment already knows to be partial, or if it refers to a partial function of the same batch.
 */
public final class PartialityAnalysis {
	private static final Logger LOG = LoggerFactory.getLogger(PartialityAnalysis.class);

	private PartialityAnalysis() {
	}

	public static Set<String> partialFunctions(DependencyGraph<IrFuncDecl> graph, Environment env) {
		Set<String> partial = new LinkedHashSet<>();
		Deque<String> worklist = new ArrayDeque<>();
		for (DependencyGraph.Entry<IrFuncDecl> entry : graph.entries()) {
			if (usesPartialFunction(graph, entry.dependencies(), env)) {
				partial.add(entry.key());
				worklist.add(entry.key());
			}
		}
		while (!worklist.isEmpty()) {
			String callee = worklist.poll();
			for (DependencyGraph.Entry<IrFuncDecl> entry : graph.entries()) {
				if (entry.dependencies().contains(callee) && partial.add(entry.key())) {
					worklist.add(entry.key());
				}
			}
		}
		if (!partial.isEmpty()) {
			LOG.debug("Partial functions: {}", new TreeSet<>(partial));
		}
		return partial;
	}

	private static boolean usesPartialFunction(DependencyGraph<IrFuncDecl> graph, List<String> dependencies,
			Environment env) {
		for (String key : dependencies) {
			if (key.equals(DependencyGraph.ERROR_KEY) || key.equals(DependencyGraph.UNDEFINED_KEY)) {
				return true;
			}
			if (graph.vertex(key).isEmpty() && env.isPartial(key)) {
				return true;
			}
		}
		return false;
	}
}
