package freec.analysis;

import freec.ast.ir.IrDecl;
import freec.ast.ir.IrFuncDecl;
import freec.ast.ir.IrTypeDecl;
import freec.report.ConversionException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Directed graph whose nodes are the declarations of one batch. There is an edge from {@code A} to {@code B} if
 * the declaration of {@code A} refers to {@code B}, i.e. {@code B} has to be defined before {@code A} or both
 * have to be defined in the same sentence.
 *
 * Type declarations and function declarations live in separate namespaces and are never mixed in one graph.
 * Every entry keeps all keys its declaration refers to, including keys of predefined functions and the special
 * error keys; only edges are restricted to the nodes of the graph. Undefined identifiers are not reported here.
 */
public final class DependencyGraph<D extends IrDecl> {
	/** The key that functions using {@code error "<message>"} depend on. */
	public static final String ERROR_KEY = "error";
	/** The key that functions using {@code undefined} depend on. */
	public static final String UNDEFINED_KEY = "undefined";

	/**
	 * A node of the graph: the declaration, its key and the keys of all declarations it depends on.
	 */
	public record Entry<D>(D decl, String key, List<String> dependencies) {
		public Entry {
			dependencies = List.copyOf(dependencies);
		}
	}

	private final List<Entry<D>> entries;
	private final Map<String, Integer> vertices = new LinkedHashMap<>();
	private final List<List<Integer>> successors = new ArrayList<>();

	private DependencyGraph(List<Entry<D>> entries) {
		this.entries = List.copyOf(entries);
		for (int v = 0; v < this.entries.size(); v++) {
			Entry<D> entry = this.entries.get(v);
			if (vertices.putIfAbsent(entry.key(), v) != null) {
				throw ConversionException.error(entry.decl().span(), "Duplicate declaration of " + entry.key());
			}
		}
		for (Entry<D> entry : this.entries) {
			List<Integer> adjacent = new ArrayList<>();
			for (String dependency : entry.dependencies()) {
				Integer w = vertices.get(dependency);
				if (w != null) {
					adjacent.add(w);
				}
			}
			successors.add(Collections.unmodifiableList(adjacent));
		}
	}

	private static <D extends IrDecl> DependencyGraph<D> build(List<D> decls, Function<D, List<String>> deps) {
		List<Entry<D>> entries = new ArrayList<>();
		for (D decl : decls) {
			entries.add(new Entry<>(decl, decl.name(), deps.apply(decl)));
		}
		return new DependencyGraph<>(entries);
	}

	public static DependencyGraph<IrTypeDecl> typeDependencyGraph(List<IrTypeDecl> decls) {
		return build(decls, DependencyExtraction::typeDeclDependencies);
	}

	public static DependencyGraph<IrFuncDecl> funcDependencyGraph(List<IrFuncDecl> decls) {
		return build(decls, DependencyExtraction::funcDeclDependencies);
	}

	public List<Entry<D>> entries() {
		return entries;
	}

	public int size() {
		return entries.size();
	}

	public Entry<D> entry(int vertex) {
		return entries.get(vertex);
	}

	public Optional<Integer> vertex(String key) {
		return Optional.ofNullable(vertices.get(key));
	}

	/**
	 * Vertices the given vertex has an edge to, in order of first reference.
	 */
	public List<Integer> successors(int vertex) {
		return successors.get(vertex);
	}

	public boolean hasEdge(String from, String to) {
		Integer v = vertices.get(from);
		Integer w = vertices.get(to);
		return v != null && w != null && successors.get(v).contains(w);
	}
}
