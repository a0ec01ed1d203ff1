package freec.analysis;

import java.util.List;

/**
 * A strongly connected component of a dependency graph.
 */
public sealed interface DependencyComponent<D> permits DependencyComponent.NonRecursive, DependencyComponent.Recursive {
	/** A single declaration that does not depend on itself. */
	record NonRecursive<D>(D decl) implements DependencyComponent<D> {
		@Override
		public List<D> decls() {
			return List.of(decl);
		}
	}

	/** Mutually recursive declarations, or a single declaration that refers to itself. */
	record Recursive<D>(List<D> decls) implements DependencyComponent<D> {
		public Recursive {
			decls = List.copyOf(decls);
		}
	}

	List<D> decls();
}
