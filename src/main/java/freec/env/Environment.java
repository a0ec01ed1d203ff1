package freec.env;

import freec.ast.ir.IrTypeSchema;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Ambient state of the conversion of one compilation unit.
 *
 * The environment is single-owner and mutated in place. Local scopes are implemented by taking a
 * {@link Snapshot} and restoring it afterwards; the counters used for fresh identifiers are never part of a
 * snapshot, so an identifier handed out once is never handed out again.
 */
public final class Environment {
	private record Binding(EnvEntry entry, int depth) {
	}

	/**
	 * Saved entries, type signatures and decreasing arguments.
	 */
	public static final class Snapshot {
		private final int depth;
		private final Map<ScopedName, Binding> entries;
		private final Map<String, IrTypeSchema> typeSigs;
		private final Map<String, DecArg> decArgs;

		private Snapshot(int depth, Map<ScopedName, Binding> entries, Map<String, IrTypeSchema> typeSigs,
				Map<String, DecArg> decArgs) {
			this.depth = depth;
			this.entries = entries;
			this.typeSigs = typeSigs;
			this.decArgs = decArgs;
		}
	}

	private int depth;
	private Map<ScopedName, Binding> entries = new LinkedHashMap<>();
	private Map<String, IrTypeSchema> typeSigs = new HashMap<>();
	private Map<String, DecArg> decArgs = new HashMap<>();
	private final Map<String, Integer> freshIdentCounts = new HashMap<>();

	public int depth() {
		return depth;
	}

	public Snapshot snapshot() {
		return new Snapshot(depth, new LinkedHashMap<>(entries), new HashMap<>(typeSigs), new HashMap<>(decArgs));
	}

	public void restore(Snapshot snapshot) {
		this.depth = snapshot.depth;
		this.entries = new LinkedHashMap<>(snapshot.entries);
		this.typeSigs = new HashMap<>(snapshot.typeSigs);
		this.decArgs = new HashMap<>(snapshot.decArgs);
	}

	/**
	 * Enters a nested scope. Entries added afterwards shadow entries of enclosing scopes.
	 */
	public void enterScope() {
		depth++;
	}

	// Entries

	public void addEntry(EnvEntry entry) {
		entries.put(new ScopedName(entry.scope(), entry.name()), new Binding(entry, depth));
	}

	public Optional<EnvEntry> lookupEntry(Scope scope, String name) {
		Binding binding = entries.get(new ScopedName(scope, name));
		return binding == null ? Optional.empty() : Optional.of(binding.entry());
	}

	public boolean isDefined(Scope scope, String name) {
		return entries.containsKey(new ScopedName(scope, name));
	}

	/**
	 * Whether the entry for the given name has been added in the current (innermost) scope.
	 */
	public boolean existsLocalEntry(Scope scope, String name) {
		Binding binding = entries.get(new ScopedName(scope, name));
		return binding != null && binding.depth() == depth;
	}

	public Optional<FuncEntry> lookupFunction(String name) {
		return lookupEntry(Scope.VALUE, name)
				.filter(FuncEntry.class::isInstance)
				.map(FuncEntry.class::cast);
	}

	public boolean isFunction(String name) {
		return lookupFunction(name).isPresent();
	}

	/**
	 * Whether the function with the given name is translated with the {@code Shape} and {@code Pos} arguments of
	 * the Free monad.
	 */
	public boolean needsFreeArgs(String name) {
		return lookupFunction(name).map(FuncEntry::needsFreeArgs).orElse(false);
	}

	public boolean isPartial(String name) {
		return lookupFunction(name).map(FuncEntry::partial).orElse(false);
	}

	public void definePartial(String name) {
		lookupFunction(name).ifPresent(entry -> replaceEntry(entry.withPartial(true)));
	}

	public Optional<Integer> lookupArity(String name) {
		Optional<EnvEntry> entry = lookupEntry(Scope.VALUE, name);
		if (entry.isPresent() && entry.get() instanceof FuncEntry func) {
			return Optional.of(func.arity());
		}
		if (entry.isPresent() && entry.get() instanceof ConEntry con) {
			return Optional.of(con.arity());
		}
		return Optional.empty();
	}

	public Optional<TypeSynEntry> lookupTypeSynonym(String name) {
		return lookupEntry(Scope.TYPE, name)
				.filter(TypeSynEntry.class::isInstance)
				.map(TypeSynEntry.class::cast);
	}

	public Optional<String> lookupIdent(Scope scope, String name) {
		return lookupEntry(scope, name).map(EnvEntry::coqIdent);
	}

	/**
	 * All target identifiers that have been assigned to entries, including smart constructors.
	 */
	public Set<String> usedIdents() {
		Set<String> used = new LinkedHashSet<>();
		for (Binding binding : entries.values()) {
			EnvEntry entry = binding.entry();
			if (entry.coqIdent() != null) {
				used.add(entry.coqIdent());
			}
			if (entry instanceof ConEntry con && con.smartIdent() != null) {
				used.add(con.smartIdent());
			}
		}
		return used;
	}

	/**
	 * Whether any entry uses the given source name, in either scope.
	 */
	public boolean isNameUsed(String name) {
		return isDefined(Scope.VALUE, name) || isDefined(Scope.TYPE, name);
	}

	private void replaceEntry(EnvEntry entry) {
		ScopedName key = new ScopedName(entry.scope(), entry.name());
		Binding old = entries.get(key);
		entries.put(key, new Binding(entry, old == null ? depth : old.depth()));
	}

	// Type signatures

	public void defineTypeSig(String name, IrTypeSchema typeSchema) {
		typeSigs.put(name, typeSchema);
	}

	public Optional<IrTypeSchema> lookupTypeSig(String name) {
		return Optional.ofNullable(typeSigs.get(name));
	}

	// Decreasing arguments

	public void defineDecArg(String funcName, int index, String argName) {
		decArgs.put(funcName, new DecArg(index, argName));
	}

	public Optional<DecArg> lookupDecArg(String funcName) {
		return Optional.ofNullable(decArgs.get(funcName));
	}

	public void removeDecArg(String funcName) {
		decArgs.remove(funcName);
	}

	// Fresh identifiers

	/**
	 * Returns the next unused counter value for the given prefix and increments the counter.
	 */
	int nextFreshIndex(String prefix) {
		int count = freshIdentCounts.getOrDefault(prefix, 0);
		freshIdentCounts.put(prefix, count + 1);
		return count;
	}
}
