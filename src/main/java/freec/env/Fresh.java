package freec.env;

import freec.ast.ir.Ir;
import freec.ast.ir.IrTypeVar;

import java.util.HashSet;
import java.util.Set;

/**
 * Generation of fresh identifiers.
 *
 * Fresh source identifiers contain {@link #INTERNAL_IDENT_CHAR}, which cannot occur in a user identifier. The
 * marker is preceded by the prefix and followed by a counter starting at {@code 0}. The corresponding target
 * identifier is obtained by {@link Renamer}, which replaces the marker by an underscore.
 */
public final class Fresh {
	public static final char INTERNAL_IDENT_CHAR = '@';

	/** Prefix of artificially introduced variables of type {@code a}. */
	public static final String FRESH_ARG_PREFIX = "x";
	/** Prefix of artificially introduced type variables. */
	public static final String FRESH_TYPE_VAR_PREFIX = "a";
	/** Prefix of section identifiers. */
	public static final String FRESH_SECTION_PREFIX = "section";

	private Fresh() {
	}

	/**
	 * Gets the next fresh source identifier for the given prefix.
	 *
	 * If the prefix is a fresh identifier itself, the prefix of that identifier is used instead. The identifier is
	 * not added to the environment.
	 */
	public static String freshIdent(Environment env, String prefix) {
		return freshIdent(env, prefix, Set.of());
	}

	/**
	 * Gets the next fresh source identifier for the given prefix whose local spelling ({@link Renamer#localIdent})
	 * differs from the spelling of every given local variable.
	 */
	public static String freshIdent(Environment env, String prefix, Set<String> localNames) {
		Set<String> localIdents = new HashSet<>();
		for (String name : localNames) {
			localIdents.add(Renamer.localIdent(name));
		}
		String root = rootPrefix(prefix);
		String ident;
		do {
			ident = root + INTERNAL_IDENT_CHAR + env.nextFreshIndex(root);
		} while (env.isNameUsed(ident) || localIdents.contains(Renamer.localIdent(ident)));
		return ident;
	}

	/**
	 * Gets the next fresh source identifier and renames it such that it can be used in the target language.
	 */
	public static String freshCoqIdent(Environment env, String prefix) {
		return Renamer.renameIdent(freshIdent(env, prefix), env);
	}

	public static IrTypeVar freshTypeVar(Environment env) {
		return Ir.typeVar(freshIdent(env, FRESH_TYPE_VAR_PREFIX));
	}

	public static boolean isFresh(String ident) {
		return ident.indexOf(INTERNAL_IDENT_CHAR) >= 0;
	}

	static String rootPrefix(String prefix) {
		int index = prefix.indexOf(INTERNAL_IDENT_CHAR);
		return index < 0 ? prefix : prefix.substring(0, index);
	}
}
