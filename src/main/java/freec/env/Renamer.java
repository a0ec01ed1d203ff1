package freec.env;

import java.util.Set;

/**
 * Assigns target identifiers to source identifiers.
 *
 * Renaming is a pure function of the environment: it never changes counters or entries, only
 * {@link #renameAndAddEntry} adds the renamed entry.
 */
public final class Renamer {
	private static final Set<String> COQ_KEYWORDS = Set.of(
			"as", "at", "cofix", "else", "end", "exists", "exists2", "fix", "for", "forall", "fun", "if", "IF",
			"in", "let", "match", "mod", "Prop", "return", "Set", "then", "Type", "using", "where", "with",
			"Definition", "Fixpoint", "Inductive", "Section", "End", "Variable", "Variables", "Arguments",
			"Theorem", "Lemma", "Proof", "Qed", "Require", "Import", "Export", "Module");

	/** Identifiers of the Free monad library that generated code refers to. */
	private static final Set<String> RESERVED_IDENTS = Set.of(
			"Free", "pure", "impure", "Shape", "Pos", "Partial", "P", "undefined", "error");

	private Renamer() {
	}

	/**
	 * Maps a source identifier to a target identifier that is no keyword, no reserved identifier and not used by
	 * any entry of the environment.
	 */
	public static String renameIdent(String ident, Environment env) {
		String sanitized = sanitize(ident);
		if (isAvailable(sanitized, env)) {
			return sanitized;
		}
		for (int i = 0;; i++) {
			String candidate = sanitized + i;
			if (isAvailable(candidate, env)) {
				return candidate;
			}
		}
	}

	/**
	 * Renames the entry's name and adds the entry to the environment. Constructors additionally get a smart
	 * constructor identifier (the lower-cased name).
	 */
	public static EnvEntry renameAndAddEntry(Environment env, EnvEntry entry) {
		EnvEntry renamed = entry.withCoqIdent(renameIdent(entry.name(), env));
		if (renamed instanceof ConEntry con) {
			env.addEntry(con);
			String smart = Character.toLowerCase(con.name().charAt(0)) + con.name().substring(1);
			renamed = con.withSmartIdent(renameIdent(smart, env));
		}
		env.addEntry(renamed);
		return renamed;
	}

	/**
	 * Target identifier of a local variable or type variable. Local identifiers are not entries of the
	 * environment, so only keywords and reserved identifiers are avoided. The spelling is not injective
	 * ({@code x@0} and {@code x_0} agree); {@link freec.print.CoqPrinter} appends digits where it would hide
	 * another name.
	 */
	public static String localIdent(String ident) {
		String sanitized = sanitize(ident);
		return mustRename(sanitized) ? sanitized + "0" : sanitized;
	}

	public static boolean mustRename(String ident) {
		return COQ_KEYWORDS.contains(ident) || RESERVED_IDENTS.contains(ident);
	}

	public static String sanitize(String ident) {
		StringBuilder sb = new StringBuilder(ident.length());
		for (int i = 0; i < ident.length(); i++) {
			char c = ident.charAt(i);
			if (c == Fresh.INTERNAL_IDENT_CHAR) {
				sb.append('_');
			} else if (Character.isLetterOrDigit(c) || c == '_' || c == '\'') {
				sb.append(c);
			} else {
				sb.append(symbolName(c));
			}
		}
		if (sb.length() == 0 || Character.isDigit(sb.charAt(0))) {
			sb.insert(0, '_');
		}
		return sb.toString();
	}

	private static String symbolName(char c) {
		return switch (c) {
			case '+' -> "op_plus";
			case '-' -> "op_minus";
			case '*' -> "op_times";
			case '/' -> "op_div";
			case '<' -> "op_lt";
			case '>' -> "op_gt";
			case '=' -> "op_eq";
			case ':' -> "op_colon";
			case '.' -> "op_dot";
			case '&' -> "op_and";
			case '|' -> "op_or";
			case '!' -> "op_bang";
			case '$' -> "op_dollar";
			default -> "op_" + (int) c;
		};
	}

	private static boolean isAvailable(String ident, Environment env) {
		return !mustRename(ident) && !env.usedIdents().contains(ident);
	}
}
