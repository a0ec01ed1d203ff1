package freec.env;

import freec.ast.SourceSpan;

/**
 * An entry of the environment. {@code coqIdent} is null until the renamer has assigned a target identifier.
 */
public sealed interface EnvEntry permits DataEntry, TypeSynEntry, ConEntry, FuncEntry {
	SourceSpan span();

	String name();

	String coqIdent();

	Scope scope();

	EnvEntry withCoqIdent(String ident);
}
