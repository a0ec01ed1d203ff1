package freec.env;

import freec.ast.SourceSpan;

public record DataEntry(SourceSpan span, String name, int arity, String coqIdent) implements EnvEntry {
	@Override
	public Scope scope() {
		return Scope.TYPE;
	}

	@Override
	public DataEntry withCoqIdent(String ident) {
		return new DataEntry(span, name, arity, ident);
	}
}
