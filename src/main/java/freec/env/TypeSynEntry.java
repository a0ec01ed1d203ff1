package freec.env;

import freec.ast.SourceSpan;
import freec.ast.ir.IrType;

import java.util.List;

public record TypeSynEntry(SourceSpan span, String name, List<String> typeArgs, IrType rhs, String coqIdent)
		implements EnvEntry {
	public TypeSynEntry {
		typeArgs = List.copyOf(typeArgs);
	}

	@Override
	public Scope scope() {
		return Scope.TYPE;
	}

	@Override
	public TypeSynEntry withCoqIdent(String ident) {
		return new TypeSynEntry(span, name, typeArgs, rhs, ident);
	}
}
