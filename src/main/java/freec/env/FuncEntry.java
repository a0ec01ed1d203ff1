package freec.env;

import freec.ast.SourceSpan;
import freec.ast.ir.IrType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Function entry. Unknown argument types are null elements of {@code argTypes}; an unknown return type is null.
 */
public record FuncEntry(SourceSpan span, String name, int arity, List<String> typeArgs, List<IrType> argTypes,
		IrType returnType, boolean needsFreeArgs, boolean partial, String coqIdent) implements EnvEntry {
	public FuncEntry {
		typeArgs = List.copyOf(typeArgs);
		argTypes = Collections.unmodifiableList(new ArrayList<>(argTypes));
		if (argTypes.size() != arity) {
			throw new IllegalArgumentException("arity of " + name + " does not match its argument types");
		}
	}

	@Override
	public Scope scope() {
		return Scope.VALUE;
	}

	@Override
	public FuncEntry withCoqIdent(String ident) {
		return new FuncEntry(span, name, arity, typeArgs, argTypes, returnType, needsFreeArgs, partial, ident);
	}

	public FuncEntry withPartial(boolean isPartial) {
		return new FuncEntry(span, name, arity, typeArgs, argTypes, returnType, needsFreeArgs, isPartial, coqIdent);
	}
}
