package freec.env;

import freec.ast.SourceSpan;
import freec.ast.ir.IrType;

import java.util.List;

/**
 * Data constructor. Besides the constructor itself, the target declares a smart constructor that lifts the
 * constructed value into the Free monad.
 */
public record ConEntry(SourceSpan span, String name, int arity, List<IrType> argTypes, IrType returnType,
		String coqIdent, String smartIdent) implements EnvEntry {
	public ConEntry {
		argTypes = List.copyOf(argTypes);
	}

	@Override
	public Scope scope() {
		return Scope.VALUE;
	}

	@Override
	public ConEntry withCoqIdent(String ident) {
		return new ConEntry(span, name, arity, argTypes, returnType, ident, smartIdent);
	}

	public ConEntry withSmartIdent(String ident) {
		return new ConEntry(span, name, arity, argTypes, returnType, coqIdent, ident);
	}
}
