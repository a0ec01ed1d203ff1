package freec.ast.coq;

import freec.ast.ir.IrType;

import java.util.List;

/**
 * Definition of a type synonym.
 */
public record CoqTypeDefinition(String ident, List<String> typeArgs, IrType rhs) implements CoqSentence {
	public CoqTypeDefinition {
		typeArgs = List.copyOf(typeArgs);
	}
}
