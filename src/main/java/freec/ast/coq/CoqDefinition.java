package freec.ast.coq;

import freec.ast.ir.IrExpr;
import freec.ast.ir.IrType;

import java.util.List;

/**
 * {@code Definition ident binders : returnType := rhs.}
 */
public record CoqDefinition(String ident, List<String> typeArgs, List<CoqBinder> binders, IrType returnType,
		IrExpr rhs) implements CoqSentence {
	public CoqDefinition {
		typeArgs = List.copyOf(typeArgs);
		binders = List.copyOf(binders);
	}
}
