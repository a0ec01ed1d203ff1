package freec.ast.coq;

import freec.ast.ir.IrExpr;
import freec.ast.ir.IrType;

import java.util.List;

/**
 * One function of a {@code Fixpoint} block, structurally recursive on the binder named {@code structArg}.
 */
public record CoqFixBody(String ident, List<String> typeArgs, List<CoqBinder> binders, String structArg,
		IrType returnType, IrExpr rhs) {
	public CoqFixBody {
		typeArgs = List.copyOf(typeArgs);
		binders = List.copyOf(binders);
		if (binders.isEmpty()) {
			throw new IllegalArgumentException("fixpoint body needs at least one binder: " + ident);
		}
	}
}
