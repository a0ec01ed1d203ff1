package freec.ast.ir;

import freec.ast.SourceSpan;

import java.util.List;

public record IrLambda(SourceSpan span, List<IrVarPat> params, IrExpr body) implements IrExpr {
	public IrLambda {
		params = List.copyOf(params);
	}
}
