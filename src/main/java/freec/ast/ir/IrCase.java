package freec.ast.ir;

import freec.ast.SourceSpan;

import java.util.List;

public record IrCase(SourceSpan span, IrExpr scrutinee, List<IrAlt> alts) implements IrExpr {
	public IrCase {
		alts = List.copyOf(alts);
	}
}
