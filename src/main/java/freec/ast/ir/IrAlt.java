package freec.ast.ir;

import freec.ast.SourceSpan;

import java.util.List;

/**
 * A {@code case} alternative {@code C x1 ... xn -> rhs}.
 *
 * Patterns are flat: a constructor applied to variable patterns.
 */
public record IrAlt(SourceSpan span, IrConPat conPat, List<IrVarPat> varPats, IrExpr rhs) implements IrNode {
	public IrAlt {
		varPats = List.copyOf(varPats);
	}

	public IrAlt withRhs(IrExpr newRhs) {
		return new IrAlt(span, conPat, varPats, newRhs);
	}
}
