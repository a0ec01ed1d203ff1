package freec.ast.ir;

import freec.ast.SourceSpan;

/**
 * Variable pattern with an optional type annotation ({@code type} may be null).
 */
public record IrVarPat(SourceSpan span, String name, IrType type) implements IrNode {
	public IrVarPat withName(String newName) {
		return new IrVarPat(span, newName, type);
	}

	public IrVarPat withType(IrType newType) {
		return new IrVarPat(span, name, newType);
	}
}
