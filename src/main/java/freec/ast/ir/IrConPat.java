package freec.ast.ir;

import freec.ast.SourceSpan;

/**
 * Constructor pattern. A wildcard alternative uses the constructor name {@code _}.
 */
public record IrConPat(SourceSpan span, String name) implements IrNode {
	public static final String WILDCARD = "_";

	public boolean isWildcard() {
		return WILDCARD.equals(name);
	}
}
