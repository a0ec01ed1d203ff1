package freec.ast.ir;

import freec.ast.SourceSpan;

/**
 * A reference to a function or variable.
 */
public record IrVar(SourceSpan span, String name) implements IrExpr {
}
