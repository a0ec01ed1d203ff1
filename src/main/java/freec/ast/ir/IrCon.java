package freec.ast.ir;

import freec.ast.SourceSpan;

/**
 * A reference to a data constructor.
 */
public record IrCon(SourceSpan span, String name) implements IrExpr {
}
