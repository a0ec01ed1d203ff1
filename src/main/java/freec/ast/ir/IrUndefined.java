package freec.ast.ir;

import freec.ast.SourceSpan;

/**
 * The partiality marker {@code undefined}.
 */
public record IrUndefined(SourceSpan span) implements IrExpr {
}
