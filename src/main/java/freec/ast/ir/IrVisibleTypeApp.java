package freec.ast.ir;

import freec.ast.SourceSpan;

/**
 * Explicit type application {@code e @t}.
 */
public record IrVisibleTypeApp(SourceSpan span, IrExpr expr, IrType typeArg) implements IrExpr {
}
