package freec.ast.ir;

import freec.ast.SourceSpan;

/**
 * The partiality marker {@code error "<message>"}.
 */
public record IrErrorExpr(SourceSpan span, String message) implements IrExpr {
}
