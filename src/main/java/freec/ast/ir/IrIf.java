package freec.ast.ir;

import freec.ast.SourceSpan;

public record IrIf(SourceSpan span, IrExpr condition, IrExpr thenExpr, IrExpr elseExpr) implements IrExpr {
}
