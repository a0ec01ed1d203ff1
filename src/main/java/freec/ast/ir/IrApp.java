package freec.ast.ir;

import freec.ast.SourceSpan;

public record IrApp(SourceSpan span, IrExpr function, IrExpr argument) implements IrExpr {
}
