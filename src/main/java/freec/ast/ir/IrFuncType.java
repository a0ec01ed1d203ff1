package freec.ast.ir;

import freec.ast.SourceSpan;

public record IrFuncType(SourceSpan span, IrType argType, IrType resultType) implements IrType {
}
