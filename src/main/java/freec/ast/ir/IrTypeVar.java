package freec.ast.ir;

import freec.ast.SourceSpan;

public record IrTypeVar(SourceSpan span, String name) implements IrType {
}
