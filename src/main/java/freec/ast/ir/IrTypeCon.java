package freec.ast.ir;

import freec.ast.SourceSpan;

public record IrTypeCon(SourceSpan span, String name) implements IrType {
}
