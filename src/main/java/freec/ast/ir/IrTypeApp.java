package freec.ast.ir;

import freec.ast.SourceSpan;

public record IrTypeApp(SourceSpan span, IrType function, IrType argument) implements IrType {
}
