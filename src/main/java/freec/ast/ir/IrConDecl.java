package freec.ast.ir;

import freec.ast.SourceSpan;

import java.util.List;

public record IrConDecl(SourceSpan span, String name, List<IrType> fieldTypes) implements IrNode {
	public IrConDecl {
		fieldTypes = List.copyOf(fieldTypes);
	}
}
