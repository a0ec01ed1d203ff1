package freec.ast.ir;

import freec.ast.SourceSpan;

import java.util.List;

public record IrTypeSynDecl(SourceSpan span, String name, List<String> typeArgs, IrType rhs) implements IrTypeDecl {
	public IrTypeSynDecl {
		typeArgs = List.copyOf(typeArgs);
	}
}
