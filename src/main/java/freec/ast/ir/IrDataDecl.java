package freec.ast.ir;

import freec.ast.SourceSpan;

import java.util.List;

public record IrDataDecl(SourceSpan span, String name, List<String> typeArgs, List<IrConDecl> conDecls)
		implements IrTypeDecl {
	public IrDataDecl {
		typeArgs = List.copyOf(typeArgs);
		conDecls = List.copyOf(conDecls);
	}
}
