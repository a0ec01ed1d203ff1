package freec.ast.ir;

import freec.ast.SourceSpan;

import java.util.List;

/**
 * A name-simplified module. {@code name} is null if the module has no header.
 */
public record IrModule(SourceSpan span, String name, List<IrTypeDecl> typeDecls, List<IrTypeSig> typeSigs,
		List<IrDecArgPragma> pragmas, List<IrFuncDecl> funcDecls) implements IrNode {
	public IrModule {
		typeDecls = List.copyOf(typeDecls);
		typeSigs = List.copyOf(typeSigs);
		pragmas = List.copyOf(pragmas);
		funcDecls = List.copyOf(funcDecls);
	}
}
