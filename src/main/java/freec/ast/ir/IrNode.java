package freec.ast.ir;

import freec.ast.SourceSpan;

public sealed interface IrNode permits IrModule, IrDecl, IrConDecl, IrTypeSig, IrDecArgPragma, IrTypeSchema, IrType,
		IrExpr, IrAlt, IrConPat, IrVarPat {
	SourceSpan span();
}
