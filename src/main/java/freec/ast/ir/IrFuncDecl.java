package freec.ast.ir;

import freec.ast.SourceSpan;

import java.util.List;

/**
 * Function declaration {@code f @a1 ... @an x1 ... xm = rhs}.
 *
 * {@code returnType} is null unless the return type has been annotated.
 */
public record IrFuncDecl(SourceSpan span, String name, List<String> typeArgs, List<IrVarPat> args, IrExpr rhs,
		IrType returnType) implements IrDecl {
	public IrFuncDecl {
		typeArgs = List.copyOf(typeArgs);
		args = List.copyOf(args);
	}

	public int arity() {
		return args.size();
	}

	public List<String> argNames() {
		return args.stream().map(IrVarPat::name).toList();
	}

	public IrFuncDecl withName(String newName) {
		return new IrFuncDecl(span, newName, typeArgs, args, rhs, returnType);
	}

	public IrFuncDecl withRhs(IrExpr newRhs) {
		return new IrFuncDecl(span, name, typeArgs, args, newRhs, returnType);
	}
}
