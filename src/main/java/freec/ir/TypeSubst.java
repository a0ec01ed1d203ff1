package freec.ir;

import freec.ast.ir.IrAlt;
import freec.ast.ir.IrApp;
import freec.ast.ir.IrCase;
import freec.ast.ir.IrExpr;
import freec.ast.ir.IrFuncType;
import freec.ast.ir.IrIf;
import freec.ast.ir.IrLambda;
import freec.ast.ir.IrType;
import freec.ast.ir.IrTypeApp;
import freec.ast.ir.IrTypeVar;
import freec.ast.ir.IrVarPat;
import freec.ast.ir.IrVisibleTypeApp;

import java.util.List;
import java.util.Map;

/**
 * Substitution of types for type variables in types and in the type annotations of expressions.
 */
public final class TypeSubst {
	private final Map<String, IrType> mapping;

	public TypeSubst(Map<String, IrType> mapping) {
		this.mapping = Map.copyOf(mapping);
	}

	public static TypeSubst single(String typeVar, IrType type) {
		return new TypeSubst(Map.of(typeVar, type));
	}

	public IrType apply(IrType type) {
		if (type == null) {
			return null;
		}
		if (type instanceof IrTypeVar var) {
			return mapping.getOrDefault(var.name(), var);
		}
		if (type instanceof IrTypeApp app) {
			return new IrTypeApp(app.span(), apply(app.function()), apply(app.argument()));
		}
		if (type instanceof IrFuncType func) {
			return new IrFuncType(func.span(), apply(func.argType()), apply(func.resultType()));
		}
		return type;
	}

	public IrExpr apply(IrExpr expr) {
		if (expr instanceof IrApp app) {
			return new IrApp(app.span(), apply(app.function()), apply(app.argument()));
		}
		if (expr instanceof IrVisibleTypeApp typeApp) {
			return new IrVisibleTypeApp(typeApp.span(), apply(typeApp.expr()), apply(typeApp.typeArg()));
		}
		if (expr instanceof IrIf ifExpr) {
			return new IrIf(ifExpr.span(), apply(ifExpr.condition()), apply(ifExpr.thenExpr()),
					apply(ifExpr.elseExpr()));
		}
		if (expr instanceof IrCase caseExpr) {
			List<IrAlt> alts = caseExpr.alts().stream()
					.map(alt -> new IrAlt(alt.span(), alt.conPat(), applyToPats(alt.varPats()), apply(alt.rhs())))
					.toList();
			return new IrCase(caseExpr.span(), apply(caseExpr.scrutinee()), alts);
		}
		if (expr instanceof IrLambda lambda) {
			return new IrLambda(lambda.span(), applyToPats(lambda.params()), apply(lambda.body()));
		}
		return expr;
	}

	public List<IrVarPat> applyToPats(List<IrVarPat> varPats) {
		return varPats.stream().map(p -> p.withType(apply(p.type()))).toList();
	}
}
