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
import freec.ast.ir.IrTypeCon;
import freec.ast.ir.IrTypeVar;
import freec.ast.ir.IrVar;
import freec.ast.ir.IrVarPat;
import freec.ast.ir.IrVisibleTypeApp;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Free and bound variables of expressions, type variables and type constructors of types, in order of first
 * occurrence.
 */
public final class FreeVars {
	private FreeVars() {
	}

	/**
	 * Names of variables and functions that occur free in the expression. Constructors are not included.
	 */
	public static Set<String> freeVars(IrExpr expr) {
		Set<String> result = new LinkedHashSet<>();
		collect(expr, new HashSet<>(), result);
		return result;
	}

	public static Set<String> freeVars(List<? extends IrExpr> exprs) {
		Set<String> result = new LinkedHashSet<>();
		for (IrExpr expr : exprs) {
			collect(expr, new HashSet<>(), result);
		}
		return result;
	}

	public static Set<String> names(List<IrVarPat> varPats) {
		Set<String> names = new LinkedHashSet<>();
		for (IrVarPat varPat : varPats) {
			names.add(varPat.name());
		}
		return names;
	}

	/**
	 * Names of all variables bound by lambdas and {@code case} alternatives in the expression.
	 */
	public static Set<String> boundVars(IrExpr expr) {
		Set<String> result = new LinkedHashSet<>();
		for (IrExpr sub : Subterm.findSubterms(e -> e instanceof IrLambda || e instanceof IrCase, expr)) {
			if (sub instanceof IrLambda lambda) {
				result.addAll(names(lambda.params()));
			} else {
				for (IrAlt alt : ((IrCase) sub).alts()) {
					result.addAll(names(alt.varPats()));
				}
			}
		}
		return result;
	}

	private static void collect(IrExpr expr, Set<String> bound, Set<String> out) {
		if (expr instanceof IrVar var) {
			if (!bound.contains(var.name())) {
				out.add(var.name());
			}
		} else if (expr instanceof IrApp app) {
			collect(app.function(), bound, out);
			collect(app.argument(), bound, out);
		} else if (expr instanceof IrVisibleTypeApp typeApp) {
			collect(typeApp.expr(), bound, out);
		} else if (expr instanceof IrIf ifExpr) {
			collect(ifExpr.condition(), bound, out);
			collect(ifExpr.thenExpr(), bound, out);
			collect(ifExpr.elseExpr(), bound, out);
		} else if (expr instanceof IrCase caseExpr) {
			collect(caseExpr.scrutinee(), bound, out);
			for (IrAlt alt : caseExpr.alts()) {
				collectUnder(alt.varPats(), alt.rhs(), bound, out);
			}
		} else if (expr instanceof IrLambda lambda) {
			collectUnder(lambda.params(), lambda.body(), bound, out);
		}
		// Constructors, literals and error terms have no free variables.
	}

	private static void collectUnder(List<IrVarPat> binders, IrExpr body, Set<String> bound, Set<String> out) {
		Set<String> inner = new HashSet<>(bound);
		inner.addAll(names(binders));
		collect(body, inner, out);
	}

	/**
	 * Names of the type constructors used by the type.
	 */
	public static Set<String> typeCons(IrType type) {
		Set<String> result = new LinkedHashSet<>();
		collectTypeCons(type, result);
		return result;
	}

	public static Set<String> typeVars(IrType type) {
		Set<String> result = new LinkedHashSet<>();
		collectTypeVars(type, result);
		return result;
	}

	private static void collectTypeVars(IrType type, Set<String> out) {
		if (type instanceof IrTypeVar var) {
			out.add(var.name());
		} else if (type instanceof IrTypeApp app) {
			collectTypeVars(app.function(), out);
			collectTypeVars(app.argument(), out);
		} else if (type instanceof IrFuncType func) {
			collectTypeVars(func.argType(), out);
			collectTypeVars(func.resultType(), out);
		}
	}

	private static void collectTypeCons(IrType type, Set<String> out) {
		if (type instanceof IrTypeCon con) {
			out.add(con.name());
		} else if (type instanceof IrTypeApp app) {
			collectTypeCons(app.function(), out);
			collectTypeCons(app.argument(), out);
		} else if (type instanceof IrFuncType func) {
			collectTypeCons(func.argType(), out);
			collectTypeCons(func.resultType(), out);
		}
	}
}
