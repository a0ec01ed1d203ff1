package freec.analysis;

import freec.ast.ir.IrAlt;
import freec.ast.ir.IrApp;
import freec.ast.ir.IrCase;
import freec.ast.ir.IrConDecl;
import freec.ast.ir.IrDataDecl;
import freec.ast.ir.IrErrorExpr;
import freec.ast.ir.IrExpr;
import freec.ast.ir.IrFuncDecl;
import freec.ast.ir.IrIf;
import freec.ast.ir.IrLambda;
import freec.ast.ir.IrType;
import freec.ast.ir.IrTypeDecl;
import freec.ast.ir.IrTypeSynDecl;
import freec.ast.ir.IrUndefined;
import freec.ast.ir.IrVar;
import freec.ast.ir.IrVisibleTypeApp;
import freec.ir.FreeVars;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Extracts the keys of the declarations a declaration refers to.
 *
 * Local variables and type variables are never dependencies. Constructors are not dependencies of functions
 * because all data types are declared before any function. The error terms {@code undefined} and
 * {@code error} are reported as {@link DependencyGraph#UNDEFINED_KEY} and {@link DependencyGraph#ERROR_KEY}.
 */
final class DependencyExtraction {
	private DependencyExtraction() {
	}

	static List<String> typeDeclDependencies(IrTypeDecl decl) {
		Set<String> keys = new LinkedHashSet<>();
		if (decl instanceof IrDataDecl data) {
			for (IrConDecl conDecl : data.conDecls()) {
				for (IrType fieldType : conDecl.fieldTypes()) {
					keys.addAll(FreeVars.typeCons(fieldType));
				}
			}
		} else if (decl instanceof IrTypeSynDecl synonym) {
			keys.addAll(FreeVars.typeCons(synonym.rhs()));
		}
		return new ArrayList<>(keys);
	}

	static List<String> funcDeclDependencies(IrFuncDecl decl) {
		Set<String> keys = new LinkedHashSet<>();
		collect(decl.rhs(), new HashSet<>(decl.argNames()), keys);
		return new ArrayList<>(keys);
	}

	private static void collect(IrExpr expr, Set<String> bound, Set<String> out) {
		if (expr instanceof IrVar var) {
			if (!bound.contains(var.name())) {
				out.add(var.name());
			}
		} else if (expr instanceof IrUndefined) {
			out.add(DependencyGraph.UNDEFINED_KEY);
		} else if (expr instanceof IrErrorExpr) {
			out.add(DependencyGraph.ERROR_KEY);
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
				Set<String> inner = new HashSet<>(bound);
				inner.addAll(FreeVars.names(alt.varPats()));
				collect(alt.rhs(), inner, out);
			}
		} else if (expr instanceof IrLambda lambda) {
			Set<String> inner = new HashSet<>(bound);
			inner.addAll(FreeVars.names(lambda.params()));
			collect(lambda.body(), inner, out);
		}
	}
}
