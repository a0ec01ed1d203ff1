package freec.print;

import freec.ast.ir.Ir;
import freec.ast.ir.IrAlt;
import freec.ast.ir.IrApp;
import freec.ast.ir.IrCase;
import freec.ast.ir.IrCon;
import freec.ast.ir.IrConDecl;
import freec.ast.ir.IrDataDecl;
import freec.ast.ir.IrDecl;
import freec.ast.ir.IrErrorExpr;
import freec.ast.ir.IrExpr;
import freec.ast.ir.IrFuncDecl;
import freec.ast.ir.IrFuncType;
import freec.ast.ir.IrIf;
import freec.ast.ir.IrIntLiteral;
import freec.ast.ir.IrLambda;
import freec.ast.ir.IrType;
import freec.ast.ir.IrTypeApp;
import freec.ast.ir.IrTypeCon;
import freec.ast.ir.IrTypeSynDecl;
import freec.ast.ir.IrTypeVar;
import freec.ast.ir.IrUndefined;
import freec.ast.ir.IrVar;
import freec.ast.ir.IrVarPat;
import freec.ast.ir.IrVisibleTypeApp;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Prints the IR in Haskell syntax with explicit type arguments, e.g. {@code f @a x = case x of { ... }}.
 */
public final class IrPrinter {
	private static final int TOP = 0;
	private static final int OPERAND = 1;
	private static final int ATOM = 2;

	public String printDecl(IrDecl decl) {
		if (decl instanceof IrFuncDecl func) {
			return printFuncDecl(func);
		}
		if (decl instanceof IrDataDecl data) {
			String conDecls = data.conDecls().stream().map(this::printConDecl).collect(Collectors.joining(" | "));
			return "data " + head(data.name(), data.typeArgs()) + (conDecls.isEmpty() ? "" : " = " + conDecls);
		}
		IrTypeSynDecl synonym = (IrTypeSynDecl) decl;
		return "type " + head(synonym.name(), synonym.typeArgs()) + " = " + printType(synonym.rhs());
	}

	public String printFuncDecl(IrFuncDecl decl) {
		StringBuilder out = new StringBuilder(name(decl.name()));
		for (String typeArg : decl.typeArgs()) {
			out.append(" @").append(typeArg);
		}
		for (IrVarPat arg : decl.args()) {
			out.append(' ').append(printVarPat(arg));
		}
		if (decl.returnType() != null) {
			out.append(" :: ").append(printType(decl.returnType()));
		}
		return out.append(" = ").append(printExpr(decl.rhs())).toString();
	}

	public String printExpr(IrExpr expr) {
		return expr(expr, TOP);
	}

	public String printType(IrType type) {
		return type(type, TOP);
	}

	private String printConDecl(IrConDecl conDecl) {
		StringBuilder out = new StringBuilder(conDecl.name());
		for (IrType fieldType : conDecl.fieldTypes()) {
			out.append(' ').append(type(fieldType, ATOM));
		}
		return out.toString();
	}

	private String printVarPat(IrVarPat varPat) {
		if (varPat.type() == null) {
			return varPat.name();
		}
		return "(" + varPat.name() + " :: " + printType(varPat.type()) + ")";
	}

	private String expr(IrExpr expr, int prec) {
		if (expr instanceof IrVar var) {
			return name(var.name());
		}
		if (expr instanceof IrCon con) {
			return name(con.name());
		}
		if (expr instanceof IrIntLiteral lit) {
			String text = lit.value().toString();
			return lit.value().signum() < 0 && prec > TOP ? "(" + text + ")" : text;
		}
		if (expr instanceof IrUndefined) {
			return "undefined";
		}
		if (expr instanceof IrErrorExpr error) {
			return parens(prec == ATOM, "error " + quote(error.message()));
		}
		if (expr instanceof IrApp || expr instanceof IrVisibleTypeApp) {
			return application(expr, prec);
		}
		if (expr instanceof IrIf ifExpr) {
			return parens(prec > TOP, "if " + expr(ifExpr.condition(), TOP) + " then " + expr(ifExpr.thenExpr(), TOP)
					+ " else " + expr(ifExpr.elseExpr(), TOP));
		}
		if (expr instanceof IrCase caseExpr) {
			String alts = caseExpr.alts().stream().map(this::alt).collect(Collectors.joining("; "));
			return parens(prec > TOP, "case " + expr(caseExpr.scrutinee(), TOP) + " of { " + alts + " }");
		}
		if (expr instanceof IrLambda lambda) {
			String params = lambda.params().stream().map(this::printVarPat).collect(Collectors.joining(" "));
			return parens(prec > TOP, "\\" + params + " -> " + expr(lambda.body(), TOP));
		}
		throw new IllegalArgumentException("unexpected expression: " + expr);
	}

	private String application(IrExpr expr, int prec) {
		IrExpr head = Ir.appHead(expr);
		List<IrExpr> args = Ir.appArgs(expr);
		if (head instanceof IrVar var && isOperator(var.name()) && args.size() == 2 && expr instanceof IrApp) {
			return parens(prec > TOP, expr(args.get(0), OPERAND) + " " + var.name() + " " + expr(args.get(1), OPERAND));
		}
		return parens(prec == ATOM, applicationParts(expr));
	}

	private String applicationParts(IrExpr expr) {
		if (expr instanceof IrApp app) {
			return applicationParts(app.function()) + " " + expr(app.argument(), ATOM);
		}
		if (expr instanceof IrVisibleTypeApp typeApp) {
			return applicationParts(typeApp.expr()) + " @" + type(typeApp.typeArg(), ATOM);
		}
		return expr(expr, ATOM);
	}

	private String alt(IrAlt alt) {
		StringBuilder out = new StringBuilder(name(alt.conPat().name()));
		for (IrVarPat varPat : alt.varPats()) {
			out.append(' ').append(printVarPat(varPat));
		}
		return out.append(" -> ").append(expr(alt.rhs(), TOP)).toString();
	}

	private String type(IrType type, int prec) {
		if (type instanceof IrTypeVar var) {
			return var.name();
		}
		if (type instanceof IrTypeCon con) {
			return con.name();
		}
		if (type instanceof IrTypeApp app) {
			return parens(prec == ATOM, type(app.function(), OPERAND) + " " + type(app.argument(), ATOM));
		}
		IrFuncType func = (IrFuncType) type;
		return parens(prec > TOP, type(func.argType(), OPERAND) + " -> " + type(func.resultType(), TOP));
	}

	private static String head(String name, List<String> typeArgs) {
		return typeArgs.isEmpty() ? name : name + " " + String.join(" ", typeArgs);
	}

	private static String name(String name) {
		return isOperator(name) ? "(" + name + ")" : name;
	}

	static boolean isOperator(String name) {
		if (name.isEmpty()) {
			return false;
		}
		char c = name.charAt(0);
		return !Character.isLetterOrDigit(c) && c != '_' && c != '(' && c != '[';
	}

	static String quote(String text) {
		return "\"" + text.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
	}

	private static String parens(boolean needed, String text) {
		return needed ? "(" + text + ")" : text;
	}
}
