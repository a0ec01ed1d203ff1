package freec.ast.ir;

import freec.ast.SourceSpan;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Factories for IR nodes without source location, and helpers to take curried applications apart.
 */
public final class Ir {
	private Ir() {
	}

	public static IrVar var(String name) {
		return new IrVar(SourceSpan.NONE, name);
	}

	public static IrCon con(String name) {
		return new IrCon(SourceSpan.NONE, name);
	}

	public static IrExpr app(IrExpr function, IrExpr... args) {
		return app(function, Arrays.asList(args));
	}

	public static IrExpr app(IrExpr function, List<? extends IrExpr> args) {
		IrExpr result = function;
		for (IrExpr arg : args) {
			result = new IrApp(SourceSpan.NONE, result, arg);
		}
		return result;
	}

	public static IrExpr visibleTypeApp(IrExpr expr, List<? extends IrType> typeArgs) {
		IrExpr result = expr;
		for (IrType typeArg : typeArgs) {
			result = new IrVisibleTypeApp(SourceSpan.NONE, result, typeArg);
		}
		return result;
	}

	/**
	 * Binary operators are ordinary functions, e.g. {@code op("+", a, b)} is {@code (+) a b}.
	 */
	public static IrExpr op(String operator, IrExpr left, IrExpr right) {
		return app(var(operator), left, right);
	}

	public static IrIf ifThenElse(IrExpr condition, IrExpr thenExpr, IrExpr elseExpr) {
		return new IrIf(SourceSpan.NONE, condition, thenExpr, elseExpr);
	}

	public static IrCase caseOf(IrExpr scrutinee, IrAlt... alts) {
		return new IrCase(SourceSpan.NONE, scrutinee, List.of(alts));
	}

	public static IrAlt alt(String conName, List<String> varNames, IrExpr rhs) {
		return new IrAlt(SourceSpan.NONE, new IrConPat(SourceSpan.NONE, conName), varPats(varNames), rhs);
	}

	public static IrLambda lambda(List<String> params, IrExpr body) {
		return new IrLambda(SourceSpan.NONE, varPats(params), body);
	}

	public static IrIntLiteral intLit(long value) {
		return new IrIntLiteral(SourceSpan.NONE, BigInteger.valueOf(value));
	}

	public static IrUndefined undefined() {
		return new IrUndefined(SourceSpan.NONE);
	}

	public static IrErrorExpr error(String message) {
		return new IrErrorExpr(SourceSpan.NONE, message);
	}

	public static IrVarPat varPat(String name) {
		return new IrVarPat(SourceSpan.NONE, name, null);
	}

	public static IrVarPat varPat(String name, IrType type) {
		return new IrVarPat(SourceSpan.NONE, name, type);
	}

	public static List<IrVarPat> varPats(List<String> names) {
		return names.stream().map(Ir::varPat).toList();
	}

	public static IrTypeVar typeVar(String name) {
		return new IrTypeVar(SourceSpan.NONE, name);
	}

	public static IrTypeCon typeCon(String name) {
		return new IrTypeCon(SourceSpan.NONE, name);
	}

	public static IrType typeApp(IrType function, IrType... args) {
		IrType result = function;
		for (IrType arg : args) {
			result = new IrTypeApp(SourceSpan.NONE, result, arg);
		}
		return result;
	}

	/**
	 * Right-associative function type {@code t1 -> ... -> tn}.
	 */
	public static IrType funcType(IrType first, IrType... rest) {
		if (rest.length == 0) {
			return first;
		}
		IrType result = rest[rest.length - 1];
		for (int i = rest.length - 2; i >= 0; i--) {
			result = new IrFuncType(SourceSpan.NONE, rest[i], result);
		}
		return new IrFuncType(SourceSpan.NONE, first, result);
	}

	public static IrFuncDecl funcDecl(String name, List<String> args, IrExpr rhs) {
		return new IrFuncDecl(SourceSpan.NONE, name, List.of(), varPats(args), rhs, null);
	}

	public static IrFuncDecl funcDecl(String name, List<String> typeArgs, List<IrVarPat> args, IrExpr rhs,
			IrType returnType) {
		return new IrFuncDecl(SourceSpan.NONE, name, typeArgs, args, rhs, returnType);
	}

	/**
	 * The expression in function position after stripping all value and type applications.
	 */
	public static IrExpr appHead(IrExpr expr) {
		IrExpr current = expr;
		while (true) {
			if (current instanceof IrApp app) {
				current = app.function();
			} else if (current instanceof IrVisibleTypeApp typeApp) {
				current = typeApp.expr();
			} else {
				return current;
			}
		}
	}

	/**
	 * The value arguments of a curried application in application order.
	 */
	public static List<IrExpr> appArgs(IrExpr expr) {
		List<IrExpr> args = new ArrayList<>();
		IrExpr current = expr;
		while (true) {
			if (current instanceof IrApp app) {
				args.add(app.argument());
				current = app.function();
			} else if (current instanceof IrVisibleTypeApp typeApp) {
				current = typeApp.expr();
			} else {
				break;
			}
		}
		Collections.reverse(args);
		return args;
	}
}
