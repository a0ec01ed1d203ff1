package freec.ir;

import freec.ast.SourceSpan;
import freec.ast.ir.IrAlt;
import freec.ast.ir.IrApp;
import freec.ast.ir.IrCase;
import freec.ast.ir.IrCon;
import freec.ast.ir.IrErrorExpr;
import freec.ast.ir.IrExpr;
import freec.ast.ir.IrFuncDecl;
import freec.ast.ir.IrIf;
import freec.ast.ir.IrIntLiteral;
import freec.ast.ir.IrLambda;
import freec.ast.ir.IrUndefined;
import freec.ast.ir.IrVar;
import freec.ast.ir.IrVarPat;
import freec.ast.ir.IrVisibleTypeApp;
import freec.env.Environment;
import freec.env.Fresh;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Inlines the right-hand sides of function declarations into expressions.
 *
 * Used to inline the non-recursive main function into the recursive helper functions it was split from. An
 * inlined reference introduces fresh variables for the parameters of the function; applications substitute their
 * argument for the first parameter that is still unbound, and parameters that remain unbound are abstracted by a
 * lambda.
 */
public final class Inliner {
	/**
	 * Partially inlined expression together with the type and value parameters that still need to be bound.
	 */
	private record Inlined(List<String> remainingTypeArgs, List<String> remainingArgs, IrExpr expr) {
		static Inlined done(IrExpr expr) {
			return new Inlined(List.of(), List.of(), expr);
		}
	}

	private final Environment env;
	private final Map<String, IrFuncDecl> declMap = new LinkedHashMap<>();

	public Inliner(Environment env, List<IrFuncDecl> decls) {
		this.env = env;
		for (IrFuncDecl decl : decls) {
			declMap.put(decl.name(), decl);
		}
	}

	public IrFuncDecl inlineFuncDecl(IrFuncDecl decl) {
		Set<String> shadowed = new HashSet<>(decl.argNames());
		return decl.withRhs(inlineAndBind(decl.rhs(), shadowed));
	}

	public IrExpr inlineExpr(IrExpr expr) {
		return inlineAndBind(expr, Set.of());
	}

	private IrExpr inlineAndBind(IrExpr expr, Set<String> shadowed) {
		Inlined inlined = inline(expr, shadowed);
		if (inlined.remainingArgs().isEmpty()) {
			return inlined.expr();
		}
		return new IrLambda(SourceSpan.NONE, inlined.remainingArgs().stream()
				.map(name -> new IrVarPat(SourceSpan.NONE, name, null))
				.toList(), inlined.expr());
	}

	private Inlined inline(IrExpr expr, Set<String> shadowed) {
		if (expr instanceof IrVar var) {
			IrFuncDecl decl = declMap.get(var.name());
			if (decl == null || shadowed.contains(var.name())) {
				return Inlined.done(var);
			}
			return renameArgs(decl);
		}
		if (expr instanceof IrApp app) {
			Inlined function = inline(app.function(), shadowed);
			IrExpr arg = inlineAndBind(app.argument(), shadowed);
			if (function.remainingArgs().isEmpty()) {
				return Inlined.done(new IrApp(app.span(), function.expr(), arg));
			}
			List<String> remaining = function.remainingArgs();
			IrExpr substituted = Subst.single(remaining.get(0), arg).apply(env, function.expr());
			return new Inlined(List.of(), remaining.subList(1, remaining.size()), substituted);
		}
		if (expr instanceof IrVisibleTypeApp typeApp) {
			Inlined inner = inline(typeApp.expr(), shadowed);
			List<String> typeArgs = inner.remainingTypeArgs();
			if (typeArgs.isEmpty()) {
				return new Inlined(List.of(), inner.remainingArgs(),
						new IrVisibleTypeApp(typeApp.span(), inner.expr(), typeApp.typeArg()));
			}
			IrExpr substituted = TypeSubst.single(typeArgs.get(0), typeApp.typeArg()).apply(inner.expr());
			return new Inlined(typeArgs.subList(1, typeArgs.size()), inner.remainingArgs(), substituted);
		}
		if (expr instanceof IrIf ifExpr) {
			return Inlined.done(new IrIf(ifExpr.span(), inlineAndBind(ifExpr.condition(), shadowed),
					inlineAndBind(ifExpr.thenExpr(), shadowed), inlineAndBind(ifExpr.elseExpr(), shadowed)));
		}
		if (expr instanceof IrCase caseExpr) {
			List<IrAlt> alts = new ArrayList<>();
			for (IrAlt alt : caseExpr.alts()) {
				alts.add(alt.withRhs(inlineAndBind(alt.rhs(), extend(shadowed, alt.varPats()))));
			}
			return Inlined.done(new IrCase(caseExpr.span(), inlineAndBind(caseExpr.scrutinee(), shadowed), alts));
		}
		if (expr instanceof IrLambda lambda) {
			return Inlined.done(new IrLambda(lambda.span(), lambda.params(),
					inlineAndBind(lambda.body(), extend(shadowed, lambda.params()))));
		}
		if (expr instanceof IrCon || expr instanceof IrIntLiteral || expr instanceof IrUndefined
				|| expr instanceof IrErrorExpr) {
			return Inlined.done(expr);
		}
		throw new IllegalStateException("unexpected expression: " + expr);
	}

	/**
	 * Renames the parameters of the inlined function to fresh variables.
	 */
	private Inlined renameArgs(IrFuncDecl decl) {
		List<String> freshArgs = new ArrayList<>();
		for (String arg : decl.argNames()) {
			freshArgs.add(Fresh.freshIdent(env, arg));
		}
		IrExpr rhs = Subst.renaming(decl.argNames(), freshArgs).apply(env, decl.rhs());
		return new Inlined(decl.typeArgs(), freshArgs, rhs);
	}

	private static Set<String> extend(Set<String> shadowed, List<IrVarPat> binders) {
		Set<String> result = new HashSet<>(shadowed);
		result.addAll(FreeVars.names(binders));
		return result;
	}
}
