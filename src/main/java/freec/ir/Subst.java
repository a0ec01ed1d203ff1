package freec.ir;

import freec.ast.SourceSpan;
import freec.ast.ir.IrAlt;
import freec.ast.ir.IrApp;
import freec.ast.ir.IrCase;
import freec.ast.ir.IrExpr;
import freec.ast.ir.IrIf;
import freec.ast.ir.IrLambda;
import freec.ast.ir.IrVar;
import freec.ast.ir.IrVarPat;
import freec.ast.ir.IrVisibleTypeApp;
import freec.env.Environment;
import freec.env.Fresh;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Capture-avoiding substitution of expressions for variables.
 *
 * A binder whose name occurs free in an expression that is substituted into its scope is renamed to a fresh
 * identifier first. Subexpressions without free occurrences of substituted variables are returned unchanged.
 */
public final class Subst {
	private final Map<String, IrExpr> mapping;

	private Subst(Map<String, IrExpr> mapping) {
		this.mapping = mapping;
	}

	public static Subst single(String name, IrExpr replacement) {
		return new Subst(Map.of(name, replacement));
	}

	public static Subst of(Map<String, ? extends IrExpr> mapping) {
		return new Subst(new LinkedHashMap<>(mapping));
	}

	/**
	 * Substitution that renames the given variables to the given new names.
	 */
	public static Subst renaming(List<String> from, List<String> to) {
		if (from.size() != to.size()) {
			throw new IllegalArgumentException("renaming needs as many new names as old names");
		}
		Map<String, IrExpr> mapping = new LinkedHashMap<>();
		for (int i = 0; i < from.size(); i++) {
			mapping.put(from.get(i), new IrVar(SourceSpan.NONE, to.get(i)));
		}
		return new Subst(mapping);
	}

	public Map<String, IrExpr> mapping() {
		return mapping;
	}

	public boolean isEmpty() {
		return mapping.isEmpty();
	}

	/**
	 * Composes this substitution with {@code next} such that applying the result is the same as applying this
	 * substitution first and {@code next} afterwards.
	 */
	public Subst andThen(Environment env, Subst next) {
		Map<String, IrExpr> composed = new LinkedHashMap<>();
		for (Map.Entry<String, IrExpr> e : mapping.entrySet()) {
			composed.put(e.getKey(), next.apply(env, e.getValue()));
		}
		for (Map.Entry<String, IrExpr> e : next.mapping.entrySet()) {
			composed.putIfAbsent(e.getKey(), e.getValue());
		}
		return new Subst(composed);
	}

	public Subst without(Collection<String> names) {
		if (names.stream().noneMatch(mapping::containsKey)) {
			return this;
		}
		Map<String, IrExpr> rest = new LinkedHashMap<>(mapping);
		rest.keySet().removeAll(names);
		return new Subst(rest);
	}

	private Subst restrictTo(Set<String> names) {
		Map<String, IrExpr> restricted = new LinkedHashMap<>();
		for (Map.Entry<String, IrExpr> e : mapping.entrySet()) {
			if (names.contains(e.getKey())) {
				restricted.put(e.getKey(), e.getValue());
			}
		}
		return restricted.size() == mapping.size() ? this : new Subst(restricted);
	}

	public IrExpr apply(Environment env, IrExpr expr) {
		Subst relevant = restrictTo(FreeVars.freeVars(expr));
		if (relevant.isEmpty()) {
			return expr;
		}
		return relevant.substitute(env, expr);
	}

	private IrExpr substitute(Environment env, IrExpr expr) {
		if (expr instanceof IrVar var) {
			return mapping.getOrDefault(var.name(), var);
		}
		if (expr instanceof IrApp app) {
			return new IrApp(app.span(), apply(env, app.function()), apply(env, app.argument()));
		}
		if (expr instanceof IrVisibleTypeApp typeApp) {
			return new IrVisibleTypeApp(typeApp.span(), apply(env, typeApp.expr()), typeApp.typeArg());
		}
		if (expr instanceof IrIf ifExpr) {
			return new IrIf(ifExpr.span(), apply(env, ifExpr.condition()), apply(env, ifExpr.thenExpr()),
					apply(env, ifExpr.elseExpr()));
		}
		if (expr instanceof IrCase caseExpr) {
			List<IrAlt> alts = new ArrayList<>();
			for (IrAlt alt : caseExpr.alts()) {
				Scoped scoped = underBinders(env, alt.varPats(), alt.rhs());
				alts.add(new IrAlt(alt.span(), alt.conPat(), scoped.binders(), scoped.body()));
			}
			return new IrCase(caseExpr.span(), apply(env, caseExpr.scrutinee()), alts);
		}
		if (expr instanceof IrLambda lambda) {
			Scoped scoped = underBinders(env, lambda.params(), lambda.body());
			return new IrLambda(lambda.span(), scoped.binders(), scoped.body());
		}
		return expr;
	}

	private record Scoped(List<IrVarPat> binders, IrExpr body) {
	}

	private Scoped underBinders(Environment env, List<IrVarPat> binders, IrExpr body) {
		Subst inner = without(FreeVars.names(binders)).restrictTo(FreeVars.freeVars(body));
		if (inner.isEmpty()) {
			return new Scoped(binders, body);
		}
		Set<String> captured = new HashSet<>(FreeVars.freeVars(new ArrayList<>(inner.mapping.values())));
		List<IrVarPat> newBinders = new ArrayList<>();
		List<String> from = new ArrayList<>();
		List<String> to = new ArrayList<>();
		for (IrVarPat binder : binders) {
			if (captured.contains(binder.name())) {
				String fresh = Fresh.freshIdent(env, binder.name());
				from.add(binder.name());
				to.add(fresh);
				newBinders.add(binder.withName(fresh));
			} else {
				newBinders.add(binder);
			}
		}
		IrExpr renamedBody = from.isEmpty() ? body : renaming(from, to).apply(env, body);
		return new Scoped(newBinders, inner.apply(env, renamedBody));
	}
}
