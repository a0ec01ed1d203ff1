package freec.ir;

import freec.ast.ir.IrAlt;
import freec.ast.ir.IrApp;
import freec.ast.ir.IrCase;
import freec.ast.ir.IrExpr;
import freec.ast.ir.IrIf;
import freec.ast.ir.IrLambda;
import freec.ast.ir.IrVisibleTypeApp;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Selection, replacement and search of subterms by {@link Pos}.
 *
 * The children of an expression are numbered from {@code 1}: the function and argument of an application, the
 * expression of a visible type application, the condition and both branches of {@code if}, the scrutinee and the
 * right-hand sides of the alternatives of {@code case}, and the body of a lambda.
 */
public final class Subterm {
	private Subterm() {
	}

	public static List<IrExpr> children(IrExpr expr) {
		if (expr instanceof IrApp app) {
			return List.of(app.function(), app.argument());
		}
		if (expr instanceof IrVisibleTypeApp typeApp) {
			return List.of(typeApp.expr());
		}
		if (expr instanceof IrIf ifExpr) {
			return List.of(ifExpr.condition(), ifExpr.thenExpr(), ifExpr.elseExpr());
		}
		if (expr instanceof IrCase caseExpr) {
			List<IrExpr> children = new ArrayList<>();
			children.add(caseExpr.scrutinee());
			for (IrAlt alt : caseExpr.alts()) {
				children.add(alt.rhs());
			}
			return children;
		}
		if (expr instanceof IrLambda lambda) {
			return List.of(lambda.body());
		}
		return List.of();
	}

	/**
	 * Rebuilds the expression with new children; {@code children} must have as many elements as
	 * {@link #children(IrExpr)} returns.
	 */
	public static IrExpr withChildren(IrExpr expr, List<IrExpr> children) {
		if (children.size() != children(expr).size()) {
			throw new IllegalArgumentException("expected " + children(expr).size() + " children, got "
					+ children.size());
		}
		if (expr instanceof IrApp app) {
			return new IrApp(app.span(), children.get(0), children.get(1));
		}
		if (expr instanceof IrVisibleTypeApp typeApp) {
			return new IrVisibleTypeApp(typeApp.span(), children.get(0), typeApp.typeArg());
		}
		if (expr instanceof IrIf ifExpr) {
			return new IrIf(ifExpr.span(), children.get(0), children.get(1), children.get(2));
		}
		if (expr instanceof IrCase caseExpr) {
			List<IrAlt> alts = new ArrayList<>();
			for (int i = 0; i < caseExpr.alts().size(); i++) {
				alts.add(caseExpr.alts().get(i).withRhs(children.get(i + 1)));
			}
			return new IrCase(caseExpr.span(), children.get(0), alts);
		}
		if (expr instanceof IrLambda lambda) {
			return new IrLambda(lambda.span(), lambda.params(), children.get(0));
		}
		return expr;
	}

	public static Optional<IrExpr> selectSubterm(IrExpr expr, Pos pos) {
		IrExpr current = expr;
		for (int index : pos.path()) {
			List<IrExpr> children = children(current);
			if (index < 1 || index > children.size()) {
				return Optional.empty();
			}
			current = children.get(index - 1);
		}
		return Optional.of(current);
	}

	public static Optional<IrExpr> replaceSubterm(IrExpr expr, Pos pos, IrExpr replacement) {
		return replaceAt(expr, pos.path(), replacement);
	}

	private static Optional<IrExpr> replaceAt(IrExpr expr, List<Integer> path, IrExpr replacement) {
		if (path.isEmpty()) {
			return Optional.of(replacement);
		}
		List<IrExpr> children = new ArrayList<>(children(expr));
		int index = path.get(0);
		if (index < 1 || index > children.size()) {
			return Optional.empty();
		}
		Optional<IrExpr> child = replaceAt(children.get(index - 1), path.subList(1, path.size()), replacement);
		if (child.isEmpty()) {
			return Optional.empty();
		}
		children.set(index - 1, child.get());
		return Optional.of(withChildren(expr, children));
	}

	/**
	 * Replaces all given positions. The positions must not be below each other.
	 */
	public static Optional<IrExpr> replaceSubterms(IrExpr expr, Map<Pos, IrExpr> replacements) {
		Optional<IrExpr> result = Optional.of(expr);
		for (Map.Entry<Pos, IrExpr> e : replacements.entrySet()) {
			result = result.flatMap(current -> replaceSubterm(current, e.getKey(), e.getValue()));
		}
		return result;
	}

	/**
	 * Positions of all subterms that satisfy the predicate, in pre-order.
	 */
	public static List<Pos> findSubtermPos(Predicate<IrExpr> predicate, IrExpr expr) {
		List<Pos> result = new ArrayList<>();
		findPos(predicate, expr, Pos.ROOT, result);
		return result;
	}

	private static void findPos(Predicate<IrExpr> predicate, IrExpr expr, Pos pos, List<Pos> out) {
		if (predicate.test(expr)) {
			out.add(pos);
		}
		List<IrExpr> children = children(expr);
		for (int i = 0; i < children.size(); i++) {
			findPos(predicate, children.get(i), pos.child(i + 1), out);
		}
	}

	public static List<IrExpr> findSubterms(Predicate<IrExpr> predicate, IrExpr expr) {
		List<IrExpr> result = new ArrayList<>();
		for (Pos pos : findSubtermPos(predicate, expr)) {
			selectSubterm(expr, pos).ifPresent(result::add);
		}
		return result;
	}

	/**
	 * Variables bound by lambdas and {@code case} alternatives that enclose the given position. Variables bound
	 * by the subterm at the position itself are not included.
	 */
	public static Set<String> boundVarsAt(IrExpr expr, Pos pos) {
		Set<String> bound = new LinkedHashSet<>();
		IrExpr current = expr;
		for (int index : pos.path()) {
			if (current instanceof IrLambda lambda) {
				bound.addAll(FreeVars.names(lambda.params()));
			} else if (current instanceof IrCase caseExpr && index > 1 && index - 2 < caseExpr.alts().size()) {
				bound.addAll(FreeVars.names(caseExpr.alts().get(index - 2).varPats()));
			}
			List<IrExpr> children = children(current);
			if (index < 1 || index > children.size()) {
				return bound;
			}
			current = children.get(index - 1);
		}
		return bound;
	}

	/**
	 * Free variables of the subterm at the given position.
	 */
	public static Set<String> usedVarsAt(IrExpr expr, Pos pos) {
		return selectSubterm(expr, pos).map(FreeVars::freeVars).orElse(Set.of());
	}
}
