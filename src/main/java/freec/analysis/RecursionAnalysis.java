package freec.analysis;

import freec.ast.ir.Ir;
import freec.ast.ir.IrAlt;
import freec.ast.ir.IrApp;
import freec.ast.ir.IrCase;
import freec.ast.ir.IrExpr;
import freec.ast.ir.IrFuncDecl;
import freec.ast.ir.IrIf;
import freec.ast.ir.IrLambda;
import freec.ast.ir.IrVar;
import freec.ast.ir.IrVarPat;
import freec.ast.ir.IrVisibleTypeApp;
import freec.env.DecArg;
import freec.env.Environment;
import freec.report.ConversionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Analyses the arguments of a group of mutually recursive functions.
 */
public final class RecursionAnalysis {
	private static final Logger LOG = LoggerFactory.getLogger(RecursionAnalysis.class);

	private RecursionAnalysis() {
	}

	/**
	 * A call from one function of the group to another (or itself).
	 *
	 * @param smallerThan for every argument, the parameters of the caller the argument is a strict structural
	 *                    sub-value of
	 * @param passesParam for every argument, the name of the caller's parameter if the argument is a reference to
	 *                    that (unshadowed) parameter, otherwise null
	 */
	record Call(String caller, String callee, List<Set<String>> smallerThan, List<String> passesParam) {
		int argCount() {
			return smallerThan.size();
		}
	}

	// Decreasing arguments

	/**
	 * Identifies the decreasing argument of every function in the group.
	 *
	 * An argument is decreasing if every recursive call passes a variable that was bound by a pattern of a
	 * {@code case} expression whose scrutinee is that argument (or, transitively, such a variable). A function
	 * with a decreasing-argument pragma keeps the argument named by the pragma, and its calls are not checked.
	 *
	 * @return the index of the decreasing argument of each function, in the order of {@code decls}
	 * @throws ConversionException if there is no or more than one choice of decreasing arguments
	 */
	public static List<Integer> identifyDecArgs(List<IrFuncDecl> decls, Environment env) {
		List<List<Integer>> candidates = new ArrayList<>();
		Set<String> pinned = new HashSet<>();
		for (IrFuncDecl decl : decls) {
			Optional<DecArg> pragma = env.lookupDecArg(decl.name());
			if (pragma.isPresent()) {
				candidates.add(List.of(pragma.get().index()));
				pinned.add(decl.name());
			} else {
				List<Integer> all = new ArrayList<>();
				for (int i = 0; i < decl.arity(); i++) {
					all.add(i);
				}
				candidates.add(all);
			}
		}

		List<Call> calls = collectCalls(decls);
		Map<String, IrFuncDecl> byName = new HashMap<>();
		for (IrFuncDecl decl : decls) {
			byName.put(decl.name(), decl);
		}

		List<List<Integer>> valid = new ArrayList<>();
		search(decls, candidates, calls.stream().filter(call -> !pinned.contains(call.caller())).toList(), byName,
				new ArrayList<>(), valid);

		String names = decls.stream().map(IrFuncDecl::name).collect(Collectors.joining(", "));
		if (valid.isEmpty()) {
			throw ConversionException.error(decls.get(0).span(),
					"Could not identify decreasing arguments of " + names + ". "
							+ "Use a DECREASES ON pragma to specify the decreasing argument.");
		}
		if (valid.size() > 1) {
			throw ConversionException.error(decls.get(0).span(),
					"The decreasing arguments of " + names + " are ambiguous. "
							+ "Use a DECREASES ON pragma to specify the decreasing argument.");
		}
		List<Integer> result = valid.get(0);
		if (LOG.isDebugEnabled()) {
			for (int i = 0; i < decls.size(); i++) {
				LOG.debug("Decreasing argument of {} is {}", decls.get(i).name(),
						decls.get(i).argNames().get(result.get(i)));
			}
		}
		return result;
	}

	private static void search(List<IrFuncDecl> decls, List<List<Integer>> candidates, List<Call> calls,
			Map<String, IrFuncDecl> byName, List<Integer> chosen, List<List<Integer>> valid) {
		if (valid.size() > 1) {
			return;
		}
		if (chosen.size() == decls.size()) {
			if (isValidCombination(decls, chosen, calls, byName)) {
				valid.add(List.copyOf(chosen));
			}
			return;
		}
		for (int index : candidates.get(chosen.size())) {
			chosen.add(index);
			search(decls, candidates, calls, byName, chosen, valid);
			chosen.remove(chosen.size() - 1);
		}
	}

	private static boolean isValidCombination(List<IrFuncDecl> decls, List<Integer> chosen, List<Call> calls,
			Map<String, IrFuncDecl> byName) {
		Map<String, Integer> decArgs = new HashMap<>();
		for (int i = 0; i < decls.size(); i++) {
			decArgs.put(decls.get(i).name(), chosen.get(i));
		}
		for (Call call : calls) {
			int calleeIndex = decArgs.get(call.callee());
			if (calleeIndex >= call.argCount()) {
				return false;
			}
			String callerDecArg = byName.get(call.caller()).argNames().get(decArgs.get(call.caller()));
			if (!call.smallerThan().get(calleeIndex).contains(callerDecArg)) {
				return false;
			}
		}
		return true;
	}

	// Constant arguments

	/**
	 * Identifies the argument positions that are passed on unchanged by every call within the group.
	 *
	 * A position is constant if all functions name their parameter at that position the same and every call
	 * from a function of the group to a function of the group passes that parameter at that position.
	 */
	public static SortedSet<Integer> identifyConstArgs(List<IrFuncDecl> decls) {
		SortedSet<Integer> constArgs = new TreeSet<>();
		int minArity = decls.stream().mapToInt(IrFuncDecl::arity).min().orElse(0);
		List<Call> calls = collectCalls(decls);
		for (int p = 0; p < minArity; p++) {
			String name = decls.get(0).argNames().get(p);
			boolean sameName = true;
			for (IrFuncDecl decl : decls) {
				sameName &= decl.argNames().get(p).equals(name);
			}
			if (sameName && isPassedOn(calls, p, name)) {
				constArgs.add(p);
			}
		}
		LOG.debug("Constant arguments of {}: {}", decls.stream().map(IrFuncDecl::name).toList(), constArgs);
		return constArgs;
	}

	private static boolean isPassedOn(List<Call> calls, int position, String name) {
		for (Call call : calls) {
			if (position >= call.argCount() || !name.equals(call.passesParam().get(position))) {
				return false;
			}
		}
		return true;
	}

	// Calls

	static List<Call> collectCalls(List<IrFuncDecl> decls) {
		Set<String> group = new HashSet<>();
		for (IrFuncDecl decl : decls) {
			group.add(decl.name());
		}
		List<Call> calls = new ArrayList<>();
		for (IrFuncDecl decl : decls) {
			Scope scope = new Scope(Set.copyOf(decl.argNames()), Map.of(), Set.copyOf(decl.argNames()));
			new CallCollector(decl.name(), group, calls).visit(decl.rhs(), scope);
		}
		return calls;
	}

	/**
	 * What is known at a program point: the caller's parameters that are still visible, the parameters each local
	 * variable is a strict sub-value of, and the local variables that shadow functions of the group.
	 */
	private record Scope(Set<String> params, Map<String, Set<String>> smaller, Set<String> shadowed) {
		Scope bind(List<String> names, Set<String> smallerThan) {
			Set<String> newParams = new HashSet<>(params);
			Map<String, Set<String>> newSmaller = new HashMap<>(smaller);
			Set<String> newShadowed = new HashSet<>(shadowed);
			for (String name : names) {
				newParams.remove(name);
				newShadowed.add(name);
				if (smallerThan.isEmpty()) {
					newSmaller.remove(name);
				} else {
					newSmaller.put(name, smallerThan);
				}
			}
			return new Scope(newParams, newSmaller, newShadowed);
		}

		Set<String> roots(IrExpr scrutinee) {
			Set<String> roots = new HashSet<>();
			if (scrutinee instanceof IrVar var) {
				if (params.contains(var.name())) {
					roots.add(var.name());
				}
				roots.addAll(smaller.getOrDefault(var.name(), Set.of()));
			}
			return roots;
		}
	}

	private static final class CallCollector {
		private final String caller;
		private final Set<String> group;
		private final List<Call> calls;

		CallCollector(String caller, Set<String> group, List<Call> calls) {
			this.caller = caller;
			this.group = group;
			this.calls = calls;
		}

		void visit(IrExpr expr, Scope scope) {
			if (expr instanceof IrVar || expr instanceof IrApp || expr instanceof IrVisibleTypeApp) {
				IrExpr head = Ir.appHead(expr);
				List<IrExpr> args = Ir.appArgs(expr);
				if (head instanceof IrVar var && group.contains(var.name()) && !scope.shadowed().contains(var.name())) {
					calls.add(call(var.name(), args, scope));
				} else if (!(head instanceof IrVar)) {
					visit(head, scope);
				}
				for (IrExpr arg : args) {
					visit(arg, scope);
				}
			} else if (expr instanceof IrIf ifExpr) {
				visit(ifExpr.condition(), scope);
				visit(ifExpr.thenExpr(), scope);
				visit(ifExpr.elseExpr(), scope);
			} else if (expr instanceof IrCase caseExpr) {
				visit(caseExpr.scrutinee(), scope);
				Set<String> roots = scope.roots(caseExpr.scrutinee());
				for (IrAlt alt : caseExpr.alts()) {
					visit(alt.rhs(), scope.bind(names(alt.varPats()), roots));
				}
			} else if (expr instanceof IrLambda lambda) {
				visit(lambda.body(), scope.bind(names(lambda.params()), Set.of()));
			}
		}

		private Call call(String callee, List<IrExpr> args, Scope scope) {
			List<Set<String>> smallerThan = new ArrayList<>();
			List<String> passesParam = new ArrayList<>();
			for (IrExpr arg : args) {
				if (arg instanceof IrVar var) {
					smallerThan.add(scope.smaller().getOrDefault(var.name(), Set.of()));
					passesParam.add(scope.params().contains(var.name()) ? var.name() : null);
				} else {
					smallerThan.add(Set.of());
					passesParam.add(null);
				}
			}
			return new Call(caller, callee, smallerThan, passesParam);
		}

		private static List<String> names(List<IrVarPat> varPats) {
			return varPats.stream().map(IrVarPat::name).toList();
		}
	}
}
