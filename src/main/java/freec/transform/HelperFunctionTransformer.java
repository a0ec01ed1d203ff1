package freec.transform;

import freec.analysis.RecursionAnalysis;
import freec.ast.coq.CoqComment;
import freec.ast.coq.CoqFixBody;
import freec.ast.coq.CoqFixpoint;
import freec.ast.coq.CoqSentence;
import freec.ast.ir.Ir;
import freec.ast.ir.IrCase;
import freec.ast.ir.IrExpr;
import freec.ast.ir.IrFuncDecl;
import freec.ast.ir.IrType;
import freec.ast.ir.IrVar;
import freec.ast.ir.IrVarPat;
import freec.env.DecArg;
import freec.env.Environment;
import freec.env.Fresh;
import freec.env.FuncEntry;
import freec.env.Renamer;
import freec.ir.FreeVars;
import freec.ir.Inliner;
import freec.ir.Pos;
import freec.ir.Subterm;
import freec.print.IrPrinter;
import freec.report.ConversionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Converts mutually recursive functions into structurally recursive helper functions and non-recursive main
 * functions.
 *
 * Every {@code case} expression on the decreasing argument of a function is moved into a helper function whose
 * arguments are the variables the {@code case} expression uses. The main function replaces these expressions by
 * calls to the helper functions. Recursive calls in the helper functions are resolved by inlining the main
 * functions, so the helper functions only call each other and become a single {@code Fixpoint}.
 */
public final class HelperFunctionTransformer {
	private static final Logger LOG = LoggerFactory.getLogger(HelperFunctionTransformer.class);

	/**
	 * The helper functions and the main function a function has been split into.
	 */
	record Split(List<IrFuncDecl> helpers, IrFuncDecl main) {
	}

	private final Converter converter;
	private final FuncDeclConverter funcDeclConverter;

	public HelperFunctionTransformer(Converter converter) {
		this.converter = converter;
		this.funcDeclConverter = new FuncDeclConverter(converter);
	}

	/**
	 * Converts the functions. {@link FuncDeclConverter#convertFuncComponent} has added them to the environment
	 * already; for other callers they are added here.
	 */
	public List<CoqSentence> transform(List<IrFuncDecl> decls) {
		Environment env = converter.env();
		for (IrFuncDecl decl : decls) {
			funcDeclConverter.registerFuncDecl(decl);
		}
		List<Integer> decArgs = RecursionAnalysis.identifyDecArgs(decls, env);

		List<IrFuncDecl> helpers = new ArrayList<>();
		List<IrFuncDecl> mains = new ArrayList<>();
		for (int i = 0; i < decls.size(); i++) {
			Split split = split(decls.get(i), decArgs.get(i));
			helpers.addAll(split.helpers());
			mains.add(split.main());
		}

		Set<String> mainNames = mains.stream().map(IrFuncDecl::name).collect(Collectors.toSet());
		List<CoqFixBody> bodies = new ArrayList<>();
		for (IrFuncDecl helper : helpers) {
			IrFuncDecl inlined = converter.localEnv(() -> new Inliner(env, mains).inlineFuncDecl(helper));
			for (String name : FreeVars.freeVars(inlined.rhs())) {
				if (mainNames.contains(name)) {
					throw ConversionException.internal(helper.span(),
							"Unresolved reference to " + name + " in helper function " + helper.name()
									+ " after inlining");
				}
			}
			if (LOG.isDebugEnabled()) {
				LOG.debug("Helper function {}", new IrPrinter().printFuncDecl(inlined));
			}
			bodies.add(convertHelper(inlined));
		}

		List<CoqSentence> sentences = new ArrayList<>();
		if (converter.options().emitHelperComments()) {
			sentences.add(new CoqComment("Helper functions for "
					+ decls.stream().map(decl -> funcDeclConverter.coqIdent(decl.name()))
							.collect(Collectors.joining(", "))));
		}
		sentences.add(new CoqFixpoint(bodies));
		for (IrFuncDecl main : mains) {
			sentences.add(funcDeclConverter.convertNonRecFuncDecl(main));
		}
		return sentences;
	}

	/**
	 * Splits the function into helper functions for the {@code case} expressions on its decreasing argument and a
	 * main function that calls them. The helper functions are added to the environment.
	 */
	Split split(IrFuncDecl decl, int decArgIndex) {
		Environment env = converter.env();
		String decArg = decl.argNames().get(decArgIndex);
		IrExpr rhs = decl.rhs();

		List<Pos> caseExprsPos = new ArrayList<>();
		for (Pos pos : Subterm.findSubtermPos(expr -> isCaseOn(decArg, expr), rhs)) {
			if (Subterm.boundVarsAt(rhs, pos).contains(decArg)) {
				continue;
			}
			if (caseExprsPos.stream().anyMatch(pos::below)) {
				continue;
			}
			caseExprsPos.add(pos);
		}

		FuncEntry entry = funcDeclConverter.entry(decl.name());
		List<IrType> argTypes = funcDeclConverter.argTypes(decl);
		List<IrFuncDecl> helpers = new ArrayList<>();
		Map<Pos, IrExpr> replacements = new LinkedHashMap<>();

		if (caseExprsPos.isEmpty()) {
			IrFuncDecl helper = addHelper(decl, entry, decl.argNames(), Set.of(), argTypes, decArg, rhs,
					funcDeclConverter.returnType(decl));
			helpers.add(helper);
			replacements.put(Pos.ROOT, helperApp(helper, decl.typeArgs()));
		} else {
			for (Pos pos : caseExprsPos) {
				Set<String> boundVars = Subterm.boundVarsAt(rhs, pos);
				Set<String> inScope = new HashSet<>(boundVars);
				inScope.addAll(decl.argNames());
				List<String> helperArgs = new ArrayList<>(new TreeSet<>(Subterm.usedVarsAt(rhs, pos)));
				helperArgs.retainAll(inScope);
				IrExpr caseExpr = Subterm.selectSubterm(rhs, pos)
						.orElseThrow(() -> ConversionException.internal(decl.span(), "Invalid position " + pos));
				IrType returnType = pos.equals(Pos.ROOT) ? funcDeclConverter.returnType(decl) : null;
				IrFuncDecl helper = addHelper(decl, entry, helperArgs, boundVars, argTypes, decArg, caseExpr,
						returnType);
				helpers.add(helper);
				replacements.put(pos, helperApp(helper, decl.typeArgs()));
			}
		}

		IrExpr mainRhs = Subterm.replaceSubterms(rhs, replacements)
				.orElseThrow(() -> ConversionException.internal(decl.span(),
						"Could not replace case expressions in " + decl.name()));
		env.removeDecArg(decl.name());
		return new Split(helpers, decl.withRhs(mainRhs));
	}

	private IrFuncDecl addHelper(IrFuncDecl decl, FuncEntry entry, List<String> helperArgs, Set<String> boundVars,
			List<IrType> argTypes, String decArg, IrExpr rhs, IrType returnType) {
		Environment env = converter.env();
		String helperName = Fresh.freshIdent(env, decl.name(), localNames(decl));
		List<IrType> helperArgTypes = new ArrayList<>();
		List<IrVarPat> helperArgPats = new ArrayList<>();
		for (String arg : helperArgs) {
			int index = decl.argNames().indexOf(arg);
			IrType type = index >= 0 && !boundVars.contains(arg) ? argTypes.get(index) : null;
			helperArgTypes.add(type);
			helperArgPats.add(Ir.varPat(arg, type));
		}
		Renamer.renameAndAddEntry(env, new FuncEntry(decl.span(), helperName, helperArgs.size(), decl.typeArgs(),
				helperArgTypes, returnType, entry.needsFreeArgs(), entry.partial(), null));
		env.defineDecArg(helperName, helperArgs.indexOf(decArg), decArg);
		LOG.debug("Helper function {} for {} decreases on {}", helperName, decl.name(), decArg);
		return new IrFuncDecl(decl.span(), helperName, decl.typeArgs(), helperArgPats, rhs, returnType);
	}

	/**
	 * Arguments and variables bound in the right-hand side of the function.
	 */
	static Set<String> localNames(IrFuncDecl decl) {
		Set<String> names = new HashSet<>(decl.argNames());
		names.addAll(FreeVars.boundVars(decl.rhs()));
		return names;
	}

	private static IrExpr helperApp(IrFuncDecl helper, List<String> typeArgs) {
		List<IrType> types = typeArgs.stream().<IrType>map(Ir::typeVar).toList();
		List<IrExpr> args = helper.argNames().stream().<IrExpr>map(Ir::var).toList();
		return Ir.app(Ir.visibleTypeApp(Ir.var(helper.name()), types), args);
	}

	private static boolean isCaseOn(String decArg, IrExpr expr) {
		return expr instanceof IrCase caseExpr
				&& caseExpr.scrutinee() instanceof IrVar var
				&& var.name().equals(decArg);
	}

	private CoqFixBody convertHelper(IrFuncDecl helper) {
		DecArg decArg = converter.env().lookupDecArg(helper.name())
				.orElseThrow(() -> ConversionException.internal(helper.span(),
						"Helper function " + helper.name() + " has no decreasing argument"));
		return new CoqFixBody(funcDeclConverter.coqIdent(helper.name()),
				FuncDeclConverter.typeArgIdents(helper.typeArgs()), funcDeclConverter.binders(helper),
				decArg.argName(), funcDeclConverter.returnType(helper), helper.rhs());
	}
}
