package freec.transform;

import freec.ast.coq.CoqBinder;
import freec.ast.coq.CoqDefinition;
import freec.ast.coq.CoqFixBody;
import freec.ast.coq.CoqFixpoint;
import freec.ast.coq.CoqSection;
import freec.ast.coq.CoqSentence;
import freec.ast.ir.Ir;
import freec.ast.ir.IrAlt;
import freec.ast.ir.IrApp;
import freec.ast.ir.IrCase;
import freec.ast.ir.IrExpr;
import freec.ast.ir.IrFuncDecl;
import freec.ast.ir.IrIf;
import freec.ast.ir.IrLambda;
import freec.ast.ir.IrType;
import freec.ast.ir.IrVar;
import freec.ast.ir.IrVarPat;
import freec.ast.ir.IrVisibleTypeApp;
import freec.env.DecArg;
import freec.env.Environment;
import freec.env.Fresh;
import freec.env.FuncEntry;
import freec.env.Renamer;
import freec.env.Scope;
import freec.ir.FreeVars;
import freec.ir.Subterm;
import freec.report.ConversionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;

/**
 * Converts mutually recursive functions whose constant arguments can be shared in a section.
 *
 * The constant arguments become variables of the section and the type arguments of the functions become type
 * variables of the section. Inside the section, the functions are renamed and take the remaining arguments only;
 * they are converted into helper and main functions. When Coq closes the section, each function is abstracted
 * over the section variables it depends on. After the section, a definition with the original name and arguments
 * applies the section's function to those variables followed by the remaining arguments.
 */
public final class SectionTransformer {
	private static final Logger LOG = LoggerFactory.getLogger(SectionTransformer.class);

	/**
	 * Section variables a function depends on.
	 */
	private record Dependencies(Set<String> typeVariables, Set<String> variables) {
		Dependencies() {
			this(new HashSet<>(), new HashSet<>());
		}

		void addAll(Dependencies other) {
			typeVariables.addAll(other.typeVariables);
			variables.addAll(other.variables);
		}
	}

	private final Converter converter;
	private final FuncDeclConverter funcDeclConverter;

	public SectionTransformer(Converter converter) {
		this.converter = converter;
		this.funcDeclConverter = new FuncDeclConverter(converter);
	}

	/**
	 * Whether the constant arguments can become section variables. A section variable needs a known type, and
	 * that type may only mention type arguments the functions have in common. The functions must have entries.
	 */
	public boolean canShare(List<IrFuncDecl> decls, SortedSet<Integer> constArgs) {
		List<String> typeArgs = decls.get(0).typeArgs();
		for (IrFuncDecl decl : decls) {
			if (!decl.typeArgs().equals(typeArgs)) {
				return false;
			}
		}
		for (int p : constArgs) {
			IrType type = constArgType(decls, p);
			if (type == null || !typeArgs.containsAll(FreeVars.typeVars(type))) {
				return false;
			}
		}
		return true;
	}

	public List<CoqSentence> transform(List<IrFuncDecl> decls, SortedSet<Integer> constArgs) {
		Environment env = converter.env();
		for (IrFuncDecl decl : decls) {
			funcDeclConverter.registerFuncDecl(decl);
		}
		if (!canShare(decls, constArgs)) {
			throw ConversionException.internal(decls.get(0).span(), "Constant arguments " + constArgs + " of "
					+ decls.get(0).name() + " cannot be section variables");
		}
		String sectionIdent = Fresh.freshCoqIdent(env, Fresh.FRESH_SECTION_PREFIX);

		List<String> typeVariables = decls.get(0).typeArgs();
		Map<String, IrType> variables = new LinkedHashMap<>();
		for (int p : constArgs) {
			variables.put(decls.get(0).argNames().get(p), constArgType(decls, p));
		}

		Set<String> localNames = new HashSet<>();
		for (IrFuncDecl decl : decls) {
			localNames.addAll(HelperFunctionTransformer.localNames(decl));
		}
		Map<String, String> renamed = new LinkedHashMap<>();
		for (IrFuncDecl decl : decls) {
			renamed.put(decl.name(), Fresh.freshIdent(env, decl.name(), localNames));
		}
		LOG.debug("Section {} shares constant arguments {} of {}", sectionIdent, constArgs, renamed.keySet());

		List<IrFuncDecl> sectionDecls = new ArrayList<>();
		for (IrFuncDecl decl : decls) {
			sectionDecls.add(removeConstArgs(decl, constArgs, renamed));
		}
		List<CoqSentence> sectionSentences = new HelperFunctionTransformer(converter).transform(sectionDecls);
		Map<String, Dependencies> dependencies = dependencies(sectionSentences, typeVariables, variables);

		List<CoqBinder> binders = new ArrayList<>();
		variables.forEach((name, type) -> binders.add(new CoqBinder(name, type)));
		List<CoqSentence> sentences = new ArrayList<>();
		sentences.add(new CoqSection(sectionIdent, FuncDeclConverter.typeArgIdents(typeVariables), binders,
				sectionSentences));
		for (IrFuncDecl decl : decls) {
			String sectionName = renamed.get(decl.name());
			Dependencies used = dependencies.getOrDefault(funcDeclConverter.coqIdent(sectionName),
					new Dependencies());
			LOG.debug("{} depends on section variables {} {}", sectionName, used.typeVariables(),
					used.variables());
			sentences.add(funcDeclConverter.convertNonRecFuncDecl(wrapper(decl, constArgs, sectionName, used)));
		}
		return sentences;
	}

	private IrType constArgType(List<IrFuncDecl> decls, int position) {
		for (IrFuncDecl decl : decls) {
			IrType type = funcDeclConverter.argTypes(decl).get(position);
			if (type != null) {
				return type;
			}
		}
		return null;
	}

	/**
	 * The section's version of the function: renamed, without type arguments and constant arguments and calling
	 * the renamed functions.
	 */
	private IrFuncDecl removeConstArgs(IrFuncDecl decl, SortedSet<Integer> constArgs, Map<String, String> renamed) {
		Environment env = converter.env();
		String newName = renamed.get(decl.name());
		FuncEntry entry = funcDeclConverter.entry(decl.name());
		List<IrType> argTypes = funcDeclConverter.argTypes(decl);

		List<IrVarPat> args = new ArrayList<>();
		List<IrType> newArgTypes = new ArrayList<>();
		for (int i = 0; i < decl.arity(); i++) {
			if (!constArgs.contains(i)) {
				args.add(decl.args().get(i).withType(argTypes.get(i)));
				newArgTypes.add(argTypes.get(i));
			}
		}
		Renamer.renameAndAddEntry(env, new FuncEntry(decl.span(), newName, args.size(), List.of(), newArgTypes,
				funcDeclConverter.returnType(decl), entry.needsFreeArgs(), entry.partial(), null));

		Optional<DecArg> pragma = env.lookupDecArg(decl.name());
		if (pragma.isPresent()) {
			int index = FreeVars.names(args).stream().toList().indexOf(pragma.get().argName());
			if (index < 0) {
				throw ConversionException.error(decl.span(), "The decreasing argument "
						+ pragma.get().argName() + " of " + decl.name() + " is passed unchanged to every call");
			}
			env.defineDecArg(newName, index, pragma.get().argName());
		}

		Set<String> shadowed = new HashSet<>(decl.argNames());
		shadowed.retainAll(renamed.keySet());
		IrExpr rhs = new CallRewriter(constArgs, renamed).rewrite(decl.rhs(), shadowed);
		return new IrFuncDecl(decl.span(), newName, List.of(), args, rhs, funcDeclConverter.returnType(decl));
	}

	/**
	 * The section variables each function of the section depends on, by Coq identifier: the variables it
	 * mentions, the variables of the section functions it calls and the type variables of their types. The
	 * functions of a {@code Fixpoint} block share their dependencies.
	 */
	private Map<String, Dependencies> dependencies(List<CoqSentence> sentences, List<String> typeVariables,
			Map<String, IrType> variables) {
		Map<String, Dependencies> result = new HashMap<>();
		for (CoqSentence sentence : sentences) {
			if (sentence instanceof CoqFixpoint fixpoint) {
				Dependencies block = new Dependencies();
				for (CoqFixBody body : fixpoint.bodies()) {
					block.addAll(mentioned(body.binders(), body.returnType(), body.rhs(), result, typeVariables,
							variables));
				}
				for (CoqFixBody body : fixpoint.bodies()) {
					result.put(body.ident(), block);
				}
			} else if (sentence instanceof CoqDefinition def) {
				result.put(def.ident(), mentioned(def.binders(), def.returnType(), def.rhs(), result,
						typeVariables, variables));
			}
		}
		return result;
	}

	private Dependencies mentioned(List<CoqBinder> binders, IrType returnType, IrExpr rhs,
			Map<String, Dependencies> known, List<String> typeVariables, Map<String, IrType> variables) {
		Dependencies result = new Dependencies();
		List<IrType> types = new ArrayList<>();
		types.add(returnType);
		Set<String> bound = new HashSet<>();
		for (CoqBinder binder : binders) {
			types.add(binder.type());
			bound.add(binder.name());
		}
		types.addAll(annotations(rhs));
		for (String name : FreeVars.freeVars(rhs)) {
			if (bound.contains(name)) {
				continue;
			}
			if (variables.containsKey(name)) {
				result.variables().add(name);
			} else {
				converter.env().lookupIdent(Scope.VALUE, name).map(known::get).ifPresent(result::addAll);
			}
		}
		for (String name : result.variables()) {
			types.add(variables.get(name));
		}
		for (IrType type : types) {
			for (String typeVar : FreeVars.typeVars(type)) {
				if (typeVariables.contains(typeVar)) {
					result.typeVariables().add(typeVar);
				}
			}
		}
		return result;
	}

	/**
	 * Types of visible type applications and annotated binders in the expression.
	 */
	private static List<IrType> annotations(IrExpr expr) {
		List<IrType> types = new ArrayList<>();
		for (IrExpr sub : Subterm.findSubterms(e -> true, expr)) {
			if (sub instanceof IrVisibleTypeApp typeApp) {
				types.add(typeApp.typeArg());
			} else if (sub instanceof IrLambda lambda) {
				lambda.params().forEach(param -> types.add(param.type()));
			} else if (sub instanceof IrCase caseExpr) {
				for (IrAlt alt : caseExpr.alts()) {
					alt.varPats().forEach(varPat -> types.add(varPat.type()));
				}
			}
		}
		return types;
	}

	/**
	 * {@code f @a x1 ... xn = f' a c1 ... ck r1 ... rm} where {@code a} and {@code c1 ... ck} are the section
	 * variables {@code f'} depends on.
	 */
	private static IrFuncDecl wrapper(IrFuncDecl decl, SortedSet<Integer> constArgs, String sectionName,
			Dependencies used) {
		List<IrExpr> args = new ArrayList<>();
		for (String typeArg : decl.typeArgs()) {
			if (used.typeVariables().contains(typeArg)) {
				args.add(Ir.var(typeArg));
			}
		}
		for (int p : constArgs) {
			if (used.variables().contains(decl.argNames().get(p))) {
				args.add(Ir.var(decl.argNames().get(p)));
			}
		}
		for (int i = 0; i < decl.arity(); i++) {
			if (!constArgs.contains(i)) {
				args.add(Ir.var(decl.argNames().get(i)));
			}
		}
		return decl.withRhs(Ir.app(Ir.var(sectionName), args));
	}

	/**
	 * Replaces calls of the functions of the group by calls of their section versions without the type arguments
	 * and the constant arguments.
	 */
	private static final class CallRewriter {
		private final SortedSet<Integer> constArgs;
		private final Map<String, String> renamed;

		CallRewriter(SortedSet<Integer> constArgs, Map<String, String> renamed) {
			this.constArgs = constArgs;
			this.renamed = renamed;
		}

		IrExpr rewrite(IrExpr expr, Set<String> shadowed) {
			if (expr instanceof IrVar || expr instanceof IrApp || expr instanceof IrVisibleTypeApp) {
				IrExpr head = Ir.appHead(expr);
				if (head instanceof IrVar var && renamed.containsKey(var.name()) && !shadowed.contains(var.name())) {
					return rewriteCall(expr, var, shadowed);
				}
			}
			if (expr instanceof IrApp app) {
				return new IrApp(app.span(), rewrite(app.function(), shadowed), rewrite(app.argument(), shadowed));
			}
			if (expr instanceof IrVisibleTypeApp typeApp) {
				return new IrVisibleTypeApp(typeApp.span(), rewrite(typeApp.expr(), shadowed), typeApp.typeArg());
			}
			if (expr instanceof IrIf ifExpr) {
				return new IrIf(ifExpr.span(), rewrite(ifExpr.condition(), shadowed),
						rewrite(ifExpr.thenExpr(), shadowed), rewrite(ifExpr.elseExpr(), shadowed));
			}
			if (expr instanceof IrCase caseExpr) {
				List<IrAlt> alts = new ArrayList<>();
				for (IrAlt alt : caseExpr.alts()) {
					alts.add(alt.withRhs(rewrite(alt.rhs(), extend(shadowed, alt.varPats()))));
				}
				return new IrCase(caseExpr.span(), rewrite(caseExpr.scrutinee(), shadowed), alts);
			}
			if (expr instanceof IrLambda lambda) {
				return new IrLambda(lambda.span(), lambda.params(),
						rewrite(lambda.body(), extend(shadowed, lambda.params())));
			}
			return expr;
		}

		private IrExpr rewriteCall(IrExpr call, IrVar head, Set<String> shadowed) {
			List<IrExpr> args = Ir.appArgs(call);
			if (!constArgs.isEmpty() && args.size() <= constArgs.last()) {
				throw ConversionException.internal(call.span(),
						"Call of " + head.name() + " does not pass all constant arguments");
			}
			IrExpr result = new IrVar(head.span(), renamed.get(head.name()));
			for (int i = 0; i < args.size(); i++) {
				if (!constArgs.contains(i)) {
					result = new IrApp(call.span(), result, rewrite(args.get(i), shadowed));
				}
			}
			return result;
		}

		private Set<String> extend(Set<String> shadowed, List<IrVarPat> binders) {
			Set<String> result = new HashSet<>(shadowed);
			for (IrVarPat binder : binders) {
				if (renamed.containsKey(binder.name())) {
					result.add(binder.name());
				}
			}
			return result;
		}
	}
}
