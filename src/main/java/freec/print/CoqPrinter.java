package freec.print;

import freec.ast.coq.CoqBinder;
import freec.ast.coq.CoqComment;
import freec.ast.coq.CoqDefinition;
import freec.ast.coq.CoqFixBody;
import freec.ast.coq.CoqFixpoint;
import freec.ast.coq.CoqInductive;
import freec.ast.coq.CoqSection;
import freec.ast.coq.CoqSentence;
import freec.ast.coq.CoqTypeDefinition;
import freec.ast.ir.Ir;
import freec.ast.ir.IrAlt;
import freec.ast.ir.IrApp;
import freec.ast.ir.IrCase;
import freec.ast.ir.IrCon;
import freec.ast.ir.IrErrorExpr;
import freec.ast.ir.IrExpr;
import freec.ast.ir.IrFuncType;
import freec.ast.ir.IrIf;
import freec.ast.ir.IrIntLiteral;
import freec.ast.ir.IrLambda;
import freec.ast.ir.IrType;
import freec.ast.ir.IrTypeApp;
import freec.ast.ir.IrTypeCon;
import freec.ast.ir.IrTypeVar;
import freec.ast.ir.IrUndefined;
import freec.ast.ir.IrVar;
import freec.ast.ir.IrVarPat;
import freec.ast.ir.IrVisibleTypeApp;
import freec.env.Environment;
import freec.env.Renamer;
import freec.env.Scope;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Prints sentences in Coq syntax.
 *
 * Global names are printed with the identifiers the environment assigned to them. Local variables are printed
 * with {@link Renamer#localIdent}, made unique against the globals and the other local variables in scope, so
 * distinct source names never print the same. Type arguments are implicit, so visible type applications are
 * omitted.
 */
public final class CoqPrinter {
	private static final String INDENT = "  ";

	private final Environment env;
	private Set<String> globalIdents = Set.of();

	public CoqPrinter(Environment env) {
		this.env = env;
	}

	public String print(List<CoqSentence> sentences) {
		globalIdents = env.usedIdents();
		StringBuilder out = new StringBuilder();
		String nl = System.lineSeparator();
		for (int i = 0; i < sentences.size(); i++) {
			if (i > 0) {
				out.append(nl);
			}
			out.append(printSentence(sentences.get(i), Map.of())).append(nl);
		}
		return out.toString();
	}

	private String printSentence(CoqSentence sentence, Map<String, String> locals) {
		if (sentence instanceof CoqComment comment) {
			return "(* " + comment.text() + " *)";
		}
		if (sentence instanceof CoqDefinition def) {
			Map<String, String> scope = bind(bindTypeArgs(locals, def.typeArgs()), def.binders());
			return "Definition " + def.ident() + implicitTypeArgs(def.typeArgs()) + binders(def.binders(), scope)
					+ returnType(def.returnType()) + " :=" + System.lineSeparator()
					+ INDENT + expr(def.rhs(), scope, false) + ".";
		}
		if (sentence instanceof CoqTypeDefinition def) {
			return "Definition " + def.ident() + explicitTypeArgs(def.typeArgs()) + " : Type := "
					+ type(def.rhs(), false) + ".";
		}
		if (sentence instanceof CoqInductive inductive) {
			return printInductive(inductive);
		}
		if (sentence instanceof CoqFixpoint fixpoint) {
			return printFixpoint(fixpoint, locals);
		}
		return printSection((CoqSection) sentence, locals);
	}

	private String printInductive(CoqInductive inductive) {
		String nl = System.lineSeparator();
		List<String> bodies = new ArrayList<>();
		for (CoqInductive.Body body : inductive.bodies()) {
			StringBuilder out = new StringBuilder(body.ident()).append(explicitTypeArgs(body.typeArgs()))
					.append(" : Type :=");
			String result = body.typeArgs().isEmpty()
					? body.ident()
					: body.ident() + " " + String.join(" ", body.typeArgs());
			for (CoqInductive.Constructor con : body.constructors()) {
				out.append(nl).append(INDENT).append("| ").append(con.ident()).append(" : ");
				for (IrType fieldType : con.fieldTypes()) {
					out.append(arrowArg(fieldType)).append(" -> ");
				}
				out.append(result);
			}
			bodies.add(out.toString());
		}
		return "Inductive " + String.join(nl + "with ", bodies) + ".";
	}

	private String printFixpoint(CoqFixpoint fixpoint, Map<String, String> locals) {
		String nl = System.lineSeparator();
		List<String> bodies = new ArrayList<>();
		for (CoqFixBody body : fixpoint.bodies()) {
			Map<String, String> scope = bind(bindTypeArgs(locals, body.typeArgs()), body.binders());
			bodies.add(body.ident() + implicitTypeArgs(body.typeArgs()) + binders(body.binders(), scope)
					+ " {struct " + localIdent(body.structArg(), scope) + "}" + returnType(body.returnType())
					+ " :=" + nl + INDENT + expr(body.rhs(), scope, false));
		}
		return "Fixpoint " + String.join(nl + "with ", bodies) + ".";
	}

	private String printSection(CoqSection section, Map<String, String> locals) {
		String nl = System.lineSeparator();
		StringBuilder out = new StringBuilder("Section ").append(section.ident()).append('.').append(nl);
		Map<String, String> scope = bind(bindTypeArgs(locals, section.typeVariables()), section.variables());
		if (!section.typeVariables().isEmpty()) {
			out.append(INDENT).append("Variable ").append(String.join(" ", section.typeVariables()))
					.append(" : Type.").append(nl);
		}
		for (CoqBinder variable : section.variables()) {
			out.append(INDENT).append("Variable ").append(localIdent(variable.name(), scope)).append(" : ")
					.append(type(variable.type(), false)).append('.').append(nl);
		}
		for (CoqSentence sentence : section.sentences()) {
			out.append(nl);
			for (String line : printSentence(sentence, scope).split("\\R")) {
				out.append(INDENT).append(line).append(nl);
			}
		}
		return out.append("End ").append(section.ident()).append('.').toString();
	}

	// Local identifiers

	/**
	 * Adds a local variable to the scope. Its identifier is {@link Renamer#localIdent}, followed by a counter if
	 * that spelling belongs to a global or to another local variable in scope. Shadowing a local variable of the
	 * same name is fine, since the shadowed one cannot be referred to anymore.
	 */
	private Map<String, String> bind(Map<String, String> locals, String name) {
		Set<String> taken = new HashSet<>(globalIdents);
		for (Map.Entry<String, String> local : locals.entrySet()) {
			if (!local.getKey().equals(name)) {
				taken.add(local.getValue());
			}
		}
		String base = Renamer.localIdent(name);
		String ident = base;
		for (int i = 0; taken.contains(ident); i++) {
			ident = base + i;
		}
		Map<String, String> scope = new HashMap<>(locals);
		scope.put(name, ident);
		return scope;
	}

	private Map<String, String> bind(Map<String, String> locals, List<CoqBinder> binders) {
		Map<String, String> scope = locals;
		for (CoqBinder binder : binders) {
			scope = bind(scope, binder.name());
		}
		return scope;
	}

	private Map<String, String> bindPats(Map<String, String> locals, List<IrVarPat> varPats) {
		Map<String, String> scope = locals;
		for (IrVarPat varPat : varPats) {
			scope = bind(scope, varPat.name());
		}
		return scope;
	}

	/**
	 * Type arguments are printed as they are given; value variables are renamed around them.
	 */
	private static Map<String, String> bindTypeArgs(Map<String, String> locals, List<String> typeArgs) {
		if (typeArgs.isEmpty()) {
			return locals;
		}
		Map<String, String> scope = new HashMap<>(locals);
		for (String typeArg : typeArgs) {
			scope.put(typeArg, typeArg);
		}
		return scope;
	}

	private static String localIdent(String name, Map<String, String> scope) {
		String ident = scope.get(name);
		return ident != null ? ident : Renamer.localIdent(name);
	}

	private String implicitTypeArgs(List<String> typeArgs) {
		return typeArgs.isEmpty() ? "" : " {" + String.join(" ", typeArgs) + " : Type}";
	}

	private String explicitTypeArgs(List<String> typeArgs) {
		return typeArgs.isEmpty() ? "" : " (" + String.join(" ", typeArgs) + " : Type)";
	}

	private String binders(List<CoqBinder> binders, Map<String, String> scope) {
		StringBuilder out = new StringBuilder();
		for (CoqBinder binder : binders) {
			out.append(' ');
			String ident = localIdent(binder.name(), scope);
			if (binder.type() == null) {
				out.append(ident);
			} else {
				out.append('(').append(ident).append(" : ").append(type(binder.type(), false)).append(')');
			}
		}
		return out.toString();
	}

	private String returnType(IrType type) {
		return type == null ? "" : " : " + type(type, false);
	}

	// Expressions

	private String expr(IrExpr expr, Map<String, String> locals, boolean atom) {
		if (expr instanceof IrVar var) {
			return varIdent(var.name(), locals);
		}
		if (expr instanceof IrCon con) {
			return env.lookupIdent(Scope.VALUE, con.name()).orElseGet(() -> Renamer.localIdent(con.name()));
		}
		if (expr instanceof IrIntLiteral lit) {
			return lit.value().signum() < 0 ? "(" + lit.value() + ")" : lit.value().toString();
		}
		if (expr instanceof IrUndefined) {
			return "undefined";
		}
		if (expr instanceof IrErrorExpr error) {
			return parens(atom, "error " + IrPrinter.quote(error.message()));
		}
		if (expr instanceof IrApp || expr instanceof IrVisibleTypeApp) {
			List<IrExpr> args = Ir.appArgs(expr);
			String head = expr(Ir.appHead(expr), locals, true);
			if (args.isEmpty()) {
				return head;
			}
			StringBuilder out = new StringBuilder(head);
			for (IrExpr arg : args) {
				out.append(' ').append(expr(arg, locals, true));
			}
			return parens(atom, out.toString());
		}
		if (expr instanceof IrIf ifExpr) {
			return parens(atom, "if " + expr(ifExpr.condition(), locals, false) + " then "
					+ expr(ifExpr.thenExpr(), locals, false) + " else " + expr(ifExpr.elseExpr(), locals, false));
		}
		if (expr instanceof IrCase caseExpr) {
			StringBuilder out = new StringBuilder("match ").append(expr(caseExpr.scrutinee(), locals, false))
					.append(" with");
			for (IrAlt alt : caseExpr.alts()) {
				out.append(" | ").append(alt(alt, locals));
			}
			return out.append(" end").toString();
		}
		if (expr instanceof IrLambda lambda) {
			Map<String, String> scope = bindPats(locals, lambda.params());
			StringBuilder out = new StringBuilder("fun");
			for (IrVarPat param : lambda.params()) {
				out.append(' ').append(localIdent(param.name(), scope));
			}
			return parens(atom, out.append(" => ").append(expr(lambda.body(), scope, false)).toString());
		}
		throw new IllegalArgumentException("unexpected expression: " + expr);
	}

	private String alt(IrAlt alt, Map<String, String> locals) {
		StringBuilder out = new StringBuilder();
		if (alt.conPat().isWildcard() || isLiteral(alt.conPat().name())) {
			out.append(alt.conPat().name());
		} else {
			out.append(env.lookupIdent(Scope.VALUE, alt.conPat().name())
					.orElseGet(() -> Renamer.localIdent(alt.conPat().name())));
		}
		Map<String, String> scope = bindPats(locals, alt.varPats());
		for (IrVarPat varPat : alt.varPats()) {
			out.append(' ').append(localIdent(varPat.name(), scope));
		}
		return out.append(" => ").append(expr(alt.rhs(), scope, false)).toString();
	}

	private static boolean isLiteral(String pattern) {
		return pattern.matches("-?[0-9]+");
	}

	private String varIdent(String name, Map<String, String> locals) {
		String local = locals.get(name);
		if (local != null) {
			return local;
		}
		return env.lookupIdent(Scope.VALUE, name).orElseGet(() -> Renamer.localIdent(name));
	}

	// Types

	private String type(IrType type, boolean operand) {
		if (type instanceof IrTypeVar var) {
			return Renamer.localIdent(var.name());
		}
		if (type instanceof IrTypeCon con) {
			return env.lookupIdent(Scope.TYPE, con.name()).orElseGet(() -> Renamer.localIdent(con.name()));
		}
		if (type instanceof IrTypeApp app) {
			return parens(operand, typeApplication(app));
		}
		IrFuncType func = (IrFuncType) type;
		return parens(operand, arrowArg(func.argType()) + " -> " + type(func.resultType(), false));
	}

	private String arrowArg(IrType type) {
		return type(type, type instanceof IrFuncType);
	}

	private String typeApplication(IrType type) {
		if (type instanceof IrTypeApp app) {
			return typeApplication(app.function()) + " " + type(app.argument(), true);
		}
		return type(type, true);
	}

	private static String parens(boolean needed, String text) {
		return needed ? "(" + text + ")" : text;
	}
}
