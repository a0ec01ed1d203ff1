package freec.ir;

import freec.ast.ir.IrConDecl;
import freec.ast.ir.IrDataDecl;
import freec.ast.ir.IrFuncType;
import freec.ast.ir.IrType;
import freec.ast.ir.IrTypeApp;
import freec.ast.ir.IrTypeCon;
import freec.env.Environment;
import freec.env.TypeSynEntry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Expansion of fully applied type synonyms using the synonyms registered in the environment.
 */
public final class TypeSynExpansion {
	private final Environment env;

	public TypeSynExpansion(Environment env) {
		this.env = env;
	}

	/**
	 * Expands all type synonyms whose names satisfy the predicate in the field types of the data type.
	 */
	public IrDataDecl expandInDataDeclWhere(Predicate<String> predicate, IrDataDecl decl) {
		List<IrConDecl> conDecls = new ArrayList<>();
		for (IrConDecl conDecl : decl.conDecls()) {
			List<IrType> fieldTypes = conDecl.fieldTypes().stream()
					.map(type -> expandWhere(predicate, type))
					.toList();
			conDecls.add(new IrConDecl(conDecl.span(), conDecl.name(), fieldTypes));
		}
		return new IrDataDecl(decl.span(), decl.name(), decl.typeArgs(), conDecls);
	}

	public IrType expandAll(IrType type) {
		return expandWhere(name -> true, type);
	}

	/**
	 * Expands the type synonyms satisfying the predicate. Partially applied synonyms are left unchanged. The
	 * synonyms must not form a cycle.
	 */
	public IrType expandWhere(Predicate<String> predicate, IrType type) {
		if (type instanceof IrFuncType func) {
			return new IrFuncType(func.span(), expandWhere(predicate, func.argType()),
					expandWhere(predicate, func.resultType()));
		}
		if (!(type instanceof IrTypeCon) && !(type instanceof IrTypeApp)) {
			return type;
		}
		List<IrType> args = new ArrayList<>();
		IrType head = type;
		while (head instanceof IrTypeApp app) {
			args.add(app.argument());
			head = app.function();
		}
		Collections.reverse(args);
		List<IrType> expandedArgs = args.stream().map(arg -> expandWhere(predicate, arg)).toList();
		if (head instanceof IrTypeCon con && predicate.test(con.name())) {
			Optional<TypeSynEntry> synonym = env.lookupTypeSynonym(con.name());
			if (synonym.isPresent() && synonym.get().typeArgs().size() <= expandedArgs.size()) {
				return expandWhere(predicate, instantiate(synonym.get(), expandedArgs));
			}
		}
		IrType result = head;
		for (IrType arg : expandedArgs) {
			result = new IrTypeApp(type.span(), result, arg);
		}
		return result;
	}

	private static IrType instantiate(TypeSynEntry synonym, List<IrType> args) {
		Map<String, IrType> mapping = new HashMap<>();
		List<String> typeArgs = synonym.typeArgs();
		for (int i = 0; i < typeArgs.size(); i++) {
			mapping.put(typeArgs.get(i), args.get(i));
		}
		IrType result = new TypeSubst(mapping).apply(synonym.rhs());
		for (IrType extra : args.subList(typeArgs.size(), args.size())) {
			result = new IrTypeApp(extra.span(), result, extra);
		}
		return result;
	}
}
