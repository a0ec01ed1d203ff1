package freec.transform;

import freec.analysis.DependencyComponent;
import freec.ast.SourceSpan;
import freec.ast.coq.CoqBinder;
import freec.ast.coq.CoqDefinition;
import freec.ast.coq.CoqSentence;
import freec.ast.ir.IrFuncDecl;
import freec.ast.ir.IrFuncType;
import freec.ast.ir.IrType;
import freec.ast.ir.IrTypeSchema;
import freec.ast.ir.IrTypeVar;
import freec.env.Environment;
import freec.env.FuncEntry;
import freec.env.Renamer;
import freec.env.Scope;
import freec.ir.TypeSubst;
import freec.report.ConversionException;
import freec.report.ConversionResult;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Converts function declarations.
 *
 * Non-recursive functions become definitions. Recursive components are passed on to the
 * {@link RecFuncTransformer}.
 */
public final class FuncDeclConverter {
	private final Converter converter;

	public FuncDeclConverter(Converter converter) {
		this.converter = converter;
	}

	/**
	 * Converts one strongly connected component. If the conversion fails, the environment is left unchanged.
	 */
	public ConversionResult<List<CoqSentence>> convertFuncComponent(DependencyComponent<IrFuncDecl> component) {
		return converter.atomically(() -> {
			for (IrFuncDecl decl : component.decls()) {
				registerFuncDecl(decl);
			}
			if (component instanceof DependencyComponent.NonRecursive<IrFuncDecl> nonRec) {
				return List.<CoqSentence>of(convertNonRecFuncDecl(nonRec.decl()));
			}
			return new RecFuncTransformer(converter).transform(component.decls());
		});
	}

	public CoqDefinition convertNonRecFuncDecl(IrFuncDecl decl) {
		return new CoqDefinition(coqIdent(decl.name()), typeArgIdents(decl.typeArgs()), binders(decl),
				returnType(decl), decl.rhs());
	}

	// Entries

	/**
	 * Adds an entry for the function unless there is one already. Argument and return types are taken from the
	 * annotations of the declaration or from the type signature of the function.
	 */
	public FuncEntry registerFuncDecl(IrFuncDecl decl) {
		Environment env = converter.env();
		Optional<FuncEntry> existing = env.lookupFunction(decl.name());
		if (existing.isPresent()) {
			return existing.get();
		}
		List<IrType> argTypes = new ArrayList<>();
		IrType returnType = decl.returnType();
		Optional<IrTypeSchema> typeSig = env.lookupTypeSig(decl.name());
		if (typeSig.isPresent()) {
			IrType type = instantiate(typeSig.get(), decl.typeArgs());
			for (int i = 0; i < decl.arity(); i++) {
				if (type instanceof IrFuncType func) {
					argTypes.add(func.argType());
					type = func.resultType();
				} else {
					argTypes.add(null);
					type = null;
				}
			}
			if (returnType == null) {
				returnType = type;
			}
		} else {
			for (int i = 0; i < decl.arity(); i++) {
				argTypes.add(null);
			}
		}
		for (int i = 0; i < decl.arity(); i++) {
			IrType annotated = decl.args().get(i).type();
			if (annotated != null) {
				argTypes.set(i, annotated);
			}
		}
		FuncEntry entry = new FuncEntry(decl.span(), decl.name(), decl.arity(), decl.typeArgs(), argTypes,
				returnType, true, false, null);
		return (FuncEntry) Renamer.renameAndAddEntry(env, entry);
	}

	/**
	 * The type of the signature with its type arguments renamed to the type arguments of the declaration.
	 */
	private static IrType instantiate(IrTypeSchema schema, List<String> typeArgs) {
		if (typeArgs.size() != schema.typeArgs().size()) {
			return schema.type();
		}
		Map<String, IrType> mapping = new HashMap<>();
		for (int i = 0; i < typeArgs.size(); i++) {
			mapping.put(schema.typeArgs().get(i), new IrTypeVar(schema.span(), typeArgs.get(i)));
		}
		return new TypeSubst(mapping).apply(schema.type());
	}

	FuncEntry entry(String name) {
		return converter.env().lookupFunction(name)
				.orElseThrow(() -> ConversionException.internal(SourceSpan.NONE,
						"Function " + name + " has no entry"));
	}

	/**
	 * The known argument types of the function; unknown types are null.
	 */
	List<IrType> argTypes(IrFuncDecl decl) {
		List<IrType> types = new ArrayList<>();
		List<IrType> entryTypes = converter.env().lookupFunction(decl.name())
				.filter(e -> e.arity() == decl.arity())
				.map(FuncEntry::argTypes)
				.orElse(null);
		for (int i = 0; i < decl.arity(); i++) {
			IrType type = decl.args().get(i).type();
			if (type == null && entryTypes != null) {
				type = entryTypes.get(i);
			}
			types.add(type);
		}
		return types;
	}

	IrType returnType(IrFuncDecl decl) {
		if (decl.returnType() != null) {
			return decl.returnType();
		}
		return converter.env().lookupFunction(decl.name()).map(FuncEntry::returnType).orElse(null);
	}

	List<CoqBinder> binders(IrFuncDecl decl) {
		List<IrType> types = argTypes(decl);
		List<CoqBinder> binders = new ArrayList<>();
		for (int i = 0; i < decl.arity(); i++) {
			binders.add(new CoqBinder(decl.argNames().get(i), types.get(i)));
		}
		return binders;
	}

	String coqIdent(String name) {
		return converter.env().lookupIdent(Scope.VALUE, name).orElseGet(() -> Renamer.localIdent(name));
	}

	static List<String> typeArgIdents(List<String> typeArgs) {
		return typeArgs.stream().map(Renamer::localIdent).toList();
	}
}
