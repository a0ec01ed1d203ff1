package freec.transform;

import freec.analysis.DependencyAnalysis;
import freec.analysis.DependencyComponent;
import freec.ast.coq.CoqInductive;
import freec.ast.coq.CoqSentence;
import freec.ast.coq.CoqTypeDefinition;
import freec.ast.ir.Ir;
import freec.ast.ir.IrConDecl;
import freec.ast.ir.IrDataDecl;
import freec.ast.ir.IrType;
import freec.ast.ir.IrTypeDecl;
import freec.ast.ir.IrTypeSynDecl;
import freec.env.ConEntry;
import freec.env.DataEntry;
import freec.env.Environment;
import freec.env.Renamer;
import freec.env.Scope;
import freec.env.TypeSynEntry;
import freec.ir.TypeSynExpansion;
import freec.report.ConversionException;
import freec.report.ConversionResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Converts data type and type synonym declarations.
 *
 * Data types become inductive types. Type synonyms become definitions; since definitions cannot be recursive,
 * the synonyms of a recursive component are expanded in the data types of the component and defined after them.
 */
public final class TypeDeclConverter {
	private final Converter converter;

	public TypeDeclConverter(Converter converter) {
		this.converter = converter;
	}

	/**
	 * Adds entries for the type and its constructors.
	 */
	public void registerTypeDecl(IrTypeDecl decl) {
		Environment env = converter.env();
		if (decl instanceof IrDataDecl data) {
			Renamer.renameAndAddEntry(env, new DataEntry(data.span(), data.name(), data.typeArgs().size(), null));
			IrType returnType = Ir.typeApp(Ir.typeCon(data.name()),
					data.typeArgs().stream().<IrType>map(Ir::typeVar).toArray(IrType[]::new));
			for (IrConDecl conDecl : data.conDecls()) {
				Renamer.renameAndAddEntry(env, new ConEntry(conDecl.span(), conDecl.name(),
						conDecl.fieldTypes().size(), conDecl.fieldTypes(), returnType, null, null));
			}
		} else if (decl instanceof IrTypeSynDecl synonym) {
			Renamer.renameAndAddEntry(env, new TypeSynEntry(synonym.span(), synonym.name(), synonym.typeArgs(),
					synonym.rhs(), null));
		}
	}

	/**
	 * Converts one strongly connected component. If the conversion fails, the environment is left unchanged.
	 */
	public ConversionResult<List<CoqSentence>> convertTypeComponent(DependencyComponent<IrTypeDecl> component) {
		return converter.atomically(() -> {
			for (IrTypeDecl decl : component.decls()) {
				if (!converter.env().isDefined(Scope.TYPE, decl.name())) {
					registerTypeDecl(decl);
				}
			}
			if (component instanceof DependencyComponent.NonRecursive<IrTypeDecl> nonRec) {
				IrTypeDecl decl = nonRec.decl();
				if (decl instanceof IrTypeSynDecl synonym) {
					return List.<CoqSentence>of(convertTypeSynDecl(synonym));
				}
				return List.<CoqSentence>of(new CoqInductive(List.of(convertDataDecl((IrDataDecl) decl))));
			}
			return convertRecursive(component.decls());
		});
	}

	private List<CoqSentence> convertRecursive(List<IrTypeDecl> decls) {
		List<IrDataDecl> dataDecls = new ArrayList<>();
		List<IrTypeDecl> synonyms = new ArrayList<>();
		for (IrTypeDecl decl : decls) {
			if (decl instanceof IrDataDecl data) {
				dataDecls.add(data);
			} else {
				synonyms.add(decl);
			}
		}

		List<IrTypeSynDecl> sortedSynonyms = new ArrayList<>();
		for (DependencyComponent<IrTypeDecl> component : DependencyAnalysis.groupTypeDecls(synonyms)) {
			if (component instanceof DependencyComponent.Recursive<IrTypeDecl> cycle) {
				throw ConversionException.error(cycle.decls().get(0).span(),
						"Type synonym declarations form a cycle: "
								+ cycle.decls().stream().map(IrTypeDecl::name).collect(Collectors.joining(", ")));
			}
			sortedSynonyms.add((IrTypeSynDecl) component.decls().get(0));
		}

		Set<String> synonymNames = sortedSynonyms.stream().map(IrTypeSynDecl::name).collect(Collectors.toSet());
		TypeSynExpansion expansion = new TypeSynExpansion(converter.env());
		List<CoqInductive.Body> bodies = new ArrayList<>();
		for (IrDataDecl dataDecl : dataDecls) {
			bodies.add(convertDataDecl(expansion.expandInDataDeclWhere(synonymNames::contains, dataDecl)));
		}

		List<CoqSentence> sentences = new ArrayList<>();
		sentences.add(new CoqInductive(bodies));
		for (IrTypeSynDecl synonym : sortedSynonyms) {
			sentences.add(convertTypeSynDecl(synonym));
		}
		return sentences;
	}

	private CoqInductive.Body convertDataDecl(IrDataDecl decl) {
		List<CoqInductive.Constructor> constructors = new ArrayList<>();
		for (IrConDecl conDecl : decl.conDecls()) {
			constructors.add(new CoqInductive.Constructor(ident(Scope.VALUE, conDecl.name()), conDecl.fieldTypes()));
		}
		return new CoqInductive.Body(ident(Scope.TYPE, decl.name()), FuncDeclConverter.typeArgIdents(decl.typeArgs()),
				constructors);
	}

	private CoqTypeDefinition convertTypeSynDecl(IrTypeSynDecl decl) {
		return new CoqTypeDefinition(ident(Scope.TYPE, decl.name()), FuncDeclConverter.typeArgIdents(decl.typeArgs()),
				decl.rhs());
	}

	private String ident(Scope scope, String name) {
		return converter.env().lookupIdent(scope, name).orElseGet(() -> Renamer.localIdent(name));
	}
}
