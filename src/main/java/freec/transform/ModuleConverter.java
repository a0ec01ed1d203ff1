package freec.transform;

import freec.analysis.DependencyAnalysis;
import freec.analysis.DependencyComponent;
import freec.analysis.DependencyGraph;
import freec.analysis.PartialityAnalysis;
import freec.ast.coq.CoqSentence;
import freec.ast.ir.IrDecArgPragma;
import freec.ast.ir.IrFuncDecl;
import freec.ast.ir.IrModule;
import freec.ast.ir.IrTypeDecl;
import freec.ast.ir.IrTypeSig;
import freec.env.Environment;
import freec.report.ConversionException;
import freec.report.ConversionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Converts a module: the type declarations in dependency order, then the function declarations in dependency
 * order.
 *
 * The conversion stops at the first component that cannot be converted; the components converted before are
 * kept in the environment.
 */
public final class ModuleConverter {
	private static final Logger LOG = LoggerFactory.getLogger(ModuleConverter.class);

	private final Converter converter;
	private final TypeDeclConverter typeDeclConverter;
	private final FuncDeclConverter funcDeclConverter;

	public ModuleConverter(Converter converter) {
		this.converter = converter;
		this.typeDeclConverter = new TypeDeclConverter(converter);
		this.funcDeclConverter = new FuncDeclConverter(converter);
	}

	public ConversionResult<List<CoqSentence>> convertModule(IrModule module) {
		String moduleName = module.name() != null ? module.name() : converter.options().moduleName();
		LOG.debug("Converting module {}", moduleName);
		List<CoqSentence> sentences = new ArrayList<>();

		ConversionResult<Void> registered = converter.atomically(() -> {
			for (IrTypeDecl decl : module.typeDecls()) {
				typeDeclConverter.registerTypeDecl(decl);
			}
			return null;
		});
		if (!registered.isSuccess()) {
			return registered.map(ignored -> sentences);
		}

		List<DependencyComponent<IrTypeDecl>> typeComponents;
		try {
			typeComponents = DependencyAnalysis.groupTypeDecls(module.typeDecls());
		} catch (ConversionException e) {
			return ConversionResult.failure(e.diagnostic());
		}
		for (DependencyComponent<IrTypeDecl> component : typeComponents) {
			ConversionResult<List<CoqSentence>> result = typeDeclConverter.convertTypeComponent(component);
			if (!result.isSuccess()) {
				return result;
			}
			sentences.addAll(result.orElseThrow());
		}

		Environment env = converter.env();
		for (IrTypeSig typeSig : module.typeSigs()) {
			for (String name : typeSig.names()) {
				env.defineTypeSig(name, typeSig.typeSchema());
			}
		}
		for (IrFuncDecl decl : module.funcDecls()) {
			funcDeclConverter.registerFuncDecl(decl);
		}
		for (IrDecArgPragma pragma : module.pragmas()) {
			definePragma(module, pragma);
		}

		DependencyGraph<IrFuncDecl> graph;
		try {
			graph = DependencyGraph.funcDependencyGraph(module.funcDecls());
		} catch (ConversionException e) {
			return ConversionResult.failure(e.diagnostic());
		}
		for (String name : PartialityAnalysis.partialFunctions(graph, env)) {
			env.definePartial(name);
		}

		for (DependencyComponent<IrFuncDecl> component : DependencyAnalysis.groupDependencies(graph)) {
			ConversionResult<List<CoqSentence>> result = funcDeclConverter.convertFuncComponent(component);
			if (!result.isSuccess()) {
				return result;
			}
			sentences.addAll(result.orElseThrow());
		}
		return ConversionResult.success(sentences);
	}

	private void definePragma(IrModule module, IrDecArgPragma pragma) {
		Optional<IrFuncDecl> decl = module.funcDecls().stream()
				.filter(d -> d.name().equals(pragma.funcName()))
				.findFirst();
		if (decl.isEmpty()) {
			LOG.warn("{}: Ignoring decreasing argument pragma for unknown function {}", pragma.span(),
					pragma.funcName());
			return;
		}
		int index = decl.get().argNames().indexOf(pragma.argName());
		if (index < 0) {
			LOG.warn("{}: Ignoring decreasing argument pragma: {} has no argument {}", pragma.span(),
					pragma.funcName(), pragma.argName());
			return;
		}
		converter.env().defineDecArg(pragma.funcName(), index, pragma.argName());
	}
}
