package freec;

import freec.analysis.DependencyGraph;
import freec.ast.coq.CoqSentence;
import freec.ast.ir.IrModule;
import freec.env.Environment;
import freec.print.CoqPrinter;
import freec.print.DotPrinter;
import freec.report.ConversionResult;
import freec.transform.Converter;
import freec.transform.ModuleConverter;

import java.util.List;

/**
 * Public entrypoint for the conversion of a module to Coq.
 */
public final class Compiler {
	private final ConverterOptions options;

	public Compiler(ConverterOptions options) {
		this.options = options;
	}

	public Compiler() {
		this(ConverterOptions.defaults());
	}

	public ConversionResult<String> compile(IrModule module) {
		Environment env = new Environment();
		ConversionResult<List<CoqSentence>> sentences = new ModuleConverter(new Converter(env, options))
				.convertModule(module);
		return sentences.map(s -> new CoqPrinter(env).print(s));
	}

	/**
	 * The dependency graph of the functions of the module in DOT format.
	 */
	public String functionDependencies(IrModule module) {
		return new DotPrinter().print(DependencyGraph.funcDependencyGraph(module.funcDecls()));
	}

	/**
	 * The dependency graph of the types of the module in DOT format.
	 */
	public String typeDependencies(IrModule module) {
		return new DotPrinter().print(DependencyGraph.typeDependencyGraph(module.typeDecls()));
	}
}
