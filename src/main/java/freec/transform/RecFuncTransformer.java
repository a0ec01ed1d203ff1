package freec.transform;

import freec.analysis.RecursionAnalysis;
import freec.ast.coq.CoqSentence;
import freec.ast.ir.IrFuncDecl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Converts a component of mutually recursive functions.
 *
 * If the functions pass some arguments on unchanged and the types of these arguments are known, these are shared
 * in a section ({@link SectionTransformer}). Otherwise the functions are split into helper and main functions
 * ({@link HelperFunctionTransformer}).
 */
public final class RecFuncTransformer {
	private static final Logger LOG = LoggerFactory.getLogger(RecFuncTransformer.class);

	private final Converter converter;

	public RecFuncTransformer(Converter converter) {
		this.converter = converter;
	}

	public List<CoqSentence> transform(List<IrFuncDecl> decls) {
		SortedSet<Integer> constArgs = converter.options().useSections()
				? RecursionAnalysis.identifyConstArgs(decls)
				: new TreeSet<>();
		List<String> names = decls.stream().map(IrFuncDecl::name).toList();
		if (constArgs.isEmpty()) {
			LOG.debug("Converting {} with helper functions", names);
			return new HelperFunctionTransformer(converter).transform(decls);
		}
		FuncDeclConverter funcDeclConverter = new FuncDeclConverter(converter);
		for (IrFuncDecl decl : decls) {
			funcDeclConverter.registerFuncDecl(decl);
		}
		SectionTransformer sectionTransformer = new SectionTransformer(converter);
		if (!sectionTransformer.canShare(decls, constArgs)) {
			LOG.debug("Converting {} with helper functions, the types of constant arguments {} are not known",
					names, constArgs);
			return new HelperFunctionTransformer(converter).transform(decls);
		}
		LOG.debug("Converting {} in a section", names);
		return sectionTransformer.transform(decls, constArgs);
	}
}
