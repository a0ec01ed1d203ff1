package freec.ast.coq;

import java.util.List;

/**
 * {@code Section ident. Variable typeVariables : Type. Variable ... sentences End ident.}
 *
 * Every variable has a known type.
 */
public record CoqSection(String ident, List<String> typeVariables, List<CoqBinder> variables,
		List<CoqSentence> sentences) implements CoqSentence {
	public CoqSection {
		typeVariables = List.copyOf(typeVariables);
		variables = List.copyOf(variables);
		sentences = List.copyOf(sentences);
	}
}
