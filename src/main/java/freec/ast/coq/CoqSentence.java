package freec.ast.coq;

/**
 * Top-level sentences of the generated Gallina code.
 *
 * Right-hand sides are still IR expressions; converting them to Gallina terms is the job of the term emitter.
 */
public sealed interface CoqSentence permits CoqComment, CoqDefinition, CoqTypeDefinition, CoqInductive, CoqFixpoint,
		CoqSection {
}
