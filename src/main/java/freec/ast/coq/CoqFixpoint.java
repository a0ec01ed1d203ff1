package freec.ast.coq;

import java.util.List;

public record CoqFixpoint(List<CoqFixBody> bodies) implements CoqSentence {
	public CoqFixpoint {
		bodies = List.copyOf(bodies);
		if (bodies.isEmpty()) {
			throw new IllegalArgumentException("empty fixpoint block");
		}
	}
}
