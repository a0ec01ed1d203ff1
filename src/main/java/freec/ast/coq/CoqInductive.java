package freec.ast.coq;

import freec.ast.ir.IrType;

import java.util.List;

/**
 * A block of (mutually recursive) inductive types.
 */
public record CoqInductive(List<Body> bodies) implements CoqSentence {
	public CoqInductive {
		bodies = List.copyOf(bodies);
	}

	public record Body(String ident, List<String> typeArgs, List<Constructor> constructors) {
		public Body {
			typeArgs = List.copyOf(typeArgs);
			constructors = List.copyOf(constructors);
		}
	}

	public record Constructor(String ident, List<IrType> fieldTypes) {
		public Constructor {
			fieldTypes = List.copyOf(fieldTypes);
		}
	}
}
