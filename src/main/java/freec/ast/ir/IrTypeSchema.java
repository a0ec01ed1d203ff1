package freec.ast.ir;

import freec.ast.SourceSpan;

import java.util.List;

/**
 * A type with explicitly quantified type variables ({@code forall a b. t}).
 */
public record IrTypeSchema(SourceSpan span, List<String> typeArgs, IrType type) implements IrNode {
	public IrTypeSchema {
		typeArgs = List.copyOf(typeArgs);
	}
}
