package freec.ast.ir;

import freec.ast.SourceSpan;

import java.util.List;

/**
 * Type signature {@code f, g :: forall a. t}.
 */
public record IrTypeSig(SourceSpan span, List<String> names, IrTypeSchema typeSchema) implements IrNode {
	public IrTypeSig {
		names = List.copyOf(names);
	}
}
