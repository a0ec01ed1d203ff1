package freec.ast.ir;

import freec.ast.SourceSpan;

/**
 * Pragma that names the decreasing argument of a recursive function explicitly.
 */
public record IrDecArgPragma(SourceSpan span, String funcName, String argName) implements IrNode {
}
