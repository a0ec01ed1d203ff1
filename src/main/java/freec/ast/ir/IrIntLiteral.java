package freec.ast.ir;

import freec.ast.SourceSpan;

import java.math.BigInteger;

public record IrIntLiteral(SourceSpan span, BigInteger value) implements IrExpr {
}
