package freec.ast.ir;

/**
 * Expressions of the intermediate representation.
 *
 * Applications are binary; {@link Ir#app(IrExpr, IrExpr...)} builds curried applications.
 */
public sealed interface IrExpr extends IrNode permits IrVar, IrCon, IrApp, IrVisibleTypeApp, IrIf, IrCase, IrLambda,
		IrIntLiteral, IrUndefined, IrErrorExpr {
}
