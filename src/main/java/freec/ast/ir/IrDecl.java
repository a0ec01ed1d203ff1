package freec.ast.ir;

/**
 * A named top-level declaration. The name is the key of the declaration in dependency graphs.
 */
public sealed interface IrDecl extends IrNode permits IrTypeDecl, IrFuncDecl {
	String name();
}
