package freec.ast.ir;

public sealed interface IrType extends IrNode permits IrTypeVar, IrTypeCon, IrTypeApp, IrFuncType {
}
