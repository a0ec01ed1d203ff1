package freec.ast.ir;

import java.util.List;

public sealed interface IrTypeDecl extends IrDecl permits IrDataDecl, IrTypeSynDecl {
	List<String> typeArgs();
}
