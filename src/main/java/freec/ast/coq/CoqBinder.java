package freec.ast.coq;

import freec.ast.ir.IrType;

/**
 * An explicit binder {@code (name : type)} of a local variable; {@code type} is null if it is left to inference.
 * The name is the source name; the printer chooses its target identifier.
 */
public record CoqBinder(String name, IrType type) {
}
