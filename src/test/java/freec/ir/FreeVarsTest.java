package freec.ir;

import freec.ast.ir.Ir;
import freec.ast.ir.IrExpr;
import freec.ast.ir.IrType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;

class FreeVarsTest {
	// \f -> case xs of { Nil -> f; Cons y ys -> g y ys }
	private static final IrExpr EXPR = Ir.lambda(List.of("f"), Ir.caseOf(Ir.var("xs"),
			Ir.alt("Nil", List.of(), Ir.var("f")),
			Ir.alt("Cons", List.of("y", "ys"), Ir.app(Ir.var("g"), Ir.var("y"), Ir.var("ys")))));

	@Test
	void freeVariablesExcludeBoundOnes() {
		assertEquals(List.of("xs", "g"), List.copyOf(FreeVars.freeVars(EXPR)));
	}

	@Test
	void boundVariablesOfLambdasAndAlternatives() {
		assertEquals(Set.of("f", "y", "ys"), FreeVars.boundVars(EXPR));
	}

	@Test
	void typeVariablesInOrderOfOccurrence() {
		IrType type = Ir.funcType(Ir.funcType(Ir.typeVar("b"), Ir.typeVar("a")),
				Ir.typeApp(Ir.typeCon("List"), Ir.typeVar("b")));

		assertEquals(List.of("b", "a"), List.copyOf(FreeVars.typeVars(type)));
	}
}
