package freec.ir;

import freec.ast.ir.Ir;
import freec.ast.ir.IrExpr;
import freec.env.Environment;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

class SubstTest {
	private final Environment env = new Environment();

	@Test
	void substitutesFreeVariables() {
		IrExpr expr = Ir.op("+", Ir.var("x"), Ir.var("y"));

		IrExpr result = Subst.single("x", Ir.intLit(1)).apply(env, expr);

		assertEquals(Ir.op("+", Ir.intLit(1), Ir.var("y")), result);
	}

	@Test
	void closedExpressionIsUnchanged() {
		IrExpr expr = Ir.lambda(List.of("x"), Ir.app(Ir.var("f"), Ir.var("x")));

		IrExpr result = Subst.single("x", Ir.var("y")).apply(env, expr);

		assertSame(expr, result);
	}

	@Test
	void boundVariableIsRenamedToAvoidCapture() {
		// [y := x] (\x -> y)
		IrExpr expr = Ir.lambda(List.of("x"), Ir.var("y"));

		IrExpr result = Subst.single("y", Ir.var("x")).apply(env, expr);

		assertEquals(Ir.lambda(List.of("x@0"), Ir.var("x")), result);
	}

	@Test
	void renamedBinderIsRenamedInTheBody() {
		// [y := x] (\x -> x y)
		IrExpr expr = Ir.lambda(List.of("x"), Ir.app(Ir.var("x"), Ir.var("y")));

		IrExpr result = Subst.single("y", Ir.var("x")).apply(env, expr);

		assertEquals(Ir.lambda(List.of("x@0"), Ir.app(Ir.var("x@0"), Ir.var("x"))), result);
	}

	@Test
	void patternVariablesShadowTheSubstitution() {
		// [x := 1] (case z of { C x -> x; D -> x })
		IrExpr expr = Ir.caseOf(Ir.var("z"),
				Ir.alt("C", List.of("x"), Ir.var("x")),
				Ir.alt("D", List.of(), Ir.var("x")));

		IrExpr result = Subst.single("x", Ir.intLit(1)).apply(env, expr);

		assertEquals(Ir.caseOf(Ir.var("z"),
				Ir.alt("C", List.of("x"), Ir.var("x")),
				Ir.alt("D", List.of(), Ir.intLit(1))), result);
	}

	@Test
	void patternVariablesAreRenamedToAvoidCapture() {
		// [z := y] (case xs of { Cons y ys -> z })
		IrExpr expr = Ir.caseOf(Ir.var("xs"), Ir.alt("Cons", List.of("y", "ys"), Ir.var("z")));

		IrExpr result = Subst.single("z", Ir.var("y")).apply(env, expr);

		assertEquals(Ir.caseOf(Ir.var("xs"), Ir.alt("Cons", List.of("y@0", "ys"), Ir.var("y"))), result);
	}

	@Test
	void substitutionIsSimultaneous() {
		Subst swap = Subst.of(Map.of("x", Ir.var("y"), "y", Ir.var("x")));

		assertEquals(Ir.app(Ir.var("y"), Ir.var("x")), swap.apply(env, Ir.app(Ir.var("x"), Ir.var("y"))));
	}

	@Test
	void compositionAppliesBothSubstitutions() {
		Subst first = Subst.single("x", Ir.var("y"));
		Subst second = Subst.single("y", Ir.intLit(2));

		IrExpr result = first.andThen(env, second).apply(env, Ir.op("+", Ir.var("x"), Ir.var("y")));

		assertEquals(Ir.op("+", Ir.intLit(2), Ir.intLit(2)), result);
	}
}
