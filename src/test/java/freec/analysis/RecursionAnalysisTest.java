package freec.analysis;

import freec.ast.ir.Ir;
import freec.ast.ir.IrFuncDecl;
import freec.env.Environment;
import freec.report.ConversionException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RecursionAnalysisTest {
	// len xs = case xs of { Nil -> 0; Cons y ys -> 1 + len ys }
	private static final IrFuncDecl LEN = Ir.funcDecl("len", List.of("xs"), Ir.caseOf(Ir.var("xs"),
			Ir.alt("Nil", List.of(), Ir.intLit(0)),
			Ir.alt("Cons", List.of("y", "ys"), Ir.op("+", Ir.intLit(1), Ir.app(Ir.var("len"), Ir.var("ys"))))));

	@Test
	void decreasingArgumentOfLength() {
		assertEquals(List.of(0), RecursionAnalysis.identifyDecArgs(List.of(LEN), new Environment()));
	}

	@Test
	void decreasingArgumentAfterUnchangedArgument() {
		// drop n xs = case xs of { Nil -> Nil; Cons y ys -> drop n ys }
		IrFuncDecl drop = Ir.funcDecl("drop", List.of("n", "xs"), Ir.caseOf(Ir.var("xs"),
				Ir.alt("Nil", List.of(), Ir.con("Nil")),
				Ir.alt("Cons", List.of("y", "ys"), Ir.app(Ir.var("drop"), Ir.var("n"), Ir.var("ys")))));

		assertEquals(List.of(1), RecursionAnalysis.identifyDecArgs(List.of(drop), new Environment()));
	}

	@Test
	void nestedPatternsAreSmaller() {
		// pairs xs = case xs of { Cons y ys -> case ys of { Cons z zs -> pairs zs; _ -> 0 }; _ -> 0 }
		IrFuncDecl pairs = Ir.funcDecl("pairs", List.of("xs"), Ir.caseOf(Ir.var("xs"),
				Ir.alt("Cons", List.of("y", "ys"), Ir.caseOf(Ir.var("ys"),
						Ir.alt("Cons", List.of("z", "zs"), Ir.app(Ir.var("pairs"), Ir.var("zs"))),
						Ir.alt("_", List.of(), Ir.intLit(0)))),
				Ir.alt("_", List.of(), Ir.intLit(0))));

		assertEquals(List.of(0), RecursionAnalysis.identifyDecArgs(List.of(pairs), new Environment()));
	}

	@Test
	void shadowedPatternVariableIsNotSmaller() {
		// f xs = case xs of { Cons y ys -> (\ys -> f ys) y; _ -> 0 }
		IrFuncDecl f = Ir.funcDecl("f", List.of("xs"), Ir.caseOf(Ir.var("xs"),
				Ir.alt("Cons", List.of("y", "ys"),
						Ir.app(Ir.lambda(List.of("ys"), Ir.app(Ir.var("f"), Ir.var("ys"))), Ir.var("y"))),
				Ir.alt("_", List.of(), Ir.intLit(0))));

		ConversionException e = assertThrows(ConversionException.class,
				() -> RecursionAnalysis.identifyDecArgs(List.of(f), new Environment()));
		assertTrue(e.getMessage().contains("Could not identify decreasing arguments of f"));
	}

	@Test
	void nonStructuralRecursionHasNoDecreasingArgument() {
		// fac n = if n == 0 then 1 else n * fac (n - 1)
		IrFuncDecl fac = Ir.funcDecl("fac", List.of("n"), Ir.ifThenElse(Ir.op("==", Ir.var("n"), Ir.intLit(0)),
				Ir.intLit(1),
				Ir.op("*", Ir.var("n"), Ir.app(Ir.var("fac"), Ir.op("-", Ir.var("n"), Ir.intLit(1))))));

		assertThrows(ConversionException.class,
				() -> RecursionAnalysis.identifyDecArgs(List.of(fac), new Environment()));
	}

	@Test
	void twoDecreasingArgumentsAreAmbiguous() {
		IrFuncDecl zip = zip();

		ConversionException e = assertThrows(ConversionException.class,
				() -> RecursionAnalysis.identifyDecArgs(List.of(zip), new Environment()));
		assertTrue(e.getMessage().contains("ambiguous"));
	}

	@Test
	void pragmaResolvesAmbiguity() {
		Environment env = new Environment();
		env.defineDecArg("zip", 1, "ys");

		assertEquals(List.of(1), RecursionAnalysis.identifyDecArgs(List.of(zip()), env));
	}

	@Test
	void pragmaIsTrustedForNonStructuralRecursion() {
		IrFuncDecl fac = Ir.funcDecl("fac", List.of("n"), Ir.caseOf(Ir.var("n"),
				Ir.alt("0", List.of(), Ir.intLit(1)),
				Ir.alt("_", List.of(), Ir.op("*", Ir.var("n"),
						Ir.app(Ir.var("fac"), Ir.op("-", Ir.var("n"), Ir.intLit(1)))))));
		Environment env = new Environment();
		env.defineDecArg("fac", 0, "n");

		assertEquals(List.of(0), RecursionAnalysis.identifyDecArgs(List.of(fac), env));
	}

	// zip xs ys = case xs of { Cons a as -> case ys of { Cons b bs -> Cons (Pair a b) (zip as bs); _ -> Nil }; _ -> Nil }
	private static IrFuncDecl zip() {
		return Ir.funcDecl("zip", List.of("xs", "ys"), Ir.caseOf(Ir.var("xs"),
				Ir.alt("Cons", List.of("a", "as"), Ir.caseOf(Ir.var("ys"),
						Ir.alt("Cons", List.of("b", "bs"), Ir.app(Ir.con("Cons"),
								Ir.app(Ir.con("Pair"), Ir.var("a"), Ir.var("b")),
								Ir.app(Ir.var("zip"), Ir.var("as"), Ir.var("bs")))),
						Ir.alt("_", List.of(), Ir.con("Nil")))),
				Ir.alt("_", List.of(), Ir.con("Nil"))));
	}

	@Test
	void mutuallyRecursiveFunctions() {
		assertEquals(List.of(0, 0), RecursionAnalysis.identifyDecArgs(evenOdd("ys", "ys"), new Environment()));
	}

	// even n xs = case xs of { Nil -> True; Cons y ys -> odd n ys }, odd n xs = ... even n ys
	private static List<IrFuncDecl> evenOdd(String evenArg, String oddArg) {
		IrFuncDecl even = Ir.funcDecl("even", List.of("xs"), Ir.caseOf(Ir.var("xs"),
				Ir.alt("Nil", List.of(), Ir.con("True")),
				Ir.alt("Cons", List.of("y", "ys"), Ir.app(Ir.var("odd"), Ir.var(evenArg)))));
		IrFuncDecl odd = Ir.funcDecl("odd", List.of("xs"), Ir.caseOf(Ir.var("xs"),
				Ir.alt("Nil", List.of(), Ir.con("False")),
				Ir.alt("Cons", List.of("y", "ys"), Ir.app(Ir.var("even"), Ir.var(oddArg)))));
		return List.of(even, odd);
	}

	@Test
	void mutualRecursionNeedsEveryCallToDecrease() {
		assertThrows(ConversionException.class,
				() -> RecursionAnalysis.identifyDecArgs(evenOdd("ys", "xs"), new Environment()));
	}

	// Constant arguments

	private static List<IrFuncDecl> walk(String fArg, String gArg) {
		// f x ys = case ys of { Nil -> x; Cons z zs -> g <fArg> zs }
		IrFuncDecl f = Ir.funcDecl("f", List.of("x", "ys"), Ir.caseOf(Ir.var("ys"),
				Ir.alt("Nil", List.of(), Ir.var("x")),
				Ir.alt("Cons", List.of("z", "zs"), Ir.app(Ir.var("g"), Ir.var(fArg), Ir.var("zs")))));
		// g x ys = case ys of { Nil -> x; Cons z zs -> f <gArg> zs }
		IrFuncDecl g = Ir.funcDecl("g", List.of("x", "ys"), Ir.caseOf(Ir.var("ys"),
				Ir.alt("Nil", List.of(), Ir.var("x")),
				Ir.alt("Cons", List.of("z", "zs"), Ir.app(Ir.var("f"), Ir.var(gArg), Ir.var("zs")))));
		return List.of(f, g);
	}

	@Test
	void argumentPassedOnByEveryCallIsConstant() {
		assertEquals(Set.of(0), RecursionAnalysis.identifyConstArgs(walk("x", "x")));
	}

	@Test
	void argumentChangedByOneCallIsNotConstant() {
		assertEquals(Set.of(), RecursionAnalysis.identifyConstArgs(walk("x", "z")));
	}

	@Test
	void constantArgumentMustHaveTheSameName() {
		IrFuncDecl f = Ir.funcDecl("f", List.of("x"), Ir.app(Ir.var("g"), Ir.var("x")));
		IrFuncDecl g = Ir.funcDecl("g", List.of("y"), Ir.app(Ir.var("f"), Ir.var("y")));

		assertEquals(Set.of(), RecursionAnalysis.identifyConstArgs(List.of(f, g)));
	}

	@Test
	void shadowedArgumentIsNotConstant() {
		// f x = \x -> f x
		IrFuncDecl f = Ir.funcDecl("f", List.of("x"),
				Ir.lambda(List.of("x"), Ir.app(Ir.var("f"), Ir.var("x"))));

		assertEquals(Set.of(), RecursionAnalysis.identifyConstArgs(List.of(f)));
	}

	@Test
	void partialApplicationHasNoConstantArgument() {
		// f x = map (f) x
		IrFuncDecl f = Ir.funcDecl("f", List.of("x"), Ir.app(Ir.var("map"), Ir.var("f"), Ir.var("x")));

		assertEquals(Set.of(), RecursionAnalysis.identifyConstArgs(List.of(f)));
	}
}
