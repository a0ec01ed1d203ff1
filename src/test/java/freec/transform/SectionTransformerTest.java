package freec.transform;

import freec.ConverterOptions;
import freec.ast.coq.CoqBinder;
import freec.ast.coq.CoqComment;
import freec.ast.coq.CoqDefinition;
import freec.ast.coq.CoqFixBody;
import freec.ast.coq.CoqFixpoint;
import freec.ast.coq.CoqSection;
import freec.ast.coq.CoqSentence;
import freec.ast.ir.Ir;
import freec.ast.ir.IrFuncDecl;
import freec.ast.ir.IrType;
import freec.env.Environment;
import freec.print.CoqPrinter;
import freec.print.IrPrinter;
import freec.report.ConversionException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SectionTransformerTest {
	private static final IrType A = Ir.typeVar("a");
	private static final IrType B = Ir.typeVar("b");
	private static final IrType INTEGER = Ir.typeCon("Integer");
	private static final IrType LIST_INTEGER = Ir.typeApp(Ir.typeCon("List"), INTEGER);

	// map @a @b (f : a -> b) (xs : List a) : List b
	//   = case xs of { Nil -> Nil; Cons y ys -> Cons (f y) (map @a @b f ys) }
	static final IrFuncDecl MAP = Ir.funcDecl("map", List.of("a", "b"),
			List.of(Ir.varPat("f", Ir.funcType(A, B)), Ir.varPat("xs", Ir.typeApp(Ir.typeCon("List"), A))),
			Ir.caseOf(Ir.var("xs"),
					Ir.alt("Nil", List.of(), Ir.con("Nil")),
					Ir.alt("Cons", List.of("y", "ys"), Ir.app(Ir.con("Cons"),
							Ir.app(Ir.var("f"), Ir.var("y")),
							Ir.app(Ir.visibleTypeApp(Ir.var("map"), List.of(A, B)), Ir.var("f"), Ir.var("ys"))))),
			Ir.typeApp(Ir.typeCon("List"), B));

	// map f xs = case xs of { Nil -> Nil; Cons y ys -> Cons (f y) (map f ys) }
	static final IrFuncDecl UNTYPED_MAP = Ir.funcDecl("map", List.of("f", "xs"), Ir.caseOf(Ir.var("xs"),
			Ir.alt("Nil", List.of(), Ir.con("Nil")),
			Ir.alt("Cons", List.of("y", "ys"), Ir.app(Ir.con("Cons"),
					Ir.app(Ir.var("f"), Ir.var("y")),
					Ir.app(Ir.var("map"), Ir.var("f"), Ir.var("ys"))))));

	// len (c : Integer) (xs : List Integer) : Integer
	//   = case xs of { Nil -> 0; Cons y ys -> 1 + len c ys }
	private static final IrFuncDecl LEN = Ir.funcDecl("len", List.of(),
			List.of(Ir.varPat("c", INTEGER), Ir.varPat("xs", LIST_INTEGER)),
			Ir.caseOf(Ir.var("xs"),
					Ir.alt("Nil", List.of(), Ir.intLit(0)),
					Ir.alt("Cons", List.of("y", "ys"),
							Ir.op("+", Ir.intLit(1), Ir.app(Ir.var("len"), Ir.var("c"), Ir.var("ys"))))),
			INTEGER);

	// sumFrom (c : Integer) (xs : List Integer) : Integer
	//   = case xs of { Nil -> c; Cons y ys -> y + sumFrom c ys }
	private static final IrFuncDecl SUM_FROM = Ir.funcDecl("sumFrom", List.of(),
			List.of(Ir.varPat("c", INTEGER), Ir.varPat("xs", LIST_INTEGER)),
			Ir.caseOf(Ir.var("xs"),
					Ir.alt("Nil", List.of(), Ir.var("c")),
					Ir.alt("Cons", List.of("y", "ys"),
							Ir.op("+", Ir.var("y"), Ir.app(Ir.var("sumFrom"), Ir.var("c"), Ir.var("ys"))))),
			INTEGER);

	private static final SortedSet<Integer> FIRST = new TreeSet<>(List.of(0));

	private final Environment env = new Environment();
	private final Converter converter = new Converter(env, new ConverterOptions(true, true, "Main"));
	private final IrPrinter printer = new IrPrinter();

	private List<CoqSentence> transform(IrFuncDecl decl) {
		return new SectionTransformer(converter).transform(List.of(decl), FIRST);
	}

	private String print(List<CoqSentence> sentences) {
		return new CoqPrinter(env).print(sentences).replace("\r\n", "\n");
	}

	@Test
	void constantArgumentBecomesSectionVariable() {
		List<CoqSentence> sentences = transform(MAP);

		assertEquals(2, sentences.size());
		CoqSection section = assertInstanceOf(CoqSection.class, sentences.get(0));
		assertEquals("section_0", section.ident());
		assertEquals(List.of("a", "b"), section.typeVariables());
		assertEquals(List.of(new CoqBinder("f", Ir.funcType(A, B))), section.variables());

		List<CoqSentence> inner = section.sentences();
		assertEquals(3, inner.size());
		assertEquals(new CoqComment("Helper functions for map_0"), inner.get(0));
		CoqFixBody helper = ((CoqFixpoint) inner.get(1)).bodies().get(0);
		assertEquals("map_1", helper.ident());
		assertEquals(List.of(), helper.typeArgs());
		assertEquals(List.of(new CoqBinder("xs", Ir.typeApp(Ir.typeCon("List"), A))), helper.binders());
		assertEquals("case xs of { Nil -> Nil; Cons y ys -> Cons (f y) (map@1 ys) }",
				printer.printExpr(helper.rhs()));
		CoqDefinition sectionMain = (CoqDefinition) inner.get(2);
		assertEquals("map_0", sectionMain.ident());
		assertEquals("map@1 xs", printer.printExpr(sectionMain.rhs()));

		CoqDefinition wrapper = assertInstanceOf(CoqDefinition.class, sentences.get(1));
		assertEquals("map", wrapper.ident());
		assertEquals(List.of("a", "b"), wrapper.typeArgs());
		assertEquals("map@0 a b f xs", printer.printExpr(wrapper.rhs()));
	}

	@Test
	void sectionFunctionsAreRegistered() {
		transform(MAP);

		assertEquals(1, env.lookupFunction("map@0").orElseThrow().arity());
		assertEquals(List.of(), env.lookupFunction("map@0").orElseThrow().typeArgs());
		assertTrue(env.isFunction("map@1"));
		assertEquals(2, env.lookupFunction("map").orElseThrow().arity());
	}

	@Test
	void constantArgumentThatIsOnlyPassedOnIsNotApplied() {
		assertEquals("Section section_0.\n"
				+ "  Variable c : Integer.\n"
				+ "\n"
				+ "  (* Helper functions for len_0 *)\n"
				+ "\n"
				+ "  Fixpoint len_1 (xs : List Integer) {struct xs} : Integer :=\n"
				+ "    match xs with | Nil => 0 | Cons y ys => op_plus 1 (len_1 ys) end.\n"
				+ "\n"
				+ "  Definition len_0 (xs : List Integer) : Integer :=\n"
				+ "    len_1 xs.\n"
				+ "End section_0.\n"
				+ "\n"
				+ "Definition len (c : Integer) (xs : List Integer) : Integer :=\n"
				+ "  len_0 xs.\n", print(transform(LEN)));
	}

	@Test
	void usedConstantArgumentIsApplied() {
		List<CoqSentence> sentences = transform(SUM_FROM);

		CoqDefinition wrapper = (CoqDefinition) sentences.get(1);
		assertEquals("sumFrom@0 c xs", printer.printExpr(wrapper.rhs()));
		String coq = print(sentences);
		assertTrue(coq.contains("  Variable c : Integer.\n"), coq);
		assertTrue(coq.contains("match xs with | Nil => c | Cons y ys => op_plus y (sumFrom_1 ys) end."), coq);
	}

	@Test
	void typeVariablesAreSectionVariables() {
		String coq = print(transform(MAP));

		assertTrue(coq.startsWith("Section section_0.\n"
				+ "  Variable a b : Type.\n"
				+ "  Variable f : a -> b.\n"), coq);
		assertTrue(coq.contains("  Fixpoint map_1 (xs : List a) {struct xs} : List b :=\n"), coq);
		assertTrue(coq.endsWith("Definition map {a b : Type} (f : a -> b) (xs : List a) : List b :=\n"
				+ "  map_0 a b f xs.\n"), coq);
	}

	@Test
	void untypedConstantArgumentCannotBeShared() {
		SectionTransformer transformer = new SectionTransformer(converter);

		assertFalse(transformer.canShare(List.of(UNTYPED_MAP), FIRST));
		assertTrue(transformer.canShare(List.of(MAP), FIRST));
		assertThrows(ConversionException.class, () -> transformer.transform(List.of(UNTYPED_MAP), FIRST));
	}

	@Test
	void pragmaMustNotNameAConstantArgument() {
		env.defineDecArg("map", 0, "f");

		ConversionException e = assertThrows(ConversionException.class, () -> transform(MAP));

		assertEquals("The decreasing argument f of map is passed unchanged to every call", e.diagnostic().text());
	}

	@Test
	void pragmaIsMovedToTheSectionFunction() {
		env.defineDecArg("map", 1, "xs");

		List<CoqSentence> sentences = transform(MAP);

		CoqSection section = (CoqSection) sentences.get(0);
		CoqFixBody helper = ((CoqFixpoint) section.sentences().get(1)).bodies().get(0);
		assertEquals("xs", helper.structArg());
	}
}
