package freec;

import freec.ast.SourceSpan;
import freec.ast.ir.Ir;
import freec.ast.ir.IrConDecl;
import freec.ast.ir.IrDataDecl;
import freec.ast.ir.IrFuncDecl;
import freec.ast.ir.IrModule;
import freec.ast.ir.IrType;
import freec.ast.ir.IrTypeSchema;
import freec.ast.ir.IrTypeSig;
import freec.ast.ir.IrTypeSynDecl;
import freec.report.ConversionResult;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

public class CompilerTest {
	private static final IrType LIST_A = Ir.typeApp(Ir.typeCon("List"), Ir.typeVar("a"));

	/**
	 * <pre>
	 * data List a = Nil | Cons a (List a)
	 * length :: forall a. List a -> Integer
	 * length @a xs = case xs of { Nil -> 0; Cons y ys -> 1 + length @a ys }
	 * map :: forall a b. (a -> b) -> List a -> List b
	 * map @a @b f xs = case xs of { Nil -> Nil; Cons y ys -> Cons (f y) (map @a @b f ys) }
	 * double xs = map (\x -> x + x) xs
	 * </pre>
	 */
	private static IrModule listModule() {
		IrDataDecl list = new IrDataDecl(SourceSpan.NONE, "List", List.of("a"), List.of(
				new IrConDecl(SourceSpan.NONE, "Nil", List.of()),
				new IrConDecl(SourceSpan.NONE, "Cons", List.of(Ir.typeVar("a"), LIST_A))));
		IrTypeSig lengthSig = new IrTypeSig(SourceSpan.NONE, List.of("length"),
				new IrTypeSchema(SourceSpan.NONE, List.of("a"), Ir.funcType(LIST_A, Ir.typeCon("Integer"))));
		IrFuncDecl length = Ir.funcDecl("length", List.of("a"), Ir.varPats(List.of("xs")), Ir.caseOf(Ir.var("xs"),
				Ir.alt("Nil", List.of(), Ir.intLit(0)),
				Ir.alt("Cons", List.of("y", "ys"), Ir.op("+", Ir.intLit(1),
						Ir.app(Ir.visibleTypeApp(Ir.var("length"), List.of(Ir.typeVar("a"))), Ir.var("ys"))))),
				null);
		IrType a = Ir.typeVar("a");
		IrType b = Ir.typeVar("b");
		IrTypeSig mapSig = new IrTypeSig(SourceSpan.NONE, List.of("map"), new IrTypeSchema(SourceSpan.NONE,
				List.of("a", "b"), Ir.funcType(Ir.funcType(a, b), LIST_A, Ir.typeApp(Ir.typeCon("List"), b))));
		IrFuncDecl map = Ir.funcDecl("map", List.of("a", "b"), Ir.varPats(List.of("f", "xs")),
				Ir.caseOf(Ir.var("xs"),
						Ir.alt("Nil", List.of(), Ir.con("Nil")),
						Ir.alt("Cons", List.of("y", "ys"), Ir.app(Ir.con("Cons"),
								Ir.app(Ir.var("f"), Ir.var("y")),
								Ir.app(Ir.visibleTypeApp(Ir.var("map"), List.of(a, b)), Ir.var("f"), Ir.var("ys"))))),
				null);
		IrFuncDecl doubleAll = Ir.funcDecl("double", List.of("xs"), Ir.app(Ir.var("map"),
				Ir.lambda(List.of("x"), Ir.op("+", Ir.var("x"), Ir.var("x"))), Ir.var("xs")));
		return new IrModule(SourceSpan.NONE, "Data.List", List.of(list), List.of(lengthSig, mapSig), List.of(),
				List.of(length, map, doubleAll));
	}

	@Test
	void compilesListModuleToExpectedCoq() throws Exception {
		String expected = Files.readString(Path.of("src", "test", "resources", "golden", "List.v"));

		String actual = new Compiler(new ConverterOptions(true, true, "Main")).compile(listModule()).orElseThrow();

		assertEquals(normalize(expected), normalize(actual));
	}

	@Test
	void compilesListModuleWithoutSections() throws Exception {
		String expected = Files.readString(Path.of("src", "test", "resources", "golden", "ListNoSections.v"));

		String actual = new Compiler(new ConverterOptions(false, false, "Main")).compile(listModule())
				.orElseThrow();

		assertEquals(normalize(expected), normalize(actual));
	}

	@Test
	void printsFunctionDependencies() throws Exception {
		String expected = Files.readString(Path.of("src", "test", "resources", "golden", "List.dot"));

		assertEquals(normalize(expected), normalize(new Compiler().functionDependencies(listModule())));
	}

	@Test
	void printsTypeDependencies() {
		IrModule module = new IrModule(SourceSpan.NONE, null, List.of(
				new IrTypeSynDecl(SourceSpan.NONE, "Name", List.of(), Ir.typeCon("String")),
				new IrTypeSynDecl(SourceSpan.NONE, "String", List.of(), Ir.typeApp(Ir.typeCon("List"),
						Ir.typeCon("Char")))), List.of(), List.of(), List.of());

		assertEquals("digraph {\n  0 [label=\"Name\"];\n  1 [label=\"String\"];\n  0 -> {1};\n}\n",
				normalize(new Compiler().typeDependencies(module)));
	}

	@Test
	void reportsFailures() {
		IrModule module = new IrModule(SourceSpan.NONE, null, List.of(
				new IrTypeSynDecl(SourceSpan.NONE, "A", List.of(), Ir.typeCon("B")),
				new IrTypeSynDecl(SourceSpan.NONE, "B", List.of(), Ir.typeCon("A"))), List.of(), List.of(), List.of());

		ConversionResult<String> result = new Compiler().compile(module);

		assertFalse(result.isSuccess());
	}

	private static String normalize(String s) {
		String normalized = s.replace("\r\n", "\n");
		if (!normalized.endsWith("\n")) {
			normalized += "\n";
		}
		return normalized;
	}
}
