package freec.transform;

import freec.ConverterOptions;
import freec.analysis.DependencyComponent;
import freec.ast.SourceSpan;
import freec.ast.coq.CoqBinder;
import freec.ast.coq.CoqDefinition;
import freec.ast.coq.CoqSentence;
import freec.ast.ir.Ir;
import freec.ast.ir.IrFuncDecl;
import freec.ast.ir.IrType;
import freec.ast.ir.IrTypeSchema;
import freec.env.Environment;
import freec.env.FuncEntry;
import freec.report.ConversionResult;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;

class FuncDeclConverterTest {
	private static final IrType LIST_A = Ir.typeApp(Ir.typeCon("List"), Ir.typeVar("a"));
	private static final IrType LIST_B = Ir.typeApp(Ir.typeCon("List"), Ir.typeVar("b"));
	private static final IrType INTEGER = Ir.typeCon("Integer");

	private final Environment env = new Environment();
	private final FuncDeclConverter converter =
			new FuncDeclConverter(new Converter(env, new ConverterOptions(true, true, "Main")));

	@Test
	void typesAreTakenFromTheTypeSignature() {
		env.defineTypeSig("length", new IrTypeSchema(SourceSpan.NONE, List.of("a"), Ir.funcType(LIST_A, INTEGER)));
		IrFuncDecl length = Ir.funcDecl("length", List.of("b"), Ir.varPats(List.of("xs")), Ir.intLit(0), null);

		FuncEntry entry = converter.registerFuncDecl(length);

		assertEquals(List.of(LIST_B), entry.argTypes());
		assertEquals(INTEGER, entry.returnType());
		assertEquals(List.of("b"), entry.typeArgs());
		assertEquals("length", entry.coqIdent());
	}

	@Test
	void annotationsTakePrecedence() {
		env.defineTypeSig("const", new IrTypeSchema(SourceSpan.NONE, List.of(), Ir.funcType(INTEGER, INTEGER,
				INTEGER)));
		IrFuncDecl decl = Ir.funcDecl("const", List.of(), List.of(Ir.varPat("x", Ir.typeCon("Int")), Ir.varPat("y")),
				Ir.var("x"), null);

		FuncEntry entry = converter.registerFuncDecl(decl);

		assertEquals(List.of(Ir.typeCon("Int"), INTEGER), entry.argTypes());
		assertEquals(INTEGER, entry.returnType());
	}

	@Test
	void missingTypesAreUnknown() {
		FuncEntry entry = converter.registerFuncDecl(Ir.funcDecl("pair", List.of("x", "y"), Ir.var("x")));

		assertEquals(Arrays.asList(null, null), entry.argTypes());
		assertEquals(null, entry.returnType());
		assertFalse(entry.partial());
	}

	@Test
	void existingEntriesAreKept() {
		IrFuncDecl decl = Ir.funcDecl("id", List.of("x"), Ir.var("x"));
		FuncEntry first = converter.registerFuncDecl(decl);

		assertSame(first, converter.registerFuncDecl(decl));
	}

	@Test
	void nonRecursiveFunctionBecomesDefinition() {
		env.defineTypeSig("length", new IrTypeSchema(SourceSpan.NONE, List.of("a"), Ir.funcType(LIST_A, INTEGER)));
		// match is a keyword, so both the function and its argument are renamed
		IrFuncDecl decl = Ir.funcDecl("match", List.of("a"), Ir.varPats(List.of("end")),
				Ir.app(Ir.var("length"), Ir.var("end")), null);

		ConversionResult<List<CoqSentence>> result =
				converter.convertFuncComponent(new DependencyComponent.NonRecursive<>(decl));

		CoqDefinition def = (CoqDefinition) result.orElseThrow().get(0);
		assertEquals("match0", def.ident());
		assertEquals(List.of("a"), def.typeArgs());
		assertEquals(List.of(new CoqBinder("end", null)), def.binders());
	}
}
