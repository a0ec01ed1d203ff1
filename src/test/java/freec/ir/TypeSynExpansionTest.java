package freec.ir;

import freec.ast.SourceSpan;
import freec.ast.ir.Ir;
import freec.ast.ir.IrType;
import freec.env.Environment;
import freec.env.TypeSynEntry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class TypeSynExpansionTest {
	private final Environment env = new Environment();

	TypeSynExpansionTest() {
		// type Pair a b = Tuple a b; type Assoc k = List (Pair k String)
		env.addEntry(new TypeSynEntry(SourceSpan.NONE, "Pair", List.of("a", "b"),
				Ir.typeApp(Ir.typeCon("Tuple"), Ir.typeVar("a"), Ir.typeVar("b")), "Pair"));
		env.addEntry(new TypeSynEntry(SourceSpan.NONE, "Assoc", List.of("k"),
				Ir.typeApp(Ir.typeCon("List"), Ir.typeApp(Ir.typeCon("Pair"), Ir.typeVar("k"), Ir.typeCon("String"))),
				"Assoc"));
	}

	@Test
	void expandsNestedSynonyms() {
		IrType type = Ir.funcType(Ir.typeApp(Ir.typeCon("Assoc"), Ir.typeCon("Int")), Ir.typeCon("Bool"));

		IrType expected = Ir.funcType(Ir.typeApp(Ir.typeCon("List"),
				Ir.typeApp(Ir.typeCon("Tuple"), Ir.typeCon("Int"), Ir.typeCon("String"))), Ir.typeCon("Bool"));
		assertEquals(expected, new TypeSynExpansion(env).expandAll(type));
	}

	@Test
	void partialApplicationIsNotExpanded() {
		IrType type = Ir.typeApp(Ir.typeCon("Pair"), Ir.typeCon("Int"));

		assertEquals(type, new TypeSynExpansion(env).expandAll(type));
	}

	@Test
	void onlySelectedSynonymsAreExpanded() {
		IrType type = Ir.typeApp(Ir.typeCon("Assoc"), Ir.typeCon("Int"));

		IrType expected = Ir.typeApp(Ir.typeCon("List"),
				Ir.typeApp(Ir.typeCon("Pair"), Ir.typeCon("Int"), Ir.typeCon("String")));
		assertEquals(expected, new TypeSynExpansion(env).expandWhere("Assoc"::equals, type));
	}
}
