package freec.env;

import freec.ast.SourceSpan;
import freec.ast.ir.Ir;
import freec.ast.ir.IrType;
import freec.ast.ir.IrTypeSchema;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EnvironmentTest {
	private final Environment env = new Environment();

	private static FuncEntry func(String name, int arity) {
		IrType[] argTypes = new IrType[arity];
		return new FuncEntry(SourceSpan.NONE, name, arity, List.of(), Arrays.asList(argTypes), null, true, false,
				name);
	}

	@Test
	void restoreDiscardsEntriesAndDecreasingArguments() {
		env.addEntry(func("f", 1));
		env.defineDecArg("f", 0, "xs");
		Environment.Snapshot snapshot = env.snapshot();

		env.enterScope();
		env.addEntry(func("g", 2));
		env.removeDecArg("f");
		env.defineTypeSig("g", new IrTypeSchema(SourceSpan.NONE, List.of(), Ir.typeCon("Int")));
		assertTrue(env.existsLocalEntry(Scope.VALUE, "g"));
		assertFalse(env.existsLocalEntry(Scope.VALUE, "f"));
		env.restore(snapshot);

		assertFalse(env.isDefined(Scope.VALUE, "g"));
		assertEquals(Optional.of(new DecArg(0, "xs")), env.lookupDecArg("f"));
		assertEquals(Optional.empty(), env.lookupTypeSig("g"));
		assertEquals(0, env.depth());
	}

	@Test
	void scopesAreSeparate() {
		env.addEntry(new DataEntry(SourceSpan.NONE, "T", 0, "T"));
		env.addEntry(func("T", 0));

		assertTrue(env.lookupEntry(Scope.TYPE, "T").orElseThrow() instanceof DataEntry);
		assertEquals(Optional.of(0), env.lookupArity("T"));
	}

	@Test
	void partialityCanBeRecorded() {
		env.addEntry(func("head", 1));

		env.definePartial("head");

		assertTrue(env.isPartial("head"));
		assertTrue(env.needsFreeArgs("head"));
		assertFalse(env.isPartial("tail"));
	}

	@Test
	void functionEntriesCheckTheirArity() {
		assertThrows(IllegalArgumentException.class, () -> new FuncEntry(SourceSpan.NONE, "f", 2, List.of(),
				List.<IrType>of(), null, true, false, null));
	}
}
