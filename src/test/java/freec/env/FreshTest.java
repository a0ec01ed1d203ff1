package freec.env;

import freec.ConverterOptions;
import freec.ast.SourceSpan;
import freec.ast.ir.IrType;
import freec.transform.Converter;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FreshTest {
	private final Environment env = new Environment();

	@Test
	void freshIdentsAreDistinctAndUnused() {
		env.addEntry(new FuncEntry(SourceSpan.NONE, "x@1", 0, List.of(), List.<IrType>of(), null, true, false,
				"x_1"));

		Set<String> idents = new HashSet<>();
		for (int i = 0; i < 100; i++) {
			String ident = Fresh.freshIdent(env, Fresh.FRESH_ARG_PREFIX);
			assertTrue(idents.add(ident), ident);
			assertFalse(env.isNameUsed(ident), ident);
		}
		assertFalse(idents.contains("x@1"));
	}

	@Test
	void freshIdentSkipsSpellingsOfLocalVariables() {
		assertEquals("f@1", Fresh.freshIdent(env, "f", Set.of("f_0", "xs")));
		assertEquals("f@3", Fresh.freshIdent(env, "f", Set.of("f_2")));
		assertEquals("end@1", Fresh.freshIdent(env, "end", Set.of("end_0")));
	}

	@Test
	void freshIdentOfFreshIdentUsesTheRootPrefix() {
		assertEquals("f@0", Fresh.freshIdent(env, "f"));
		assertEquals("f@1", Fresh.freshIdent(env, "f@0"));
		assertEquals("f@2", Fresh.freshIdent(env, "f@1"));
	}

	@Test
	void freshIdentsContainTheInternalMarker() {
		String ident = Fresh.freshIdent(env, "go");

		assertTrue(Fresh.isFresh(ident));
		assertFalse(Fresh.isFresh("go"));
	}

	@Test
	void coqIdentReplacesTheMarker() {
		assertEquals("section_0", Fresh.freshCoqIdent(env, Fresh.FRESH_SECTION_PREFIX));
	}

	@Test
	void localScopesDoNotResetCounters() {
		Converter converter = new Converter(env, new ConverterOptions(true, true, "Main"));

		String first = converter.localEnv(() -> Fresh.freshIdent(env, "y"));
		String second = converter.localEnv(() -> Fresh.freshIdent(env, "y"));

		assertEquals("y@0", first);
		assertEquals("y@1", second);
	}

	@Test
	void freshTypeVariables() {
		assertEquals("a@0", Fresh.freshTypeVar(env).name());
	}
}
