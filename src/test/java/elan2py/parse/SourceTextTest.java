package elan2py.parse;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SourceTextTest {
	@Test
	void splitsArgumentsOnlyOnTopLevelCommas() {
		assertEquals(List.of("a", "f(b, c)", "d[1, 2]", "\"x, y\""),
				SourceText.splitArguments("a, f(b, c), d[1, 2], \"x, y\""));
		assertTrue(SourceText.splitArguments("   ").isEmpty());
	}

	@Test
	void parameterSplitKeepsGenericArgumentsTogether() {
		assertEquals(List.of("d as Dictionary<of String, Int>", "out n as Int"),
				SourceText.splitParameters("d as Dictionary<of String, Int>, out n as Int"));
		// call arguments may compare with < and >, so they are not nesting there
		assertEquals(List.of("a < b", "c > d"), SourceText.splitArguments("a < b, c > d"));
	}

	@Test
	void matchesDelimitersIgnoringStringLiterals() {
		String text = "f(\")\", g(1))";
		assertEquals(text.length() - 1, SourceText.matchingClose(text, 1));
		assertEquals(1, SourceText.matchingOpen(text, text.length() - 1));
		assertEquals(-1, SourceText.matchingClose("f(a", 1));
	}

	@Test
	void mapsOnlyTextOutsideLiterals() {
		String out = SourceText.mapOutsideLiterals("a & \"b & c\" & d", s -> s.replace("&", "+"));
		assertEquals("a + \"b & c\" + d", out);
	}

	@Test
	void escapedQuoteDoesNotEndLiteral() {
		assertEquals(-1, SourceText.indexOutsideLiterals("\"say \\\" = \"", " = ", 0));
		assertEquals(10, SourceText.indexOutsideLiterals("\"a = b\" x = 1", "=", 0));
	}

	@Test
	void readsIdentifiers() {
		assertEquals(7, SourceText.identifierEnd("add_one(x)", 0));
		assertEquals(0, SourceText.identifierEnd("(x)", 0));
	}
}
