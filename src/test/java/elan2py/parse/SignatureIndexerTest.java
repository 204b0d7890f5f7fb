package elan2py.parse;

import elan2py.ast.SourceLine;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

public class SignatureIndexerTest {
	private static List<SourceLine> lines(String... text) {
		List<SourceLine> lines = new ArrayList<>();
		for (int i = 0; i < text.length; i++) {
			lines.add(new SourceLine(i + 1, text[i]));
		}
		return lines;
	}

	@Test
	void recordsOutputPositionsAndSkipsProceduresWithoutThem() {
		SignatureTable table = new SignatureIndexer().index(lines(
				"main",
				"  call swap(a, b)",
				"end main",
				"procedure swap(out x, out y)",
				"end procedure",
				"procedure show(a as Int)",
				"end procedure",
				"function half(n as Int, out rest as Int) returns Int",
				"end function"));

		assertEquals(Optional.of(List.of(0, 1)), table.outPositions("swap"));
		assertEquals(Optional.of(List.of(1)), table.outPositions("half"));
		assertFalse(table.contains("show"));
		assertEquals(2, table.size());
	}

	@Test
	void laterDeclarationReplacesEarlierOne() {
		SignatureTable table = new SignatureIndexer().index(lines(
				"procedure p(out a, b)",
				"end procedure",
				"procedure p(a, out b)",
				"end procedure",
				"procedure q(out a)",
				"end procedure",
				"procedure q(a)",
				"end procedure"));

		assertEquals(Optional.of(List.of(1)), table.outPositions("p"));
		assertFalse(table.contains("q"));
	}
}
