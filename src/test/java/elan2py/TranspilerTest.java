package elan2py;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TranspilerTest {
	private final Transpiler transpiler = new Transpiler();

	@Test
	void callersMayPrecedeTheDeclaration() {
		String python = transpiler.transpile(String.join("\n",
				"main",
				"  call swap(a, b)",
				"end main",
				"",
				"procedure swap(out x, out y)",
				"  set x to 1",
				"  set y to 2",
				"end procedure"));

		assertTrue(python.contains("    a, b = swap(a, b)\n"), python);
		assertTrue(python.endsWith("    return x, y\n"), python);
	}

	@Test
	void wellFormedProgramEndsAtDepthZero() {
		String python = transpiler.transpile(String.join("\n",
				"procedure p(n)",
				"  if n > 0 then",
				"    while n > 0",
				"      set n to n - 1",
				"    end while",
				"  end if",
				"end procedure",
				"x = 1"));

		// a statement after every block closed lands at column 0
		assertTrue(python.endsWith("\nx = 1"), python);
		assertFalse(python.contains("ERROR"), python);
	}

	@Test
	void noGraphicsMeansNoPreambleAndNoExitOnClick() {
		String python = transpiler.transpile("main\n  println 1\nend main");
		assertEquals("def main():\n    print(1)\n\nif __name__ == '__main__':\n    main()", python);
	}

	@Test
	void graphicsPreambleComesFirst() {
		String python = transpiler.transpile("main\n  call turtle.forward(50)\nend main");
		assertTrue(python.startsWith("import turtle\nimport math\n"), python);
		assertTrue(python.endsWith("    main()\n    screen.exitonclick()"), python);
	}

	@Test
	void configuredIndentUnitIsUsed() {
		Transpiler tabs = new Transpiler(new TranslatorConfig("\t", 6, "output.py"));
		assertEquals("def main():\n\tx = 1\n\nif __name__ == '__main__':\n\tmain()",
				tabs.transpile("main\n  x = 1\nend main"));
	}

	@Test
	void instancesAreReusableAcrossTranslations() {
		String first = transpiler.transpile("procedure f(out a)\nend procedure\nmain\n  call f(z)\nend main");
		String second = transpiler.transpile("main\n  call f(z)\nend main");
		assertTrue(first.contains("z = f(z)"), first);
		assertTrue(second.contains("    f(z)"), second);
		assertFalse(second.contains("z = f(z)"), second);
	}

	@Test
	void emptyAndWhitespaceOnlyInput() {
		assertEquals("", transpiler.transpile(""));
		assertEquals("", transpiler.transpile("  \n\t\n"));
	}

	@Test
	void windowsLineEndingsAreAccepted() {
		assertEquals("x = 1\ny = 2", transpiler.transpile("x = 1\r\ny = 2\r\n"));
	}

	@Test
	void nullSourceIsRejected() {
		assertThrows(NullPointerException.class, () -> transpiler.transpile(null));
	}
}
