package elan2py.parse;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class LoopHeaderTest {
	@Test
	void rangeWithAndWithoutStep() {
		assertEquals(Optional.of(new LoopHeader.Range("i", "0", "a.length() - 1", Optional.of("1"))),
				LoopHeader.parseFor("for i from 0 to a.length() - 1 step 1"));
		assertEquals(Optional.of(new LoopHeader.Range("i", "1", "10", Optional.empty())),
				LoopHeader.parseFor("for i from 1 to 10"));
	}

	@Test
	void iterationForms() {
		assertEquals(Optional.of(new LoopHeader.Iteration("x", "items")), LoopHeader.parseFor("for x in items"));
		assertEquals(Optional.of(new LoopHeader.Iteration("w", "words[1..]")), LoopHeader.parseEach("each w in words[1..]"));
	}

	@Test
	void repeatCount() {
		assertEquals(Optional.of(new LoopHeader.Repeat("n div 2")), LoopHeader.parseRepeat("repeat n div 2 times"));
	}

	@Test
	void malformedHeaders() {
		assertTrue(LoopHeader.parseFor("for from 1 to").isEmpty());
		assertTrue(LoopHeader.parseFor("for i over items").isEmpty());
		assertTrue(LoopHeader.parseEach("each in items").isEmpty());
		assertTrue(LoopHeader.parseRepeat("repeat times").isEmpty());
	}
}
