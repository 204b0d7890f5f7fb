package elan2py.transform;

import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class GraphicsPrimitiveTest {
	@Test
	void namesMustBeFollowedByAnArgumentList() {
		assertEquals(Optional.empty(), GraphicsPrimitive.rewrite("turtle.forwardFast(3)"));
		assertEquals(Optional.empty(), GraphicsPrimitive.rewrite("turtle.forward"));
		assertEquals(Optional.of("clearScreen()"), GraphicsPrimitive.rewrite("clearScreen"));
	}

	@Test
	void everySourceNameIsDetected() {
		for (GraphicsPrimitive primitive : GraphicsPrimitive.values()) {
			assertEquals(Set.of(Feature.GRAPHICS), Feature.detect("main\n  call " + primitive.sourceName() + "(1)\nend main"));
		}
		assertEquals(Set.of(Feature.GRAPHICS), Feature.detect("variable t set to new Turtle()"));
		assertTrue(Feature.detect("main\n  print 1\nend main").isEmpty());
	}
}
