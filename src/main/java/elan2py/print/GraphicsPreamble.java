package elan2py.print;

import java.util.List;

/**
 * Turtle setup emitted at the top of programs that draw, and the call that keeps the
 * window open after {@code main()} returns.
 */
public final class GraphicsPreamble {
	public static final String EXIT_ON_CLICK = "screen.exitonclick()";

	private GraphicsPreamble() {
	}

	public static List<String> setup(int turtleSpeed, String indentUnit) {
		return List.of(
				"import turtle",
				"import math",
				"",
				"# Initialize turtle graphics",
				"screen = turtle.Screen()",
				"t = turtle.Turtle()",
				"t.speed(" + turtleSpeed + ")",
				"",
				"def clearScreen():",
				indentUnit + "screen.clear()",
				indentUnit + "global t",
				indentUnit + "t = turtle.Turtle()",
				indentUnit + "t.speed(" + turtleSpeed + ")",
				"");
	}
}
