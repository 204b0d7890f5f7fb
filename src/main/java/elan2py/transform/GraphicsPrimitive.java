package elan2py.transform;

import elan2py.parse.SourceText;

import java.util.Optional;

/**
 * Built-in drawing calls and the turtle-module calls they become. A template ending in
 * {@code (} receives the source argument list verbatim; the others ignore it.
 */
public enum GraphicsPrimitive {
	CLEAR_SCREEN("clearScreen", "clearScreen()"),
	PEN_DOWN("turtle.penDown", "t.pendown()"),
	PEN_UP("turtle.penUp", "t.penup()"),
	FORWARD("turtle.forward", "t.forward("),
	TURN_LEFT("turtle.turnLeft", "t.left("),
	TURN_RIGHT("turtle.turnRight", "t.right(");

	private final String sourceName;
	private final String template;

	GraphicsPrimitive(String sourceName, String template) {
		this.sourceName = sourceName;
		this.template = template;
	}

	public String sourceName() {
		return sourceName;
	}

	private boolean takesArguments() {
		return template.endsWith("(");
	}

	/**
	 * @param call the call text without the {@code call} keyword
	 */
	public static Optional<String> rewrite(String call) {
		for (GraphicsPrimitive primitive : values()) {
			if (!call.startsWith(primitive.sourceName)) {
				continue;
			}
			int paren = SourceText.skipWhitespace(call, primitive.sourceName.length());
			if (paren == call.length()) {
				if (!primitive.takesArguments()) {
					return Optional.of(primitive.template);
				}
				continue;
			}
			if (call.charAt(paren) != '(') {
				continue;
			}
			return Optional.of(primitive.takesArguments()
					? primitive.template.substring(0, primitive.template.length() - 1) + call.substring(paren)
					: primitive.template);
		}
		return Optional.empty();
	}

	static boolean mentionedIn(String source) {
		if (source.contains("turtle.")) {
			return true;
		}
		for (GraphicsPrimitive primitive : values()) {
			if (source.contains(primitive.sourceName)) {
				return true;
			}
		}
		return false;
	}
}
