package elan2py.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Scanning helpers shared by the line recognizers and the rewriters.
 *
 * Notes:
 * - String literals are double-quoted; a backslash escapes the next character.
 * - Nothing inside a string literal counts as a delimiter or operator.
 */
public final class SourceText {
	private SourceText() {
	}

	/**
	 * Marks every character that belongs to a string literal, quotes included.
	 */
	public static boolean[] literalMask(String text) {
		boolean[] mask = new boolean[text.length()];
		boolean inString = false;
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			if (inString) {
				mask[i] = true;
				if (c == '\\' && i + 1 < text.length()) {
					mask[++i] = true;
				} else if (c == '"') {
					inString = false;
				}
			} else if (c == '"') {
				mask[i] = true;
				inString = true;
			}
		}
		return mask;
	}

	/**
	 * Applies {@code fn} to every run of text outside string literals and leaves the
	 * literals untouched.
	 */
	public static String mapOutsideLiterals(String text, UnaryOperator<String> fn) {
		boolean[] mask = literalMask(text);
		StringBuilder out = new StringBuilder(text.length());
		int i = 0;
		while (i < text.length()) {
			int start = i;
			boolean literal = mask[i];
			while (i < text.length() && mask[i] == literal) {
				i++;
			}
			String run = text.substring(start, i);
			out.append(literal ? run : fn.apply(run));
		}
		return out.toString();
	}

	/**
	 * Index of the first occurrence of {@code needle} at or after {@code from} that
	 * does not start inside a string literal, or -1.
	 */
	public static int indexOutsideLiterals(String text, String needle, int from) {
		boolean[] mask = literalMask(text);
		for (int i = Math.max(0, from); i + needle.length() <= text.length(); i++) {
			if (!mask[i] && text.startsWith(needle, i)) {
				return i;
			}
		}
		return -1;
	}

	public static boolean containsOutsideLiterals(String text, String needle) {
		return indexOutsideLiterals(text, needle, 0) >= 0;
	}

	/**
	 * Finds the delimiter closing the one at {@code openIndex}, which must be one of
	 * {@code ( [ { <}. Angle brackets only balance against each other.
	 *
	 * @return the closing index, or -1 when unbalanced
	 */
	public static int matchingClose(String text, int openIndex) {
		char open = text.charAt(openIndex);
		char close = closerOf(open);
		boolean[] mask = literalMask(text);
		int depth = 0;
		for (int i = openIndex; i < text.length(); i++) {
			if (mask[i])
				continue;
			char c = text.charAt(i);
			if (c == open) {
				depth++;
			} else if (c == close) {
				depth--;
				if (depth == 0)
					return i;
			}
		}
		return -1;
	}

	/**
	 * Mirror of {@link #matchingClose(String, int)}, scanning backwards from a closing
	 * delimiter.
	 */
	public static int matchingOpen(String text, int closeIndex) {
		char close = text.charAt(closeIndex);
		char open = openerOf(close);
		boolean[] mask = literalMask(text);
		int depth = 0;
		for (int i = closeIndex; i >= 0; i--) {
			if (mask[i])
				continue;
			char c = text.charAt(i);
			if (c == close) {
				depth++;
			} else if (c == open) {
				depth--;
				if (depth == 0)
					return i;
			}
		}
		return -1;
	}

	/**
	 * Splits call arguments on commas that are not nested in brackets or literals.
	 * Pieces are stripped; an all-blank input yields an empty list.
	 */
	public static List<String> splitArguments(String text) {
		return splitTopLevel(text, false);
	}

	/**
	 * Like {@link #splitArguments(String)}, but also treats {@code < >} as nesting so
	 * that {@code Dictionary<of String, Int>} stays one parameter.
	 */
	public static List<String> splitParameters(String text) {
		return splitTopLevel(text, true);
	}

	private static List<String> splitTopLevel(String text, boolean angleBrackets) {
		List<String> parts = new ArrayList<>();
		if (text == null || text.isBlank()) {
			return parts;
		}
		boolean[] mask = literalMask(text);
		int depth = 0;
		int start = 0;
		for (int i = 0; i < text.length(); i++) {
			if (mask[i])
				continue;
			char c = text.charAt(i);
			if (c == '(' || c == '[' || c == '{' || (angleBrackets && c == '<')) {
				depth++;
			} else if (c == ')' || c == ']' || c == '}' || (angleBrackets && c == '>')) {
				depth = Math.max(0, depth - 1);
			} else if (c == ',' && depth == 0) {
				parts.add(text.substring(start, i).strip());
				start = i + 1;
			}
		}
		parts.add(text.substring(start).strip());
		return parts;
	}

	/**
	 * Reads an identifier ({@code [A-Za-z_][A-Za-z0-9_]*}) starting at {@code index}.
	 *
	 * @return the end index (exclusive), equal to {@code index} when there is none
	 */
	public static int identifierEnd(String text, int index) {
		int i = index;
		if (i >= text.length() || !(Character.isLetter(text.charAt(i)) || text.charAt(i) == '_')) {
			return index;
		}
		while (i < text.length() && (Character.isLetterOrDigit(text.charAt(i)) || text.charAt(i) == '_')) {
			i++;
		}
		return i;
	}

	public static int skipWhitespace(String text, int index) {
		int i = index;
		while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
			i++;
		}
		return i;
	}

	private static char closerOf(char open) {
		return switch (open) {
			case '(' -> ')';
			case '[' -> ']';
			case '{' -> '}';
			case '<' -> '>';
			default -> throw new IllegalArgumentException("not an opening delimiter: " + open);
		};
	}

	private static char openerOf(char close) {
		return switch (close) {
			case ')' -> '(';
			case ']' -> '[';
			case '}' -> '{';
			case '>' -> '<';
			default -> throw new IllegalArgumentException("not a closing delimiter: " + close);
		};
	}
}
