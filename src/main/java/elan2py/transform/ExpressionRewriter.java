package elan2py.transform;

import elan2py.parse.SourceText;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Rewrites an Elan value expression into Python. Stateless.
 *
 * The steps run in a fixed order: concatenation first so that later operand matching
 * sees Python operators, boolean literals last since they are a plain token swap.
 * Text inside string literals is never rewritten.
 */
public final class ExpressionRewriter {
	private static final Pattern INTEGER_DIVISION = Pattern.compile("(?<=[\\w)\\]])\\s+div\\s+(?=[\\w(])");
	private static final Pattern TRUE = Pattern.compile("\\btrue\\b");
	private static final Pattern FALSE = Pattern.compile("\\bfalse\\b");

	private static final String AS_ARRAY = ".asArray()";
	private static final String NEW_ARRAY = "new Array<";
	private static final String EMPTY_ARRAY = "empty Array<";

	public String rewrite(String expr) {
		if (expr == null || expr.isEmpty()) {
			return expr;
		}
		String out = SourceText.mapOutsideLiterals(expr, s -> s.replace(" & ", " + "));
		out = dropAsArray(out);
		out = sizedArrays(out);
		out = emptyArrays(out);
		out = slices(out);
		out = SourceText.mapOutsideLiterals(out, s -> INTEGER_DIVISION.matcher(s).replaceAll(" // "));
		out = SourceText.mapOutsideLiterals(out, s -> s.replace(" mod ", " % "));
		out = SourceText.mapOutsideLiterals(out, s -> FALSE.matcher(TRUE.matcher(s).replaceAll("True")).replaceAll("False"));
		return out;
	}

	/** {@code [1, 2].asArray()} becomes {@code [1, 2]}; subscripts are left alone. */
	static String dropAsArray(String expr) {
		String out = expr;
		int from = 0;
		int at;
		while ((at = SourceText.indexOutsideLiterals(out, AS_ARRAY, from)) >= 0) {
			if (at > 0 && out.charAt(at - 1) == ']') {
				int open = SourceText.matchingOpen(out, at - 1);
				if (open >= 0 && !isSubscriptable(out, open)) {
					out = out.substring(0, at) + out.substring(at + AS_ARRAY.length());
					from = at;
					continue;
				}
			}
			from = at + AS_ARRAY.length();
		}
		return out;
	}

	/** {@code new Array<of T>(n, v)} becomes {@code (n) * [v]}. */
	static String sizedArrays(String expr) {
		String out = expr;
		int from = 0;
		int at;
		while ((at = SourceText.indexOutsideLiterals(out, NEW_ARRAY, from)) >= 0) {
			int typeClose = SourceText.matchingClose(out, at + NEW_ARRAY.length() - 1);
			int paren = typeClose < 0 ? -1 : SourceText.skipWhitespace(out, typeClose + 1);
			if (paren < 0 || paren >= out.length() || out.charAt(paren) != '(') {
				from = at + NEW_ARRAY.length();
				continue;
			}
			int parenClose = SourceText.matchingClose(out, paren);
			List<String> args = parenClose < 0 ? List.of() : SourceText.splitArguments(out.substring(paren + 1, parenClose));
			if (args.size() != 2 || args.get(0).isEmpty() || args.get(1).isEmpty()) {
				from = at + NEW_ARRAY.length();
				continue;
			}
			String replacement = "(" + sizedArrays(args.get(0)) + ") * [" + sizedArrays(args.get(1)) + "]";
			out = out.substring(0, at) + replacement + out.substring(parenClose + 1);
			from = at + replacement.length();
		}
		return out;
	}

	/** {@code empty Array<of T>} becomes {@code []}. */
	static String emptyArrays(String expr) {
		String out = expr;
		int from = 0;
		int at;
		while ((at = SourceText.indexOutsideLiterals(out, EMPTY_ARRAY, from)) >= 0) {
			int typeClose = SourceText.matchingClose(out, at + EMPTY_ARRAY.length() - 1);
			if (typeClose < 0) {
				from = at + EMPTY_ARRAY.length();
				continue;
			}
			out = out.substring(0, at) + "[]" + out.substring(typeClose + 1);
			from = at + 2;
		}
		return out;
	}

	/**
	 * Turns the range inside a subscript into a slice: {@code a[i..]}, {@code a[..j]},
	 * {@code a[i..j]}. Only brackets that follow an operand are subscripts; list
	 * literals and single dots are untouched.
	 */
	static String slices(String expr) {
		boolean[] mask = SourceText.literalMask(expr);
		StringBuilder out = new StringBuilder(expr.length());
		int i = 0;
		while (i < expr.length()) {
			char c = expr.charAt(i);
			if (!mask[i] && c == '[' && isSubscriptable(expr, i)) {
				int close = SourceText.matchingClose(expr, i);
				if (close > 0) {
					String inner = slices(expr.substring(i + 1, close));
					out.append('[').append(rangeToSlice(inner)).append(']');
					i = close + 1;
					continue;
				}
			}
			out.append(c);
			i++;
		}
		return out.toString();
	}

	private static String rangeToSlice(String inner) {
		boolean[] mask = SourceText.literalMask(inner);
		int depth = 0;
		for (int k = 0; k + 1 < inner.length(); k++) {
			if (mask[k])
				continue;
			char c = inner.charAt(k);
			if (c == '(' || c == '[' || c == '{') {
				depth++;
			} else if (c == ')' || c == ']' || c == '}') {
				depth--;
			} else if (depth == 0 && inner.startsWith("..", k) && !inner.startsWith("...", k)) {
				return inner.substring(0, k).strip() + ":" + inner.substring(k + 2).strip();
			}
		}
		return inner;
	}

	private static boolean isSubscriptable(String expr, int bracket) {
		if (bracket == 0) {
			return false;
		}
		char prev = expr.charAt(bracket - 1);
		return Character.isLetterOrDigit(prev) || prev == '_' || prev == ')' || prev == ']';
	}
}
