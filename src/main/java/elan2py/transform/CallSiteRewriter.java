package elan2py.transform;

import elan2py.parse.SignatureTable;
import elan2py.parse.SourceText;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Rewrites the body of a {@code call} statement, in order of precedence:
 * <ol>
 * <li>{@code c.put(i, v)} becomes {@code c[i] = v};</li>
 * <li>drawing primitives become turtle calls;</li>
 * <li>calls to procedures with output parameters become
 * {@code a, b = name(args)}, where {@code a, b} are the arguments passed at the output
 * positions;</li>
 * <li>anything else is kept as a bare call.</li>
 * </ol>
 * The arguments reused as assignment targets are not checked for assignability.
 */
public final class CallSiteRewriter {
	private static final String PUT = ".put(";

	private final SignatureTable signatures;
	private final ExpressionRewriter expressions;

	public CallSiteRewriter(SignatureTable signatures, ExpressionRewriter expressions) {
		this.signatures = signatures;
		this.expressions = expressions;
	}

	/**
	 * @param call the statement text after the {@code call} keyword
	 */
	public String rewrite(String call) {
		Optional<String> put = indexedAssignment(call);
		if (put.isPresent()) {
			return put.get();
		}
		Optional<String> graphics = GraphicsPrimitive.rewrite(call);
		if (graphics.isPresent()) {
			return graphics.get();
		}
		return outParameterAssignment(call).orElse(call);
	}

	Optional<String> indexedAssignment(String call) {
		if (!call.endsWith(")")) {
			return Optional.empty();
		}
		int at = SourceText.indexOutsideLiterals(call, PUT, 0);
		if (at <= 0) {
			return Optional.empty();
		}
		int open = at + PUT.length() - 1;
		if (SourceText.matchingClose(call, open) != call.length() - 1) {
			return Optional.empty();
		}
		List<String> args = SourceText.splitArguments(call.substring(open + 1, call.length() - 1));
		if (args.size() != 2 || args.get(0).isEmpty() || args.get(1).isEmpty()) {
			return Optional.empty();
		}
		String container = call.substring(0, at).strip();
		return Optional.of(container + "[" + expressions.rewrite(args.get(0)) + "] = " + expressions.rewrite(args.get(1)));
	}

	Optional<String> outParameterAssignment(String call) {
		int nameEnd = SourceText.identifierEnd(call, 0);
		if (nameEnd == 0) {
			return Optional.empty();
		}
		String name = call.substring(0, nameEnd);
		Optional<List<Integer>> positions = signatures.outPositions(name);
		int open = SourceText.skipWhitespace(call, nameEnd);
		if (positions.isEmpty() || open >= call.length() || call.charAt(open) != '(') {
			return Optional.empty();
		}
		int close = SourceText.matchingClose(call, open);
		if (close < 0) {
			return Optional.empty();
		}
		List<String> args = SourceText.splitArguments(call.substring(open + 1, close));
		List<String> targets = new ArrayList<>();
		for (int position : positions.get()) {
			if (position < args.size()) {
				targets.add(args.get(position));
			}
		}
		if (targets.isEmpty()) {
			return Optional.empty();
		}
		return Optional.of(String.join(", ", targets) + " = " + call);
	}
}
