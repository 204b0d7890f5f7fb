package elan2py.transform;

import elan2py.parse.SourceText;

/**
 * Guards of {@code if}, {@code else if} and {@code while}: comparison keywords first,
 * then the ordinary expression rewrites.
 */
public final class ConditionRewriter {
	private final ExpressionRewriter expressions;

	public ConditionRewriter(ExpressionRewriter expressions) {
		this.expressions = expressions;
	}

	public String rewrite(String condition) {
		String normalized = SourceText.mapOutsideLiterals(condition, ConditionRewriter::comparisons);
		return expressions.rewrite(normalized);
	}

	static String comparisons(String text) {
		return text.replace(" is not ", " != ")
				.replace(" is ", " == ")
				.replace(" = ", " == ")
				.replace(" <> ", " != ");
	}
}
