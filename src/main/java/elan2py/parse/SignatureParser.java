package elan2py.parse;

import elan2py.ast.ParameterSpec;
import elan2py.ast.ProcedureSignature;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Recognizes procedure and function headers:
 *
 * <pre>
 * procedure name(a as Int, out b as Array&lt;of Int&gt;)
 * function name(x as Float) returns Float
 * procedure name
 * </pre>
 */
public final class SignatureParser {
	private static final String OUT_MARKER = "out ";
	private static final String TYPE_MARKER = " as ";
	private static final String RETURNS = "returns";

	public static boolean isHeader(String line) {
		return line.startsWith("procedure ") || line.startsWith("function ");
	}

	/**
	 * @return the signature, or empty when the header is malformed
	 */
	public Optional<ProcedureSignature> parse(String line) {
		if (!isHeader(line)) {
			return Optional.empty();
		}
		int i = SourceText.skipWhitespace(line, line.indexOf(' '));
		int nameEnd = SourceText.identifierEnd(line, i);
		if (nameEnd == i) {
			return Optional.empty();
		}
		String name = line.substring(i, nameEnd);
		i = SourceText.skipWhitespace(line, nameEnd);

		List<ParameterSpec> params = new ArrayList<>();
		if (i < line.length() && line.charAt(i) == '(') {
			int close = SourceText.matchingClose(line, i);
			if (close < 0) {
				return Optional.empty();
			}
			for (String raw : SourceText.splitParameters(line.substring(i + 1, close))) {
				if (raw.isEmpty()) {
					return Optional.empty();
				}
				params.add(parseParameter(raw));
			}
			i = SourceText.skipWhitespace(line, close + 1);
		}

		Optional<String> returnType = Optional.empty();
		String rest = line.substring(i);
		if (rest.startsWith(RETURNS)) {
			String type = rest.substring(RETURNS.length()).strip();
			if (!type.isEmpty()) {
				returnType = Optional.of(type);
			}
		} else if (!rest.isEmpty()) {
			return Optional.empty();
		}
		return Optional.of(new ProcedureSignature(name, params, returnType));
	}

	ParameterSpec parseParameter(String raw) {
		var direction = ParameterSpec.Direction.IN;
		String text = raw;
		if (text.startsWith(OUT_MARKER)) {
			direction = ParameterSpec.Direction.OUT;
			text = text.substring(OUT_MARKER.length()).strip();
		}
		int as = text.indexOf(TYPE_MARKER);
		if (as < 0) {
			return new ParameterSpec(text, Optional.empty(), direction);
		}
		String name = text.substring(0, as).strip();
		String type = text.substring(as + TYPE_MARKER.length()).strip();
		return new ParameterSpec(name, type.isEmpty() ? Optional.empty() : Optional.of(type), direction);
	}
}
