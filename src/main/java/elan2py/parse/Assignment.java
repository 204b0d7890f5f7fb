package elan2py.parse;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Target and untranslated value of an assignment or declaration line.
 */
public record Assignment(String target, String value) {
	private static final Pattern DECLARATION = Pattern.compile("^(?:variable|constant)\\s+(\\w+)\\s+set to\\s+(.+)$");
	private static final Pattern SET = Pattern.compile("^set\\s+(.+?)\\s+to\\s+(.+)$");

	/**
	 * Tries the declaration form, then {@code set ... to ...}, then {@code target = value}.
	 */
	public static Optional<Assignment> parse(String line) {
		Matcher m = DECLARATION.matcher(line);
		if (m.matches()) {
			return Optional.of(new Assignment(m.group(1), m.group(2).strip()));
		}
		m = SET.matcher(line);
		if (line.startsWith("set ") && m.matches()) {
			return Optional.of(new Assignment(m.group(1).strip(), m.group(2).strip()));
		}
		int eq = SourceText.indexOutsideLiterals(line, " = ", 0);
		if (eq >= 0 && !SourceText.containsOutsideLiterals(line, "==")
				&& !SourceText.containsOutsideLiterals(line, "!=")) {
			String target = line.substring(0, eq).strip();
			String value = line.substring(eq + 3).strip();
			if (!target.isEmpty() && !value.isEmpty()) {
				return Optional.of(new Assignment(target, value));
			}
		}
		return Optional.empty();
	}
}
