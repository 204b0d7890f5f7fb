package elan2py.parse;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsed headers of the counted and iterating loop forms. Expressions are kept as
 * written; rewriting happens later.
 */
public sealed interface LoopHeader permits LoopHeader.Range, LoopHeader.Iteration, LoopHeader.Repeat {
	/** {@code for v from start to end [step s]}, both bounds inclusive. */
	record Range(String variable, String start, String end, Optional<String> step) implements LoopHeader {
	}

	/** {@code for v in coll} and {@code each v in coll}. */
	record Iteration(String variable, String collection) implements LoopHeader {
	}

	/** {@code repeat n times}. */
	record Repeat(String count) implements LoopHeader {
	}

	Pattern RANGE_WITH_STEP = Pattern.compile("^for\\s+(\\w+)\\s+from\\s+(.+?)\\s+to\\s+(.+?)\\s+step\\s+(.+)$");
	Pattern RANGE = Pattern.compile("^for\\s+(\\w+)\\s+from\\s+(.+?)\\s+to\\s+(.+)$");
	Pattern FOR_IN = Pattern.compile("^for\\s+(\\w+)\\s+in\\s+(.+)$");
	Pattern EACH = Pattern.compile("^each\\s+(\\w+)\\s+in\\s+(.+)$");
	Pattern REPEAT = Pattern.compile("^repeat\\s+(.+?)\\s+times\\b.*$");

	static Optional<LoopHeader> parseFor(String line) {
		if (line.contains(" from ") && line.contains(" to ")) {
			Matcher m = RANGE_WITH_STEP.matcher(line);
			if (line.contains(" step ") && m.matches()) {
				return Optional.of(new Range(m.group(1), m.group(2).strip(), m.group(3).strip(),
						Optional.of(m.group(4).strip())));
			}
			m = RANGE.matcher(line);
			if (!line.contains(" step ") && m.matches()) {
				return Optional.of(new Range(m.group(1), m.group(2).strip(), m.group(3).strip(), Optional.empty()));
			}
			return Optional.empty();
		}
		Matcher m = FOR_IN.matcher(line);
		if (m.matches()) {
			return Optional.of(new Iteration(m.group(1), m.group(2).strip()));
		}
		return Optional.empty();
	}

	static Optional<LoopHeader> parseEach(String line) {
		Matcher m = EACH.matcher(line);
		return m.matches() ? Optional.of(new Iteration(m.group(1), m.group(2).strip())) : Optional.empty();
	}

	static Optional<LoopHeader> parseRepeat(String line) {
		Matcher m = REPEAT.matcher(line);
		return m.matches() ? Optional.of(new Repeat(m.group(1).strip())) : Optional.empty();
	}
}
