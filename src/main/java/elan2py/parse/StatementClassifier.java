package elan2py.parse;

import elan2py.ast.StatementKind;

import java.util.List;
import java.util.function.Predicate;

/**
 * Classifies one stripped source line by its surface syntax.
 *
 * Rules are tried in declaration order and the first match wins. Assignment is tested
 * before call because both can contain {@code =}.
 */
public final class StatementClassifier {
	private record Rule(StatementKind kind, Predicate<String> test) {
	}

	private static final List<Rule> RULES = List.of(
			new Rule(StatementKind.BLANK, String::isEmpty),
			new Rule(StatementKind.COMMENT, line -> line.startsWith("#")),
			new Rule(StatementKind.MAIN_OPEN, line -> line.equals("main")),
			new Rule(StatementKind.MAIN_CLOSE, line -> line.equals("end main")),
			new Rule(StatementKind.PROCEDURE_OPEN, SignatureParser::isHeader),
			new Rule(StatementKind.PROCEDURE_CLOSE,
					line -> line.startsWith("end procedure") || line.startsWith("end function")),
			new Rule(StatementKind.IF_OPEN, line -> line.startsWith("if ")),
			new Rule(StatementKind.ELSE, line -> line.equals("else") || line.startsWith("else if ")),
			new Rule(StatementKind.IF_CLOSE, line -> line.startsWith("end if")),
			new Rule(StatementKind.REPEAT_OPEN, line -> line.startsWith("repeat ") && line.contains(" times")),
			new Rule(StatementKind.REPEAT_CLOSE, line -> line.equals("end repeat")),
			new Rule(StatementKind.WHILE_OPEN, line -> line.startsWith("while ")),
			new Rule(StatementKind.WHILE_CLOSE, line -> line.startsWith("end while")),
			new Rule(StatementKind.FOR_OPEN, line -> line.startsWith("for ")),
			new Rule(StatementKind.FOR_CLOSE, line -> line.startsWith("end for")),
			new Rule(StatementKind.EACH_OPEN, line -> line.startsWith("each ")),
			new Rule(StatementKind.EACH_CLOSE, line -> line.equals("end each")),
			new Rule(StatementKind.ASSIGNMENT, StatementClassifier::isAssignment),
			new Rule(StatementKind.CALL, line -> line.startsWith("call ")),
			new Rule(StatementKind.RETURN, line -> line.equals("return") || line.startsWith("return ")),
			new Rule(StatementKind.PRINT, line -> line.startsWith("print ") || line.startsWith("println ")));

	public StatementKind classify(String line) {
		for (Rule rule : RULES) {
			if (rule.test().test(line)) {
				return rule.kind();
			}
		}
		return StatementKind.UNRECOGNIZED;
	}

	/**
	 * Declaration with {@code set to}, imperative {@code set ... to ...}, or a bare
	 * {@code =} outside string literals that is not part of a comparison and not inside a
	 * call line.
	 */
	static boolean isAssignment(String line) {
		if ((line.startsWith("variable ") || line.startsWith("constant ")) && line.contains(" set to ")) {
			return true;
		}
		if (line.startsWith("set ") && line.contains(" to ")) {
			return true;
		}
		return SourceText.containsOutsideLiterals(line, " = ")
				&& !line.startsWith("call ")
				&& !SourceText.containsOutsideLiterals(line, "==")
				&& !SourceText.containsOutsideLiterals(line, "!=");
	}
}
