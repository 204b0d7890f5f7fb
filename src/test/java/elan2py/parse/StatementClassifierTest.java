package elan2py.parse;

import elan2py.ast.StatementKind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class StatementClassifierTest {
	private final StatementClassifier classifier = new StatementClassifier();

	@Test
	void classifiesEveryStatementForm() {
		assertEquals(StatementKind.BLANK, classifier.classify(""));
		assertEquals(StatementKind.COMMENT, classifier.classify("# hello"));
		assertEquals(StatementKind.MAIN_OPEN, classifier.classify("main"));
		assertEquals(StatementKind.MAIN_CLOSE, classifier.classify("end main"));
		assertEquals(StatementKind.PROCEDURE_OPEN, classifier.classify("procedure f(out x)"));
		assertEquals(StatementKind.PROCEDURE_OPEN, classifier.classify("function g(x) returns Int"));
		assertEquals(StatementKind.PROCEDURE_CLOSE, classifier.classify("end procedure"));
		assertEquals(StatementKind.PROCEDURE_CLOSE, classifier.classify("end function"));
		assertEquals(StatementKind.IF_OPEN, classifier.classify("if x is 3 then"));
		assertEquals(StatementKind.ELSE, classifier.classify("else"));
		assertEquals(StatementKind.ELSE, classifier.classify("else if x > 2 then"));
		assertEquals(StatementKind.IF_CLOSE, classifier.classify("end if"));
		assertEquals(StatementKind.REPEAT_OPEN, classifier.classify("repeat 4 times"));
		assertEquals(StatementKind.REPEAT_CLOSE, classifier.classify("end repeat"));
		assertEquals(StatementKind.WHILE_OPEN, classifier.classify("while n > 0"));
		assertEquals(StatementKind.WHILE_CLOSE, classifier.classify("end while"));
		assertEquals(StatementKind.FOR_OPEN, classifier.classify("for i from 1 to 10"));
		assertEquals(StatementKind.FOR_CLOSE, classifier.classify("end for"));
		assertEquals(StatementKind.EACH_OPEN, classifier.classify("each w in words"));
		assertEquals(StatementKind.EACH_CLOSE, classifier.classify("end each"));
		assertEquals(StatementKind.ASSIGNMENT, classifier.classify("variable x set to 3"));
		assertEquals(StatementKind.CALL, classifier.classify("call f(a, b)"));
		assertEquals(StatementKind.RETURN, classifier.classify("return x * 2"));
		assertEquals(StatementKind.RETURN, classifier.classify("return"));
		assertEquals(StatementKind.PRINT, classifier.classify("print x"));
		assertEquals(StatementKind.PRINT, classifier.classify("println x"));
		assertEquals(StatementKind.UNRECOGNIZED, classifier.classify("x.sort()"));
	}

	@Test
	void assignmentIsTestedBeforeCall() {
		assertTrue(StatementClassifier.isAssignment("set total to total + 1"));
		assertTrue(StatementClassifier.isAssignment("constant pi set to 3.14"));
		assertTrue(StatementClassifier.isAssignment("x = y + 1"));
		assertFalse(StatementClassifier.isAssignment("call f(x = 1)"));
		assertFalse(StatementClassifier.isAssignment("if a == b"));
		assertFalse(StatementClassifier.isAssignment("while a != b"));
		assertEquals(StatementKind.ASSIGNMENT, classifier.classify("set result to f(x)"));
	}

	@Test
	void equalsInsideStringIsNotAssignment() {
		assertEquals(StatementKind.PRINT, classifier.classify("print \"u = \" & u"));
	}

	@Test
	void lookalikeWordsAreNotKeywords() {
		assertEquals(StatementKind.UNRECOGNIZED, classifier.classify("elsewhere()"));
		assertEquals(StatementKind.UNRECOGNIZED, classifier.classify("returned()"));
		assertEquals(StatementKind.UNRECOGNIZED, classifier.classify("mainLoop()"));
	}

	@Test
	void generatedPythonDoesNotLookLikeElanHeaders() {
		assertEquals(StatementKind.UNRECOGNIZED, classifier.classify("def f(x: int, y: int):"));
		assertEquals(StatementKind.UNRECOGNIZED, classifier.classify("print(x, end='')"));
		assertEquals(StatementKind.UNRECOGNIZED, classifier.classify("t.forward(100)"));
	}
}
